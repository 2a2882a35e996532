package com.example.pharmacyrota.common.error;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Keeps the most recent engine errors in memory so that operators can see why a
 * per-date operation failed without trawling the logs.
 */
@Component
public class ErrorLogBuffer {
    private static final int MAX_ENTRIES = 200;

    private final Deque<Entry> deque = new ConcurrentLinkedDeque<>();

    public void addError(String message, Throwable t) {
        String m = message == null ? "" : message;
        String detail = t == null ? "" : (t.getClass().getName() + ": " + t.getMessage());
        record(m, detail);
    }

    public void addFailure(String message, String detail) {
        record(message == null ? "" : message, detail == null ? "" : detail);
    }

    private void record(String message, String detail) {
        deque.addFirst(new Entry(LocalDateTime.now(), message, detail));
        while (deque.size() > MAX_ENTRIES) deque.removeLast();
    }

    public List<Entry> recent() {
        return new ArrayList<>(deque);
    }

    public void clear() {
        deque.clear();
    }

    public record Entry(LocalDateTime time, String message, String detail) {}
}
