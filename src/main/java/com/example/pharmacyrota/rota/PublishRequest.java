package com.example.pharmacyrota.rota;

import jakarta.validation.constraints.NotBlank;

public record PublishRequest(@NotBlank(message = "publishedBy is required") String publishedBy) {
}
