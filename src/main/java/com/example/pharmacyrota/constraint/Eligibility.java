package com.example.pharmacyrota.constraint;

public record Eligibility(boolean eligible, IneligibilityReason reason, String detail) {

    private static final Eligibility ELIGIBLE = new Eligibility(true, null, null);

    public static Eligibility ok() {
        return ELIGIBLE;
    }

    public static Eligibility rejected(IneligibilityReason reason, String detail) {
        return new Eligibility(false, reason, detail);
    }
}
