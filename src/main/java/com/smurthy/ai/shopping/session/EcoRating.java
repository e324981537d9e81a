package com.smurthy.ai.shopping.session;

/**
 * Qualitative band for a footprint total in kg CO2e.
 */
public enum EcoRating {
    VERY_LOW("Very Low"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    VERY_HIGH("Very High");

    private final String label;

    EcoRating(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EcoRating of(double totalKg) {
        if (totalKg < 50) return VERY_LOW;
        if (totalKg < 100) return LOW;
        if (totalKg < 200) return MEDIUM;
        if (totalKg < 400) return HIGH;
        return VERY_HIGH;
    }
}
