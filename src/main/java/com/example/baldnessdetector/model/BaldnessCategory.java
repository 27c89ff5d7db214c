package com.example.baldnessdetector.model;

public enum BaldnessCategory {
    NONE,
    SLIGHT,
    MODERATE,
    SIGNIFICANT,
    SEVERE,
    COMPLETE;

    public static BaldnessCategory fromLevel(double level) {
        if (level < 0.1) {
            return NONE;
        } else if (level < 0.3) {
            return SLIGHT;
        } else if (level < 0.5) {
            return MODERATE;
        } else if (level < 0.7) {
            return SIGNIFICANT;
        } else if (level < 0.9) {
            return SEVERE;
        }
        return COMPLETE;
    }
}
