package com.example.baldnessdetector.model;

public enum BaldnessRegion {
    CROWN,
    FRONTAL,
    TEMPORAL,
    VERTEX,
    OVERALL
}
