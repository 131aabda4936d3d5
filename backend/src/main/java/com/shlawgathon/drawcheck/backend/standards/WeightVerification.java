package com.shlawgathon.drawcheck.backend.standards;

/**
 * Expected versus actual mass of a member. Weights in pounds.
 */
public record WeightVerification(
        String designation,
        double lengthFt,
        double expected,
        double tolerance,
        double actual,
        double difference,
        boolean withinTolerance) {
}
