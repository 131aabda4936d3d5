package com.shlawgathon.drawcheck.backend.model.drawing;

import com.shlawgathon.drawcheck.backend.model.IssueLocation;

/**
 * Numeric dimension token. Tolerance is the symmetric plus/minus value, if
 * stated.
 */
public record Dimension(double value, DimensionUnit unit, Double tolerance, String raw, IssueLocation location) {

    public double inches() {
        return unit == DimensionUnit.MM ? value / 25.4 : value;
    }
}
