package com.shlawgathon.drawcheck.backend.validation.welding;

/**
 * Geometry of equal-leg fillet welds.
 */
public final class FilletWeldGeometry {

    public static final double THROAT_FACTOR = 0.707;

    private FilletWeldGeometry() {
    }

    public static double effectiveThroat(double legSize) {
        return THROAT_FACTOR * legSize;
    }
}
