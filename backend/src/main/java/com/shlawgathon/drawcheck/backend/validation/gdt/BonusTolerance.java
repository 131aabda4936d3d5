package com.shlawgathon.drawcheck.backend.validation.gdt;

/**
 * Bonus tolerance and virtual condition for a position tolerance applied at
 * MMC or LMC.
 */
public record BonusTolerance(double bonus, double totalTolerance, double virtualCondition) {

    /**
     * @param limitSize MMC size for {@link MaterialCondition#MMC}, LMC size for {@link MaterialCondition#LMC}
     */
    public static BonusTolerance compute(boolean hole, MaterialCondition modifier, double tolerance,
            double limitSize, double actualSize) {
        boolean atMmc = modifier != MaterialCondition.LMC;
        double departure = hole == atMmc ? actualSize - limitSize : limitSize - actualSize;
        double bonus = Math.max(0.0, departure);
        double virtualCondition = hole == atMmc ? limitSize - tolerance : limitSize + tolerance;
        return new BonusTolerance(bonus, tolerance + bonus, virtualCondition);
    }
}
