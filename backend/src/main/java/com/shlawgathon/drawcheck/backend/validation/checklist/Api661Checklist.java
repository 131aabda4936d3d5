package com.shlawgathon.drawcheck.backend.validation.checklist;

import com.shlawgathon.drawcheck.backend.model.drawing.MaterialSpec;
import com.shlawgathon.drawcheck.backend.standards.StandardsCategory;
import com.shlawgathon.drawcheck.backend.standards.StandardsRecord;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

import static com.shlawgathon.drawcheck.backend.validation.checklist.ChecklistPhase.DESIGN_BASIS;
import static com.shlawgathon.drawcheck.backend.validation.checklist.ChecklistPhase.ELECTRICAL_CONTROLS;
import static com.shlawgathon.drawcheck.backend.validation.checklist.ChecklistPhase.INSTALLATION_TESTING;
import static com.shlawgathon.drawcheck.backend.validation.checklist.ChecklistPhase.LOADS_ANALYSIS;
import static com.shlawgathon.drawcheck.backend.validation.checklist.ChecklistPhase.MATERIALS_FABRICATION;
import static com.shlawgathon.drawcheck.backend.validation.checklist.ChecklistPhase.MECHANICAL_DESIGN;
import static com.shlawgathon.drawcheck.backend.validation.checklist.ChecklistPhase.OPERATIONS_MAINTENANCE;
import static com.shlawgathon.drawcheck.backend.validation.checklist.ChecklistPhase.PIPING_INSTRUMENTATION;

/**
 * Review checklist for air-cooled heat exchangers (API 661), in phase order.
 */
public final class Api661Checklist {

    public static final String HEAT_DUTY = "heatDuty";
    public static final String DESIGN_PRESSURE = "designPressure";
    public static final String DESIGN_TEMPERATURE = "designTemperature";
    public static final String MAWP = "mawp";
    public static final String MDMT = "mdmt";
    public static final String LMTD = "lmtd";
    public static final String MTD_CORRECTION = "mtdCorrection";
    public static final String TUBE_MATERIAL = "tubeMaterial";
    public static final String FIN_TYPE = "finType";
    public static final String TUBE_WALL_BWG = "tubeWallBwg";
    public static final String FAN_DIAMETER_FT = "fanDiameterFt";
    public static final String FAN_TIP_CLEARANCE = "fanTipClearance";
    public static final String NUM_FANS = "numFans";
    public static final String BUNDLE_FACE_AREA = "bundleFaceArea";
    public static final String CORROSION_ALLOWANCE = "corrosionAllowance";
    public static final String FLANGE_CLASS = "flangeClass";
    public static final String PROCESS_PIPING = "processPiping";
    public static final String MOTOR_HP = "motorHp";
    public static final String FAN_POWER_HP = "fanPowerHp";
    public static final String VIBRATION_SWITCH = "vibrationSwitch";
    public static final String HYDRO_TEST_PRESSURE = "hydroTestPressure";
    public static final String HANDRAIL_HEIGHT = "handrailHeight";
    public static final String LADDER_RUNG_SPACING = "ladderRungSpacing";
    public static final String TOE_BOARD_HEIGHT = "toeBoardHeight";
    public static final String STAIR_RISER_HEIGHT = "stairRiserHeight";
    public static final String WIND_SPEED = "windSpeed";
    public static final String SEISMIC_DESIGN_CATEGORY = "seismicDesignCategory";
    public static final String NOZZLE_LOADS_VERIFIED = "nozzleLoadsVerified";

    private static final Set<Integer> FLANGE_CLASSES = Set.of(150, 300, 600, 900, 1500, 2500);
    private static final Pattern WPS = Pattern.compile("\\bWPS\\b|WELD(?:ING)?\\s+PROCEDURE", Pattern.CASE_INSENSITIVE);
    private static final double MOTOR_MARGIN = 1.1;
    private static final double MIN_FAN_COVERAGE_PCT = 40.0;

    private static final List<ChecklistItem> ITEMS = build();

    private Api661Checklist() {
    }

    public static List<ChecklistItem> items() {
        return ITEMS;
    }

    private static List<ChecklistItem> build() {
        List<ChecklistItem> items = new ArrayList<>();

        // Design basis
        items.add(new ChecklistItem("DB-01", DESIGN_BASIS, "Heat duty specified", "API 661 Section 4.1",
                required(HEAT_DUTY, "heat duty", duty -> duty > 0
                        ? ItemResult.pass("Heat duty " + fmt(duty) + " MMBtu/hr")
                        : ItemResult.fail("Heat duty must be positive"))));
        items.add(new ChecklistItem("DB-02", DESIGN_BASIS, "Design pressure specified", "API 661 Section 4.1",
                required(DESIGN_PRESSURE, "design pressure", p -> p > 0
                        ? ItemResult.pass("Design pressure " + fmt(p) + " psig")
                        : ItemResult.fail("Design pressure must be positive"))));
        items.add(new ChecklistItem("DB-03", DESIGN_BASIS, "Design temperature specified", "API 661 Section 4.1",
                required(DESIGN_TEMPERATURE, "design temperature",
                        t -> ItemResult.pass("Design temperature " + fmt(t) + " F"))));
        items.add(new ChecklistItem("DB-04", DESIGN_BASIS, "LMTD calculated", "API 661 Section 4.2",
                optional(LMTD, lmtd -> lmtd > 0
                        ? ItemResult.pass("LMTD " + fmt(lmtd) + " F")
                        : ItemResult.fail("LMTD must be positive"))));
        items.add(new ChecklistItem("DB-05", DESIGN_BASIS, "MTD correction factor in range", "API 661 Section 4.2",
                ctx -> ctx.number(MTD_CORRECTION).map(f -> {
                    double min = ctx.standards().codeLimit("MTD-CORRECTION", "min").orElse(0.8);
                    double max = ctx.standards().codeLimit("MTD-CORRECTION", "max").orElse(1.0);
                    return f >= min && f <= max
                            ? ItemResult.pass("MTD correction " + fmt(f))
                            : ItemResult.fail("MTD correction " + fmt(f) + " outside " + fmt(min) + " to " + fmt(max));
                }).orElseGet(() -> ItemResult.notApplicable("MTD correction factor not provided"))));
        items.add(new ChecklistItem("DB-06", DESIGN_BASIS, "Tube material specified", "API 661 Table 1",
                ctx -> ctx.text(TUBE_MATERIAL).or(() -> ctx.data().getMaterials().stream()
                                .map(MaterialSpec::getDesignation).findFirst())
                        .map(m -> ItemResult.pass("Tube material " + m))
                        .orElseGet(() -> ItemResult.missingRequired("tube material"))));
        items.add(new ChecklistItem("DB-07", DESIGN_BASIS, "ASME VIII applicability", "ASME Section VIII Div. 1 U-1",
                ctx -> ctx.number(DESIGN_PRESSURE).map(p -> {
                    double threshold = ctx.standards().codeLimit("ASME-VIII-APPLICABILITY", "minPressurePsig")
                            .orElse(15.0);
                    if (p < threshold) {
                        return ItemResult.pass("Design pressure below " + fmt(threshold) + " psig; ASME VIII not required");
                    }
                    return ctx.referencesCode("ASME VIII")
                            ? ItemResult.pass("ASME VIII Div. 1 referenced")
                            : ItemResult.fail("Design pressure " + fmt(p) + " psig requires ASME VIII Div. 1 but the "
                                    + "code is not referenced");
                }).orElseGet(() -> ItemResult.missingRequired("design pressure"))));
        items.add(new ChecklistItem("DB-08", DESIGN_BASIS, "Design temperature within range", "API 661 Section 4.1",
                ctx -> ctx.number(DESIGN_TEMPERATURE).map(t -> {
                    double min = ctx.standards().codeLimit("DESIGN-TEMPERATURE-RANGE", "minF").orElse(-20.0);
                    double max = ctx.standards().codeLimit("DESIGN-TEMPERATURE-RANGE", "maxF").orElse(1000.0);
                    return t >= min && t <= max
                            ? ItemResult.pass("Design temperature " + fmt(t) + " F within " + fmt(min) + " to " + fmt(max))
                            : ItemResult.fail("Design temperature " + fmt(t) + " F outside " + fmt(min) + " to " + fmt(max));
                }).orElseGet(() -> ItemResult.missingRequired("design temperature"))));
        items.add(new ChecklistItem("DB-09", DESIGN_BASIS, "Fin type suitable for temperature", "API 661 Table 1",
                ctx -> {
                    Optional<String> fin = ctx.text(FIN_TYPE);
                    Optional<Double> temperature = ctx.number(DESIGN_TEMPERATURE);
                    if (fin.isEmpty() || temperature.isEmpty()) {
                        return ItemResult.notApplicable("Fin type or design temperature not provided");
                    }
                    double limit = ctx.standards().codeLimit("ALUMINUM-FIN-TEMPERATURE", "maxF").orElse(400.0);
                    boolean aluminum = fin.get().toUpperCase(Locale.ROOT).contains("ALUMINUM");
                    return aluminum && temperature.get() > limit
                            ? ItemResult.fail("Aluminum fins are limited to " + fmt(limit) + " F; design temperature is "
                                    + fmt(temperature.get()) + " F")
                            : ItemResult.pass(fin.get() + " fins at " + fmt(temperature.get()) + " F");
                }));
        items.add(new ChecklistItem("DB-10", DESIGN_BASIS, "MDMT below design temperature", "API 661 Section 4.1",
                ctx -> {
                    Optional<Double> mdmt = ctx.number(MDMT);
                    Optional<Double> temperature = ctx.number(DESIGN_TEMPERATURE);
                    if (mdmt.isEmpty() || temperature.isEmpty()) {
                        return ItemResult.notApplicable("MDMT not stated");
                    }
                    return mdmt.get() < temperature.get()
                            ? ItemResult.pass("MDMT " + fmt(mdmt.get()) + " F")
                            : ItemResult.fail("MDMT " + fmt(mdmt.get()) + " F is not below design temperature "
                                    + fmt(temperature.get()) + " F");
                }));

        // Mechanical design
        items.add(new ChecklistItem("MD-01", MECHANICAL_DESIGN, "Tube wall thickness adequate", "API 661 Table 1",
                ctx -> ctx.number(TUBE_WALL_BWG).map(bwg -> {
                    double maxBwg = ctx.standards().codeLimit("TUBE-WALL-BWG", "maxBwg").orElse(14.0);
                    return bwg <= maxBwg
                            ? ItemResult.pass(fmt(bwg) + " BWG tube wall")
                            : ItemResult.fail(fmt(bwg) + " BWG is thinner than the " + fmt(maxBwg) + " BWG minimum");
                }).orElseGet(() -> ItemResult.notApplicable("Tube gauge not provided"))));
        items.add(new ChecklistItem("MD-02", MECHANICAL_DESIGN, "Fan tip clearance within limit", "API 661 Table 6",
                Api661Checklist::fanTipClearance));
        items.add(new ChecklistItem("MD-03", MECHANICAL_DESIGN, "Fan coverage at least 40 percent of bundle face",
                "API 661 Section 6.1", Api661Checklist::fanCoverage));
        items.add(new ChecklistItem("MD-04", MECHANICAL_DESIGN, "MAWP not less than design pressure",
                "ASME Section VIII Div. 1 UG-98", ctx -> {
                    Optional<Double> mawp = ctx.number(MAWP);
                    Optional<Double> design = ctx.number(DESIGN_PRESSURE);
                    if (mawp.isEmpty() || design.isEmpty()) {
                        return ItemResult.notApplicable("MAWP not stated");
                    }
                    return mawp.get() >= design.get()
                            ? ItemResult.pass("MAWP " + fmt(mawp.get()) + " psig")
                            : ItemResult.fail("MAWP " + fmt(mawp.get()) + " psig is below design pressure "
                                    + fmt(design.get()) + " psig");
                }));
        items.add(new ChecklistItem("MD-05", MECHANICAL_DESIGN, "Corrosion allowance stated", "API 661 Section 7.1",
                optional(CORROSION_ALLOWANCE, ca -> ca >= 0
                        ? ItemResult.pass("Corrosion allowance " + fmt(ca) + " in")
                        : ItemResult.fail("Corrosion allowance cannot be negative"))));

        // Piping and instrumentation
        items.add(new ChecklistItem("PI-01", PIPING_INSTRUMENTATION, "Nozzle flange class is standard",
                "ASME B16.5", ctx -> ctx.number(FLANGE_CLASS).map(c -> FLANGE_CLASSES.contains((int) Math.round(c))
                        ? ItemResult.pass("Class " + fmt(c) + " flanges")
                        : ItemResult.fail("Class " + fmt(c) + " is not a B16.5 pressure class"))
                        .orElseGet(() -> ItemResult.notApplicable("Flange class not provided"))));
        items.add(new ChecklistItem("PI-02", PIPING_INSTRUMENTATION, "Process piping code referenced",
                "ASME B31.3", ctx -> {
                    if (!ctx.flag(PROCESS_PIPING).orElse(false)) {
                        return ItemResult.notApplicable("No process piping in scope");
                    }
                    return ctx.referencesCode("B31.3")
                            ? ItemResult.pass("ASME B31.3 referenced")
                            : ItemResult.fail("Process piping in scope but ASME B31.3 is not referenced");
                }));

        // Electrical and controls
        items.add(new ChecklistItem("EC-01", ELECTRICAL_CONTROLS, "Motor rating covers fan power",
                "API 661 Section 6.2", ctx -> {
                    Optional<Double> motor = ctx.number(MOTOR_HP);
                    Optional<Double> fan = ctx.number(FAN_POWER_HP);
                    if (motor.isEmpty() || fan.isEmpty()) {
                        return ItemResult.notApplicable("Motor or fan power not provided");
                    }
                    double needed = fan.get() * MOTOR_MARGIN;
                    return motor.get() >= needed
                            ? ItemResult.pass(fmt(motor.get()) + " hp motor for " + fmt(fan.get()) + " hp fan")
                            : ItemResult.fail(fmt(motor.get()) + " hp motor is below " + fmt(round(needed))
                                    + " hp (fan power plus 10 percent)");
                }));
        items.add(new ChecklistItem("EC-02", ELECTRICAL_CONTROLS, "Fan vibration switch provided",
                "API 661 Section 6.2", ctx -> ctx.flag(VIBRATION_SWITCH)
                        .map(v -> v ? ItemResult.pass("Vibration switch specified")
                                : ItemResult.warn("No vibration switch on fan drive"))
                        .orElseGet(() -> ItemResult.notApplicable("Vibration switch not specified"))));

        // Materials and fabrication
        items.add(new ChecklistItem("MF-01", MATERIALS_FABRICATION, "Material specifications recognized",
                "API 661 Table 1", ctx -> {
                    if (ctx.data().getMaterials().isEmpty()) {
                        return ItemResult.notApplicable("No material callouts on the drawing");
                    }
                    List<String> unknown = ctx.data().getMaterials().stream()
                            .map(MaterialSpec::getDesignation)
                            .filter(d -> ctx.standards().lookup(StandardsCategory.MATERIAL, d).isEmpty())
                            .distinct()
                            .toList();
                    return unknown.isEmpty()
                            ? ItemResult.pass("All material specifications recognized")
                            : ItemResult.warn("Unrecognized material specifications " + unknown);
                }));
        items.add(new ChecklistItem("MF-02", MATERIALS_FABRICATION, "PWHT requirement stated",
                "ASME Section VIII Div. 1 UCS-56", ctx -> {
                    Boolean pwht = ctx.data().getDesignData().getPwhtRequired();
                    if (pwht == null) {
                        return ctx.referencesCode("ASME VIII")
                                ? ItemResult.warn("PWHT requirement not stated for ASME VIII equipment")
                                : ItemResult.notApplicable("PWHT not stated");
                    }
                    return ItemResult.pass(pwht ? "PWHT required" : "No PWHT");
                }));
        items.add(new ChecklistItem("MF-03", MATERIALS_FABRICATION, "Radiography extent stated",
                "ASME Section VIII Div. 1 UW-11", ctx -> {
                    String rt = ctx.data().getDesignData().getRadiography();
                    if (rt != null) {
                        return ItemResult.pass(rt + " radiography");
                    }
                    return ctx.referencesCode("ASME VIII")
                            ? ItemResult.warn("Radiography extent not stated for ASME VIII equipment")
                            : ItemResult.notApplicable("Radiography not stated");
                }));
        items.add(new ChecklistItem("MF-04", MATERIALS_FABRICATION, "Welding procedure referenced",
                "AWS D1.1 Clause 5", ctx -> {
                    if (ctx.data().getWelds().isEmpty()) {
                        return ItemResult.notApplicable("No welds called out");
                    }
                    return WPS.matcher(ctx.data().fullText()).find()
                            ? ItemResult.pass("WPS referenced")
                            : ItemResult.fail("Welds called out without a WPS reference");
                }));

        // Installation and testing
        items.add(new ChecklistItem("IT-01", INSTALLATION_TESTING, "Hydrostatic test pressure",
                "ASME Section VIII Div. 1 UG-99", Api661Checklist::hydroTest));

        // Operations and maintenance
        items.add(new ChecklistItem("OM-01", OPERATIONS_MAINTENANCE, "Handrail height", "OSHA 1910.29",
                ctx -> range(ctx, HANDRAIL_HEIGHT, "HANDRAIL-HEIGHT", "Handrail height")));
        items.add(new ChecklistItem("OM-02", OPERATIONS_MAINTENANCE, "Ladder rung spacing", "OSHA 1910.23",
                ctx -> range(ctx, LADDER_RUNG_SPACING, "LADDER-RUNG-SPACING", "Ladder rung spacing")));
        items.add(new ChecklistItem("OM-03", OPERATIONS_MAINTENANCE, "Toe board height", "OSHA 1910.29",
                ctx -> range(ctx, TOE_BOARD_HEIGHT, "TOE-BOARD-HEIGHT", "Toe board height")));
        items.add(new ChecklistItem("OM-04", OPERATIONS_MAINTENANCE, "Stair riser height", "OSHA 1910.25",
                ctx -> range(ctx, STAIR_RISER_HEIGHT, "STAIR-RISER-HEIGHT", "Stair riser height")));

        // Loads and analysis
        items.add(new ChecklistItem("LA-01", LOADS_ANALYSIS, "Wind load basis stated", "ASCE 7 Chapter 26",
                optional(WIND_SPEED, v -> v > 0
                        ? ItemResult.pass("Basic wind speed " + fmt(v) + " mph")
                        : ItemResult.fail("Wind speed must be positive"))));
        items.add(new ChecklistItem("LA-02", LOADS_ANALYSIS, "Seismic design category stated", "ASCE 7 Chapter 11",
                ctx -> ctx.text(SEISMIC_DESIGN_CATEGORY).map(c -> c.toUpperCase(Locale.ROOT).matches("[A-F]")
                                ? ItemResult.pass("Seismic design category " + c.toUpperCase(Locale.ROOT))
                                : ItemResult.fail("Seismic design category " + c + " is not A through F"))
                        .orElseGet(() -> ItemResult.notApplicable("Seismic design category not provided"))));
        items.add(new ChecklistItem("LA-03", LOADS_ANALYSIS, "Nozzle loads verified", "API 661 Table 4",
                ctx -> ctx.flag(NOZZLE_LOADS_VERIFIED)
                        .map(v -> v ? ItemResult.pass("Nozzle loads verified against API 661 allowables")
                                : ItemResult.fail("Nozzle loads not verified"))
                        .orElseGet(() -> ItemResult.notApplicable("Nozzle load verification not provided"))));

        return List.copyOf(items);
    }

    private static ItemResult fanTipClearance(ChecklistContext ctx) {
        Optional<Double> diameter = ctx.number(FAN_DIAMETER_FT);
        Optional<Double> clearance = ctx.number(FAN_TIP_CLEARANCE);
        if (diameter.isEmpty() || clearance.isEmpty()) {
            return ItemResult.notApplicable("Fan diameter or tip clearance not provided");
        }
        Optional<Double> max = ctx.standards().fanTipClearanceRow(diameter.get())
                .flatMap(row -> row.property("maxTipClearanceIn"));
        if (max.isEmpty()) {
            return ItemResult.notApplicable("No tip clearance limit for " + fmt(diameter.get()) + " ft fan");
        }
        return clearance.get() <= max.get()
                ? ItemResult.pass("Tip clearance " + fmt(clearance.get()) + " in within " + fmt(max.get()) + " in")
                : ItemResult.fail("Tip clearance " + fmt(clearance.get()) + " in exceeds " + fmt(max.get())
                        + " in for " + fmt(diameter.get()) + " ft fan");
    }

    private static ItemResult fanCoverage(ChecklistContext ctx) {
        Optional<Double> fans = ctx.number(NUM_FANS);
        Optional<Double> diameter = ctx.number(FAN_DIAMETER_FT);
        Optional<Double> face = ctx.number(BUNDLE_FACE_AREA);
        if (fans.isEmpty() || diameter.isEmpty() || face.isEmpty() || face.get() <= 0) {
            return ItemResult.notApplicable("Fan count, fan diameter or bundle face area not provided");
        }
        double radius = diameter.get() / 2.0;
        double coverage = fans.get() * Math.PI * radius * radius / face.get() * 100.0;
        return coverage >= MIN_FAN_COVERAGE_PCT
                ? ItemResult.pass("Fan coverage " + fmt(round(coverage)) + " percent")
                : ItemResult.fail("Fan coverage " + fmt(round(coverage)) + " percent is below 40 percent");
    }

    private static ItemResult hydroTest(ChecklistContext ctx) {
        Optional<Double> hydro = ctx.number(HYDRO_TEST_PRESSURE);
        Optional<Double> basis = ctx.number(MAWP).or(() -> ctx.number(DESIGN_PRESSURE));
        if (hydro.isEmpty()) {
            return ItemResult.notApplicable("Hydrostatic test pressure not stated");
        }
        if (basis.isEmpty() || basis.get() <= 0) {
            return ItemResult.missingRequired("MAWP or design pressure for the hydrostatic test ratio");
        }
        StandardsStore standards = ctx.standards();
        double min = standards.codeLimit("HYDRO-TEST-RATIO", "minRatio").orElse(1.3);
        double max = standards.codeLimit("HYDRO-TEST-RATIO", "maxRatio").orElse(1.65);
        double ratio = hydro.get() / basis.get();
        String stated = "Hydrostatic test " + fmt(hydro.get()) + " psig is " + fmt(round(ratio)) + " x "
                + fmt(basis.get()) + " psig";
        if (ratio < min) {
            return ItemResult.fail(stated + "; minimum is " + fmt(min) + " x");
        }
        if (ratio > max) {
            return ItemResult.warn(stated + "; above " + fmt(max) + " x may overstress components");
        }
        return ItemResult.pass(stated);
    }

    private static ItemResult range(ChecklistContext ctx, String key, String limitName, String label) {
        Optional<Double> value = ctx.number(key);
        if (value.isEmpty()) {
            return ItemResult.notApplicable(label + " not provided");
        }
        Optional<StandardsRecord> limit = ctx.standards().lookup(StandardsCategory.CODE_LIMIT, limitName);
        Optional<Double> min = limit.flatMap(l -> l.property("minIn"));
        Optional<Double> max = limit.flatMap(l -> l.property("maxIn"));
        double v = value.get();
        if (min.isPresent() && v < min.get()) {
            return ItemResult.fail(label + " " + fmt(v) + " in is below " + fmt(min.get()) + " in");
        }
        if (max.isPresent() && v > max.get()) {
            return ItemResult.fail(label + " " + fmt(v) + " in exceeds " + fmt(max.get()) + " in");
        }
        return ItemResult.pass(label + " " + fmt(v) + " in");
    }

    private static Function<ChecklistContext, ItemResult> required(String key, String label,
            Function<Double, ItemResult> rule) {
        return ctx -> ctx.number(key).map(rule).orElseGet(() -> ItemResult.missingRequired(label));
    }

    private static Function<ChecklistContext, ItemResult> optional(String key, Function<Double, ItemResult> rule) {
        return ctx -> ctx.number(key).map(rule)
                .orElseGet(() -> ItemResult.notApplicable(key + " not provided"));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    static String fmt(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
