package com.shlawgathon.drawcheck.backend.standards;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only reference tables. Fully populated on construction and never
 * mutated afterwards, so concurrent reads need no locking.
 */
public class StandardsStore {

    private static final Logger log = LoggerFactory.getLogger(StandardsStore.class);

    public static final double DEFAULT_WEIGHT_TOLERANCE_PCT = 5.0;

    public static final String MIN_FILLET_GROUP = "aws-d1.1-min-fillet";
    public static final String PREHEAT_GROUP = "aws-d1.1-preheat-group-i";
    public static final String FAN_TIP_GROUP = "api-661-fan-tip-clearance";
    public static final String DENSITY_GROUP = "material-density";

    private final Map<StandardsCategory, List<StandardsRecord>> tables;
    private final Map<StandardsCategory, Map<String, StandardsRecord>> index;
    private final Map<LookupKey, Optional<StandardsRecord>> cache = new ConcurrentHashMap<>();

    public StandardsStore(Map<StandardsCategory, List<StandardsRecord>> tables) {
        Map<StandardsCategory, List<StandardsRecord>> copy = new EnumMap<>(StandardsCategory.class);
        Map<StandardsCategory, Map<String, StandardsRecord>> byKey = new EnumMap<>(StandardsCategory.class);
        for (StandardsCategory category : StandardsCategory.values()) {
            List<StandardsRecord> records = List.copyOf(tables.getOrDefault(category, List.of()));
            copy.put(category, records);
            Map<String, StandardsRecord> keys = new HashMap<>();
            for (StandardsRecord record : records) {
                keys.putIfAbsent(DesignationNormalizer.normalize(category, record.getDesignation()), record);
                for (String alias : record.getAliases()) {
                    keys.putIfAbsent(DesignationNormalizer.normalize(category, alias), record);
                }
            }
            byKey.put(category, Collections.unmodifiableMap(keys));
        }
        this.tables = Collections.unmodifiableMap(copy);
        this.index = Collections.unmodifiableMap(byKey);
        log.info("[STANDARDS] Store ready with {} records", copy.values().stream().mapToInt(List::size).sum());
    }

    /**
     * Find a record by designation. A miss is an ordinary result.
     */
    public Optional<StandardsRecord> lookup(StandardsCategory category, String designation) {
        if (category == null || designation == null) {
            return Optional.empty();
        }
        return cache.computeIfAbsent(new LookupKey(category, designation),
                key -> Optional.ofNullable(index.get(category)
                        .get(DesignationNormalizer.normalize(category, designation))));
    }

    public List<StandardsRecord> records(StandardsCategory category) {
        return tables.get(category);
    }

    /**
     * Rows of one table in file order.
     */
    public List<StandardsRecord> records(StandardsCategory category, String group) {
        return tables.get(category).stream()
                .filter(r -> group.equals(r.getGroup()))
                .toList();
    }

    public int size() {
        return tables.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Compare an actual member weight against the tabulated weight per foot.
     */
    public Optional<WeightVerification> verifyWeight(String designation, double lengthFt, double actualLb) {
        return verifyWeight(designation, lengthFt, actualLb, DEFAULT_WEIGHT_TOLERANCE_PCT);
    }

    public Optional<WeightVerification> verifyWeight(String designation, double lengthFt, double actualLb,
            double tolerancePct) {
        return lookup(StandardsCategory.BEAM, designation)
                .flatMap(r -> r.property("weightPerFt").map(perFt -> {
                    double expected = perFt * lengthFt;
                    double tolerance = expected * tolerancePct / 100.0;
                    double difference = actualLb - expected;
                    return new WeightVerification(r.getDesignation(), lengthFt, expected, tolerance, actualLb,
                            difference, Math.abs(difference) <= tolerance);
                }));
    }

    /**
     * Minimum fillet leg for a base metal thickness. Ranges exclude the lower
     * bound and include the upper bound; the last row has no upper bound.
     */
    public Optional<StandardsRecord> minimumFilletRow(double thickness) {
        return bracket(StandardsCategory.CODE_LIMIT, MIN_FILLET_GROUP, "thicknessOver", "thicknessThrough", thickness);
    }

    public Optional<Double> minimumFilletWeldSize(double thickness) {
        return minimumFilletRow(thickness).flatMap(r -> r.property("minSize"));
    }

    /**
     * Largest fillet that does not need to be detailed as built out to full
     * throat: the full thickness under 1/4", else thickness less 1/16".
     */
    public Optional<Double> maximumFilletWeldSize(double thickness) {
        if (thickness <= 0) {
            return Optional.empty();
        }
        return Optional.of(thickness < 0.25 ? thickness : thickness - 0.0625);
    }

    public Optional<StandardsRecord> preheatRow(double thickness) {
        return bracket(StandardsCategory.CODE_LIMIT, PREHEAT_GROUP, "thicknessOver", "thicknessThrough", thickness);
    }

    public Optional<StandardsRecord> fanTipClearanceRow(double fanDiameterFt) {
        return bracket(StandardsCategory.CODE_LIMIT, FAN_TIP_GROUP, "diameterOverFt", "diameterThroughFt",
                fanDiameterFt);
    }

    public Optional<Double> minimumEdgeDistance(String boltSize, boolean rolledEdge) {
        return lookup(StandardsCategory.BOLT, boltSize)
                .flatMap(r -> r.property(rolledEdge ? "minEdgeRolled" : "minEdgeSheared"));
    }

    public Optional<Double> density(String materialFamily) {
        return lookup(StandardsCategory.CODE_LIMIT, materialFamily)
                .filter(r -> DENSITY_GROUP.equals(r.getGroup()))
                .flatMap(r -> r.property("lbPerCubicIn"));
    }

    public Optional<Double> codeLimit(String designation, String property) {
        return lookup(StandardsCategory.CODE_LIMIT, designation).flatMap(r -> r.property(property));
    }

    private Optional<StandardsRecord> bracket(StandardsCategory category, String group, String over,
            String through, double value) {
        for (StandardsRecord row : records(category, group)) {
            double lower = row.property(over).orElse(0.0);
            Optional<Double> upper = row.property(through);
            if (value > lower && (upper.isEmpty() || value <= upper.get())) {
                return Optional.of(row);
            }
        }
        return Optional.empty();
    }

    private record LookupKey(StandardsCategory category, String designation) {
    }
}
