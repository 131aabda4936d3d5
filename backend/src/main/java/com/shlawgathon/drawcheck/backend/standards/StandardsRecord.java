package com.shlawgathon.drawcheck.backend.standards;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One row of a reference table. Numeric values live in {@code properties},
 * textual ones in {@code attributes}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StandardsRecord {
    StandardsCategory category;
    String designation;
    String group;
    @Singular
    List<String> aliases;
    @Singular
    Map<String, Double> properties;
    @Singular
    Map<String, String> attributes;
    String citation;

    public Optional<Double> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public double require(String name) {
        Double value = properties.get(name);
        if (value == null) {
            throw new IllegalStateException("Standards record " + designation + " has no property " + name);
        }
        return value;
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }
}
