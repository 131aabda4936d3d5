package com.shlawgathon.drawcheck.backend.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validators available in this process, keyed by domain. Built once at
 * startup; requests resolve their check-set against it.
 */
public class ValidatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ValidatorRegistry.class);

    public static final String ALL = "all";

    private final Map<ValidationDomain, DrawingValidator> validators;

    public ValidatorRegistry(Collection<? extends DrawingValidator> candidates, Set<ValidationDomain> enabled) {
        Map<ValidationDomain, DrawingValidator> available = new EnumMap<>(ValidationDomain.class);
        for (DrawingValidator validator : candidates) {
            if (!enabled.contains(validator.domain())) {
                log.info("[VALIDATION] {} validator disabled by configuration", validator.domain().key());
                continue;
            }
            DrawingValidator previous = available.putIfAbsent(validator.domain(), validator);
            if (previous != null) {
                throw new IllegalStateException("Two validators registered for " + validator.domain().key());
            }
        }
        this.validators = Collections.unmodifiableMap(available);
        log.info("[VALIDATION] Registry ready: {}", available.keySet());
    }

    public ValidatorRegistry(Collection<? extends DrawingValidator> candidates) {
        this(candidates, EnumSet.allOf(ValidationDomain.class));
    }

    public Optional<DrawingValidator> find(ValidationDomain domain) {
        return Optional.ofNullable(validators.get(domain));
    }

    public Set<ValidationDomain> availableDomains() {
        return validators.isEmpty() ? EnumSet.noneOf(ValidationDomain.class) : EnumSet.copyOf(validators.keySet());
    }

    /**
     * Map requested check keys onto available validators. An empty request or
     * {@code "all"} selects every available validator.
     */
    public Resolution resolve(Collection<String> requested) {
        Set<ValidationDomain> domains = EnumSet.noneOf(ValidationDomain.class);
        Set<String> unknown = new LinkedHashSet<>();
        boolean all = requested == null || requested.isEmpty();
        if (!all) {
            for (String key : requested) {
                if (ALL.equalsIgnoreCase(key.trim())) {
                    all = true;
                    continue;
                }
                ValidationDomain.fromKey(key).ifPresentOrElse(domains::add, () -> unknown.add(key));
            }
        }
        if (all) {
            domains.addAll(validators.keySet());
        }

        List<DrawingValidator> selected = new ArrayList<>();
        List<ValidationDomain> unavailable = new ArrayList<>();
        for (ValidationDomain domain : domains) {
            DrawingValidator validator = validators.get(domain);
            if (validator != null) {
                selected.add(validator);
            } else {
                unavailable.add(domain);
            }
        }
        return new Resolution(List.copyOf(selected), List.copyOf(unavailable), List.copyOf(unknown));
    }

    /**
     * Outcome of resolving a check-set. Validators are in domain order.
     */
    public record Resolution(List<DrawingValidator> validators, List<ValidationDomain> unavailable,
            List<String> unknown) {
    }
}
