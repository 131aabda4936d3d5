package com.shlawgathon.drawcheck.backend.orchestration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One validation job: the raw document, the requested check-set and
 * per-domain parameters keyed by domain key.
 */
@Value
@Builder
public class ValidationRequest {
    String requestId;
    String documentName;
    byte[] document;
    @Singular
    List<String> checks;
    @Singular("domainParams")
    Map<String, Map<String, Object>> params;
    boolean annotate;

    public Map<String, Object> paramsFor(String domainKey) {
        return params.getOrDefault(domainKey, Map.of());
    }
}
