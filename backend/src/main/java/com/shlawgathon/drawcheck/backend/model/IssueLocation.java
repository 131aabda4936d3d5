package com.shlawgathon.drawcheck.backend.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Where on the source document an issue applies. Pages are 1-based.
 */
@Value
@Builder
@Jacksonized
public class IssueLocation {
    int page;
    Region region;

    public static IssueLocation page(int page) {
        return new IssueLocation(page, null);
    }
}
