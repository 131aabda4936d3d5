package com.shlawgathon.drawcheck.backend.standards;

import java.util.List;

/**
 * On-disk layout of one reference table file.
 */
public record StandardsDataset(StandardsCategory category, String citation, List<StandardsRecord> records) {
}
