package com.shlawgathon.drawcheck.backend.model.drawing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Structured content of one drawing. Read-only once built.
 */
@Value
@Builder
public class ExtractedDrawingData {
    @Singular
    List<PageText> pages;
    @Singular
    SortedSet<String> datums;
    @Singular
    List<WeldCallout> welds;
    @Singular
    List<MaterialSpec> materials;
    @Singular
    List<Dimension> dimensions;
    @Builder.Default
    DrawingMetadata metadata = DrawingMetadata.empty();
    @Builder.Default
    DesignData designData = DesignData.empty();
    @Singular
    List<Integer> missingPages;
    boolean incomplete;

    public String fullText() {
        StringBuilder sb = new StringBuilder();
        for (PageText page : pages) {
            sb.append(page.text());
        }
        return sb.toString();
    }

    public Optional<PageText> page(int number) {
        return pages.stream().filter(p -> p.page() == number).findFirst();
    }
}
