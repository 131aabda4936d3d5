package com.shlawgathon.drawcheck.backend.model.drawing;

import com.shlawgathon.drawcheck.backend.model.IssueLocation;
import com.shlawgathon.drawcheck.backend.model.Region;

import java.util.List;
import java.util.Locale;

/**
 * Text of a single page. Lines carry boxes for text-layer pages; OCR pages
 * only know the page.
 */
public record PageText(int page, List<TextLine> lines, TextSource source) {

    public PageText {
        lines = List.copyOf(lines);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (TextLine line : lines) {
            sb.append(line.text()).append('\n');
        }
        return sb.toString();
    }

    public int characterCount() {
        int count = 0;
        for (TextLine line : lines) {
            count += line.text().strip().length();
        }
        return count;
    }

    /**
     * Location of the line containing {@code fragment}, falling back to the
     * page alone.
     */
    public IssueLocation locate(String fragment) {
        if (fragment != null && !fragment.isBlank()) {
            String needle = fragment.strip().toUpperCase(Locale.ROOT);
            for (TextLine line : lines) {
                if (line.region() != null && line.text().toUpperCase(Locale.ROOT).contains(needle)) {
                    return IssueLocation.builder().page(page).region(line.region()).build();
                }
            }
        }
        return IssueLocation.page(page);
    }

    public static PageText ocr(int page, String text) {
        List<TextLine> lines = text.lines()
                .map(l -> new TextLine(l, (Region) null))
                .toList();
        return new PageText(page, lines, TextSource.OCR);
    }
}
