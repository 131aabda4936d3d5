package com.shlawgathon.drawcheck.backend.validation;

import com.shlawgathon.drawcheck.backend.model.Region;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.model.drawing.PageText;
import com.shlawgathon.drawcheck.backend.model.drawing.TextLine;
import com.shlawgathon.drawcheck.backend.model.drawing.TextSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-built drawing data for validator tests.
 */
public final class DrawingFixtures {

    private DrawingFixtures() {
    }

    /**
     * Text-layer page with one line per argument, stacked 12 points apart.
     */
    public static PageText page(int number, String... lines) {
        List<TextLine> textLines = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            textLines.add(new TextLine(lines[i], Region.builder()
                    .x(36).y(36 + 12.0 * i).width(6.0 * lines[i].length()).height(10)
                    .build()));
        }
        return new PageText(number, textLines, TextSource.TEXT_LAYER);
    }

    public static ExtractedDrawingData.ExtractedDrawingDataBuilder drawing(String... lines) {
        return ExtractedDrawingData.builder().page(page(1, lines));
    }
}
