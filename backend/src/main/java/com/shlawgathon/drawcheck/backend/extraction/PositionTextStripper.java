package com.shlawgathon.drawcheck.backend.extraction;

import com.shlawgathon.drawcheck.backend.model.Region;
import com.shlawgathon.drawcheck.backend.model.drawing.TextLine;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Text stripper that keeps each output line together with the box around its
 * glyphs.
 */
class PositionTextStripper extends PDFTextStripper {

    private final List<TextLine> lines = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();
    private Region currentRegion;

    PositionTextStripper() {
        setSortByPosition(true);
    }

    List<TextLine> linesOf(PDDocument document, int pageNumber) throws IOException {
        lines.clear();
        current.setLength(0);
        currentRegion = null;
        setStartPage(pageNumber);
        setEndPage(pageNumber);
        getText(document);
        flush();
        return List.copyOf(lines);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) {
        current.append(text);
        for (TextPosition position : textPositions) {
            Region glyph = Region.builder()
                    .x(position.getXDirAdj())
                    .y(position.getYDirAdj() - position.getHeightDir())
                    .width(position.getWidthDirAdj())
                    .height(position.getHeightDir())
                    .build();
            currentRegion = currentRegion == null ? glyph : currentRegion.union(glyph);
        }
    }

    @Override
    protected void writeWordSeparator() {
        current.append(' ');
    }

    @Override
    protected void writeLineSeparator() {
        flush();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
        flush();
        super.endPage(page);
    }

    private void flush() {
        if (!current.toString().isBlank()) {
            lines.add(new TextLine(current.toString(), currentRegion));
        }
        current.setLength(0);
        currentRegion = null;
    }
}
