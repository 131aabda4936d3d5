package com.shlawgathon.drawcheck.backend.annotation;

import com.shlawgathon.drawcheck.backend.model.IssueLocation;
import com.shlawgathon.drawcheck.backend.model.Region;
import com.shlawgathon.drawcheck.backend.model.Severity;
import com.shlawgathon.drawcheck.backend.model.ValidationIssue;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws severity-colored boxes and labels on a PDF copy of the drawing.
 * Raster inputs are first wrapped into a one-page PDF.
 */
public class PdfDocumentAnnotator implements DocumentAnnotator {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentAnnotator.class);

    private static final float LABEL_SIZE = 6f;
    private static final float SUMMARY_SIZE = 9f;
    private static final float SUMMARY_LEADING = 12f;
    private static final float MARGIN = 36f;
    private static final float FLAG_SIZE = 8f;
    private static final int SUMMARY_WRAP = 100;
    private static final int LABEL_MAX = 90;

    private final PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

    @Override
    public AnnotatedDocument annotate(byte[] document, String documentName, List<ValidationIssue> issues)
            throws AnnotationException {
        if (document == null || document.length == 0) {
            throw new AnnotationException("Document is empty");
        }
        try (PDDocument pdf = open(document)) {
            int pageCount = pdf.getNumberOfPages();
            List<ValidationIssue> unplaced = new ArrayList<>();
            Map<Integer, Integer> flagsPerPage = new HashMap<>();
            int markers = 0;

            for (ValidationIssue issue : issues) {
                IssueLocation location = issue.getLocation();
                if (location == null || location.getPage() < 1 || location.getPage() > pageCount) {
                    unplaced.add(issue);
                    continue;
                }
                PDPage page = pdf.getPage(location.getPage() - 1);
                if (location.getRegion() != null) {
                    drawRegionMarker(pdf, page, location.getRegion(), issue);
                } else {
                    int index = flagsPerPage.merge(location.getPage(), 1, Integer::sum) - 1;
                    drawMarginFlag(pdf, page, index, issue);
                }
                markers++;
            }
            if (!unplaced.isEmpty()) {
                appendSummary(pdf, unplaced);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            pdf.save(out);
            log.info("[ANNOTATE] {} markers, {} issues on summary pages", markers, unplaced.size());
            return new AnnotatedDocument(annotatedName(documentName), out.toByteArray(), markers, unplaced.size());
        } catch (IOException e) {
            throw new AnnotationException("Could not annotate document: " + e.getMessage(), e);
        }
    }

    private PDDocument open(byte[] document) throws IOException, AnnotationException {
        if (new String(document, 0, Math.min(document.length, 1024), StandardCharsets.ISO_8859_1).contains("%PDF-")) {
            return Loader.loadPDF(document);
        }
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(document));
        if (image == null) {
            throw new AnnotationException("Unsupported document format");
        }
        PDDocument pdf = new PDDocument();
        PDPage page = new PDPage(new PDRectangle(image.getWidth(), image.getHeight()));
        pdf.addPage(page);
        PDImageXObject xObject = LosslessFactory.createFromImage(pdf, image);
        try (PDPageContentStream content = new PDPageContentStream(pdf, page)) {
            content.drawImage(xObject, 0, 0, image.getWidth(), image.getHeight());
        }
        return pdf;
    }

    // Regions are measured from the top-left corner; PDF space starts bottom-left.
    private void drawRegionMarker(PDDocument pdf, PDPage page, Region region, ValidationIssue issue)
            throws IOException {
        PDRectangle box = page.getMediaBox();
        float padding = 2f;
        float x = (float) region.getX() - padding;
        float width = (float) region.getWidth() + 2 * padding;
        float height = (float) region.getHeight() + 2 * padding;
        float y = box.getHeight() - (float) region.getY() - (float) region.getHeight() - padding;

        try (PDPageContentStream content = append(pdf, page)) {
            content.setStrokingColor(colorOf(issue.getSeverity()));
            content.setLineWidth(1.2f);
            content.addRect(box.getLowerLeftX() + x, box.getLowerLeftY() + y, width, height);
            content.stroke();
            label(content, box.getLowerLeftX() + x, box.getLowerLeftY() + y + height + 1.5f, issue);
        }
    }

    private void drawMarginFlag(PDDocument pdf, PDPage page, int index, ValidationIssue issue) throws IOException {
        PDRectangle box = page.getMediaBox();
        float x = box.getLowerLeftX() + 6f;
        float y = box.getUpperRightY() - 18f - index * (FLAG_SIZE + 4f);
        try (PDPageContentStream content = append(pdf, page)) {
            content.setNonStrokingColor(colorOf(issue.getSeverity()));
            content.addRect(x, y, FLAG_SIZE, FLAG_SIZE);
            content.fill();
            label(content, x + FLAG_SIZE + 3f, y + 1f, issue);
        }
    }

    private void label(PDPageContentStream content, float x, float y, ValidationIssue issue) throws IOException {
        content.setNonStrokingColor(colorOf(issue.getSeverity()));
        content.beginText();
        content.setFont(font, LABEL_SIZE);
        content.newLineAtOffset(x, y);
        content.showText(truncate(winAnsi(issue.getMessage()), LABEL_MAX));
        content.endText();
    }

    private void appendSummary(PDDocument pdf, List<ValidationIssue> issues) throws IOException {
        List<String[]> lines = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            String severity = issue.getSeverity().name();
            List<String> wrapped = wrap(winAnsi("[" + severity + "] " + issue.getCheckType() + ": "
                    + issue.getMessage()), SUMMARY_WRAP);
            for (String line : wrapped) {
                lines.add(new String[]{issue.getSeverity().key(), line});
            }
        }

        PDRectangle size = PDRectangle.LETTER;
        int perPage = (int) ((size.getHeight() - 2 * MARGIN - 2 * SUMMARY_LEADING) / SUMMARY_LEADING);
        int pages = Math.max(1, (lines.size() + perPage - 1) / perPage);
        for (int p = 0; p < pages; p++) {
            PDPage page = new PDPage(size);
            pdf.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(pdf, page)) {
                content.beginText();
                content.setFont(bold, 12f);
                content.newLineAtOffset(MARGIN, size.getHeight() - MARGIN);
                content.showText("Validation issues without a drawing location"
                        + (pages > 1 ? " (" + (p + 1) + " of " + pages + ")" : ""));
                content.setFont(font, SUMMARY_SIZE);
                content.setLeading(SUMMARY_LEADING);
                content.newLine();
                content.newLine();
                int end = Math.min(lines.size(), (p + 1) * perPage);
                for (int i = p * perPage; i < end; i++) {
                    String[] line = lines.get(i);
                    content.setNonStrokingColor(colorOf(Severity.fromKey(line[0])));
                    content.showText(line[1]);
                    content.newLine();
                }
                content.endText();
            }
        }
    }

    private static PDPageContentStream append(PDDocument pdf, PDPage page) throws IOException {
        return new PDPageContentStream(pdf, page, PDPageContentStream.AppendMode.APPEND, true, true);
    }

    static Color colorOf(Severity severity) {
        return switch (severity) {
            case CRITICAL -> new Color(220, 0, 0);
            case ERROR -> new Color(255, 69, 0);
            case WARNING -> new Color(255, 165, 0);
            case INFO -> new Color(0, 102, 204);
        };
    }

    /**
     * Standard 14 fonts only encode WinAnsi; anything else becomes '?'.
     */
    static String winAnsi(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '\n' || c == '\r' || c == '\t') {
                sb.append(' ');
            } else if (c >= 32 && c <= 126) {
                sb.append(c);
            } else if (c == 'Ø' || c == '⌀') {
                sb.append("DIA ");
            } else {
                sb.append('?');
            }
        }
        return sb.toString();
    }

    static List<String> wrap(String text, int width) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : text.split(" ")) {
            if (line.length() > 0 && line.length() + 1 + word.length() > width) {
                lines.add(line.toString());
                line.setLength(0);
                line.append("    ");
            }
            if (line.length() > 0 && !line.toString().isBlank()) {
                line.append(' ');
            }
            line.append(word);
        }
        if (!line.toString().isBlank()) {
            lines.add(line.toString());
        }
        return lines;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }

    static String annotatedName(String documentName) {
        String base = documentName == null || documentName.isBlank() ? "drawing" : documentName;
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        return base + "-annotated.pdf";
    }
}
