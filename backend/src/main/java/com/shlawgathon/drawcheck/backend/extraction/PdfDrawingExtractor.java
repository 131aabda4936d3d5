package com.shlawgathon.drawcheck.backend.extraction;

import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.model.drawing.PageText;
import com.shlawgathon.drawcheck.backend.model.drawing.TextSource;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads PDFs through their text layer and falls back to OCR for sparse or
 * scanned pages. Raster images are treated as a single scanned page.
 */
public class PdfDrawingExtractor implements DrawingExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfDrawingExtractor.class);

    private static final long CANCEL_POLL_MS = 200;

    private final DrawingTextParser parser;
    private final OcrEngine ocrEngine;
    private final ExecutorService ocrExecutor;
    private final ExtractionSettings settings;

    /**
     * @param ocrEngine may be null when OCR is disabled
     */
    public PdfDrawingExtractor(DrawingTextParser parser, OcrEngine ocrEngine, ExecutorService ocrExecutor,
            ExtractionSettings settings) {
        this.parser = parser;
        this.ocrEngine = ocrEngine;
        this.ocrExecutor = ocrExecutor;
        this.settings = settings;
    }

    @Override
    public ExtractedDrawingData extract(byte[] document, ExtractionControl control) throws ExtractionException {
        if (document == null || document.length == 0) {
            throw new ExtractionException("Document is empty");
        }
        List<PageText> pages = new ArrayList<>();
        List<Integer> missing = new ArrayList<>();

        if (isPdf(document)) {
            readPdf(document, control, pages, missing);
        } else {
            readImage(document, control, pages, missing);
        }

        if (pages.isEmpty()) {
            throw new ExtractionException("No usable text from text layer or OCR"
                    + (missing.isEmpty() ? "" : " (pages missing: " + missing + ")"));
        }
        if (!missing.isEmpty()) {
            log.warn("[EXTRACT] Partial extraction, missing pages {}", missing);
        }
        ExtractedDrawingData data = parser.parse(pages, missing);
        log.info("[EXTRACT] {} pages, {} datums, {} welds, {} materials, {} dimensions, incomplete={}",
                pages.size(), data.getDatums().size(), data.getWelds().size(), data.getMaterials().size(),
                data.getDimensions().size(), data.isIncomplete());
        return data;
    }

    private void readPdf(byte[] document, ExtractionControl control, List<PageText> pages, List<Integer> missing)
            throws ExtractionException {
        try (PDDocument pdf = Loader.loadPDF(document)) {
            PDFRenderer renderer = new PDFRenderer(pdf);
            PositionTextStripper stripper = new PositionTextStripper();
            int pageCount = pdf.getNumberOfPages();

            for (int number = 1; number <= pageCount; number++) {
                control.throwIfCancelled();
                if (control.isExpired()) {
                    log.warn("[EXTRACT] Document deadline reached at page {} of {}", number, pageCount);
                    for (int rest = number; rest <= pageCount; rest++) {
                        missing.add(rest);
                    }
                    break;
                }

                PageText page = new PageText(number, stripper.linesOf(pdf, number), TextSource.TEXT_LAYER);
                if (page.characterCount() < settings.minCharsPerPage()) {
                    Optional<PageText> scanned = ocrPdfPage(renderer, number, control);
                    if (scanned.isPresent() && scanned.get().characterCount() > page.characterCount()) {
                        page = scanned.get();
                    } else if (scanned.isEmpty() && page.characterCount() == 0) {
                        missing.add(number);
                        continue;
                    }
                }
                if (page.characterCount() > 0) {
                    pages.add(page);
                }
            }
        } catch (InvalidPasswordException e) {
            throw new ExtractionException("Document is encrypted", e);
        } catch (IOException e) {
            throw new ExtractionException("Unreadable PDF: " + e.getMessage(), e);
        }
    }

    private void readImage(byte[] document, ExtractionControl control, List<PageText> pages, List<Integer> missing)
            throws ExtractionException {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(document));
        } catch (IOException e) {
            throw new ExtractionException("Unreadable image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ExtractionException("Unsupported document format");
        }
        Optional<PageText> page = ocr(image, 1, control);
        if (page.isEmpty()) {
            missing.add(1);
        } else if (page.get().characterCount() > 0) {
            pages.add(page.get());
        }
    }

    private Optional<PageText> ocrPdfPage(PDFRenderer renderer, int number, ExtractionControl control) {
        if (ocrEngine == null) {
            return Optional.empty();
        }
        BufferedImage image;
        try {
            image = renderer.renderImageWithDPI(number - 1, settings.ocrDpi(), ImageType.GRAY);
        } catch (IOException e) {
            log.warn("[EXTRACT] Could not rasterize page {}: {}", number, e.getMessage());
            return Optional.empty();
        }
        return ocr(image, number, control);
    }

    /**
     * OCR one image on the worker pool. Empty when OCR is unavailable, fails
     * or runs past its time budget.
     */
    private Optional<PageText> ocr(BufferedImage image, int number, ExtractionControl control) {
        if (ocrEngine == null) {
            log.warn("[OCR] Page {} needs OCR but no engine is configured", number);
            return Optional.empty();
        }
        long budget = Math.min(settings.pageTimeout().toMillis(), control.remainingMillis());
        Future<String> future = ocrExecutor.submit(() -> ocrEngine.recognize(image));
        long waited = 0;
        try {
            while (true) {
                control.throwIfCancelled();
                long slice = Math.min(CANCEL_POLL_MS, budget - waited);
                if (slice <= 0) {
                    throw new TimeoutException();
                }
                try {
                    String text = future.get(slice, TimeUnit.MILLISECONDS);
                    return Optional.of(PageText.ocr(number, text == null ? "" : text));
                } catch (TimeoutException e) {
                    waited += slice;
                }
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[OCR] Page {} timed out after {} ms", number, budget);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("[OCR] Page {} failed: {}", number, e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionCancelledException("Interrupted during OCR of page " + number);
        } catch (ExtractionCancelledException e) {
            future.cancel(true);
            throw e;
        }
    }

    static boolean isPdf(byte[] document) {
        int window = Math.min(document.length, 1024);
        return new String(document, 0, window, StandardCharsets.ISO_8859_1).contains("%PDF-");
    }
}
