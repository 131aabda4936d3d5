package com.shlawgathon.drawcheck.backend.extraction;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Tesseract backed OCR. Tesseract handles are not thread-safe, so each call
 * gets its own instance.
 */
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final String dataPath;
    private final String language;
    private final int dpi;

    public TesseractOcrEngine(String dataPath, String language, int dpi) {
        this.dataPath = dataPath;
        this.language = language;
        this.dpi = dpi;
    }

    @Override
    public String recognize(BufferedImage image) throws OcrException {
        ITesseract tesseract = new Tesseract();
        tesseract.setDatapath(dataPath);
        tesseract.setLanguage(language);
        tesseract.setVariable("user_defined_dpi", String.valueOf(dpi));
        try {
            long start = System.currentTimeMillis();
            String text = tesseract.doOCR(image);
            log.debug("[OCR] Recognized {} chars in {} ms", text.length(), System.currentTimeMillis() - start);
            return text;
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed: " + e.getMessage(), e);
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            throw new OcrException("Tesseract native library unavailable", e);
        }
    }
}
