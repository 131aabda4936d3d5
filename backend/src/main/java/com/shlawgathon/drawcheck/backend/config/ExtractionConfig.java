package com.shlawgathon.drawcheck.backend.config;

import com.shlawgathon.drawcheck.backend.extraction.DrawingExtractor;
import com.shlawgathon.drawcheck.backend.extraction.DrawingTextParser;
import com.shlawgathon.drawcheck.backend.extraction.ExtractionSettings;
import com.shlawgathon.drawcheck.backend.extraction.OcrEngine;
import com.shlawgathon.drawcheck.backend.extraction.PdfDrawingExtractor;
import com.shlawgathon.drawcheck.backend.extraction.TesseractOcrEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** Text-layer and OCR extraction beans. */
@Configuration
public class ExtractionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExtractionConfig.class);

    @Value("${drawcheck.extraction.min-chars-per-page:100}")
    private int minCharsPerPage;

    @Value("${drawcheck.extraction.ocr.dpi:300}")
    private int ocrDpi;

    @Value("${drawcheck.extraction.page-timeout-ms:30000}")
    private long pageTimeoutMs;

    @Value("${drawcheck.extraction.document-timeout-ms:120000}")
    private long documentTimeoutMs;

    @Bean
    public ExtractionSettings extractionSettings() {
        return new ExtractionSettings(minCharsPerPage, ocrDpi, Duration.ofMillis(pageTimeoutMs),
                Duration.ofMillis(documentTimeoutMs));
    }

    @Bean
    @ConditionalOnProperty(name = "drawcheck.extraction.ocr.enabled", havingValue = "true", matchIfMissing = true)
    public OcrEngine ocrEngine(
            @Value("${drawcheck.extraction.ocr.datapath:/usr/share/tesseract-ocr/5/tessdata}") String dataPath,
            @Value("${drawcheck.extraction.ocr.language:eng}") String language) {
        log.info("[OCR] Tesseract enabled with language {} at {}", language, dataPath);
        return new TesseractOcrEngine(dataPath, language, ocrDpi);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ocrExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public DrawingExtractor drawingExtractor(ObjectProvider<OcrEngine> ocrEngine,
            @Qualifier("ocrExecutor") ExecutorService ocrExecutor, ExtractionSettings settings) {
        OcrEngine engine = ocrEngine.getIfAvailable();
        if (engine == null) {
            log.warn("[OCR] OCR disabled; scanned pages will be reported as unreadable");
        }
        return new PdfDrawingExtractor(new DrawingTextParser(), engine, ocrExecutor, settings);
    }
}
