package com.shlawgathon.drawcheck.backend.extraction;

import java.awt.image.BufferedImage;

/**
 * Optical character recognition over a rendered page.
 */
public interface OcrEngine {

    String recognize(BufferedImage image) throws OcrException;
}
