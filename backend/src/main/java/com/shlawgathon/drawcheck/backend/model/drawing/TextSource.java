package com.shlawgathon.drawcheck.backend.model.drawing;

/**
 * Where the text of a page came from.
 */
public enum TextSource {
    TEXT_LAYER,
    OCR
}
