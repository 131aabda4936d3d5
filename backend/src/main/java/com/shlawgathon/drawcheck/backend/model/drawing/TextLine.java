package com.shlawgathon.drawcheck.backend.model.drawing;

import com.shlawgathon.drawcheck.backend.model.Region;

/**
 * One line of page text with its bounding box, when known.
 */
public record TextLine(String text, Region region) {
}
