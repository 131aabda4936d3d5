package com.shlawgathon.drawcheck.backend.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Rectangle on a page, in PDF points measured from the top-left corner.
 */
@Value
@Builder
@Jacksonized
public class Region {
    double x;
    double y;
    double width;
    double height;

    public Region union(Region other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        double maxX = Math.max(x + width, other.x + other.width);
        double maxY = Math.max(y + height, other.y + other.height);
        return new Region(minX, minY, maxX - minX, maxY - minY);
    }
}
