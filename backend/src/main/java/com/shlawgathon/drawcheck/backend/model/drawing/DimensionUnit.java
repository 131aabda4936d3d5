package com.shlawgathon.drawcheck.backend.model.drawing;

public enum DimensionUnit {
    IN,
    MM
}
