package com.shlawgathon.drawcheck.backend.model.drawing;

public enum WeldType {
    FILLET,
    GROOVE,
    PLUG,
    SLOT,
    SPOT,
    BUTT,
    UNKNOWN
}
