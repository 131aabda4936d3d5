package com.shlawgathon.drawcheck.backend.model.drawing;

public enum WeldSide {
    ARROW_SIDE,
    OTHER_SIDE,
    BOTH_SIDES
}
