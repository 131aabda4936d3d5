package com.shlawgathon.drawcheck.backend.validation.gdt;

public record DatumReference(String letter, MaterialCondition modifier) {
}
