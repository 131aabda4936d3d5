package com.shlawgathon.drawcheck.backend.service;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(String requestId) {
        super("Validation report not found: " + requestId);
    }
}
