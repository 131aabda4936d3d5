package com.shlawgathon.drawcheck.backend.standards;

/**
 * Reference table families held by the standards store.
 */
public enum StandardsCategory {
    BEAM("beams.json"),
    BOLT("bolts.json"),
    MATERIAL("materials.json"),
    PIPE("pipes.json"),
    CODE_LIMIT("code-limits.json");

    private final String resource;

    StandardsCategory(String resource) {
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
