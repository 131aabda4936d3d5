package com.shlawgathon.drawcheck.backend.controller;

import com.shlawgathon.drawcheck.backend.standards.StandardsCategory;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StandardsControllerTest {

    @Test
    void shouldResolveCategoryFromTableName() {
        assertEquals(Optional.of(StandardsCategory.BEAM), StandardsController.category("beams"));
        assertEquals(Optional.of(StandardsCategory.CODE_LIMIT), StandardsController.category("code-limits"));
    }

    @Test
    void shouldResolveCategoryFromEnumName() {
        assertEquals(Optional.of(StandardsCategory.CODE_LIMIT), StandardsController.category("CODE_LIMIT"));
        assertEquals(Optional.of(StandardsCategory.MATERIAL), StandardsController.category("material"));
    }

    @Test
    void shouldRejectUnknownCategory() {
        assertTrue(StandardsController.category("gaskets").isEmpty());
    }
}
