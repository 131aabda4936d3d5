package com.shlawgathon.drawcheck.backend.controller;

import com.shlawgathon.drawcheck.backend.BaseE2ETest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class StandardsControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldLookUpBeam() throws Exception {
        mockMvc.perform(get("/api/standards/beams/W12x26"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.designation").value("W12X26"))
                .andExpect(jsonPath("$.properties.weightPerFt").value(26.0));
    }

    @Test
    void shouldLookUpMaterialByAsmeName() throws Exception {
        mockMvc.perform(get("/api/standards/materials/SA-516-70"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.designation").value("A516-70"));
    }

    @Test
    void shouldVerifyBeamWeight() throws Exception {
        mockMvc.perform(get("/api/standards/beams/W12X26/weight")
                        .param("lengthFt", "20")
                        .param("actualLb", "530"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expectedLb").value(520.0))
                .andExpect(jsonPath("$.toleranceLb").value(26.0))
                .andExpect(jsonPath("$.withinTolerance").value(true));
    }

    @Test
    void shouldRejectNonPositiveLength() throws Exception {
        mockMvc.perform(get("/api/standards/beams/W12X26/weight")
                        .param("lengthFt", "0")
                        .param("actualLb", "530"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnNotFoundForUnknownDesignationOrCategory() throws Exception {
        mockMvc.perform(get("/api/standards/beams/W99X999"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/standards/gaskets/SPW-1"))
                .andExpect(status().isNotFound());
    }
}
