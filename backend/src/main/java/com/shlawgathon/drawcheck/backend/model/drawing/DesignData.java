package com.shlawgathon.drawcheck.backend.model.drawing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Design conditions stated in the drawing notes. Pressures in psig,
 * temperatures in degrees Fahrenheit, lengths in inches.
 */
@Value
@Builder(toBuilder = true)
public class DesignData {
    Double designPressure;
    Double designTemperature;
    Double mawp;
    Double mdmt;
    Double hydroTestPressure;
    Double corrosionAllowance;
    Boolean pwhtRequired;
    String radiography;
    @Singular
    List<String> designCodes;

    public static DesignData empty() {
        return DesignData.builder().build();
    }
}
