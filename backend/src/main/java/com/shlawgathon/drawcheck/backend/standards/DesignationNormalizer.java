package com.shlawgathon.drawcheck.backend.standards;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical lookup keys for designations as they are written on drawings.
 */
public final class DesignationNormalizer {

    private static final Pattern MATERIAL_PREFIX = Pattern.compile("^S?([AB])-?(\\d{2,4})");
    private static final Pattern STAINLESS_TYPE = Pattern.compile("^(?:SS|TP|TYPE)-?(\\d{3}[A-Z]?)$");
    private static final Pattern PIPE = Pattern.compile(
            "^(?:NPS)?\\s*(\\d+(?:[\\s-]\\d+/\\d+)?|\\d+/\\d+)\\s*(?:\"|IN\\.?)?\\s*(?:SCH(?:EDULE)?\\.?)\\s*(\\d+)$");
    private static final Pattern MIXED_FRACTION = Pattern.compile("^(\\d+)\\s+(\\d+/\\d+)$");

    private DesignationNormalizer() {
    }

    public static String normalize(StandardsCategory category, String designation) {
        if (designation == null) {
            return "";
        }
        String value = designation.trim().toUpperCase(Locale.ROOT);
        return switch (category) {
            case BEAM -> value.replace('×', 'X').replaceAll("\\s+", "");
            case BOLT -> mixedFraction(value.replaceAll("(\"|IN\\.?|DIA\\.?)", "").trim()).replaceAll("\\s+", "");
            case MATERIAL -> material(value);
            case PIPE -> pipe(value);
            case CODE_LIMIT -> value.replaceAll("\\s+", "-");
        };
    }

    private static String material(String value) {
        String v = value.replaceAll("\\b(ASTM|ASME)\\b", "")
                .replaceAll("\\bGRADE\\b|\\bGR\\.?", "-")
                .replaceAll("\\s+", "");
        Matcher stainless = STAINLESS_TYPE.matcher(v);
        if (stainless.matches()) {
            return stainless.group(1);
        }
        Matcher prefix = MATERIAL_PREFIX.matcher(v);
        if (prefix.find()) {
            v = prefix.group(1) + prefix.group(2) + v.substring(prefix.end());
        }
        return v.replaceAll("-{2,}", "-").replaceAll("^-|-$", "");
    }

    private static String pipe(String value) {
        Matcher matcher = PIPE.matcher(value);
        if (matcher.matches()) {
            return mixedFraction(matcher.group(1).trim()) + "-" + matcher.group(2);
        }
        return value.replaceAll("\\s+", "");
    }

    private static String mixedFraction(String value) {
        Matcher matcher = MIXED_FRACTION.matcher(value);
        if (matcher.matches()) {
            return matcher.group(1) + "-" + matcher.group(2);
        }
        return value;
    }
}
