package com.shlawgathon.drawcheck.backend.validation.gdt;

import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.model.drawing.PageText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds feature control frames in page text, written either with symbols
 * ({@code |⌖|Ø.010(M)|A|B|C|}) or in words ({@code POSITION DIA 0.010 MMC A B C}).
 */
public class FeatureControlFrameParser {

    private static final String MODIFIER = "\\([MLS]\\)|[ⓂⓁⓈ]|MMC|LMC|RFS";
    private static final String DATUM_LETTER = "[A-HJ-NPR-Z]";

    private static final Map<String, GeometricCharacteristic> BY_TOKEN = tokens();

    private static final Pattern FRAME = Pattern.compile(
            "(?<![A-Z0-9])(?<sym>" + alternation() + ")(?![A-Z0-9])"
                    + "[ \\t]*[|:]?[ \\t]*(?<dia>Ø|⌀|DIA\\.?)?[ \\t]*(?<tol>\\d*\\.\\d+)"
                    + "[ \\t]*(?<mod>" + MODIFIER + ")?"
                    + "(?<datums>(?:[ \\t]*[|,]?[ \\t]*" + DATUM_LETTER
                    + "(?:[ \\t]*(?:" + MODIFIER + "))?(?![A-Z0-9]))*)");

    private static final Pattern DATUM = Pattern.compile(
            "(?<letter>" + DATUM_LETTER + ")(?:[ \\t]*(?<mod>" + MODIFIER + "))?(?![A-Z0-9])");

    public List<FeatureControlFrame> parse(ExtractedDrawingData data) {
        List<FeatureControlFrame> frames = new ArrayList<>();
        for (PageText page : data.getPages()) {
            frames.addAll(parse(page));
        }
        return frames;
    }

    public List<FeatureControlFrame> parse(PageText page) {
        List<FeatureControlFrame> frames = new ArrayList<>();
        Matcher m = FRAME.matcher(page.text().toUpperCase(Locale.ROOT));
        while (m.find()) {
            String raw = m.group().strip();
            FeatureControlFrame.FeatureControlFrameBuilder frame = FeatureControlFrame.builder()
                    .raw(raw)
                    .characteristic(BY_TOKEN.get(m.group("sym")))
                    .tolerance(Double.parseDouble(m.group("tol")))
                    .diametricZone(m.group("dia") != null)
                    .modifier(MaterialCondition.fromSymbol(m.group("mod")).orElse(null))
                    .location(page.locate(raw));
            Matcher d = DATUM.matcher(m.group("datums"));
            while (d.find()) {
                frame.datum(new DatumReference(d.group("letter"),
                        MaterialCondition.fromSymbol(d.group("mod")).orElse(null)));
            }
            frames.add(frame.build());
        }
        return frames;
    }

    private static Map<String, GeometricCharacteristic> tokens() {
        Map<String, GeometricCharacteristic> byToken = new HashMap<>();
        for (GeometricCharacteristic characteristic : GeometricCharacteristic.values()) {
            for (String token : characteristic.tokens()) {
                byToken.put(token, characteristic);
            }
        }
        return Map.copyOf(byToken);
    }

    // Longest first so that CIRCULAR RUNOUT wins over RUNOUT.
    private static String alternation() {
        return BY_TOKEN.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
    }
}
