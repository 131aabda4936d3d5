package com.shlawgathon.drawcheck.backend.extraction;

import com.shlawgathon.drawcheck.backend.model.drawing.DesignData;
import com.shlawgathon.drawcheck.backend.model.drawing.Dimension;
import com.shlawgathon.drawcheck.backend.model.drawing.DimensionUnit;
import com.shlawgathon.drawcheck.backend.model.drawing.DrawingMetadata;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.model.drawing.MaterialSpec;
import com.shlawgathon.drawcheck.backend.model.drawing.PageText;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldCallout;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldSide;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldType;
import com.shlawgathon.drawcheck.backend.standards.DesignationNormalizer;
import com.shlawgathon.drawcheck.backend.standards.StandardsCategory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern extraction over page text: datums, weld callouts, material specs,
 * dimensions, title block and design data.
 */
public class DrawingTextParser {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final String NUMBER = "\\d+\\s*-\\s*\\d+/\\d+|\\d+\\s+\\d+/\\d+|\\d+/\\d+|\\d*\\.\\d+|\\d+";

    // Datums
    private static final Pattern DATUM_LABEL = Pattern.compile("\\[([A-Z])\\]");
    private static final Pattern DATUM_NOTE = Pattern.compile("\\bDATUM\\s+(?:FEATURE\\s+)?([A-Z])\\b");

    // Welds
    private static final Pattern WELD = Pattern.compile(
            "(?<![\\w./])(?<size>" + NUMBER + ")\\s*(?:\"|IN\\b\\.?|INCH)?\\s*"
                    + "(?<type>FILLET|FIL|V-GROOVE|BEVEL|GROOVE|GRV|PLUG|SLOT|SPOT|BUTT)\\b(?:\\s*WELDS?\\b)?", FLAGS);
    private static final Pattern WELD_THICKNESS = Pattern.compile(
            "(?:\\b(?:ON|TO)\\s+(?<plate>" + NUMBER + ")\\s*(?:\"|IN\\b\\.?)?\\s*(?:THK\\.?\\s*)?(?:PL|PLATE)\\b)"
                    + "|(?:\\bT\\s*=\\s*(?<t>" + NUMBER + "))"
                    + "|(?:\\bBASE\\s+METAL\\s*[:=]?\\s*(?<base>" + NUMBER + "))", FLAGS);
    private static final Pattern INTERMITTENT = Pattern.compile(
            "(?<![\\w/.-])(\\d+(?:\\.\\d+)?)\\s*\"?\\s*(?:-|@)\\s*(\\d+(?:\\.\\d+)?)(?![\\d/])", FLAGS);
    private static final Pattern BOTH_SIDES = Pattern.compile("\\bBOTH\\s+SIDES?\\b|\\bARROW\\s+AND\\s+OTHER\\b", FLAGS);
    private static final Pattern OTHER_SIDE = Pattern.compile("\\b(?:OTHER|FAR)\\s+SIDE\\b", FLAGS);
    private static final Pattern ALL_AROUND = Pattern.compile("\\bALL\\s*AROUND\\b", FLAGS);
    private static final Pattern FIELD = Pattern.compile("\\bFIELD\\b", FLAGS);

    // Materials
    private static final Pattern MATERIAL = Pattern.compile(
            "(?<![\\w-])(?:(?:ASTM|ASME)\\s+)?(?<prefix>S?[AB])(?:\\s*-\\s*)?(?<number>\\d{2,4})\\b"
                    + "(?:\\s*-\\s*(?<suffix>\\d+|[A-Z]+\\d*)\\b)?"
                    + "(?:\\s*(?:GR\\.?|GRADE)\\s*(?<grade>[A-Z0-9]+)\\b)?");
    private static final Pattern STAINLESS = Pattern.compile("\\b(?:TYPE\\s+|TP\\s*|SS\\s*)(?<type>3\\d{2}L?|4\\d{2})\\b", FLAGS);
    private static final Pattern TABLE_REF = Pattern.compile("\\bTABLE\\s+([A-Z]?\\d+(?:[.-]\\d+)*)", FLAGS);
    private static final Pattern CHEMISTRY = Pattern.compile(
            "\\b(MN|SI|CR|NI|MO|CU|C|P|S|V)\\s*[:=]?\\s*(\\d*\\.\\d+)\\s*%?", FLAGS);
    private static final Pattern MECHANICAL = Pattern.compile(
            "\\b(YS|YIELD(?:\\s+STRENGTH)?|UTS|TS|TENSILE(?:\\s+STRENGTH)?|EL|ELONG(?:ATION)?)\\s*[:=]?\\s*"
                    + "(\\d+(?:\\.\\d+)?)\\s*(KSI|PSI|%)?", FLAGS);
    private static final Pattern HEAT_NUMBER = Pattern.compile(
            "\\bHEAT\\s*(?:NO\\.?|NUMBER|#)\\s*[:=]?\\s*([A-Z0-9][A-Z0-9-]*)", FLAGS);
    private static final Map<Pattern, String> HEAT_TREATMENTS = new LinkedHashMap<>();

    static {
        HEAT_TREATMENTS.put(Pattern.compile("\\bNORMALI[SZ]ED\\b", FLAGS), "NORMALIZED");
        HEAT_TREATMENTS.put(Pattern.compile("\\bSOLUTION\\s+ANNEALED\\b", FLAGS), "SOLUTION_ANNEALED");
        HEAT_TREATMENTS.put(Pattern.compile("\\bQUENCHED\\s+(?:AND|&)\\s+TEMPERED\\b|\\bQ\\s*&\\s*T\\b", FLAGS),
                "QUENCHED_TEMPERED");
        HEAT_TREATMENTS.put(Pattern.compile("\\bAS[\\s-]ROLLED\\b", FLAGS), "AS_ROLLED");
        HEAT_TREATMENTS.put(Pattern.compile("\\bSTRESS\\s+RELIEVED\\b", FLAGS), "STRESS_RELIEVED");
    }

    private static final Map<String, String> ELEMENTS = Map.of(
            "C", "carbon", "MN", "manganese", "P", "phosphorus", "S", "sulfur", "SI", "silicon",
            "CR", "chromium", "NI", "nickel", "MO", "molybdenum", "V", "vanadium", "CU", "copper");

    // Dimensions
    private static final Pattern IMPERIAL = Pattern.compile(
            "(?<![\\w./-])(?<value>\\d+\\s*-\\s*\\d+/\\d+|\\d+/\\d+|\\d*\\.\\d+|\\d+)\\s*(?:\"|IN\\b|INCH(?:ES)?\\b)"
                    + "(?:\\s*(?:±|\\+/-)\\s*(?<tol>\\d*\\.?\\d+))?", FLAGS);
    private static final Pattern METRIC = Pattern.compile(
            "(?<![\\w./-])(?<value>\\d*\\.?\\d+)\\s*(?<unit>MM|CM)\\b(?:\\s*(?:±|\\+/-)\\s*(?<tol>\\d*\\.?\\d+))?", FLAGS);
    private static final Pattern TOLERANCED = Pattern.compile(
            "(?<![\\w./-])(?<value>\\d*\\.\\d+)\\s*(?:±|\\+/-)\\s*(?<tol>\\d*\\.\\d+)");

    // Title block
    private static final Pattern DRAWING_NUMBER = Pattern.compile(
            "\\b(?:DWG|DRAWING)\\s*(?:NO\\.?|NUMBER|#)\\s*[:.]?\\s*([A-Z0-9][A-Z0-9._-]*)", FLAGS);
    private static final Pattern REVISION = Pattern.compile("\\bREV(?:ISION)?\\b\\.?\\s*:?\\s*([A-Z0-9]{1,3})\\b", FLAGS);
    private static final Pattern TITLE = Pattern.compile("\\bTITLE\\s*:\\s*([^\\n]+)", FLAGS);
    private static final Pattern SHEET = Pattern.compile("\\bSHEET\\s*:?\\s*(\\d+)\\s*(?:OF|/)\\s*(\\d+)", FLAGS);

    // Design data
    private static final Pattern DESIGN_PRESSURE = Pattern.compile(
            "\\bDESIGN\\s+PRESS(?:URE|\\.)?\\s*[:=]?\\s*(-?\\d+(?:\\.\\d+)?)", FLAGS);
    private static final Pattern DESIGN_TEMPERATURE = Pattern.compile(
            "\\bDESIGN\\s+TEMP(?:ERATURE|\\.)?\\s*[:=]?\\s*(-?\\d+(?:\\.\\d+)?)", FLAGS);
    private static final Pattern MAWP = Pattern.compile("\\bMAWP\\s*[:=]?\\s*(\\d+(?:\\.\\d+)?)", FLAGS);
    private static final Pattern MDMT = Pattern.compile("\\bMDMT\\s*[:=]?\\s*(-?\\d+(?:\\.\\d+)?)", FLAGS);
    private static final Pattern HYDRO = Pattern.compile(
            "\\b(?:HYDRO(?:STATIC)?(?:\\s+TEST)?(?:\\s+PRESS(?:URE)?)?|TEST\\s+PRESS(?:URE)?)\\s*[:=@]?\\s*(\\d+(?:\\.\\d+)?)",
            FLAGS);
    private static final Pattern CORROSION = Pattern.compile(
            "(?:\\bCORROSION\\s+ALLOWANCE|\\bC\\.A\\.)\\s*[:=]?\\s*(" + NUMBER + ")", FLAGS);
    private static final Pattern NO_PWHT = Pattern.compile("\\bNO\\s+PWHT\\b|\\bPWHT\\s*(?:REQ(?:UIRED|'D|D)?\\.?)?\\s*[:=]?\\s*(?:NO|NOT\\s+REQUIRED|N/?A)\\b", FLAGS);
    private static final Pattern PWHT = Pattern.compile("\\bPWHT\\b|\\bPOST\\s*WELD\\s+HEAT\\s+TREAT", FLAGS);
    private static final Pattern RADIOGRAPHY = Pattern.compile("\\b(FULL|SPOT|100%)\\s+(?:RT|RADIOGRAPH(?:Y|ED)?)\\b", FLAGS);
    private static final Map<String, Pattern> DESIGN_CODES = new LinkedHashMap<>();

    static {
        DESIGN_CODES.put("ASME VIII", Pattern.compile("\\bASME\\s+(?:BPVC\\s+)?(?:SEC(?:TION|\\.)?\\s*)?VIII\\b", FLAGS));
        DESIGN_CODES.put("API 661", Pattern.compile("\\bAPI\\s*(?:STD\\.?\\s*)?661\\b", FLAGS));
        DESIGN_CODES.put("AWS D1.1", Pattern.compile("\\bAWS\\s*D1\\.1\\b", FLAGS));
        DESIGN_CODES.put("ASME B31.3", Pattern.compile("\\bASME\\s*B31\\.3\\b", FLAGS));
        DESIGN_CODES.put("ASME Y14.5", Pattern.compile("\\bASME\\s*Y14\\.5", FLAGS));
    }

    /**
     * Build the drawing data for the given pages. Missing pages mark the
     * result incomplete.
     */
    public ExtractedDrawingData parse(List<PageText> pages, List<Integer> missingPages) {
        ExtractedDrawingData.ExtractedDrawingDataBuilder builder = ExtractedDrawingData.builder()
                .pages(pages)
                .missingPages(missingPages)
                .incomplete(!missingPages.isEmpty());

        for (PageText page : pages) {
            String text = page.text();
            builder.datums(datums(text));
            builder.welds(welds(page, text));
            builder.materials(materials(page, text));
            builder.dimensions(dimensions(page, text));
        }
        builder.metadata(metadata(pages));
        builder.designData(designData(pages));
        return builder.build();
    }

    List<String> datums(String text) {
        List<String> datums = new ArrayList<>();
        collect(DATUM_LABEL.matcher(text), datums);
        collect(DATUM_NOTE.matcher(text), datums);
        return datums;
    }

    private static void collect(Matcher matcher, List<String> out) {
        while (matcher.find()) {
            out.add(matcher.group(1).toUpperCase(Locale.ROOT));
        }
    }

    List<WeldCallout> welds(PageText page, String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher matcher = WELD.matcher(text);
        while (matcher.find()) {
            spans.add(new int[]{matcher.start(), matcher.end()});
        }

        List<WeldCallout> welds = new ArrayList<>();
        for (int i = 0; i < spans.size(); i++) {
            int start = spans.get(i)[0];
            int end = spans.get(i)[1];
            int lineEnd = text.indexOf('\n', end);
            int restEnd = lineEnd < 0 ? text.length() : lineEnd;
            if (i + 1 < spans.size()) {
                restEnd = Math.min(restEnd, spans.get(i + 1)[0]);
            }
            welds.add(weld(page, text.substring(start, end), text.substring(end, restEnd)));
        }
        return welds;
    }

    private WeldCallout weld(PageText page, String head, String rest) {
        Matcher matcher = WELD.matcher(head);
        if (!matcher.find()) {
            throw new IllegalStateException("Weld head no longer matches: " + head);
        }

        Double thickness = null;
        String remainder = rest;
        Matcher t = WELD_THICKNESS.matcher(rest);
        if (t.find()) {
            String token = t.group("plate") != null ? t.group("plate")
                    : t.group("t") != null ? t.group("t") : t.group("base");
            thickness = Measurements.parse(token).orElse(null);
            remainder = rest.substring(0, t.start()) + rest.substring(t.end());
        }

        WeldSide side = WeldSide.ARROW_SIDE;
        if (BOTH_SIDES.matcher(rest).find()) {
            side = WeldSide.BOTH_SIDES;
        } else if (OTHER_SIDE.matcher(rest).find()) {
            side = WeldSide.OTHER_SIDE;
        }

        String raw = (head + rest).trim();
        WeldCallout.WeldCalloutBuilder weld = WeldCallout.builder()
                .raw(raw)
                .type(weldType(matcher.group("type")))
                .size(Measurements.parse(matcher.group("size")).orElse(null))
                .side(side)
                .allAround(ALL_AROUND.matcher(rest).find())
                .field(FIELD.matcher(rest).find())
                .baseMetalThickness(thickness)
                .location(page.locate(head.trim()));

        Matcher intermittent = INTERMITTENT.matcher(remainder);
        if (intermittent.find()) {
            weld.intermittentLength(Double.parseDouble(intermittent.group(1)))
                    .intermittentPitch(Double.parseDouble(intermittent.group(2)));
        }
        return weld.build();
    }

    private static WeldType weldType(String token) {
        return switch (token.toUpperCase(Locale.ROOT)) {
            case "FILLET", "FIL" -> WeldType.FILLET;
            case "GROOVE", "GRV", "V-GROOVE", "BEVEL" -> WeldType.GROOVE;
            case "PLUG" -> WeldType.PLUG;
            case "SLOT" -> WeldType.SLOT;
            case "SPOT" -> WeldType.SPOT;
            case "BUTT" -> WeldType.BUTT;
            default -> WeldType.UNKNOWN;
        };
    }

    List<MaterialSpec> materials(PageText page, String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        List<int[]> spans = new ArrayList<>();
        List<String[]> found = new ArrayList<>();

        List<int[]> titleBlock = new ArrayList<>();
        Matcher dwg = DRAWING_NUMBER.matcher(upper);
        while (dwg.find()) {
            titleBlock.add(new int[]{dwg.start(), dwg.end()});
        }

        Matcher matcher = MATERIAL.matcher(upper);
        while (matcher.find()) {
            if (overlaps(titleBlock, matcher.start(), matcher.end())) {
                continue;
            }
            StringBuilder designation = new StringBuilder(matcher.group("prefix")).append(matcher.group("number"));
            String grade = matcher.group("suffix") != null ? matcher.group("suffix") : matcher.group("grade");
            if (grade != null) {
                designation.append('-').append(grade);
            }
            spans.add(new int[]{matcher.start(), matcher.end()});
            found.add(new String[]{matcher.group().trim(), designation.toString(), grade});
        }
        Matcher stainless = STAINLESS.matcher(upper);
        while (stainless.find()) {
            if (overlaps(spans, stainless.start(), stainless.end())) {
                continue;
            }
            spans.add(new int[]{stainless.start(), stainless.end()});
            found.add(new String[]{stainless.group().trim(), stainless.group("type"), null});
        }

        List<MaterialSpec> materials = new ArrayList<>();
        for (int i = 0; i < found.size(); i++) {
            int end = spans.get(i)[1];
            int next = upper.length();
            for (int[] span : spans) {
                if (span[0] >= end && span[0] < next) {
                    next = span[0];
                }
            }
            String window = upper.substring(end, Math.min(next, end + 400));
            materials.add(material(page, found.get(i), window));
        }
        materials.sort((a, b) -> Integer.compare(upper.indexOf(a.getRaw()), upper.indexOf(b.getRaw())));
        return materials;
    }

    private static boolean overlaps(List<int[]> spans, int start, int end) {
        for (int[] span : spans) {
            if (start < span[1] && end > span[0]) {
                return true;
            }
        }
        return false;
    }

    private MaterialSpec material(PageText page, String[] match, String window) {
        MaterialSpec.MaterialSpecBuilder spec = MaterialSpec.builder()
                .raw(match[0])
                .designation(DesignationNormalizer.normalize(StandardsCategory.MATERIAL, match[1]))
                .grade(match[2])
                .location(page.locate(firstLine(match[0])));

        Matcher tables = TABLE_REF.matcher(window);
        while (tables.find()) {
            spec.tableReference("TABLE " + tables.group(1));
        }
        Matcher chemistry = CHEMISTRY.matcher(window);
        Map<String, Double> elements = new LinkedHashMap<>();
        while (chemistry.find()) {
            elements.putIfAbsent(ELEMENTS.get(chemistry.group(1).toUpperCase(Locale.ROOT)),
                    Double.parseDouble(chemistry.group(2)));
        }
        spec.chemistry(elements);

        Matcher mechanical = MECHANICAL.matcher(window);
        Map<String, Double> properties = new LinkedHashMap<>();
        while (mechanical.find()) {
            String key = mechanicalKey(mechanical.group(1));
            double value = Double.parseDouble(mechanical.group(2));
            if ("PSI".equalsIgnoreCase(mechanical.group(3))) {
                value = value / 1000.0;
            }
            properties.putIfAbsent(key, value);
        }
        spec.mechanical(properties);

        for (Map.Entry<Pattern, String> treatment : HEAT_TREATMENTS.entrySet()) {
            if (treatment.getKey().matcher(window).find()) {
                spec.heatTreatment(treatment.getValue());
                break;
            }
        }
        Matcher heat = HEAT_NUMBER.matcher(window);
        if (heat.find()) {
            spec.heatNumber(heat.group(1));
        }
        return spec.build();
    }

    private static String mechanicalKey(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        if (upper.startsWith("Y")) {
            return "yieldKsi";
        }
        if (upper.startsWith("E")) {
            return "elongationPct";
        }
        return "tensileKsi";
    }

    List<Dimension> dimensions(PageText page, String text) {
        List<Dimension> dimensions = new ArrayList<>();
        List<int[]> spans = new ArrayList<>();

        Matcher imperial = IMPERIAL.matcher(text);
        while (imperial.find()) {
            Optional<Double> value = Measurements.parse(imperial.group("value"));
            if (value.isPresent()) {
                spans.add(new int[]{imperial.start(), imperial.end()});
                dimensions.add(dimension(page, imperial, value.get(), DimensionUnit.IN));
            }
        }
        Matcher metric = METRIC.matcher(text);
        while (metric.find()) {
            if (overlaps(spans, metric.start(), metric.end())) {
                continue;
            }
            double factor = "CM".equalsIgnoreCase(metric.group("unit")) ? 10.0 : 1.0;
            spans.add(new int[]{metric.start(), metric.end()});
            Double tolerance = metric.group("tol") != null ? Double.parseDouble(metric.group("tol")) * factor : null;
            dimensions.add(new Dimension(Double.parseDouble(metric.group("value")) * factor, DimensionUnit.MM,
                    tolerance, metric.group().trim(), page.locate(metric.group().trim())));
        }
        Matcher toleranced = TOLERANCED.matcher(text);
        while (toleranced.find()) {
            if (overlaps(spans, toleranced.start(), toleranced.end())) {
                continue;
            }
            spans.add(new int[]{toleranced.start(), toleranced.end()});
            dimensions.add(dimension(page, toleranced, Double.parseDouble(toleranced.group("value")), DimensionUnit.IN));
        }
        dimensions.sort((a, b) -> Integer.compare(text.indexOf(a.raw()), text.indexOf(b.raw())));
        return dimensions;
    }

    private static Dimension dimension(PageText page, Matcher matcher, double value, DimensionUnit unit) {
        String raw = matcher.group().trim();
        Double tolerance = matcher.group("tol") != null ? Double.parseDouble(matcher.group("tol")) : null;
        return new Dimension(value, unit, tolerance, raw, page.locate(raw));
    }

    DrawingMetadata metadata(List<PageText> pages) {
        DrawingMetadata.DrawingMetadataBuilder metadata = DrawingMetadata.builder();
        first(pages, DRAWING_NUMBER).ifPresent(metadata::drawingNumber);
        first(pages, REVISION).ifPresent(metadata::revision);
        first(pages, TITLE).map(String::trim).ifPresent(metadata::title);
        for (PageText page : pages) {
            Matcher sheet = SHEET.matcher(page.text());
            if (sheet.find()) {
                metadata.sheetNumber(Integer.parseInt(sheet.group(1)))
                        .sheetCount(Integer.parseInt(sheet.group(2)));
                break;
            }
        }
        return metadata.build();
    }

    DesignData designData(List<PageText> pages) {
        DesignData.DesignDataBuilder design = DesignData.builder();
        firstNumber(pages, DESIGN_PRESSURE).ifPresent(design::designPressure);
        firstNumber(pages, DESIGN_TEMPERATURE).ifPresent(design::designTemperature);
        firstNumber(pages, MAWP).ifPresent(design::mawp);
        firstNumber(pages, MDMT).ifPresent(design::mdmt);
        firstNumber(pages, HYDRO).ifPresent(design::hydroTestPressure);
        first(pages, CORROSION).flatMap(Measurements::parse).ifPresent(design::corrosionAllowance);

        String all = joined(pages);
        if (NO_PWHT.matcher(all).find()) {
            design.pwhtRequired(false);
        } else if (PWHT.matcher(all).find()) {
            design.pwhtRequired(true);
        }
        Matcher rt = RADIOGRAPHY.matcher(all);
        if (rt.find()) {
            design.radiography("SPOT".equalsIgnoreCase(rt.group(1)) ? "SPOT" : "FULL");
        }
        DESIGN_CODES.forEach((code, pattern) -> {
            if (pattern.matcher(all).find()) {
                design.designCode(code);
            }
        });
        return design.build();
    }

    private static Optional<String> first(List<PageText> pages, Pattern pattern) {
        for (PageText page : pages) {
            Matcher matcher = pattern.matcher(page.text());
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    private static Optional<Double> firstNumber(List<PageText> pages, Pattern pattern) {
        return first(pages, pattern).flatMap(Measurements::parse);
    }

    private static String joined(List<PageText> pages) {
        StringBuilder sb = new StringBuilder();
        pages.forEach(p -> sb.append(p.text()));
        return sb.toString();
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return (newline >= 0 ? text.substring(0, newline) : text).trim();
    }
}
