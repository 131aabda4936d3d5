package com.shlawgathon.drawcheck.backend.annotation;

import com.shlawgathon.drawcheck.backend.extraction.TestPdfs;
import com.shlawgathon.drawcheck.backend.model.IssueLocation;
import com.shlawgathon.drawcheck.backend.model.Region;
import com.shlawgathon.drawcheck.backend.model.Severity;
import com.shlawgathon.drawcheck.backend.model.ValidationIssue;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfDocumentAnnotatorTest {

    private final PdfDocumentAnnotator annotator = new PdfDocumentAnnotator();

    private static ValidationIssue issue(Severity severity, String message, IssueLocation location) {
        return ValidationIssue.builder()
                .severity(severity)
                .checkType("welding.fillet-size")
                .message(message)
                .location(location)
                .build();
    }

    @Test
    void marksLocatedIssuesAndSummarizesTheRest() throws Exception {
        byte[] source = TestPdfs.pdf(List.of(List.of("1/16 FILLET ON 1/2 PL"), List.of("NOTES")));
        Region region = Region.builder().x(50).y(80).width(120).height(11).build();
        List<ValidationIssue> issues = List.of(
                issue(Severity.CRITICAL, "Fillet weld size 0.0625 is below minimum 0.1875",
                        IssueLocation.builder().page(1).region(region).build()),
                issue(Severity.WARNING, "No WPS referenced", IssueLocation.page(2)),
                issue(Severity.INFO, "Ø marker without page", null),
                issue(Severity.ERROR, "Located on a page that does not exist", IssueLocation.page(9)));

        AnnotatedDocument annotated = annotator.annotate(source, "drawing.pdf", issues);

        assertThat(annotated.filename()).isEqualTo("drawing-annotated.pdf");
        assertThat(annotated.markerCount()).isEqualTo(2);
        assertThat(annotated.summaryIssueCount()).isEqualTo(2);
        try (PDDocument pdf = Loader.loadPDF(annotated.content())) {
            assertThat(pdf.getNumberOfPages()).isEqualTo(3);
        }
    }

    @Test
    void noIssuesLeavesPageCountUnchanged() throws Exception {
        AnnotatedDocument annotated = annotator.annotate(TestPdfs.pdf("NOTES"), "sheet-1.pdf", List.of());

        assertThat(annotated.markerCount()).isZero();
        try (PDDocument pdf = Loader.loadPDF(annotated.content())) {
            assertThat(pdf.getNumberOfPages()).isEqualTo(1);
        }
    }

    @Test
    void wrapsRasterInputInAPdf() throws Exception {
        BufferedImage image = new BufferedImage(200, 100, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(image, "png", png);

        AnnotatedDocument annotated = annotator.annotate(png.toByteArray(), "scan.png",
                List.of(issue(Severity.WARNING, "check", IssueLocation.page(1))));

        assertThat(annotated.filename()).isEqualTo("scan-annotated.pdf");
        assertThat(annotated.markerCount()).isEqualTo(1);
        try (PDDocument pdf = Loader.loadPDF(annotated.content())) {
            assertThat(pdf.getNumberOfPages()).isEqualTo(1);
        }
    }

    @Test
    void rejectsUnreadableInput() {
        assertThatThrownBy(() -> annotator.annotate(new byte[0], "x.pdf", List.of()))
                .isInstanceOf(AnnotationException.class);
        assertThatThrownBy(() -> annotator.annotate("hello".getBytes(StandardCharsets.US_ASCII), "x.txt", List.of()))
                .isInstanceOf(AnnotationException.class)
                .hasMessage("Unsupported document format");
    }

    @Test
    void replacesCharactersTheStandardFontsCannotEncode() {
        assertThat(PdfDocumentAnnotator.winAnsi("Ø0.5\tok ⌖")).isEqualTo("DIA 0.5 ok ?");
    }

    @Test
    void wrapsLongSummaryLines() {
        List<String> lines = PdfDocumentAnnotator.wrap("alpha beta gamma delta", 11);

        assertThat(lines).containsExactly("alpha beta", "    gamma", "    delta");
    }

    @Test
    void namesAnnotatedCopies() {
        assertThat(PdfDocumentAnnotator.annotatedName("plan.v2.pdf")).isEqualTo("plan.v2-annotated.pdf");
        assertThat(PdfDocumentAnnotator.annotatedName(null)).isEqualTo("drawing-annotated.pdf");
    }
}
