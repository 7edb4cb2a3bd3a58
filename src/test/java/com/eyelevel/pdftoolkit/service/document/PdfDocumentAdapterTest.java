package com.eyelevel.pdftoolkit.service.document;

import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.DocumentLoadException;
import com.eyelevel.pdftoolkit.exception.FileProtectedException;
import com.eyelevel.pdftoolkit.model.DocumentMetadata;
import com.eyelevel.pdftoolkit.support.TestDocuments;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the PDFBox-backed document operations, using generated fixtures.
 */
class PdfDocumentAdapterTest {

    private final PdfDocumentAdapter adapter = new PdfDocumentAdapter(new ToolkitProcessingConfig());

    @Test
    void loadRejectsBytesThatAreNotAPdf() {
        byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> adapter.load(garbage)).isInstanceOf(DocumentLoadException.class)
                                                       .hasMessage("Corrupted or not a valid PDF");
    }

    @Test
    void loadRejectsPasswordProtectedPdf() throws Exception {
        byte[] protectedPdf = TestDocuments.createProtectedPdf("user-secret");

        assertThatThrownBy(() -> adapter.load(protectedPdf)).isInstanceOf(FileProtectedException.class);
    }

    @Test
    void mergeKeepsInputOrder() throws Exception {
        try (PDDocument first = adapter.load(TestDocuments.createPdf(2, 200));
             PDDocument second = adapter.load(TestDocuments.createPdf(1, 300));
             PDDocument merged = adapter.merge(List.of(first, second))) {

            byte[] saved = adapter.save(merged);

            assertThat(adapter.pageCount(merged)).isEqualTo(3);
            assertThat(TestDocuments.pageWidths(saved)).containsExactly(201, 202, 301);
        }
    }

    @Test
    void extractPagesFollowsTheGivenOrderIncludingRepeats() throws Exception {
        try (PDDocument source = adapter.load(TestDocuments.createPdf(4));
             PDDocument extracted = adapter.extractPages(source, List.of(2, 0, 2))) {

            byte[] saved = adapter.save(extracted);

            assertThat(TestDocuments.pageWidths(saved)).containsExactly(203, 201, 203);
        }
    }

    @Test
    void repeatedPagesRotateIndependently() throws Exception {
        try (PDDocument source = adapter.load(TestDocuments.createPdf(1));
             PDDocument extracted = adapter.extractPages(source, List.of(0, 0))) {

            adapter.rotate(extracted, Map.of(1, 90));

            assertThat(extracted.getPage(0).getRotation()).isEqualTo(90);
            assertThat(extracted.getPage(1).getRotation()).isZero();
        }
    }

    @Test
    void rotationIsAdditiveModulo360() throws Exception {
        try (PDDocument document = adapter.load(TestDocuments.createPdf(3))) {
            document.getPage(0).setRotation(270);
            Map<Integer, Integer> rotations = new LinkedHashMap<>();
            rotations.put(1, 180);
            rotations.put(2, -90);
            rotations.put(9, 90);

            adapter.rotate(document, rotations);

            assertThat(document.getPage(0).getRotation()).isEqualTo(90);
            assertThat(document.getPage(1).getRotation()).isEqualTo(270);
            assertThat(document.getPage(2).getRotation()).isZero();
        }
    }

    @Test
    void extremeRotationDeltaDoesNotOverflow() throws Exception {
        try (PDDocument document = adapter.load(TestDocuments.createPdf(1))) {
            document.getPage(0).setRotation(90);

            adapter.rotate(document, Map.of(1, Integer.MAX_VALUE));

            assertThat(document.getPage(0).getRotation()).isEqualTo(217);
        }
    }

    @Test
    void metadataOverwritesOnlyProvidedFieldsAndStampsProducer() throws Exception {
        try (PDDocument document = adapter.load(TestDocuments.createPdf(1))) {
            document.getDocumentInformation().setAuthor("Original Author");

            adapter.setMetadata(document, DocumentMetadata.builder()
                                                          .title("Lab Report")
                                                          .author("  ")
                                                          .keywords(" physics, optics ,, lab")
                                                          .build());

            try (PDDocument reloaded = Loader.loadPDF(adapter.save(document))) {
                PDDocumentInformation info = reloaded.getDocumentInformation();
                assertThat(info.getTitle()).isEqualTo("Lab Report");
                assertThat(info.getAuthor()).isEqualTo("Original Author");
                assertThat(info.getKeywords()).isEqualTo("physics optics lab");
                assertThat(info.getProducer()).isEqualTo("College Submission Toolkit");
            }
        }
    }

    @Test
    void embedsPngAndJpegAtNativeSize() throws Exception {
        try (PDDocument document = new PDDocument()) {
            assertThat(adapter.embedRasterPage(document, TestDocuments.createImage("png", 40, 30), "image/png")).isTrue();
            assertThat(adapter.embedRasterPage(document, TestDocuments.createImage("jpg", 64, 48), "image/jpeg")).isTrue();

            PDRectangle first = document.getPage(0).getMediaBox();
            PDRectangle second = document.getPage(1).getMediaBox();
            assertThat(first.getWidth()).isEqualTo(40f);
            assertThat(first.getHeight()).isEqualTo(30f);
            assertThat(second.getWidth()).isEqualTo(64f);
            assertThat(second.getHeight()).isEqualTo(48f);
        }
    }

    @Test
    void unsupportedOrUndecodableImagesAreSkipped() throws Exception {
        try (PDDocument document = new PDDocument()) {
            byte[] png = TestDocuments.createImage("png", 10, 10);

            assertThat(adapter.embedRasterPage(document, png, "image/gif")).isFalse();
            assertThat(adapter.embedRasterPage(document, new byte[]{1, 2, 3}, "image/png")).isFalse();
            assertThat(adapter.embedRasterPage(document, png, null)).isFalse();
            assertThat(adapter.pageCount(document)).isZero();
        }
    }

    @Test
    void resaveProducesAnEquivalentDocument() throws Exception {
        byte[] original = TestDocuments.createPdf(3);

        byte[] rewritten = adapter.resave(original);

        assertThat(TestDocuments.pageWidths(rewritten)).containsExactly(201, 202, 203);
    }

    @Test
    void documentOpenedWithEmptyUserPasswordReportsEncryption() throws Exception {
        try (PDDocument document = adapter.load(TestDocuments.createProtectedPdf(""))) {
            assertThat(adapter.isEncrypted(document)).isTrue();
        }
    }

    @Test
    void keywordsAreSplitOnCommasAndJoinedWithSpaces() {
        assertThat(PdfDocumentAdapter.normalizeKeywords("a,b , c")).isEqualTo("a b c");
    }
}
