package com.eyelevel.pdftoolkit.service.dispatch;

import com.eyelevel.pdftoolkit.common.json.jackson.JacksonJsonParser;
import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.OperationException;
import com.eyelevel.pdftoolkit.exception.RequestValidationException;
import com.eyelevel.pdftoolkit.exception.ToolUnavailableException;
import com.eyelevel.pdftoolkit.exception.json.JsonParsingException;
import com.eyelevel.pdftoolkit.model.DocumentOperation;
import com.eyelevel.pdftoolkit.model.InputDocument;
import com.eyelevel.pdftoolkit.model.OperationResult;
import com.eyelevel.pdftoolkit.model.ValidationStatus;
import com.eyelevel.pdftoolkit.service.compression.PdfCompressionService;
import com.eyelevel.pdftoolkit.service.document.PdfDocumentAdapter;
import com.eyelevel.pdftoolkit.service.range.PageRangeSelector;
import com.eyelevel.pdftoolkit.service.storage.ArtifactStore;
import com.eyelevel.pdftoolkit.service.tool.GhostscriptReducer;
import com.eyelevel.pdftoolkit.service.tool.LibreOfficeConverter;
import com.eyelevel.pdftoolkit.service.tool.ToolLocator;
import com.eyelevel.pdftoolkit.support.FakeCommandRunner;
import com.eyelevel.pdftoolkit.support.TestDocuments;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.BDDMockito;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;

/**
 * End-to-end tests of the dispatcher over real PDFBox processing and a real artifact store.
 * Ghostscript is absent and LibreOffice is mocked.
 */
class OperationDispatcherTest {

    @TempDir
    Path storeDir;

    private ToolkitProcessingConfig config;
    private ArtifactStore artifactStore;
    private LibreOfficeConverter libreOfficeConverter;
    private OperationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        config = new ToolkitProcessingConfig();
        config.getArtifacts().setDirectory(storeDir.toString());
        artifactStore = new ArtifactStore(config, Clock.systemUTC());
        PdfDocumentAdapter adapter = new PdfDocumentAdapter(config);
        FakeCommandRunner runner = FakeCommandRunner.withoutTools();
        GhostscriptReducer reducer = new GhostscriptReducer(config, runner, new ToolLocator(runner));
        libreOfficeConverter = Mockito.mock(LibreOfficeConverter.class);
        dispatcher = new OperationDispatcher(config, new PageRangeSelector(), adapter,
                                             new PdfCompressionService(config, reducer, adapter, artifactStore),
                                             libreOfficeConverter, artifactStore,
                                             new JacksonJsonParser(new ObjectMapper()));
    }

    @Test
    void splitExtractsSelectedPagesInAscendingOrder() throws Exception {
        InputDocument pdf = pdf("thesis.pdf", 10);

        OperationResult result = dispatcher.dispatch(DocumentOperation.SPLIT, List.of(pdf),
                                                     Map.of(OperationDispatcher.PARAM_PAGES, "2,4,6-8"));

        assertThat(result.getPageCount()).isEqualTo(5);
        assertThat(result.getOriginalSize()).isEqualTo(pdf.size());
        assertThat(result.getArtifactRef()).endsWith("_split_thesis.pdf");
        assertThat(TestDocuments.pageWidths(artifactStore.get(result.getArtifactRef())))
                .containsExactly(202, 204, 206, 207, 208);
    }

    @Test
    void splitWithNothingInRangeIsRejected() throws Exception {
        InputDocument pdf = pdf("thesis.pdf", 10);

        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.SPLIT, List.of(pdf),
                                                     Map.of(OperationDispatcher.PARAM_PAGES, "20-30")))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("No valid pages selected");
        assertThat(storedFileCount()).isZero();
    }

    @Test
    void splitWithoutPagesIsRejected() throws Exception {
        InputDocument pdf = pdf("thesis.pdf", 3);

        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.SPLIT, List.of(pdf), Map.of()))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("Page range required");
    }

    @Test
    void organiseKeepsOrderAndRepeats() throws Exception {
        OperationResult result = dispatcher.dispatch(DocumentOperation.ORGANISE, List.of(pdf("a.pdf", 3)),
                                                     Map.of(OperationDispatcher.PARAM_PAGE_ORDER, "3,1,3"));

        assertThat(TestDocuments.pageWidths(artifactStore.get(result.getArtifactRef())))
                .containsExactly(203, 201, 203);
    }

    @Test
    void organiseWithInvalidOrderIsRejected() throws Exception {
        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.ORGANISE, List.of(pdf("a.pdf", 3)),
                                                     Map.of(OperationDispatcher.PARAM_PAGE_ORDER, "9, x")))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("Invalid page order");
    }

    @Test
    void mergeConcatenatesInSubmissionOrder() throws Exception {
        InputDocument first = new InputDocument("a.pdf", "application/pdf", TestDocuments.createPdf(2, 200));
        InputDocument second = new InputDocument("b.pdf", "application/pdf", TestDocuments.createPdf(1, 300));

        OperationResult result = dispatcher.dispatch(DocumentOperation.MERGE, List.of(first, second), Map.of());

        assertThat(result.getPageCount()).isEqualTo(3);
        assertThat(TestDocuments.pageWidths(artifactStore.get(result.getArtifactRef())))
                .containsExactly(201, 202, 301);
    }

    @Test
    void mergeNeedsAtLeastTwoFiles() throws Exception {
        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.MERGE, List.of(pdf("a.pdf", 1)), Map.of()))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("At least 2 files required");
    }

    @Test
    void oversizedUploadIsRejectedBeforeProcessing() throws Exception {
        config.setMaxUploadSize(10);

        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.COMPRESS, List.of(pdf("a.pdf", 1)), Map.of()))
                .isInstanceOf(RequestValidationException.class);
        assertThat(storedFileCount()).isZero();
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.VALIDATE, List.of(), Map.of()))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("No file uploaded");
    }

    @Test
    void validateReportsReadyForSmallReadablePdf() throws Exception {
        OperationResult result = dispatcher.dispatch(DocumentOperation.VALIDATE, List.of(pdf("ok.pdf", 4)), Map.of());

        assertThat(result.getStatus()).isEqualTo(ValidationStatus.READY);
        assertThat(result.getPageCount()).isEqualTo(4);
        assertThat(result.getFilename()).isEqualTo("ok.pdf");
        assertThat(result.getArtifactRef()).isNull();
        assertThat(storedFileCount()).isZero();
    }

    @Test
    void validateReportsRiskyAboveThreshold() throws Exception {
        config.setRiskySizeThreshold(100);

        OperationResult result = dispatcher.dispatch(DocumentOperation.VALIDATE, List.of(pdf("big.pdf", 2)), Map.of());

        assertThat(result.getStatus()).isEqualTo(ValidationStatus.RISKY);
        assertThat(result.getPageCount()).isEqualTo(2);
    }

    @Test
    void validateReportsInvalidForCorruptedBytes() {
        InputDocument garbage = new InputDocument("bad.pdf", "application/pdf",
                                                  "%PDF-1.4 truncated".getBytes(StandardCharsets.UTF_8));

        OperationResult result = dispatcher.dispatch(DocumentOperation.VALIDATE, List.of(garbage), Map.of());

        assertThat(result.getStatus()).isEqualTo(ValidationStatus.INVALID);
        assertThat(result.getMessage()).isEqualTo("Corrupted or not a valid PDF");
    }

    @Test
    void validateReportsInvalidForEmptyUpload() {
        InputDocument empty = new InputDocument("x.pdf", "application/pdf", new byte[0]);

        OperationResult result = dispatcher.dispatch(DocumentOperation.VALIDATE, List.of(empty), Map.of());

        assertThat(result.getStatus()).isEqualTo(ValidationStatus.INVALID);
        assertThat(result.getMessage()).isEqualTo("Corrupted or not a valid PDF");
        assertThat(result.getSize()).isZero();
        assertThat(result.getPageCount()).isNull();
    }

    @Test
    void emptyUploadIsRejectedByOtherOperations() {
        InputDocument empty = new InputDocument("x.pdf", "application/pdf", new byte[0]);

        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.COMPRESS, List.of(empty), Map.of()))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("Uploaded file is empty");
    }

    @Test
    void validateReportsInvalidForPasswordProtectedPdf() throws Exception {
        for (String userPassword : List.of("user-secret", "")) {
            InputDocument locked = new InputDocument("locked.pdf", "application/pdf",
                                                     TestDocuments.createProtectedPdf(userPassword));

            OperationResult result = dispatcher.dispatch(DocumentOperation.VALIDATE, List.of(locked), Map.of());

            assertThat(result.getStatus()).isEqualTo(ValidationStatus.INVALID);
            assertThat(result.getMessage()).isEqualTo("PDF is password protected");
        }
    }

    @Test
    void renameSanitizesTheNameAndKeepsContent() throws Exception {
        InputDocument pdf = pdf("scan.pdf", 1);
        Map<String, String> params = new HashMap<>();
        params.put(OperationDispatcher.PARAM_ROLL_NO, "21/CS 042");
        params.put(OperationDispatcher.PARAM_SUBJECT, "../Physics");
        params.put(OperationDispatcher.PARAM_TYPE, "Lab");
        params.put(OperationDispatcher.PARAM_DATE, "2024-03-01");

        OperationResult result = dispatcher.dispatch(DocumentOperation.RENAME, List.of(pdf), params);

        assertThat(result.getFilename()).isEqualTo("21CS042_..Physics_Lab_2024-03-01.pdf");
        assertThat(result.getFilename()).doesNotContain("/");
        assertThat(artifactStore.get(result.getArtifactRef())).isEqualTo(pdf.getContent());
    }

    @Test
    void renameRequiresEveryPart() throws Exception {
        Map<String, String> params = Map.of(OperationDispatcher.PARAM_ROLL_NO, "21CS042");

        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.RENAME, List.of(pdf("a.pdf", 1)), params))
                .isInstanceOf(RequestValidationException.class);
    }

    @Test
    void rotateAppliesValidEntriesAndDropsTheRest() throws Exception {
        String rotations = "{\"1\": 90, \"x\": 180, \"2\": \"abc\", \"3\": \"-90\"}";

        OperationResult result = dispatcher.dispatch(DocumentOperation.ROTATE, List.of(pdf("a.pdf", 3)),
                                                     Map.of(OperationDispatcher.PARAM_ROTATIONS, rotations));

        try (PDDocument rotated = Loader.loadPDF(artifactStore.get(result.getArtifactRef()))) {
            assertThat(rotated.getPage(0).getRotation()).isEqualTo(90);
            assertThat(rotated.getPage(1).getRotation()).isZero();
            assertThat(rotated.getPage(2).getRotation()).isEqualTo(270);
        }
    }

    @Test
    void rotationValuesOutsideIntRangeAreDropped() throws Exception {
        OperationResult result = dispatcher.dispatch(DocumentOperation.ROTATE, List.of(pdf("a.pdf", 2)),
                                                     Map.of(OperationDispatcher.PARAM_ROTATIONS,
                                                            "{\"1\": 4294967386, \"2\": 90}"));

        try (PDDocument rotated = Loader.loadPDF(artifactStore.get(result.getArtifactRef()))) {
            assertThat(rotated.getPage(0).getRotation()).isZero();
            assertThat(rotated.getPage(1).getRotation()).isEqualTo(90);
        }
    }

    @Test
    void rotateWithMalformedJsonIsRejected() throws Exception {
        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.ROTATE, List.of(pdf("a.pdf", 1)),
                                                     Map.of(OperationDispatcher.PARAM_ROTATIONS, "{not json")))
                .isInstanceOf(JsonParsingException.class);
    }

    @Test
    void imagesBecomePagesAndUnsupportedFilesAreSkipped() throws Exception {
        InputDocument png = new InputDocument("a.png", "image/png", TestDocuments.createImage("png", 40, 30));
        InputDocument text = new InputDocument("notes.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8));
        InputDocument jpg = new InputDocument("b.jpg", "image/jpeg", TestDocuments.createImage("jpg", 50, 20));

        OperationResult result = dispatcher.dispatch(DocumentOperation.IMAGE_TO_PDF, List.of(png, text, jpg), Map.of());

        assertThat(result.getPageCount()).isEqualTo(2);
        assertThat(TestDocuments.pageWidths(artifactStore.get(result.getArtifactRef()))).containsExactly(40, 50);
    }

    @Test
    void imagesWithNothingEmbeddableAreRejected() {
        InputDocument text = new InputDocument("notes.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.IMAGE_TO_PDF, List.of(text), Map.of()))
                .isInstanceOf(RequestValidationException.class);
        assertThat(storedFileCount()).isZero();
    }

    @Test
    void metadataKeepsTheUploadedFileName() throws Exception {
        Map<String, String> params = new HashMap<>();
        params.put(OperationDispatcher.PARAM_TITLE, "Lab Report");
        params.put(OperationDispatcher.PARAM_KEYWORDS, "physics, optics");

        OperationResult result = dispatcher.dispatch(DocumentOperation.METADATA, List.of(pdf("report.pdf", 1)), params);

        assertThat(result.getFilename()).isEqualTo("report.pdf");
        try (PDDocument updated = Loader.loadPDF(artifactStore.get(result.getArtifactRef()))) {
            assertThat(updated.getDocumentInformation().getTitle()).isEqualTo("Lab Report");
            assertThat(updated.getDocumentInformation().getKeywords()).isEqualTo("physics optics");
            assertThat(updated.getDocumentInformation().getProducer()).isEqualTo("College Submission Toolkit");
        }
    }

    @Test
    void compressWithoutGhostscriptFallsBackWithWarning() throws Exception {
        OperationResult result = dispatcher.dispatch(DocumentOperation.COMPRESS, List.of(pdf("big.pdf", 2)),
                                                     Map.of(OperationDispatcher.PARAM_TARGET_SIZE, "100"));

        assertThat(result.getWarning()).isEqualTo("Basic optimization only. Install Ghostscript for maximum compression.");
        assertThat(result.getArtifactRef()).endsWith("_compressed_big.pdf");
    }

    @Test
    void compressRejectsNonNumericTarget() throws Exception {
        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.COMPRESS, List.of(pdf("a.pdf", 1)),
                                                     Map.of(OperationDispatcher.PARAM_TARGET_SIZE, "small")))
                .isInstanceOf(RequestValidationException.class);
    }

    @Test
    void pdfToWordStoresTheConvertedDocument() throws Exception {
        BDDMockito.given(libreOfficeConverter.convertToWord(any(Path.class), any(Path.class), anyString()))
                  .willAnswer(invocation -> {
                      Path outputDir = invocation.getArgument(1);
                      return Files.write(outputDir.resolve("input.docx"), new byte[]{4, 5, 6});
                  });

        OperationResult result = dispatcher.dispatch(DocumentOperation.PDF_TO_WORD, List.of(pdf("essay.pdf", 1)),
                                                     Map.of());

        assertThat(result.getArtifactRef()).endsWith("_essay.docx");
        assertThat(artifactStore.get(result.getArtifactRef())).containsExactly(4, 5, 6);
    }

    @Test
    void pdfToWordWithoutLibreOfficeIsUnavailable() throws Exception {
        BDDMockito.given(libreOfficeConverter.convertToWord(any(Path.class), any(Path.class), anyString()))
                  .willThrow(new ToolUnavailableException("LibreOffice is not installed."));

        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.PDF_TO_WORD, List.of(pdf("essay.pdf", 1)),
                                                     Map.of()))
                .isInstanceOf(ToolUnavailableException.class);
    }

    @Test
    void unexpectedFailuresAreWrapped() throws Exception {
        BDDMockito.given(libreOfficeConverter.convertToWord(any(Path.class), any(Path.class), anyString()))
                  .willThrow(new IllegalStateException("/tmp/secret/path exploded"));

        assertThatThrownBy(() -> dispatcher.dispatch(DocumentOperation.PDF_TO_WORD, List.of(pdf("essay.pdf", 1)),
                                                     Map.of()))
                .isInstanceOf(OperationException.class)
                .hasMessageNotContaining("/tmp");
    }

    private static InputDocument pdf(String name, int pages) throws Exception {
        return new InputDocument(name, "application/pdf", TestDocuments.createPdf(pages));
    }

    private long storedFileCount() {
        try (Stream<Path> files = Files.list(storeDir)) {
            return files.count();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
