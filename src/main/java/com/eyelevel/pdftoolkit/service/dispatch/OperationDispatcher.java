package com.eyelevel.pdftoolkit.service.dispatch;

import com.eyelevel.pdftoolkit.common.json.JsonParser;
import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.DocumentLoadException;
import com.eyelevel.pdftoolkit.exception.DocumentProcessingException;
import com.eyelevel.pdftoolkit.exception.FileProtectedException;
import com.eyelevel.pdftoolkit.exception.OperationException;
import com.eyelevel.pdftoolkit.exception.RequestValidationException;
import com.eyelevel.pdftoolkit.exception.apiclient.ApiException;
import com.eyelevel.pdftoolkit.exception.json.JsonParsingException;
import com.eyelevel.pdftoolkit.model.Artifact;
import com.eyelevel.pdftoolkit.model.CompressionResult;
import com.eyelevel.pdftoolkit.model.DocumentMetadata;
import com.eyelevel.pdftoolkit.model.DocumentOperation;
import com.eyelevel.pdftoolkit.model.InputDocument;
import com.eyelevel.pdftoolkit.model.OperationResult;
import com.eyelevel.pdftoolkit.model.OperationState;
import com.eyelevel.pdftoolkit.model.PageSelectionMode;
import com.eyelevel.pdftoolkit.model.SubmissionName;
import com.eyelevel.pdftoolkit.model.ValidationReport;
import com.eyelevel.pdftoolkit.model.ValidationStatus;
import com.eyelevel.pdftoolkit.service.compression.PdfCompressionService;
import com.eyelevel.pdftoolkit.service.document.PdfDocumentAdapter;
import com.eyelevel.pdftoolkit.service.range.PageRangeSelector;
import com.eyelevel.pdftoolkit.service.storage.ArtifactStore;
import com.eyelevel.pdftoolkit.service.tool.LibreOfficeConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single entry point for every document operation.
 *
 * <p>A request moves through {@link OperationState#RECEIVED}, {@link OperationState#VALIDATED} and
 * {@link OperationState#EXECUTING} to either {@link OperationState#SUCCEEDED} or
 * {@link OperationState#FAILED}. All input checks happen before any document is parsed or any tool
 * is started, and every successful operation except validation yields exactly one artifact.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperationDispatcher {

    public static final String PARAM_TARGET_SIZE = "targetSize";
    public static final String PARAM_PAGES = "pages";
    public static final String PARAM_PAGE_ORDER = "pageOrder";
    public static final String PARAM_ROTATIONS = "rotations";
    public static final String PARAM_TITLE = "title";
    public static final String PARAM_AUTHOR = "author";
    public static final String PARAM_SUBJECT = "subject";
    public static final String PARAM_KEYWORDS = "keywords";
    public static final String PARAM_ROLL_NO = "rollNo";
    public static final String PARAM_TYPE = "type";
    public static final String PARAM_DATE = "date";

    private static final String PASSWORD_PROTECTED = "PDF is password protected";
    private static final String NOT_A_PDF = "Corrupted or not a valid PDF";

    private final ToolkitProcessingConfig config;
    private final PageRangeSelector rangeSelector;
    private final PdfDocumentAdapter documentAdapter;
    private final PdfCompressionService compressionService;
    private final LibreOfficeConverter libreOfficeConverter;
    private final ArtifactStore artifactStore;
    private final JsonParser jsonParser;

    /**
     * Validates and executes one operation.
     *
     * @param operation The requested operation.
     * @param files     Uploaded files in submission order.
     * @param params    Form parameters; absent keys mean the parameter was not sent.
     * @return The normalized result.
     * @throws RequestValidationException if inputs or parameters are missing or malformed.
     * @throws DocumentProcessingException for typed processing failures.
     */
    public OperationResult dispatch(DocumentOperation operation, List<InputDocument> files, Map<String, String> params) {
        String contextInfo = operation.getPath() + "-" + UUID.randomUUID().toString().substring(0, 8);
        List<InputDocument> inputs = files == null ? List.of() : files;
        Map<String, String> parameters = params == null ? Map.of() : params;
        log.info("[{}] {} with {} file(s).", contextInfo, OperationState.RECEIVED, inputs.size());

        try {
            validate(operation, inputs, parameters);
            log.debug("[{}] {}", contextInfo, OperationState.VALIDATED);

            log.debug("[{}] {}", contextInfo, OperationState.EXECUTING);
            OperationResult result = execute(operation, inputs, parameters, contextInfo);

            log.info("[{}] {}: '{}' ({} bytes).", contextInfo, OperationState.SUCCEEDED, result.getFilename(),
                     result.getSize());
            return result;
        } catch (DocumentProcessingException | ApiException | JsonParsingException e) {
            log.warn("[{}] {}: {}", contextInfo, OperationState.FAILED, e.getMessage());
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("[{}] {} with an unexpected error.", contextInfo, OperationState.FAILED, e);
            throw new OperationException("Failed to " + describe(operation) + ".", e);
        }
    }

    private void validate(DocumentOperation operation, List<InputDocument> files, Map<String, String> params) {
        long totalSize = files.stream().mapToLong(InputDocument::size).sum();
        if (totalSize > config.getMaxUploadSize()) {
            throw new RequestValidationException(
                    String.format("Upload of %d bytes exceeds the limit of %d bytes.", totalSize,
                                  config.getMaxUploadSize()));
        }

        switch (operation) {
            case MERGE -> {
                if (files.size() < 2) {
                    throw new RequestValidationException("At least 2 files required");
                }
                requireNonEmpty(files);
            }
            case IMAGE_TO_PDF -> {
                if (files.isEmpty()) {
                    throw new RequestValidationException("No images uploaded");
                }
            }
            case VALIDATE -> {
                // empty bytes are reported as INVALID, not rejected
                if (files.isEmpty()) {
                    throw new RequestValidationException("No file uploaded");
                }
            }
            default -> {
                if (files.isEmpty()) {
                    throw new RequestValidationException("No file uploaded");
                }
                requireNonEmpty(files.subList(0, 1));
            }
        }

        switch (operation) {
            case COMPRESS -> parseTargetSize(params.get(PARAM_TARGET_SIZE));
            case SPLIT -> requireParam(params, PARAM_PAGES, "Page range required");
            case ORGANISE -> requireParam(params, PARAM_PAGE_ORDER, "Page order required");
            case ROTATE -> requireParam(params, PARAM_ROTATIONS, "Rotation data required");
            case RENAME -> {
                for (String key : List.of(PARAM_ROLL_NO, PARAM_SUBJECT, PARAM_TYPE, PARAM_DATE)) {
                    requireParam(params, key, "rollNo, subject, type and date are required");
                }
            }
            default -> {
                // no parameters to check
            }
        }
    }

    private OperationResult execute(DocumentOperation operation, List<InputDocument> files, Map<String, String> params,
                                    String contextInfo) throws IOException {
        return switch (operation) {
            case COMPRESS -> compress(files.get(0), params, contextInfo);
            case MERGE -> merge(files);
            case SPLIT -> selectPages(operation, files.get(0), params.get(PARAM_PAGES), PageSelectionMode.SELECTION,
                                      "No valid pages selected");
            case ORGANISE -> selectPages(operation, files.get(0), params.get(PARAM_PAGE_ORDER),
                                         PageSelectionMode.REORDER, "Invalid page order");
            case ROTATE -> rotate(files.get(0), params.get(PARAM_ROTATIONS));
            case IMAGE_TO_PDF -> imagesToPdf(files);
            case METADATA -> updateMetadata(files.get(0), params);
            case VALIDATE -> toResult(files.get(0), validateDocument(files.get(0)));
            case PDF_TO_WORD -> convertToWord(files.get(0), contextInfo);
            case RENAME -> rename(files.get(0), params);
        };
    }

    private OperationResult compress(InputDocument file, Map<String, String> params, String contextInfo) {
        Long targetSize = parseTargetSize(params.get(PARAM_TARGET_SIZE));
        CompressionResult result = compressionService.compress(file, targetSize, contextInfo);
        return OperationResult.builder()
                              .artifactRef(result.artifact().name())
                              .filename(result.artifact().name())
                              .size(result.artifact().size())
                              .originalSize(result.originalSize())
                              .warning(result.warning())
                              .message(result.message())
                              .build();
    }

    private OperationResult merge(List<InputDocument> files) throws IOException {
        List<PDDocument> sources = new ArrayList<>();
        try {
            for (InputDocument file : files) {
                sources.add(documentAdapter.load(file.getContent()));
            }
            try (PDDocument merged = documentAdapter.merge(sources)) {
                Artifact artifact = artifactStore.put(documentAdapter.save(merged),
                                                      DocumentOperation.MERGE.getArtifactPrefix() + ".pdf");
                return OperationResult.builder()
                                      .artifactRef(artifact.name())
                                      .filename(artifact.name())
                                      .size(artifact.size())
                                      .pageCount(documentAdapter.pageCount(merged))
                                      .build();
            }
        } finally {
            for (PDDocument source : sources) {
                source.close();
            }
        }
    }

    private OperationResult selectPages(DocumentOperation operation, InputDocument file, String spec,
                                        PageSelectionMode mode, String emptySelectionMessage) throws IOException {
        try (PDDocument source = documentAdapter.load(file.getContent())) {
            List<Integer> pages = rangeSelector.parse(spec, documentAdapter.pageCount(source), mode);
            if (pages.isEmpty()) {
                throw new RequestValidationException(emptySelectionMessage);
            }
            try (PDDocument selected = documentAdapter.extractPages(source, rangeSelector.toZeroBased(pages))) {
                Artifact artifact = store(documentAdapter.save(selected), operation, file);
                return OperationResult.builder()
                                      .artifactRef(artifact.name())
                                      .filename(artifact.name())
                                      .size(artifact.size())
                                      .originalSize(file.size())
                                      .pageCount(documentAdapter.pageCount(selected))
                                      .build();
            }
        }
    }

    private OperationResult rotate(InputDocument file, String rotationsJson) throws IOException {
        Map<Integer, Integer> rotations = parseRotations(rotationsJson);
        try (PDDocument document = documentAdapter.load(file.getContent())) {
            documentAdapter.rotate(document, rotations);
            Artifact artifact = store(documentAdapter.save(document), DocumentOperation.ROTATE, file);
            return OperationResult.builder()
                                  .artifactRef(artifact.name())
                                  .filename(artifact.name())
                                  .size(artifact.size())
                                  .originalSize(file.size())
                                  .build();
        }
    }

    private OperationResult imagesToPdf(List<InputDocument> images) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (InputDocument image : images) {
                if (!documentAdapter.embedRasterPage(document, image.getContent(), image.getMediaType())) {
                    log.warn("Skipped '{}' ({}): not a supported image.", image.getOriginalName(),
                             image.getMediaType());
                }
            }
            if (documentAdapter.pageCount(document) == 0) {
                throw new RequestValidationException("None of the uploaded files is a supported JPEG or PNG image");
            }
            Artifact artifact = artifactStore.put(documentAdapter.save(document),
                                                  DocumentOperation.IMAGE_TO_PDF.getArtifactPrefix() + ".pdf");
            return OperationResult.builder()
                                  .artifactRef(artifact.name())
                                  .filename(artifact.name())
                                  .size(artifact.size())
                                  .pageCount(documentAdapter.pageCount(document))
                                  .build();
        }
    }

    private OperationResult updateMetadata(InputDocument file, Map<String, String> params) throws IOException {
        DocumentMetadata metadata = DocumentMetadata.builder()
                                                    .title(params.get(PARAM_TITLE))
                                                    .author(params.get(PARAM_AUTHOR))
                                                    .subject(params.get(PARAM_SUBJECT))
                                                    .keywords(params.get(PARAM_KEYWORDS))
                                                    .build();
        try (PDDocument document = documentAdapter.load(file.getContent())) {
            documentAdapter.setMetadata(document, metadata);
            Artifact artifact = store(documentAdapter.save(document), DocumentOperation.METADATA, file);
            return OperationResult.builder()
                                  .artifactRef(artifact.name())
                                  .filename(file.getOriginalName())
                                  .size(artifact.size())
                                  .build();
        }
    }

    /**
     * Pre-flight check. Problems with the document are reported in the result, never thrown.
     */
    ValidationReport validateDocument(InputDocument file) throws IOException {
        long size = file.size();
        PDDocument document;
        try {
            document = documentAdapter.load(file.getContent());
        } catch (FileProtectedException e) {
            return ValidationReport.invalid(size, PASSWORD_PROTECTED);
        } catch (DocumentLoadException e) {
            return ValidationReport.invalid(size, NOT_A_PDF);
        }

        try (document) {
            if (documentAdapter.isEncrypted(document)) {
                return ValidationReport.invalid(size, PASSWORD_PROTECTED);
            }
            ValidationStatus status = size > config.getRiskySizeThreshold() ? ValidationStatus.RISKY
                                                                             : ValidationStatus.READY;
            return new ValidationReport(status, documentAdapter.pageCount(document), size, null);
        }
    }

    private OperationResult toResult(InputDocument file, ValidationReport report) {
        return OperationResult.builder()
                              .filename(file.getOriginalName())
                              .size(report.size())
                              .pageCount(report.status() == ValidationStatus.INVALID ? null : report.pageCount())
                              .status(report.status())
                              .message(report.message())
                              .build();
    }

    private OperationResult convertToWord(InputDocument file, String contextInfo) throws IOException {
        documentAdapter.load(file.getContent()).close();

        Path scratchDir = Files.createTempDirectory("pdf-to-word-");
        try {
            Path input = scratchDir.resolve("input.pdf");
            Files.write(input, file.getContent());
            Path docx = libreOfficeConverter.convertToWord(input, scratchDir, contextInfo);

            String wordName = FilenameUtils.getBaseName(file.getOriginalName()) + ".docx";
            Artifact artifact = artifactStore.put(docx, wordName);
            return OperationResult.builder()
                                  .artifactRef(artifact.name())
                                  .filename(artifact.name())
                                  .size(artifact.size())
                                  .originalSize(file.size())
                                  .build();
        } finally {
            try {
                FileUtils.deleteDirectory(scratchDir.toFile());
            } catch (IOException e) {
                log.warn("[{}] Failed to clean up scratch directory {}: {}", contextInfo, scratchDir, e.getMessage());
            }
        }
    }

    private OperationResult rename(InputDocument file, Map<String, String> params) {
        String newName = SubmissionName.builder()
                                       .rollNo(params.get(PARAM_ROLL_NO))
                                       .subject(params.get(PARAM_SUBJECT))
                                       .type(params.get(PARAM_TYPE))
                                       .date(params.get(PARAM_DATE))
                                       .build()
                                       .toFileName();
        Artifact artifact = artifactStore.put(file.getContent(), newName);
        return OperationResult.builder()
                              .artifactRef(artifact.name())
                              .filename(newName)
                              .size(artifact.size())
                              .build();
    }

    private Artifact store(byte[] content, DocumentOperation operation, InputDocument source) {
        return artifactStore.put(content, operation.getArtifactPrefix() + "_" + source.getOriginalName());
    }

    /**
     * Reads a JSON object of page number to degrees. Entries whose key or value is not an integer that
     * fits in an {@code int} are dropped.
     */
    Map<Integer, Integer> parseRotations(String rotationsJson) {
        Map<?, ?> raw = jsonParser.parseObject(rotationsJson, Map.class);
        Map<Integer, Integer> rotations = new LinkedHashMap<>();
        if (CollectionUtils.isEmpty(raw)) {
            return rotations;
        }
        raw.forEach((key, value) -> {
            Integer page = toInteger(key);
            Integer degrees = toInteger(value);
            if (page != null && degrees != null) {
                rotations.put(page, degrees);
            } else {
                log.debug("Dropping rotation entry {}={}.", key, value);
            }
        });
        return rotations;
    }

    private Long parseTargetSize(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new RequestValidationException("targetSize must be a whole number of bytes", e);
        }
    }

    private static Integer toInteger(Object value) {
        if (value instanceof Integer number) {
            return number;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            log.debug("Dropping out-of-range value {}.", value);
            return null;
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static void requireParam(Map<String, String> params, String key, String message) {
        if (!StringUtils.hasText(params.get(key))) {
            throw new RequestValidationException(message);
        }
    }

    private static void requireNonEmpty(List<InputDocument> files) {
        for (InputDocument file : files) {
            if (file == null || file.isEmpty()) {
                throw new RequestValidationException("Uploaded file is empty");
            }
        }
    }

    private static String describe(DocumentOperation operation) {
        return operation.getPath().replace('-', ' ');
    }
}
