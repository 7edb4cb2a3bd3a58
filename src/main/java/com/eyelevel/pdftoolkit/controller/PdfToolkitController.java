package com.eyelevel.pdftoolkit.controller;

import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.dto.common.ToolkitResponse;
import com.eyelevel.pdftoolkit.dto.info.ToolkitInfoResponse;
import com.eyelevel.pdftoolkit.exception.OperationException;
import com.eyelevel.pdftoolkit.model.DocumentOperation;
import com.eyelevel.pdftoolkit.model.InputDocument;
import com.eyelevel.pdftoolkit.model.OperationResult;
import com.eyelevel.pdftoolkit.service.dispatch.OperationDispatcher;
import com.eyelevel.pdftoolkit.service.storage.ArtifactStore;
import com.eyelevel.pdftoolkit.service.tool.GhostscriptReducer;
import com.eyelevel.pdftoolkit.service.tool.LibreOfficeConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing every document operation as a multipart endpoint under {@code /api},
 * plus the artifact download endpoint. All operation responses follow the {@link ToolkitResponse} format.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class PdfToolkitController implements PdfToolkitApi {

    private final OperationDispatcher operationDispatcher;
    private final ArtifactStore artifactStore;
    private final GhostscriptReducer ghostscriptReducer;
    private final LibreOfficeConverter libreOfficeConverter;
    private final ToolkitProcessingConfig config;

    @Override
    @PostMapping("/api/compress")
    public ResponseEntity<ToolkitResponse> compress(
            @RequestParam(value = "file", required = false) final MultipartFile file,
            @RequestParam(value = "targetSize", required = false) final String targetSize) {
        Map<String, String> params = new HashMap<>();
        params.put(OperationDispatcher.PARAM_TARGET_SIZE, targetSize);
        return run(DocumentOperation.COMPRESS, single(file), params);
    }

    @Override
    @PostMapping("/api/merge")
    public ResponseEntity<ToolkitResponse> merge(
            @RequestParam(value = "files", required = false) final List<MultipartFile> files) {
        return run(DocumentOperation.MERGE, files, Map.of());
    }

    @Override
    @PostMapping("/api/split")
    public ResponseEntity<ToolkitResponse> split(
            @RequestParam(value = "file", required = false) final MultipartFile file,
            @RequestParam(value = "pages", required = false) final String pages) {
        Map<String, String> params = new HashMap<>();
        params.put(OperationDispatcher.PARAM_PAGES, pages);
        return run(DocumentOperation.SPLIT, single(file), params);
    }

    @Override
    @PostMapping("/api/organise")
    public ResponseEntity<ToolkitResponse> organise(
            @RequestParam(value = "file", required = false) final MultipartFile file,
            @RequestParam(value = "pageOrder", required = false) final String pageOrder) {
        Map<String, String> params = new HashMap<>();
        params.put(OperationDispatcher.PARAM_PAGE_ORDER, pageOrder);
        return run(DocumentOperation.ORGANISE, single(file), params);
    }

    @Override
    @PostMapping("/api/rotate")
    public ResponseEntity<ToolkitResponse> rotate(
            @RequestParam(value = "file", required = false) final MultipartFile file,
            @RequestParam(value = "rotations", required = false) final String rotations) {
        Map<String, String> params = new HashMap<>();
        params.put(OperationDispatcher.PARAM_ROTATIONS, rotations);
        return run(DocumentOperation.ROTATE, single(file), params);
    }

    @Override
    @PostMapping("/api/image-to-pdf")
    public ResponseEntity<ToolkitResponse> imageToPdf(
            @RequestParam(value = "files", required = false) final List<MultipartFile> files) {
        return run(DocumentOperation.IMAGE_TO_PDF, files, Map.of());
    }

    @Override
    @PostMapping("/api/metadata")
    public ResponseEntity<ToolkitResponse> updateMetadata(
            @RequestParam(value = "file", required = false) final MultipartFile file,
            @RequestParam(value = "title", required = false) final String title,
            @RequestParam(value = "author", required = false) final String author,
            @RequestParam(value = "subject", required = false) final String subject,
            @RequestParam(value = "keywords", required = false) final String keywords) {
        Map<String, String> params = new HashMap<>();
        params.put(OperationDispatcher.PARAM_TITLE, title);
        params.put(OperationDispatcher.PARAM_AUTHOR, author);
        params.put(OperationDispatcher.PARAM_SUBJECT, subject);
        params.put(OperationDispatcher.PARAM_KEYWORDS, keywords);
        return run(DocumentOperation.METADATA, single(file), params);
    }

    @Override
    @PostMapping("/api/validate")
    public ResponseEntity<ToolkitResponse> validate(
            @RequestParam(value = "file", required = false) final MultipartFile file) {
        return run(DocumentOperation.VALIDATE, single(file), Map.of());
    }

    @Override
    @PostMapping("/api/pdf-to-word")
    public ResponseEntity<ToolkitResponse> pdfToWord(
            @RequestParam(value = "file", required = false) final MultipartFile file) {
        return run(DocumentOperation.PDF_TO_WORD, single(file), Map.of());
    }

    @Override
    @PostMapping("/api/rename")
    public ResponseEntity<ToolkitResponse> rename(
            @RequestParam(value = "file", required = false) final MultipartFile file,
            @RequestParam(value = "rollNo", required = false) final String rollNo,
            @RequestParam(value = "subject", required = false) final String subject,
            @RequestParam(value = "type", required = false) final String type,
            @RequestParam(value = "date", required = false) final String date) {
        Map<String, String> params = new HashMap<>();
        params.put(OperationDispatcher.PARAM_ROLL_NO, rollNo);
        params.put(OperationDispatcher.PARAM_SUBJECT, subject);
        params.put(OperationDispatcher.PARAM_TYPE, type);
        params.put(OperationDispatcher.PARAM_DATE, date);
        return run(DocumentOperation.RENAME, single(file), params);
    }

    @Override
    @GetMapping("/download/{filename}")
    public ResponseEntity<Resource> download(@PathVariable("filename") final String filename) {
        log.info("Download requested for artifact '{}'.", filename);
        byte[] content = artifactStore.get(filename);
        String downloadName = ArtifactStore.displayName(filename);
        MediaType mediaType = MediaTypeFactory.getMediaType(downloadName).orElse(MediaType.APPLICATION_OCTET_STREAM);

        return ResponseEntity.ok()
                             .contentType(mediaType)
                             .contentLength(content.length)
                             .header(HttpHeaders.CONTENT_DISPOSITION,
                                     ContentDisposition.attachment().filename(downloadName).build().toString())
                             .body(new ByteArrayResource(content));
    }

    @Override
    @GetMapping("/api/info")
    public ResponseEntity<ToolkitInfoResponse> info() {
        ToolkitInfoResponse response = ToolkitInfoResponse.builder()
                                                          .service("PDF Toolkit")
                                                          .ghostscriptAvailable(ghostscriptReducer.isAvailable())
                                                          .libreOfficeAvailable(libreOfficeConverter.isAvailable())
                                                          .maxUploadSize(config.getMaxUploadSize())
                                                          .artifactTtlSeconds(config.getArtifacts().getTtl().toSeconds())
                                                          .build();
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<ToolkitResponse> run(DocumentOperation operation, List<MultipartFile> files,
                                                Map<String, String> params) {
        log.info("Received {} request with {} file(s).", operation, files == null ? 0 : files.size());
        OperationResult result = operationDispatcher.dispatch(operation, toInputDocuments(files), params);
        return ResponseEntity.ok(ToolkitResponse.from(result));
    }

    private static List<MultipartFile> single(MultipartFile file) {
        List<MultipartFile> files = new ArrayList<>();
        if (file != null) {
            files.add(file);
        }
        return files;
    }

    private static List<InputDocument> toInputDocuments(List<MultipartFile> files) {
        List<InputDocument> documents = new ArrayList<>();
        if (files == null) {
            return documents;
        }
        for (MultipartFile file : files) {
            try {
                documents.add(new InputDocument(FilenameUtils.getName(file.getOriginalFilename()), file.getContentType(), file.getBytes()));
            } catch (IOException e) {
                throw new OperationException("Could not read the uploaded file.", e);
            }
        }
        return documents;
    }
}
