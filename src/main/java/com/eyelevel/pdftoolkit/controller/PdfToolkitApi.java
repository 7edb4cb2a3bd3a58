package com.eyelevel.pdftoolkit.controller;

import com.eyelevel.pdftoolkit.dto.common.ToolkitResponse;
import com.eyelevel.pdftoolkit.dto.info.ToolkitInfoResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.core.io.Resource;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Tag(name = "PDF Toolkit", description = "Synchronous PDF operations. Each call returns a short-lived download reference.")
public interface PdfToolkitApi {

    @Operation(summary = "Compress PDF",
            description = "Reduces the file size. With a target size, Ghostscript presets are tried from highest to lowest quality and the first result that fits is returned; otherwise the smallest result. Without Ghostscript only a basic rewrite is done and a warning is returned.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Compressed file created.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ToolkitResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "url": "/download/3f1c2a4e-8d8b-4c57-9a4f-1b2c3d4e5f60_compressed_report.pdf",
                                        "filename": "3f1c2a4e-8d8b-4c57-9a4f-1b2c3d4e5f60_compressed_report.pdf",
                                        "size": 182044,
                                        "originalSize": 1048576
                                    }
                                    """))),
            @ApiResponse(responseCode = "400", description = "Bad Request - no file or a non-numeric target size.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ToolkitResponse.class))),
            @ApiResponse(responseCode = "422", description = "The upload is not a readable PDF or is password protected.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ToolkitResponse.class))),
            @ApiResponse(responseCode = "500", description = "No compression preset produced a result.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ToolkitResponse.class)))
    })
    ResponseEntity<ToolkitResponse> compress(
            @Parameter(description = "The PDF to compress.", required = true) MultipartFile file,
            @Parameter(description = "Desired maximum size in bytes.", example = "204800") String targetSize);

    @Operation(summary = "Merge PDFs", description = "Concatenates two or more PDFs in the order they were submitted.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Merged file created.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ToolkitResponse.class))),
            @ApiResponse(responseCode = "400", description = "Bad Request - fewer than two files.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ToolkitResponse.class)))
    })
    ResponseEntity<ToolkitResponse> merge(@Parameter(description = "The PDFs to merge, in order.") List<MultipartFile> files);

    @Operation(summary = "Split PDF", description = "Extracts the selected pages, e.g. \"1-3,5\", into a new PDF in ascending order.")
    ResponseEntity<ToolkitResponse> split(
            @Parameter(description = "The source PDF.", required = true) MultipartFile file,
            @Parameter(description = "Comma-separated pages and ranges.", example = "1-3,5") String pages);

    @Operation(summary = "Organise PDF", description = "Builds a new PDF from the given page order. Pages may be repeated.")
    ResponseEntity<ToolkitResponse> organise(
            @Parameter(description = "The source PDF.", required = true) MultipartFile file,
            @Parameter(description = "Comma-separated page order.", example = "3,1,2") String pageOrder);

    @Operation(summary = "Rotate pages", description = "Adds the given number of degrees to the rotation of each listed page.")
    ResponseEntity<ToolkitResponse> rotate(
            @Parameter(description = "The source PDF.", required = true) MultipartFile file,
            @Parameter(description = "JSON object of page number to degrees.", example = "{\"1\": 90, \"3\": -90}") String rotations);

    @Operation(summary = "Images to PDF", description = "Places each JPEG or PNG image on its own page. Other files are skipped.")
    ResponseEntity<ToolkitResponse> imageToPdf(@Parameter(description = "The images, in page order.") List<MultipartFile> files);

    @Operation(summary = "Update metadata", description = "Overwrites the given document information fields and stamps the producer.")
    ResponseEntity<ToolkitResponse> updateMetadata(
            @Parameter(description = "The source PDF.", required = true) MultipartFile file,
            String title, String author, String subject,
            @Parameter(description = "Comma-separated keywords.", example = "thesis, physics") String keywords);

    @Operation(summary = "Validate PDF",
            description = "Pre-flight check. Reports READY, RISKY (larger than the risky size threshold) or INVALID (unreadable or password protected). No file is produced.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Validation report.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ToolkitResponse.class),
                            examples = @ExampleObject(name = "Invalid", value = """
                                    {
                                        "filename": "scan.pdf",
                                        "size": 1024,
                                        "status": "INVALID",
                                        "message": "Corrupted or not a valid PDF"
                                    }
                                    """)))
    })
    ResponseEntity<ToolkitResponse> validate(@Parameter(description = "The PDF to check.", required = true) MultipartFile file);

    @Operation(summary = "PDF to Word", description = "Converts a PDF to .docx with LibreOffice.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Word document created.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ToolkitResponse.class))),
            @ApiResponse(responseCode = "503", description = "LibreOffice is not installed on the server.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ToolkitResponse.class)))
    })
    ResponseEntity<ToolkitResponse> pdfToWord(@Parameter(description = "The PDF to convert.", required = true) MultipartFile file);

    @Operation(summary = "Rename for submission", description = "Returns the same file under the name rollNo_subject_type_date.pdf.")
    ResponseEntity<ToolkitResponse> rename(
            @Parameter(description = "The file to rename.", required = true) MultipartFile file,
            @Parameter(example = "21CS042") String rollNo,
            @Parameter(example = "Physics") String subject,
            @Parameter(example = "Assignment") String type,
            @Parameter(example = "2024-03-01") String date);

    @Operation(summary = "Download artifact", description = "Streams a generated file. Files expire a few minutes after creation.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "The file content."),
            @ApiResponse(responseCode = "404", description = "File not found or expired.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ToolkitResponse.class)))
    })
    ResponseEntity<Resource> download(@Parameter(description = "The name from a previous response's url.") String filename);

    @Operation(summary = "Service info", description = "Reports external tool availability and processing limits.")
    ResponseEntity<ToolkitInfoResponse> info();
}
