package com.eyelevel.pdftoolkit.exception.handler;

import com.eyelevel.pdftoolkit.dto.common.ToolkitResponse;
import com.eyelevel.pdftoolkit.exception.CompressionFailedException;
import com.eyelevel.pdftoolkit.exception.DocumentLoadException;
import com.eyelevel.pdftoolkit.exception.DocumentProcessingException;
import com.eyelevel.pdftoolkit.exception.FileProtectedException;
import com.eyelevel.pdftoolkit.exception.RequestValidationException;
import com.eyelevel.pdftoolkit.exception.ToolExecutionException;
import com.eyelevel.pdftoolkit.exception.ToolTimeoutException;
import com.eyelevel.pdftoolkit.exception.ToolUnavailableException;
import com.eyelevel.pdftoolkit.exception.apiclient.ApiException;
import com.eyelevel.pdftoolkit.exception.json.JsonParsingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.util.Objects;

/**
 * A centralized exception handler for the entire application.
 * It converts exceptions thrown from controllers into a {@link ToolkitResponse} carrying an
 * {@code error} field, with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles missing or malformed operation inputs. (400 Bad Request)
     */
    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<ToolkitResponse> handleRequestValidation(RequestValidationException ex) {
        log.warn("Request Validation Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ToolkitResponse.error(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles JSON form fields that cannot be parsed, such as the rotation map. (400 Bad Request)
     */
    @ExceptionHandler(JsonParsingException.class)
    public ResponseEntity<ToolkitResponse> handleJsonParsing(JsonParsingException ex) {
        log.warn("Handling JsonParsingException: {}", ex.getMessage());
        return new ResponseEntity<>(ToolkitResponse.error("Invalid JSON in request parameter."), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles missing multipart files. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ToolkitResponse> handleMissingPart(MissingServletRequestPartException ex) {
        String errorMessage = String.format("Required part '%s' is missing.", ex.getRequestPartName());
        log.warn("Handling MissingServletRequestPartException: {}", errorMessage);
        return new ResponseEntity<>(ToolkitResponse.error("No file uploaded", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles missing required request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ToolkitResponse> handleMissingServletRequestParameter(MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(),
                                            ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return new ResponseEntity<>(ToolkitResponse.error("Required parameter is missing.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles type mismatch errors for path variables or request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ToolkitResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                                            ex.getName(), ex.getRequiredType() != null
                                                    ? ex.getRequiredType().getSimpleName()
                                                    : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return new ResponseEntity<>(ToolkitResponse.error("Invalid parameter type provided.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles exceptions that carry their own HTTP status, such as unknown or expired download artifacts.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ToolkitResponse> handleApiException(ApiException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (status.is5xxServerError()) {
            log.error("API Exception ({}): {}", status.value(), ex.getMessage(), ex);
        } else {
            log.warn("API Exception ({}): {}", status.value(), ex.getMessage());
        }
        return new ResponseEntity<>(ToolkitResponse.error(ex.getMessage()), status);
    }

    /**
     * Handles invalid URLs that don't map to any controller. (404 Not Found)
     * NOTE: Requires 'spring.mvc.throw-exception-if-no-handler-found=true' in properties.
     */
    @ExceptionHandler(NoHandlerFoundException.class)
    public ResponseEntity<ToolkitResponse> handleNoHandlerFound(NoHandlerFoundException ex) {
        String errorMessage = String.format("No endpoint %s found for %s", ex.getHttpMethod(), ex.getRequestURL());
        log.warn("Handling NoHandlerFoundException: {}", errorMessage);
        return new ResponseEntity<>(ToolkitResponse.error("Resource not found.", errorMessage), HttpStatus.NOT_FOUND);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ToolkitResponse> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                                            ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return new ResponseEntity<>(ToolkitResponse.error("Method not allowed.", errorMessage),
                                    HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles uploads above the configured multipart limit. (413 Payload Too Large)
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ToolkitResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Handling MaxUploadSizeExceededException: {}", ex.getMessage());
        return new ResponseEntity<>(ToolkitResponse.error("File too large"), HttpStatus.PAYLOAD_TOO_LARGE);
    }

    /**
     * Handles multipart requests that could not be parsed. (400 Bad Request)
     */
    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ToolkitResponse> handleMultipart(MultipartException ex) {
        log.warn("Handling MultipartException: {}", ex.getMessage());
        return new ResponseEntity<>(ToolkitResponse.error("Malformed upload."), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles documents that cannot be opened: corrupted, not a PDF, or password protected. (422 Unprocessable Entity)
     */
    @ExceptionHandler({DocumentLoadException.class, FileProtectedException.class})
    public ResponseEntity<ToolkitResponse> handleUnprocessableDocument(DocumentProcessingException ex) {
        log.warn("Unprocessable Document: {}", ex.getMessage());
        return new ResponseEntity<>(ToolkitResponse.error(ex.getMessage()), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles a required external tool that is not installed. (503 Service Unavailable)
     */
    @ExceptionHandler(ToolUnavailableException.class)
    public ResponseEntity<ToolkitResponse> handleToolUnavailable(ToolUnavailableException ex) {
        log.error("Tool Unavailable Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ToolkitResponse.error(ex.getMessage()), HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Handles external tools that exceeded their time budget. (504 Gateway Timeout)
     */
    @ExceptionHandler(ToolTimeoutException.class)
    public ResponseEntity<ToolkitResponse> handleToolTimeout(ToolTimeoutException ex) {
        log.error("Tool Timeout Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ToolkitResponse.error("Processing took too long and was aborted."),
                                    HttpStatus.GATEWAY_TIMEOUT);
    }

    /**
     * Handles compression and external tool failures. (500 Internal Server Error)
     */
    @ExceptionHandler({CompressionFailedException.class, ToolExecutionException.class})
    public ResponseEntity<ToolkitResponse> handleProcessingFailure(DocumentProcessingException ex) {
        log.error("Processing Failure: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(ToolkitResponse.error(ex.getMessage()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * Handles every other processing failure, including {@code OperationException}. (500 Internal Server Error)
     */
    @ExceptionHandler(DocumentProcessingException.class)
    public ResponseEntity<ToolkitResponse> handleDocumentProcessing(DocumentProcessingException ex) {
        log.error("Document Processing Exception: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(ToolkitResponse.error(ex.getMessage()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * A catch-all handler for any other unhandled exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ToolkitResponse> handleAllUncaughtException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return new ResponseEntity<>(ToolkitResponse.error("An unexpected internal error occurred."),
                                    HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
