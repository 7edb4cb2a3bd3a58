package com.eyelevel.pdftoolkit.config;

import com.eyelevel.pdftoolkit.model.GhostscriptPreset;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. This provides centralized control over upload limits, artifact lifetime
 * and the external tools used by the processing engine.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.processing")
public class ToolkitProcessingConfig {

    /**
     * Upper bound for the combined size of all files uploaded in one request.
     */
    @Positive
    private long maxUploadSize = 50L * 1024 * 1024;

    /**
     * Files larger than this are reported as {@code RISKY} by the validate operation.
     */
    @Positive
    private long riskySizeThreshold = 5L * 1024 * 1024;

    /**
     * Producer tag stamped on every document whose metadata is rewritten.
     */
    @NotBlank
    private String producer = "College Submission Toolkit";

    @Valid
    private Artifacts artifacts = new Artifacts();
    @Valid
    private Ghostscript ghostscript = new Ghostscript();
    @Valid
    private LibreOffice libreoffice = new LibreOffice();

    @Data
    public static class RetryConfig {
        @PositiveOrZero
        private int attempts;
        @PositiveOrZero
        private long delayMs;
    }

    @Data
    public static class Artifacts {
        @NotBlank
        private String directory = System.getProperty("java.io.tmpdir") + "/pdf-toolkit";
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Ghostscript {
        @NotEmpty
        private List<String> candidates = new ArrayList<>(List.of("gswin64c", "gswin32c", "gs"));
        @NotEmpty
        private List<GhostscriptPreset> presets = new ArrayList<>(List.of(GhostscriptPreset.values()));
        private GhostscriptPreset defaultPreset = GhostscriptPreset.EBOOK;
        private Duration timeout = Duration.ofMinutes(2);
        private Duration probeTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class LibreOffice {
        @NotEmpty
        private List<String> candidates = new ArrayList<>(List.of("soffice", "libreoffice"));
        private Duration timeout = Duration.ofMinutes(2);
        private Duration probeTimeout = Duration.ofSeconds(30);
        @Valid
        private RetryConfig retry = new RetryConfig();
    }
}
