package com.eyelevel.pdftoolkit.service.tool;

import com.eyelevel.pdftoolkit.common.processexec.CommandRunner;
import com.eyelevel.pdftoolkit.common.processexec.CommandRunner.ProcessResult;
import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.ToolExecutionException;
import com.eyelevel.pdftoolkit.exception.ToolUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LibreOfficeConverterTest {

    @TempDir
    Path workDir;

    private final ToolkitProcessingConfig config = new ToolkitProcessingConfig();

    @Test
    void convertsWithIsolatedProfileAndWordImportFilter() throws Exception {
        List<List<String>> commands = new ArrayList<>();
        AtomicReference<Path> profile = new AtomicReference<>();
        CommandRunner runner = (command, contextInfo, timeout, processName) -> {
            commands.add(command);
            if (command.contains("--version")) {
                return new ProcessResult(0, "LibreOffice 7.6", "");
            }
            String installation = command.get(1).substring("-env:UserInstallation=file://".length());
            profile.set(Path.of(installation));
            Files.write(workDir.resolve("input.docx"), new byte[]{1, 2, 3});
            return new ProcessResult(0, "", "");
        };
        Path input = Files.write(workDir.resolve("input.pdf"), new byte[]{9});

        Path docx = converter(runner).convertToWord(input, workDir, "test");

        assertThat(docx).isEqualTo(workDir.resolve("input.docx"));
        List<String> conversion = commands.get(commands.size() - 1);
        assertThat(conversion.get(0)).isEqualTo("soffice");
        assertThat(conversion).contains("--headless", "--infilter=writer_pdf_import", "--convert-to", "docx",
                                        "--outdir");
        assertThat(conversion.get(1)).startsWith("-env:UserInstallation=file://");
        assertThat(profile.get()).doesNotExist();
    }

    @Test
    void missingOutputIsAnExecutionFailure() throws Exception {
        CommandRunner runner = (command, contextInfo, timeout, processName) -> new ProcessResult(0, "", "");
        Path input = Files.write(workDir.resolve("input.pdf"), new byte[]{9});

        assertThatThrownBy(() -> converter(runner).convertToWord(input, workDir, "test"))
                .isInstanceOf(ToolExecutionException.class);
    }

    @Test
    void absentLibreOfficeIsUnavailable() throws Exception {
        CommandRunner runner = (command, contextInfo, timeout, processName) -> {
            throw new IOException("Cannot run program");
        };
        Path input = Files.write(workDir.resolve("input.pdf"), new byte[]{9});
        LibreOfficeConverter converter = converter(runner);

        assertThat(converter.isAvailable()).isFalse();
        assertThatThrownBy(() -> converter.convertToWord(input, workDir, "test"))
                .isInstanceOf(ToolUnavailableException.class);
    }

    private LibreOfficeConverter converter(CommandRunner runner) {
        return new LibreOfficeConverter(config, new ToolLocator(runner),
                                        new LibreOfficeConversionService(config, runner));
    }
}
