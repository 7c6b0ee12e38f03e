package org.dxworks.fortframe.analyzer.reader;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.FortframeConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the configured external preprocessor over a whole file. Any failure falls back to the raw text.
 */
public class Preprocessor {

    private final List<String> command;
    private final List<String> macros;
    private final List<Path> includeDirs;
    private final Charset charset;
    private final Diagnostics diagnostics;

    public Preprocessor(FortframeConfig config, Diagnostics diagnostics) {
        this.command = config.getPreprocessor();
        this.macros = config.getMacros();
        this.includeDirs = config.getIncludeDirs();
        this.charset = Charset.forName(config.getEncoding());
        this.diagnostics = diagnostics;
    }

    List<String> commandLine(Path file) {
        List<String> commandLine = new ArrayList<>(command);
        for (String macro : macros) {
            commandLine.add("-D" + macro);
        }
        for (Path dir : includeDirs) {
            commandLine.add("-I" + dir);
        }
        commandLine.add(file.toString());
        return commandLine;
    }

    public String process(Path file, String rawText) {
        List<String> commandLine = commandLine(file);
        try {
            Process process = new ProcessBuilder(commandLine).start();
            process.getOutputStream().close();
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readQuietly(process.getErrorStream()));
            String stdout = new String(process.getInputStream().readAllBytes(), charset);
            int exitCode = process.waitFor();
            String errors = stderr.join();
            if (exitCode != 0) {
                diagnostics.warn("Preprocessing " + file + " failed (exit code " + exitCode + "): "
                        + errors.strip() + ". Reading it unprocessed");
                return rawText;
            }
            return stdout;
        } catch (IOException e) {
            diagnostics.warn("Could not run preprocessor '" + String.join(" ", commandLine) + "' on " + file
                    + ": " + e.getMessage() + ". Reading it unprocessed");
            return rawText;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            diagnostics.warn("Preprocessing " + file + " was interrupted. Reading it unprocessed");
            return rawText;
        }
    }

    private String readQuietly(InputStream stream) {
        try {
            return new String(stream.readAllBytes(), charset);
        } catch (IOException e) {
            return "(stderr unavailable: " + e.getMessage() + ")";
        }
    }
}
