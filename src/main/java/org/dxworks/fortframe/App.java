package org.dxworks.fortframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.fortframe.model.Project;
import org.dxworks.fortframe.model.summary.SummaryBuilder;
import org.dxworks.fortframe.model.summary.UnitSummary;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar fortframe.jar <output-file> <input>...");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.err.println("  <input>:       Fortran source files or directories to scan");
            System.err.println("Settings are read from fortframe-config.yml in the working directory");
            System.exit(2);
        }

        Path jsonlOutput = Paths.get(args[0]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        List<Path> inputs = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            Path input = Paths.get(args[i]);
            if (!Files.exists(input)) {
                System.err.println("Error: Input path does not exist: " + input);
                System.exit(1);
            }
            inputs.add(input);
        }

        System.out.println("Starting Fortran analysis...");
        try {
            run(jsonlOutput, inputs, FortframeConfig.load());
        } catch (FortframeException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(Path jsonlOutput, List<Path> inputs, FortframeConfig config) throws IOException {
        List<Path> files = collectSourceFiles(inputs);
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        Diagnostics diagnostics = Diagnostics.of(config);
        ProjectLoader loader = new ProjectLoader(config, diagnostics);
        Project project = loader.load(files);
        List<UnitSummary> summaries = SummaryBuilder.units(project.getFiles());

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_paths", inputs.stream().map(Path::toString).toList());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            for (UnitSummary summary : summaries) {
                writer.write(MAPPER.writeValueAsString(summary));
                writer.newLine();
            }

            for (Map.Entry<Path, String> failure : loader.getFailures().entrySet()) {
                Map<String, String> error = new HashMap<>();
                error.put("kind", "error");
                error.put("file", failure.getKey().toString());
                error.put("error", failure.getValue());
                writer.write(MAPPER.writeValueAsString(error));
                writer.newLine();
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", project.getFiles().size());
            doneInfo.put("files_with_errors", project.getFailedFiles().size());
            doneInfo.put("units", summaries.size());
            doneInfo.put("warnings", project.getWarnings().size());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + project.getFiles().size() + " files");
        if (!project.getFailedFiles().isEmpty()) {
            System.out.println("Errors: " + project.getFailedFiles().size());
        }
        if (!project.getWarnings().isEmpty()) {
            System.out.println("Warnings: " + project.getWarnings().size());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectSourceFiles(List<Path> inputs) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> stream = Files.walk(input)) {
                    stream.filter(Files::isRegularFile)
                          .filter(SourceFormDetector::isFortranSource)
                          .sorted()
                          .forEach(files::add);
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            }
        }
        return files;
    }
}
