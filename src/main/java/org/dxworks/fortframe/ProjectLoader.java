package org.dxworks.fortframe;

import org.dxworks.fortframe.analyzer.correlation.Correlator;
import org.dxworks.fortframe.analyzer.parser.FortranParser;
import org.dxworks.fortframe.analyzer.reader.FortranReader;
import org.dxworks.fortframe.model.Project;
import org.dxworks.fortframe.model.SourceFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Reads and parses source files on a worker pool, then correlates them into a {@link Project}.
 * A file that fails to read or parse is reported and left out unless the configuration is strict.
 */
public class ProjectLoader {

    private final FortframeConfig config;
    private final Diagnostics diagnostics;
    private final SourceFormDetector detector;
    private final Map<Path, String> failures = Collections.synchronizedMap(new LinkedHashMap<>());

    public ProjectLoader(FortframeConfig config, Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
        this.detector = new SourceFormDetector(config);
    }

    public Project load(List<Path> paths) {
        List<SourceFile> files = parseAll(paths);
        List<String> failedFiles = new ArrayList<>();
        for (Path path : paths) {
            if (failures.containsKey(path)) {
                failedFiles.add(path.toString());
            }
        }
        return new Correlator(config, diagnostics).correlate(files, failedFiles);
    }

    /**
     * Parses every file, keeping the input order in the result.
     */
    public List<SourceFile> parseAll(List<Path> paths) {
        if (paths.isEmpty()) {
            return new ArrayList<>();
        }
        int threads = Math.max(1, Math.min(config.getWorkers(), paths.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Optional<SourceFile>>> futures = new ArrayList<>();
            for (Path path : paths) {
                futures.add(executor.submit(() -> parseSafely(path)));
            }
            List<SourceFile> files = new ArrayList<>();
            for (Future<Optional<SourceFile>> future : futures) {
                future.get().ifPresent(files::add);
            }
            return files;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FortframeException("Interrupted while parsing sources", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new FortframeException("Parsing failed: " + cause.getMessage(), cause);
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private Optional<SourceFile> parseSafely(Path path) {
        Optional<SourceForm> form = detector.detectSourceForm(path);
        if (form.isEmpty()) {
            diagnostics.warn("Skipping " + path + ": not a recognised Fortran source extension");
            return Optional.empty();
        }
        diagnostics.info("Reading file " + path);
        try {
            return Optional.of(parseFile(path, form.get()));
        } catch (FortframeException e) {
            throw e;
        } catch (RuntimeException e) {
            if (config.isStrict()) {
                throw e;
            }
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            failures.put(path, message);
            diagnostics.error("Failed to parse " + path + ": " + message);
            return Optional.empty();
        }
    }

    public SourceFile parseFile(Path path, SourceForm form) {
        FortranReader reader = new FortranReader(path, form, detector.needsPreprocessing(path), config, diagnostics);
        return new FortranParser(diagnostics).parse(reader);
    }

    /**
     * Files left out of the project, with the reason each one failed.
     */
    public Map<Path, String> getFailures() {
        synchronized (failures) {
            return new LinkedHashMap<>(failures);
        }
    }
}
