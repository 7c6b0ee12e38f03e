package org.dxworks.fortframe;

import java.nio.file.Path;
import java.util.Optional;

public class SourceFormDetector {

    private static final String[] FREE_EXTENSIONS = {"f90", "f95", "f03", "f08", "f18"};

    private final FortframeConfig config;

    public SourceFormDetector(FortframeConfig config) {
        this.config = config;
    }

    public Optional<SourceForm> detectSourceForm(Path filePath) {
        String extension = extensionOf(filePath);
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        String lower = extension.toLowerCase();
        for (String fixed : config.getFixedExtensions()) {
            if (fixed.equalsIgnoreCase(lower)) {
                return Optional.of(SourceForm.FIXED);
            }
        }
        for (String free : FREE_EXTENSIONS) {
            if (free.equals(lower)) {
                return Optional.of(SourceForm.FREE);
            }
        }
        return Optional.empty();
    }

    /**
     * Preprocessing is keyed on the exact extension, so {@code .F90} is preprocessed and {@code .f90} is not.
     */
    public boolean needsPreprocessing(Path filePath) {
        return config.getFppExtensions().contains(extensionOf(filePath));
    }

    public static boolean isFortranSource(Path filePath) {
        String lower = extensionOf(filePath).toLowerCase();
        if (lower.equals("f") || lower.equals("for") || lower.equals("fpp") || lower.equals("ftn")) {
            return true;
        }
        for (String free : FREE_EXTENSIONS) {
            if (free.equals(lower)) {
                return true;
            }
        }
        return false;
    }

    static String extensionOf(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1);
    }
}
