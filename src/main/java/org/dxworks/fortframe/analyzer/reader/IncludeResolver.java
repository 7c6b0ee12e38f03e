package org.dxworks.fortframe.analyzer.reader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds the file named by an {@code include} line: first next to the including file, then in the include
 * directories in configured order.
 */
public final class IncludeResolver {

    private final List<Path> includeDirs;

    public IncludeResolver(List<Path> includeDirs) {
        this.includeDirs = List.copyOf(includeDirs);
    }

    public Optional<Path> resolve(String name, Path includingDir) {
        if (includingDir != null) {
            Path local = includingDir.resolve(name);
            if (Files.isRegularFile(local)) {
                return Optional.of(local);
            }
        }
        for (Path dir : includeDirs) {
            Path candidate = dir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
