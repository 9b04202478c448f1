package com.crewmind.core.security;

import com.crewmind.config.CrewmindProperties;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Decides which files the {@code read_file} tool may open: paths must resolve
 * inside the configured base directory and match one of the readable globs.
 */
public class PathRestrictionService {

    private final Path baseDir;
    private final List<PathMatcher> readable;

    public PathRestrictionService(CrewmindProperties.Files files) {
        this.baseDir = Path.of(files.getBaseDir()).toAbsolutePath().normalize();
        this.readable = files.getReadable().stream()
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .toList();
    }

    /**
     * Resolves {@code requested} against the base directory.
     *
     * @throws SecurityException when the path escapes the base directory or matches no readable glob
     */
    public Path resolveReadable(String requested) {
        if (requested == null || requested.isBlank()) {
            throw new SecurityException("No file path given");
        }
        Path resolved = baseDir.resolve(requested).normalize();
        if (!resolved.startsWith(baseDir)) {
            throw new SecurityException("Path '" + requested + "' is outside " + baseDir);
        }
        if (!isPathReadable(baseDir.relativize(resolved).toString())) {
            throw new SecurityException("Path '" + requested + "' is not readable");
        }
        return resolved;
    }

    public boolean isPathReadable(String relativePath) {
        Path path = Path.of(relativePath);
        for (PathMatcher matcher : readable) {
            // "**/*.md" does not match a top-level "notes.md", so try with a leading directory too
            if (matcher.matches(path) || matcher.matches(Path.of("_").resolve(path))) {
                return true;
            }
        }
        return false;
    }

    public Path getBaseDir() {
        return baseDir;
    }
}
