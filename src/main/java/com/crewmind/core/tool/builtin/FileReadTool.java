package com.crewmind.core.tool.builtin;

import com.crewmind.core.security.PathRestrictionService;
import com.crewmind.core.tool.Tool;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

/**
 * Reads a text file below the configured base directory.
 */
public class FileReadTool implements Tool {

    public static final String ID = "read_file";

    private final PathRestrictionService pathRestrictions;
    private final int maxChars;

    public FileReadTool(PathRestrictionService pathRestrictions, int maxChars) {
        this.pathRestrictions = pathRestrictions;
        this.maxChars = maxChars;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Read a local text file (path relative to the working directory)";
    }

    @Override
    public String parameterHint() {
        return "{\"path\": \"notes/market.md\"}";
    }

    @Override
    public String invoke(Map<String, Object> parameters) throws IOException {
        Object path = parameters.get("path");
        var file = pathRestrictions.resolveReadable(path == null ? null : path.toString());
        if (!Files.isRegularFile(file)) {
            throw new IOException("No such file: " + path);
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        return WebPageTool.truncate(content, maxChars);
    }
}
