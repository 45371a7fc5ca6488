package com.knowledgecore.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads plain text and markdown files. Other formats come from dedicated extractors outside this library.
 */
public class TextFileParser {

    public boolean supports(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".txt") || name.endsWith(".md") || name.endsWith(".markdown");
    }

    public ParsedDocument parse(Path path) throws IOException {
        if (!supports(path)) {
            throw new IllegalArgumentException("Unsupported file type: " + path.getFileName());
        }
        String name = path.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        DocumentType type = lower.endsWith(".md") || lower.endsWith(".markdown") ? DocumentType.MARKDOWN : DocumentType.TEXT;
        String content = Files.readString(path, StandardCharsets.UTF_8).strip();
        return new ParsedDocument(content, path.toAbsolutePath().normalize().toString(), name, type);
    }
}
