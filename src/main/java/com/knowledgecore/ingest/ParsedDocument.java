package com.knowledgecore.ingest;

/**
 * Output of an external parser (file reader, PDF extractor, web scraper, Notion flattener). Only plain text
 * and a minimal identity are required.
 */
public record ParsedDocument(String content, String source, String filename, DocumentType type) {

    public ParsedDocument {
        type = type == null ? DocumentType.TEXT : type;
        filename = filename == null || filename.isBlank() ? source : filename;
    }
}
