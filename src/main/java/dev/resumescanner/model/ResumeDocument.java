package dev.resumescanner.model;

/**
 * Already-extracted resume text and the identifier of the document it came from.
 */
public record ResumeDocument(String text, String sourceId) {
}
