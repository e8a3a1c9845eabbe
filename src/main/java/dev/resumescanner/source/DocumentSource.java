package dev.resumescanner.source;

import dev.resumescanner.model.ResumeDocument;
import reactor.core.publisher.Flux;

/**
 * Supplies already-extracted resume text to the pipeline.
 */
public interface DocumentSource {

    /**
     * Get the name of this source (e.g., "Directory")
     */
    String getName();

    /**
     * Stream every available document.
     */
    Flux<ResumeDocument> fetchDocuments();

    /**
     * Check if this source is enabled.
     */
    default boolean isEnabled() {
        return true;
    }
}
