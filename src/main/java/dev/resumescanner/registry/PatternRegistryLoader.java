package dev.resumescanner.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the registry JSON resource and compiles it into a {@link PatternRegistry}.
 */
@Slf4j
@RequiredArgsConstructor
public class PatternRegistryLoader {

    public static final String DEFAULT_LOCATION = "registry/default-registry.json";

    private final ObjectMapper objectMapper;

    public PatternRegistryLoader() {
        this(new ObjectMapper());
    }

    /**
     * Load the registry bundled with the application.
     */
    public PatternRegistry loadDefault() {
        try (InputStream in = PatternRegistryLoader.class.getClassLoader().getResourceAsStream(DEFAULT_LOCATION)) {
            if (in == null) {
                throw new IllegalStateException("Bundled registry not found on classpath: " + DEFAULT_LOCATION);
            }
            return PatternRegistry.from(readDocument(in));
        } catch (IOException e) {
            throw new IllegalStateException("Could not read bundled registry", e);
        }
    }

    /**
     * Parse a registry document from JSON.
     *
     * @throws IOException when the stream is not valid registry JSON
     */
    public RegistryDocument readDocument(InputStream in) throws IOException {
        RegistryDocument document = objectMapper.readValue(in, RegistryDocument.class);
        log.debug("Read registry version {} ({} skills, {} certifications)",
                document.getVersion(), document.getSkills().size(), document.getCertifications().size());
        return document;
    }

    public PatternRegistry load(InputStream in) throws IOException {
        return PatternRegistry.from(readDocument(in));
    }
}
