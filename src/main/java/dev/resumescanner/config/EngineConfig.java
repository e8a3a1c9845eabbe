package dev.resumescanner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumescanner.registry.PatternRegistry;
import dev.resumescanner.registry.PatternRegistryLoader;
import dev.resumescanner.registry.RegistryDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

/**
 * Wires the pattern registry and the clock used for open-ended date ranges.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public PatternRegistry patternRegistry(RegistryConfig registryConfig, ResourceLoader resourceLoader,
                                           ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(registryConfig.getLocation());
        if (!resource.exists()) {
            throw new IllegalStateException("Pattern registry not found at " + registryConfig.getLocation());
        }

        PatternRegistryLoader loader = new PatternRegistryLoader(objectMapper);
        try (InputStream in = resource.getInputStream()) {
            RegistryDocument document = PatternRegistry.withAdditionalSkills(
                    loader.readDocument(in), registryConfig.getAdditionalSkills());
            PatternRegistry registry = PatternRegistry.from(document);
            log.info("Loaded {} from {}", registry, registryConfig.getLocation());
            return registry;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to load pattern registry from {}", registryConfig.getLocation(), e);
            throw new IllegalStateException("Could not load pattern registry", e);
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
