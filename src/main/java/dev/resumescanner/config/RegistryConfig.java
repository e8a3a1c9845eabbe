package dev.resumescanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Where the pattern registry comes from and how it is extended.
 * Loaded from application.yml under the 'registry' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "registry")
public class RegistryConfig {

    private String location = "classpath:registry/default-registry.json";
    private List<String> additionalSkills = new ArrayList<>();
}
