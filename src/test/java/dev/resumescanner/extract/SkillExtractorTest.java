package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.registry.PatternRegistry;
import dev.resumescanner.registry.PatternRegistryLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SkillExtractorTest {

    private static PatternRegistry registry;

    private SkillExtractor skillExtractor;

    @BeforeAll
    static void loadRegistry() {
        registry = new PatternRegistryLoader().loadDefault();
    }

    @BeforeEach
    void setUp() {
        skillExtractor = new SkillExtractor(new ExtractionConfig());
    }

    @Test
    @DisplayName("Should return skills in order of first occurrence")
    void shouldKeepOccurrenceOrder() {
        String text = "Docker daily, some Python, then Kubernetes and more Docker";

        assertThat(skillExtractor.extract(text, registry)).containsExactly("Docker", "Python", "Kubernetes");
    }

    @Test
    @DisplayName("Longer skills claim their span before shorter ones")
    void longerSkillsWin() {
        String text = "Built services with Spring Boot";

        assertThat(skillExtractor.extract(text, registry)).containsExactly("Spring Boot");
    }

    @Test
    @DisplayName("Shorter skill still counts where it appears on its own")
    void shorterSkillCountsElsewhere() {
        String text = "Spring Boot and Spring, plus C++ and C# and Java and JavaScript";

        assertThat(skillExtractor.extract(text, registry))
                .containsExactly("Spring Boot", "Spring", "C++", "C#", "Java", "JavaScript");
    }

    @Test
    @DisplayName("Should match case-insensitively but report canonical names")
    void shouldReportCanonicalNames() {
        assertThat(skillExtractor.extract("POSTGRESQL and numpy", registry))
                .containsExactly("PostgreSQL", "NumPy");
    }

    @Test
    @DisplayName("Should not match inside other words")
    void shouldNotMatchInsideWords() {
        assertThat(skillExtractor.extract("Gitter chat, Rusty tools, Javanese dialect", registry)).isEmpty();
    }

    @Test
    @DisplayName("Should cap the result at ten skills")
    void shouldCapAtTen() {
        String text = String.join(", ", registry.skillNames());

        List<String> skills = skillExtractor.extract(text, registry);

        assertThat(skills).hasSize(10).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should return empty for text without skills")
    void shouldReturnEmpty() {
        assertThat(skillExtractor.extract("", registry)).isEmpty();
    }
}
