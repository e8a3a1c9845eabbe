package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.registry.PatternRegistry;
import dev.resumescanner.registry.PatternRegistryLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ContactExtractorTest {

    private static PatternRegistry registry;

    private ContactExtractor contactExtractor;

    @BeforeAll
    static void loadRegistry() {
        registry = new PatternRegistryLoader().loadDefault();
    }

    @BeforeEach
    void setUp() {
        contactExtractor = new ContactExtractor(new ExtractionConfig());
    }

    @Nested
    @DisplayName("Email")
    class EmailTests {

        @Test
        @DisplayName("Should return the first address with a lower-cased domain")
        void shouldReturnFirstEmail() {
            String text = "Contact: Jane.Doe@Example.COM or jane@backup.org";

            assertThat(contactExtractor.extractEmail(text)).isEqualTo("Jane.Doe@example.com");
        }

        @Test
        @DisplayName("Should return empty when there is no address")
        void shouldReturnEmptyWithoutEmail() {
            assertThat(contactExtractor.extractEmail("reach me at jane at example dot com")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Phone")
    class PhoneTests {

        @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
        @CsvSource(delimiter = ';', value = {
                "Phone: +1 (415) 555-0100; +1 (415) 555-0100",
                "Phone: (415) 555-0100; (415) 555-0100",
                "Mobile 415.555.0100; 415.555.0100",
                "Call 4155550100 today; 4155550100",
                "Jane Doe\\n+1 415 555 0100\\n123 Main Street; +1 415 555 0100",
                "Jane Doe\\n+1 415 555 0100\\n2019 - 2023 Engineer at Acme; +1 415 555 0100",
                "(555) 123-4567\\n2019 - 2023; (555) 123-4567"
        })
        void shouldFindPhoneNumbers(String text, String expected) {
            assertThat(contactExtractor.extractPhone(text.replace("\\n", "\n"), registry)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should not mistake date ranges for phone numbers")
        void shouldIgnoreDateRanges() {
            String text = "Developer 2010-2015-2020 and 2016 - 2020";

            assertThat(contactExtractor.extractPhone(text, registry)).isEmpty();
        }

        @Test
        @DisplayName("Should require at least ten digits")
        void shouldRequireTenDigits() {
            assertThat(contactExtractor.extractPhone("Employee ID 123-456-789", registry)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Location")
    class LocationTests {

        @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
        @CsvSource(delimiter = ';', value = {
                "Mary Major\\nSan Francisco, CA\\n; San Francisco, CA",
                "Mary Major\\nPortland, Oregon\\n; Portland, Oregon"
        })
        void shouldFindLocation(String text, String expected) {
            assertThat(contactExtractor.extractLocation(text.replace("\\n", "\n"), registry)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should reject tech terms shaped like a location")
        void shouldRejectTechTerms() {
            assertThat(contactExtractor.extractLocation("Skills: Java, Python", registry)).isEmpty();
        }

        @Test
        @DisplayName("Should reject a location next to tech wording")
        void shouldRejectLocationNearTechContext() {
            String text = "Programming languages: Ruby, Scala\nFrameworks: Rails";

            assertThat(contactExtractor.extractLocation(text, registry)).isEmpty();
        }

        @Test
        @DisplayName("Should reject job lines")
        void shouldRejectJobLines() {
            assertThat(contactExtractor.extractLocation("Software Engineer, Google", registry)).isEmpty();
        }

        @Test
        @DisplayName("Should only look at the start of the text")
        void shouldOnlyScanHeader() {
            String text = "x".repeat(1200) + "\nAustin, TX";

            assertThat(contactExtractor.extractLocation(text, registry)).isEmpty();
        }
    }
}
