package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.registry.PatternRegistry;
import dev.resumescanner.registry.PatternRegistryLoader;
import dev.resumescanner.registry.RegistryDocument;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmploymentExtractorTest {

    private static PatternRegistry registry;

    private EmploymentExtractor employmentExtractor;

    @BeforeAll
    static void loadRegistry() {
        registry = new PatternRegistryLoader().loadDefault();
    }

    @BeforeEach
    void setUp() {
        employmentExtractor = new EmploymentExtractor(new ExtractionConfig());
    }

    @Nested
    @DisplayName("Companies")
    class CompanyTests {

        @Test
        @DisplayName("Should find companies in title | company | dates lines")
        void shouldFindPipeSeparatedCompanies() {
            String text = "Software Engineer | Company A | 2015 - 2018\nSenior Engineer | Company B | 2018 - 2022";

            assertThat(employmentExtractor.extractCompanies(text, registry)).containsExactly("Company A", "Company B");
        }

        @Test
        @DisplayName("Should find 'worked at' and suffix-terminated names")
        void shouldFindPhraseAndSuffixCompanies() {
            String text = "Currently working at Globex Corporation as a developer.\n"
                    + "Previously a consultant for Initech Solutions (contract).";

            assertThat(employmentExtractor.extractCompanies(text, registry))
                    .containsExactly("Globex Corporation", "Initech Solutions");
        }

        @Test
        @DisplayName("Registry without suffixes only finds phrase-introduced companies")
        void registryWithoutSuffixes() throws IOException {
            PatternRegistryLoader loader = new PatternRegistryLoader();
            RegistryDocument document;
            try (InputStream in = getClass().getClassLoader()
                    .getResourceAsStream(PatternRegistryLoader.DEFAULT_LOCATION)) {
                document = loader.readDocument(in);
            }
            document.setCompanySuffixes(List.of());
            PatternRegistry noSuffixes = PatternRegistry.from(document);
            String text = "Previously a consultant for Initech Solutions (contract).\nEngineer at Globex";

            assertThat(employmentExtractor.extractCompanies(text, registry))
                    .containsExactly("Initech Solutions", "Globex");
            assertThat(employmentExtractor.extractCompanies(text, noSuffixes)).containsExactly("Globex");
        }

        @Test
        @DisplayName("Should deduplicate case-insensitively")
        void shouldDeduplicate() {
            String text = "Engineer at Umbrella Corp\nLater promoted to lead at UMBRELLA CORP";

            assertThat(employmentExtractor.extractCompanies(text, registry)).containsExactly("Umbrella Corp");
        }

        @Test
        @DisplayName("Should reject schools, skills and credentials")
        void shouldRejectNonEmployers() {
            String text = "Graduated at Stanford University.\nWorked with Python daily.\n"
                    + "Senior Software Engineer role, AWS Certified Solutions Architect.";

            assertThat(employmentExtractor.extractCompanies(text, registry)).isEmpty();
        }

        @Test
        @DisplayName("Should require work context nearby")
        void shouldRequireWorkContext() {
            assertThat(employmentExtractor.extractCompanies("Visited Acme Labs on holiday", registry)).isEmpty();
        }

        @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
        @CsvSource(delimiter = ';', value = {
                "Acme Corp | 2019 - 2021; Acme Corp",
                "Acme Corp (Remote); Acme Corp",
                "Acme Corp, 2019; Acme Corp",
                "Acme Corp,; Acme Corp"
        })
        void shouldCleanCompanyNames(String raw, String expected) {
            assertThat(EmploymentExtractor.clean(raw)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should cap at ten companies")
        void shouldCapAtTen() {
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < 12; i++) {
                text.append("Engineer at Company").append((char) ('A' + i)).append(" Inc\n");
            }

            assertThat(employmentExtractor.extractCompanies(text.toString(), registry)).hasSize(10);
        }
    }

    @Nested
    @DisplayName("Job titles")
    class JobTitleTests {

        @Test
        @DisplayName("Should find titles with optional seniority")
        void shouldFindTitles() {
            String text = "Senior Software Engineer at Acme\nData Scientist at Globex\nSenior Software Engineer again";

            assertThat(employmentExtractor.extractJobTitles(text, registry))
                    .containsExactly("Senior Software Engineer", "Data Scientist");
        }

        @Test
        @DisplayName("Should exclude program, product and project managers")
        void shouldExcludeManagers() {
            String text = "Project Manager at Initech\nSenior Data Scientist at Globex";

            assertThat(employmentExtractor.extractJobTitles(text, registry)).containsExactly("Senior Data Scientist");
        }

        @Test
        @DisplayName("Should require job context")
        void shouldRequireJobContext() {
            assertThat(employmentExtractor.extractJobTitles("Software Engineer", registry)).isEmpty();
        }

        @Test
        @DisplayName("Should cap at five titles")
        void shouldCapAtFive() {
            String text = "Role history: Software Engineer, Data Engineer, Cloud Architect, QA Analyst, "
                    + "Security Consultant, Web Developer, Mobile Developer";

            assertThat(employmentExtractor.extractJobTitles(text, registry)).hasSize(5);
        }
    }
}
