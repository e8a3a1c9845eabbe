package dev.resumescanner.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ExperienceLevelTest {

    @ParameterizedTest(name = "{0} years is {1}")
    @CsvSource({
            "0, ENTRY",
            "2, ENTRY",
            "2.5, MID",
            "5, MID",
            "6, SENIOR",
            "10, SENIOR",
            "10.5, EXPERT",
            "50, EXPERT"
    })
    void shouldBucketYears(double years, ExperienceLevel expected) {
        assertThat(ExperienceLevel.of(years)).isEqualTo(expected);
    }
}
