package com.example.storyextractor.application.extraction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderCanonicalizerTest {

    private final HeaderCanonicalizer canonicalizer = new HeaderCanonicalizer();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Sr. No.|AC #",
            "S.No|AC #",
            "Sr.No.|AC #",
            "AC #|AC #",
            "ID|AC #",
            "AC No.|AC #",
            "Precondition|Given",
            "Action|When",
            "Expected Result|Expected",
            "RESULT|Expected",
            "Criteria|Acceptance Criteria",
            "AC|Acceptance Criteria",
            "scenario:|Scenario"
    })
    void aliasesResolveToCanonicalHeaders(String raw, String expected) {
        assertThat(canonicalizer.canonicalize(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Scenario", "Given", "When", "Then", "Expected", "Acceptance Criteria", "AC #"})
    void canonicalHeadersAreFixedPoints(String header) {
        assertThat(canonicalizer.canonicalize(header)).isEqualTo(header);
    }

    @Test
    void hashSignAloneIsAcNumber() {
        assertThat(canonicalizer.canonicalize(" # ")).isEqualTo(HeaderCanonicalizer.AC_NUMBER);
    }

    @Test
    void unknownHeaderKeepsTrimmedOriginalText() {
        assertThat(canonicalizer.canonicalize("  Business Notes. ")).isEqualTo("Business Notes.");
    }

    @Test
    void blankInputGivesEmptyString() {
        assertThat(canonicalizer.canonicalize(null)).isEmpty();
        assertThat(canonicalizer.canonicalize("   ")).isEmpty();
    }

    @Test
    void noBreakSpacesAreStrippedFromHeaders() {
        assertThat(canonicalizer.canonicalize("\u00a0Sr.\u00a0No.\u00a0")).isEqualTo("AC #");
        assertThat(canonicalizer.canonicalize("Owner\u00a0")).isEqualTo("Owner");
    }
}
