package com.teamstash.backend.modules.tag;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import com.teamstash.backend.modules.tag.domain.TagNames;

import org.junit.jupiter.api.Test;

class TagNamesTest {

    @Test
    void csvIsSplitAndTrimmed() {
        assertThat(TagNames.splitCsv(" food, dairy,,frozen ,")).containsExactly("food", "dairy", "frozen");
    }

    @Test
    void blankCsvYieldsNoNames() {
        assertThat(TagNames.splitCsv(null)).isEmpty();
        assertThat(TagNames.splitCsv("  ")).isEmpty();
        assertThat(TagNames.splitCsv(" , ,")).isEmpty();
    }

    @Test
    void normalisationIgnoresCaseDuplicatesAndEmptyEntries() {
        assertThat(TagNames.normalize(Arrays.asList("Dairy", " dairy ", "", null, "FROZEN")))
                .containsExactly("dairy", "frozen");
    }

    @Test
    void orderAndRepetitionDoNotChangeTheSet() {
        assertThat(TagNames.normalize(List.of("frozen", "Dairy", "frozen")))
                .isEqualTo(TagNames.normalize(List.of("dairy", "FROZEN")));
    }

    @Test
    void tooLongNamesAreReported() {
        String longName = "x".repeat(TagNames.MAX_LENGTH + 1);
        String exact = "y".repeat(TagNames.MAX_LENGTH);

        assertThat(TagNames.tooLong(List.of("ok", longName, exact))).containsExactly(longName);
    }
}
