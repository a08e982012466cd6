package org.iceforge.kpigate.request;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceMonthTest {

    @Test
    void defaultIsDecember2025() {
        assertThat(ReferenceMonth.DEFAULT.token()).isEqualTo("202512");
    }

    @Test
    void parsesConformingTokens() {
        assertThat(ReferenceMonth.parseOrDefault("202503").token()).isEqualTo("202503");
        assertThat(ReferenceMonth.parseOrDefault(" 202411 ").token()).isEqualTo("202411");
    }

    @Test
    void nonConformingTokensFallBackToDefault() {
        assertThat(ReferenceMonth.parseOrDefault(null)).isEqualTo(ReferenceMonth.DEFAULT);
        assertThat(ReferenceMonth.parseOrDefault("202513")).isEqualTo(ReferenceMonth.DEFAULT);
        assertThat(ReferenceMonth.parseOrDefault("2025-03")).isEqualTo(ReferenceMonth.DEFAULT);
        assertThat(ReferenceMonth.parseOrDefault("202503' OR '1'='1")).isEqualTo(ReferenceMonth.DEFAULT);
    }

    @Test
    void yearStartIsJanuaryOfSameYear() {
        assertThat(ReferenceMonth.parseOrDefault("202506").yearStart().token()).isEqualTo("202501");
    }

    @Test
    void constructorRejectsInvalidTokens() {
        assertThatThrownBy(() -> new ReferenceMonth("202500"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
