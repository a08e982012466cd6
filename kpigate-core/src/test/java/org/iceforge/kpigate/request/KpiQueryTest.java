package org.iceforge.kpigate.request;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KpiQueryTest {

    @Test
    void defaultsApplyWhenOptionalFieldsAreAbsent() {
        KpiQuery q = KpiQuery.of("volume", null, null, null, null);

        assertThat(q.groupBy()).isEqualTo(GroupBy.TIME);
        assertThat(q.scope()).isEqualTo(Scope.YTD);
        assertThat(q.referenceMonth()).isEqualTo(ReferenceMonth.DEFAULT);
        assertThat(q.filters().excludesSegment()).isTrue();
    }

    @Test
    void unknownKpiIsRejected() {
        assertThatThrownBy(() -> KpiQuery.of("margin", "time", "YTD", "202501", null))
                .isInstanceOf(KpiRequestException.class)
                .hasMessageContaining("margin");
    }

    @Test
    void missingKpiIsRejected() {
        assertThatThrownBy(() -> KpiQuery.of(null, null, null, null, null))
                .isInstanceOf(KpiRequestException.class)
                .hasMessageContaining("kpi");
    }

    @Test
    void unknownGroupByAndScopeAreRejected() {
        assertThatThrownBy(() -> KpiQuery.of("volume", "brand", null, null, null))
                .isInstanceOf(KpiRequestException.class);
        assertThatThrownBy(() -> KpiQuery.of("volume", null, "QTD", null, null))
                .isInstanceOf(KpiRequestException.class);
        assertThatThrownBy(() -> KpiQuery.of("volume", "MEGABRAND", null, null, null))
                .isInstanceOf(KpiRequestException.class);
    }

    @Test
    void malformedMonthFallsBackToDefault() {
        assertThat(KpiQuery.of("volume", null, null, "2025-06", null).referenceMonth())
                .isEqualTo(ReferenceMonth.DEFAULT);
        assertThat(KpiQuery.of("volume", null, null, "202513", null).referenceMonth())
                .isEqualTo(ReferenceMonth.DEFAULT);
        assertThat(KpiQuery.of("volume", null, null, "202506; DROP TABLE x", null).referenceMonth())
                .isEqualTo(ReferenceMonth.DEFAULT);
        assertThat(KpiQuery.of("volume", null, null, " 202506 ", null).referenceMonth().token())
                .isEqualTo("202506");
    }

    @Test
    void yearStartKeepsTheYear() {
        assertThat(new ReferenceMonth("202506").yearStart().token()).isEqualTo("202501");
        assertThatThrownBy(() -> new ReferenceMonth("2025"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void filtersDropNullEntriesAndOnlyExplicitTrueIncludesAo() {
        KpiFilters f = new KpiFilters(Arrays.asList("A", null, "B"), null, List.of(), null, null, Boolean.FALSE);

        assertThat(f.megabrand()).containsExactly("A", "B");
        assertThat(f.region()).isEmpty();
        assertThat(f.excludesSegment()).isTrue();
        assertThat(new KpiFilters(null, null, null, null, null, null).excludesSegment()).isTrue();
        assertThat(new KpiFilters(null, null, null, null, null, true).excludesSegment()).isFalse();
    }
}
