package org.iceforge.kpigate.sql;

import org.iceforge.kpigate.request.KpiFilters;
import org.iceforge.kpigate.request.KpiQuery;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FilterCompilerTest {

    @Test
    void mtdIsEqualityOnReferenceMonth() {
        List<String> p = FilterCompiler.compile(KpiQuery.of("volume", null, "MTD", "202503", null));
        assertThat(p.get(0)).isEqualTo("cal_yr_mo_nbr = 202503");
    }

    @Test
    void ytdIsRangeFromJanuary() {
        List<String> p = FilterCompiler.compile(KpiQuery.of("volume", null, "YTD", "202503", null));
        assertThat(p.get(0)).isEqualTo("cal_yr_mo_nbr BETWEEN 202501 AND 202503");
    }

    @Test
    void segmentExcludedUnlessExplicitlyIncluded() {
        KpiFilters include = new KpiFilters(null, null, null, null, null, true);
        KpiFilters exclude = new KpiFilters(null, null, null, null, null, false);

        assertThat(FilterCompiler.compile(KpiQuery.of("volume", null, null, null, null)))
                .contains("segment <> 'AO'");
        assertThat(FilterCompiler.compile(KpiQuery.of("volume", null, null, null, exclude)))
                .contains("segment <> 'AO'");
        assertThat(FilterCompiler.compile(KpiQuery.of("volume", null, null, null, include)))
                .noneMatch(s -> s.contains("segment"));
    }

    @Test
    void listFiltersFollowFixedOrderAndDedicatedColumns() {
        KpiFilters f = new KpiFilters(
                List.of("MICHELOB ULTRA", "BUSCH"),
                List.of("WEST"),
                List.of("CA", "NV"),
                List.of("10021"),
                List.of("ON PREMISE"),
                null);

        List<String> p = FilterCompiler.compile(KpiQuery.of("volume", null, "MTD", "202501", f));

        assertThat(p).containsExactly(
                "cal_yr_mo_nbr = 202501",
                "segment <> 'AO'",
                "megabrand IN ('MICHELOB ULTRA','BUSCH')",
                "sls_regn_cd IN ('WEST')",
                "mktng_st_cd IN ('CA','NV')",
                "wslr_nbr IN ('10021')",
                "channel IN ('ON PREMISE')");
    }

    @Test
    void emptyListsAreSkipped() {
        KpiFilters f = new KpiFilters(List.of(), List.of(), null, null, List.of(), null);
        assertThat(FilterCompiler.compile(KpiQuery.of("volume", null, null, null, f))).hasSize(2);
    }

    @Test
    void channelFilterOnKpiWithoutChannelMatchesNothing() {
        KpiFilters f = new KpiFilters(null, null, null, null, List.of("OFF PREMISE"), null);

        List<String> p = FilterCompiler.compile(KpiQuery.of("share", null, null, null, f));

        assertThat(p).contains(FilterCompiler.MATCH_NONE);
        assertThat(p).noneMatch(s -> s.startsWith("channel"));
    }

    @Test
    void quotesAreDoubledAndRecoverable() {
        String nasty = "O'Doul's', 'x') OR 1=1 --";
        KpiFilters f = new KpiFilters(List.of(nasty, "plain"), null, null, null, null, null);

        String predicate = FilterCompiler.compile(KpiQuery.of("volume", null, null, null, f)).get(2);

        assertThat(predicate).startsWith("megabrand IN (");
        assertThat(literals(predicate)).containsExactly(nasty, "plain");
    }

    /** Reads back every single-quoted literal, undoing '' escapes. */
    static List<String> literals(String sql) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = null;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (cur == null) {
                if (c == '\'') cur = new StringBuilder();
                continue;
            }
            if (c == '\'') {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    cur.append('\'');
                    i++;
                } else {
                    out.add(cur.toString());
                    cur = null;
                }
            } else {
                cur.append(c);
            }
        }
        return out;
    }
}
