package org.iceforge.kpigate.server.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.kpigate.server.execution.ContractViolationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String s) throws Exception {
        return mapper.readTree(s);
    }

    @Test
    void mapsColumnsInOrder() throws Exception {
        QueryResult r = ResultNormalizer.normalize(json(
                "{\"row_count\":2,\"data_array\":[[\"BUSCH\",\"1200.5\",\"1100\"],[\"STELLA\",\"80\",null]]}"));

        assertThat(r.rows()).containsExactly(
                new QueryResult.Row("BUSCH", new BigDecimal("1200.5"), new BigDecimal("1100")),
                new QueryResult.Row("STELLA", new BigDecimal("80"), null));
    }

    @Test
    void acceptsNativeJsonNumbers() throws Exception {
        QueryResult r = ResultNormalizer.normalize(json("{\"data_array\":[[202501, 3.25, 0]]}"));

        assertThat(r.rows().get(0).dimension()).isEqualTo("202501");
        assertThat(r.rows().get(0).currentValue()).isEqualByComparingTo("3.25");
        assertThat(r.rows().get(0).priorValue()).isEqualByComparingTo("0");
    }

    @Test
    void emptyResultWithoutDataArray() throws Exception {
        assertThat(ResultNormalizer.normalize(json("{\"row_count\":0}")).rows()).isEmpty();
    }

    @Test
    void missingOrMalformedPayloadIsContractViolation() throws Exception {
        assertThatThrownBy(() -> ResultNormalizer.normalize(null))
                .isInstanceOf(ContractViolationException.class);
        assertThatThrownBy(() -> ResultNormalizer.normalize(json("{\"row_count\":3}")))
                .isInstanceOf(ContractViolationException.class);
        assertThatThrownBy(() -> ResultNormalizer.normalize(json("{\"data_array\":\"nope\"}")))
                .isInstanceOf(ContractViolationException.class);
        assertThatThrownBy(() -> ResultNormalizer.normalize(json("{\"data_array\":[[\"only\",\"two\"]]}")))
                .isInstanceOf(ContractViolationException.class);
        assertThatThrownBy(() -> ResultNormalizer.normalize(json("{\"data_array\":[[\"x\",\"abc\",\"1\"]]}")))
                .isInstanceOf(ContractViolationException.class);
    }

    @Test
    void violationMessagesDoNotEchoRemoteValues() throws Exception {
        assertThatThrownBy(() -> ResultNormalizer.normalize(json("{\"data_array\":[[\"x\",\"secret-42\",\"1\"]]}")))
                .isInstanceOf(ContractViolationException.class)
                .hasMessage("Non-numeric value in result");
        assertThatThrownBy(() -> ResultNormalizer.normalize(json("{\"data_array\":[[\"internal-row\"]]}")))
                .isInstanceOf(ContractViolationException.class)
                .hasMessage("Result row does not have 3 columns");
        assertThatThrownBy(() -> ResultNormalizer.firstColumn(json("{\"data_array\":[\"internal-row\"]}")))
                .isInstanceOf(ContractViolationException.class)
                .hasMessage("Result row is empty");
    }

    @Test
    void firstColumnForOptionLists() throws Exception {
        assertThat(ResultNormalizer.firstColumn(json("{\"data_array\":[[\"CA\"],[\"NV\"]]}")))
                .containsExactly("CA", "NV");
    }
}
