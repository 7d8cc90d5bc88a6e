package com.example.batch.service;

import com.example.batch.error.InvalidSpecException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadMapperTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PayloadMapper payloads = new PayloadMapper(mapper);

    @Test
    void absentPayloadIsStoredAsNull() {
        assertThat(payloads.write(null)).isNull();
        assertThat(payloads.write(NullNode.getInstance())).isNull();
    }

    @Test
    void blankStoredPayloadReadsAsEmptyObject() {
        JsonNode n = payloads.read("  ");
        assertThat(n.isObject()).isTrue();
        assertThat(n.size()).isZero();
    }

    @Test
    void corruptStoredPayloadIsAnIllegalState() {
        assertThatThrownBy(() -> payloads.read("{not json"))
                .isInstanceOf(IllegalStateException.class)
                .isNotInstanceOf(InvalidSpecException.class);
    }

    @Test
    void errorFromThrowableCarriesTypeAndCollapsedMessage() {
        JsonNode err = payloads.error(new IllegalArgumentException("bad\n\n   input"));
        assertThat(err.get("type").asText()).isEqualTo("IllegalArgumentException");
        assertThat(err.get("message").asText()).isEqualTo("bad input");
    }

    @Test
    void longMessagesAreTruncated() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 3000; i++) sb.append('x');
        assertThat(PayloadMapper.trimErr(sb.toString())).hasSize(1900);
    }
}
