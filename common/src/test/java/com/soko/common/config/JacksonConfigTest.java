package com.soko.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonConfigTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    static class Line {
        public Long productId;
        public Integer quantity;
    }

    @Test
    void fractionalValueForIntegerFieldIsRejected() {
        assertThatThrownBy(() -> objectMapper.readValue("{\"productId\":1,\"quantity\":2.7}", Line.class))
                .isInstanceOf(InvalidFormatException.class);
    }

    @Test
    void wholeNumbersAndUnknownFieldsStillParse() throws Exception {
        Line line = objectMapper.readValue("{\"productId\":1,\"quantity\":3,\"note\":\"x\"}", Line.class);

        assertThat(line.quantity).isEqualTo(3);
    }
}
