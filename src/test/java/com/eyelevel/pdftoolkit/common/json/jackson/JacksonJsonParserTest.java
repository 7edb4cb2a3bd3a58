package com.eyelevel.pdftoolkit.common.json.jackson;

import com.eyelevel.pdftoolkit.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonParserTest {

    private final JacksonJsonParser parser = new JacksonJsonParser(new ObjectMapper());

    @Test
    void parsesRotationObject() {
        Map<?, ?> rotations = parser.parseObject("{\"1\": 90, \"3\": 180}", Map.class);

        assertThat(rotations.get("1")).isEqualTo(90);
        assertThat(rotations.get("3")).isEqualTo(180);
        assertThat(rotations).hasSize(2);
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> parser.parseObject("{\"1\": ", Map.class))
                .isInstanceOf(JsonParsingException.class);
    }

    @Test
    void nullIsRejected() {
        assertThatThrownBy(() -> parser.parseObject(null, Map.class))
                .isInstanceOf(JsonParsingException.class);
    }
}
