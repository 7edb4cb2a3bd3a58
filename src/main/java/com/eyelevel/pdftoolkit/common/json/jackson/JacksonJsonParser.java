package com.eyelevel.pdftoolkit.common.json.jackson;

import com.eyelevel.pdftoolkit.common.json.JsonParser;
import com.eyelevel.pdftoolkit.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson {@link ObjectMapper}
 * configured by Spring Boot.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        if (json == null) {
            throw new JsonParsingException("Error parsing JSON string", new IllegalArgumentException("JSON is null"));
        }
        try {
            T result = objectMapper.readValue(json, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.warn("Error parsing JSON string to object of type {}: {}", valueType.getName(), e.getMessage());
            throw new JsonParsingException("Error parsing JSON string", e);
        }
    }
}
