package com.eyelevel.jobengine.common.json.jackson;

import com.eyelevel.jobengine.common.json.JsonParser;
import com.eyelevel.jobengine.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson {@link ObjectMapper}
 * configured by Spring Boot.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @throws JsonParsingException if an error occurs during JSON parsing.
     */
    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.trace("Parsing JSON string to object of type: {}", valueType.getName());
        try {
            return objectMapper.readValue(json, valueType);
        } catch (IOException e) {
            log.error("Error parsing JSON string to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON string", e);
        }
    }

    @Override
    public Map<String, Object> parseMap(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (IOException e) {
            log.error("Error parsing JSON string to a map", e);
            throw new JsonParsingException("Error parsing JSON object", e);
        }
    }
}
