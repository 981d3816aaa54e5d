package com.eyelevel.jobengine.common.json.jackson;

import com.eyelevel.jobengine.common.json.JsonSerializer;
import com.eyelevel.jobengine.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    /**
     * Serializes a Java object into its JSON representation.
     *
     * @throws JsonParsingException if an error occurs during JSON serialization.
     */
    @Override
    public <T> String serialize(T object) {
        log.trace("Serializing Java object to JSON string: {}", object.getClass().getName());
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing Java object to JSON", e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
