package com.eyelevel.jobengine.model;

import com.eyelevel.jobengine.common.json.JsonParser;
import com.eyelevel.jobengine.common.json.JsonSerializer;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * Stores schema-less job payloads as JSON text. Hibernate obtains instances from the Spring bean
 * container, so the application's JSON components are injected.
 */
@Converter
@RequiredArgsConstructor
public class JsonMapConverter implements AttributeConverter<Map<String, Object>, String> {

    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;

    @Override
    public String convertToDatabaseColumn(final Map<String, Object> attribute) {
        return attribute == null ? null : jsonSerializer.serialize(attribute);
    }

    @Override
    public Map<String, Object> convertToEntityAttribute(final String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        return jsonParser.parseMap(dbData);
    }
}
