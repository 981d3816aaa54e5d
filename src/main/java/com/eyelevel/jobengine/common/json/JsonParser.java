package com.eyelevel.jobengine.common.json;

import java.util.Map;

/**
 * Defines the contract for parsing JSON data into Java objects.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @param json      The JSON data as a string.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.jobengine.exception.json.JsonParsingException if an error occurs during
     *                                                                    JSON parsing.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses a JSON object into a map of its top-level fields.
     *
     * @throws com.eyelevel.jobengine.exception.json.JsonParsingException if the text is not a JSON
     *                                                                    object.
     */
    Map<String, Object> parseMap(String json);
}
