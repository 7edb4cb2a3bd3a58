package com.eyelevel.pdftoolkit.common.json;

/**
 * Defines the contract for parsing JSON request parameters.
 *
 * <p>Some operations receive structured values (for example the per-page rotation map) serialized
 * as a JSON string inside a multipart form field. Implementations hide the JSON library in use.
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
     * @throws com.eyelevel.pdftoolkit.exception.json.JsonParsingException if the string is not
     *                                                                     valid JSON for the type.
     */
    <T> T parseObject(String json, Class<T> valueType);
}
