package com.eyelevel.bordereaux.common.json;

/**
 * Parses JSON documents (rule sets, template documents, model replies) into Java objects.
 * Implementations hide the JSON library in use.
 */
public interface JsonParser {

    /**
     * Parses a JSON string.
     *
     * @param json      the JSON text
     * @param valueType target type
     * @param <T>       target type
     *
     * @return the parsed object
     *
     * @throws com.eyelevel.bordereaux.exception.json.JsonParsingException if the text is not valid JSON for the
     *                                                                      target type
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses UTF-8 encoded JSON bytes.
     *
     * @param jsonBytes the JSON document
     * @param valueType target type
     * @param <T>       target type
     *
     * @return the parsed object
     *
     * @throws com.eyelevel.bordereaux.exception.json.JsonParsingException if the bytes are not valid JSON for the
     *                                                                      target type
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
