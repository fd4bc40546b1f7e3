package com.eyelevel.bordereaux.common.json.jackson;

import com.eyelevel.bordereaux.common.json.JsonParser;
import com.eyelevel.bordereaux.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link JsonParser} backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        if (json == null) {
            throw new JsonParsingException("Cannot parse null JSON into " + valueType.getSimpleName(), null);
        }
        return parseObject(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing {} bytes of JSON into {}", jsonBytes == null ? 0 : jsonBytes.length,
                  valueType.getSimpleName());
        if (jsonBytes == null || jsonBytes.length == 0) {
            throw new JsonParsingException("Cannot parse empty JSON into " + valueType.getSimpleName(), null);
        }
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsed JSON into: {}", result);
            return result;
        } catch (IOException e) {
            log.debug("Could not parse JSON into {}: {}", valueType.getSimpleName(), e.getMessage());
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }
}
