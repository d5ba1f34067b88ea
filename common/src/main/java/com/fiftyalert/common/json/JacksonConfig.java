package com.fiftyalert.common.json;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class JacksonConfig {

    public static ObjectMapper createObjectMapper() {
        return baseBuilder().build();
    }

    /**
     * Mapper for files meant to be read and repaired by hand (the delivery ledger).
     */
    public static ObjectMapper createPrettyPrintingObjectMapper() {
        return baseBuilder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    private static JsonMapper.Builder baseBuilder() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }
}
