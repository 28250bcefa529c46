package com.artifactduo.server.util;

import com.artifactduo.server.exception.JsonException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.List;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule()) // jackson to handle java.time fields
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS) // ISO-8601 instead of timestamp
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonUtil() {}

    public static <T> List<T> deserToList(String jsonString, Class<T> elementType) throws JsonException {
        if (StringUtils.isBlank(jsonString)) {
            return Collections.emptyList();
        }
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            return objectMapper.readValue(jsonString, listType);
        } catch (JsonProcessingException e) {
            throw new JsonException("deserToList failed. elementType is %s".formatted(elementType), e);
        }
    }

    public static String serializeToString(Object object) throws JsonException {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new JsonException("serializeToString failed. object is %s".formatted(object), e);
        }
    }
}
