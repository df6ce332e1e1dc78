package com.couchreplicator.util;

import com.couchreplicator.exception.JsonException;
import com.couchreplicator.model.couchdb.global.ErrorInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.StringUtils;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static <T> T deserialize(String json, Class<T> clazz) throws JsonException {
        if (StringUtils.isBlank(json)) {
            throw new JsonException("deserialize failed. json is blank");
        }
        try {
            return objectMapper.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new JsonException("deserialize failed. json is %s".formatted(json), e);
        }
    }

    public static <T> T deserialize(String json, TypeReference<T> typeRef) throws JsonException {
        if (StringUtils.isBlank(json)) {
            throw new JsonException("deserialize failed. json is blank");
        }
        try {
            return objectMapper.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            throw new JsonException("deserialize failed. json is %s".formatted(json), e);
        }
    }

    public static String serializeToString(Object object) throws JsonException {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new JsonException("serializeToString failed. object is %s".formatted(object), e);
        }
    }

    // error bodies may come from a proxy and not be json at all
    public static ErrorInfo parseErrorInfo(String body) {
        if (StringUtils.isBlank(body)) {
            return new ErrorInfo(null, null);
        }
        try {
            ErrorInfo errorInfo = objectMapper.readValue(body, ErrorInfo.class);
            if (StringUtils.isAllBlank(errorInfo.getError(), errorInfo.getReason())) {
                return new ErrorInfo(null, body);
            }
            return errorInfo;
        } catch (JsonProcessingException e) {
            return new ErrorInfo(null, body);
        }
    }
}
