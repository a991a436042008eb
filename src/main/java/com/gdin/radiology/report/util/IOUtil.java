package com.gdin.radiology.report.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

public class IOUtil {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static {
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static String jsonSerialize(Object obj) throws JsonProcessingException {
        return obj == null ? null : objectMapper.writeValueAsString(obj);
    }

    /**
     * 从输入流读取 JSON 数组
     */
    public static <T> List<T> jsonDeserializeList(InputStream is, Class<T> elementType) throws IOException {
        JavaType type = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        return objectMapper.readValue(is, type);
    }
}
