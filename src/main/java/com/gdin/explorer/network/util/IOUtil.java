package com.gdin.explorer.network.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * json序列化(不将类型信息序列化到json字符串中)
     */
    public static String jsonSerializeWithNoType(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) {
            return null;
        } else {
            return pretty ? simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj) : simpleMapper.writeValueAsString(obj);
        }
    }
}
