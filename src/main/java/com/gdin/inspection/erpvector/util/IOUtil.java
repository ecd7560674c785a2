package com.gdin.inspection.erpvector.util;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Slf4j
public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();
    private static final ObjectMapper prettyMapper;

    static {
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        prettyMapper = simpleMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static ObjectMapper mapper() {
        return simpleMapper;
    }

    /**
     * json序列化(不带类型信息)
     */
    public static String jsonSerializeWithNoType(Object obj) throws JsonProcessingException {
        return jsonSerializeWithNoType(obj, false);
    }

    public static String jsonSerializeWithNoType(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) return null;
        return pretty ? prettyMapper.writeValueAsString(obj) : simpleMapper.writeValueAsString(obj);
    }

    public static <T> T jsonDeserializeWithNoType(InputStream is, Class<T> clazz) throws IOException {
        return simpleMapper.readValue(is, clazz);
    }

    public static <T> T jsonDeserializeWithNoType(InputStream is, TypeReference<T> type) throws IOException {
        return simpleMapper.readValue(is, type);
    }

    public static <T> T jsonDeserializeWithNoType(String content, Class<T> clazz) throws IOException {
        return simpleMapper.readValue(content, clazz);
    }

    public static <T> T jsonDeserializeWithNoType(String content, TypeReference<T> type) throws IOException {
        return simpleMapper.readValue(content, type);
    }

    /**
     * 对象转 Map（用于 payload 等弱类型结构）
     */
    public static Map<String, Object> toMap(Object obj) {
        return simpleMapper.convertValue(obj, new TypeReference<Map<String, Object>>() {});
    }

    public static <T> T convert(Object obj, Class<T> clazz) {
        return simpleMapper.convertValue(obj, clazz);
    }

    /**
     * 将JSON字符串解析为指定类型的列表
     * @return 解析后的对象列表，解析失败返回空列表
     */
    public static <T> List<T> parseList(String json, Class<T> elementType) {
        try {
            if (StrUtil.isBlank(json)) {
                return Collections.emptyList();
            }
            return simpleMapper.readValue(json,
                    simpleMapper.getTypeFactory().constructCollectionType(List.class, elementType));
        } catch (Exception e) {
            log.error("JSON解析失败: {}", json, e);
            return Collections.emptyList();
        }
    }
}
