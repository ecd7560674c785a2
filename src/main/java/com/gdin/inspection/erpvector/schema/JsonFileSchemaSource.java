package com.gdin.inspection.erpvector.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gdin.inspection.erpvector.util.IOUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * 从 JSON 文件加载 schema，支持 classpath: 与 file: 前缀。
 * 文件内容为 ModelSchema 数组。
 */
@Slf4j
public class JsonFileSchemaSource implements SchemaSource {
    private final String location;

    public JsonFileSchemaSource(String location) {
        this.location = location;
    }

    @Override
    public List<ModelSchema> load() {
        Resource resource = new DefaultResourceLoader().getResource(location);
        if (!resource.exists()) throw new SchemaLoadException("schema file not found: " + location);
        try (InputStream is = resource.getInputStream()) {
            List<ModelSchema> models = IOUtil.jsonDeserializeWithNoType(is, new TypeReference<List<ModelSchema>>() {});
            log.info("加载 schema 文件 {}，模型数 {}", location, models.size());
            return models;
        } catch (IOException e) {
            throw new SchemaLoadException("failed to read schema file " + location, e);
        }
    }
}
