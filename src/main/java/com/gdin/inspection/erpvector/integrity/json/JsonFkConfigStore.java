package com.gdin.inspection.erpvector.integrity.json;

import cn.hutool.core.io.FileUtil;
import com.gdin.inspection.erpvector.util.IOUtil;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * JSON 外键映射配置文件。每次写入前先复制一份带时间戳的备份。
 */
@Slf4j
public class JsonFkConfigStore {
    private static final DateTimeFormatter BACKUP_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    private final File file;
    /** model -> field -> fk 映射，文件修改时间变化或本实例写入后重建 */
    private volatile Map<String, Map<String, JsonFkMapping>> fkIndex;
    private volatile long indexedModified = -1L;

    public JsonFkConfigStore(String path) {
        this.file = FileUtil.file(path);
    }

    @Value
    public static class SaveResult {
        int added;
        int skipped;
        /** 原文件不存在时为空 */
        String backupPath;
    }

    public synchronized JsonFkConfig load() {
        if (!file.exists()) return new JsonFkConfig();
        try {
            JsonFkConfig config = IOUtil.jsonDeserializeWithNoType(FileUtil.readUtf8String(file), JsonFkConfig.class);
            return config == null ? new JsonFkConfig() : config;
        } catch (IOException e) {
            throw new IllegalStateException("invalid json fk config " + file, e);
        }
    }

    public Optional<JsonFkMapping> find(String model, String field) {
        for (JsonFkMapping m : load().getMappings()) {
            if (m.getSourceModel().equals(model) && m.getFieldName().equals(field)) return Optional.of(m);
        }
        return Optional.empty();
    }

    /**
     * 某个模型已确认为外键的 JSON 字段，同步时每条记录都会查，走缓存
     * @return field -> 映射，没有时为空 map
     */
    public Map<String, JsonFkMapping> fkMappings(String model) {
        return index().getOrDefault(model, Map.of());
    }

    public Set<String> modelsWithFkMappings() {
        return index().keySet();
    }

    private Map<String, Map<String, JsonFkMapping>> index() {
        long modified = file.exists() ? file.lastModified() : 0L;
        Map<String, Map<String, JsonFkMapping>> current = fkIndex;
        if (current != null && modified == indexedModified) return current;

        Map<String, Map<String, JsonFkMapping>> built = new HashMap<>();
        for (JsonFkMapping m : load().getMappings()) {
            if (m.getMappingType() != JsonFieldClass.FK) continue;
            built.computeIfAbsent(m.getSourceModel(), k -> new HashMap<>()).put(m.getFieldName(), m);
        }
        fkIndex = built;
        indexedModified = modified;
        return built;
    }

    public Set<String> configuredKeys() {
        Set<String> keys = new HashSet<>();
        for (JsonFkMapping m : load().getMappings()) keys.add(m.key());
        return keys;
    }

    /**
     * 追加映射，已存在的 (model, field) 跳过。只有确实新增时才写文件。
     */
    public synchronized SaveResult addAll(Collection<JsonFkMapping> mappings) {
        JsonFkConfig config = load();
        Set<String> existing = new HashSet<>();
        for (JsonFkMapping m : config.getMappings()) existing.add(m.key());

        int added = 0;
        int skipped = 0;
        for (JsonFkMapping m : mappings) {
            if (existing.add(m.key())) {
                config.getMappings().add(m);
                added++;
            } else {
                skipped++;
            }
        }
        if (added == 0) return new SaveResult(0, skipped, null);
        String backup = write(config);
        log.info("json fk config: added={}, skipped={}, backup={}", added, skipped, backup);
        return new SaveResult(added, skipped, backup);
    }

    public synchronized boolean remove(String model, String field) {
        JsonFkConfig config = load();
        boolean removed = config.getMappings().removeIf(m -> m.getSourceModel().equals(model) && m.getFieldName().equals(field));
        if (removed) write(config);
        return removed;
    }

    private String write(JsonFkConfig config) {
        String backup = null;
        if (file.exists()) {
            String name = FileUtil.mainName(file) + ".backup-" + LocalDateTime.now().format(BACKUP_TS) + "." + FileUtil.extName(file);
            File target = new File(file.getAbsoluteFile().getParentFile(), name);
            FileUtil.copy(file, target, true);
            backup = target.getPath();
        }
        try {
            FileUtil.writeString(IOUtil.jsonSerializeWithNoType(config, true), file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("failed to write json fk config " + file, e);
        } finally {
            fkIndex = null;
        }
        return backup;
    }
}
