package com.gdin.inspection.erpvector.sync;

import cn.hutool.core.io.FileUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.gdin.inspection.erpvector.util.IOUtil;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 每个模型最近一次成功同步的 write_date，增量同步从这里继续。
 */
public class SyncMetadataStore {
    private final File file;

    public SyncMetadataStore(String path) {
        this.file = FileUtil.file(path);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelSyncState {
        private String lastWriteDate;
        private String lastSyncAt;
        private long recordCount;
    }

    public synchronized Optional<ModelSyncState> get(String model) {
        return Optional.ofNullable(loadAll().get(model));
    }

    public synchronized Map<String, ModelSyncState> all() {
        return loadAll();
    }

    public synchronized void put(String model, ModelSyncState state) {
        Map<String, ModelSyncState> all = loadAll();
        all.put(model, state);
        try {
            FileUtil.writeString(IOUtil.jsonSerializeWithNoType(all, true), file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("failed to write sync metadata " + file, e);
        }
    }

    private Map<String, ModelSyncState> loadAll() {
        if (!file.exists()) return new LinkedHashMap<>();
        try {
            Map<String, ModelSyncState> map = IOUtil.jsonDeserializeWithNoType(
                    FileUtil.readUtf8String(file), new TypeReference<LinkedHashMap<String, ModelSyncState>>() {});
            return map == null ? new LinkedHashMap<>() : map;
        } catch (IOException e) {
            throw new IllegalStateException("corrupt sync metadata " + file, e);
        }
    }
}
