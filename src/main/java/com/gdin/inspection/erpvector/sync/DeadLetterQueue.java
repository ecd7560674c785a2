package com.gdin.inspection.erpvector.sync;

import cn.hutool.core.io.FileUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.inspection.erpvector.util.IOUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 同步失败记录，JSONL 追加写，每行一条。
 */
@Slf4j
public class DeadLetterQueue {
    private final File file;
    private final AtomicLong total = new AtomicLong();

    public DeadLetterQueue(String path) {
        this.file = FileUtil.file(path);
    }

    public synchronized void add(String model, Long recordId, String stage, String error) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", Instant.now().toString());
        entry.put("model", model);
        entry.put("record_id", recordId);
        entry.put("stage", stage);
        entry.put("error", error);
        try {
            FileUtil.appendLines(List.of(IOUtil.jsonSerializeWithNoType(entry)), file, StandardCharsets.UTF_8);
            total.incrementAndGet();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize dead letter entry", e);
        }
    }

    public long getTotal() {
        return total.get();
    }

    /**
     * 读取某个模型的失败记录号（用于重试）
     */
    public synchronized List<Long> failedRecordIds(String model) {
        if (!file.exists()) return List.of();
        Set<Long> ids = new LinkedHashSet<>();
        for (String line : FileUtil.readUtf8Lines(file)) {
            if (line.isBlank()) continue;
            Map<String, Object> entry = parse(line);
            if (entry != null && model.equals(entry.get("model")) && entry.get("record_id") instanceof Number) {
                ids.add(((Number) entry.get("record_id")).longValue());
            }
        }
        return new ArrayList<>(ids);
    }

    private static Map<String, Object> parse(String line) {
        try {
            return IOUtil.toMap(IOUtil.jsonDeserializeWithNoType(line, Map.class));
        } catch (IOException e) {
            log.warn("skip malformed dead letter line: {}", line);
            return null;
        }
    }
}
