package com.gdin.inspection.erpvector.integrity;

import cn.hutool.core.io.FileUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.inspection.erpvector.util.IOUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * 追加写的 JSONL 校验历史，一次校验一行。
 */
@Slf4j
public class JsonlValidationHistorySink implements ValidationHistorySink {
    private final File file;
    private final int defaultKeep;

    public JsonlValidationHistorySink(String path, int defaultKeep) {
        this.file = FileUtil.file(path);
        this.defaultKeep = Math.max(1, defaultKeep);
    }

    @Override
    public synchronized ValidationHistoryEntry append(ValidationRunReport report) {
        Map<String, Double> previousScores = new HashMap<>();
        for (ValidationHistoryEntry entry : readAll()) {
            for (ValidationHistoryEntry.ModelHistory m : entry.getModels()) {
                if (m.getError() == null) previousScores.put(m.getModel(), m.getIntegrityScore());
            }
        }

        List<ValidationHistoryEntry.ModelHistory> models = new ArrayList<>();
        for (ModelIntegrityReport r : report.getModels()) {
            Double previous = previousScores.get(r.getModel());
            Double delta = previous == null || r.isFailed()
                    ? null : Math.round((r.getIntegrityScore() - previous) * 100.0) / 100.0;
            models.add(new ValidationHistoryEntry.ModelHistory(
                    r.getModel(), report.getTimestamp(), r.getTotalEdges(), r.getTotalOrphans(),
                    r.getDriftCount(), r.getStructuralErrorCount(), r.getRepaired(),
                    r.getIntegrityScore(), delta, r.getError()));
        }
        ValidationHistoryEntry entry = new ValidationHistoryEntry(report.getRunId(), report.getTimestamp(), models);
        try {
            FileUtil.appendLines(List.of(IOUtil.jsonSerializeWithNoType(entry)), file, StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize validation history", e);
        }
        return entry;
    }

    @Override
    public synchronized List<ValidationHistoryEntry.ModelHistory> trend(String model, int limit) {
        int keep = limit > 0 ? limit : defaultKeep;
        LinkedList<ValidationHistoryEntry.ModelHistory> window = new LinkedList<>();
        for (ValidationHistoryEntry entry : readAll()) {
            for (ValidationHistoryEntry.ModelHistory m : entry.getModels()) {
                if (!m.getModel().equals(model)) continue;
                window.addLast(m);
                if (window.size() > keep) window.removeFirst();
            }
        }
        return new ArrayList<>(window);
    }

    public List<ValidationHistoryEntry.ModelHistory> trend(String model) {
        return trend(model, defaultKeep);
    }

    @Override
    public synchronized Optional<ValidationHistoryEntry> lastRun() {
        List<ValidationHistoryEntry> all = readAll();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    private List<ValidationHistoryEntry> readAll() {
        if (!file.exists()) return List.of();
        List<ValidationHistoryEntry> entries = new ArrayList<>();
        for (String line : FileUtil.readUtf8Lines(file)) {
            if (line.isBlank()) continue;
            try {
                entries.add(IOUtil.jsonDeserializeWithNoType(line, ValidationHistoryEntry.class));
            } catch (IOException e) {
                log.warn("skip malformed history line in {}: {}", file, e.getMessage());
            }
        }
        return entries;
    }
}
