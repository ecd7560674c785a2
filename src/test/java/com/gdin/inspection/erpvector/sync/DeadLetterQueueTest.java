package com.gdin.inspection.erpvector.sync;

import cn.hutool.core.io.FileUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeadLetterQueueTest {

    @TempDir
    Path dir;

    @Test
    void failedIdsPerModelDeduplicated() {
        File file = dir.resolve("dlq.jsonl").toFile();
        DeadLetterQueue dlq = new DeadLetterQueue(file.getPath());
        dlq.add("account.move.line", 5L, "upsert", "timeout");
        dlq.add("account.move.line", 5L, "upsert", "timeout");
        dlq.add("account.move.line", 9L, "encode", "record id overflow");
        dlq.add("res.partner", 1L, "upsert", "timeout");
        dlq.add("res.partner", null, "encode", "missing id");

        assertEquals(5, dlq.getTotal());
        assertEquals(5, FileUtil.readUtf8Lines(file).size());
        assertEquals(List.of(5L, 9L), dlq.failedRecordIds("account.move.line"));
        assertEquals(List.of(1L), dlq.failedRecordIds("res.partner"));
        assertTrue(dlq.failedRecordIds("account.tax").isEmpty());
    }

    @Test
    void malformedLinesAreSkipped() {
        File file = dir.resolve("dlq.jsonl").toFile();
        FileUtil.appendLines(List.of("not json", "", "{\"model\":\"res.partner\",\"record_id\":3}"), file, StandardCharsets.UTF_8);
        assertEquals(List.of(3L), new DeadLetterQueue(file.getPath()).failedRecordIds("res.partner"));
    }

    @Test
    void missingFile() {
        assertTrue(new DeadLetterQueue(dir.resolve("none.jsonl").toString()).failedRecordIds("res.partner").isEmpty());
    }
}
