package com.gdin.inspection.erpvector.util;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 查询日志旁路：调用方只做非阻塞入队，队列满或写入失败直接丢弃，
 * 任何情况下都不影响查询结果。
 */
@Slf4j
public class AsyncQueryLogSink implements AutoCloseable {
    private final BlockingQueue<Map<String, Object>> queue;
    private final File file;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private final Thread worker;
    private volatile boolean running = true;

    public AsyncQueryLogSink(int capacity, String path) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.file = StrUtil.isBlank(path) ? null : FileUtil.file(path);
        this.worker = new Thread(this::drain, "query-log-sink");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * @return false 表示已丢弃
     */
    public boolean offer(String operation, Map<String, Object> details) {
        if (!running) return false;
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", Instant.now().toString());
        entry.put("operation", operation);
        if (details != null) entry.putAll(details);
        boolean accepted = queue.offer(entry);
        if (!accepted) dropped.incrementAndGet();
        return accepted;
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getWritten() {
        return written.get();
    }

    private void drain() {
        List<Map<String, Object>> batch = new ArrayList<>();
        while (running || !queue.isEmpty()) {
            try {
                Map<String, Object> first = queue.poll(200, TimeUnit.MILLISECONDS);
                if (first == null) continue;
                batch.add(first);
                queue.drainTo(batch, 99);
                write(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                batch.clear();
            }
        }
    }

    private void write(List<Map<String, Object>> batch) {
        try {
            List<String> lines = new ArrayList<>(batch.size());
            for (Map<String, Object> entry : batch) lines.add(IOUtil.jsonSerializeWithNoType(entry));
            if (file != null) FileUtil.appendLines(lines, file, StandardCharsets.UTF_8);
            else lines.forEach(l -> log.debug("query: {}", l));
            written.addAndGet(batch.size());
        } catch (Exception e) {
            // 丢弃这一批，计数即可
            dropped.addAndGet(batch.size());
            log.debug("query log write failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        running = false;
        try {
            worker.join(2000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
