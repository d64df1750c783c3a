package com.dyntable.tableservice.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 按时间排序的 id 生成器，用于表、列、行、流水和销售记录。
 * id 以 36 进制表示并带简短的类型前缀，例如 {@code row_3x9k2m1a0b}
 */
@Component
public class SnowflakeIdGenerator {

    private static final long EPOCH = 1704067200000L; // 2024-01-01T00:00:00Z
    private static final int NODE_BITS = 10;
    private static final int SEQUENCE_BITS = 12;
    private static final long MAX_NODE = (1L << NODE_BITS) - 1;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;

    private final long nodeId;

    private long lastTimestamp = -1L;
    private long sequence;

    public SnowflakeIdGenerator(@Value("${snowflake.worker-id:1}") long workerId,
                                @Value("${snowflake.datacenter-id:1}") long datacenterId) {
        long node = (datacenterId << 5) | workerId;
        if (workerId < 0 || workerId > 31 || datacenterId < 0 || datacenterId > 31 || node > MAX_NODE) {
            throw new IllegalArgumentException(
                    String.format("Snowflake node out of range: worker=%d, datacenter=%d", workerId, datacenterId));
        }
        this.nodeId = node;
    }

    public synchronized long nextId() {
        long now = System.currentTimeMillis();
        if (now < lastTimestamp) {
            // 容忍轻微的时钟回拨，复用上一个时间戳
            now = lastTimestamp;
        }
        if (now == lastTimestamp) {
            sequence = (sequence + 1) & SEQUENCE_MASK;
            if (sequence == 0) {
                while (now <= lastTimestamp) {
                    now = System.currentTimeMillis();
                }
            }
        } else {
            sequence = 0;
        }
        lastTimestamp = now;
        return ((now - EPOCH) << (NODE_BITS + SEQUENCE_BITS)) | (nodeId << SEQUENCE_BITS) | sequence;
    }

    public String nextId(String prefix) {
        return prefix + "_" + Long.toString(nextId(), 36).toLowerCase(Locale.ROOT);
    }
}
