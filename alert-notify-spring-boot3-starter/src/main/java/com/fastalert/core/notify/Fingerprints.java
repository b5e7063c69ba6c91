package com.fastalert.core.notify;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * 标签集指纹
 * FNV-1a 64: 按标签名排序, 依次写入 name, 0xFF, value, 0xFF, 输出 16 位小写十六进制
 */
public final class Fingerprints {

    private static final long OFFSET_64 = 0xcbf29ce484222325L;

    private static final long PRIME_64 = 0x100000001b3L;

    private static final byte SEPARATOR = (byte) 0xFF;

    private Fingerprints() {}

    public static String of(Map<String, String> labels) {
        return String.format("%016x", hash(labels));
    }

    public static long hash(Map<String, String> labels) {
        long h = OFFSET_64;
        if (labels == null || labels.isEmpty()) {
            return h;
        }
        for (Map.Entry<String, String> e : new TreeMap<>(labels).entrySet()) {
            h = add(h, e.getKey());
            h = addByte(h, SEPARATOR);
            h = add(h, e.getValue());
            h = addByte(h, SEPARATOR);
        }
        return h;
    }

    private static long add(long h, String s) {
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            h = addByte(h, b);
        }
        return h;
    }

    private static long addByte(long h, byte b) {
        h ^= (b & 0xFF);
        return h * PRIME_64;
    }
}
