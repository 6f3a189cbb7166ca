package com.kreasipositif.wpsprocessor.repository;

import org.springframework.stereotype.Component;

import java.time.Year;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sequential human-readable references, e.g. {@code WPS-2026-00001}, {@code SUB-2026-00001}.
 */
@Component
public class ReferenceGenerator {

    public static final String BATCH = "WPS";
    public static final String SUBMISSION = "SUB";
    public static final String COMPLIANCE = "CMP";

    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public String next(String prefix) {
        String key = prefix + "-" + Year.now().getValue();
        long value = sequences.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        return "%s-%05d".formatted(key, value);
    }
}
