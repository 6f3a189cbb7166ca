package com.kreasipositif.wpsprocessor.validation.derived;

import java.math.BigDecimal;
import java.util.Map;

final class Params {

    private Params() {
    }

    static BigDecimal decimal(Map<String, String> params, String key, BigDecimal fallback) {
        String raw = params.get(key);
        return raw == null || raw.isBlank() ? fallback : new BigDecimal(raw.trim());
    }

    static BigDecimal requiredDecimal(Map<String, String> params, String key) {
        String raw = params.get(key);
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("missing parameter '" + key + "'");
        }
        return new BigDecimal(raw.trim());
    }

    static int integer(Map<String, String> params, String key, int fallback) {
        String raw = params.get(key);
        return raw == null || raw.isBlank() ? fallback : Integer.parseInt(raw.trim());
    }
}
