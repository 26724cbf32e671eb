package com.kbengine.health;

import java.util.List;
import java.util.Map;

/**
 * Per-store status: {@code up}, {@code down} or {@code skipped}.
 */
public record ReadinessReport(String status, Map<String, String> stores, List<String> unavailable) {

    public boolean ready() {
        return unavailable.isEmpty();
    }
}
