package org.ipusage;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

@JsonPropertyOrder({"used", "unused"})
public record UsageReport(Map<String, Long> used, Map<String, Long> unused) {

    public UsageReport {
        used = Collections.unmodifiableMap(new TreeMap<>(used));
        unused = Collections.unmodifiableMap(new TreeMap<>(unused));
    }
}
