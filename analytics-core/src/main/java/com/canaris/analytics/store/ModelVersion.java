package com.canaris.analytics.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ModelVersion {
    String name;
    String version;
    Instant createdAt;
    long sizeBytes;
    boolean latest;
    Map<String, Object> metadata;
}
