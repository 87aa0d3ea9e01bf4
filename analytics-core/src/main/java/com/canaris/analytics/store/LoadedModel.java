package com.canaris.analytics.store;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
public class LoadedModel<T> {
    String name;
    String version;
    T state;
    Map<String, Object> metadata;
    Instant createdAt;
}
