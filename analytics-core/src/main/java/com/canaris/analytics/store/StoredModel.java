package com.canaris.analytics.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable version of a model as held by a {@link ModelStateRepository}.
 */
@Value
@Builder
public class StoredModel {
    String name;
    String version;
    byte[] state;
    Map<String, Object> metadata;
    Instant createdAt;
}
