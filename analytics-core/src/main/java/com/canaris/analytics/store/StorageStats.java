package com.canaris.analytics.store;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StorageStats {
    int totalModels;
    int totalVersions;
    long totalSizeBytes;

    public double getTotalSizeMb() {
        return Math.round(totalSizeBytes / (1024.0 * 1024.0) * 100.0) / 100.0;
    }
}
