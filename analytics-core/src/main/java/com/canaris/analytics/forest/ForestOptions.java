package com.canaris.analytics.forest;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

@Value
@Builder
public class ForestOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    int trees = 100;

    /** Points drawn (without replacement) to grow each tree; capped at the training set size. */
    @Builder.Default
    int subsample = 256;

    @Builder.Default
    long seed = 42L;

    public static ForestOptions defaults() {
        return ForestOptions.builder().build();
    }
}
