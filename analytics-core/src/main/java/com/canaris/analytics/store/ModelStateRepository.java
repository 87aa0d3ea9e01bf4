package com.canaris.analytics.store;

import java.util.List;
import java.util.Optional;

/**
 * Persistence backend behind {@link ModelStore}: opaque model bytes plus
 * JSON-like metadata addressed by (name, version), and a mutable
 * name to version alias for the latest model.
 * <p>
 * Each method must be atomic on its own; {@link #pointLatest} in particular
 * must never expose a half-written alias to concurrent readers.
 */
public interface ModelStateRepository {

    void insert(StoredModel model);

    Optional<StoredModel> findVersion(String name, String version);

    Optional<String> findLatestVersion(String name);

    void pointLatest(String name, String version);

    void clearLatest(String name);

    /** Versions of {@code name} without their state bytes, newest first. */
    List<ModelVersion> listVersions(String name);

    List<String> listModelNames();

    boolean deleteVersion(String name, String version);
}
