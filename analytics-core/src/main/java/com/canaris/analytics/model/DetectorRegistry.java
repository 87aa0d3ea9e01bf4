package com.canaris.analytics.model;

import com.canaris.analytics.store.ModelStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Detectors by logical model name. A detector is created on first use and
 * loads its latest stored version at that point.
 */
@Slf4j
public class DetectorRegistry {

    private final ModelStore store;
    @Getter
    private final DetectorConfig config;
    private final ConcurrentMap<String, UnivariateModel> univariate = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, MultivariateModel> multivariate = new ConcurrentHashMap<>();

    public DetectorRegistry(ModelStore store, DetectorConfig config) {
        this.store = store;
        this.config = config;
    }

    public UnivariateModel univariate(String name) {
        return univariate.computeIfAbsent(name, n -> {
            log.info("Creating univariate detector '{}'", n);
            return new UnivariateModel(n, store, config);
        });
    }

    public MultivariateModel multivariate(String name) {
        return multivariate.computeIfAbsent(name, n -> {
            log.info("Creating multivariate detector '{}'", n);
            return new MultivariateModel(n, store, config);
        });
    }

    /** Reloads the latest stored version into every cached detector of that name. */
    public void reload(String name) {
        UnivariateModel u = univariate.get(name);
        if (u != null) {
            u.reload();
        }
        MultivariateModel m = multivariate.get(name);
        if (m != null) {
            m.reload();
        }
    }

    public void evict(String name) {
        univariate.remove(name);
        multivariate.remove(name);
        log.info("Evicted detectors for '{}'", name);
    }

    public Set<String> cachedNames() {
        Set<String> names = new TreeSet<>(univariate.keySet());
        names.addAll(multivariate.keySet());
        return names;
    }
}
