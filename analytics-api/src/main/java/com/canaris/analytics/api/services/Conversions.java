package com.canaris.analytics.api.services;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request payload lists to the primitive arrays the engine works on.
 */
final class Conversions {

    private Conversions() {
    }

    static double[] toArray(List<Double> values) {
        if (values == null) {
            return new double[0];
        }
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            Double value = values.get(i);
            if (value == null || value.isNaN()) {
                throw new IllegalArgumentException("Value at index " + i + " is not a number");
            }
            array[i] = value;
        }
        return array;
    }

    /** Keeps the caller's key order. */
    static Map<String, double[]> toArrays(Map<String, List<Double>> metrics) {
        Map<String, double[]> arrays = new LinkedHashMap<>();
        if (metrics != null) {
            metrics.forEach((name, values) -> arrays.put(name, toArray(values)));
        }
        return arrays;
    }

    static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
