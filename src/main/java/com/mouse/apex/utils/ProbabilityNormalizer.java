package com.mouse.apex.utils;

import com.mouse.apex.model.ProbabilityPair;
import com.mouse.apex.model.ProbabilityTriple;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.mouse.apex.utils.NumberUtils.clamp;
import static com.mouse.apex.utils.NumberUtils.round1;

/**
 * Bound-respecting renormalization of outcome percentages.
 * <p>
 * Output values lie in [{@value #MIN_PROB}, {@value #MAX_PROB}] and sum to 100 within
 * {@value #SUM_TOLERANCE}. Clamping and rescaling are interleaved in a small bounded loop
 * because neither alone can satisfy both constraints.
 */
@Slf4j
public class ProbabilityNormalizer {

    public static final double MIN_PROB = 5.0;
    public static final double MAX_PROB = 95.0;
    public static final double SUM_TOLERANCE = 0.001;

    private static final double RESCALE_THRESHOLD = 0.01;
    private static final double EPSILON = 1e-9;
    private static final int MAX_PASSES = 2;

    private ProbabilityNormalizer() {
    }

    public static ProbabilityTriple normalize(ProbabilityTriple raw) {
        return ProbabilityTriple.of(normalizeValues(raw.toArray()));
    }

    public static ProbabilityPair normalize(ProbabilityPair raw) {
        return ProbabilityPair.of(normalizeValues(raw.toArray()));
    }

    /**
     * Normalize two or three percentages. Ties during residual correction resolve in
     * array order (home, draw, away / option1, option2).
     *
     * @param raw raw percentages, possibly out of bounds or not summing to 100
     * @return a new array satisfying both invariants, or a best-effort array when no
     * entry has headroom left
     */
    public static double[] normalizeValues(double... raw) {
        if (raw == null || raw.length < 2) {
            throw new IllegalArgumentException("Normalization needs at least two outcomes");
        }
        double[] v = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            double value = raw[i];
            if (!Double.isFinite(value)) {
                log.warn("Non-finite probability replaced with even share | Index: {} | Value: {}", i, value);
                value = 100.0 / raw.length;
            }
            v[i] = clamp(value, MIN_PROB, MAX_PROB);
        }

        double sum = sum(v);
        if (Math.abs(sum - 100.0) > RESCALE_THRESHOLD) {
            double factor = 100.0 / sum;
            for (int i = 0; i < v.length; i++) {
                v[i] = v[i] * factor;
            }
        }

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            reclampAndRedistribute(v);
            for (int i = 0; i < v.length; i++) {
                v[i] = round1(v[i]);
            }
            correctResidual(v);
            if (satisfiesInvariants(v)) {
                break;
            }
        }

        if (!satisfiesInvariants(v)) {
            log.warn("NormalizationTolerance: invariants not met after {} passes | Input: {} | Output: {} | Sum: {}",
                    MAX_PASSES, Arrays.toString(raw), Arrays.toString(v), sum(v));
        }
        return v;
    }

    /** Violations of the bound and sum invariants; empty when the values are valid. */
    public static List<String> verify(double... values) {
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] < MIN_PROB || values[i] > MAX_PROB) {
                errors.add(String.format("Probability %.2f%% at index %d out of bounds [%.0f, %.0f]",
                        values[i], i, MIN_PROB, MAX_PROB));
            }
        }
        double sum = sum(values);
        if (Math.abs(sum - 100.0) > SUM_TOLERANCE) {
            errors.add(String.format("Probabilities sum to %.3f%%, not 100%%", sum));
        }
        return errors;
    }

    public static boolean satisfiesInvariants(double... values) {
        return verify(values).isEmpty();
    }

    private static void reclampAndRedistribute(double[] v) {
        for (int i = 0; i < v.length; i++) {
            v[i] = clamp(v[i], MIN_PROB, MAX_PROB);
        }
        // Each round pins at least one more entry, so v.length rounds are enough.
        for (int round = 0; round < v.length; round++) {
            double residual = 100.0 - sum(v);
            if (Math.abs(residual) < EPSILON) {
                return;
            }
            int open = 0;
            for (double value : v) {
                if (hasHeadroom(value, residual)) open++;
            }
            if (open == 0) {
                return;
            }
            double share = residual / open;
            for (int i = 0; i < v.length; i++) {
                if (hasHeadroom(v[i], residual)) {
                    v[i] = clamp(v[i] + share, MIN_PROB, MAX_PROB);
                }
            }
        }
    }

    private static void correctResidual(double[] v) {
        double residual = round1(100.0 - sum(v));
        if (Math.abs(residual) < EPSILON) {
            return;
        }

        int target = -1;
        for (int i = 0; i < v.length; i++) {
            double room = residual > 0 ? MAX_PROB - v[i] : v[i] - MIN_PROB;
            if (room + EPSILON >= Math.abs(residual) && (target < 0 || v[i] > v[target])) {
                target = i;
            }
        }
        if (target < 0) {
            // Nobody can take the whole residual: give it to whoever has the most room.
            double bestRoom = 0.0;
            for (int i = 0; i < v.length; i++) {
                double room = residual > 0 ? MAX_PROB - v[i] : v[i] - MIN_PROB;
                if (room > bestRoom + EPSILON) {
                    bestRoom = room;
                    target = i;
                }
            }
        }
        if (target < 0) {
            return;
        }
        v[target] = round1(clamp(v[target] + residual, MIN_PROB, MAX_PROB));
    }

    private static boolean hasHeadroom(double value, double residual) {
        return residual > 0 ? value < MAX_PROB : value > MIN_PROB;
    }

    private static double sum(double[] v) {
        double total = 0.0;
        for (double value : v) {
            total += value;
        }
        return total;
    }
}
