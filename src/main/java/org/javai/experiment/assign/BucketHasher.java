package org.javai.experiment.assign;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Stable hash of (test, user) into the unit interval.
 *
 * <p>SHA-256 over the UTF-8 bytes of {@code testId + ":" + userId}; the first 8 bytes are read
 * as an unsigned big-endian integer and its top 53 bits scaled into {@code [0, 1)}. The result
 * depends on nothing but the two ids, so it survives restarts and is reproducible by any
 * other implementation of the same recipe.
 */
public final class BucketHasher {

    static final String ROLLOUT_SALT = "rollout:";
    private static final double UNIT = 0x1.0p-53;

    /**
     * Bucket used to pick the variant.
     */
    public double bucket(String testId, String userId) {
        return unitInterval(testId + ":" + userId);
    }

    /**
     * Independent bucket used for the rollout gate, so that rollout and variant choice do not
     * correlate.
     */
    public double rolloutBucket(String testId, String userId) {
        return unitInterval(ROLLOUT_SALT + testId + ":" + userId);
    }

    /**
     * Index of the arm whose half-open range {@code [lo, hi)} holds the bucket.
     * Residue from weights that do not sum exactly to 1 falls to the last arm with weight.
     */
    public static int pick(double[] weights, double bucket) {
        double cumulative = 0.0;
        int lastWeighted = -1;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] <= 0.0) {
                continue;
            }
            lastWeighted = i;
            cumulative += weights[i];
            if (bucket < cumulative) {
                return i;
            }
        }
        if (lastWeighted < 0) {
            throw new IllegalArgumentException("No arm carries traffic weight");
        }
        return lastWeighted;
    }

    static double unitInterval(String key) {
        byte[] digest = sha256().digest(key.getBytes(StandardCharsets.UTF_8));
        long h = 0;
        for (int i = 0; i < 8; i++) {
            h = (h << 8) | (digest[i] & 0xFF);
        }
        return (h >>> 11) * UNIT;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
