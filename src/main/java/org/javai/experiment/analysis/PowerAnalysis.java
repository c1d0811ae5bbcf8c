package org.javai.experiment.analysis;

/**
 * @param requiredSampleSizePerArm exposures per arm needed to detect the primary goal's
 *                                 minimum detectable effect; 0 when no effect is configured
 * @param smallestArm exposures of the smallest arm at analysis time
 * @param observedPower power against the largest observed effect
 */
public record PowerAnalysis(long requiredSampleSizePerArm, long smallestArm, double observedPower) {
}
