package com.questrail.chamber.hardware;

/**
 * Port to the hazard input watched by the safety monitor (smoke/flame sensor).
 */
@FunctionalInterface
public interface HazardDetector
{
    /**
     * Returns true while the hazard input is asserted.
     */
    boolean hazardPresent() throws Exception;

    /**
     * A detector for installations without a hazard input.
     */
    static HazardDetector none() {
        return () -> false;
    }
}
