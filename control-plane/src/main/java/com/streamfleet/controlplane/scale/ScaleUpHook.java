package com.streamfleet.controlplane.scale;

/**
 * Provisions new instances. Runs on a blocking-friendly scheduler.
 */
@FunctionalInterface
public interface ScaleUpHook {

    void onScaleUp(int count) throws Exception;
}
