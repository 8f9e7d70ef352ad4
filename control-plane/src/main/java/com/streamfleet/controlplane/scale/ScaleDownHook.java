package com.streamfleet.controlplane.scale;

import java.util.List;

/**
 * Terminates the given instances. Runs on a blocking-friendly scheduler.
 */
@FunctionalInterface
public interface ScaleDownHook {

    /**
     * @param instanceIds registry ids of the instances to remove, least loaded first
     */
    void onScaleDown(List<String> instanceIds) throws Exception;
}
