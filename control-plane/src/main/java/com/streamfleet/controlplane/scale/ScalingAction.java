package com.streamfleet.controlplane.scale;

public enum ScalingAction {
    SCALE_UP,
    SCALE_DOWN,
    NO_ACTION
}
