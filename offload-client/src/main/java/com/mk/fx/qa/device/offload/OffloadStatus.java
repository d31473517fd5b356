package com.mk.fx.qa.device.offload;

public enum OffloadStatus {
    SUCCESS,
    FAILURE
}
