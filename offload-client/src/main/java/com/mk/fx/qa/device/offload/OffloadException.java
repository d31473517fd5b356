package com.mk.fx.qa.device.offload;

/** Transport-level failure talking to the offload platform. */
public class OffloadException extends Exception {

    public OffloadException(String message) {
        super(message);
    }

    public OffloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
