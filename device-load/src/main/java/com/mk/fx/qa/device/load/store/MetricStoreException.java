package com.mk.fx.qa.device.load.store;

/** The metric store could not complete an operation. */
public class MetricStoreException extends RuntimeException {

  public MetricStoreException(String message) {
    super(message);
  }

  public MetricStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
