package com.mk.fx.qa.device.load.store;

/** A record could not be persisted after bounded waiting and retrying. */
public class StoreWriteException extends MetricStoreException {

  public StoreWriteException(String message) {
    super(message);
  }

  public StoreWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
