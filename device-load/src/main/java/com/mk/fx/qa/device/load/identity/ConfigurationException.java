package com.mk.fx.qa.device.load.identity;

/** A run is misconfigured and must not start. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }
}
