package com.mk.fx.qa.device.load.store;

public enum MetricStatus {
  SUCCESS,
  FAILURE
}
