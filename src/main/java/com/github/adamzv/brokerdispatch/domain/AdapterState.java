package com.github.adamzv.brokerdispatch.domain;

public enum AdapterState {
  IDLE,
  CONNECTING,
  CONSUMING,
  DRAINING,
  STOPPED;

  public boolean isActive() {
    return this == CONNECTING || this == CONSUMING || this == DRAINING;
  }
}
