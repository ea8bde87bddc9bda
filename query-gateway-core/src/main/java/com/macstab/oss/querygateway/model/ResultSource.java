/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where a query result came from. */
public enum ResultSource {
  DB("db"),
  CACHE("cache");

  private final String wireName;

  ResultSource(final String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
