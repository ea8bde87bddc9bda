/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.engine;

/**
 * Shape of an executed query's result as far as the gateway cares: its row count.
 *
 * @param rowCount number of rows returned
 */
public record QueryRows(long rowCount) {

  public QueryRows {
    if (rowCount < 0) {
      throw new IllegalArgumentException("rowCount must be >= 0, got: " + rowCount);
    }
  }
}
