/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.data.page;

import java.util.List;

/**
 * A batch of rows flowing through a pipeline operator. Columns (channels) are named, and every row
 * keeps the id it had in the frame it was derived from, so filtered or rewritten pages can still be
 * aligned with their source.
 */
public interface Page {

  /** Returns the number of rows in this page. */
  int getPositionCount();

  /** Returns the number of columns in this page. */
  int getChannelCount();

  /** Returns the column names, in channel order. */
  List<String> getColumnNames();

  /**
   * Returns the channel index of a column.
   *
   * @param columnName the column name
   * @return the 0-based channel index
   * @throws IllegalArgumentException if the page has no such column
   */
  default int getChannel(String columnName) {
    int channel = getColumnNames().indexOf(columnName);
    if (channel < 0) {
      throw new IllegalArgumentException(
          "Column " + columnName + " not found in " + getColumnNames());
    }
    return channel;
  }

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  Object getValue(int position, int channel);

  /**
   * Returns the id of the row at the given position. Row ids survive filtering and rewriting.
   *
   * @param position the row index (0-based)
   * @return the row id
   */
  long getRowId(int position);
}
