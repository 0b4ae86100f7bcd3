/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.data.page;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import lombok.EqualsAndHashCode;

/**
 * Simple row-based {@link Page} implementation. Each row is an Object array where the index
 * corresponds to the column (channel) position, paired with the row's id.
 */
@EqualsAndHashCode
public class RowPage implements Page {

  private final List<String> columnNames;
  private final long[] rowIds;
  private final Object[][] rows;

  /**
   * Creates a RowPage from pre-built row data.
   *
   * @param columnNames the column names, one per channel
   * @param rowIds the id of each row
   * @param rows 2D array where rows[i][j] is the value at row i, column j
   */
  public RowPage(List<String> columnNames, long[] rowIds, Object[][] rows) {
    Preconditions.checkArgument(
        rowIds.length == rows.length,
        "Got %s row ids for %s rows", rowIds.length, rows.length);
    this.columnNames = ImmutableList.copyOf(columnNames);
    this.rowIds = rowIds;
    this.rows = rows;
  }

  @Override
  public int getPositionCount() {
    return rows.length;
  }

  @Override
  public int getChannelCount() {
    return columnNames.size();
  }

  @Override
  public List<String> getColumnNames() {
    return columnNames;
  }

  @Override
  public Object getValue(int position, int channel) {
    checkPosition(position);
    if (channel < 0 || channel >= columnNames.size()) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + columnNames.size() + ")");
    }
    return rows[position][channel];
  }

  @Override
  public long getRowId(int position) {
    checkPosition(position);
    return rowIds[position];
  }

  private void checkPosition(int position) {
    if (position < 0 || position >= rows.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + rows.length + ")");
    }
  }

  @Override
  public String toString() {
    return "RowPage{columns=" + columnNames + ", rows=" + Arrays.deepToString(rows) + '}';
  }
}
