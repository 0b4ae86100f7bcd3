/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.data.page;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link Page} row by row. Call {@link #beginRow(long)}, set values via {@link
 * #setValue(int, Object)} or copy them with {@link #copyRow(Page, int)}, then {@link #endRow()} to
 * commit. Call {@link #build()} to produce the final Page.
 */
public class PageBuilder {

  private final List<String> columnNames;
  private final List<Object[]> rows;
  private final List<Long> rowIds;
  private Object[] currentRow;
  private long currentRowId;

  public PageBuilder(List<String> columnNames) {
    this.columnNames = List.copyOf(columnNames);
    this.rows = new ArrayList<>();
    this.rowIds = new ArrayList<>();
  }

  /**
   * Starts a new row. Values default to null.
   *
   * @param rowId the id the row carries
   */
  public void beginRow(long rowId) {
    currentRow = new Object[columnNames.size()];
    currentRowId = rowId;
  }

  /**
   * Sets a value in the current row.
   *
   * @param channel the column index (0-based)
   * @param value the value to set
   */
  public void setValue(int channel, Object value) {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before setValue()");
    }
    if (channel < 0 || channel >= columnNames.size()) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + columnNames.size() + ")");
    }
    currentRow[channel] = value;
  }

  /**
   * Starts a row that is a copy of a row of another page with the same columns. The copy can be
   * changed with {@link #setValue(int, Object)} before {@link #endRow()}.
   *
   * @param source the page to copy from
   * @param position the row of the source page
   */
  public void copyRow(Page source, int position) {
    if (!source.getColumnNames().equals(columnNames)) {
      throw new IllegalArgumentException(
          "Cannot copy a row with columns " + source.getColumnNames() + " into " + columnNames);
    }
    beginRow(source.getRowId(position));
    for (int channel = 0; channel < columnNames.size(); channel++) {
      currentRow[channel] = source.getValue(position, channel);
    }
  }

  /** Commits the current row to the page. */
  public void endRow() {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before endRow()");
    }
    rows.add(currentRow);
    rowIds.add(currentRowId);
    currentRow = null;
  }

  /** Returns the number of rows added so far. */
  public int getRowCount() {
    return rows.size();
  }

  /** Returns true if no rows have been added. */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Builds the final Page from all committed rows and resets the builder. */
  public Page build() {
    if (currentRow != null) {
      throw new IllegalStateException("endRow() must be called before build()");
    }
    Object[][] data = rows.toArray(new Object[0][]);
    long[] ids = rowIds.stream().mapToLong(Long::longValue).toArray();
    rows.clear();
    rowIds.clear();
    return new RowPage(columnNames, ids, data);
  }
}
