/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.cleanlearn.data.page.Page;

/**
 * Comparison table of a data cleaning analysis. The metadata columns {@link #CORRUPTED_COLUMN},
 * {@link #ERROR} and {@link #CLEANING_METHOD} are followed by one metric column per score
 * operator. Row 0 holds the unmodified pipeline, with null metadata.
 */
@ToString
@EqualsAndHashCode
public class Report {

  public static final String CORRUPTED_COLUMN = "corrupted_column";
  public static final String ERROR = "error";
  public static final String CLEANING_METHOD = "cleaning_method";

  private final Page page;

  public Report(Page page) {
    this.page = page;
  }

  public List<String> getColumnNames() {
    return page.getColumnNames();
  }

  public int getRowCount() {
    return page.getPositionCount();
  }

  /**
   * Returns one cell.
   *
   * @param row the row index, 0 is the unmodified pipeline
   * @param columnName the column name
   * @return the value, null for the metadata of row 0
   */
  public Object getValue(int row, String columnName) {
    return page.getValue(row, page.getChannel(columnName));
  }

  /** Returns one row, in column order. */
  public List<Object> getRow(int row) {
    List<Object> values = new ArrayList<>();
    for (int channel = 0; channel < page.getChannelCount(); channel++) {
      values.add(page.getValue(row, channel));
    }
    return values;
  }

  /** Returns one column, in row order. */
  public List<Object> getColumn(String columnName) {
    int channel = page.getChannel(columnName);
    List<Object> values = new ArrayList<>();
    for (int row = 0; row < page.getPositionCount(); row++) {
      values.add(page.getValue(row, channel));
    }
    return values;
  }
}
