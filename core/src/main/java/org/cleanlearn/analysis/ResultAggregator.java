/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import lombok.extern.log4j.Log4j2;
import org.cleanlearn.analysis.exception.MissingExtractedResultException;
import org.cleanlearn.data.page.PageBuilder;

/**
 * Turns the results mapping filled in by the execution engine into a {@link Report}. Result values
 * are opaque and copied into the report as they are.
 */
@Log4j2
public class ResultAggregator {

  /**
   * Builds the report.
   *
   * @param scoreColumns the score operators as (description, line), in the order they were found;
   *     repeated entries are reported once
   * @param spec the cleaning spec the plans were generated from
   * @param results the results mapping, label to result
   * @return the report, baseline first, then one row per cleaning method in request order
   * @throws MissingExtractedResultException if any required label has no result; no report is
   *     built in that case
   */
  public Report buildReport(
      List<ScoreColumn> scoreColumns, CleaningSpec spec, Map<String, ?> results) {
    List<ScoreColumn> metricColumns = new ArrayList<>(new LinkedHashSet<>(scoreColumns));

    List<String> columnNames = new ArrayList<>();
    columnNames.add(Report.CORRUPTED_COLUMN);
    columnNames.add(Report.ERROR);
    columnNames.add(Report.CLEANING_METHOD);
    metricColumns.forEach(scoreColumn -> columnNames.add(scoreColumn.getColumnName()));

    List<Object[]> rows = new ArrayList<>();
    rows.add(row(null, null, null, metricColumns, Labels::original, results));
    for (CleaningMethod method : spec.getCleanings()) {
      rows.add(
          row(
              spec.getColumn(),
              spec.getErrorType().getValue(),
              method.getValue(),
              metricColumns,
              line -> Labels.forLine(Labels.cleaningPrefix(spec.getColumn(), method), line),
              results));
    }

    PageBuilder builder = new PageBuilder(columnNames);
    for (int rowId = 0; rowId < rows.size(); rowId++) {
      builder.beginRow(rowId);
      Object[] values = rows.get(rowId);
      for (int channel = 0; channel < values.length; channel++) {
        builder.setValue(channel, values[channel]);
      }
      builder.endRow();
    }
    log.info(
        "Built data cleaning report for column {} with {} rows and {} metric columns",
        spec.getColumn(),
        rows.size(),
        metricColumns.size());
    return new Report(builder.build());
  }

  private Object[] row(
      String column,
      String error,
      String method,
      List<ScoreColumn> metricColumns,
      IntFunction<String> labelForLine,
      Map<String, ?> results) {
    Object[] values = new Object[3 + metricColumns.size()];
    values[0] = column;
    values[1] = error;
    values[2] = method;
    for (int i = 0; i < metricColumns.size(); i++) {
      String label = labelForLine.apply(metricColumns.get(i).getLineNumber());
      Object result = results.get(label);
      if (result == null) {
        log.error("Result {} is missing, the plan producing it did not complete", label);
        throw new MissingExtractedResultException(label);
      }
      values[3 + i] = result;
    }
    return values;
  }
}
