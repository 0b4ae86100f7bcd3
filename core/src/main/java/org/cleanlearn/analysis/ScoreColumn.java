/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** A metric column of the report: one score description at one source line. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class ScoreColumn {

  private final String description;
  private final int lineNumber;

  /** Returns {@code {description}_L{lineNumber}}. */
  public String getColumnName() {
    return description + "_L" + lineNumber;
  }
}
