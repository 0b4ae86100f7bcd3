/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Identity of one data cleaning analysis: two analyses with equal ids ask the same question and
 * produce the same plans.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class AnalysisId {

  private final String column;
  private final ErrorType errorType;
  private final Object imputeConstant;
  private final List<CleaningMethod> cleanings;
}
