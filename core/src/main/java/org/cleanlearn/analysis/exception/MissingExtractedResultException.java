/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis.exception;

import lombok.Getter;

/**
 * A label expected in the results mapping is absent, meaning the plan that should have produced it
 * did not run to completion.
 */
@Getter
public class MissingExtractedResultException extends WhatIfAnalysisException {

  private static final long serialVersionUID = 1L;

  private final String label;

  public MissingExtractedResultException(String label) {
    super(String.format("No extracted result found for label %s", label));
    this.label = label;
  }
}
