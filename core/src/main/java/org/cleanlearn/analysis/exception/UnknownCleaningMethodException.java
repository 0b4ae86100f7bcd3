/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis.exception;

/** The requested cleaning method is unknown. */
public class UnknownCleaningMethodException extends WhatIfAnalysisException {

  private static final long serialVersionUID = 1L;

  public UnknownCleaningMethodException(String message) {
    super(message);
  }
}
