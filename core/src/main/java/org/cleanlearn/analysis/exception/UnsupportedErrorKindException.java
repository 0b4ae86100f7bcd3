/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis.exception;

/** The requested error kind is not supported by the data cleaning analysis. */
public class UnsupportedErrorKindException extends WhatIfAnalysisException {

  private static final long serialVersionUID = 1L;

  public UnsupportedErrorKindException(String message) {
    super(message);
  }
}
