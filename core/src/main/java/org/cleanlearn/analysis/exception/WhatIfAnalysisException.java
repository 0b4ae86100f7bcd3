/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis.exception;

/**
 * Base exception for a what-if analysis that cannot be satisfied by the given pipeline graph or
 * result set. Not retryable.
 */
public class WhatIfAnalysisException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public WhatIfAnalysisException(String message) {
    super(message);
  }
}
