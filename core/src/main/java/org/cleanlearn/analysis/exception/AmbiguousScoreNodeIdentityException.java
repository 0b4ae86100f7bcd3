/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis.exception;

/** Score operators of the pipeline cannot be told apart by their source line. */
public class AmbiguousScoreNodeIdentityException extends WhatIfAnalysisException {

  private static final long serialVersionUID = 1L;

  public AmbiguousScoreNodeIdentityException(String message) {
    super(message);
  }
}
