/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis.exception;

/** The pipeline graph does not contain exactly one predict operator. */
public class MultiplePredictNodesException extends WhatIfAnalysisException {

  private static final long serialVersionUID = 1L;

  public MultiplePredictNodesException(String message) {
    super(message);
  }
}
