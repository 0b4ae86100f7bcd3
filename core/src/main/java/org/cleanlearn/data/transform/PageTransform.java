/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.data.transform;

import org.cleanlearn.data.page.Page;

/**
 * The data-level behaviour attached to a pipeline operator. Implementations are built with their
 * parameters bound and must not modify the input page.
 */
@FunctionalInterface
public interface PageTransform {

  /**
   * Applies the transform.
   *
   * @param input the page produced by the upstream operator
   * @return a new page, the input is left untouched
   */
  Page apply(Page input);
}
