/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

/**
 * The visitor of {@link PipelinePatch}. Every patch variant has its own method, so a new variant
 * does not compile until all visitors handle it.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface PatchVisitor<R, C> {

  R visitDataFiltering(DataFiltering patch, C context);

  R visitDataProjection(DataProjection patch, C context);

  R visitExtraction(Extraction patch, C context);
}
