/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.cleanlearn.dag.PipelineGraph;

/**
 * State shared by the analyses of one top-level run: the id sources for synthetic nodes and
 * patches, and the results mapping the execution engine fills in. Ids are strictly increasing and
 * never reused, also across analyses planning concurrently against the same context.
 */
public class AnalysisContext {

  private final AtomicLong nextOpId;
  private final AtomicLong nextPatchId;
  private final Map<String, Object> labelsToExtractedPlanResults;

  public AnalysisContext() {
    this(0L);
  }

  /**
   * Creates a context.
   *
   * @param firstOpId the first id handed out for synthetic nodes
   */
  public AnalysisContext(long firstOpId) {
    this.nextOpId = new AtomicLong(firstOpId);
    this.nextPatchId = new AtomicLong(0L);
    this.labelsToExtractedPlanResults = new ConcurrentHashMap<>();
  }

  /** Creates a context whose synthetic node ids start above every id recorded in the graph. */
  public static AnalysisContext forGraph(PipelineGraph graph) {
    return new AnalysisContext(graph.maxNodeId() + 1);
  }

  public long getNextOpId() {
    return nextOpId.getAndIncrement();
  }

  public long getNextPatchId() {
    return nextPatchId.getAndIncrement();
  }

  /**
   * Stores a result extracted while running a plan.
   *
   * @param label the extraction label
   * @param result the result, not null
   */
  public void putResult(String label, Object result) {
    Preconditions.checkNotNull(label, "label");
    Preconditions.checkNotNull(result, "Result for label %s must not be null", label);
    labelsToExtractedPlanResults.put(label, result);
  }

  public Optional<Object> getResult(String label) {
    return Optional.ofNullable(labelsToExtractedPlanResults.get(label));
  }

  /** Returns a read-only view of the results mapping. */
  public Map<String, Object> getResults() {
    return Collections.unmodifiableMap(labelsToExtractedPlanResults);
  }
}
