/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.dag;

import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.cleanlearn.data.transform.PageTransform;

/**
 * A recorded (or synthetic) pipeline operator. Nodes are identified by their id; the attached
 * transform is behaviour and takes no part in identity.
 */
@Getter
@ToString(of = {"nodeId", "operatorType", "description"})
@EqualsAndHashCode(of = "nodeId")
public class OperatorNode {

  private final long nodeId;
  private final CodeLocation codeLocation;
  private final OperatorType operatorType;
  private final String description;
  private final List<String> columns;
  private final PageTransform transform;

  /**
   * Creates a node.
   *
   * @param nodeId unique id within the graph and every analysis extending it
   * @param codeLocation where the operator was called
   * @param operatorType operator kind
   * @param description human-readable description
   * @param columns the columns the operator outputs, empty if unknown
   * @param transform the data-level behaviour, null for recorded operators
   */
  public OperatorNode(
      long nodeId,
      CodeLocation codeLocation,
      OperatorType operatorType,
      String description,
      List<String> columns,
      PageTransform transform) {
    this.nodeId = nodeId;
    this.codeLocation = codeLocation;
    this.operatorType = operatorType;
    this.description = description;
    this.columns = columns == null ? List.of() : List.copyOf(columns);
    this.transform = transform;
  }

  public Optional<PageTransform> getTransform() {
    return Optional.ofNullable(transform);
  }
}
