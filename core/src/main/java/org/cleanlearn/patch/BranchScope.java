/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Which side of the train/test split a data intervention is spliced into. */
@Getter
@ToString
@EqualsAndHashCode
public class BranchScope {

  public static final BranchScope TRAIN_ONLY = new BranchScope(true, false);

  private final boolean train;
  private final boolean test;

  @JsonCreator
  public BranchScope(@JsonProperty("train") boolean train, @JsonProperty("test") boolean test) {
    this.train = train;
    this.test = test;
  }
}
