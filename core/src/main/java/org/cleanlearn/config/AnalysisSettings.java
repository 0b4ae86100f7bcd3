/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import lombok.Getter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cleanlearn.patch.BranchScope;

/**
 * Settings of the data cleaning analysis. Both interventions default to the training branch only,
 * so the held-out evaluation data stays the same across all variants.
 *
 * <pre>
 * {
 *   "filter": {"train": true, "test": false},
 *   "impute": {"train": true, "test": false},
 *   "cleaningCodeReference": "Data Cleaning"
 * }
 * </pre>
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisSettings {

  private static final Logger LOG = LogManager.getLogger();

  public static final String DEFAULT_CODE_REFERENCE = "Data Cleaning";

  @JsonProperty("filter")
  @JsonSetter(nulls = Nulls.FAIL)
  private BranchScope filterScope = BranchScope.TRAIN_ONLY;

  @JsonProperty("impute")
  @JsonSetter(nulls = Nulls.FAIL)
  private BranchScope imputeScope = BranchScope.TRAIN_ONLY;

  /** Code location tag of the synthetic cleaning operators. */
  @JsonProperty("cleaningCodeReference")
  @JsonSetter(nulls = Nulls.FAIL)
  private String cleaningCodeReference = DEFAULT_CODE_REFERENCE;

  public static AnalysisSettings defaults() {
    return new AnalysisSettings();
  }

  /**
   * Reads settings from a JSON document. Keys that are absent keep their defaults, keys set to
   * null are rejected.
   *
   * @param inputStream the JSON document
   * @return the settings
   * @throws IllegalArgumentException if the document is malformed
   */
  public static AnalysisSettings fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      return objectMapper.readValue(inputStream, AnalysisSettings.class);
    } catch (IOException e) {
      LOG.error("Analysis settings are malformed. Verify the settings document.");
      throw new IllegalArgumentException("Malformed analysis settings json: " + e.getMessage(), e);
    }
  }
}
