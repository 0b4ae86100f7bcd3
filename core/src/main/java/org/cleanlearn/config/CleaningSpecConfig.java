/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cleanlearn.analysis.CleaningMethod;
import org.cleanlearn.analysis.CleaningSpec;
import org.cleanlearn.analysis.ErrorType;
import org.cleanlearn.data.transform.RangeOutlierPredicate;

/**
 * JSON form of a {@link CleaningSpec}. Outliers are described by a closed value range:
 *
 * <pre>
 * {
 *   "column": "age",
 *   "error": "outliers",
 *   "cleanings": ["filter", "impute"],
 *   "imputeConstant": 40,
 *   "outlierRange": {"lower": 0, "upper": 110}
 * }
 * </pre>
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class CleaningSpecConfig {

  private static final Logger LOG = LogManager.getLogger();

  @JsonProperty(required = true)
  private String column;

  @JsonProperty(required = true)
  private String error;

  @JsonProperty(required = true)
  private List<String> cleanings;

  private Object imputeConstant;

  @JsonProperty(required = true)
  private OutlierRange outlierRange;

  /** Values outside {@code [lower, upper]} are outliers. */
  @Getter
  @Setter
  @NoArgsConstructor
  public static class OutlierRange {
    private double lower;
    private double upper;
  }

  /**
   * Resolves the error kind and cleaning methods and builds the cleaning spec.
   *
   * @throws org.cleanlearn.analysis.exception.UnsupportedErrorKindException for an unknown error
   * @throws org.cleanlearn.analysis.exception.UnknownCleaningMethodException for an unknown method
   */
  public CleaningSpec toCleaningSpec() {
    Preconditions.checkArgument(cleanings != null, "Missing cleanings");
    Preconditions.checkArgument(outlierRange != null, "Missing outlierRange");
    List<CleaningMethod> methods =
        cleanings.stream().map(CleaningMethod::fromValue).collect(Collectors.toList());
    return new CleaningSpec(
        column,
        ErrorType.fromValue(error),
        methods,
        new RangeOutlierPredicate(outlierRange.getLower(), outlierRange.getUpper()),
        imputeConstant);
  }

  /**
   * Reads a cleaning spec from a JSON document.
   *
   * @param inputStream the JSON document
   * @return the parsed config
   */
  public static CleaningSpecConfig fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      return objectMapper.readValue(inputStream, CleaningSpecConfig.class);
    } catch (IOException e) {
      LOG.error("Cleaning spec is malformed. Verify the cleaning spec document.");
      throw new IllegalArgumentException("Malformed cleaning spec json: " + e.getMessage(), e);
    }
  }
}
