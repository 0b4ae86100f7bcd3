/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.cleanlearn.analysis.CleaningMethod;
import org.cleanlearn.analysis.CleaningSpec;
import org.cleanlearn.analysis.ErrorType;
import org.cleanlearn.analysis.exception.UnknownCleaningMethodException;
import org.cleanlearn.analysis.exception.UnsupportedErrorKindException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CleaningSpecConfigTest {

  @Test
  void should_read_a_cleaning_spec_document() throws Exception {
    CleaningSpec spec;
    try (InputStream inputStream = getClass().getResourceAsStream("/config/age_outliers.json")) {
      spec = CleaningSpecConfig.fromInputStream(inputStream).toCleaningSpec();
    }

    assertEquals("age", spec.getColumn());
    assertEquals(ErrorType.OUTLIER, spec.getErrorType());
    assertEquals(List.of(CleaningMethod.FILTER, CleaningMethod.IMPUTE), spec.getCleanings());
    assertEquals(40, spec.getImputeConstant());
    assertTrue(spec.getOutlierPredicate().test(121));
    assertFalse(spec.getOutlierPredicate().test(120));
  }

  @Test
  void should_reject_an_unknown_cleaning_method() {
    CleaningSpecConfig config =
        parse(
            "{\"column\": \"age\", \"error\": \"outliers\", \"cleanings\": [\"drop\"],"
                + " \"outlierRange\": {\"lower\": 0, \"upper\": 1}}");

    assertThrows(UnknownCleaningMethodException.class, config::toCleaningSpec);
  }

  @Test
  void should_reject_an_unsupported_error_kind() {
    CleaningSpecConfig config =
        parse(
            "{\"column\": \"age\", \"error\": \"missing_values\", \"cleanings\": [\"filter\"],"
                + " \"outlierRange\": {\"lower\": 0, \"upper\": 1}}");

    assertThrows(UnsupportedErrorKindException.class, config::toCleaningSpec);
  }

  @Test
  void should_reject_a_document_without_column() {
    CleaningSpecConfig config =
        parse(
            "{\"error\": \"outliers\", \"cleanings\": [\"filter\"],"
                + " \"outlierRange\": {\"lower\": 0, \"upper\": 1}}");

    IllegalArgumentException exception =
        assertThrows(IllegalArgumentException.class, config::toCleaningSpec);
    assertEquals("Missing column. Column is a required parameter.", exception.getMessage());
  }

  @Test
  void should_reject_a_document_without_outlier_range() {
    CleaningSpecConfig config =
        parse("{\"column\": \"age\", \"error\": \"outliers\", \"cleanings\": [\"filter\"]}");

    assertThrows(IllegalArgumentException.class, config::toCleaningSpec);
  }

  @Test
  void should_reject_malformed_json() {
    assertThrows(IllegalArgumentException.class, () -> parse("{\"column\": "));
  }

  private static CleaningSpecConfig parse(String json) {
    return CleaningSpecConfig.fromInputStream(
        new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }
}
