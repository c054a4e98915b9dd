/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.mathmatrix.matrix;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What {@link Matrix#inverse()} does with a matrix whose determinant is exactly 0.
 * The default comes from system property {@code matrix.inverse.singularityPolicy}.
 */
public enum SingularityPolicy {

  /** Fail with {@link MatrixError#SINGULAR_MATRIX}. */
  REJECT,

  /**
   * Divide by the zero determinant anyway, so the result holds infinities and {@link Double#NaN}
   * following IEEE 754.
   */
  PROPAGATE,
  ;

  private static final Logger log = LoggerFactory.getLogger(SingularityPolicy.class);

  static final String PROPERTY = "matrix.inverse.singularityPolicy";

  private static final SingularityPolicy DEFAULT = parse(System.getProperty(PROPERTY));

  /**
   * @return the policy configured by {@code matrix.inverse.singularityPolicy}, or {@link #REJECT}
   */
  public static SingularityPolicy getDefault() {
    return DEFAULT;
  }

  /**
   * @param value policy name, case-insensitive; may be {@code null}
   * @return named policy, or {@link #REJECT} if {@code value} is {@code null} or names no policy
   */
  static SingularityPolicy parse(String value) {
    if (value == null || value.isEmpty()) {
      return REJECT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ENGLISH));
    } catch (IllegalArgumentException iae) {
      log.warn("Ignoring unknown {} value {}; using {}", PROPERTY, value, REJECT);
      return REJECT;
    }
  }

}
