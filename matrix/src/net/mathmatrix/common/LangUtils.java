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

package net.mathmatrix.common;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;

/**
 * General utility methods related to the language, or primitives.
 */
public final class LangUtils {

  private LangUtils() {
  }

  /**
   * @return true if argument is not {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} or
   *  {@link Double#NEGATIVE_INFINITY}
   */
  public static boolean isFinite(double d) {
    return !(Double.isNaN(d) || Double.isInfinite(d));
  }

  /**
   * @param count number of items, nonnegative
   * @return the integer square root of {@code count} if {@code count} is a perfect square, or -1
   */
  public static int perfectSquareRoot(int count) {
    Preconditions.checkArgument(count >= 0, "Negative count: %s", count);
    int root = (int) FastMath.round(FastMath.sqrt(count));
    return (long) root * root == count ? root : -1;
  }

  /**
   * Rounds to the nearest integral value, with ties going away from zero. Unlike
   * {@link FastMath#rint(double)} a tie like 2.5 becomes 3.0, and -2.5 becomes -3.0.
   * Non-finite values are returned unchanged, and the sign of zero is kept.
   *
   * @param d value to round
   * @return nearest integral value as a {@code double}
   */
  public static double roundHalfAwayFromZero(double d) {
    if (!isFinite(d)) {
      return d;
    }
    double magnitude = FastMath.abs(d);
    double floor = FastMath.floor(magnitude);
    double rounded = magnitude - floor >= 0.5 ? floor + 1.0 : floor;
    return FastMath.copySign(rounded, d);
  }

}
