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

import java.math.BigDecimal;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

import net.mathmatrix.common.LangUtils;

/**
 * Contains utility methods for dealing with {@link Matrix} instances: conversion to and from
 * Commons Math's {@link RealMatrix}, and rendering as text.
 */
public final class MatrixUtils {

  private static final String COLUMN_SEPARATOR = "  ";

  private MatrixUtils() {
  }

  /**
   * @param M matrix with at least one row and column
   * @return a newly allocated {@link RealMatrix} with the same entries
   */
  public static RealMatrix toRealMatrix(Matrix M) {
    int rows = M.getRows();
    int columns = M.getColumns();
    Preconditions.checkArgument(rows > 0 && columns > 0, "Can't convert empty matrix %s", M.getOrder());
    double[] items = M.toArray();
    RealMatrix result = new Array2DRowRealMatrix(rows, columns);
    for (int row = 0; row < rows; row++) {
      for (int col = 0; col < columns; col++) {
        result.setEntry(row, col, items[row * columns + col]);
      }
    }
    return result;
  }

  /**
   * @param M any {@link RealMatrix}
   * @return a newly allocated {@link Matrix} with the same entries
   */
  public static Matrix fromRealMatrix(final RealMatrix M) {
    Preconditions.checkNotNull(M);
    return Matrix.generate(new MatrixGenerator() {
      @Override
      public double valueAt(int i, int j) {
        return M.getEntry(i - 1, j - 1);
      }
    }, new Order(M.getRowDimension(), M.getColumnDimension()));
  }

  /**
   * @param M matrix to print
   * @return one line per row; each entry is left-justified to the width of the widest entry in the
   *  matrix and followed by two spaces
   */
  public static String matrixToString(Matrix M) {
    double[] items = M.toArray();
    String[] values = new String[items.length];
    int width = 0;
    for (int i = 0; i < items.length; i++) {
      values[i] = formatValue(items[i]);
      width = FastMath.max(width, values[i].length());
    }
    int columns = M.getColumns();
    StringBuilder result = new StringBuilder();
    for (int i = 0; i < values.length; i++) {
      result.append(Strings.padEnd(values[i], width, ' ')).append(COLUMN_SEPARATOR);
      if ((i + 1) % columns == 0) {
        result.append('\n');
      }
    }
    return result.toString();
  }

  /**
   * @return finite values in plain decimal notation with no trailing zeros, like "3", "0.25" or
   *  "0.0000001"; others as {@link Double#toString(double)} does
   */
  static String formatValue(double value) {
    if (!LangUtils.isFinite(value)) {
      return Double.toString(value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

}
