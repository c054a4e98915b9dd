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

import com.google.common.base.Preconditions;

import net.mathmatrix.common.LangUtils;

/**
 * <p>The determinant of a square grid of values, given in row-major order. An instance is a
 * snapshot: it copies the values it's given and never observes later changes to their source.</p>
 *
 * <p>Values are computed by Laplace expansion along the first column, always in increasing row
 * order, so that the floating-point summation order is fixed and results are reproducible.
 * Minors are not copied out; they are addressed through arrays of the remaining row and column
 * indices into the snapshot.</p>
 *
 * <p>Time is factorial in {@link #getSize()}, and nothing is cached between calls. This is only
 * suitable for small grids.</p>
 */
public final class Determinant {

  private final double[] items;
  private final int size;

  /**
   * @param items values in row-major order
   * @throws MatrixException with {@link MatrixError#INAPPROPRIATE_NUMBER_OF_ITEMS} if the number of
   *  values is not a perfect square
   */
  public Determinant(double... items) throws MatrixException {
    Preconditions.checkNotNull(items);
    int size = LangUtils.perfectSquareRoot(items.length);
    if (size < 0) {
      throw new MatrixException(MatrixError.INAPPROPRIATE_NUMBER_OF_ITEMS, items.length + " items");
    }
    this.items = items.clone();
    this.size = size;
  }

  /**
   * @return number of rows, and of columns
   */
  public int getSize() {
    return size;
  }

  /**
   * @return value of the determinant; 0 for an empty (0 x 0) determinant
   */
  public double value() {
    int[] all = range(size);
    return valueOf(all, all);
  }

  /**
   * @param i 1-based row
   * @param j 1-based column
   * @return the minor at {@code (i,j)} multiplied by {@code (-1)^i * (-1)^j}
   * @throws MatrixException with {@link MatrixError#INDEX_OUT_OF_RANGE} unless
   *  {@code 1 <= i,j <= size}
   */
  public double cofactor(int i, int j) throws MatrixException {
    if (i < 1 || i > size || j < 1 || j > size) {
      throw new MatrixException(MatrixError.INDEX_OUT_OF_RANGE, "(" + i + ", " + j + ") in size " + size);
    }
    int[] all = range(size);
    int[] rows = without(all, i - 1);
    int[] columns = without(all, j - 1);
    // The empty minor of a 1 x 1 determinant counts as 1
    double minor = rows.length == 0 ? 1.0 : valueOf(rows, columns);
    return i % 2 == j % 2 ? minor : -minor;
  }

  private double at(int row, int column) {
    return items[row * size + column];
  }

  /**
   * @param rows rows of the snapshot that make up the minor, ascending
   * @param columns columns of the snapshot that make up the minor, ascending; same length as rows
   */
  private double valueOf(int[] rows, int[] columns) {
    int n = rows.length;
    switch (n) {
      case 0:
        return 0.0;
      case 1:
        return at(rows[0], columns[0]);
      case 2:
        return at(rows[0], columns[0]) * at(rows[1], columns[1]) -
               at(rows[0], columns[1]) * at(rows[1], columns[0]);
      default:
        break;
    }
    int[] minorColumns = without(columns, 0);
    double value = 0.0;
    for (int i = 0; i < n; i++) {
      double item = at(rows[i], columns[0]);
      double minor = valueOf(without(rows, i), minorColumns);
      if (i % 2 == 0) {
        value += minor * item;
      } else {
        value -= minor * item;
      }
    }
    return value;
  }

  private static int[] range(int n) {
    int[] result = new int[n];
    for (int i = 0; i < n; i++) {
      result[i] = i;
    }
    return result;
  }

  /**
   * @return copy of {@code indices} without the element at {@code position}
   */
  private static int[] without(int[] indices, int position) {
    int[] result = new int[indices.length - 1];
    System.arraycopy(indices, 0, result, 0, position);
    System.arraycopy(indices, position + 1, result, position, result.length - position);
    return result;
  }

}
