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

/**
 * The order, or shape, of a matrix: its number of rows and columns.
 */
public final class Order {

  private final int rows;
  private final int columns;
  private final int count;

  /**
   * @throws IllegalArgumentException if either dimension is negative, or a matrix of this order
   *  would hold more than {@link Integer#MAX_VALUE} items
   */
  public Order(int rows, int columns) {
    Preconditions.checkArgument(rows >= 0, "Negative rows: %s", rows);
    Preconditions.checkArgument(columns >= 0, "Negative columns: %s", columns);
    long count = (long) rows * columns;
    Preconditions.checkArgument(count <= Integer.MAX_VALUE, "Too many items for order (%s, %s)", rows, columns);
    this.rows = rows;
    this.columns = columns;
    this.count = (int) count;
  }

  /**
   * @return order of a {@code size} x {@code size} matrix
   */
  public static Order square(int size) {
    return new Order(size, size);
  }

  public int getRows() {
    return rows;
  }

  public int getColumns() {
    return columns;
  }

  /**
   * @return number of items a matrix of this order holds
   */
  public int getCount() {
    return count;
  }

  public boolean isSquare() {
    return rows == columns;
  }

  /**
   * @return the order with rows and columns swapped
   */
  public Order transpose() {
    return new Order(columns, rows);
  }

  /**
   * @return true iff 1-based {@code (i,j)} lies within {@code [1,rows] x [1,columns]}
   */
  boolean contains(int i, int j) {
    return i >= 1 && i <= rows && j >= 1 && j <= columns;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Order)) {
      return false;
    }
    Order other = (Order) o;
    return rows == other.rows && columns == other.columns;
  }

  @Override
  public int hashCode() {
    return 31 * rows + columns;
  }

  @Override
  public String toString() {
    return "(" + rows + ", " + columns + ')';
  }

}
