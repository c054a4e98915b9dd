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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.mathmatrix.common.LangUtils;

/**
 * <p>A dense matrix of {@code double} values, held in row-major order together with its
 * {@link Order}. Entries are addressed by 1-based coordinates {@code (i,j)}, which map to flat
 * index {@code (i-1)*columns + (j-1)}.</p>
 *
 * <p>Instances are mutable through {@link #set(int, int, double)} and the {@code ...InPlace}
 * methods, and are not thread-safe. Derivations like {@link #transpose()}, {@link #adjoint()} and
 * {@link #inverse()} never alias the receiver's storage.</p>
 */
public final class Matrix {

  private static final Logger log = LoggerFactory.getLogger(Matrix.class);

  private double[] items;
  private Order order;

  private Matrix(double[] items, Order order) {
    this.items = items;
    this.order = order;
  }

  /**
   * @param items values in row-major order; copied
   * @param order order of the matrix
   * @throws MatrixException with {@link MatrixError#INAPPROPRIATE_NUMBER_OF_ITEMS} if the number of
   *  items doesn't match the order
   */
  public static Matrix of(double[] items, Order order) throws MatrixException {
    Preconditions.checkNotNull(items);
    Preconditions.checkNotNull(order);
    if (items.length != order.getCount()) {
      throw new MatrixException(MatrixError.INAPPROPRIATE_NUMBER_OF_ITEMS,
                                items.length + " items for order " + order);
    }
    return new Matrix(items.clone(), order);
  }

  /**
   * @see #of(double[], Order)
   */
  public static Matrix of(double[] items, int rows, int columns) throws MatrixException {
    return of(items, new Order(rows, columns));
  }

  /**
   * @param generator gives the value at each 1-based {@code (i,j)}; called once per entry, row by row
   * @param order order of the matrix to generate
   * @return new matrix of the given order
   */
  public static Matrix generate(MatrixGenerator generator, Order order) {
    Preconditions.checkNotNull(generator);
    Preconditions.checkNotNull(order);
    int rows = order.getRows();
    int columns = order.getColumns();
    double[] items = new double[order.getCount()];
    int index = 0;
    for (int i = 1; i <= rows; i++) {
      for (int j = 1; j <= columns; j++) {
        items[index++] = generator.valueAt(i, j);
      }
    }
    return new Matrix(items, order);
  }

  /**
   * @return a matrix with one row holding the given items
   */
  public static Matrix rowMatrix(double... items) {
    return new Matrix(items.clone(), new Order(1, items.length));
  }

  /**
   * @return a matrix with one column holding the given items
   */
  public static Matrix columnMatrix(double... items) {
    return new Matrix(items.clone(), new Order(items.length, 1));
  }

  /**
   * @return a matrix of the given order filled with zeroes
   */
  public static Matrix nullMatrix(Order order) {
    return new Matrix(new double[order.getCount()], order);
  }

  /**
   * @param items values in row-major order
   * @return a square matrix holding the items
   * @throws MatrixException with {@link MatrixError#INAPPROPRIATE_NUMBER_OF_ITEMS} if the number of
   *  items is not a perfect square
   */
  public static Matrix squareMatrix(double... items) throws MatrixException {
    int size = LangUtils.perfectSquareRoot(items.length);
    if (size < 0) {
      throw new MatrixException(MatrixError.INAPPROPRIATE_NUMBER_OF_ITEMS, items.length + " items");
    }
    return new Matrix(items.clone(), Order.square(size));
  }

  /**
   * @return a square matrix with the given items along its diagonal, and zeroes elsewhere
   */
  public static Matrix diagonalMatrix(final double... items) {
    return generate(new MatrixGenerator() {
      @Override
      public double valueAt(int i, int j) {
        return i == j ? items[i - 1] : 0.0;
      }
    }, Order.square(items.length));
  }

  /**
   * @return a {@code size} x {@code size} diagonal matrix whose diagonal entries are all {@code item}
   */
  public static Matrix scalarMatrix(final double item, int size) {
    return generate(new MatrixGenerator() {
      @Override
      public double valueAt(int i, int j) {
        return i == j ? item : 0.0;
      }
    }, Order.square(size));
  }

  public static Matrix identityMatrix(int size) {
    return scalarMatrix(1.0, size);
  }

  public Order getOrder() {
    return order;
  }

  public int getRows() {
    return order.getRows();
  }

  public int getColumns() {
    return order.getColumns();
  }

  public boolean isSquare() {
    return order.isSquare();
  }

  /**
   * @return true if the matrix has more columns than rows
   */
  public boolean isHorizontal() {
    return order.getColumns() > order.getRows();
  }

  /**
   * @return true if the matrix has more rows than columns
   */
  public boolean isVertical() {
    return order.getRows() > order.getColumns();
  }

  /**
   * @param i 1-based row
   * @param j 1-based column
   * @return entry at {@code (i,j)}
   * @throws MatrixException with {@link MatrixError#INDEX_OUT_OF_RANGE} if {@code (i,j)} is outside
   *  the matrix
   */
  public double get(int i, int j) throws MatrixException {
    checkIndex(i, j);
    return entry(i, j);
  }

  /**
   * @param i 1-based row
   * @param j 1-based column
   * @param value new value of the entry at {@code (i,j)}
   * @throws MatrixException with {@link MatrixError#INDEX_OUT_OF_RANGE} if {@code (i,j)} is outside
   *  the matrix
   */
  public void set(int i, int j, double value) throws MatrixException {
    checkIndex(i, j);
    items[index(i, j)] = value;
  }

  /**
   * @param i 1-based row
   * @return copy of row {@code i}
   * @throws MatrixException with {@link MatrixError#INDEX_OUT_OF_RANGE} if there's no such row
   */
  public double[] getRow(int i) throws MatrixException {
    if (i < 1 || i > order.getRows()) {
      throw new MatrixException(MatrixError.INDEX_OUT_OF_RANGE, "row " + i + " of " + order);
    }
    int columns = order.getColumns();
    double[] row = new double[columns];
    System.arraycopy(items, (i - 1) * columns, row, 0, columns);
    return row;
  }

  /**
   * @param j 1-based column
   * @return copy of column {@code j}
   * @throws MatrixException with {@link MatrixError#INDEX_OUT_OF_RANGE} if there's no such column
   */
  public double[] getColumn(int j) throws MatrixException {
    if (j < 1 || j > order.getColumns()) {
      throw new MatrixException(MatrixError.INDEX_OUT_OF_RANGE, "column " + j + " of " + order);
    }
    int rows = order.getRows();
    double[] column = new double[rows];
    for (int i = 1; i <= rows; i++) {
      column[i - 1] = entry(i, j);
    }
    return column;
  }

  /**
   * @return copy of all entries, in row-major order
   */
  public double[] toArray() {
    return items.clone();
  }

  /**
   * @return the entries along the diagonal, top left first
   * @throws MatrixException with {@link MatrixError#TRACE_EXISTS_ONLY_FOR_SQUARE_MATRICES} if the
   *  matrix is not square
   */
  public double[] trace() throws MatrixException {
    if (!order.isSquare()) {
      throw new MatrixException(MatrixError.TRACE_EXISTS_ONLY_FOR_SQUARE_MATRICES, order.toString());
    }
    int size = order.getRows();
    double[] diagonal = new double[size];
    for (int i = 1; i <= size; i++) {
      diagonal[i - 1] = entry(i, i);
    }
    return diagonal;
  }

  /**
   * @return sum of {@link #trace()}
   * @throws MatrixException as {@link #trace()} does
   */
  public double traceSum() throws MatrixException {
    double sum = 0.0;
    for (double d : trace()) {
      sum += d;
    }
    return sum;
  }

  /**
   * @return new matrix whose entry {@code (i,j)} is this matrix's {@code (j,i)}
   */
  public Matrix transpose() {
    return generate(new MatrixGenerator() {
      @Override
      public double valueAt(int i, int j) {
        return entry(j, i);
      }
    }, order.transpose());
  }

  /**
   * @return a {@link Determinant} snapshot of this matrix's current values
   * @throws MatrixException with {@link MatrixError#INCORRECT_ORDERS_FOR_OPERATION} if the matrix
   *  is not square
   */
  public Determinant toDeterminant() throws MatrixException {
    if (!order.isSquare()) {
      throw new MatrixException(MatrixError.INCORRECT_ORDERS_FOR_OPERATION,
                                "determinant of " + order + " matrix");
    }
    return new Determinant(items);
  }

  /**
   * @return value of this matrix's determinant
   * @throws MatrixException as {@link #toDeterminant()} does
   */
  public double determinant() throws MatrixException {
    return toDeterminant().value();
  }

  /**
   * @return the adjugate: the transpose of the matrix of cofactors
   * @throws MatrixException as {@link #toDeterminant()} does
   */
  public Matrix adjoint() throws MatrixException {
    final Determinant determinant = toDeterminant();
    Matrix cofactors = generate(new MatrixGenerator() {
      @Override
      public double valueAt(int i, int j) {
        try {
          return determinant.cofactor(i, j);
        } catch (MatrixException me) {
          // generate() stays within the determinant's size
          throw new IllegalStateException(me);
        }
      }
    }, order);
    return cofactors.transpose();
  }

  /**
   * Like {@link #inverse(SingularityPolicy)}, with {@link SingularityPolicy#getDefault()}.
   */
  public Matrix inverse() throws MatrixException {
    return inverse(SingularityPolicy.getDefault());
  }

  /**
   * @param policy what to do if the determinant is exactly 0
   * @return {@link #adjoint()} divided by {@link #determinant()}
   * @throws MatrixException as {@link #toDeterminant()} does, or with
   *  {@link MatrixError#SINGULAR_MATRIX} if the determinant is 0 and {@code policy} is
   *  {@link SingularityPolicy#REJECT}
   */
  public Matrix inverse(SingularityPolicy policy) throws MatrixException {
    Preconditions.checkNotNull(policy);
    double determinant = determinant();
    log.debug("Inverting {} matrix with determinant {}", order, determinant);
    if (determinant == 0.0) {
      if (policy == SingularityPolicy.REJECT) {
        throw new MatrixException(MatrixError.SINGULAR_MATRIX, "determinant of " + order + " matrix is 0");
      }
      log.warn("{} matrix is singular; inverse will contain infinite or NaN values", order);
    }
    return adjoint().divide(determinant);
  }

  /**
   * @return new matrix with every entry rounded to the nearest integral value, ties away from zero
   * @see LangUtils#roundHalfAwayFromZero(double)
   */
  public Matrix round() {
    Matrix result = copy();
    result.roundInPlace();
    return result;
  }

  /**
   * Like {@link #round()}, but rounds this matrix's own entries.
   */
  public void roundInPlace() {
    for (int i = 0; i < items.length; i++) {
      items[i] = LangUtils.roundHalfAwayFromZero(items[i]);
    }
  }

  /**
   * @return new matrix holding the elementwise sum of this matrix and {@code other}
   * @throws MatrixException with {@link MatrixError#INCORRECT_ORDERS_FOR_OPERATION} if orders differ
   */
  public Matrix add(Matrix other) throws MatrixException {
    Matrix result = copy();
    result.addInPlace(other);
    return result;
  }

  /**
   * Like {@link #add(Matrix)}, but updates this matrix.
   */
  public void addInPlace(Matrix other) throws MatrixException {
    checkSameOrder(other, "+");
    double[] otherItems = other.items;
    for (int i = 0; i < items.length; i++) {
      items[i] += otherItems[i];
    }
  }

  /**
   * @return new matrix holding the elementwise difference of this matrix and {@code other}
   * @throws MatrixException with {@link MatrixError#INCORRECT_ORDERS_FOR_OPERATION} if orders differ
   */
  public Matrix subtract(Matrix other) throws MatrixException {
    Matrix result = copy();
    result.subtractInPlace(other);
    return result;
  }

  /**
   * Like {@link #subtract(Matrix)}, but updates this matrix.
   */
  public void subtractInPlace(Matrix other) throws MatrixException {
    checkSameOrder(other, "-");
    double[] otherItems = other.items;
    for (int i = 0; i < items.length; i++) {
      items[i] -= otherItems[i];
    }
  }

  /**
   * @param other matrix with as many rows as this matrix has columns
   * @return new matrix product of this matrix times {@code other}
   * @throws MatrixException with {@link MatrixError#INCORRECT_ORDERS_FOR_OPERATION} if this matrix's
   *  columns don't match {@code other}'s rows
   */
  public Matrix multiply(Matrix other) throws MatrixException {
    Preconditions.checkNotNull(other);
    int inner = order.getColumns();
    if (inner != other.order.getRows()) {
      throw new MatrixException(MatrixError.INCORRECT_ORDERS_FOR_OPERATION, order + " * " + other.order);
    }
    int rows = order.getRows();
    int columns = other.order.getColumns();
    Order productOrder = new Order(rows, columns);
    double[] product = new double[productOrder.getCount()];
    double[] otherItems = other.items;
    for (int i = 0; i < rows; i++) {
      int rowOffset = i * inner;
      for (int j = 0; j < columns; j++) {
        double total = 0.0;
        for (int r = 0; r < inner; r++) {
          total += items[rowOffset + r] * otherItems[r * columns + j];
        }
        product[i * columns + j] = total;
      }
    }
    return new Matrix(product, productOrder);
  }

  /**
   * Like {@link #multiply(Matrix)}, but replaces this matrix with the product, which may change
   * its order.
   */
  public void multiplyInPlace(Matrix other) throws MatrixException {
    Matrix product = multiply(other);
    items = product.items;
    order = product.order;
  }

  /**
   * @return new matrix with every entry multiplied by {@code factor}
   */
  public Matrix multiply(double factor) {
    Matrix result = copy();
    result.multiplyInPlace(factor);
    return result;
  }

  public void multiplyInPlace(double factor) {
    for (int i = 0; i < items.length; i++) {
      items[i] *= factor;
    }
  }

  /**
   * @return new matrix with every entry divided by {@code divisor}; dividing by 0 gives infinite or
   *  {@link Double#NaN} entries
   */
  public Matrix divide(double divisor) {
    Matrix result = copy();
    result.divideInPlace(divisor);
    return result;
  }

  public void divideInPlace(double divisor) {
    for (int i = 0; i < items.length; i++) {
      items[i] /= divisor;
    }
  }

  /**
   * @return deep copy of this matrix
   */
  public Matrix copy() {
    return new Matrix(items.clone(), order);
  }

  /**
   * Matrices are equal when their orders are equal and every pair of entries compares equal with
   * {@code ==}. So {@code -0.0} equals {@code 0.0}, and a matrix containing {@link Double#NaN}
   * is not equal even to itself.
   */
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Matrix)) {
      return false;
    }
    Matrix other = (Matrix) o;
    if (!order.equals(other.order)) {
      return false;
    }
    double[] otherItems = other.items;
    for (int i = 0; i < items.length; i++) {
      if (items[i] != otherItems[i]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = order.hashCode();
    for (double d : items) {
      // 0.0 and -0.0 are equal, so must hash alike
      hash = 31 * hash + Double.hashCode(d == 0.0 ? 0.0 : d);
    }
    return hash;
  }

  @Override
  public String toString() {
    return MatrixUtils.matrixToString(this);
  }

  private int index(int i, int j) {
    return (i - 1) * order.getColumns() + (j - 1);
  }

  /**
   * Unchecked access for coordinates already known to be in range.
   */
  private double entry(int i, int j) {
    return items[index(i, j)];
  }

  private void checkIndex(int i, int j) throws MatrixException {
    if (!order.contains(i, j)) {
      throw new MatrixException(MatrixError.INDEX_OUT_OF_RANGE, "(" + i + ", " + j + ") in " + order);
    }
  }

  private void checkSameOrder(Matrix other, String operation) throws MatrixException {
    Preconditions.checkNotNull(other);
    if (!order.equals(other.order)) {
      throw new MatrixException(MatrixError.INCORRECT_ORDERS_FOR_OPERATION,
                                order + " " + operation + ' ' + other.order);
    }
  }

}
