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

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.Test;

import net.mathmatrix.common.MathMatrixTest;

/**
 * Tests the derivations of a {@link Matrix}: transpose, determinant, adjoint, inverse and rounding.
 */
public final class MatrixDerivationsTest extends MathMatrixTest {

  private static Matrix nonSingular() throws MatrixException {
    return Matrix.of(new double[] {1, 6, 4, 2, 5, 7, 4, 2, 9}, 3, 3);
  }

  @Test
  public void testTranspose() throws Exception {
    Matrix matrix = Matrix.of(new double[] {1, 2, 3, 4, 5, 6}, 2, 3);
    Matrix transpose = matrix.transpose();
    assertEquals(Matrix.of(new double[] {1, 4, 2, 5, 3, 6}, 3, 2), transpose);
    assertEquals(Matrix.of(new double[] {1, 2, 3, 4, 5, 6}, 2, 3), matrix);
  }

  @Test
  public void testTransposeTwice() throws Exception {
    Matrix[] matrices = {
        Matrix.of(new double[] {1, 2, 3, 4, 5, 6}, 2, 3),
        Matrix.rowMatrix(1, 2, 3),
        Matrix.columnMatrix(-1, 0.5),
        nonSingular(),
        Matrix.nullMatrix(new Order(0, 4)),
    };
    for (Matrix matrix : matrices) {
      assertEquals(matrix, matrix.transpose().transpose());
    }
  }

  @Test
  public void testToDeterminant() throws Exception {
    Determinant determinant = Matrix.of(new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9}, 3, 3).toDeterminant();
    assertEquals(3, determinant.getSize());
    assertEquals(0.0, determinant.value());
    assertEquals(27.0, nonSingular().determinant());
  }

  @Test
  public void testToDeterminantNonSquare() throws Exception {
    // Both have a square number of items, but aren't square
    Matrix[] matrices = {Matrix.columnMatrix(1, 2, 3), Matrix.rowMatrix(1, 2, 3, 4)};
    for (Matrix matrix : matrices) {
      try {
        matrix.toDeterminant();
        fail();
      } catch (MatrixException me) {
        assertEquals(MatrixError.INCORRECT_ORDERS_FOR_OPERATION, me.getError());
      }
    }
  }

  @Test
  public void testDeterminantIsSnapshot() throws Exception {
    Matrix matrix = Matrix.squareMatrix(1, 2, 3, 4);
    Determinant determinant = matrix.toDeterminant();
    matrix.set(1, 1, 50.0);
    assertEquals(-2.0, determinant.value());
    assertEquals(194.0, matrix.determinant());
  }

  @Test
  public void testAdjoint() throws Exception {
    Matrix matrix = Matrix.of(new double[] {1, 0, -1, 3, 4, 5, 0, -6, -7}, 3, 3);
    assertEquals(Matrix.of(new double[] {2, 6, 4, 21, -7, -8, -18, 6, 4}, 3, 3), matrix.adjoint());
  }

  @Test
  public void testAdjointOfSingleItem() throws Exception {
    assertEquals(Matrix.rowMatrix(1), Matrix.rowMatrix(5).adjoint());
  }

  @Test
  public void testAdjointNonSquare() throws Exception {
    try {
      Matrix.rowMatrix(1, 2).adjoint();
      fail();
    } catch (MatrixException me) {
      assertEquals(MatrixError.INCORRECT_ORDERS_FOR_OPERATION, me.getError());
    }
  }

  @Test
  public void testAdjointTimesOriginal() throws Exception {
    Matrix[] matrices = {
        nonSingular(),
        Matrix.of(new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9}, 3, 3),
        Matrix.squareMatrix(0.5, -1.25, 3.0, 2.0, 7.5, -0.1, 4.0, 4.0, 1.0, 0.0, 2.0, 9.0, -3.0, 1.0, 1.0, 6.0),
    };
    for (Matrix matrix : matrices) {
      int size = matrix.getRows();
      double determinant = matrix.determinant();
      Matrix expected = Matrix.scalarMatrix(determinant, size);
      assertArrayEquals(expected.toArray(), matrix.adjoint().multiply(matrix).toArray(), 1.0e-9);
      assertArrayEquals(expected.toArray(), matrix.multiply(matrix.adjoint()).toArray(), 1.0e-9);
    }
  }

  @Test
  public void testInverse() throws Exception {
    Matrix matrix = Matrix.of(new double[] {1, 2, 3, 3, 2, 1, 2, 1, 3}, 3, 3);
    Matrix expected = Matrix.of(new double[] {-5, 3, 4, 7, 3, -8, 1, -3, 4}, 3, 3).divide(12.0);
    assertEquals(expected, matrix.inverse());
  }

  @Test
  public void testInverseTimesOriginalRoundsToIdentity() throws Exception {
    Matrix matrix = nonSingular();
    Matrix inverse = matrix.inverse();
    assertEquals(Matrix.identityMatrix(3), inverse.multiply(matrix).round());
    assertEquals(Matrix.identityMatrix(3), matrix.multiply(inverse).round());
  }

  @Test
  public void testInverseOfSingleItem() throws Exception {
    assertEquals(Matrix.rowMatrix(0.25), Matrix.rowMatrix(4).inverse());
  }

  @Test
  public void testInverseDoesNotMutate() throws Exception {
    Matrix matrix = nonSingular();
    matrix.inverse();
    assertEquals(nonSingular(), matrix);
  }

  @Test
  public void testInverseAgreesWithLUDecomposition() throws Exception {
    RandomGenerator random = new Well19937c(5678L);
    for (int size = 2; size <= 5; size++) {
      double[] items = new double[size * size];
      for (int i = 0; i < items.length; i++) {
        items[i] = 2.0 * random.nextDouble() - 1.0;
      }
      // Diagonally dominant, so well-conditioned
      for (int i = 0; i < size; i++) {
        items[i * size + i] += size;
      }
      Matrix matrix = Matrix.squareMatrix(items);
      RealMatrix expected = new LUDecomposition(MatrixUtils.toRealMatrix(matrix)).getSolver().getInverse();
      assertArrayEquals(MatrixUtils.fromRealMatrix(expected).toArray(), matrix.inverse().toArray(), 1.0e-8);
    }
  }

  @Test
  public void testSingularInverseRejected() throws Exception {
    Matrix singular = Matrix.of(new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9}, 3, 3);
    try {
      singular.inverse(SingularityPolicy.REJECT);
      fail();
    } catch (MatrixException me) {
      assertEquals(MatrixError.SINGULAR_MATRIX, me.getError());
    }
  }

  @Test
  public void testSingularInversePropagated() throws Exception {
    Matrix singular = Matrix.squareMatrix(1, 2, 2, 4);
    double[] inverse = singular.inverse(SingularityPolicy.PROPAGATE).toArray();
    // adjoint is [4, -2, -2, 1]
    assertEquals(Double.POSITIVE_INFINITY, inverse[0], 0.0);
    assertEquals(Double.NEGATIVE_INFINITY, inverse[1], 0.0);
    assertEquals(Double.NEGATIVE_INFINITY, inverse[2], 0.0);
    assertEquals(Double.POSITIVE_INFINITY, inverse[3], 0.0);
    double[] zeroAdjoint = Matrix.nullMatrix(Order.square(2)).inverse(SingularityPolicy.PROPAGATE).toArray();
    for (double d : zeroAdjoint) {
      assertNaN(d);
    }
  }

  @Test
  public void testInverseNonSquare() throws Exception {
    try {
      Matrix.nullMatrix(new Order(2, 3)).inverse();
      fail();
    } catch (MatrixException me) {
      assertEquals(MatrixError.INCORRECT_ORDERS_FOR_OPERATION, me.getError());
    }
  }

  @Test
  public void testRound() throws Exception {
    Matrix matrix = Matrix.rowMatrix(0.9999, 0.0000023, 0.99999);
    assertEquals(Matrix.rowMatrix(1, 0, 1), matrix.round());
    assertEquals(Matrix.rowMatrix(0.9999, 0.0000023, 0.99999), matrix);
    matrix.roundInPlace();
    assertEquals(Matrix.rowMatrix(1, 0, 1), matrix);
    assertEquals(Matrix.rowMatrix(-3, 3, -1), Matrix.rowMatrix(-2.5, 2.5, -0.5000001).round());
  }

}
