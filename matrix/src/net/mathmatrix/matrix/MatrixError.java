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

/**
 * Kinds of recoverable failure reported by {@link MatrixException}.
 */
public enum MatrixError {

  INAPPROPRIATE_NUMBER_OF_ITEMS("Inappropriate number of items"),
  TRACE_EXISTS_ONLY_FOR_SQUARE_MATRICES("Traces exists only for square matrices"),
  INCORRECT_ORDERS_FOR_OPERATION("Incorrect orders of matrices for algebraic operations"),
  INDEX_OUT_OF_RANGE("Index out of range"),
  SINGULAR_MATRIX("Matrix is singular"),
  ;

  private final String description;

  MatrixError(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

}
