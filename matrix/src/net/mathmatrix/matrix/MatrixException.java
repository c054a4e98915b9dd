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
 * Thrown when a matrix or determinant operation can't be carried out on its arguments, for example
 * because the orders of two matrices don't agree, or a 1-based index is out of range.
 * {@link #getError()} tells which.
 */
public final class MatrixException extends Exception {

  private final MatrixError error;

  public MatrixException(MatrixError error) {
    this(error, null);
  }

  /**
   * @param error kind of failure
   * @param detail additional context appended to the error's description, or {@code null}
   */
  public MatrixException(MatrixError error, String detail) {
    super(buildMessage(Preconditions.checkNotNull(error), detail));
    this.error = error;
  }

  public MatrixError getError() {
    return error;
  }

  private static String buildMessage(MatrixError error, String detail) {
    return detail == null ? error.getDescription() : error.getDescription() + " (" + detail + ')';
  }

}
