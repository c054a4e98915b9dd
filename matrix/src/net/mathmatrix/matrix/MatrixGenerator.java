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
 * Describes a matrix as a function of its 1-based coordinates.
 *
 * @see Matrix#generate(MatrixGenerator, Order)
 */
public interface MatrixGenerator {

  /**
   * @param i 1-based row
   * @param j 1-based column
   * @return value of the entry at {@code (i,j)}
   */
  double valueAt(int i, int j);

}
