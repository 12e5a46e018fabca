/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.mines.core;

import static com.google.common.base.Preconditions.checkArgument;

import javax.annotation.concurrent.Immutable;

/**
 * A location on a mines board: a row and a column, both zero-based.  Cells
 * know nothing of the board they sit on; see {@link Geometry} for bounds and
 * adjacency.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Cell implements Comparable<Cell> {

  public final int row;
  public final int col;

  public static Cell of(int row, int col) {
    checkArgument(row >= 0 && col >= 0, "negative cell coordinates (%s, %s)", row, col);
    return new Cell(row, col);
  }

  private Cell(int row, int col) {
    this.row = row;
    this.col = col;
  }

  /** Row-major order. */
  @Override public int compareTo(Cell that) {
    if (this.row != that.row) return this.row < that.row ? -1 : 1;
    return this.col < that.col ? -1 : this.col == that.col ? 0 : 1;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Cell)) return false;
    Cell that = (Cell) o;
    return this.row == that.row && this.col == that.col;
  }

  @Override public int hashCode() {
    return row * 31 + col;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row, col);
  }
}
