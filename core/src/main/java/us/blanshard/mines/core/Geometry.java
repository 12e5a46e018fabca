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
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * The shape of a mines board: its height and width, and the adjacency rules
 * between its cells.  Each cell's neighbors are the up to 8 cells that touch
 * it, clipped to the board.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Geometry {

  public final int height;
  public final int width;

  /** All cells, row-major. */
  private final ImmutableList<Cell> all;

  public Geometry(int height, int width) {
    checkArgument(height > 0 && width > 0, "bad board dimensions %sx%s", height, width);
    this.height = height;
    this.width = width;
    ImmutableList.Builder<Cell> builder = ImmutableList.builder();
    for (int row = 0; row < height; ++row)
      for (int col = 0; col < width; ++col)
        builder.add(Cell.of(row, col));
    this.all = builder.build();
  }

  /** The number of cells on the board. */
  public int size() {
    return all.size();
  }

  /** Returns every cell of the board in row-major order. */
  public List<Cell> all() {
    return all;
  }

  public boolean contains(Cell cell) {
    return cell.row < height && cell.col < width;
  }

  /** Returns the row-major index of the given cell, in the range [0, size). */
  public int index(Cell cell) {
    checkContains(cell);
    return cell.row * width + cell.col;
  }

  /** Reverses {@link #index}. */
  public Cell cell(int index) {
    return all.get(checkElementIndex(index, all.size()));
  }

  /**
   * Returns the cells adjacent to the given one, horizontally, vertically or
   * diagonally, that lie on the board.  The cell itself is not included.
   */
  public List<Cell> neighbors(Cell cell) {
    checkContains(cell);
    ImmutableList.Builder<Cell> builder = ImmutableList.builder();
    for (int row = cell.row - 1; row <= cell.row + 1; ++row) {
      if (row < 0 || row >= height) continue;
      for (int col = cell.col - 1; col <= cell.col + 1; ++col) {
        if (col < 0 || col >= width) continue;
        if (row == cell.row && col == cell.col) continue;
        builder.add(all.get(row * width + col));
      }
    }
    return builder.build();
  }

  private void checkContains(Cell cell) {
    checkArgument(contains(cell), "%s is not on a %s board", cell, this);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Geometry)) return false;
    Geometry that = (Geometry) o;
    return this.height == that.height && this.width == that.width;
  }

  @Override public int hashCode() {
    return height * 31 + width;
  }

  @Override public String toString() {
    return height + "x" + width;
  }
}
