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

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable mines board: a geometry plus the cells that hold mines.  This
 * is the environment the agent plays against; it answers for any safe cell
 * how many of its neighbors are mines.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Board {

  private static final Splitter ROW_SPLITTER =
      Splitter.onPattern("[\n/]").trimResults().omitEmptyStrings();

  private final Geometry geometry;
  private final boolean[] mined;
  private final ImmutableSet<Cell> mines;

  private Board(Geometry geometry, boolean[] mined) {
    this.geometry = geometry;
    this.mined = mined;
    ImmutableSet.Builder<Cell> builder = ImmutableSet.builder();
    for (int index = 0; index < mined.length; ++index) {
      if (mined[index]) builder.add(geometry.cell(index));
    }
    this.mines = builder.build();
  }

  /**
   * Creates a board of the given shape with the given number of mines placed
   * uniformly at random.
   */
  public static Board random(Geometry geometry, int mineCount, Random random) {
    checkArgument(mineCount >= 0 && mineCount <= geometry.size(),
                  "can't place %s mines on a %s board", mineCount, geometry);
    List<Cell> cells = Lists.newArrayList(geometry.all());
    Collections.shuffle(cells, random);
    boolean[] mined = new boolean[geometry.size()];
    for (Cell cell : cells.subList(0, mineCount))
      mined[geometry.index(cell)] = true;
    return new Board(geometry, mined);
  }

  /**
   * Parses a board from rows separated by newlines or slashes.  Within a row,
   * 'X' or '*' is a mine and '.' or '_' is a safe cell; spaces are ignored.
   */
  public static Board fromString(String s) {
    List<String> rows = Lists.newArrayList();
    for (String row : ROW_SPLITTER.split(s))
      rows.add(row.replace(" ", "").replace("\t", ""));
    checkArgument(!rows.isEmpty() && !rows.get(0).isEmpty(), "no rows in board string %s", s);
    int width = rows.get(0).length();
    Geometry geometry = new Geometry(rows.size(), width);
    boolean[] mined = new boolean[geometry.size()];
    for (int row = 0; row < rows.size(); ++row) {
      String line = rows.get(row);
      checkArgument(line.length() == width,
                    "row %s has width %s, expected %s", row, line.length(), width);
      for (int col = 0; col < width; ++col) {
        char c = line.charAt(col);
        if (c == 'X' || c == '*') mined[row * width + col] = true;
        else checkArgument(c == '.' || c == '_', "unexpected character '%s' in board", c);
      }
    }
    return new Board(geometry, mined);
  }

  public Geometry getGeometry() {
    return geometry;
  }

  public boolean isMine(Cell cell) {
    return mined[geometry.index(cell)];
  }

  /** Returns the cells holding mines, in row-major order. */
  public Set<Cell> getMines() {
    return mines;
  }

  public int getMineCount() {
    return mines.size();
  }

  /**
   * Returns the number of mines among the given cell's neighbors, not counting
   * the cell itself.
   */
  public int nearbyMines(Cell cell) {
    int count = 0;
    for (Cell neighbor : geometry.neighbors(cell)) {
      if (mined[geometry.index(neighbor)]) ++count;
    }
    return count;
  }

  /** Tells whether the given flags mark exactly this board's mines. */
  public boolean won(Set<Cell> flagged) {
    return mines.equals(flagged);
  }

  /**
   * Generates the rows of the board separated by slashes, 'X' for mines and
   * '.' for safe cells.  Reversed by {@link #fromString}.
   */
  public String toFlatString() {
    StringBuilder sb = new StringBuilder();
    for (int index = 0; index < mined.length; ++index) {
      if (index > 0 && index % geometry.width == 0) sb.append('/');
      sb.append(mined[index] ? 'X' : '.');
    }
    return sb.toString();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Board)) return false;
    Board that = (Board) o;
    return this.geometry.equals(that.geometry) && this.mines.equals(that.mines);
  }

  @Override public int hashCode() {
    return geometry.hashCode() * 31 + mines.hashCode();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    String divider = Strings.repeat("--", geometry.width) + "-\n";
    for (int row = 0; row < geometry.height; ++row) {
      sb.append(divider);
      for (int col = 0; col < geometry.width; ++col)
        sb.append(mined[row * geometry.width + col] ? "|X" : "| ");
      sb.append("|\n");
    }
    return sb.append(divider).toString();
  }
}
