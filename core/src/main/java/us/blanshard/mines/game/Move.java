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
package us.blanshard.mines.game;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static us.blanshard.mines.game.GameJson.JOINER;
import static us.blanshard.mines.game.GameJson.SPLITTER;

import us.blanshard.mines.core.Cell;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A single move in a mines game: the cell revealed, how the agent came to
 * choose it, and what the board said about it.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Move {

  /** The count recorded for a move that revealed a mine. */
  public static final int MINE = -1;

  /** How a move was chosen. */
  public enum Kind {
    INFERRED,  // Proven safe by the knowledge base.
    GUESS;     // Chosen at random.
  }

  public final Cell cell;
  public final Kind kind;
  public final int count;

  public Move(Cell cell, Kind kind, int count) {
    checkArgument(count >= MINE && count <= 8, "bad count %s", count);
    this.cell = checkNotNull(cell);
    this.kind = checkNotNull(kind);
    this.count = count;
  }

  public boolean hitMine() {
    return count == MINE;
  }

  /** Renders this move as a string for json.  Reversed by {@link #fromJsonValue}. */
  String toJsonValue() {
    return JOINER.join(cell.row, cell.col, kind, count);
  }

  static Move fromJsonValue(String value) {
    List<String> parts = SPLITTER.splitToList(value);
    checkArgument(parts.size() == 4, "bad move %s", value);
    return new Move(Cell.of(Integer.parseInt(parts.get(0)), Integer.parseInt(parts.get(1))),
                    Kind.valueOf(parts.get(2)),
                    Integer.parseInt(parts.get(3)));
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Move)) return false;
    Move that = (Move) o;
    return this.cell.equals(that.cell) && this.kind == that.kind && this.count == that.count;
  }

  @Override public int hashCode() {
    return (cell.hashCode() * 31 + kind.hashCode()) * 31 + count;
  }

  @Override public String toString() {
    return kind + " " + cell + (hitMine() ? " boom" : " -> " + count);
  }
}
