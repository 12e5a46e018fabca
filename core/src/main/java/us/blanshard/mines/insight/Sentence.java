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
package us.blanshard.mines.insight;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import us.blanshard.mines.core.Cell;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A logical statement about a mines board: exactly {@link #getCount} of the
 * cells in {@link #getCells} are mines.  Sentences shrink as facts about their
 * cells become known.
 *
 * <p> Equality is structural, over both the cells and the count.  Since
 * sentences are mutable, don't keep them in hashed collections across calls
 * to {@link #markMine} or {@link #markSafe}.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Sentence {
  private static final Joiner JOINER = Joiner.on(", ");

  private final SortedSet<Cell> cells;
  private int count;

  /**
   * Creates a sentence over the given cells, which must contain at least
   * {@code count} distinct cells.
   *
   * @throws IllegalArgumentException if count is negative or larger than the
   *     number of distinct cells
   */
  public Sentence(Collection<Cell> cells, int count) {
    this.cells = Sets.newTreeSet(cells);
    checkArgument(count >= 0 && count <= this.cells.size(),
                  "count %s out of range for %s cells", count, this.cells.size());
    this.count = count;
  }

  /** Copy constructor. */
  public Sentence(Sentence that) {
    this.cells = Sets.newTreeSet(that.cells);
    this.count = that.count;
  }

  public Set<Cell> getCells() {
    return Collections.unmodifiableSet(cells);
  }

  public int getCount() {
    return count;
  }

  public int size() {
    return cells.size();
  }

  /** An empty sentence says nothing and can be retired. */
  public boolean isEmpty() {
    return cells.isEmpty();
  }

  /** Returns all the cells if every one of them must be a mine, else nothing. */
  public Set<Cell> knownMines() {
    return count == cells.size() ? ImmutableSet.copyOf(cells) : ImmutableSet.<Cell>of();
  }

  /** Returns all the cells if none of them can be a mine, else nothing. */
  public Set<Cell> knownSafes() {
    return count == 0 ? ImmutableSet.copyOf(cells) : ImmutableSet.<Cell>of();
  }

  /**
   * Removes the given cell, now known to be a mine, and takes it out of the
   * count.  Returns false if the cell wasn't in this sentence.
   */
  public boolean markMine(Cell cell) {
    if (!cells.remove(cell)) return false;
    --count;
    return true;
  }

  /**
   * Removes the given cell, now known to be safe.  Returns false if the cell
   * wasn't in this sentence.
   */
  public boolean markSafe(Cell cell) {
    return cells.remove(cell);
  }

  /** Tells whether this sentence's cells are a proper subset of the other's. */
  public boolean isStrictSubsetOf(Sentence that) {
    return this.cells.size() < that.cells.size() && that.cells.containsAll(this.cells);
  }

  /**
   * Given a sentence whose cells are a strict subset of this one's, returns the
   * sentence about the remaining cells: they hold whatever mines the subset
   * doesn't account for.
   */
  public Sentence minus(Sentence subset) {
    checkArgument(subset.isStrictSubsetOf(this), "%s is not a strict subset of %s", subset, this);
    return new Sentence(Sets.difference(this.cells, subset.cells), this.count - subset.count);
  }

  /** Tells whether the count lies within [0, size]. */
  boolean isConsistent() {
    return count >= 0 && count <= cells.size();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Sentence)) return false;
    Sentence that = (Sentence) o;
    return this.count == that.count && this.cells.equals(that.cells);
  }

  @Override public int hashCode() {
    return cells.hashCode() * 31 + count;
  }

  @Override public String toString() {
    return "{" + JOINER.join(cells) + "} = " + count;
  }
}
