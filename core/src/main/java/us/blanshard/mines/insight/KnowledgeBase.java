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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import us.blanshard.mines.core.Cell;
import us.blanshard.mines.core.Geometry;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The agent's knowledge of a mines board: the cells it has visited, the cells
 * proven to be mines or safe, and a collection of {@link Sentence}s about the
 * cells still in doubt.
 *
 * <p> Each observation adds a sentence and then propagates to a fixpoint.  A
 * pass of propagation marks every cell that some sentence proves to be a mine
 * or safe, retires sentences left empty, and resolves every pair of sentences
 * where one's cells are a strict subset of the other's into a new sentence
 * about the difference.  Each pass either grows the set of known cells or adds
 * a sentence not seen before, and both are finite, so the loop ends.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class KnowledgeBase {
  private static final Logger logger = Logger.getLogger(KnowledgeBase.class.getName());

  /** The largest number of mines a cell can have around it. */
  public static final int MAX_COUNT = 8;

  /**
   * A callback interface for parties interested in what the knowledge base
   * manages to prove.
   */
  public interface Listener {
    /** Called when a cell is first proven to be a mine. */
    void mineFound(Cell cell);

    /** Called when a cell is first proven to be safe. */
    void safeFound(Cell cell);

    /** Called with a copy of each new sentence derived by subset resolution. */
    void sentenceDerived(Sentence sentence);
  }

  /**
   * A null implementation of {@link Listener} so you can have a listener
   * without having to implement every method.
   */
  public static class Adapter implements Listener {
    @Override public void mineFound(Cell cell) {}
    @Override public void safeFound(Cell cell) {}
    @Override public void sentenceDerived(Sentence sentence) {}
  }

  private final Geometry geometry;
  private final Set<Cell> movesMade = Sets.newTreeSet();
  private final Map<Cell, Integer> observedCounts = Maps.newHashMap();
  private final Set<Cell> mines = Sets.newTreeSet();
  private final Set<Cell> safes = Sets.newTreeSet();
  private final List<Listener> listeners = Lists.newArrayList();
  private List<Sentence> sentences = Lists.newArrayList();

  public KnowledgeBase(Geometry geometry) {
    this.geometry = checkNotNull(geometry);
  }

  public Geometry getGeometry() {
    return geometry;
  }

  public void addListener(Listener listener) {
    listeners.add(checkNotNull(listener));
  }

  public void removeListener(Listener listener) {
    listeners.remove(listener);
  }

  /**
   * Records that the given safe cell was revealed with the given number of
   * mines around it, and works out everything that follows.  Observing a cell
   * a second time with the same count changes nothing.
   *
   * @throws IllegalArgumentException if the cell is off the board or known to
   *     be a mine, was observed before with another count, or the count can't
   *     be right given the cell's known neighbors; the knowledge base is left
   *     as it was
   * @throws IllegalStateException if the count contradicts what follows from
   *     other sentences; the knowledge base is then unusable
   */
  public void observe(Cell cell, int count) {
    checkArgument(geometry.contains(cell), "%s is not on a %s board", cell, geometry);
    checkArgument(count >= 0 && count <= MAX_COUNT, "bad count %s for %s", count, cell);
    checkArgument(!mines.contains(cell), "%s is known to be a mine", cell);
    Integer previous = observedCounts.get(cell);
    checkArgument(previous == null || previous == count,
                  "%s was observed with count %s, now %s", cell, previous, count);

    Sentence sentence = makeSentence(cell, count);

    movesMade.add(cell);
    observedCounts.put(cell, count);
    markSafe(cell);
    append(sentence);
    propagate();
  }

  /**
   * Adds a sentence about cells not yet settled, and works out everything that
   * follows.
   */
  void addSentence(Sentence sentence) {
    for (Cell cell : sentence.getCells()) {
      checkArgument(geometry.contains(cell), "%s is not on a %s board", cell, geometry);
      checkArgument(!mines.contains(cell) && !safes.contains(cell), "%s is already known", cell);
    }
    append(new Sentence(sentence));
    propagate();
  }

  private void append(Sentence sentence) {
    if (!sentences.contains(sentence)) sentences.add(sentence);
  }

  /**
   * Builds the sentence describing the given cell's neighbors, leaving out
   * those already settled.
   */
  private Sentence makeSentence(Cell cell, int count) {
    List<Cell> unknown = Lists.newArrayList();
    int remaining = count;
    for (Cell neighbor : geometry.neighbors(cell)) {
      if (mines.contains(neighbor)) {
        --remaining;
      } else if (!safes.contains(neighbor) && !movesMade.contains(neighbor)) {
        unknown.add(neighbor);
      }
    }
    checkArgument(remaining >= 0 && remaining <= unknown.size(),
                  "count %s at %s is inconsistent with known mines %s", count, cell, mines);
    return new Sentence(unknown, remaining);
  }

  /** Marks the given cell as a mine, here and in every sentence. */
  public void markMine(Cell cell) {
    checkArgument(!safes.contains(cell), "%s is known to be safe", cell);
    if (mines.add(cell)) {
      for (Listener listener : listeners) listener.mineFound(cell);
    }
    for (Sentence sentence : sentences) sentence.markMine(cell);
  }

  /** Marks the given cell as safe, here and in every sentence. */
  public void markSafe(Cell cell) {
    checkArgument(!mines.contains(cell), "%s is known to be a mine", cell);
    if (safes.add(cell)) {
      for (Listener listener : listeners) listener.safeFound(cell);
    }
    for (Sentence sentence : sentences) sentence.markSafe(cell);
  }

  /**
   * Draws conclusions from the sentences until nothing more can be learned.
   * Returns true if anything changed.
   *
   * @throws IllegalStateException if the knowledge turns out to contradict
   *     itself
   */
  public boolean propagate() {
    int passes = 0;
    while (propagateOnce())
      ++passes;
    checkInvariants();
    if (passes > 0 && logger.isLoggable(Level.FINE)) {
      logger.fine(String.format("%d passes: %d mines, %d safes, %d sentences",
                                passes, mines.size(), safes.size(), sentences.size()));
    }
    return passes > 0;
  }

  /** Performs one pass of propagation, tells whether it changed anything. */
  private boolean propagateOnce() {
    boolean changed = false;

    Set<Cell> newMines = Sets.newTreeSet();
    Set<Cell> newSafes = Sets.newTreeSet();
    for (Sentence sentence : sentences) {
      newMines.addAll(sentence.knownMines());
      newSafes.addAll(sentence.knownSafes());
    }
    newMines.removeAll(mines);
    newSafes.removeAll(safes);
    checkState(Collections.disjoint(newMines, newSafes),
               "cells proven both mines and safe: %s", Sets.intersection(newMines, newSafes));
    checkState(Collections.disjoint(newMines, safes) && Collections.disjoint(newSafes, mines),
               "proofs contradict known cells");

    // Each kind of mark has its own guard.
    if (!newSafes.isEmpty()) {
      changed = true;
      for (Cell cell : newSafes) markSafe(cell);
    }
    if (!newMines.isEmpty()) {
      changed = true;
      for (Cell cell : newMines) markMine(cell);
    }

    // The next generation drops empty and duplicate sentences.
    Set<Sentence> next = Sets.newLinkedHashSet();
    for (Sentence sentence : sentences) {
      checkState(sentence.isConsistent(), "marks left sentence out of range: %s", sentence);
      if (!sentence.isEmpty()) next.add(sentence);
    }
    if (next.size() != sentences.size()) changed = true;

    List<Sentence> current = ImmutableList.copyOf(next);
    for (Sentence subset : current) {
      for (Sentence superset : current) {
        if (subset == superset || !subset.isStrictSubsetOf(superset)) continue;
        int remaining = superset.getCount() - subset.getCount();
        checkState(remaining >= 0 && remaining <= superset.size() - subset.size(),
                   "sentences %s and %s contradict each other", subset, superset);
        Sentence derived = superset.minus(subset);
        if (next.add(derived)) {
          changed = true;
          for (Listener listener : listeners) listener.sentenceDerived(new Sentence(derived));
        }
      }
    }

    sentences = Lists.newArrayList(next);
    return changed;
  }

  /** Fails if the knowledge base has become inconsistent. */
  void checkInvariants() {
    checkState(Collections.disjoint(mines, safes),
               "cells both mines and safe: %s", Sets.intersection(mines, safes));
    checkState(safes.containsAll(movesMade), "visited cells not all safe");
    for (Sentence sentence : sentences) {
      checkState(sentence.isConsistent(), "sentence out of range: %s", sentence);
      for (Cell cell : sentence.getCells()) {
        checkState(!mines.contains(cell) && !safes.contains(cell),
                   "sentence %s mentions known cell %s", sentence, cell);
      }
    }
  }

  /** Returns the cells proven to be mines, in row-major order. */
  public Set<Cell> getMines() {
    return ImmutableSet.copyOf(mines);
  }

  /** Returns the cells proven to be safe, in row-major order. */
  public Set<Cell> getSafes() {
    return ImmutableSet.copyOf(safes);
  }

  /** Returns the cells observed so far, in row-major order. */
  public Set<Cell> getMovesMade() {
    return ImmutableSet.copyOf(movesMade);
  }

  /** Returns copies of the live sentences. */
  public List<Sentence> getSentences() {
    ImmutableList.Builder<Sentence> builder = ImmutableList.builder();
    for (Sentence sentence : sentences) builder.add(new Sentence(sentence));
    return builder.build();
  }

  /** Returns the count the given cell was observed with, or null. */
  @Nullable public Integer getObservedCount(Cell cell) {
    return observedCounts.get(cell);
  }

  public boolean isKnownMine(Cell cell) {
    return mines.contains(cell);
  }

  public boolean isKnownSafe(Cell cell) {
    return safes.contains(cell);
  }

  public boolean isVisited(Cell cell) {
    return movesMade.contains(cell);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("geometry", geometry)
        .add("moves", movesMade.size())
        .add("mines", mines)
        .add("safes", safes.size())
        .add("sentences", sentences)
        .toString();
  }
}
