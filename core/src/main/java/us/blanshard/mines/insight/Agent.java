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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Lists;

import us.blanshard.mines.core.Cell;
import us.blanshard.mines.core.Geometry;

import java.util.List;
import java.util.Random;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A mines player that only moves where its {@link KnowledgeBase} proves it
 * safe, and guesses when it must.  Guesses come from the given random source,
 * so a fixed seed replays the same game.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Agent {
  private final KnowledgeBase knowledge;
  private final Random random;

  public Agent(Geometry geometry, Random random) {
    this.knowledge = new KnowledgeBase(geometry);
    this.random = checkNotNull(random);
  }

  public Geometry getGeometry() {
    return knowledge.getGeometry();
  }

  public KnowledgeBase getKnowledge() {
    return knowledge;
  }

  /** Tells the agent what was revealed at the given cell. */
  public void observe(Cell cell, int count) {
    knowledge.observe(cell, count);
  }

  /**
   * Returns the first cell, in row-major order, that is known to be safe and
   * hasn't been played yet; or null if there is none.
   */
  @Nullable public Cell chooseSafeMove() {
    for (Cell cell : knowledge.getGeometry().all()) {
      if (knowledge.isKnownSafe(cell) && !knowledge.isVisited(cell)) return cell;
    }
    return null;
  }

  /**
   * Returns a cell chosen uniformly from those not yet played and not known to
   * be mines; or null if there is none.
   */
  @Nullable public Cell chooseRandomMove() {
    List<Cell> candidates = Lists.newArrayList();
    for (Cell cell : knowledge.getGeometry().all()) {
      if (!knowledge.isVisited(cell) && !knowledge.isKnownMine(cell)) candidates.add(cell);
    }
    if (candidates.isEmpty()) return null;
    return candidates.get(random.nextInt(candidates.size()));
  }

  /** The cells this agent would flag: those proven to be mines. */
  public Set<Cell> getFlags() {
    return knowledge.getMines();
  }
}
