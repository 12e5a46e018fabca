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

import com.google.common.collect.Lists;

import us.blanshard.mines.core.Board;
import us.blanshard.mines.core.Cell;
import us.blanshard.mines.insight.Agent;

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A game of mines: an agent playing against a board.  Each step asks the
 * agent for a move, reveals it, and reports what was found back to the agent.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Game {
  private static final Logger logger = Logger.getLogger(Game.class.getName());

  /** Possible states for a game. */
  public enum State {
    IN_PROGRESS,
    WON,   // Every safe cell has been revealed.
    LOST;  // A mine was revealed.

    public boolean isOver() {
      return this != IN_PROGRESS;
    }
  }

  /**
   * A callback interface for interested parties to find out what's going on in
   * a game.
   */
  public interface Listener {
    /** Called after each move. */
    void moveMade(Game game, Move move);

    /** Called once, when the game is won or lost. */
    void gameOver(Game game, State state);
  }

  /**
   * A null implementation of {@link Listener} so you can have a listener
   * without having to implement every method.
   */
  public static class Adapter implements Listener {
    @Override public void moveMade(Game game, Move move) {}
    @Override public void gameOver(Game game, State state) {}
  }

  private final Board board;
  private final Agent agent;
  private final List<Move> history = Lists.newArrayList();
  private final List<Listener> listeners = Lists.newArrayList();
  private final int safeCount;
  private int revealed;
  private State state;

  public Game(Board board, Agent agent) {
    this.board = checkNotNull(board);
    this.agent = checkNotNull(agent);
    checkArgument(board.getGeometry().equals(agent.getGeometry()),
                  "agent plays %s, board is %s", agent.getGeometry(), board.getGeometry());
    this.safeCount = board.getGeometry().size() - board.getMineCount();
    this.state = safeCount == 0 ? State.WON : State.IN_PROGRESS;
  }

  public Board getBoard() {
    return board;
  }

  public Agent getAgent() {
    return agent;
  }

  public State getState() {
    return state;
  }

  public void addListener(Listener listener) {
    listeners.add(checkNotNull(listener));
  }

  public List<Move> getHistory() {
    return Collections.unmodifiableList(history);
  }

  /** The number of moves that were guesses. */
  public int getGuessCount() {
    int count = 0;
    for (Move move : history) {
      if (move.kind == Move.Kind.GUESS) ++count;
    }
    return count;
  }

  /** Tells whether the agent's flags mark exactly the board's mines. */
  public boolean isFlaggedCorrectly() {
    return board.won(agent.getFlags());
  }

  /**
   * Makes one move: a proven-safe cell if the agent knows one, a guess if not.
   * Returns the move, or null if the game is already over.
   */
  @Nullable public Move step() {
    if (state.isOver()) return null;

    Move.Kind kind = Move.Kind.INFERRED;
    Cell cell = agent.chooseSafeMove();
    if (cell == null) {
      kind = Move.Kind.GUESS;
      cell = agent.chooseRandomMove();
      // Can't happen while safe cells remain hidden.
      if (cell == null) return null;
    }

    Move move;
    if (board.isMine(cell)) {
      move = new Move(cell, kind, Move.MINE);
      state = State.LOST;
    } else {
      int count = board.nearbyMines(cell);
      agent.observe(cell, count);
      move = new Move(cell, kind, count);
      if (++revealed == safeCount) state = State.WON;
    }

    history.add(move);
    logger.finer(move.toString());
    for (Listener listener : listeners) listener.moveMade(this, move);
    if (state.isOver()) {
      logger.fine(String.format("Game %s after %d moves, %d guesses",
                                state, history.size(), getGuessCount()));
      for (Listener listener : listeners) listener.gameOver(this, state);
    }
    return move;
  }

  /** Steps until the game is over, returns the final state. */
  public State play() {
    while (step() != null) {}
    return state;
  }
}
