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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import us.blanshard.mines.core.Board;
import us.blanshard.mines.core.Cell;
import us.blanshard.mines.core.Geometry;
import us.blanshard.mines.insight.Agent;
import us.blanshard.mines.insight.TestHelper.ScriptedRandom;

import java.util.Random;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class GameTest {
  @Mock Game.Listener listener;
  private final ScriptedRandom random = new ScriptedRandom();

  private static final Board BOARD = Board.fromString("X../.../...");

  @Test public void win() {
    ScriptedRandom random = new ScriptedRandom(8);
    Game game = new Game(BOARD, new Agent(BOARD.getGeometry(), random));
    game.addListener(listener);

    assertEquals(Game.State.WON, game.play());
    assertThat(game.getHistory()).hasSize(8);
    assertEquals(new Move(Cell.of(2, 2), Move.Kind.GUESS, 0), game.getHistory().get(0));
    assertEquals(new Move(Cell.of(1, 1), Move.Kind.INFERRED, 1), game.getHistory().get(1));
    assertEquals(1, game.getGuessCount());
    assertTrue(game.isFlaggedCorrectly());
    assertThat(game.getAgent().getFlags()).containsExactly(Cell.of(0, 0));

    verify(listener, times(8)).moveMade(same(game), any(Move.class));
    verify(listener).gameOver(game, Game.State.WON);
    assertNull(game.step());
    assertThat(random.getBounds()).containsExactly(9);
  }

  @Test public void lose() {
    ScriptedRandom random = new ScriptedRandom(0);
    Game game = new Game(BOARD, new Agent(BOARD.getGeometry(), random));
    game.addListener(listener);

    Move move = game.step();
    assertEquals(new Move(Cell.of(0, 0), Move.Kind.GUESS, Move.MINE), move);
    assertTrue(move.hitMine());
    assertEquals(Game.State.LOST, game.getState());
    assertTrue(game.getState().isOver());
    assertFalse(game.isFlaggedCorrectly());
    verify(listener).moveMade(game, move);
    verify(listener).gameOver(game, Game.State.LOST);

    assertNull(game.step());
    assertEquals(Game.State.LOST, game.play());
    assertThat(game.getHistory()).containsExactly(move);
  }

  @Test public void inProgress() {
    ScriptedRandom random = new ScriptedRandom(8);
    Game game = new Game(BOARD, new Agent(BOARD.getGeometry(), random));
    game.addListener(listener);
    game.step();
    assertEquals(Game.State.IN_PROGRESS, game.getState());
    assertFalse(game.getState().isOver());
    verify(listener, never()).gameOver(any(Game.class), any(Game.State.class));
  }

  @Test public void allMines() {
    Board board = Board.fromString("XX/XX");
    Game game = new Game(board, new Agent(board.getGeometry(), random));
    assertEquals(Game.State.WON, game.getState());
    assertNull(game.step());
    assertThat(game.getHistory()).isEmpty();
  }

  @Test public void reproducible() {
    Geometry geometry = new Geometry(8, 8);
    for (int seed = 0; seed < 10; ++seed) {
      Board board = Board.random(geometry, 8, new Random(seed));
      Game first = new Game(board, new Agent(geometry, new Random(seed)));
      Game second = new Game(board, new Agent(geometry, new Random(seed)));
      assertEquals(first.play(), second.play());
      assertEquals(first.getHistory(), second.getHistory());
      assertTrue(first.getState().isOver());
    }
  }

  @Test(expected = UnsupportedOperationException.class)
  public void history_unmodifiable() {
    Game game = new Game(BOARD, new Agent(BOARD.getGeometry(), random));
    game.getHistory().add(new Move(Cell.of(0, 0), Move.Kind.GUESS, 0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void geometryMismatch() {
    new Game(BOARD, new Agent(new Geometry(4, 4), random));
  }

  @Test public void getters() {
    Agent agent = new Agent(BOARD.getGeometry(), random);
    Game game = new Game(BOARD, agent);
    assertSame(BOARD, game.getBoard());
    assertSame(agent, game.getAgent());
    assertEquals(Game.State.IN_PROGRESS, game.getState());
  }
}
