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
package us.blanshard.mines.stats;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.concurrent.TimeUnit.MICROSECONDS;

import com.google.common.base.Stopwatch;

import us.blanshard.mines.core.Board;
import us.blanshard.mines.core.Geometry;
import us.blanshard.mines.game.Game;
import us.blanshard.mines.insight.Agent;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Plays random mines games with the deduction agent and spits out statistics
 * about how it does.
 *
 * @author Luke Blanshard
 */
public class PlayStats {
  private static final Logger logger = Logger.getLogger(PlayStats.class.getName());

  static final int DEFAULT_HEIGHT = 8;
  static final int DEFAULT_WIDTH = 8;
  static final int DEFAULT_MINES = 8;

  /** The command-line settings. */
  static final class Options {
    final int count;
    final long seed;
    final Geometry geometry;
    final int mines;

    Options(int count, long seed, Geometry geometry, int mines) {
      checkArgument(count >= 0, "negative game count %s", count);
      checkArgument(mines >= 0 && mines < geometry.size(),
                    "%s mines won't fit on a %s board", mines, geometry);
      this.count = count;
      this.seed = seed;
      this.geometry = geometry;
      this.mines = mines;
    }

    /**
     * Parses {@code <count> [<seed> [<height> <width> <mines>]]}.
     *
     * @throws IllegalArgumentException if the arguments don't fit
     */
    static Options parse(String[] args, long defaultSeed) {
      checkArgument(args.length == 1 || args.length == 2 || args.length == 5,
                    "wrong number of arguments: %s", args.length);
      int count = Integer.decode(args[0]);
      long seed = args.length > 1 ? Long.decode(args[1]) : defaultSeed;
      Geometry geometry = new Geometry(DEFAULT_HEIGHT, DEFAULT_WIDTH);
      int mines = DEFAULT_MINES;
      if (args.length == 5) {
        geometry = new Geometry(Integer.decode(args[2]), Integer.decode(args[3]));
        mines = Integer.decode(args[4]);
      }
      return new Options(count, seed, geometry, mines);
    }
  }

  /** What happened in one game. */
  static final class Result {
    final Board board;
    final Game.State state;
    final int moves;
    final int guesses;
    final int minesFound;
    final boolean flagged;
    final long micros;

    Result(Game game, long micros) {
      this.board = game.getBoard();
      this.state = game.getState();
      this.moves = game.getHistory().size();
      this.guesses = game.getGuessCount();
      this.minesFound = game.getAgent().getFlags().size();
      this.flagged = game.isFlaggedCorrectly();
      this.micros = micros;
    }

    String toTsv() {
      return String.format("%s\t%s\t%d\t%d\t%d\t%s\t%d",
                           board.toFlatString(), state, moves, guesses, minesFound, flagged, micros);
    }
  }

  public static void main(String[] args) {
    configureLogging();
    Options options;
    try {
      options = Options.parse(args, System.currentTimeMillis());
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      exitWithUsage();
      return;  // Convince the compiler.
    }

    System.err.printf("Playing %d games on %s boards with %d mines from seed %#x%n",
                      options.count, options.geometry, options.mines, options.seed);
    int won = play(options, System.out);
    System.err.printf("Won %d of %d%n", won, options.count);
  }

  private static void exitWithUsage() {
    System.err.println("Usage: PlayStats <count> [<seed> [<height> <width> <mines>]]");
    System.exit(1);
  }

  private static void configureLogging() {
    try (InputStream in = PlayStats.class.getResourceAsStream("/logging.properties")) {
      if (in != null) LogManager.getLogManager().readConfiguration(in);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to read logging configuration", e);
    }
  }

  /**
   * Plays the games the options call for, printing a line for each to the
   * given stream.  Returns the number won.
   */
  static int play(Options options, PrintStream out) {
    out.println("Board\tResult\tMoves\tGuesses\tMines Found\tFlagged\tMicros");
    Random random = new Random(options.seed);
    int won = 0;
    for (int i = 0; i < options.count; ++i) {
      Result result = playOne(options, random.nextLong(), random.nextLong());
      if (result.state == Game.State.WON) ++won;
      out.println(result.toTsv());
    }
    logger.info(String.format("Won %d of %d games from seed %#x", won, options.count, options.seed));
    return won;
  }

  /** Plays one game with the given board and agent seeds. */
  static Result playOne(Options options, long boardSeed, long agentSeed) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Board board = Board.random(options.geometry, options.mines, new Random(boardSeed));
    Game game = new Game(board, new Agent(options.geometry, new Random(agentSeed)));
    game.play();
    stopwatch.stop();
    return new Result(game, stopwatch.elapsed(MICROSECONDS));
  }
}
