package org.mcts.base.util.statemachine;

import java.util.List;


/**
 * Provides the base class for all game state implementations.
 *
 * A game state is an immutable value describing one complete position of a two-player, alternating-move game,
 * including whose turn it is.  It is referentially independent: {@link #applyMove(GameMove)} never mutates the source
 * state, it always yields a new one.  This is mandatory because several tree branches and several rollout threads may
 * hold the same state concurrently.
 *
 * Playout outcomes are always expressed from the point of view of the first side: 1.0 is a definite win for the first
 * side, 0.0 is a definite win for the second side and interior values are draws or heuristic valuations.
 */
public abstract class GameState
{
  // ============================================
  //          Stubs for implementations
  // ============================================
  //  The following methods are required for a valid
  // game state implementation.

  /**
   * @return the legal moves in this state, in a stable order.
   *
   * The engine never calls this on a terminal state.  Other callers may, and must receive an empty list.
   */
  public abstract List<GameMove> getLegalMoves();

  /**
   * @return the state obtained by playing the specified move in this state.  This state is left unchanged.
   *
   * @param xiMove - a move previously returned by {@link #getLegalMoves()} for this state.
   */
  public abstract GameState applyMove(GameMove xiMove);

  /**
   * Play a randomized game from this state to its end.  For a terminal state, this is just the final outcome.
   *
   * @return the outcome for the first side, in the closed interval [0.0, 1.0].
   */
  public abstract double playout();

  /**
   * @return whether this state is terminal (i.e. the game is over).
   */
  public abstract boolean isTerminal();

  /**
   * @return whether it is the first side's turn to move.
   */
  public abstract boolean isFirstSideToMove();

  /**
   * @return an independent copy of this state, sharing no mutable data with it.
   */
  public abstract GameState deepCopy();

  // ============================================
  //          Stubs for advanced methods
  // ============================================
  //
  //   The following methods have functioning stubs,
  // which can be overridden by games that know
  // something better.

  /**
   * Play a heuristically guided game from this state to its end.  By default this is just a random playout.
   *
   * @return the outcome for the first side, in the closed interval [0.0, 1.0].
   */
  public double heuristicPlayout()
  {
    return playout();
  }

  /**
   * Prior estimate of how promising a move is.  Moves with a higher estimate are expanded first.  By default all
   * moves are equal, so they are expanded in the order given by {@link #getLegalMoves()}.
   *
   * @param xiMove - a legal move in this state.
   *
   * @return the estimate.  Only the relative order matters.
   */
  public double evaluateMove(GameMove xiMove)
  {
    return 0.0;
  }
}
