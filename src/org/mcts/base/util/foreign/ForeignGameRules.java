package org.mcts.base.util.foreign;

import java.util.List;

/**
 * The rules of a game implemented in a foreign object model.
 *
 * Foreign states may be mutable.  Every method is called on an object freshly restored from a snapshot, which the
 * implementation is free to modify.  States and moves must be acyclic object graphs, so that they can be snapshotted.
 *
 * @param <S> the foreign state type.
 * @param <M> the foreign move type.
 */
public abstract class ForeignGameRules<S, M>
{
  // ============================================
  //          Stubs for implementations
  // ============================================

  /**
   * @return the legal moves in the specified state, in a stable order.  Empty if the state is terminal.
   */
  public abstract List<M> getLegalMoves(S xiState);

  /**
   * Apply a move.  The implementation may modify the state it is passed and return it.
   *
   * @return the resulting state.
   */
  public abstract S applyMove(S xiState, M xiMove);

  /**
   * @return the outcome of a random playout for the first side, in [0.0, 1.0].
   */
  public abstract double playout(S xiState);

  public abstract boolean isTerminal(S xiState);

  public abstract boolean isFirstSideToMove(S xiState);

  // ============================================
  //          Stubs for advanced methods
  // ============================================

  /**
   * @return the outcome of a heuristic playout for the first side, in [0.0, 1.0].  By default, a random playout.
   */
  public double heuristicPlayout(S xiState)
  {
    return playout(xiState);
  }

  /**
   * @return the expansion prior for a move.  By default all moves are equal.
   */
  public double evaluateMove(S xiState, M xiMove)
  {
    return 0.0;
  }

  /**
   * @return a human-readable description of the move.
   */
  public String describeMove(M xiMove)
  {
    return String.valueOf(xiMove);
  }
}
