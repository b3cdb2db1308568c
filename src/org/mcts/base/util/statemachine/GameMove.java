package org.mcts.base.util.statemachine;

/**
 * Provides the base class for all move representations.
 *
 * A move is an immutable value describing one legal transition.  Moves are produced by a {@link GameState} and consumed
 * by that same state's {@link GameState#applyMove(GameMove)}.  The search engine never constructs moves itself.
 *
 * Implementations must provide value equality (the engine matches an externally supplied move against the moves it has
 * already explored) and a stable, human-readable rendering (used for logging).
 */
public abstract class GameMove
{
  @Override
  public abstract boolean equals(Object xiOther);

  @Override
  public abstract int hashCode();

  @Override
  public abstract String toString();
}
