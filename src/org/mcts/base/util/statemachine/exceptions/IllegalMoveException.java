package org.mcts.base.util.statemachine.exceptions;

import org.mcts.base.util.statemachine.GameMove;
import org.mcts.base.util.statemachine.GameState;

/**
 * Thrown when a caller supplies a move that is not legal in the state it is to be played in.
 */
public class IllegalMoveException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final GameMove mMove;
  private final GameState mState;

  /**
   * @param xiMove  - the offending move.
   * @param xiState - the state in which it was to be played.
   */
  public IllegalMoveException(GameMove xiMove, GameState xiState)
  {
    super("Move " + xiMove + " is not legal in state " + xiState);
    mMove = xiMove;
    mState = xiState;
  }

  public GameMove getMove()
  {
    return mMove;
  }

  public GameState getState()
  {
    return mState;
  }
}
