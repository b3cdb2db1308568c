package org.mcts.base.util.foreign;

import java.util.ArrayList;
import java.util.List;

import org.mcts.base.util.statemachine.GameMove;

/**
 * Lets the search engine play a game implemented in a foreign object model.
 *
 * The adapter turns foreign states and moves into {@link ForeignState}s and {@link ForeignMove}s, which hold nothing
 * but an immutable snapshot.  Every game operation restores a fresh foreign object from the snapshot, invokes the
 * foreign rules on it and snapshots the result again.  So the tree never holds a reference to a foreign object and
 * foreign objects are never shared between threads.
 *
 * @param <S> the foreign state type.
 * @param <M> the foreign move type.
 */
public class ForeignStateAdapter<S, M>
{
  private final ForeignGameRules<S, M> mRules;
  private final SnapshotCodec<S>       mStateCodec;
  private final SnapshotCodec<M>       mMoveCodec;

  /**
   * Create an adapter.
   *
   * @param xiRules - the rules of the game.
   * @param xiStateCodec - codec for states.
   * @param xiMoveCodec - codec for moves.
   */
  public ForeignStateAdapter(ForeignGameRules<S, M> xiRules,
                             SnapshotCodec<S> xiStateCodec,
                             SnapshotCodec<M> xiMoveCodec)
  {
    mRules = xiRules;
    mStateCodec = xiStateCodec;
    mMoveCodec = xiMoveCodec;
  }

  /**
   * Create an adapter using JSON snapshots.
   *
   * @param xiRules - the rules of the game.
   * @param xiStateClass - the foreign state class.
   * @param xiMoveClass - the foreign move class.
   */
  public ForeignStateAdapter(ForeignGameRules<S, M> xiRules, Class<S> xiStateClass, Class<M> xiMoveClass)
  {
    this(xiRules, new GsonSnapshotCodec<>(xiStateClass), new GsonSnapshotCodec<>(xiMoveClass));
  }

  /**
   * @return a native state for the specified foreign state.  The foreign state is only read.
   *
   * @param xiState - the foreign state.
   *
   * @throws SnapshotException if the state can't be snapshotted, e.g. because it refers to itself.
   */
  public ForeignState wrapState(S xiState)
  {
    String lSnapshot = mStateCodec.toSnapshot(xiState);

    // Query a restored copy, so that the caller's object is never passed to the rules.
    S lCopy = mStateCodec.fromSnapshot(lSnapshot);
    return new ForeignState(this, lSnapshot, mRules.isTerminal(lCopy), mRules.isFirstSideToMove(lCopy));
  }

  /**
   * @return a newly restored foreign state for the specified native state.
   *
   * @param xiState - the native state, which must have been created by this adapter.
   */
  public S unwrapState(ForeignState xiState)
  {
    checkOwner(xiState.getAdapter(), xiState);
    return mStateCodec.fromSnapshot(xiState.getSnapshot());
  }

  /**
   * @return a native move for the specified foreign move.
   *
   * @param xiMove - the foreign move.
   */
  public ForeignMove wrapMove(M xiMove)
  {
    return new ForeignMove(this, mMoveCodec.toSnapshot(xiMove), mRules.describeMove(xiMove));
  }

  /**
   * @return a newly restored foreign move for the specified native move.
   *
   * @param xiMove - the native move, which must have been created by this adapter.
   */
  public M unwrapMove(ForeignMove xiMove)
  {
    checkOwner(xiMove.getAdapter(), xiMove);
    return mMoveCodec.fromSnapshot(xiMove.getSnapshot());
  }

  private void checkOwner(ForeignStateAdapter<?, ?> xiOwner, Object xiObject)
  {
    if (xiOwner != this)
    {
      throw new IllegalArgumentException(xiObject + " belongs to a different adapter");
    }
  }

  List<GameMove> getLegalMoves(ForeignState xiState)
  {
    List<M> lForeignMoves = mRules.getLegalMoves(unwrapState(xiState));
    List<GameMove> lMoves = new ArrayList<>(lForeignMoves.size());
    for (M lForeignMove : lForeignMoves)
    {
      lMoves.add(wrapMove(lForeignMove));
    }
    return lMoves;
  }

  ForeignState applyMove(ForeignState xiState, ForeignMove xiMove)
  {
    return wrapState(mRules.applyMove(unwrapState(xiState), unwrapMove(xiMove)));
  }

  double playout(ForeignState xiState)
  {
    return mRules.playout(unwrapState(xiState));
  }

  double heuristicPlayout(ForeignState xiState)
  {
    return mRules.heuristicPlayout(unwrapState(xiState));
  }

  double evaluateMove(ForeignState xiState, ForeignMove xiMove)
  {
    return mRules.evaluateMove(unwrapState(xiState), unwrapMove(xiMove));
  }
}
