package org.mcts.base.util.foreign;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mcts.base.player.search.MCTSAgent;
import org.mcts.base.player.search.rollout.ThreadControl;
import org.mcts.base.test.TicTacToeMove;
import org.mcts.base.util.statemachine.GameMove;
import org.mcts.base.util.statemachine.GameState;

public class ForeignStateAdapterTest extends Assert
{
  /**
   * A mutable Nim position.  The player who takes the last stone wins.
   */
  public static class NimPosition
  {
    public int     stones;
    public boolean firstToMove;

    public NimPosition()
    {
    }

    public NimPosition(int xiStones, boolean xiFirstToMove)
    {
      stones = xiStones;
      firstToMove = xiFirstToMove;
    }
  }

  public static class NimMove
  {
    public int take;

    public NimMove()
    {
    }

    public NimMove(int xiTake)
    {
      take = xiTake;
    }
  }

  /**
   * A chain of positions, which may be made to loop.
   */
  public static class LinkedPosition
  {
    public int            stones;
    public LinkedPosition next;
  }

  /**
   * Nim, taking one or two stones per turn.
   */
  public static class NimRules extends ForeignGameRules<NimPosition, NimMove>
  {
    @Override
    public List<NimMove> getLegalMoves(NimPosition xiState)
    {
      List<NimMove> lMoves = new ArrayList<>();
      for (int lTake = 1; lTake <= Math.min(2, xiState.stones); lTake++)
      {
        lMoves.add(new NimMove(lTake));
      }
      return lMoves;
    }

    @Override
    public NimPosition applyMove(NimPosition xiState, NimMove xiMove)
    {
      xiState.stones -= xiMove.take;
      xiState.firstToMove = !xiState.firstToMove;
      return xiState;
    }

    @Override
    public double playout(NimPosition xiState)
    {
      while (xiState.stones > 0)
      {
        int lTake = (xiState.stones == 1) ? 1 : 1 + ThreadLocalRandom.current().nextInt(2);
        applyMove(xiState, new NimMove(lTake));
      }

      // Whoever is to move when the stones run out has lost.
      return xiState.firstToMove ? 0.0 : 1.0;
    }

    @Override
    public boolean isTerminal(NimPosition xiState)
    {
      return xiState.stones == 0;
    }

    @Override
    public boolean isFirstSideToMove(NimPosition xiState)
    {
      return xiState.firstToMove;
    }

    @Override
    public String describeMove(NimMove xiMove)
    {
      return "take " + xiMove.take;
    }
  }

  private final ForeignStateAdapter<NimPosition, NimMove> mAdapter =
                                    new ForeignStateAdapter<>(new NimRules(), NimPosition.class, NimMove.class);

  private int mSavedRolloutThreads;

  @Before
  public void setUp()
  {
    mSavedRolloutThreads = ThreadControl.getRolloutThreads();
    ThreadControl.setRolloutThreads(1);
  }

  @After
  public void tearDown()
  {
    ThreadControl.setRolloutThreads(mSavedRolloutThreads);
  }

  @Test
  public void testWrapAndUnwrapState()
  {
    NimPosition lPosition = new NimPosition(5, true);
    ForeignState lState = mAdapter.wrapState(lPosition);

    assertFalse(lState.isTerminal());
    assertTrue(lState.isFirstSideToMove());

    NimPosition lRestored = mAdapter.unwrapState(lState);
    assertNotSame(lPosition, lRestored);
    assertEquals(5, lRestored.stones);
    assertTrue(lRestored.firstToMove);

    // Every unwrap is a fresh object.
    assertNotSame(lRestored, mAdapter.unwrapState(lState));
  }

  @Test
  public void testLegalMoves()
  {
    ForeignState lState = mAdapter.wrapState(new NimPosition(5, true));
    List<GameMove> lMoves = lState.getLegalMoves();

    assertEquals(2, lMoves.size());
    assertEquals("take 1", lMoves.get(0).toString());
    assertEquals("take 2", lMoves.get(1).toString());
    assertEquals(2, mAdapter.unwrapMove((ForeignMove)lMoves.get(1)).take);

    assertEquals(1, mAdapter.wrapState(new NimPosition(1, false)).getLegalMoves().size());
    assertTrue(mAdapter.wrapState(new NimPosition(0, false)).getLegalMoves().isEmpty());
  }

  @Test
  public void testMoveEqualityIsSnapshotEquality()
  {
    ForeignState lState = mAdapter.wrapState(new NimPosition(5, true));
    ForeignMove lWrapped = mAdapter.wrapMove(new NimMove(2));

    assertEquals(lState.getLegalMoves().get(1), lWrapped);
    assertEquals(lState.getLegalMoves().get(1).hashCode(), lWrapped.hashCode());
    assertFalse(lState.getLegalMoves().get(0).equals(lWrapped));
    assertTrue(lState.getLegalMoves().contains(lWrapped));
  }

  @Test
  public void testApplyMoveLeavesSourceUnchanged()
  {
    NimPosition lPosition = new NimPosition(5, true);
    ForeignState lState = mAdapter.wrapState(lPosition);
    String lSnapshot = lState.getSnapshot();

    GameState lNext = lState.applyMove(mAdapter.wrapMove(new NimMove(2)));

    assertEquals(lSnapshot, lState.getSnapshot());
    assertEquals(5, mAdapter.unwrapState(lState).stones);
    assertEquals(5, lPosition.stones);

    assertFalse(lNext.isFirstSideToMove());
    assertEquals(3, mAdapter.unwrapState((ForeignState)lNext).stones);
    assertEquals(mAdapter.wrapState(new NimPosition(3, false)), lNext);
  }

  @Test
  public void testPlayoutFromTerminalState()
  {
    assertEquals(1.0, mAdapter.wrapState(new NimPosition(0, false)).playout(), 1e-9);
    assertEquals(0.0, mAdapter.wrapState(new NimPosition(0, true)).playout(), 1e-9);
  }

  @Test
  public void testDeepCopy()
  {
    ForeignState lState = mAdapter.wrapState(new NimPosition(4, true));
    GameState lCopy = lState.deepCopy();
    assertNotSame(lState, lCopy);
    assertEquals(lState, lCopy);
    assertEquals(lState.hashCode(), lCopy.hashCode());
  }

  @Test
  public void testAgentPlaysForeignGame() throws Exception
  {
    MCTSAgent lAgent = new MCTSAgent(mAdapter.wrapState(new NimPosition(5, true)), 3000, MCTSAgent.UNLIMITED_TIME);

    // Taking two leaves the opponent a lost position.
    GameMove lMove = lAgent.generateMove(null);
    assertEquals(mAdapter.wrapMove(new NimMove(2)), lMove);
    assertEquals(2, mAdapter.unwrapMove((ForeignMove)lMove).take);

    // Opponent takes one, leaving two, which we take to win.
    lMove = lAgent.generateMove(mAdapter.wrapMove(new NimMove(1)));
    assertEquals(mAdapter.wrapMove(new NimMove(2)), lMove);
    assertTrue(lAgent.getCurrentState().isTerminal());
  }

  @Test(expected = SnapshotException.class)
  public void testMalformedSnapshot()
  {
    new GsonSnapshotCodec<>(NimPosition.class).fromSnapshot("{\"stones\": \"many\"}");
  }

  @Test(expected = SnapshotException.class)
  public void testNullSnapshot()
  {
    new GsonSnapshotCodec<>(NimPosition.class).fromSnapshot("null");
  }

  @Test(expected = SnapshotException.class)
  public void testSnapshotOfNull()
  {
    mAdapter.wrapState(null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testStateFromAnotherAdapter()
  {
    ForeignStateAdapter<NimPosition, NimMove> lOther =
                                    new ForeignStateAdapter<>(new NimRules(), NimPosition.class, NimMove.class);
    mAdapter.unwrapState(lOther.wrapState(new NimPosition(3, true)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNativeMoveRejected()
  {
    mAdapter.wrapState(new NimPosition(3, true)).applyMove(new TicTacToeMove(0));
  }

  @Test(expected = SnapshotException.class)
  public void testSelfReferenceRejected()
  {
    LinkedPosition lPosition = new LinkedPosition();
    lPosition.next = lPosition;
    new GsonSnapshotCodec<>(LinkedPosition.class).toSnapshot(lPosition);
  }

  @Test(expected = SnapshotException.class)
  public void testCycleRejected()
  {
    LinkedPosition lFirst = new LinkedPosition();
    LinkedPosition lSecond = new LinkedPosition();
    lFirst.next = lSecond;
    lSecond.next = lFirst;
    new GsonSnapshotCodec<>(LinkedPosition.class).toSnapshot(lFirst);
  }

  @Test
  public void testSharedObjectsAllowed()
  {
    LinkedPosition lShared = new LinkedPosition();
    lShared.stones = 7;
    List<LinkedPosition> lPositions = new ArrayList<>();
    lPositions.add(lShared);
    lPositions.add(lShared);

    GsonSnapshotCodec<ArrayList> lCodec = new GsonSnapshotCodec<>(ArrayList.class);
    assertEquals("[{\"stones\":7},{\"stones\":7}]", lCodec.toSnapshot(new ArrayList<>(lPositions)));

    LinkedPosition lChain = new LinkedPosition();
    lChain.next = lShared;
    assertEquals("{\"stones\":0,\"next\":{\"stones\":7}}",
                 new GsonSnapshotCodec<>(LinkedPosition.class).toSnapshot(lChain));
  }
}
