package org.mcts.base.player.search;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.mcts.base.test.ScriptedMove;
import org.mcts.base.test.ScriptedState;
import org.mcts.base.test.TicTacToeMove;
import org.mcts.base.test.TicTacToeState;
import org.mcts.base.util.statemachine.GameMove;

public class SearchTreeNodeTest extends Assert
{
  private static final double EPSILON = 1e-9;

  private static SearchTreeNode scriptedRoot(int xiDepth, int xiBranching)
  {
    return SearchTreeNode.createRoot(new ScriptedState(xiDepth, xiBranching, 0.5, new ScriptedState.Recorder()));
  }

  @Test
  public void testExpansionFollowsLegalMoveOrder()
  {
    SearchTreeNode lRoot = scriptedRoot(3, 3);
    assertEquals(Arrays.asList(new GameMove[] {new ScriptedMove(0), new ScriptedMove(1), new ScriptedMove(2)}),
                 lRoot.getUntriedMoves());

    SearchTreeNode lChild = lRoot.expand();
    assertEquals(new ScriptedMove(0), lChild.getMove());
    assertSame(lRoot, lChild.getParent());
    assertEquals(Arrays.asList(new GameMove[] {new ScriptedMove(1), new ScriptedMove(2)}), lRoot.getUntriedMoves());
  }

  @Test
  public void testExpansionFollowsMovePrior()
  {
    SearchTreeNode lRoot = SearchTreeNode.createRoot(TicTacToeState.initialState());

    // Centre, then corners, then edges.  Equal priors keep the board order.
    int[] lExpected = {4, 0, 2, 6, 8, 1, 3, 5, 7};
    List<GameMove> lUntried = lRoot.getUntriedMoves();
    assertEquals(9, lUntried.size());
    for (int lii = 0; lii < lExpected.length; lii++)
    {
      assertEquals(new TicTacToeMove(lExpected[lii]), lUntried.get(lii));
    }

    for (int lii = 0; lii < lExpected.length; lii++)
    {
      assertEquals(new TicTacToeMove(lExpected[lii]), lRoot.expand().getMove());
    }
  }

  @Test
  public void testMoveSetShrinksOnExpansion()
  {
    SearchTreeNode lRoot = scriptedRoot(2, 4);
    for (int lii = 1; lii <= 4; lii++)
    {
      assertTrue(lRoot.hasUntriedMoves());
      lRoot.expand();
      assertEquals(4 - lii, lRoot.getUntriedMoves().size());
      assertEquals(lii, lRoot.getChildren().size());
    }
    assertFalse(lRoot.hasUntriedMoves());
  }

  @Test
  public void testTerminalNodeHasNoMoves()
  {
    SearchTreeNode lRoot = SearchTreeNode.createRoot(new TicTacToeState("XXXOO...."));
    assertTrue(lRoot.isTerminal());
    assertFalse(lRoot.hasUntriedMoves());
    assertFalse(lRoot.hasChildren());
  }

  @Test
  public void testPerspectiveAlternatesForFirstSideWin()
  {
    SearchTreeNode lRoot = scriptedRoot(4, 2);
    SearchTreeNode lChild = lRoot.expand();
    SearchTreeNode lGrandchild = lChild.expand();

    assertFalse(lRoot.isMoverFirstSide());
    assertTrue(lChild.isMoverFirstSide());
    assertFalse(lGrandchild.isMoverFirstSide());

    lGrandchild.recordDirectRollout();
    lGrandchild.backPropagate(1.0);

    assertEquals(0.0, lGrandchild.getValueSum(), EPSILON);
    assertEquals(1.0, lChild.getValueSum(), EPSILON);
    assertEquals(0.0, lRoot.getValueSum(), EPSILON);
    assertEquals(1, lGrandchild.getNumVisits());
    assertEquals(1, lChild.getNumVisits());
    assertEquals(1, lRoot.getNumVisits());
  }

  @Test
  public void testPerspectiveAlternatesForSecondSideWin()
  {
    SearchTreeNode lRoot = scriptedRoot(4, 2);
    SearchTreeNode lChild = lRoot.expand();
    SearchTreeNode lGrandchild = lChild.expand();

    lGrandchild.recordDirectRollout();
    lGrandchild.backPropagate(0.0);

    assertEquals(1.0, lGrandchild.getValueSum(), EPSILON);
    assertEquals(0.0, lChild.getValueSum(), EPSILON);
    assertEquals(1.0, lRoot.getValueSum(), EPSILON);
  }

  @Test
  public void testDrawCountsHalfForBothSides()
  {
    SearchTreeNode lRoot = scriptedRoot(4, 2);
    SearchTreeNode lChild = lRoot.expand();

    lChild.recordDirectRollout();
    lChild.backPropagate(0.5);

    assertEquals(0.5, lChild.getMean(), EPSILON);
    assertEquals(0.5, lRoot.getMean(), EPSILON);
  }

  @Test
  public void testSelectionPrefersUnvisitedThenHigherMean()
  {
    SearchTreeNode lRoot = scriptedRoot(4, 3);

    SearchTreeNode lLoser = lRoot.expand();
    lLoser.recordDirectRollout();
    lLoser.backPropagate(0.0);

    SearchTreeNode lWinner = lRoot.expand();
    lWinner.recordDirectRollout();
    lWinner.backPropagate(1.0);

    assertSame(lWinner, lRoot.selectChild(1.41));

    SearchTreeNode lUnvisited = lRoot.expand();
    assertSame(lUnvisited, lRoot.selectChild(1.41));
  }

  @Test
  public void testSelectionTieGoesToFirstChild()
  {
    SearchTreeNode lRoot = scriptedRoot(4, 2);
    SearchTreeNode lFirst = lRoot.expand();
    SearchTreeNode lSecond = lRoot.expand();

    // Both unvisited.
    assertSame(lFirst, lRoot.selectChild(1.41));

    lFirst.recordDirectRollout();
    lFirst.backPropagate(0.5);
    lSecond.recordDirectRollout();
    lSecond.backPropagate(0.5);
    assertSame(lFirst, lRoot.selectChild(1.41));
  }

  @Test
  public void testBestChildByVisitsThenMean()
  {
    SearchTreeNode lRoot = scriptedRoot(4, 3);
    SearchTreeNode lA = lRoot.expand();
    SearchTreeNode lB = lRoot.expand();
    SearchTreeNode lC = lRoot.expand();

    // A: 1 visit.  B: 2 visits, mean 0.  C: 2 visits, mean 1.
    lA.recordDirectRollout();
    lA.backPropagate(1.0);
    for (int lii = 0; lii < 2; lii++)
    {
      lB.recordDirectRollout();
      lB.backPropagate(0.0);
      lC.recordDirectRollout();
      lC.backPropagate(1.0);
    }

    assertSame(lC, lRoot.getBestChild());
  }

  @Test
  public void testBestChildWithoutChildren()
  {
    assertNull(scriptedRoot(2, 2).getBestChild());
  }

  @Test
  public void testFindChild()
  {
    SearchTreeNode lRoot = scriptedRoot(3, 3);
    lRoot.expand();
    SearchTreeNode lSecond = lRoot.expand();

    assertSame(lSecond, lRoot.findChild(new ScriptedMove(1)));
    assertNull(lRoot.findChild(new ScriptedMove(2)));
  }

  @Test
  public void testVisitConservation()
  {
    SearchTreeNode lRoot = scriptedRoot(5, 2);
    SearchTreeNode lChild = lRoot.expand();
    SearchTreeNode lGrandchild = lChild.expand();

    lRoot.recordDirectRollout();
    lRoot.backPropagate(0.5);
    lChild.recordDirectRollout();
    lChild.backPropagate(1.0);
    lGrandchild.recordDirectRollout();
    lGrandchild.backPropagate(0.0);
    lGrandchild.recordDirectRollout();
    lGrandchild.backPropagate(1.0);

    assertEquals(4, lRoot.getNumVisits());
    assertEquals(3, lChild.getNumVisits());
    assertEquals(2, lGrandchild.getNumVisits());
    assertNull(lRoot.findInconsistency());
    assertEquals(3, lRoot.getSubtreeSize());

    // A visit without a matching rollout is spotted.
    lChild.backPropagate(1.0);
    assertNotNull(lRoot.findInconsistency());
  }
}
