package org.mcts.base.player.search.rollout;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class ThreadControlTest extends Assert
{
  private int mSavedRolloutThreads;

  @Before
  public void setUp()
  {
    mSavedRolloutThreads = ThreadControl.getRolloutThreads();
  }

  @After
  public void tearDown()
  {
    ThreadControl.setRolloutThreads(mSavedRolloutThreads);
  }

  @Test
  public void testDefaults()
  {
    int lCPUs = ThreadControl.getHardwareConcurrency();
    assertTrue(lCPUs >= 1);

    int lRecommended = ThreadControl.getRecommendedRolloutThreads();
    assertTrue(lRecommended >= 1);
    assertTrue(lRecommended <= lCPUs);
    assertEquals(Math.max(1, (lCPUs + 1) / 2), lRecommended);

    assertTrue(ThreadControl.getRolloutThreads() >= 1);
    assertTrue(ThreadControl.getRolloutThreads() <= lCPUs);
  }

  @Test
  public void testSetRolloutThreads()
  {
    ThreadControl.setRolloutThreads(1);
    assertEquals(1, ThreadControl.getRolloutThreads());

    ThreadControl.setRolloutThreads(ThreadControl.getHardwareConcurrency());
    assertEquals(ThreadControl.getHardwareConcurrency(), ThreadControl.getRolloutThreads());
  }

  @Test
  public void testExcessThreadsClamped()
  {
    ThreadControl.setRolloutThreads(ThreadControl.getHardwareConcurrency() + 100);
    assertEquals(ThreadControl.getHardwareConcurrency(), ThreadControl.getRolloutThreads());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroThreadsRejected()
  {
    ThreadControl.setRolloutThreads(0);
  }

  @Test
  public void testRejectedValueLeavesSettingUnchanged()
  {
    ThreadControl.setRolloutThreads(1);
    try
    {
      ThreadControl.setRolloutThreads(-3);
      fail("Expected IllegalArgumentException");
    }
    catch (IllegalArgumentException lEx)
    {
      assertEquals(1, ThreadControl.getRolloutThreads());
    }
  }
}
