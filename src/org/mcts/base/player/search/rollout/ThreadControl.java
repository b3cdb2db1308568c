package org.mcts.base.player.search.rollout;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mcts.base.player.search.MachineSpecificConfiguration;
import org.mcts.base.player.search.MachineSpecificConfiguration.CfgItem;

/**
 * Utility class holding the process-wide threading configuration.
 *
 * There are two classes of CPU intensive thread.
 *
 * - The controlling thread of each agent, which performs selection, expansion and back-propagation.  This is whatever
 *   thread calls into the agent.
 * - Rollout processors, shared by all agents in the process.  There are {@link #getRolloutThreads()} of these.
 *
 * The rollout thread count is a single piece of process-wide state.  It is initialised from
 * {@link CfgItem#ROLLOUT_THREADS} (falling back to {@link #getRecommendedRolloutThreads()}) and there is deliberately
 * no per-agent override.
 */
public class ThreadControl
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * The number of vCPUs available on the system.  (For a hyper-threaded system, each hyper-thread counts as a CPU.)
   */
  public static final int NUM_CPUS = Runtime.getRuntime().availableProcessors();

  /**
   * The number of rollouts to perform (in parallel) for each MCTS iteration.  When 1, rollouts are performed
   * synchronously on the controlling thread.
   */
  private static volatile int sRolloutThreads;
  static
  {
    int lConfiguredValue = MachineSpecificConfiguration.getCfgInt(CfgItem.ROLLOUT_THREADS);
    if (lConfiguredValue == -1)
    {
      sRolloutThreads = getRecommendedRolloutThreads();
    }
    else if (lConfiguredValue < 1)
    {
      LOGGER.warn("Invalid configured rollout thread count " + lConfiguredValue + " - using the recommended value");
      sRolloutThreads = getRecommendedRolloutThreads();
    }
    else
    {
      sRolloutThreads = Math.min(lConfiguredValue, NUM_CPUS);
    }
  }

  private ThreadControl()
  {
    // Private default constructor.
  }

  /**
   * @return the number of concurrent threads supported by the hardware.
   */
  public static int getHardwareConcurrency()
  {
    return NUM_CPUS;
  }

  /**
   * @return the recommended number of rollout threads for this machine.  Use half the available vCPUs (rounding up),
   * which on hyper-threaded CPUs puts each rollout thread on its own physical core.
   */
  public static int getRecommendedRolloutThreads()
  {
    return Math.max(1, (NUM_CPUS + 1) / 2);
  }

  /**
   * @return the number of rollouts performed in parallel for each MCTS iteration.
   */
  public static int getRolloutThreads()
  {
    return sRolloutThreads;
  }

  /**
   * Set the number of rollouts performed in parallel for each MCTS iteration, for all agents in the process.
   *
   * Values above the hardware concurrency are clamped to it.
   *
   * @param xiNumThreads - the number of threads, at least 1.
   */
  public static void setRolloutThreads(int xiNumThreads)
  {
    if (xiNumThreads < 1)
    {
      throw new IllegalArgumentException("Rollout thread count must be at least 1, not " + xiNumThreads);
    }

    int lNumThreads = xiNumThreads;
    if (lNumThreads > NUM_CPUS)
    {
      LOGGER.warn("Requested " + xiNumThreads + " rollout threads but only " + NUM_CPUS + " vCPUs are available");
      lNumThreads = NUM_CPUS;
    }

    if (lNumThreads != sRolloutThreads)
    {
      LOGGER.info("Rollout threads: " + sRolloutThreads + " -> " + lNumThreads);
      sRolloutThreads = lNumThreads;
    }
  }
}
