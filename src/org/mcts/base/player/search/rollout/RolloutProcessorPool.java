package org.mcts.base.player.search.rollout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A fixed size pool of rollout processors, shared by every agent in the process.
 *
 * The pool is sized from {@link ThreadControl#getRolloutThreads()} and is (re)built lazily the first time it is used
 * after the thread count changes.
 */
public class RolloutProcessorPool
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final AtomicInteger sThreadIndex = new AtomicInteger();

  private static ExecutorService sExecutor = null;
  private static int sPoolSize = 0;

  private RolloutProcessorPool()
  {
    // Private default constructor.
  }

  /**
   * Factory for rollout processor threads.  Daemon threads, so that an abandoned pool never keeps the process alive.
   */
  private static class RolloutThreadFactory implements ThreadFactory
  {
    @Override
    public Thread newThread(Runnable xiRunnable)
    {
      Thread lThread = new Thread(xiRunnable, "Rollout Processor " + sThreadIndex.getAndIncrement());
      lThread.setDaemon(true);
      return lThread;
    }
  }

  /**
   * @return an executor with the currently configured number of threads.
   */
  private static synchronized ExecutorService getExecutor()
  {
    int lRequired = ThreadControl.getRolloutThreads();
    if ((sExecutor == null) || (sPoolSize != lRequired))
    {
      if (sExecutor != null)
      {
        LOGGER.info("Resizing rollout processor pool from " + sPoolSize + " to " + lRequired + " threads");

        // Work already submitted to the old pool still completes.
        sExecutor.shutdown();
      }
      else
      {
        LOGGER.info("Starting rollout processor pool with " + lRequired + " threads");
      }

      sExecutor = Executors.newFixedThreadPool(lRequired, new RolloutThreadFactory());
      sPoolSize = lRequired;
    }

    return sExecutor;
  }

  /**
   * @return the number of threads in the pool, or 0 if it hasn't been started.
   */
  public static synchronized int getPoolSize()
  {
    return (sExecutor == null) ? 0 : sPoolSize;
  }

  /**
   * Perform the specified rollouts on the pool and wait for all of them to complete.
   *
   * @param xiRequests - the rollouts to perform.
   *
   * @return the outcome of each rollout, in the same order as the requests (not the order of completion).
   */
  public static List<Double> processAll(List<RolloutRequest> xiRequests)
  {
    List<Future<Double>> lFutures = null;
    while (lFutures == null)
    {
      ExecutorService lExecutor = getExecutor();
      try
      {
        lFutures = lExecutor.invokeAll(xiRequests);
      }
      catch (RejectedExecutionException lEx)
      {
        // The pool was resized (or shut down) under our feet.  Try again with the current pool.
        LOGGER.debug("Rollout processor pool replaced whilst submitting work - retrying");
        if (!lExecutor.isShutdown())
        {
          throw lEx;
        }
      }
      catch (InterruptedException lEx)
      {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted whilst waiting for rollouts to complete", lEx);
      }
    }

    List<Double> lOutcomes = new ArrayList<>(lFutures.size());
    for (Future<Double> lFuture : lFutures)
    {
      lOutcomes.add(getOutcome(lFuture));
    }
    return lOutcomes;
  }

  private static double getOutcome(Future<Double> xiFuture)
  {
    try
    {
      return xiFuture.get();
    }
    catch (InterruptedException lEx)
    {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted whilst waiting for rollouts to complete", lEx);
    }
    catch (ExecutionException lEx)
    {
      // Surface the failure from the rollout processor exactly as if the rollout had been run on this thread.
      Throwable lCause = lEx.getCause();
      if (lCause instanceof RuntimeException)
      {
        throw (RuntimeException)lCause;
      }
      if (lCause instanceof Error)
      {
        throw (Error)lCause;
      }
      throw new IllegalStateException("Rollout failed", lCause);
    }
  }

  /**
   * Stop all rollout processors.  The pool restarts if it is used again.
   *
   * The pool is shared, so other agents may be waiting on work that is queued or in progress.  That work is run to
   * completion before the processors exit.
   */
  public static synchronized void shutdown()
  {
    if (sExecutor != null)
    {
      LOGGER.info("Stop rollout processors");
      sExecutor.shutdown();
      sExecutor = null;
      sPoolSize = 0;
    }
  }
}
