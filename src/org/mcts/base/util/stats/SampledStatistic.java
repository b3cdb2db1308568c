package org.mcts.base.util.stats;

/**
 * Keep track of a statistic based on a number of samples.
 *
 * Optimised for recording samples more often than reading the summary values.  Not thread-safe: samples must all be
 * recorded from the same thread (in practice, an agent's controlling thread).
 */
public class SampledStatistic
{
  private int      mNumSamples   = 0;
  private double   mSum          = 0;
  private double   mSumOfSquares = 0;
  private double   mMin          = Double.POSITIVE_INFINITY;
  private double   mMax          = Double.NEGATIVE_INFINITY;

  /**
   * Record a sample.
   *
   * @param xiValue - the sample value.
   */
  public void sample(double xiValue)
  {
    mSum += xiValue;
    mSumOfSquares += xiValue * xiValue;
    mNumSamples++;

    if (xiValue < mMin)
    {
      mMin = xiValue;
    }
    if (xiValue > mMax)
    {
      mMax = xiValue;
    }
  }

  /**
   * Discard all recorded samples.
   */
  public void clear()
  {
    mNumSamples = 0;
    mSum = 0;
    mSumOfSquares = 0;
    mMin = Double.POSITIVE_INFINITY;
    mMax = Double.NEGATIVE_INFINITY;
  }

  /**
   * @return the number of samples recorded.
   */
  public int getNumSamples()
  {
    return mNumSamples;
  }

  /**
   * @return the total value of the recorded samples.
   */
  public double getTotal()
  {
    return mSum;
  }

  /**
   * @return the mean value of the recorded samples, or 0 if there are none.
   */
  public double getMean()
  {
    if (mNumSamples == 0)
    {
      return 0;
    }
    return mSum / mNumSamples;
  }

  /**
   * @return the smallest sample recorded, or 0 if there are none.
   */
  public double getMin()
  {
    return (mNumSamples == 0) ? 0 : mMin;
  }

  /**
   * @return the largest sample recorded, or 0 if there are none.
   */
  public double getMax()
  {
    return (mNumSamples == 0) ? 0 : mMax;
  }

  /**
   * @return the standard deviation of the recorded samples.
   */
  public double getStdDev()
  {
    if (mNumSamples < 2)
    {
      return 0;
    }

    //  When every sample is the same, rounding errors can make the difference slightly negative.
    double numerator = Math.max(0, ((mNumSamples * mSumOfSquares) - (mSum * mSum)));
    double lStdDev = Math.sqrt(numerator / (mNumSamples * ((double)mNumSamples - 1)));
    assert(!Double.isNaN(lStdDev));
    assert(!Double.isInfinite(lStdDev));
    assert(lStdDev >= 0);

    return lStdDev;
  }

  @Override
  public String toString()
  {
    if (mNumSamples == 0)
    {
      return "<No samples>";
    }

    return String.format("%.3f +/- %.3f [%.3f, %.3f] (n=%d)", getMean(), getStdDev(), getMin(), getMax(), mNumSamples);
  }
}
