package org.mcts.base.player.search;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to machine-specific configuration.
 *
 * Every item has a built-in default.  A machine can override any of them in data/cfg/&lt;hostname&gt;.properties, where
 * the host is identified by the COMPUTERNAME (Windows) or HOSTNAME environment variable.
 */
public class MachineSpecificConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * The number of rollout worker threads.  By default, we calculate based on the number of available CPUs.
     */
    ROLLOUT_THREADS(-1),

    /**
     * Exploration constant for the upper-confidence bound used during selection.
     */
    EXPLORATION_BIAS("1.41"),

    /**
     * Default rollout strategy for new search trees (a {@link RolloutStrategy} name).
     */
    ROLLOUT_STRATEGY(RolloutStrategy.RANDOM.name()),

    /**
     * Probability of using a heuristic playout under {@link RolloutStrategy#MIXED}.
     */
    HEURISTIC_RATIO("0.5"),

    /**
     * Default limit on the number of MCTS iterations to perform per turn.
     */
    MAX_ITERATIONS_PER_TURN(100000),

    /**
     * Default limit on the wall-clock time to spend searching per turn, in seconds.
     */
    MAX_SECONDS_PER_TURN(30);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiDefault)
    {
      mDefault = xiDefault;
    }

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }
  }

  private static final Properties MACHINE_PROPERTIES = new Properties();
  static
  {
    String lComputerName = System.getenv("COMPUTERNAME");
    if (lComputerName == null)
    {
      lComputerName = System.getenv("HOSTNAME");
    }

    if (lComputerName != null)
    {
      try (InputStream lPropStream = new FileInputStream("data/cfg/" + lComputerName + ".properties"))
      {
        MACHINE_PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.debug("No machine-specific configuration for " + lComputerName + " - using defaults");
      }
    }
    else
    {
      LOGGER.debug("Failed to identify computer name - no environment variable COMPUTERNAME or HOSTNAME");
    }
  }

  private MachineSpecificConfiguration()
  {
    // Private default constructor.
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (MACHINE_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey).trim());
  }

  /**
   * @return the specified floating point configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static double getCfgDouble(CfgItem xiKey)
  {
    return Double.parseDouble(getCfgStr(xiKey).trim());
  }

  /**
   * Log all machine-specific configuration.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with machine-specific properties:");
    for (Entry<Object, Object> e : MACHINE_PROPERTIES.entrySet())
    {
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value, or null to revert to the default.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    if (xiValue == null)
    {
      MACHINE_PROPERTIES.remove(xiKey.toString());
    }
    else
    {
      MACHINE_PROPERTIES.setProperty(xiKey.toString(), xiValue);
    }
  }
}
