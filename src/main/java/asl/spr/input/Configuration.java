package asl.spr.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file including analysis parameters that users may need to adjust for their
 * instrument. These include the TIR search windows for liquid and dry (air) measurements and the
 * number of scans that separates the two, the neighborhood used in resonance minimum fitting,
 * the number of points in the dense resampling of fitted polynomials, the number of worker
 * threads used in sensorgram calculation and the step used for numerical derivatives in fitting.
 */
public class Configuration {

  private static Configuration instance;

  static final String DEFAULT_CONFIG_PATH = "spr-analysis-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private AngleRange liquidTIRWindow = new AngleRange(60.8, 63.);
  private AngleRange airTIRWindow = new AngleRange(40.9, 41.8);
  private int liquidScanThreshold = 50;

  private int sprPointsBelow = 70;
  private int sprPointsAbove = 70;
  private int sprDensePoints = 4000;
  private int tirDensePoints = 4000;

  // non-positive means one thread per available processor
  private int workerThreadsSetting = -1;
  private int workerThreads = Runtime.getRuntime().availableProcessors();
  private double derivativeStep = 1E-7;

  Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      liquidTIRWindow = readWindow(config, "TIRWindows.Liquid", liquidTIRWindow);
      airTIRWindow = readWindow(config, "TIRWindows.Air", airTIRWindow);
      liquidScanThreshold =
          config.getInt("TIRWindows.LiquidScanThreshold", liquidScanThreshold);

      sprPointsBelow = config.getInt("Resonance.PointsBelow", sprPointsBelow);
      sprPointsAbove = config.getInt("Resonance.PointsAbove", sprPointsAbove);
      sprDensePoints = config.getInt("Resonance.DensePoints", sprDensePoints);
      tirDensePoints = config.getInt("CriticalAngle.DensePoints", tirDensePoints);

      workerThreadsSetting = config.getInt("Processing.WorkerThreads", workerThreadsSetting);
      if (workerThreadsSetting > 0) {
        workerThreads = workerThreadsSetting;
      }
      derivativeStep = config.getDouble("Fitting.DerivativeStep", derivativeStep);

      try {
        loadedConfigPath = config.getFile().getCanonicalPath();
        logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
      } catch (IOException e) {
        logger.warn("Could not resolve path of loaded configuration " + configLocation, e);
        loadedConfigPath = configLocation;
      }
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  private static AngleRange readWindow(XMLConfiguration config, String key,
      AngleRange defaultWindow) {
    double lower = config.getDouble(key + ".Lower", defaultWindow.getLower());
    double upper = config.getDouble(key + ".Upper", defaultWindow.getUpper());
    try {
      return new AngleRange(lower, upper);
    } catch (IllegalArgumentException e) {
      logger.error("Invalid window " + key + " in configuration, using default "
          + defaultWindow, e);
      return defaultWindow;
    }
  }

  private static boolean copyEmbedXML(String pathToPlaceFile) {
    File fileOut = new File(pathToPlaceFile);
    try (InputStream stream =
        Configuration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (stream == null) {
        logger.error("Major error: config XML file not part of resources!!");
        return false;
      }
      try {
        logger.info("Copying over embedded jar file to absolute path " + fileOut.getAbsolutePath());
        Files.copy(stream, fileOut.toPath());
        return true;
      } catch (IOException e) {
        logger.warn("Could not copy over the file...", e);
      }
    } catch (IOException e) {
      logger.error("Could not close embedded config XML resource", e);
    }
    return false;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists.
   * @param configLocation New configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      File config = new File(configLocation);
      if (!config.exists()) {
        boolean success = copyEmbedXML(configLocation);
        if (!success) {
          logger.warn("Could not find or write to specified config location: " + configLocation);
          logger.warn("Will attempt to initialize config file at user home directory.");
          configLocation = System.getProperty("user.home") + File.separator + DEFAULT_CONFIG_PATH;
          config = new File(configLocation);
          if (!config.exists()) {
            success = copyEmbedXML(configLocation);
            if (!success) {
              logger.warn("Could not find or write to user home directory either!");
            }
          }
        }
      }
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  /**
   * Get the TIR search window to use for a measurement. Measurements with many scans are long
   * kinetic runs in liquid and use the higher-angle liquid window, short measurements are taken
   * as dry scans in air.
   *
   * The threshold is defined from Configuration.TIRWindows.LiquidScanThreshold
   * @param scanCount Number of scans in the measurement
   * @return Window in which the TIR edge is searched for
   */
  public AngleRange getTIRWindowForScanCount(int scanCount) {
    if (scanCount >= liquidScanThreshold) {
      return liquidTIRWindow;
    }
    return airTIRWindow;
  }

  /**
   * The property is defined from Configuration.TIRWindows.Liquid
   * @return TIR search window for measurements in liquid
   */
  public AngleRange getLiquidTIRWindow() {
    return liquidTIRWindow;
  }

  public void setLiquidTIRWindow(AngleRange replacement) {
    liquidTIRWindow = replacement;
  }

  /**
   * The property is defined from Configuration.TIRWindows.Air
   * @return TIR search window for dry measurements
   */
  public AngleRange getAirTIRWindow() {
    return airTIRWindow;
  }

  public void setAirTIRWindow(AngleRange replacement) {
    airTIRWindow = replacement;
  }

  public int getLiquidScanThreshold() {
    return liquidScanThreshold;
  }

  public void setLiquidScanThreshold(int replacement) {
    liquidScanThreshold = replacement;
  }

  /**
   * Number of samples below the intensity minimum included in the resonance polynomial fit.
   *
   * The property is defined from Configuration.Resonance.PointsBelow
   * @return Neighborhood size below the minimum
   */
  public int getSPRPointsBelow() {
    return sprPointsBelow;
  }

  /**
   * Number of samples above the intensity minimum included in the resonance polynomial fit.
   *
   * The property is defined from Configuration.Resonance.PointsAbove
   * @return Neighborhood size above the minimum
   */
  public int getSPRPointsAbove() {
    return sprPointsAbove;
  }

  public void setSPRNeighborhood(int pointsBelow, int pointsAbove) {
    sprPointsBelow = pointsBelow;
    sprPointsAbove = pointsAbove;
  }

  public int getSPRDensePoints() {
    return sprDensePoints;
  }

  public int getTIRDensePoints() {
    return tirDensePoints;
  }

  /**
   * Number of threads used when processing the scans of a measurement. If not set in the
   * configuration file it defaults to the number of available processors.
   *
   * The property is defined from Configuration.Processing.WorkerThreads
   * @return Worker thread count
   */
  public int getWorkerThreads() {
    return workerThreads;
  }

  /**
   * Set the worker thread count. A non-positive value leaves the count unchanged.
   *
   * @param replacement New worker thread count
   */
  public void setWorkerThreads(int replacement) {
    if (replacement > 0) {
      workerThreadsSetting = replacement;
      workerThreads = replacement;
    }
  }

  /**
   * Step used in the forward-difference derivative of the fit residuals.
   *
   * The property is defined from Configuration.Fitting.DerivativeStep
   * @return derivative step, in units of the fitted parameter
   */
  public double getDerivativeStep() {
    return derivativeStep;
  }

  /**
   * @return Path of the configuration file values were read from
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Writes out the current configuration to file.
   */
  public void saveCurrentConfig() {
    XMLConfiguration config;
    try {
      config = new XMLConfiguration(loadedConfigPath);

      config.setProperty("TIRWindows.Liquid.Lower", liquidTIRWindow.getLower());
      config.setProperty("TIRWindows.Liquid.Upper", liquidTIRWindow.getUpper());
      config.setProperty("TIRWindows.Air.Lower", airTIRWindow.getLower());
      config.setProperty("TIRWindows.Air.Upper", airTIRWindow.getUpper());
      config.setProperty("TIRWindows.LiquidScanThreshold", liquidScanThreshold);
      config.setProperty("Resonance.PointsBelow", sprPointsBelow);
      config.setProperty("Resonance.PointsAbove", sprPointsAbove);
      config.setProperty("Resonance.DensePoints", sprDensePoints);
      config.setProperty("CriticalAngle.DensePoints", tirDensePoints);
      config.setProperty("Processing.WorkerThreads", workerThreadsSetting);
      config.setProperty("Fitting.DerivativeStep", derivativeStep);

      config.save();
    } catch (ConfigurationException e) {
      logger.error("Could not save configuration to " + loadedConfigPath, e);
    }
  }

}
