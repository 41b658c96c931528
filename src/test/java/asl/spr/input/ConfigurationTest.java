package asl.spr.input;

import static org.junit.Assert.assertEquals;

import asl.spr.test.TestUtils;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.apache.commons.configuration.XMLConfiguration;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ConfigurationTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void readsValuesFromFile() {
    Configuration config = new Configuration(TestUtils.TEST_CONFIG_LOCATION);
    assertEquals(new AngleRange(61.0, 62.5), config.getLiquidTIRWindow());
    assertEquals(new AngleRange(40.5, 42.0), config.getAirTIRWindow());
    assertEquals(20, config.getLiquidScanThreshold());
    assertEquals(40, config.getSPRPointsBelow());
    assertEquals(50, config.getSPRPointsAbove());
    assertEquals(3, config.getWorkerThreads());
  }

  @Test
  public void missingKeysKeepDefaults() {
    Configuration config = new Configuration(TestUtils.TEST_CONFIG_LOCATION);
    assertEquals(4000, config.getSPRDensePoints());
    assertEquals(4000, config.getTIRDensePoints());
    assertEquals(1E-7, config.getDerivativeStep(), 0.);
  }

  @Test
  public void unreadableFileUsesDefaults() {
    Configuration config = new Configuration("src/test/resources/no-such-config.xml");
    assertEquals(new AngleRange(60.8, 63.), config.getLiquidTIRWindow());
    assertEquals(new AngleRange(40.9, 41.8), config.getAirTIRWindow());
    assertEquals(50, config.getLiquidScanThreshold());
    assertEquals(70, config.getSPRPointsBelow());
    assertEquals(70, config.getSPRPointsAbove());
  }

  @Test
  public void windowChosenByScanCount() {
    Configuration config = new Configuration("src/test/resources/no-such-config.xml");
    assertEquals(config.getLiquidTIRWindow(), config.getTIRWindowForScanCount(50));
    assertEquals(config.getLiquidTIRWindow(), config.getTIRWindowForScanCount(500));
    assertEquals(config.getAirTIRWindow(), config.getTIRWindowForScanCount(49));
    assertEquals(config.getAirTIRWindow(), config.getTIRWindowForScanCount(1));
  }

  @Test
  public void settersChangeValues() {
    Configuration config = new Configuration(TestUtils.TEST_CONFIG_LOCATION);
    config.setLiquidScanThreshold(5);
    config.setSPRNeighborhood(10, 12);
    config.setWorkerThreads(0);
    assertEquals(config.getLiquidTIRWindow(), config.getTIRWindowForScanCount(5));
    assertEquals(10, config.getSPRPointsBelow());
    assertEquals(12, config.getSPRPointsAbove());
    assertEquals(3, config.getWorkerThreads());
  }

  @Test
  public void savedValuesAreReadBack() throws Exception {
    File copy = new File(folder.getRoot(), "saved-config.xml");
    Files.copy(Paths.get(TestUtils.TEST_CONFIG_LOCATION), copy.toPath());

    Configuration config = new Configuration(copy.getPath());
    config.setAirTIRWindow(new AngleRange(40.7, 41.9));
    config.setSPRNeighborhood(25, 35);
    config.saveCurrentConfig();

    Configuration reloaded = new Configuration(copy.getPath());
    assertEquals(new AngleRange(40.7, 41.9), reloaded.getAirTIRWindow());
    assertEquals(25, reloaded.getSPRPointsBelow());
    assertEquals(35, reloaded.getSPRPointsAbove());
    assertEquals(20, reloaded.getLiquidScanThreshold());
  }

  @Test
  public void automaticThreadCountKeptOnSave() throws Exception {
    File copy = new File(folder.getRoot(), "auto-threads-config.xml");
    Files.copy(Paths.get("src/main/resources/spr-analysis-config.xml"), copy.toPath());

    Configuration config = new Configuration(copy.getPath());
    assertEquals(Runtime.getRuntime().availableProcessors(), config.getWorkerThreads());
    config.setLiquidScanThreshold(30);
    config.saveCurrentConfig();

    XMLConfiguration saved = new XMLConfiguration(copy);
    assertEquals(-1, saved.getInt("Processing.WorkerThreads"));
    assertEquals(30, saved.getInt("TIRWindows.LiquidScanThreshold"));
  }

  @Test
  public void explicitThreadCountSaved() throws Exception {
    File copy = new File(folder.getRoot(), "fixed-threads-config.xml");
    Files.copy(Paths.get("src/main/resources/spr-analysis-config.xml"), copy.toPath());

    Configuration config = new Configuration(copy.getPath());
    config.setWorkerThreads(6);
    config.saveCurrentConfig();

    assertEquals(6, new Configuration(copy.getPath()).getWorkerThreads());
  }
}
