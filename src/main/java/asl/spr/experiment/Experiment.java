package asl.spr.experiment;

import asl.spr.exception.AnalysisException;
import asl.spr.input.ScanSequence;
import asl.spr.utils.NumericUtils;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * This class defines template patterns for each type of SPR analysis (we use the term
 * "experiment" in the code to match the naming of the measurement workflow). Concrete extensions
 * of this class define a backend for the calculations, producing data to be passed into a class
 * that does plotting.
 *
 * Experiments work in a manner similar to builder patterns: experiments that rely on variables
 * to determine how their calculations are run, such as the fit experiment using a stack and fit
 * configuration or the sensorgram experiment using a TIR window, have these set first, and then
 * "runExperimentOnData" is called with a given ScanSequence holding the measurement.
 *
 * Some experiment implementations produce not only XY series data to be plotted but also
 * additional results, such as a fitted value or the number of scans where an angle was not found.
 * These should not be called unless the experiment has already been run, as they will otherwise
 * not be populated with valid results.
 *
 * @author akearns - KBRWyle
 */
public abstract class Experiment {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        NumericUtils.setInfinityPrintable(format);
        return format;
      });

  private final EventListenerList eventHelper;
  List<XYSeriesCollection> xySeriesData;
  /**
   * Names of the measurements used in the experiment, used in report metadata
   */
  List<String> dataNames;
  private String status;

  /**
   * Initialize all fields common to experiment objects
   */
  Experiment() {
    dataNames = new ArrayList<>();
    status = "";
    eventHelper = new EventListenerList();
  }

  /**
   * Helper function to put an angle / value curve into a plottable series
   *
   * @param name Name of the series (shown in plot legends)
   * @param x X-axis values (angles or times)
   * @param y Y-axis values; entries that are NaN are left out of the series
   * @return Series holding the defined points of the curve
   */
  static XYSeries toSeries(String name, double[] x, double[] y) {
    XYSeries series = new XYSeries(name);
    for (int i = 0; i < x.length; ++i) {
      if (Double.isNaN(y[i])) {
        continue;
      }
      series.add(x[i], y[i]);
    }
    return series;
  }

  /**
   * Stub method to be overridden for other methods to produce String data for experiment result.
   * Includes formatting of numeric data. This may not be used for all experiments.
   * @return String containing human-readable data
   */
  String[] getDataStrings() {
    return new String[]{""};
  }

  /**
   * Stub method to be overridden for other methods to produce String data for reports.
   * Includes formatting of numeric data. This may not be used for all plots.
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      sb.append(strings[i]);
      // add space between inset strings
      if (i + 1 < strings.length) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * Add an object to the list of objects to be notified when the experiment's
   * status changes
   *
   * @param listener ChangeListener to be notified (i.e., parent panel)
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Abstract function that runs the calculations specific to a given procedure,
   * overwritten by concrete experiments with specific operations.
   *
   * @param sequence Measurement to process
   * @throws AnalysisException if the analysis cannot produce a result for the measurement
   * @throws InterruptedException if the calculation was interrupted
   */
  protected abstract void backend(final ScanSequence sequence)
      throws AnalysisException, InterruptedException;

  /**
   * Update processing status and notify listeners of change
   * (Used to show messages displaying the progress of the function on the GUI)
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Return the plottable data for this experiment, populated in the backend
   * function of an implementing class. The results are returned as a list, where each list is the
   * data to be placed into a separate chart.
   *
   * @return Plottable data (null if the experiment has not been run)
   */
  public List<XYSeriesCollection> getData() {
    return xySeriesData;
  }

  /**
   * Get the names of data sent into the experiment (set during backend calculations),
   * mainly used in report metadata generation
   *
   * @return Names of measurements used
   */
  public List<String> getInputNames() {
    return dataNames;
  }

  /**
   * Return newest status message produced by this program
   *
   * @return String representing status of program
   */
  public String getStatus() {
    return status;
  }

  /**
   * Used to check if the measurement has enough data to do the calculation.
   *
   * @param sequence Measurement to be fed into experiment calculation
   * @return True if there is enough data to be run
   */
  public abstract boolean hasEnoughData(final ScanSequence sequence);

  /**
   * Driver to do data processing on a measurement (calls a concrete backend
   * method which is different for each type of experiment)
   *
   * @param sequence Measurement to be processed
   * @throws AnalysisException if the analysis cannot produce a result for the measurement
   * @throws InterruptedException if the calculation was interrupted
   */
  public void runExperimentOnData(final ScanSequence sequence)
      throws AnalysisException, InterruptedException {

    fireStateChange("Beginning loading data...");

    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();

    if (!hasEnoughData(sequence)) {
      throw new IllegalArgumentException("Measurement does not have enough data for "
          + getClass().getSimpleName());
    }

    dataNames.add(sequence.getName());

    fireStateChange("Beginning calculations...");

    backend(sequence);

    fireStateChange("Calculations done!");
  }
}
