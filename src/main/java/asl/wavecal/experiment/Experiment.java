package asl.wavecal.experiment;

import asl.wavecal.input.DataStore;
import asl.wavecal.utils.NumericUtils;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * This class defines template patterns for each calibration procedure (we use the term
 * "experiment" in the code, since each procedure takes in observed data and produces a fit model
 * plus diagnostic data from it). Concrete extensions of this class define a backend for the
 * calculation; callers set any options on the experiment first and then call
 * "runExperimentOnData" with a DataStore holding the relevant inputs.
 *
 * Besides their main result, experiments produce XY series data describing the quality of the
 * fit (e.g., residuals of each line) and summary strings for reports. These are only populated
 * once the experiment has been run. Progress of a run is published as status messages to any
 * registered ChangeListener, which is also the hook for observing intermediate results.
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
   * Descriptions of the inputs used by the experiment, for report metadata
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
   * Stub method to be overridden for other methods to produce String data for experiment result.
   * Includes formatting of numeric data. This may not be used for all experiments.
   * @return String containing human-readable data
   */
  String[] getDataStrings() {
    return new String[]{""};
  }

  /**
   * Produce a human-readable summary of the experiment result, one entry of getDataStrings per
   * line
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      sb.append(strings[i]);
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
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Abstract function that runs the calculations specific to a given procedure,
   * overwritten by concrete experiments with specific operations.
   *
   * @param dataStore Object containing the inputs to process
   */
  protected abstract void backend(final DataStore dataStore);

  /**
   * Update processing status and notify listeners of change
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
   * Return the diagnostic data for this experiment, populated in the backend
   * function of an implementing class. The results are returned as a list, where each entry is
   * the data of a separate chart.
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
   * @return Names of inputs
   */
  public List<String> getInputNames() {
    return dataNames;
  }

  /**
   * Return newest status message produced by this experiment
   *
   * @return String representing status of the calculation
   */
  public String getStatus() {
    return status;
  }

  /**
   * Used to check if the current input has enough data to do the calculation.
   *
   * @param dataStore DataStore to be fed into experiment calculation
   * @return True if there is enough data to be run
   */
  public abstract boolean hasEnoughData(final DataStore dataStore);

  /**
   * Driver to do data processing on inputted data (calls a concrete backend
   * method which is different for each type of experiment)
   *
   * @param dataStore Inputs to be processed
   * @throws IllegalStateException if the store lacks inputs the experiment needs
   */
  public void runExperimentOnData(final DataStore dataStore) {

    fireStateChange("Beginning loading data...");

    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();

    if (!hasEnoughData(dataStore)) {
      throw new IllegalStateException(
          "Not enough data loaded to run " + getClass().getSimpleName());
    }

    fireStateChange("Beginning calculations...");

    backend(dataStore);

    fireStateChange("Calculations done!");
  }
}
