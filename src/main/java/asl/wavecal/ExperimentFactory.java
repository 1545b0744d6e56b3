package asl.wavecal;

import asl.wavecal.experiment.CalibrationExperiment;
import asl.wavecal.experiment.FrequencyCombExperiment;
import asl.wavecal.experiment.WavelengthCalibrationExperiment;
import asl.wavecal.input.Configuration;

/**
 * Enumerated type defining each kind of calibration, so callers have a list of all procedures
 * available and can create the associated Experiment class.
 *
 * If adding a new procedure, make sure to also create a new extension of CalibrationExperiment.
 */
public enum ExperimentFactory {

  WAVECAL("Wavelength calibration") {
    @Override
    public CalibrationExperiment createExperiment(Configuration config) {
      return new WavelengthCalibrationExperiment(config);
    }
  },
  FREQCOMB("Frequency comb calibration") {
    @Override
    public CalibrationExperiment createExperiment(Configuration config) {
      return new FrequencyCombExperiment(config);
    }
  };

  private final String name;

  ExperimentFactory(String name) {
    this.name = name;
  }

  /**
   * Creates the associated Experiment for the enum, using the default configuration
   *
   * @return new Experiment
   */
  public CalibrationExperiment createExperiment() {
    return createExperiment(new Configuration());
  }

  /**
   * Creates the associated Experiment for the enum
   *
   * @param config Run parameters
   * @return new Experiment
   */
  public abstract CalibrationExperiment createExperiment(Configuration config);

  /**
   * Get the full name of this procedure (used for report titles)
   *
   * @return Name of experiment, as String
   */
  public String getName() {
    return name;
  }

}
