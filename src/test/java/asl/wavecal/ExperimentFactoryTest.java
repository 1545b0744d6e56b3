package asl.wavecal;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

import asl.wavecal.experiment.CalibrationExperiment;
import asl.wavecal.experiment.FrequencyCombExperiment;
import asl.wavecal.experiment.WavelengthCalibrationExperiment;
import asl.wavecal.input.Configuration;
import asl.wavecal.solution.SolutionMode;
import org.junit.Test;

/**
 * These tests verify that each enum matches its expected class for createExperiment().
 */
public class ExperimentFactoryTest {

  @Test
  public void wavecal_createExperiment() {
    assertThat(ExperimentFactory.WAVECAL.createExperiment(),
        instanceOf(WavelengthCalibrationExperiment.class));
  }

  @Test
  public void freqcomb_createExperiment() {
    assertThat(ExperimentFactory.FREQCOMB.createExperiment(),
        instanceOf(FrequencyCombExperiment.class));
  }

  @Test
  public void createExperiment_defaultLoadsEmbeddedConfiguration() {
    for (ExperimentFactory factory : ExperimentFactory.values()) {
      CalibrationExperiment experiment = factory.createExperiment();
      Configuration config = experiment.getConfiguration();
      assertEquals(Configuration.DEFAULT_CONFIG_PATH, config.getLoadedConfigPath());
      assertEquals(SolutionMode.TWO_D, config.getMode());
      assertEquals(3, config.getIterations());
    }
  }

  @Test
  public void createExperiment_usesGivenConfiguration() {
    Configuration config = new Configuration();
    config.setMode(SolutionMode.ONE_D);
    CalibrationExperiment experiment = ExperimentFactory.WAVECAL.createExperiment(config);
    assertEquals(SolutionMode.ONE_D, experiment.getConfiguration().getMode());
  }

  @Test
  public void getName_isHumanReadable() {
    assertEquals("Frequency comb calibration", ExperimentFactory.FREQCOMB.getName());
  }
}
