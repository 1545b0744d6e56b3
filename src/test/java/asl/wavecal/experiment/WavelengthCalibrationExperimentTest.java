package asl.wavecal.experiment;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import asl.wavecal.align.AlignmentOffset;
import asl.wavecal.align.FixedOffsetAlignment;
import asl.wavecal.input.Configuration;
import asl.wavecal.input.DataStore;
import asl.wavecal.input.LineList;
import asl.wavecal.input.ObservedSpectrum;
import asl.wavecal.input.ReferenceLine;
import asl.wavecal.output.CalResult;
import asl.wavecal.solution.InsufficientLinesException;
import asl.wavecal.solution.SolutionMode;
import asl.wavecal.solution.SurfacePolynomialSolution;
import asl.wavecal.test.TestUtils;
import asl.wavecal.utils.NumericUtils;
import org.junit.Before;
import org.junit.Test;

public class WavelengthCalibrationExperimentTest {

  private Configuration config;
  private ObservedSpectrum arc;

  @Before
  public void setUp() {
    config = new Configuration();
    config.setDegreeX(2);
    config.setDegreeY(1);
    arc = TestUtils.createArcSpectrum(TestUtils.createCatalogue(false));
  }

  private static void assertMatchesTruth(double[][] wave, double tolerance) {
    double[][] truth = TestUtils.arcWavelengthImage();
    assertEquals(truth.length, wave.length);
    for (int i = 0; i < truth.length; ++i) {
      assertEquals(truth[i].length, wave[i].length);
      for (int j = 0; j < truth[i].length; ++j) {
        assertEquals(truth[i][j], wave[i][j], tolerance);
      }
    }
  }

  private static void assertOutliersRejected(LineList lines) {
    for (int i = 0; i < lines.size(); ++i) {
      int order = i / TestUtils.LINES_PER_ORDER;
      int k = i % TestUtils.LINES_PER_ORDER;
      if (TestUtils.isOutlier(order, k)) {
        assertFalse("Outlier " + i + " still in use", lines.get(i).isFlagged());
      }
    }
  }

  @Test
  public void execute_recoversWavelengthImageAndRejectsOutliers() {
    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    double[][] wave = experiment.execute(arc, TestUtils.createCatalogue(true));

    assertMatchesTruth(wave, 1E-3);
    LineList lines = experiment.getLines();
    assertOutliersRejected(lines);
    assertTrue(lines.countFlagged() >= 40);
    assertEquals(0, experiment.getAlignmentOffset().getOrderShift());
    assertEquals(0, experiment.getAlignmentOffset().getPixelShift());
    assertTrue(Double.isFinite(experiment.getScore().getAIC()));
    assertEquals(lines.countFlagged(), experiment.getScore().getPoints());
  }

  @Test
  public void execute_perturbedGuesses_rejectsOnlyOutliersAndRecoversPolynomial() {
    LineList catalogue = TestUtils.createCatalogue(true);
    // about 5% of the guesses off by half a pixel
    int[] perturbed = {1, 17, 33};
    double[] shifts = {0.5, -0.5, 0.5};
    for (int n = 0; n < perturbed.length; ++n) {
      ReferenceLine line = catalogue.get(perturbed[n]);
      line.setPosition(line.getPosition() + shifts[n]);
    }

    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    experiment.execute(arc, catalogue);

    LineList lines = experiment.getLines();
    for (int i = 0; i < lines.size(); ++i) {
      int order = i / TestUtils.LINES_PER_ORDER;
      int k = i % TestUtils.LINES_PER_ORDER;
      assertEquals("Line " + i, !TestUtils.isOutlier(order, k), lines.get(i).isFlagged());
    }
    assertEquals(lines.size() - TestUtils.OUTLIERS.length, lines.countFlagged());

    // wavelength = 5000 + 10 * order + 0.05 * x + 1E-6 * x^2
    double[][] coeffs = ((SurfacePolynomialSolution) experiment.getSolution()).getCoefficients();
    assertEquals(5000., coeffs[0][0], 1E-3);
    assertEquals(10., coeffs[0][1], 1E-4);
    assertEquals(0.05, coeffs[1][0], 1E-5);
    assertEquals(0., coeffs[1][1], 1E-6);
    assertEquals(1E-6, coeffs[2][0], 1E-8);
    assertEquals(0., coeffs[2][1], 1E-9);
  }

  @Test
  public void rejectLines_afterConvergence_changesNothing() {
    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    experiment.execute(arc, TestUtils.createCatalogue(true));
    LineList lines = experiment.getLines();
    boolean[] flags = lines.getFlags();

    assertEquals(0, experiment.rejectLines(lines));
    assertArrayEquals(flags, lines.getFlags());
  }

  @Test
  public void execute_flaggedResidualsWithinThreshold() {
    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    experiment.execute(arc, TestUtils.createCatalogue(true));

    double[] residual = CalibrationExperiment.calculateResidual(
        experiment.getSolution(), experiment.getLines());
    for (int i = 0; i < residual.length; ++i) {
      if (experiment.getLines().get(i).isFlagged()) {
        assertTrue(Math.abs(residual[i]) <= config.getThreshold());
      } else {
        assertTrue(Double.isNaN(residual[i]));
      }
    }
  }

  @Test
  public void execute_isRepeatableAndLeavesCatalogueUntouched() {
    LineList catalogue = TestUtils.createCatalogue(true);
    double[] positions = catalogue.getPositions();

    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    double[][] first = experiment.execute(arc, catalogue);
    double[][] second = experiment.execute(arc, catalogue);
    double[][] third = new WavelengthCalibrationExperiment(config).execute(arc, catalogue);

    for (int i = 0; i < first.length; ++i) {
      assertArrayEquals(first[i], second[i], 0.);
      assertArrayEquals(first[i], third[i], 0.);
    }
    assertArrayEquals(positions, catalogue.getPositions(), 0.);
    assertEquals(catalogue.size(), catalogue.countFlagged());
  }

  @Test
  public void execute_alignsShiftedCatalogue() {
    LineList catalogue = TestUtils.createCatalogue(true);
    catalogue.applyOffset(new AlignmentOffset(1, 7));

    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    double[][] wave = experiment.execute(arc, catalogue);

    assertEquals(-1, experiment.getAlignmentOffset().getOrderShift());
    assertEquals(-7, experiment.getAlignmentOffset().getPixelShift());
    assertMatchesTruth(wave, 1E-3);
  }

  @Test
  public void execute_manualAlignmentUsesConfiguredOffset() {
    LineList catalogue = TestUtils.createCatalogue(true);
    catalogue.applyOffset(new AlignmentOffset(1, 7));
    config.setManualAlignment(true);
    config.setOrderOffset(-1);
    config.setPixelOffset(-7);

    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    assertTrue(experiment.getEffectiveAlignmentStrategy() instanceof FixedOffsetAlignment);
    double[][] wave = experiment.execute(arc, catalogue);
    assertMatchesTruth(wave, 1E-3);
  }

  @Test
  public void execute_explicitStrategyOverridesConfiguration() {
    LineList catalogue = TestUtils.createCatalogue(false);
    catalogue.applyOffset(new AlignmentOffset(0, 4));

    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    experiment.setAlignmentStrategy(new FixedOffsetAlignment(0, -4));
    experiment.execute(arc, catalogue);
    assertEquals(-4, experiment.getAlignmentOffset().getPixelShift());
  }

  @Test
  public void execute_oneDimensionalMode() {
    config.setMode(SolutionMode.ONE_D);
    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    double[][] wave = experiment.execute(arc, TestUtils.createCatalogue(true));
    assertMatchesTruth(wave, 1E-3);
    assertOutliersRejected(experiment.getLines());
  }

  @Test(expected = InsufficientLinesException.class)
  public void execute_tooFewLinesForDegree_throwsException() {
    LineList catalogue = TestUtils.createCatalogue(false);
    LineList few = new LineList();
    for (int i = 0; i < 20; ++i) {
      few.add(catalogue.get(i));
    }
    new WavelengthCalibrationExperiment(new Configuration()).execute(arc, few);
  }

  @Test
  public void autoId_onlyAcceptsLinesWithinThreshold() {
    config.setThreshold(2000.);
    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    ObservedSpectrum normalized = arc.normalize();
    double[][] wave = TestUtils.arcWavelengthImage();
    LineList lines = TestUtils.createCatalogue(true);
    lines.setAllFlags(false);

    int found = experiment.autoId(normalized, wave, lines);

    assertEquals(TestUtils.ORDERS * TestUtils.LINES_PER_ORDER - TestUtils.OUTLIERS.length, found);
    assertEquals(found, lines.countFlagged());
    assertOutliersRejected(lines);
    for (ReferenceLine line : lines) {
      if (line.isFlagged()) {
        double predicted = wave[line.getOrder()][(int) line.getPosition()];
        double residual =
            Math.abs(NumericUtils.velocityResidual(predicted, line.getWavelength()));
        assertTrue(residual < config.getThreshold());
      }
    }
  }

  @Test
  public void autoId_tightThreshold_findsNothingOffPixelCenters() {
    config.setThreshold(100.);
    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    LineList lines = TestUtils.createCatalogue(false);
    lines.setAllFlags(false);
    // line centers sit 0.2 to 0.4 pixels off the peak sample, well above 100 m/s
    assertEquals(0, experiment.autoId(arc.normalize(), TestUtils.arcWavelengthImage(), lines));
  }

  @Test
  public void fitLines_unflagsLinesOffTheDetector() {
    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    LineList lines = new LineList();
    lines.add(new ReferenceLine(5000., TestUtils.linePosition(0, 1) + 1., 0, 2., 1.));
    lines.add(new ReferenceLine(5000., 1200., 0, 2., 1.));
    lines.add(new ReferenceLine(5000., 100., 7, 2., 1.));
    lines.add(new ReferenceLine(5000., 478., 0, 2., 1.));

    experiment.fitLines(arc.normalize(), lines);
    assertTrue(lines.get(0).isFlagged());
    assertEquals(TestUtils.linePosition(0, 1), lines.get(0).getPosition(), 1E-3);
    assertFalse(lines.get(1).isFlagged());
    assertFalse(lines.get(2).isFlagged());
    // nothing but masked background between two lines
    assertFalse(lines.get(3).isFlagged());
  }

  @Test
  public void rejectOutlier_unflagsLargestAbsoluteResidual() {
    LineList lines = new LineList();
    for (int i = 0; i < 4; ++i) {
      lines.add(new ReferenceLine(5000. + i, 10. * i, 0, 1., 1.));
    }
    lines.get(0).setFlagged(false);
    double[] residual = {Double.NaN, 5., -20., 3.};
    assertEquals(2, WavelengthCalibrationExperiment.rejectOutlier(residual, lines));
    assertFalse(lines.get(2).isFlagged());
    assertEquals(2, lines.countFlagged());

    double[] none = {Double.NaN, Double.NaN, Double.NaN, Double.NaN};
    assertEquals(-1, WavelengthCalibrationExperiment.rejectOutlier(none, lines));
  }

  @Test
  public void rejectLines_removesEveryOutlier() {
    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    experiment.setDetectorShape(TestUtils.ORDERS, TestUtils.COLUMNS);
    LineList lines = TestUtils.createCatalogue(true);

    int discarded = experiment.rejectLines(lines);
    assertEquals(TestUtils.OUTLIERS.length, discarded);
    assertOutliersRejected(lines);
    double[] residual = CalibrationExperiment.calculateResidual(experiment.getSolution(), lines);
    for (double value : residual) {
      assertTrue(Double.isNaN(value) || Math.abs(value) <= config.getThreshold());
    }
  }

  @Test
  public void runExperimentOnData_fillsDiagnosticsAndResult() {
    DataStore ds = new DataStore(arc, TestUtils.createCatalogue(true));
    WavelengthCalibrationExperiment experiment = new WavelengthCalibrationExperiment(config);
    experiment.runExperimentOnData(ds);

    assertEquals(2, experiment.getData().size());
    assertEquals(2, experiment.getData().get(0).getSeriesCount());
    assertEquals(TestUtils.ORDERS, experiment.getData().get(1).getSeriesCount());
    assertEquals(2, experiment.getInputNames().size());
    assertEquals("Calculations done!", experiment.getStatus());

    CalResult result = experiment.getResult();
    assertEquals(experiment.getLines().countFlagged(),
        result.getNumerMap().get("Lines_used")[0], 0.);
    assertEquals(50., result.getNumerMap().get("Lines_total")[0], 0.);
    assertTrue(experiment.getReportString().contains("Lines used"));
  }

  @Test(expected = IllegalStateException.class)
  public void runExperimentOnData_missingLines_throwsException() {
    DataStore ds = new DataStore();
    ds.setArcSpectrum(arc);
    new WavelengthCalibrationExperiment(config).runExperimentOnData(ds);
  }
}
