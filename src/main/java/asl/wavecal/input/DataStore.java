package asl.wavecal.input;

/**
 * Holds the inputs handed to a calibration experiment: the observed arc (line lamp) spectrum and
 * its reference line list for the wavelength calibration, and the frequency comb spectrum plus
 * the wavelength image it refines for the comb calibration. Not every experiment needs every
 * input; see each experiment's hasEnoughData.
 */
public class DataStore {

  private ObservedSpectrum arcSpectrum;
  private LineList referenceLines;
  private ObservedSpectrum combSpectrum;
  private double[][] wavelengthImage;

  public DataStore() {
    arcSpectrum = null;
    referenceLines = null;
    combSpectrum = null;
    wavelengthImage = null;
  }

  /**
   * Create a store holding the inputs of a wavelength calibration
   *
   * @param arcSpectrum Observed calibration lamp spectrum
   * @param referenceLines Reference line catalogue
   */
  public DataStore(ObservedSpectrum arcSpectrum, LineList referenceLines) {
    this();
    setArcSpectrum(arcSpectrum);
    setReferenceLines(referenceLines);
  }

  public ObservedSpectrum getArcSpectrum() {
    return arcSpectrum;
  }

  public void setArcSpectrum(ObservedSpectrum arcSpectrum) {
    this.arcSpectrum = arcSpectrum;
  }

  public boolean arcSpectrumIsSet() {
    return arcSpectrum != null;
  }

  /**
   * @return Reference line list as given by the caller (experiments work on a copy)
   */
  public LineList getReferenceLines() {
    return referenceLines;
  }

  public void setReferenceLines(LineList referenceLines) {
    this.referenceLines = referenceLines;
  }

  public boolean referenceLinesAreSet() {
    return referenceLines != null && !referenceLines.isEmpty();
  }

  public ObservedSpectrum getCombSpectrum() {
    return combSpectrum;
  }

  public void setCombSpectrum(ObservedSpectrum combSpectrum) {
    this.combSpectrum = combSpectrum;
  }

  public boolean combSpectrumIsSet() {
    return combSpectrum != null;
  }

  /**
   * @return Wavelength of every (order, column) from a previous calibration
   */
  public double[][] getWavelengthImage() {
    return wavelengthImage;
  }

  public void setWavelengthImage(double[][] wavelengthImage) {
    this.wavelengthImage = wavelengthImage;
  }

  public boolean wavelengthImageIsSet() {
    return wavelengthImage != null;
  }
}
