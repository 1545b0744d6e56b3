package asl.wavecal.align;

import asl.wavecal.input.LineList;
import asl.wavecal.input.ObservedSpectrum;

/**
 * Alignment whose offset is supplied from outside the engine, e.g. picked interactively by a user
 * comparing the reference and observed spectra, or taken from the configuration.
 */
public class FixedOffsetAlignment implements AlignmentStrategy {

  private final AlignmentOffset offset;

  public FixedOffsetAlignment(int orderShift, int pixelShift) {
    this(new AlignmentOffset(orderShift, pixelShift));
  }

  public FixedOffsetAlignment(AlignmentOffset offset) {
    this.offset = offset;
  }

  @Override
  public AlignmentOffset align(ObservedSpectrum observed, LineList lines) {
    return offset;
  }

}
