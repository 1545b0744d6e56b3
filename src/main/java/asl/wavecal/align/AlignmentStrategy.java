package asl.wavecal.align;

import asl.wavecal.input.LineList;
import asl.wavecal.input.ObservedSpectrum;

/**
 * Determines how a reference line list must be shifted to line up with an observed spectrum.
 * The calibration loop only consumes the returned offset, so it does not care whether the offset
 * came from cross-correlation or was chosen by a person.
 */
public interface AlignmentStrategy {

  /**
   * Find the offset to apply to the reference lines. Implementations must not modify the lines.
   *
   * @param observed Normalized observed spectrum
   * @param lines Reference lines in their catalogue positions
   * @return Offset to apply with {@link LineList#applyOffset(AlignmentOffset)}
   */
  AlignmentOffset align(ObservedSpectrum observed, LineList lines);

}
