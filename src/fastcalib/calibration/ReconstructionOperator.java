package fastcalib.calibration;

import fastcalib.data.Volume;
import fastcalib.geometry.Geometry;

/**
 * Tomographic reconstruction provided by the caller
 */
public interface ReconstructionOperator
{

  /**
   * Reconstructs a volume. Must be deterministic for fixed inputs.
   *
   * @param pProjections
   *          projection stack (rows, angles, columns), not modified
   * @param pGeometry
   *          acquisition geometry
   * @param pSampling
   *          (vertical, horizontal, horizontal) subsampling of the projections
   *          and of the volume
   * @return reconstructed volume
   */
  Volume reconstruct(Volume pProjections, Geometry pGeometry, int... pSampling);

}
