package fastcalib.calibration;

import fastcalib.data.Volume;
import fastcalib.geometry.Geometry;

/**
 * Cost of a geometry parameter value: reconstructs the projections with the
 * value set and returns the negated {@link GradientEnergyMetric} of the
 * reconstruction, negative densities clamped to zero. A correct geometry gives
 * the sharpest reconstruction, hence the lowest cost.
 */
public class ReconstructionSharpnessCost implements ScalarCostFunction
{
  private final ReconstructionOperator mOperator;
  private final Volume mProjections;
  private final Geometry mGeometry;
  private final String mKey;
  private int mVerticalSampling = 20;

  /**
   * @param pOperator
   *          reconstruction
   * @param pProjections
   *          projection stack
   * @param pGeometry
   *          geometry, copied for every evaluation
   * @param pKey
   *          geometry field that receives the trial value
   */
  public ReconstructionSharpnessCost(ReconstructionOperator pOperator,
                                     Volume pProjections,
                                     Geometry pGeometry,
                                     String pKey)
  {
    mOperator = pOperator;
    mProjections = pProjections;
    mGeometry = pGeometry;
    mKey = pKey;
  }

  @Override
  public double evaluate(double pValue, int pSubscale)
  {
    Geometry lGeometry = mGeometry.copy().set(mKey, pValue);
    Volume lVolume = mOperator.reconstruct(mProjections,
                                           lGeometry,
                                           mVerticalSampling,
                                           pSubscale,
                                           pSubscale);
    float[] lData = lVolume.getData();
    for (int i = 0; i < lData.length; i++)
      if (lData[i] < 0)
        lData[i] = 0;
    return -GradientEnergyMetric.compute(lVolume);
  }

  public int getVerticalSampling()
  {
    return mVerticalSampling;
  }

  public void setVerticalSampling(int pVerticalSampling)
  {
    assert pVerticalSampling >= 1;
    mVerticalSampling = pVerticalSampling;
  }

}
