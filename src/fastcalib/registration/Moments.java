package fastcalib.registration;

import java.util.Arrays;

/**
 * Image moments of a volume up to second order: mass, centroid in array
 * coordinates and the symmetric matrix of central second moments (normalized by
 * the mass).
 */
public class Moments
{
  private final double mMass;
  private final double[] mCentroid;
  private final double[][] mCovariance;

  public Moments(double pMass, double[] pCentroid, double[][] pCovariance)
  {
    assert pCentroid.length == 3 && pCovariance.length == 3;
    mMass = pMass;
    mCentroid = pCentroid.clone();
    mCovariance = new double[3][];
    for (int i = 0; i < 3; i++)
      mCovariance[i] = pCovariance[i].clone();
  }

  public double getMass()
  {
    return mMass;
  }

  public double[] getCentroid()
  {
    return mCentroid.clone();
  }

  public double[][] getCovariance()
  {
    double[][] lCopy = new double[3][];
    for (int i = 0; i < 3; i++)
      lCopy[i] = mCovariance[i].clone();
    return lCopy;
  }

  @Override
  public String toString()
  {
    return String.format("Moments(mass = %g, centroid = %s, covariance = %s)",
                         mMass,
                         Arrays.toString(mCentroid),
                         Arrays.deepToString(mCovariance));
  }

}
