package fastcalib.shift;

import java.util.Arrays;

/**
 * Sub-pixel shift measured on one slice
 */
public class ShiftSample
{
  private final int mSliceIndex;
  private final double[] mShift;
  private final double mCorrelation;

  public ShiftSample(int pSliceIndex, double[] pShift, double pCorrelation)
  {
    assert pShift.length == 2;
    mSliceIndex = pSliceIndex;
    mShift = pShift.clone();
    mCorrelation = pCorrelation;
  }

  public int getSliceIndex()
  {
    return mSliceIndex;
  }

  /**
   * @return (rows, columns) shift
   */
  public double[] getShift()
  {
    return mShift.clone();
  }

  public double getCorrelation()
  {
    return mCorrelation;
  }

  @Override
  public String toString()
  {
    return String.format("ShiftSample(slice %d, shift = %s, correlation = %.3f)",
                         mSliceIndex,
                         Arrays.toString(mShift),
                         mCorrelation);
  }

}
