package fastcalib.shift;

import java.util.ArrayList;
import java.util.List;

import fastcalib.ShapeMismatchException;
import fastcalib.TileBoundsException;
import fastcalib.data.Image2D;
import fastcalib.data.Volume;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Residual shift of a tile relative to its nominal position inside a reference
 * stack. Every n-th slice is cropped to the common support, edge-enhanced with
 * a Laplacian and registered by {@link PhaseCorrelation}; the per-slice shifts
 * are then reduced to a consensus with outlier rejection. Whenever no
 * consistent shift emerges the result is zero, i.e. the nominal offset is
 * trusted.
 */
public class RobustShiftEstimator
{
  private static final Logger cLogger =
                                      LoggerFactory.getLogger(RobustShiftEstimator.class);

  private int mAxis = 1;
  private int mStep = 10;
  private int mUpsampling = 10;
  private double mMinPeakCorrelation = 0.2;
  private double mMaxRelativeDeviation = 0.5;
  private double mMinShift = 1;
  private boolean mDebug = false;

  /**
   * Estimates the shift along the configured slicing axis
   *
   * @param pReference
   *          reference stack, not modified
   * @param pMoving
   *          tile stack, not modified
   * @param pOffset
   *          nominal (rows, columns) position of the tile in the slices of the
   *          reference
   * @return (rows, columns) correction to add to the nominal offset
   */
  public double[] estimateShift(Volume pReference,
                                Volume pMoving,
                                int... pOffset)
  {
    return estimateShift(pReference, pMoving, pOffset, mAxis);
  }

  /**
   * Estimates the shift between two stacks sliced along the given axis
   *
   * @param pReference
   *          reference stack, not modified
   * @param pMoving
   *          tile stack, not modified
   * @param pOffset
   *          nominal (rows, columns) position of the tile in the slices of the
   *          reference
   * @param pAxis
   *          axis perpendicular to the slices
   * @return (rows, columns) correction to add to the nominal offset
   */
  public double[] estimateShift(Volume pReference,
                                Volume pMoving,
                                int[] pOffset,
                                int pAxis)
  {
    return consensus(collectSamples(pReference, pMoving, pOffset, pAxis));
  }

  /**
   * Measures the shift on every n-th slice, skipping slices whose common
   * support spans fewer than two rows or columns, and slices without a significant correlation peak
   *
   * @param pReference
   *          reference stack
   * @param pMoving
   *          tile stack
   * @param pOffset
   *          nominal (rows, columns) offset
   * @param pAxis
   *          slicing axis
   * @return samples in slice order
   */
  public List<ShiftSample> collectSamples(Volume pReference,
                                          Volume pMoving,
                                          int[] pOffset,
                                          int pAxis)
  {
    assert pOffset.length == 2;
    int lSlices = pReference.getDimension(pAxis);
    if (pMoving.getDimension(pAxis) != lSlices)
      throw new ShapeMismatchException("Stacks have %d and %d slices along axis %d",
                                       lSlices,
                                       pMoving.getDimension(pAxis),
                                       pAxis);

    List<ShiftSample> lSamples = new ArrayList<>();
    for (int i = 0; i < lSlices; i += mStep)
    {
      Image2D lMoving = pMoving.getSlice(pAxis, i);
      Image2D lReference = pReference.getSlice(pAxis, i);
      checkBounds(lReference, lMoving, pOffset);
      lReference = lReference.crop(pOffset[0],
                                   pOffset[1],
                                   lMoving.getRows(),
                                   lMoving.getColumns());

      Image2D[] lSupported = intersectSupport(lReference, lMoving);
      if (lSupported == null || lSupported[0].getRows() < 2
          || lSupported[0].getColumns() < 2)
        continue;

      Image2D lReferenceEdges = lSupported[0].laplace();
      Image2D lMovingEdges = lSupported[1].laplace();
      if (lReferenceEdges.sumOfSquares() == 0
          || lMovingEdges.sumOfSquares() == 0)
        continue;

      PhaseCorrelation.Peak lPeak =
                                  PhaseCorrelation.register(lReferenceEdges,
                                                            lMovingEdges,
                                                            mUpsampling);
      ShiftSample lSample = new ShiftSample(i,
                                            lPeak.getShift(),
                                            lPeak.getCorrelation());
      log("{}", lSample);
      if (lPeak.getCorrelation() < mMinPeakCorrelation)
        continue;
      lSamples.add(lSample);
    }
    return lSamples;
  }

  private static void checkBounds(Image2D pReference,
                                  Image2D pMoving,
                                  int[] pOffset)
  {
    if (pOffset[0] < 0 || pOffset[1] < 0
        || pOffset[0] + pMoving.getRows() > pReference.getRows()
        || pOffset[1] + pMoving.getColumns() > pReference.getColumns())
      throw new TileBoundsException("Tile of shape (%d, %d) at offset (%d, %d) exceeds reference of shape (%d, %d)",
                                    pMoving.getRows(),
                                    pMoving.getColumns(),
                                    pOffset[0],
                                    pOffset[1],
                                    pReference.getRows(),
                                    pReference.getColumns());
  }

  /**
   * Masks both images with their common nonzero support and keeps only the rows
   * and columns that carry support
   *
   * @param pReference
   *          reference crop
   * @param pMoving
   *          moving image of the same shape
   * @return masked reference and moving images, or null without common support
   */
  static Image2D[] intersectSupport(Image2D pReference, Image2D pMoving)
  {
    int lRows = pReference.getRows(), lColumns = pReference.getColumns();
    boolean[] lRowHasSupport = new boolean[lRows];
    boolean[] lColumnHasSupport = new boolean[lColumns];
    for (int r = 0; r < lRows; r++)
      for (int c = 0; c < lColumns; c++)
        if (pReference.get(r, c) != 0 && pMoving.get(r, c) != 0)
        {
          lRowHasSupport[r] = true;
          lColumnHasSupport[c] = true;
        }

    int[] lRowIndices = indicesOf(lRowHasSupport);
    int[] lColumnIndices = indicesOf(lColumnHasSupport);
    if (lRowIndices.length == 0)
      return null;

    Image2D lReference = new Image2D(lRowIndices.length,
                                     lColumnIndices.length);
    Image2D lMoving = new Image2D(lRowIndices.length, lColumnIndices.length);
    for (int i = 0; i < lRowIndices.length; i++)
      for (int j = 0; j < lColumnIndices.length; j++)
      {
        float a = pReference.get(lRowIndices[i], lColumnIndices[j]);
        float b = pMoving.get(lRowIndices[i], lColumnIndices[j]);
        if (a != 0 && b != 0)
        {
          lReference.set(i, j, a);
          lMoving.set(i, j, b);
        }
      }
    return new Image2D[]
    { lReference, lMoving };
  }

  private static int[] indicesOf(boolean[] pFlags)
  {
    int lCount = 0;
    for (boolean lFlag : pFlags)
      if (lFlag)
        lCount++;
    int[] lIndices = new int[lCount];
    for (int i = 0, j = 0; i < pFlags.length; i++)
      if (pFlags[i])
        lIndices[j++] = i;
    return lIndices;
  }

  /**
   * Reduces per-slice shifts to a single shift. Samples farther from the mean
   * than the mean is from zero are discarded; the survivors must agree (spread
   * below the configured fraction of their mean) and their mean must reach the
   * minimal shift, otherwise the result is zero.
   *
   * @param pSamples
   *          samples
   * @return consensus (rows, columns) shift
   */
  public double[] consensus(List<ShiftSample> pSamples)
  {
    double[] lZero = new double[2];
    if (pSamples.isEmpty())
    {
      log("no shift samples collected");
      return lZero;
    }

    double[] lMean = mean(pSamples);
    double lMeanNorm = norm(lMean);
    List<ShiftSample> lInliers = new ArrayList<>();
    for (ShiftSample lSample : pSamples)
    {
      double[] s = lSample.getShift();
      if (norm(s[0] - lMean[0], s[1] - lMean[1]) < lMeanNorm)
        lInliers.add(lSample);
    }
    if (lInliers.isEmpty())
    {
      log("no consistent shift among {} samples", pSamples.size());
      return lZero;
    }

    double[] lShift = mean(lInliers);
    double[] lStd = new double[2];
    for (ShiftSample lSample : lInliers)
    {
      double[] s = lSample.getShift();
      for (int k = 0; k < 2; k++)
        lStd[k] += (s[k] - lShift[k]) * (s[k] - lShift[k]);
    }
    for (int k = 0; k < 2; k++)
      lStd[k] = Math.sqrt(lStd[k] / lInliers.size());

    double lShiftNorm = norm(lShift);
    if (norm(lStd) > lShiftNorm * mMaxRelativeDeviation)
    {
      log("shift {} rejected, deviation {} too large",
          lShiftNorm,
          norm(lStd));
      return lZero;
    }
    if (lShiftNorm < mMinShift)
    {
      log("shift {} below {} pixel, keeping nominal offset",
          lShiftNorm,
          mMinShift);
      return lZero;
    }
    log("consensus shift ({}, {}) from {} of {} samples",
        lShift[0],
        lShift[1],
        lInliers.size(),
        pSamples.size());
    return lShift;
  }

  private static double[] mean(List<ShiftSample> pSamples)
  {
    double[] lMean = new double[2];
    for (ShiftSample lSample : pSamples)
    {
      double[] s = lSample.getShift();
      lMean[0] += s[0];
      lMean[1] += s[1];
    }
    lMean[0] /= pSamples.size();
    lMean[1] /= pSamples.size();
    return lMean;
  }

  private static double norm(double... v)
  {
    return Math.hypot(v[0], v[1]);
  }

  private void log(String pFormat, Object... pArgs)
  {
    if (mDebug)
      cLogger.info(pFormat, pArgs);
    else
      cLogger.debug(pFormat, pArgs);
  }

  public int getAxis()
  {
    return mAxis;
  }

  /**
   * Sets the axis perpendicular to the compared slices
   *
   * @param pAxis
   *          0, 1 or 2; 1 is the angle axis of a projection stack
   */
  public void setAxis(int pAxis)
  {
    assert pAxis >= 0 && pAxis < 3;
    mAxis = pAxis;
  }

  public int getStep()
  {
    return mStep;
  }

  public void setStep(int pStep)
  {
    assert pStep >= 1;
    mStep = pStep;
  }

  public int getUpsampling()
  {
    return mUpsampling;
  }

  public void setUpsampling(int pUpsampling)
  {
    assert pUpsampling >= 1;
    mUpsampling = pUpsampling;
  }

  public double getMinPeakCorrelation()
  {
    return mMinPeakCorrelation;
  }

  /**
   * Slices whose normalized correlation peak is below this value are ignored
   *
   * @param pMinPeakCorrelation
   *          value in [0, 1], 0 keeps every slice
   */
  public void setMinPeakCorrelation(double pMinPeakCorrelation)
  {
    assert pMinPeakCorrelation >= 0 && pMinPeakCorrelation <= 1;
    mMinPeakCorrelation = pMinPeakCorrelation;
  }

  public double getMaxRelativeDeviation()
  {
    return mMaxRelativeDeviation;
  }

  public void setMaxRelativeDeviation(double pMaxRelativeDeviation)
  {
    assert pMaxRelativeDeviation > 0;
    mMaxRelativeDeviation = pMaxRelativeDeviation;
  }

  public double getMinShift()
  {
    return mMinShift;
  }

  public void setMinShift(double pMinShift)
  {
    assert pMinShift >= 0;
    mMinShift = pMinShift;
  }

  public void setDebug(boolean pDebug)
  {
    mDebug = pDebug;
  }

}
