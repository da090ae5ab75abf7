package fastcalib.data;

import java.util.Arrays;

import javax.vecmath.Matrix3d;

import fastcalib.DegenerateInputException;
import fastcalib.ShapeMismatchException;

import ij.process.AutoThresholder;
import ij.process.AutoThresholder.Method;
import net.imglib2.algorithm.gauss3.Gauss3;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * Voxel-wise helpers shared by registration, stitching and calibration
 */
public class VolumeOps
{
  private static final int cOtsuBins = 256;

  /**
   * Root mean square difference between two volumes of equal shape
   *
   * @param pVolumeA
   *          first volume
   * @param pVolumeB
   *          second volume
   * @return sqrt(mean((a - b)^2))
   */
  public static double l2Norm(Volume pVolumeA, Volume pVolumeB)
  {
    checkSameDimensions(pVolumeA, pVolumeB);
    float[] a = pVolumeA.getData(), b = pVolumeB.getData();
    double lSum = 0;
    for (int i = 0; i < a.length; i++)
    {
      double d = a[i] - b[i];
      lSum += d * d;
    }
    return Math.sqrt(lSum / a.length);
  }

  public static void checkSameDimensions(Volume pVolumeA, Volume pVolumeB)
  {
    if (!pVolumeA.hasSameDimensions(pVolumeB))
      throw new ShapeMismatchException("Volumes have different dimensions: %s and %s",
                                       Arrays.toString(pVolumeA.getDimensions()),
                                       Arrays.toString(pVolumeB.getDimensions()));
  }

  /**
   * Otsu threshold computed jointly over the voxels of all given volumes, each
   * strided by the given step along every axis.
   *
   * @param pStride
   *          sampling stride used to speed up the histogram
   * @param pVolumes
   *          volumes
   * @return threshold (center of the last background bin of a 256-bin
   *         histogram)
   */
  public static double otsuThreshold(int pStride, Volume... pVolumes)
  {
    double lMin = Double.POSITIVE_INFINITY, lMax =
                                             Double.NEGATIVE_INFINITY;
    for (Volume lVolume : pVolumes)
      for (float lValue : lVolume.subsample(pStride).getData())
      {
        lMin = Math.min(lMin, lValue);
        lMax = Math.max(lMax, lValue);
      }
    if (!(lMax > lMin))
      throw new DegenerateInputException("Cannot compute an Otsu threshold of uniform data (value %g)",
                                         lMin);

    int[] lHistogram = new int[cOtsuBins];
    double lBinWidth = (lMax - lMin) / cOtsuBins;
    for (Volume lVolume : pVolumes)
      for (float lValue : lVolume.subsample(pStride).getData())
      {
        int lBin = (int) ((lValue - lMin) / lBinWidth);
        lHistogram[Math.min(lBin, cOtsuBins - 1)]++;
      }

    int lThresholdBin = new AutoThresholder().getThreshold(Method.Otsu,
                                                           lHistogram);
    return lMin + (lThresholdBin + 0.5) * lBinWidth;
  }

  /**
   * Sets all voxels below the threshold to zero, in place
   *
   * @param pVolume
   *          volume to modify
   * @param pThreshold
   *          threshold
   */
  public static void applyThreshold(Volume pVolume, double pThreshold)
  {
    float[] lData = pVolume.getData();
    for (int i = 0; i < lData.length; i++)
      if (lData[i] < pThreshold)
        lData[i] = 0;
  }

  /**
   * Gaussian smoothing with mirrored borders
   *
   * @param pVolume
   *          input volume, not modified
   * @param pSigma
   *          standard deviation in voxels, a non-positive value returns a copy
   * @return smoothed copy
   */
  public static Volume gaussianBlur(Volume pVolume, double pSigma)
  {
    Volume lResult = pVolume.copy();
    if (pSigma <= 0)
      return lResult;
    ArrayImg<FloatType, FloatArray> lImg = wrap(lResult);
    Gauss3.gauss(pSigma, Views.extendMirrorDouble(lImg), lImg);
    return lResult;
  }

  // (X,Y,Z) image sharing the volume's buffer
  private static ArrayImg<FloatType, FloatArray> wrap(Volume pVolume)
  {
    return ArrayImgs.floats(pVolume.getData(),
                            pVolume.getWidth(),
                            pVolume.getHeight(),
                            pVolume.getDepth());
  }

  /**
   * Smooths then subsamples a volume, used to build coarse pyramid levels
   *
   * @param pVolume
   *          input volume, not modified
   * @param pShrink
   *          subsampling stride
   * @param pSigma
   *          smoothing sigma in voxels of the input
   * @return coarse copy
   */
  public static Volume smoothAndSubsample(Volume pVolume,
                                          int pShrink,
                                          double pSigma)
  {
    return gaussianBlur(pVolume, pSigma).subsample(pShrink);
  }

  /**
   * Resamples a volume under a rigid pose about the volume center c:
   * out(o) = in(R (o - c - T) + c), trilinear, zero outside.
   *
   * @param pVolume
   *          moving volume, not modified
   * @param pRotation
   *          rotation matrix in (Z,Y,X) index order
   * @param pTranslation
   *          translation in (Z,Y,X) index order, in voxels
   * @return resampled volume of the same shape
   */
  public static Volume affine(Volume pVolume,
                              Matrix3d pRotation,
                              double[] pTranslation)
  {
    int[] lCenter = pVolume.getCenter();
    double cz = lCenter[0], cy = lCenter[1], cx = lCenter[2];
    Matrix3d R = pRotation;
    Volume lResult = new Volume(pVolume.getDepth(),
                                pVolume.getHeight(),
                                pVolume.getWidth(),
                                pVolume.getVoxelSize());
    float[] lData = lResult.getData();
    int i = 0;
    for (int z = 0; z < pVolume.getDepth(); z++)
    {
      double vz = z - cz - pTranslation[0];
      for (int y = 0; y < pVolume.getHeight(); y++)
      {
        double vy = y - cy - pTranslation[1];
        for (int x = 0; x < pVolume.getWidth(); x++)
        {
          double vx = x - cx - pTranslation[2];
          double sz = R.m00 * vz + R.m01 * vy + R.m02 * vx + cz;
          double sy = R.m10 * vz + R.m11 * vy + R.m12 * vx + cy;
          double sx = R.m20 * vz + R.m21 * vy + R.m22 * vx + cx;
          lData[i++] = pVolume.interpolate(sz, sy, sx);
        }
      }
    }
    return lResult;
  }

}
