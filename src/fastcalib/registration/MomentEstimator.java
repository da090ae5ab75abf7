package fastcalib.registration;

import java.util.Arrays;
import java.util.Comparator;

import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

import fastcalib.DegenerateInputException;
import fastcalib.data.Volume;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealVector;

/**
 * Estimates the pose of a volume from its intensity-weighted moments. The rows
 * of the rotation are the principal axes in descending order of their second
 * moment, the translation is the centroid relative to the volume center. The
 * signs of the first two axes are arbitrary and left to
 * {@link OrientationDisambiguator}.
 */
public class MomentEstimator
{

  /**
   * Computes the moments of a volume on a strided grid. Coordinates stay in
   * the full-resolution frame and the mass is scaled by the voxel count each
   * sample stands for.
   *
   * @param pVolume
   *          volume, not modified
   * @param pSubsample
   *          stride along all axes, at least 1
   * @return moments
   */
  public static Moments computeMoments(Volume pVolume, int pSubsample)
  {
    Volume lVolume = pVolume.subsample(pSubsample);
    float[] lData = lVolume.getData();

    double lMass = 0, mz = 0, my = 0, mx = 0;
    int i = 0;
    for (int z = 0; z < lVolume.getDepth(); z++)
      for (int y = 0; y < lVolume.getHeight(); y++)
        for (int x = 0; x < lVolume.getWidth(); x++)
        {
          double w = lData[i++];
          lMass += w;
          mz += w * z;
          my += w * y;
          mx += w * x;
        }
    if (!(lMass > 0))
      throw new DegenerateInputException("Volume %s has no positive mass (%g), cannot compute moments",
                                         pVolume,
                                         lMass);

    double[] lCentroid =
    { mz / lMass, my / lMass, mx / lMass };

    double[][] lCovariance = new double[3][3];
    double[] d = new double[3];
    i = 0;
    for (int z = 0; z < lVolume.getDepth(); z++)
      for (int y = 0; y < lVolume.getHeight(); y++)
        for (int x = 0; x < lVolume.getWidth(); x++)
        {
          double w = lData[i++];
          if (w == 0)
            continue;
          d[0] = z - lCentroid[0];
          d[1] = y - lCentroid[1];
          d[2] = x - lCentroid[2];
          for (int a = 0; a < 3; a++)
            for (int b = a; b < 3; b++)
              lCovariance[a][b] += w * d[a] * d[b];
        }
    double s2 = (double) pSubsample * pSubsample;
    for (int a = 0; a < 3; a++)
      for (int b = a; b < 3; b++)
      {
        lCovariance[a][b] = lCovariance[a][b] / lMass * s2;
        lCovariance[b][a] = lCovariance[a][b];
      }
    for (int a = 0; a < 3; a++)
      lCentroid[a] *= pSubsample;

    double s3 = s2 * pSubsample;
    return new Moments(lMass * s3, lCentroid, lCovariance);
  }

  /**
   * Principal-axes pose of a volume
   *
   * @param pVolume
   *          volume, not modified
   * @param pSubsample
   *          stride used when computing the moments
   * @return pose whose rotation rows are the principal axes and whose
   *         translation is the centroid relative to shape // 2
   */
  public static Pose estimatePose(Volume pVolume, int pSubsample)
  {
    Moments lMoments = computeMoments(pVolume, pSubsample);

    EigenDecomposition lEigen =
                              new EigenDecomposition(new Array2DRowRealMatrix(lMoments.getCovariance()));
    double[] lEigenvalues = lEigen.getRealEigenvalues();
    Integer[] lOrder =
    { 0, 1, 2 };
    Arrays.sort(lOrder,
                Comparator.comparingDouble((Integer k) -> -lEigenvalues[k]));

    Matrix3d R = new Matrix3d();
    for (int r = 0; r < 2; r++)
    {
      RealVector v = lEigen.getEigenvector(lOrder[r]);
      R.setRow(r, v.getEntry(0), v.getEntry(1), v.getEntry(2));
    }
    Vector3d lThird = new Vector3d();
    lThird.cross(AffineMatrix.row(R, 0), AffineMatrix.row(R, 1));
    R.setRow(2, lThird.x, lThird.y, lThird.z);

    double[] lCentroid = lMoments.getCentroid();
    int[] lCenter = pVolume.getCenter();
    return new Pose(R,
                    lCentroid[0] - lCenter[0],
                    lCentroid[1] - lCenter[1],
                    lCentroid[2] - lCenter[2]);
  }

}
