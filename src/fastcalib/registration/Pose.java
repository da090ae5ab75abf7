package fastcalib.registration;

import java.util.Arrays;

import javax.vecmath.Matrix3d;

import fastcalib.data.Volume;
import fastcalib.data.VolumeOps;

/**
 * Rigid pose: rotation R and translation T expressed about the volume center c
 * = shape // 2, both in (Z,Y,X) index order. Posing a moving volume samples it
 * at R (o - c - T) + c for every output voxel o.
 */
public class Pose
{
  private final Matrix3d mRotation;
  private final double[] mTranslation;

  public Pose(Matrix3d pRotation, double... pTranslation)
  {
    assert pTranslation.length == 3;
    mRotation = new Matrix3d(pRotation);
    mTranslation = pTranslation.clone();
  }

  public static Pose identity()
  {
    return new Pose(AffineMatrix.identity(), 0, 0, 0);
  }

  public Matrix3d getRotation()
  {
    return new Matrix3d(mRotation);
  }

  public double[] getTranslation()
  {
    return mTranslation.clone();
  }

  /**
   * Checks |det R| = 1 and R R^T = I within the given tolerance
   *
   * @param pTolerance
   *          absolute tolerance
   * @return true if R is orthonormal
   */
  public boolean isOrthonormal(double pTolerance)
  {
    if (Math.abs(Math.abs(mRotation.determinant()) - 1) > pTolerance)
      return false;
    Matrix3d lProduct = AffineMatrix.multiply(mRotation,
                                              AffineMatrix.transpose(mRotation));
    for (int i = 0; i < 3; i++)
      for (int j = 0; j < 3; j++)
        if (Math.abs(lProduct.getElement(i, j) - (i == j ? 1 : 0)) > pTolerance)
          return false;
    return true;
  }

  /**
   * Same rotation, translation multiplied by a factor. Used to move a pose
   * between resolution levels.
   *
   * @param pFactor
   *          scale factor
   * @return scaled pose
   */
  public Pose scaleTranslation(double pFactor)
  {
    return new Pose(mRotation,
                    mTranslation[0] * pFactor,
                    mTranslation[1] * pFactor,
                    mTranslation[2] * pFactor);
  }

  /**
   * Resamples a moving volume under this pose
   *
   * @param pMoving
   *          moving volume, not modified
   * @return posed copy
   */
  public Volume apply(Volume pMoving)
  {
    return VolumeOps.affine(pMoving, mRotation, mTranslation);
  }

  public double[] getEulerAngles()
  {
    return AffineMatrix.eulerAngles(mRotation);
  }

  @Override
  public String toString()
  {
    double[][] lRows = new double[3][3];
    for (int i = 0; i < 3; i++)
      mRotation.getRow(i, lRows[i]);
    return String.format("Pose(R = %s, T = %s)",
                         Arrays.deepToString(lRows),
                         Arrays.toString(mTranslation));
  }

}
