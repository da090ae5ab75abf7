package fastcalib.geometry;

import javax.vecmath.Matrix3d;

import fastcalib.registration.AffineMatrix;
import fastcalib.registration.Pose;

/**
 * Conversions between registration results and geometry records
 */
public class GeometryTransforms
{
  // volume (Z,Y,X) axes to the (x, y, z) order of the vol_tra field
  private static final int[] cTranslationAxes =
  { 0, 2, 1 };

  /**
   * Writes a registered pose into a copy of a geometry record: the volume
   * rotation becomes the XYZ Euler angles of R^T (radians) and R T, scaled by
   * the voxel size, is subtracted from the volume translation.
   *
   * @param pPose
   *          pose with the translation in voxels
   * @param pGeometry
   *          geometry of the moving volume, not modified
   * @return updated copy
   */
  public static Geometry applyPose(Pose pPose, Geometry pGeometry)
  {
    Geometry lGeometry = pGeometry.copy();
    Matrix3d R = pPose.getRotation();

    double[] lAngles = AffineMatrix.eulerAngles(AffineMatrix.transpose(R));
    for (int i = 0; i < 3; i++)
      lAngles[i] = Math.toRadians(lAngles[i]);
    lGeometry.setVector(Geometry.VOL_ROT, lAngles);

    double lVoxel = lGeometry.getScalar(Geometry.IMG_PIXEL);
    double[] lRT = AffineMatrix.transform(R, pPose.getTranslation());
    double[] lTranslation = lGeometry.getVector(Geometry.VOL_TRA, 0, 0, 0);
    for (int i = 0; i < 3; i++)
      lTranslation[i] -= lRT[cTranslationAxes[i]] * lVoxel;
    lGeometry.setVector(Geometry.VOL_TRA, lTranslation);
    return lGeometry;
  }

}
