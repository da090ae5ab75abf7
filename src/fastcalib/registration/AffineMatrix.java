package fastcalib.registration;

import javax.vecmath.AxisAngle4d;
import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.RotationOrder;

/**
 * Helper functions for rotation matrix construction. Matrix rows and columns
 * follow the array axes of a volume, i.e. index 0 is Z, 1 is Y and 2 is X.
 */
public class AffineMatrix
{

  public static Matrix3d identity()
  {
    Matrix3d M = new Matrix3d();
    M.setIdentity();
    return M;
  }

  /**
   * Rotation composed of rotations about the three array axes
   *
   * @param ro
   *          angles in degrees about axis 0, 1 and 2
   * @return R = R2 * R1 * R0
   */
  public static Matrix3d rotation(double... ro)
  {
    assert ro.length == 3;
    Matrix3d R0 = new Matrix3d();
    R0.rotX(Math.toRadians(ro[0]));
    Matrix3d R1 = new Matrix3d();
    R1.rotY(Math.toRadians(ro[1]));
    Matrix3d R2 = new Matrix3d();
    R2.rotZ(Math.toRadians(ro[2]));
    return multiply(R2, R1, R0);
  }

  /**
   * Right-handed rotation about an arbitrary axis
   *
   * @param pAxis
   *          rotation axis, need not be normalized
   * @param pAngle
   *          angle in radians
   * @return rotation matrix
   */
  public static Matrix3d axisAngle(Vector3d pAxis, double pAngle)
  {
    Matrix3d M = new Matrix3d();
    M.set(new AxisAngle4d(pAxis, pAngle));
    return M;
  }

  public static Matrix3d multiply(Matrix3d... pMats)
  {
    Matrix3d R = identity();
    for (Matrix3d M : pMats)
      R.mul(M);
    return R;
  }

  public static Matrix3d transpose(Matrix3d pMatrix)
  {
    Matrix3d M = new Matrix3d(pMatrix);
    M.transpose();
    return M;
  }

  /**
   * Matrix-vector product
   *
   * @param pMatrix
   *          matrix
   * @param pVector
   *          vector of length 3
   * @return M * v
   */
  public static double[] transform(Matrix3d pMatrix, double[] pVector)
  {
    Vector3d v = new Vector3d(pVector);
    pMatrix.transform(v);
    return new double[]
    { v.x, v.y, v.z };
  }

  public static Vector3d row(Matrix3d pMatrix, int pRow)
  {
    double[] lRow = new double[3];
    pMatrix.getRow(pRow, lRow);
    return new Vector3d(lRow);
  }

  /**
   * Angle of the relative rotation between two rotation matrices
   *
   * @param pA
   *          first rotation
   * @param pB
   *          second rotation
   * @return angle in degrees, within [0, 180]
   */
  public static double angleBetween(Matrix3d pA, Matrix3d pB)
  {
    Matrix3d lRelative = multiply(transpose(pA), pB);
    double lCos = (lRelative.m00 + lRelative.m11 + lRelative.m22 - 1)
                  / 2;
    return Math.toDegrees(Math.acos(Math.max(-1, Math.min(1, lCos))));
  }

  /**
   * Cardan angles of a rotation matrix, XYZ order in the vector operator
   * convention
   *
   * @param pRotation
   *          orthonormal matrix with positive determinant
   * @return three angles in degrees
   */
  public static double[] eulerAngles(Matrix3d pRotation)
  {
    double[][] lMatrix = new double[3][3];
    for (int i = 0; i < 3; i++)
      pRotation.getRow(i, lMatrix[i]);
    Rotation lRotation = new Rotation(lMatrix, 1e-4);
    double[] lAngles =
                     lRotation.getAngles(RotationOrder.XYZ,
                                         RotationConvention.VECTOR_OPERATOR);
    for (int i = 0; i < 3; i++)
      lAngles[i] = Math.toDegrees(lAngles[i]);
    return lAngles;
  }

}
