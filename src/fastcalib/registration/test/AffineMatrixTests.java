package fastcalib.registration.test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

import fastcalib.registration.AffineMatrix;
import fastcalib.registration.Pose;

import org.junit.Test;

/**
 * Rotation helper tests
 */
public class AffineMatrixTests
{

  @Test
  public void testRotationAngles()
  {
    assertEquals(0,
                 AffineMatrix.angleBetween(AffineMatrix.rotation(0, 0, 0),
                                           AffineMatrix.identity()),
                 1e-9);
    assertEquals(30,
                 AffineMatrix.angleBetween(AffineMatrix.rotation(30, 0, 0),
                                           AffineMatrix.identity()),
                 1e-9);
    assertEquals(180,
                 AffineMatrix.angleBetween(AffineMatrix.axisAngle(new Vector3d(1,
                                                                               1,
                                                                               0),
                                                                  Math.PI),
                                           AffineMatrix.identity()),
                 1e-6);
  }

  @Test
  public void testTransform()
  {
    Matrix3d R = AffineMatrix.rotation(0, 0, 90);
    double[] v = AffineMatrix.transform(R, new double[]
    { 1, 0, 0 });
    assertArrayEquals(new double[]
    { 0, 1, 0 }, v, 1e-12);
    assertEquals(0,
                 AffineMatrix.angleBetween(AffineMatrix.multiply(R,
                                                                 AffineMatrix.transpose(R)),
                                           AffineMatrix.identity()),
                 1e-6);
  }

  @Test
  public void testEulerAngles()
  {
    assertArrayEquals(new double[3],
                      AffineMatrix.eulerAngles(AffineMatrix.identity()),
                      1e-9);
    double[] lAngles = AffineMatrix.eulerAngles(AffineMatrix.rotation(30,
                                                                       0,
                                                                       0));
    assertEquals(30, Math.abs(lAngles[0]), 1e-6);
    assertEquals(0, lAngles[1], 1e-6);
    assertEquals(0, lAngles[2], 1e-6);
  }

  @Test
  public void testPose()
  {
    Pose lPose = new Pose(AffineMatrix.rotation(10, 20, 30), 1, 2, 3);
    assertEquals(true, lPose.isOrthonormal(1e-9));
    assertArrayEquals(new double[]
    { 2, 4, 6 }, lPose.scaleTranslation(2).getTranslation(), 0);
    double[] T = lPose.getTranslation();
    T[0] = 42;
    assertEquals(1, lPose.getTranslation()[0], 0);
  }

}
