package fastcalib.geometry.test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import fastcalib.ValidationException;
import fastcalib.geometry.Geometry;
import fastcalib.geometry.GeometryTransforms;
import fastcalib.registration.AffineMatrix;
import fastcalib.registration.Pose;

import org.junit.Test;

/**
 * Geometry record and pose conversion tests
 */
public class GeometryTransformsTests
{

  @Test
  public void testTranslationOnly()
  {
    Geometry lGeometry = Geometry.of(0.1, 0.5);
    Pose lPose = new Pose(AffineMatrix.identity(), 1, 2, 3);

    Geometry lUpdated = GeometryTransforms.applyPose(lPose, lGeometry);

    assertArrayEquals(new double[]
    { -0.5, -1.5, -1.0 }, lUpdated.getVector(Geometry.VOL_TRA), 1e-12);
    assertArrayEquals(new double[3],
                      lUpdated.getVector(Geometry.VOL_ROT),
                      1e-12);

    // source record untouched
    assertArrayEquals(new double[3],
                      lGeometry.getVector(Geometry.VOL_TRA),
                      0);
  }

  @Test
  public void testTranslationAccumulates()
  {
    Geometry lGeometry = Geometry.of(0.1, 1);
    lGeometry.setVector(Geometry.VOL_TRA, 1, 1, 1);
    Geometry lUpdated =
                      GeometryTransforms.applyPose(new Pose(AffineMatrix.identity(),
                                                            1,
                                                            0,
                                                            0),
                                                   lGeometry);
    assertArrayEquals(new double[]
    { 0, 1, 1 }, lUpdated.getVector(Geometry.VOL_TRA), 1e-12);
  }

  @Test
  public void testRotatedPose()
  {
    Geometry lGeometry = Geometry.of(0.1, 0.5);
    Pose lPose = new Pose(AffineMatrix.rotation(0, 0, 90), 1, 0, 0);

    Geometry lUpdated = GeometryTransforms.applyPose(lPose, lGeometry);

    double[] lAngles = lUpdated.getVector(Geometry.VOL_ROT);
    assertEquals(0, lAngles[0], 1e-9);
    assertEquals(0, lAngles[1], 1e-9);
    assertEquals(Math.PI / 2, Math.abs(lAngles[2]), 1e-9);

    // R T = (0, 1, 0) lands on the last vol_tra component
    assertArrayEquals(new double[]
    { 0, 0, -0.5 }, lUpdated.getVector(Geometry.VOL_TRA), 1e-12);
  }

  @Test
  public void testFieldAccess()
  {
    Geometry lGeometry = Geometry.of(0.2, 0.4);
    assertEquals(0.2, lGeometry.getScalar(Geometry.DET_PIXEL), 0);
    assertEquals(0, lGeometry.getScalar(Geometry.AXS_HRZ), 0);
    assertEquals(7, lGeometry.getScalar("src_vrt", 7), 0);
    assertArrayEquals(new double[]
    { 1, 2, 3 }, lGeometry.getVector("det_tra", 1, 2, 3), 0);

    Geometry lCopy = lGeometry.copy().set(Geometry.AXS_HRZ, 1.5);
    assertEquals(1.5, lCopy.getScalar(Geometry.AXS_HRZ), 0);
    assertEquals(0, lGeometry.getScalar(Geometry.AXS_HRZ), 0);

    assertTrue(lGeometry.keys().contains(Geometry.VOL_ROT));
    assertFalse(lGeometry.has("src_vrt"));
  }

  @Test(expected = ValidationException.class)
  public void testMissingField()
  {
    new Geometry().getScalar(Geometry.IMG_PIXEL);
  }

  @Test(expected = ValidationException.class)
  public void testWrongFieldType()
  {
    Geometry.of(0.1, 0.1).getVector(Geometry.DET_PIXEL);
  }

}
