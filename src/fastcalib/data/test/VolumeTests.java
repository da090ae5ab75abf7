package fastcalib.data.test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import fastcalib.ShapeMismatchException;
import fastcalib.ValidationException;
import fastcalib.data.Image2D;
import fastcalib.data.Volume;

import org.junit.Test;

/**
 * Volume tests
 */
public class VolumeTests
{

  private static Volume ramp(int d, int h, int w)
  {
    Volume lVolume = new Volume(d, h, w);
    for (int z = 0; z < d; z++)
      for (int y = 0; y < h; y++)
        for (int x = 0; x < w; x++)
          lVolume.set(z, y, x, 100 * z + 10 * y + x);
    return lVolume;
  }

  @Test
  public void testSubsample()
  {
    Volume lVolume = ramp(5, 4, 3);
    Volume lSampled = lVolume.subsample(2);
    assertArrayEquals(new int[]
    { 3, 2, 2 }, lSampled.getDimensions());
    assertEquals(lVolume.get(2, 2, 2), lSampled.get(1, 1, 1), 0);
    assertEquals(lVolume.get(4, 0, 2), lSampled.get(2, 0, 1), 0);
    assertEquals(2, lSampled.getVoxelSize(), 0);
  }

  @Test(expected = ValidationException.class)
  public void testInvalidStride()
  {
    ramp(2, 2, 2).subsample(0);
  }

  @Test(expected = ValidationException.class)
  public void testInvalidShape()
  {
    new Volume(0, 3, 3);
  }

  @Test(expected = ShapeMismatchException.class)
  public void testDataLengthMismatch()
  {
    new Volume(new float[10], 2, 2, 2, 1);
  }

  @Test
  public void testInterpolate()
  {
    Volume lVolume = ramp(3, 3, 3);
    assertEquals(lVolume.get(1, 1, 1), lVolume.interpolate(1, 1, 1), 1e-6);
    assertEquals(0.5 * (lVolume.get(1, 1, 1) + lVolume.get(1, 1, 2)),
                 lVolume.interpolate(1, 1, 1.5),
                 1e-4);
    assertEquals(100 * 0.25 + 10 * 1.5 + 0.75,
                 lVolume.interpolate(0.25, 1.5, 0.75),
                 1e-4);
    assertEquals(0, lVolume.interpolate(-0.1, 1, 1), 0);
    assertEquals(0, lVolume.interpolate(1, 1, 2.1), 0);
  }

  @Test
  public void testSlices()
  {
    Volume lVolume = ramp(4, 5, 6);
    Image2D lSlice = lVolume.getSlice(1, 3);
    assertEquals(4, lSlice.getRows());
    assertEquals(6, lSlice.getColumns());
    assertEquals(lVolume.get(2, 3, 5), lSlice.get(2, 5), 0);

    lSlice.set(1, 1, -1);
    lVolume.setSlice(1, 3, lSlice);
    assertEquals(-1, lVolume.get(1, 3, 1), 0);

    Image2D lSide = lVolume.getSlice(2, 4);
    assertEquals(4, lSide.getRows());
    assertEquals(5, lSide.getColumns());
    assertEquals(lVolume.get(3, 2, 4), lSide.get(3, 2), 0);
  }

  @Test(expected = ShapeMismatchException.class)
  public void testSetSliceMismatch()
  {
    ramp(4, 5, 6).setSlice(0, 0, new Image2D(4, 6));
  }

  @Test
  public void testCenterAndCopy()
  {
    Volume lVolume = ramp(5, 4, 3);
    assertArrayEquals(new int[]
    { 2, 2, 1 }, lVolume.getCenter());
    Volume lCopy = lVolume.copy();
    lCopy.set(0, 0, 0, 42);
    assertEquals(0, lVolume.get(0, 0, 0), 0);
    assertEquals(lVolume.sum() + 42, lCopy.sum(), 1e-6);
  }

}
