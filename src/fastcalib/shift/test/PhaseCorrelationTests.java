package fastcalib.shift.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Random;

import fastcalib.DegenerateInputException;
import fastcalib.ShapeMismatchException;
import fastcalib.data.Image2D;
import fastcalib.shift.PhaseCorrelation;

import org.junit.Test;

/**
 * Phase correlation tests
 */
public class PhaseCorrelationTests
{

  private static final double[][] cBlobs =
  {
    { 20, 22 },
    { 30, 40 },
    { 42, 28 } };

  /**
   * Gaussian blobs displaced by -s, so that the image equals the unshifted one
   * sampled at x + s
   *
   * @param pRows
   *          rows
   * @param pColumns
   *          columns
   * @param s
   *          (rows, columns) shift
   * @return image
   */
  static Image2D blobs(int pRows, int pColumns, double... s)
  {
    Image2D lImage = new Image2D(pRows, pColumns);
    for (int r = 0; r < pRows; r++)
      for (int c = 0; c < pColumns; c++)
      {
        double lValue = 0;
        for (double[] b : cBlobs)
        {
          double dr = r + s[0] - b[0], dc = c + s[1] - b[1];
          lValue += Math.exp(-(dr * dr + dc * dc) / 18);
        }
        lImage.set(r, c, (float) lValue);
      }
    return lImage;
  }

  @Test
  public void testIdenticalImages()
  {
    Image2D lImage = blobs(64, 64, 0, 0);
    PhaseCorrelation.Peak lPeak = PhaseCorrelation.register(lImage,
                                                            lImage.copy(),
                                                            10);
    assertEquals(0, lPeak.getShift()[0], 1e-9);
    assertEquals(0, lPeak.getShift()[1], 1e-9);
    assertEquals(1, lPeak.getCorrelation(), 1e-4);
  }

  @Test
  public void testIntegerShift()
  {
    Image2D lReference = blobs(64, 64, 0, 0);
    Image2D lMoving = blobs(64, 64, 3, -5);
    double[] lShift = PhaseCorrelation.register(lReference, lMoving, 1)
                                      .getShift();
    assertEquals(3, lShift[0], 0);
    assertEquals(-5, lShift[1], 0);
  }

  @Test
  public void testSubPixelShift()
  {
    Image2D lReference = blobs(64, 64, 0, 0);
    Image2D lMoving = blobs(64, 64, 2.3, -1.7);
    PhaseCorrelation.Peak lPeak = PhaseCorrelation.register(lReference,
                                                            lMoving,
                                                            10);
    assertEquals(2.3, lPeak.getShift()[0], 0.1);
    assertEquals(-1.7, lPeak.getShift()[1], 0.1);
    assertTrue(lPeak.getCorrelation() > 0.8);
  }

  @Test
  public void testSubPixelShiftOfOddSizedImages()
  {
    Image2D lReference = blobs(60, 70, 0, 0);
    Image2D lMoving = blobs(60, 70, -1.4, 3.6);
    double[] lShift = PhaseCorrelation.register(lReference, lMoving, 10)
                                      .getShift();
    assertEquals(-1.4, lShift[0], 0.1);
    assertEquals(3.6, lShift[1], 0.1);
  }

  @Test
  public void testLargeImage()
  {
    Image2D lReference = blobs(257, 190, 0, 0);
    Image2D lMoving = blobs(257, 190, -6.2, 11.5);
    PhaseCorrelation.Peak lPeak = PhaseCorrelation.register(lReference,
                                                            lMoving,
                                                            20);
    assertEquals(-6.2, lPeak.getShift()[0], 0.05);
    assertEquals(11.5, lPeak.getShift()[1], 0.05);
    assertTrue(lPeak.getCorrelation() > 0.8);
  }

  @Test(expected = DegenerateInputException.class)
  public void testSingleRow()
  {
    PhaseCorrelation.register(new Image2D(1, 8), new Image2D(1, 8), 1);
  }

  @Test
  public void testShiftAlignsMovingImage()
  {
    Image2D lReference = blobs(64, 64, 0, 0);
    Image2D lMoving = blobs(64, 64, 4, 2);
    double[] lShift = PhaseCorrelation.register(lReference, lMoving, 1)
                                      .getShift();
    Image2D lAligned = lMoving.shift(lShift[0], lShift[1]);
    assertEquals(lReference.get(30, 40), lAligned.get(30, 40), 1e-5);
  }

  @Test
  public void testNoiseHasWeakPeak()
  {
    Random lRandom = new Random(5);
    Image2D a = new Image2D(64, 64), b = new Image2D(64, 64);
    for (int i = 0; i < a.getData().length; i++)
    {
      a.getData()[i] = (float) lRandom.nextGaussian();
      b.getData()[i] = (float) lRandom.nextGaussian();
    }
    assertTrue(PhaseCorrelation.register(a, b, 10).getCorrelation() < 0.2);
  }

  @Test(expected = ShapeMismatchException.class)
  public void testShapeMismatch()
  {
    PhaseCorrelation.register(new Image2D(8, 8), new Image2D(8, 9), 1);
  }

}
