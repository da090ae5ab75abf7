package fastcalib.calibration;

import fastcalib.data.Image2D;
import fastcalib.data.Volume;

/**
 * Sharpness of a reconstruction: sum over Z slices of the mean squared
 * gradient magnitude of the pixels where it is positive. Gradients are central
 * differences in the interior and one-sided differences at the borders.
 */
public class GradientEnergyMetric
{

  public static double compute(Volume pVolume)
  {
    double lEnergy = 0;
    for (int z = 0; z < pVolume.getDepth(); z++)
      lEnergy += compute(pVolume.getSlice(0, z));
    return lEnergy;
  }

  /**
   * Mean positive squared gradient magnitude of an image
   *
   * @param pImage
   *          image
   * @return mean, 0 if the image is flat
   */
  public static double compute(Image2D pImage)
  {
    int lRows = pImage.getRows(), lColumns = pImage.getColumns();
    double lSum = 0;
    long lCount = 0;
    for (int r = 0; r < lRows; r++)
      for (int c = 0; c < lColumns; c++)
      {
        double gr = derivative(pImage, r, c, true);
        double gc = derivative(pImage, r, c, false);
        double g = gr * gr + gc * gc;
        if (g > 0)
        {
          lSum += g;
          lCount++;
        }
      }
    return lCount > 0 ? lSum / lCount : 0;
  }

  private static double derivative(Image2D pImage,
                                   int r,
                                   int c,
                                   boolean pAlongRows)
  {
    int n = pAlongRows ? pImage.getRows() : pImage.getColumns();
    int i = pAlongRows ? r : c;
    if (n < 2)
      return 0;
    int lLow = Math.max(i - 1, 0), lHigh = Math.min(i + 1, n - 1);
    double lLowValue = pAlongRows ? pImage.get(lLow, c) : pImage.get(r, lLow);
    double lHighValue = pAlongRows ? pImage.get(lHigh, c)
                                   : pImage.get(r, lHigh);
    return (lHighValue - lLowValue) / (lHigh - lLow);
  }

}
