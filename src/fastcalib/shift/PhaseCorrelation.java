package fastcalib.shift;

import fastcalib.DegenerateInputException;
import fastcalib.ShapeMismatchException;
import fastcalib.data.Image2D;

import org.apache.commons.math3.util.FastMath;
import org.jtransforms.fft.DoubleFFT_2D;

/**
 * Sub-pixel translation between two images from the peak of their
 * cross-correlation (Guizar-Sicairos et al., 2008). The integer peak comes from
 * an FFT, the sub-pixel peak from a matrix-multiply DFT upsampled in a 1.5
 * pixel neighbourhood of it.
 */
public class PhaseCorrelation
{

  /**
   * Correlation peak: shift and its normalized correlation
   */
  public static class Peak
  {
    private final double[] mShift;
    private final double mCorrelation;

    public Peak(double[] pShift, double pCorrelation)
    {
      mShift = pShift;
      mCorrelation = pCorrelation;
    }

    /**
     * @return (rows, columns) shift that aligns the moving image to the
     *         reference when applied to the moving image
     */
    public double[] getShift()
    {
      return mShift.clone();
    }

    /**
     * @return cross-correlation at the peak divided by the product of the
     *         image norms, in [0, 1]
     */
    public double getCorrelation()
    {
      return mCorrelation;
    }
  }

  /**
   * Registers a moving image to a reference image of the same size
   *
   * @param pReference
   *          reference image
   * @param pMoving
   *          moving image
   * @param pUpsampling
   *          sub-pixel resolution is 1/upsampling, 1 for integer shifts
   * @return peak
   * @throws DegenerateInputException
   *           when either dimension is below 2
   */
  public static Peak register(Image2D pReference,
                              Image2D pMoving,
                              int pUpsampling)
  {
    if (!pReference.hasSameDimensions(pMoving))
      throw new ShapeMismatchException("Cannot correlate %s with %s",
                                       pReference,
                                       pMoving);
    assert pUpsampling >= 1;

    int lRows = pReference.getRows(), lColumns = pReference.getColumns();
    if (lRows < 2 || lColumns < 2)
      throw new DegenerateInputException("Cannot correlate images of shape (%d, %d)",
                                         lRows,
                                         lColumns);
    DoubleFFT_2D lFFT = new DoubleFFT_2D(lRows, lColumns);
    double[][] lReferenceSpectrum = toInterleaved(pReference);
    double[][] lMovingSpectrum = toInterleaved(pMoving);
    lFFT.complexForward(lReferenceSpectrum);
    lFFT.complexForward(lMovingSpectrum);

    // cross power spectrum F_ref * conj(F_mov), interleaved
    double[][] lProduct = new double[lRows][2 * lColumns];
    for (int r = 0; r < lRows; r++)
      for (int c = 0; c < lColumns; c++)
      {
        double a = lReferenceSpectrum[r][2 * c],
            b = lReferenceSpectrum[r][2 * c + 1];
        double x = lMovingSpectrum[r][2 * c],
            y = -lMovingSpectrum[r][2 * c + 1];
        lProduct[r][2 * c] = a * x - b * y;
        lProduct[r][2 * c + 1] = a * y + b * x;
      }

    double[][] lCorrelation = copy(lProduct);
    lFFT.complexInverse(lCorrelation, true);

    int lPeakRow = 0, lPeakColumn = 0;
    double lPeakMagnitude = -1;
    for (int r = 0; r < lRows; r++)
      for (int c = 0; c < lColumns; c++)
      {
        double lMagnitude = FastMath.hypot(lCorrelation[r][2 * c],
                                           lCorrelation[r][2 * c + 1]);
        if (lMagnitude > lPeakMagnitude)
        {
          lPeakMagnitude = lMagnitude;
          lPeakRow = r;
          lPeakColumn = c;
        }
      }

    double[] lShift =
    { lPeakRow > lRows / 2 ? lPeakRow - lRows : lPeakRow,
      lPeakColumn > lColumns / 2 ? lPeakColumn - lColumns
                                 : lPeakColumn };

    if (pUpsampling > 1)
    {
      int lRegion = (int) Math.ceil(pUpsampling * 1.5);
      int lCenter = lRegion / 2;
      double[][] lUpRe = new double[lRegion][lRegion];
      double[][] lUpIm = new double[lRegion][lRegion];
      upsampledCorrelation(lProduct,
                           lShift,
                           pUpsampling,
                           lCenter,
                           lUpRe,
                           lUpIm);
      int lBestRow = 0, lBestColumn = 0;
      double lBest = -1;
      for (int i = 0; i < lRegion; i++)
        for (int j = 0; j < lRegion; j++)
        {
          double lMagnitude = FastMath.hypot(lUpRe[i][j], lUpIm[i][j]);
          if (lMagnitude > lBest)
          {
            lBest = lMagnitude;
            lBestRow = i;
            lBestColumn = j;
          }
        }
      lShift[0] += (double) (lBestRow - lCenter) / pUpsampling;
      lShift[1] += (double) (lBestColumn - lCenter) / pUpsampling;
      lPeakMagnitude = lBest / ((double) lRows * lColumns);
    }

    double lNorm = Math.sqrt(pReference.sumOfSquares()
                             * pMoving.sumOfSquares());
    return new Peak(lShift, lNorm > 0 ? lPeakMagnitude / lNorm : 0);
  }

  // c(p, q) = sum_k P(k) exp(+2 pi i k . r / n) with r = shift + (p - center) /
  // upsampling, evaluated separably
  private static void upsampledCorrelation(double[][] pProduct,
                                           double[] pShift,
                                           int pUpsampling,
                                           int pCenter,
                                           double[][] pOutRe,
                                           double[][] pOutIm)
  {
    int lRows = pProduct.length, lColumns = pProduct[0].length / 2;
    int lRegion = pOutRe.length;

    double[][] lTmpRe = new double[lRows][lRegion];
    double[][] lTmpIm = new double[lRows][lRegion];
    for (int q = 0; q < lRegion; q++)
    {
      double lOffset = pShift[1] + (double) (q - pCenter) / pUpsampling;
      for (int kc = 0; kc < lColumns; kc++)
      {
        double lAngle = 2 * Math.PI
                        * frequency(kc, lColumns)
                        * lOffset
                        / lColumns;
        double lCos = FastMath.cos(lAngle), lSin = FastMath.sin(lAngle);
        for (int kr = 0; kr < lRows; kr++)
        {
          double lRe = pProduct[kr][2 * kc], lIm = pProduct[kr][2 * kc + 1];
          lTmpRe[kr][q] += lRe * lCos - lIm * lSin;
          lTmpIm[kr][q] += lRe * lSin + lIm * lCos;
        }
      }
    }

    for (int p = 0; p < lRegion; p++)
    {
      double lOffset = pShift[0] + (double) (p - pCenter) / pUpsampling;
      for (int kr = 0; kr < lRows; kr++)
      {
        double lAngle = 2 * Math.PI
                        * frequency(kr, lRows)
                        * lOffset
                        / lRows;
        double lCos = FastMath.cos(lAngle), lSin = FastMath.sin(lAngle);
        for (int q = 0; q < lRegion; q++)
        {
          pOutRe[p][q] += lTmpRe[kr][q] * lCos - lTmpIm[kr][q] * lSin;
          pOutIm[p][q] += lTmpRe[kr][q] * lSin + lTmpIm[kr][q] * lCos;
        }
      }
    }
  }

  // signed frequency of a DFT bin, in [-n/2, n/2)
  private static int frequency(int k, int n)
  {
    return ((k + n / 2) % n) - n / 2;
  }

  // real image as rows of interleaved (re, im) pairs
  private static double[][] toInterleaved(Image2D pImage)
  {
    double[][] lArray = new double[pImage.getRows()][2 * pImage.getColumns()];
    for (int r = 0; r < pImage.getRows(); r++)
      for (int c = 0; c < pImage.getColumns(); c++)
        lArray[r][2 * c] = pImage.get(r, c);
    return lArray;
  }

  private static double[][] copy(double[][] pArray)
  {
    double[][] lCopy = new double[pArray.length][];
    for (int i = 0; i < pArray.length; i++)
      lCopy[i] = pArray[i].clone();
    return lCopy;
  }

}
