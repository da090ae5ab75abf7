package fastcalib.calibration;

import java.util.Arrays;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleUnaryOperator;

import fastcalib.ValidationException;

import org.apache.commons.math3.util.ArithmeticUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coarse-to-fine search of a scalar parameter. At each subscale a small grid of
 * trial values spanning one pixel times the subscale on both sides of the
 * current guess is evaluated, the minimum is refined by parabolic
 * interpolation and the subscale is halved, down to 1.
 */
public class ScalarParameterCalibrator
{
  private static final Logger cLogger =
                                      LoggerFactory.getLogger(ScalarParameterCalibrator.class);

  private int mNumberOfTrials = 5;
  private BooleanSupplier mCancel;
  private boolean mDebug = false;

  public double calibrate(double pInitialGuess,
                          DoubleUnaryOperator pCost,
                          double pPixelSize,
                          int pMaxSubscale)
  {
    return calibrate(pInitialGuess,
                     (v, s) -> pCost.applyAsDouble(v),
                     pPixelSize,
                     pMaxSubscale);
  }

  /**
   * Calibrates a parameter
   *
   * @param pInitialGuess
   *          starting value
   * @param pCost
   *          cost function, receives the trial value and the current subscale
   * @param pPixelSize
   *          search step at subscale 1, in parameter units
   * @param pMaxSubscale
   *          first subscale, a positive power of two
   * @return calibrated value
   */
  public double calibrate(double pInitialGuess,
                          ScalarCostFunction pCost,
                          double pPixelSize,
                          int pMaxSubscale)
  {
    if (pMaxSubscale < 1 || !ArithmeticUtils.isPowerOfTwo(pMaxSubscale))
      throw new ValidationException("Subscale factor should be a power of 2, got %d",
                                    pMaxSubscale);

    double lGuess = pInitialGuess;
    log("initial guess {}", lGuess);
    for (int lSubscale = pMaxSubscale; lSubscale >= 1; lSubscale /= 2)
    {
      double lRadius = pPixelSize * lSubscale;
      double[] lValues = linspace(lGuess - lRadius,
                                  lGuess + lRadius,
                                  mNumberOfTrials);
      lGuess = searchGrid(lValues, pCost, lSubscale);
      log("subscale {}: guess {}", lSubscale, lGuess);
    }
    return lGuess;
  }

  public double searchGrid(double[] pValues, DoubleUnaryOperator pCost)
  {
    return searchGrid(pValues, (v, s) -> pCost.applyAsDouble(v), 1);
  }

  /**
   * Evaluates the cost at every trial value and returns the parabolic
   * refinement of the best one
   *
   * @param pValues
   *          trial values, evenly spaced and increasing
   * @param pCost
   *          cost function
   * @param pSubscale
   *          subscale passed to the cost function
   * @return refined minimum
   */
  public double searchGrid(double[] pValues,
                           ScalarCostFunction pCost,
                           int pSubscale)
  {
    if (pValues.length == 0)
      throw new ValidationException("No trial values given");
    double[] lCosts = new double[pValues.length];
    int lBest = 0;
    for (int i = 0; i < pValues.length; i++)
    {
      if (mCancel != null && mCancel.getAsBoolean())
        throw new CancellationException("Calibration cancelled");
      lCosts[i] = pCost.evaluate(pValues[i], pSubscale);
      if (lCosts[i] < lCosts[lBest])
        lBest = i;
    }
    log("trials {} costs {}",
        Arrays.toString(pValues),
        Arrays.toString(lCosts));
    return parabolicMinimum(lCosts, lBest, pValues);
  }

  /**
   * Vertex of the parabola through the minimum and its two neighbours; the
   * grid value itself at the borders of the grid or when the three points do
   * not form a convex parabola
   *
   * @param pCosts
   *          cost values
   * @param pIndex
   *          index of the minimum
   * @param pValues
   *          trial values
   * @return interpolated minimum
   */
  public static double parabolicMinimum(double[] pCosts,
                                        int pIndex,
                                        double[] pValues)
  {
    if (pIndex <= 0 || pIndex >= pCosts.length - 1)
      return pValues[pIndex];

    double x0 = pValues[pIndex - 1], x1 = pValues[pIndex],
        x2 = pValues[pIndex + 1];
    double y0 = pCosts[pIndex - 1], y1 = pCosts[pIndex],
        y2 = pCosts[pIndex + 1];

    double lDenominator = (x0 - x1) * (x0 - x2) * (x1 - x2);
    double A = (x2 * (y1 - y0) + x1 * (y0 - y2) + x0 * (y2 - y1))
               / lDenominator;
    double B = (x2 * x2 * (y0 - y1)
                + x1 * x1 * (y2 - y0)
                + x0 * x0 * (y1 - y2))
               / lDenominator;
    double lVertex = -B / (2 * A);
    if (!(A > 0) || !Double.isFinite(lVertex))
      return x1;
    return lVertex;
  }

  static double[] linspace(double pStart, double pEnd, int pCount)
  {
    double[] lValues = new double[pCount];
    for (int i = 0; i < pCount; i++)
      lValues[i] = pCount == 1 ? pStart
                               : pStart + (pEnd - pStart) * i / (pCount - 1);
    return lValues;
  }

  private void log(String pFormat, Object... pArgs)
  {
    if (mDebug)
      cLogger.info(pFormat, pArgs);
    else
      cLogger.debug(pFormat, pArgs);
  }

  public int getNumberOfTrials()
  {
    return mNumberOfTrials;
  }

  /**
   * Sets the number of trial values per subscale
   *
   * @param pNumberOfTrials
   *          odd number, at least 3
   */
  public void setNumberOfTrials(int pNumberOfTrials)
  {
    assert pNumberOfTrials >= 3 && pNumberOfTrials % 2 == 1;
    mNumberOfTrials = pNumberOfTrials;
  }

  /**
   * Sets the cancellation check polled before each cost evaluation
   *
   * @param pCancel
   *          check, null to disable
   */
  public void setCancel(BooleanSupplier pCancel)
  {
    mCancel = pCancel;
  }

  public void setDebug(boolean pDebug)
  {
    mDebug = pDebug;
  }

}
