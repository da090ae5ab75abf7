package fastcalib.calibration;

import fastcalib.DegenerateInputException;
import fastcalib.data.Volume;
import fastcalib.geometry.Geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the horizontal offset of the rotation axis by maximizing the sharpness
 * of reconstructions. A subscale larger than the expected error (8 or 16)
 * usually makes the search robust when the initial guess is poor.
 */
public class RotationAxisCalibration
{
  private static final Logger cLogger =
                                      LoggerFactory.getLogger(RotationAxisCalibration.class);

  private final ReconstructionOperator mOperator;
  private final ScalarParameterCalibrator mCalibrator;

  public RotationAxisCalibration(ReconstructionOperator pOperator)
  {
    this(pOperator, new ScalarParameterCalibrator());
  }

  public RotationAxisCalibration(ReconstructionOperator pOperator,
                                 ScalarParameterCalibrator pCalibrator)
  {
    mOperator = pOperator;
    mCalibrator = pCalibrator;
  }

  /**
   * Calibrates the rotation axis offset
   *
   * @param pProjections
   *          projection stack (rows, angles, columns)
   * @param pGeometry
   *          acquisition geometry, not modified
   * @param pGuess
   *          initial guess in mm, null to start from the geometry or from the
   *          centre of mass
   * @param pMaxSubscale
   *          first subscale, a power of two
   * @param pUseCentreOfMass
   *          without a guess, start from the centre of squared mass of the
   *          projections instead of the geometry's axs_hrz
   * @return calibrated axs_hrz in mm
   */
  public double optimizeRotationCenter(Volume pProjections,
                                       Geometry pGeometry,
                                       Double pGuess,
                                       int pMaxSubscale,
                                       boolean pUseCentreOfMass)
  {
    double lGuess;
    if (pGuess != null)
      lGuess = pGuess;
    else if (pUseCentreOfMass)
      lGuess = (centreOfMassColumn(pProjections)
                - pProjections.getWidth() / 2)
               * pGeometry.getScalar(Geometry.DET_PIXEL);
    else
      lGuess = pGeometry.getScalar(Geometry.AXS_HRZ, 0);
    cLogger.info("Initial guess for the rotation axis offset: {} mm", lGuess);

    ReconstructionSharpnessCost lCost =
                                      new ReconstructionSharpnessCost(mOperator,
                                                                      pProjections,
                                                                      pGeometry,
                                                                      Geometry.AXS_HRZ);
    double lResult =
                   mCalibrator.calibrate(lGuess,
                                         lCost,
                                         pGeometry.getScalar(Geometry.IMG_PIXEL),
                                         pMaxSubscale);
    cLogger.info("Rotation axis offset: {} mm", lResult);
    return lResult;
  }

  /**
   * Column of the centre of squared mass, computed on every second voxel
   *
   * @param pProjections
   *          projection stack
   * @return column coordinate in full-resolution pixels
   */
  public static double centreOfMassColumn(Volume pProjections)
  {
    Volume lSampled = pProjections.subsample(2);
    double lMass = 0, lMoment = 0;
    for (int z = 0; z < lSampled.getDepth(); z++)
      for (int y = 0; y < lSampled.getHeight(); y++)
        for (int x = 0; x < lSampled.getWidth(); x++)
        {
          double v = lSampled.get(z, y, x);
          lMass += v * v;
          lMoment += v * v * x;
        }
    if (!(lMass > 0))
      throw new DegenerateInputException("Projections %s carry no signal",
                                         pProjections);
    return lMoment / lMass * 2;
  }

}
