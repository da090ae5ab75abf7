package fastcalib.registration;

import java.util.Arrays;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import javax.vecmath.Matrix3d;

import fastcalib.data.Volume;
import fastcalib.data.VolumeOps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the sign and permutation ambiguity of moment-based poses by trying
 * every rotation of a {@link CandidateSet} and keeping the one with the lowest
 * RMS difference. Scoring runs on subsampled and smoothed copies of both
 * volumes.
 */
public class OrientationDisambiguator
{
  private static final Logger cLogger =
                                      LoggerFactory.getLogger(OrientationDisambiguator.class);

  private final RegistrationParameter mParams;

  public OrientationDisambiguator(RegistrationParameter pParams)
  {
    mParams = pParams;
  }

  public FlipSearchResult resolveFlip(Volume pFixed,
                                      Volume pMoving,
                                      Pose pPoseFixed,
                                      Pose pPoseMoving,
                                      boolean pRefine)
  {
    return resolveFlip(pFixed,
                       pMoving,
                       pPoseFixed,
                       pPoseMoving,
                       pRefine,
                       null);
  }

  /**
   * Selects the best relative pose between two moment poses
   *
   * @param pFixed
   *          fixed volume, not modified
   * @param pMoving
   *          moving volume of the same shape, not modified
   * @param pPoseFixed
   *          principal-axes pose of the fixed volume
   * @param pPoseMoving
   *          principal-axes pose of the moving volume
   * @param pRefine
   *          refine every candidate with the parameter's refiner before
   *          scoring it
   * @param pCancel
   *          polled before each candidate and passed to the refiner, may be
   *          null
   * @return winning pose in full-resolution voxels, with all scores
   */
  public FlipSearchResult resolveFlip(Volume pFixed,
                                      Volume pMoving,
                                      Pose pPoseFixed,
                                      Pose pPoseMoving,
                                      boolean pRefine,
                                      BooleanSupplier pCancel)
  {
    VolumeOps.checkSameDimensions(pFixed, pMoving);

    int lSampling = mParams.getFlipSampling();
    double lSmoothing = mParams.getFlipSmoothing();
    Volume lFixed = VolumeOps.gaussianBlur(pFixed.subsample(lSampling),
                                           lSmoothing);
    Volume lMoving = VolumeOps.gaussianBlur(pMoving.subsample(lSampling),
                                            lSmoothing);

    Matrix3d lRotationFixed = pPoseFixed.getRotation();
    Matrix3d lRotationMovingT =
                              AffineMatrix.transpose(pPoseMoving.getRotation());
    double[] lTranslationFixed = pPoseFixed.getTranslation();
    double[] lTranslationMoving = pPoseMoving.getTranslation();

    CandidateSet lCandidates = new CandidateSet(lRotationFixed);
    double[] lScores = new double[lCandidates.size()];
    Pose lBestPose = null;
    int lBestIndex = -1;
    for (int i = 0; i < lCandidates.size(); i++)
    {
      if (pCancel != null && pCancel.getAsBoolean())
        throw new CancellationException(String.format("Orientation search cancelled before candidate %d",
                                                      i));
      Matrix3d R = AffineMatrix.multiply(lRotationMovingT,
                                         lRotationFixed,
                                         lCandidates.get(i));
      double[] lRotated =
                        AffineMatrix.transform(AffineMatrix.transpose(R),
                                               lTranslationMoving);
      double[] T = new double[3];
      for (int k = 0; k < 3; k++)
        T[k] = (lTranslationFixed[k] - lRotated[k]) / lSampling;
      Pose lPose = new Pose(R, T);

      if (pRefine)
      {
        RefinementResult lRefined = mParams.getRefiner()
                                           .refine(lFixed,
                                                   lMoving,
                                                   lPose,
                                                   mParams.getFlipSchedule(),
                                                   pCancel);
        if (lRefined.isImproved())
          lPose = lRefined.getPose();
      }

      lScores[i] = VolumeOps.l2Norm(lFixed, lPose.apply(lMoving));
      log("candidate {}: score {}", i, lScores[i]);
      if (lBestPose == null || lScores[i] < lScores[lBestIndex])
      {
        lBestPose = lPose;
        lBestIndex = i;
      }
    }

    log("selected candidate {} of {}", lBestIndex, Arrays.toString(lScores));
    return new FlipSearchResult(lBestPose.scaleTranslation(lSampling),
                                lBestIndex,
                                lScores);
  }

  private void log(String pFormat, Object... pArgs)
  {
    if (mParams.getDebug())
      cLogger.info(pFormat, pArgs);
    else
      cLogger.debug(pFormat, pArgs);
  }

}
