package fastcalib.registration;

import java.util.function.BooleanSupplier;

import fastcalib.DegenerateInputException;
import fastcalib.data.Volume;
import fastcalib.data.VolumeOps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rigid registration of two volumes: optional Otsu background suppression,
 * principal-axes alignment with orientation search, then multi-scale
 * refinement. The input volumes are only read.
 */
public class VolumeRegistration
{
  private static final Logger cLogger =
                                      LoggerFactory.getLogger(VolumeRegistration.class);

  private final RegistrationParameter mParams;

  public VolumeRegistration()
  {
    this(new RegistrationSettings());
  }

  public VolumeRegistration(RegistrationParameter pParams)
  {
    mParams = pParams;
  }

  public RegistrationParameter getParameters()
  {
    return mParams;
  }

  public RegistrationResult register(Volume pFixed, Volume pMoving)
  {
    return register(pFixed, pMoving, null);
  }

  /**
   * Finds the pose that maps the moving volume onto the fixed one
   *
   * @param pFixed
   *          fixed volume
   * @param pMoving
   *          moving volume, same shape as the fixed one
   * @param pCancel
   *          cancellation check passed to the orientation search and the
   *          refiner, may be null
   * @return pose and residuals
   */
  public RegistrationResult register(Volume pFixed,
                                     Volume pMoving,
                                     BooleanSupplier pCancel)
  {
    VolumeOps.checkSameDimensions(pFixed, pMoving);

    int lSubsample = mParams.getSubsample();
    Volume lFixed = pFixed.subsample(lSubsample);
    Volume lMoving = pMoving.subsample(lSubsample);

    if (mParams.getThresholdMode() == ThresholdMode.Otsu)
      threshold(lFixed, lMoving);

    double lL2Before = VolumeOps.l2Norm(lFixed, lMoving);
    log("L2 before registration: {}", lL2Before);

    Pose lPose = Pose.identity();
    if (mParams.getUseMoments())
    {
      Pose lPoseFixed = MomentEstimator.estimatePose(lFixed, 1);
      Pose lPoseMoving = MomentEstimator.estimatePose(lMoving, 1);
      log("moments fixed {}, moving {}", lPoseFixed, lPoseMoving);
      FlipSearchResult lFlip =
                             new OrientationDisambiguator(mParams).resolveFlip(lFixed,
                                                                               lMoving,
                                                                               lPoseFixed,
                                                                               lPoseMoving,
                                                                               mParams.getUseFlipSearch(),
                                                                               pCancel);
      lPose = lFlip.getPose();
    }
    double lL2AfterMoments = VolumeOps.l2Norm(lFixed,
                                              lPose.apply(lMoving));
    log("L2 after moments: {}", lL2AfterMoments);

    double lL2After = lL2AfterMoments;
    if (mParams.getUseRefine())
    {
      RefinementResult lRefined =
                                mParams.getRefiner()
                                       .refine(lFixed,
                                               lMoving,
                                               lPose,
                                               mParams.getRefineSchedule(),
                                               pCancel);
      if (lRefined.isImproved())
      {
        lPose = lRefined.getPose();
        lL2After = lRefined.getResidual();
      }
    }
    log("L2 after registration: {}", lL2After);

    return new RegistrationResult(lPose.scaleTranslation(lSubsample),
                                  lL2Before,
                                  lL2AfterMoments,
                                  lL2After);
  }

  private void threshold(Volume pFixed, Volume pMoving)
  {
    try
    {
      double lThreshold =
                        VolumeOps.otsuThreshold(mParams.getThresholdStride(),
                                                pFixed,
                                                pMoving);
      log("Otsu threshold: {}", lThreshold);
      VolumeOps.applyThreshold(pFixed, lThreshold);
      VolumeOps.applyThreshold(pMoving, lThreshold);
    }
    catch (DegenerateInputException e)
    {
      cLogger.warn("Skipping background threshold: {}", e.getMessage());
    }
  }

  private void log(String pFormat, Object... pArgs)
  {
    if (mParams.getDebug())
      cLogger.info(pFormat, pArgs);
    else
      cLogger.debug(pFormat, pArgs);
  }

}
