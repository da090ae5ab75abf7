package fastcalib.registration;

import java.util.function.BooleanSupplier;

import fastcalib.data.Volume;

/**
 * Local continuous optimization of a rigid pose
 */
public interface ContinuousRefiner
{

  /**
   * Refines a pose so that the moving volume posed by it matches the fixed
   * volume better. Implementations must not modify the input volumes and must
   * return the initial pose, flagged as not improved, when they fail to lower
   * the residual.
   *
   * @param pFixed
   *          fixed volume
   * @param pMoving
   *          moving volume of the same shape
   * @param pInitialPose
   *          starting pose
   * @param pSchedule
   *          resolution levels, coarse to fine
   * @param pCancel
   *          polled between levels, may be null
   * @return refined pose with its residual
   */
  RefinementResult refine(Volume pFixed,
                          Volume pMoving,
                          Pose pInitialPose,
                          RefinementSchedule pSchedule,
                          BooleanSupplier pCancel);

  default RefinementResult refine(Volume pFixed,
                                  Volume pMoving,
                                  Pose pInitialPose,
                                  RefinementSchedule pSchedule)
  {
    return refine(pFixed, pMoving, pInitialPose, pSchedule, null);
  }

}
