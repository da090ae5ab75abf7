package fastcalib.registration;

/**
 * Outcome of a {@link ContinuousRefiner} run
 */
public class RefinementResult
{
  private final Pose mPose;
  private final double mResidual;
  private final boolean mImproved;

  public RefinementResult(Pose pPose, double pResidual, boolean pImproved)
  {
    mPose = pPose;
    mResidual = pResidual;
    mImproved = pImproved;
  }

  public Pose getPose()
  {
    return mPose;
  }

  /**
   * @return RMS difference at full resolution for the returned pose
   */
  public double getResidual()
  {
    return mResidual;
  }

  /**
   * @return false if the refiner could not lower the residual of the initial
   *         pose, in which case the initial pose is returned
   */
  public boolean isImproved()
  {
    return mImproved;
  }

  @Override
  public String toString()
  {
    return String.format("RefinementResult(%s, residual = %g, improved = %s)",
                         mPose,
                         mResidual,
                         mImproved);
  }

}
