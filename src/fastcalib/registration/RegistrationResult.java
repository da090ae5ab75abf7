package fastcalib.registration;

import java.util.Arrays;

/**
 * Pose found by {@link VolumeRegistration} with the RMS differences measured
 * along the way
 */
public class RegistrationResult
{
  private final Pose mPose;
  private final double mL2Before, mL2AfterMoments, mL2After;
  private final double[] mEulerAngles;

  public RegistrationResult(Pose pPose,
                            double pL2Before,
                            double pL2AfterMoments,
                            double pL2After)
  {
    mPose = pPose;
    mL2Before = pL2Before;
    mL2AfterMoments = pL2AfterMoments;
    mL2After = pL2After;
    mEulerAngles = pPose.getEulerAngles();
  }

  /**
   * @return pose with the translation in full-resolution voxels
   */
  public Pose getPose()
  {
    return mPose;
  }

  public double getL2Before()
  {
    return mL2Before;
  }

  public double getL2AfterMoments()
  {
    return mL2AfterMoments;
  }

  public double getL2After()
  {
    return mL2After;
  }

  /**
   * @return XYZ Cardan angles of the rotation, in degrees
   */
  public double[] getEulerAngles()
  {
    return mEulerAngles.clone();
  }

  @Override
  public String toString()
  {
    return String.format("RegistrationResult(%s, L2 %g -> %g -> %g, angles = %s)",
                         mPose,
                         mL2Before,
                         mL2AfterMoments,
                         mL2After,
                         Arrays.toString(mEulerAngles));
  }

}
