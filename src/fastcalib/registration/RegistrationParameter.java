package fastcalib.registration;

/**
 * Interface for registration parameters
 */
public interface RegistrationParameter
{

  public int getSubsample();

  public boolean getUseMoments();

  public boolean getUseRefine();

  public boolean getUseFlipSearch();

  public ThresholdMode getThresholdMode();

  public int getFlipSampling();

  public double getFlipSmoothing();

  public RefinementSchedule getFlipSchedule();

  public RefinementSchedule getRefineSchedule();

  public ContinuousRefiner getRefiner();

  public boolean getDebug();

  public default int getThresholdStride()
  {
    return 2;
  }

}
