package fastcalib.registration;

/**
 * Default registration parameters, each of which can be changed with a
 * setter. Instances are passed explicitly to {@link VolumeRegistration}.
 */
public class RegistrationSettings implements RegistrationParameter
{
  private int mSubsample = 2;
  private boolean mUseMoments = true;
  private boolean mUseRefine = true;
  private boolean mUseFlipSearch = false;
  private ThresholdMode mThresholdMode = ThresholdMode.Otsu;
  private int mFlipSampling = 2;
  private double mFlipSmoothing = 2;
  private RefinementSchedule mFlipSchedule = RefinementSchedule.coarse();
  private RefinementSchedule mRefineSchedule = RefinementSchedule.fine();
  private ContinuousRefiner mRefiner = new BOBYQARefiner();
  private boolean mDebug = false;

  @Override
  public int getSubsample()
  {
    return mSubsample;
  }

  /**
   * Sets the stride applied to both volumes before anything else
   *
   * @param pSubsample
   *          stride, at least 1
   */
  public void setSubsample(int pSubsample)
  {
    assert pSubsample >= 1;
    mSubsample = pSubsample;
  }

  @Override
  public boolean getUseMoments()
  {
    return mUseMoments;
  }

  public void setUseMoments(boolean pUseMoments)
  {
    mUseMoments = pUseMoments;
  }

  @Override
  public boolean getUseRefine()
  {
    return mUseRefine;
  }

  public void setUseRefine(boolean pUseRefine)
  {
    mUseRefine = pUseRefine;
  }

  @Override
  public boolean getUseFlipSearch()
  {
    return mUseFlipSearch;
  }

  /**
   * Enables the refinement of every orientation candidate before scoring it
   *
   * @param pUseFlipSearch
   *          true to refine candidates
   */
  public void setUseFlipSearch(boolean pUseFlipSearch)
  {
    mUseFlipSearch = pUseFlipSearch;
  }

  @Override
  public ThresholdMode getThresholdMode()
  {
    return mThresholdMode;
  }

  public void setThresholdMode(ThresholdMode pThresholdMode)
  {
    assert pThresholdMode != null;
    mThresholdMode = pThresholdMode;
  }

  @Override
  public int getFlipSampling()
  {
    return mFlipSampling;
  }

  public void setFlipSampling(int pFlipSampling)
  {
    assert pFlipSampling >= 1;
    mFlipSampling = pFlipSampling;
  }

  @Override
  public double getFlipSmoothing()
  {
    return mFlipSmoothing;
  }

  public void setFlipSmoothing(double pFlipSmoothing)
  {
    assert pFlipSmoothing >= 0;
    mFlipSmoothing = pFlipSmoothing;
  }

  @Override
  public RefinementSchedule getFlipSchedule()
  {
    return mFlipSchedule;
  }

  public void setFlipSchedule(RefinementSchedule pFlipSchedule)
  {
    assert pFlipSchedule != null;
    mFlipSchedule = pFlipSchedule;
  }

  @Override
  public RefinementSchedule getRefineSchedule()
  {
    return mRefineSchedule;
  }

  public void setRefineSchedule(RefinementSchedule pRefineSchedule)
  {
    assert pRefineSchedule != null;
    mRefineSchedule = pRefineSchedule;
  }

  @Override
  public ContinuousRefiner getRefiner()
  {
    return mRefiner;
  }

  public void setRefiner(ContinuousRefiner pRefiner)
  {
    assert pRefiner != null;
    mRefiner = pRefiner;
  }

  @Override
  public boolean getDebug()
  {
    return mDebug;
  }

  /**
   * Raises per-step diagnostics from DEBUG to INFO
   *
   * @param pDebug
   *          true to log diagnostics at INFO level
   */
  public void setDebug(boolean pDebug)
  {
    mDebug = pDebug;
  }

}
