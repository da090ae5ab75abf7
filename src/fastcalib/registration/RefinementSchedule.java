package fastcalib.registration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import fastcalib.ValidationException;

/**
 * Ordered resolution levels of a multi-scale refinement, coarse to fine
 */
public class RefinementSchedule
{
  /**
   * One pyramid level: subsampling stride and Gaussian sigma (in voxels of the
   * full-resolution volume) applied before subsampling
   */
  public static class Level
  {
    private final int mShrink;
    private final double mSmoothing;

    public Level(int pShrink, double pSmoothing)
    {
      if (pShrink < 1 || pSmoothing < 0)
        throw new ValidationException("Invalid refinement level (shrink = %d, smoothing = %g)",
                                      pShrink,
                                      pSmoothing);
      mShrink = pShrink;
      mSmoothing = pSmoothing;
    }

    public int getShrink()
    {
      return mShrink;
    }

    public double getSmoothing()
    {
      return mSmoothing;
    }

    @Override
    public String toString()
    {
      return String.format("(%d, %g)", mShrink, mSmoothing);
    }
  }

  private final List<Level> mLevels;

  public RefinementSchedule(List<Level> pLevels)
  {
    if (pLevels.isEmpty())
      throw new ValidationException("A refinement schedule needs at least one level");
    mLevels = Collections.unmodifiableList(new ArrayList<>(pLevels));
  }

  /**
   * Builds a schedule from alternating shrink and smoothing values
   *
   * @param pShrinkAndSmoothing
   *          shrink0, smoothing0, shrink1, smoothing1, ...
   * @return schedule
   */
  public static RefinementSchedule of(double... pShrinkAndSmoothing)
  {
    if (pShrinkAndSmoothing.length % 2 != 0)
      throw new ValidationException("Expected (shrink, smoothing) pairs, got %d values",
                                    pShrinkAndSmoothing.length);
    List<Level> lLevels = new ArrayList<>();
    for (int i = 0; i < pShrinkAndSmoothing.length; i += 2)
      lLevels.add(new Level((int) pShrinkAndSmoothing[i],
                            pShrinkAndSmoothing[i + 1]));
    return new RefinementSchedule(lLevels);
  }

  /**
   * Single level used when refining flip candidates
   *
   * @return [(2, 4)]
   */
  public static RefinementSchedule coarse()
  {
    return of(2, 4);
  }

  public static RefinementSchedule standard()
  {
    return of(4, 8, 2, 4, 1, 2, 1, 0);
  }

  public static RefinementSchedule fine()
  {
    return of(8, 8, 2, 2, 1, 0);
  }

  public List<Level> getLevels()
  {
    return mLevels;
  }

  @Override
  public String toString()
  {
    return "RefinementSchedule" + mLevels;
  }

}
