package fastcalib.registration;

/**
 * Winning orientation candidate together with the scores of all candidates
 */
public class FlipSearchResult
{
  private final Pose mPose;
  private final int mIndex;
  private final double[] mScores;

  public FlipSearchResult(Pose pPose, int pIndex, double[] pScores)
  {
    mPose = pPose;
    mIndex = pIndex;
    mScores = pScores.clone();
  }

  public Pose getPose()
  {
    return mPose;
  }

  public int getIndex()
  {
    return mIndex;
  }

  public double[] getScores()
  {
    return mScores.clone();
  }

  public double getBestScore()
  {
    return mScores[mIndex];
  }

}
