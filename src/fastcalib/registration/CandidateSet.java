package fastcalib.registration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.vecmath.Matrix3d;

/**
 * The ten rotations tried to resolve the orientation of principal axes:
 * identity, then rotations by 90, 180 and 270 degrees about each principal
 * axis of the fixed volume, axis by axis.
 */
public class CandidateSet
{
  public static final int cNumberOfCandidates = 10;

  private final List<Matrix3d> mCandidates;

  /**
   * Builds the candidates from a principal-axes rotation
   *
   * @param pPrincipalAxes
   *          rotation whose rows are the principal axes
   */
  public CandidateSet(Matrix3d pPrincipalAxes)
  {
    List<Matrix3d> lCandidates = new ArrayList<>(cNumberOfCandidates);
    lCandidates.add(AffineMatrix.identity());
    for (int i = 0; i < 3; i++)
      for (int j = 1; j <= 3; j++)
        lCandidates.add(AffineMatrix.axisAngle(AffineMatrix.row(pPrincipalAxes,
                                                                i),
                                               j * Math.PI / 2));
    mCandidates = Collections.unmodifiableList(lCandidates);
  }

  public int size()
  {
    return mCandidates.size();
  }

  public Matrix3d get(int pIndex)
  {
    return new Matrix3d(mCandidates.get(pIndex));
  }

  /**
   * @return copies of all candidates, identity first
   */
  public List<Matrix3d> getCandidates()
  {
    List<Matrix3d> lCopies = new ArrayList<>(mCandidates.size());
    for (Matrix3d lCandidate : mCandidates)
      lCopies.add(new Matrix3d(lCandidate));
    return lCopies;
  }

}
