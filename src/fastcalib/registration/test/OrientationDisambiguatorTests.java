package fastcalib.registration.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import javax.vecmath.Matrix3d;

import fastcalib.data.Volume;
import fastcalib.registration.AffineMatrix;
import fastcalib.registration.CandidateSet;
import fastcalib.registration.FlipSearchResult;
import fastcalib.registration.MomentEstimator;
import fastcalib.registration.OrientationDisambiguator;
import fastcalib.registration.Pose;
import fastcalib.registration.RegistrationSettings;

import org.junit.Test;

/**
 * Orientation disambiguator tests
 */
public class OrientationDisambiguatorTests
{

  @Test
  public void testCandidateSet()
  {
    CandidateSet lCandidates =
                             new CandidateSet(AffineMatrix.rotation(20,
                                                                    0,
                                                                    35));
    assertEquals(10, lCandidates.size());
    assertEquals(0,
                 AffineMatrix.angleBetween(lCandidates.get(0),
                                           AffineMatrix.identity()),
                 1e-9);
    for (int i = 0; i < 3; i++)
      for (int j = 1; j <= 3; j++)
        assertEquals(j == 2 ? 180 : 90,
                     AffineMatrix.angleBetween(lCandidates.get(1 + 3 * i
                                                               + j - 1),
                                               AffineMatrix.identity()),
                     1e-6);
  }

  @Test
  public void testSelectsPlantedFlip()
  {
    // half turn about Y plus a shift
    Matrix3d M = new Matrix3d(-1, 0, 0, 0, 1, 0, 0, 0, -1);
    double[] k =
    { 2, -1, 3 };
    Volume lFixed = Phantoms.ellipsoid(48);
    Volume lMoving = Phantoms.ellipsoid(48, M, k);

    Pose lPoseFixed = MomentEstimator.estimatePose(lFixed, 1);
    Pose lPoseMoving = MomentEstimator.estimatePose(lMoving, 1);

    FlipSearchResult lResult =
                             new OrientationDisambiguator(new RegistrationSettings()).resolveFlip(lFixed,
                                                                                                  lMoving,
                                                                                                  lPoseFixed,
                                                                                                  lPoseMoving,
                                                                                                  false);

    double[] lScores = lResult.getScores();
    assertEquals(10, lScores.length);
    assertEquals(Arrays.stream(lScores).min().getAsDouble(),
                 lResult.getBestScore(),
                 0);

    Pose lPose = lResult.getPose();
    assertEquals(0,
                 AffineMatrix.angleBetween(lPose.getRotation(),
                                           AffineMatrix.transpose(M)),
                 1);
    double[] T = lPose.getTranslation();
    for (int i = 0; i < 3; i++)
      assertEquals(k[i], T[i], 0.5);
  }

  @Test
  public void testUniformVolumesKeepFirstCandidate()
  {
    Volume lVolume = new Volume(9, 9, 9);
    Arrays.fill(lVolume.getData(), 1);
    FlipSearchResult lResult =
                             new OrientationDisambiguator(new RegistrationSettings()).resolveFlip(lVolume,
                                                                                                  lVolume.copy(),
                                                                                                  Pose.identity(),
                                                                                                  Pose.identity(),
                                                                                                  false);
    assertEquals(0, lResult.getIndex());
    assertEquals(0, lResult.getBestScore(), 0);
  }

  @Test
  public void testCandidatesAreCopies()
  {
    CandidateSet lCandidates = new CandidateSet(AffineMatrix.identity());
    List<Matrix3d> lList = lCandidates.getCandidates();
    assertEquals(10, lList.size());
    lList.get(0).setZero();
    lCandidates.get(1).setZero();
    assertEquals(0,
                 AffineMatrix.angleBetween(lCandidates.get(0),
                                           AffineMatrix.identity()),
                 1e-9);
    assertEquals(90,
                 AffineMatrix.angleBetween(lCandidates.getCandidates()
                                                      .get(1),
                                           AffineMatrix.identity()),
                 1e-6);
  }

  @Test
  public void testCancellationReachesCandidateRefinement()
  {
    Volume lVolume = Phantoms.ellipsoid(16);
    AtomicInteger lPolls = new AtomicInteger();
    try
    {
      new OrientationDisambiguator(new RegistrationSettings()).resolveFlip(lVolume,
                                                                           lVolume.copy(),
                                                                           Pose.identity(),
                                                                           Pose.identity(),
                                                                           true,
                                                                           () -> lPolls.incrementAndGet() >= 3);
      fail("orientation search should have been cancelled");
    }
    catch (CancellationException e)
    {
      // candidate 0, its single refinement level, candidate 1
      assertEquals(3, lPolls.get());
    }
  }

}
