package fastcalib.registration.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.CancellationException;

import fastcalib.data.Volume;
import fastcalib.data.VolumeOps;
import fastcalib.registration.AffineMatrix;
import fastcalib.registration.BOBYQARefiner;
import fastcalib.registration.Pose;
import fastcalib.registration.RefinementResult;
import fastcalib.registration.RefinementSchedule;

import org.junit.Test;

/**
 * BOBYQA refiner tests
 */
public class BOBYQARefinerTests
{

  @Test
  public void testRecoversTranslation()
  {
    double[] k =
    { 1.5, -1, 2 };
    Volume lFixed = Phantoms.smooth(Phantoms.ellipsoid(32), 1.5);
    Volume lMoving =
                   Phantoms.smooth(Phantoms.ellipsoid(32,
                                                      AffineMatrix.identity(),
                                                      k),
                                   1.5);

    BOBYQARefiner lRefiner = new BOBYQARefiner();
    RefinementResult lResult = lRefiner.refine(lFixed,
                                               lMoving,
                                               Pose.identity(),
                                               RefinementSchedule.of(2,
                                                                     1,
                                                                     1,
                                                                     0));
    assertTrue(lResult.isImproved());
    double[] T = lResult.getPose().getTranslation();
    for (int i = 0; i < 3; i++)
      assertEquals(k[i], T[i], 0.5);
    assertTrue(lResult.getResidual() < VolumeOps.l2Norm(lFixed, lMoving));
    assertTrue(lResult.getPose().isOrthonormal(1e-6));
  }

  @Test
  public void testKeepsOptimalPose()
  {
    Volume lVolume = Phantoms.smooth(Phantoms.ellipsoid(16), 1);
    BOBYQARefiner lRefiner = new BOBYQARefiner();
    lRefiner.setMaxNumberOfEvaluations(50);
    Pose lInitial = Pose.identity();
    RefinementResult lResult = lRefiner.refine(lVolume,
                                               lVolume.copy(),
                                               lInitial,
                                               RefinementSchedule.coarse());
    assertFalse(lResult.isImproved());
    assertTrue(lResult.getPose() == lInitial);
    assertEquals(0, lResult.getResidual(), 0);
  }

  @Test(expected = CancellationException.class)
  public void testCancellation()
  {
    Volume lVolume = Phantoms.ellipsoid(16);
    new BOBYQARefiner().refine(lVolume,
                               lVolume,
                               Pose.identity(),
                               RefinementSchedule.standard(),
                               () -> true);
  }

  @Test
  public void testSchedules()
  {
    assertEquals(1, RefinementSchedule.coarse().getLevels().size());
    assertEquals(4, RefinementSchedule.standard().getLevels().size());
    RefinementSchedule.Level lFirst = RefinementSchedule.fine()
                                                        .getLevels()
                                                        .get(0);
    assertEquals(8, lFirst.getShrink());
    assertEquals(8, lFirst.getSmoothing(), 0);
  }

}
