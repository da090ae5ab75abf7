package fastcalib.registration.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.concurrent.CancellationException;

import javax.vecmath.Matrix3d;

import fastcalib.DegenerateInputException;
import fastcalib.ShapeMismatchException;
import fastcalib.data.Volume;
import fastcalib.registration.AffineMatrix;
import fastcalib.registration.RefinementSchedule;
import fastcalib.registration.RegistrationResult;
import fastcalib.registration.RegistrationSettings;
import fastcalib.registration.ThresholdMode;
import fastcalib.registration.VolumeRegistration;

import org.junit.Test;

/**
 * Volume registration tests
 */
public class VolumeRegistrationTests
{

  @Test
  public void testRegisterToItself()
  {
    Volume lVolume = Phantoms.ellipsoid(32);
    RegistrationSettings lSettings = new RegistrationSettings();
    lSettings.setRefineSchedule(RefinementSchedule.of(2, 1));

    RegistrationResult lResult =
                               new VolumeRegistration(lSettings).register(lVolume,
                                                                          lVolume.copy());
    assertEquals(0,
                 AffineMatrix.angleBetween(lResult.getPose().getRotation(),
                                           AffineMatrix.identity()),
                 0.1);
    for (double t : lResult.getPose().getTranslation())
      assertEquals(0, t, 0.05);
    assertEquals(0, lResult.getL2AfterMoments(), 1e-3);
  }

  @Test
  public void testHalfTurnAboutZWithShift()
  {
    Matrix3d M = new Matrix3d(1, 0, 0, 0, -1, 0, 0, 0, -1);
    double[] k =
    { 3, 0, 0 };
    Volume lFixed = Phantoms.ellipsoid(64);
    Volume lMoving = Phantoms.ellipsoid(64, M, k);

    RegistrationSettings lSettings = new RegistrationSettings();
    lSettings.setSubsample(1);
    lSettings.setUseMoments(true);
    lSettings.setUseFlipSearch(false);
    lSettings.setUseRefine(false);
    lSettings.setDebug(true);

    RegistrationResult lResult =
                               new VolumeRegistration(lSettings).register(lFixed,
                                                                          lMoving);
    assertEquals(0,
                 AffineMatrix.angleBetween(lResult.getPose().getRotation(),
                                           M),
                 1);
    double[] T = lResult.getPose().getTranslation();
    for (int i = 0; i < 3; i++)
      assertEquals(k[i], T[i], 1);
    assertTrue(lResult.getL2AfterMoments() < 0.5 * lResult.getL2Before());
    assertEquals(3, lResult.getEulerAngles().length);
    assertEquals(180,
                 Arrays.stream(lResult.getEulerAngles())
                       .map(Math::abs)
                       .max()
                       .getAsDouble(),
                 1);
  }

  @Test
  public void testTranslationIsScaledBySubsampling()
  {
    double[] k =
    { 4, -2, 2 };
    Volume lFixed = Phantoms.ellipsoid(48);
    Volume lMoving = Phantoms.ellipsoid(48, AffineMatrix.identity(), k);

    RegistrationSettings lSettings = new RegistrationSettings();
    lSettings.setSubsample(2);
    lSettings.setUseRefine(false);
    lSettings.setThresholdMode(ThresholdMode.None);

    double[] T = new VolumeRegistration(lSettings).register(lFixed,
                                                            lMoving)
                                                  .getPose()
                                                  .getTranslation();
    for (int i = 0; i < 3; i++)
      assertEquals(k[i], T[i], 1);
  }

  @Test(expected = ShapeMismatchException.class)
  public void testShapeMismatch()
  {
    new VolumeRegistration().register(new Volume(8, 8, 8),
                                      new Volume(8, 8, 9));
  }

  @Test(expected = DegenerateInputException.class)
  public void testEmptyVolumes()
  {
    RegistrationSettings lSettings = new RegistrationSettings();
    lSettings.setUseRefine(false);
    new VolumeRegistration(lSettings).register(new Volume(8, 8, 8),
                                               new Volume(8, 8, 8));
  }

  @Test(expected = CancellationException.class)
  public void testCancellationDuringOrientationSearch()
  {
    RegistrationSettings lSettings = new RegistrationSettings();
    lSettings.setUseFlipSearch(true);
    lSettings.setUseRefine(false);
    Volume lVolume = Phantoms.ellipsoid(16);
    new VolumeRegistration(lSettings).register(lVolume,
                                               lVolume.copy(),
                                               () -> true);
  }

}
