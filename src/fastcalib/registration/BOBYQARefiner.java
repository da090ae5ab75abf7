package fastcalib.registration;

import java.util.Arrays;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import javax.vecmath.Matrix3d;

import fastcalib.data.Volume;
import fastcalib.data.VolumeOps;

import org.apache.commons.lang3.tuple.MutablePair;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-scale rigid refinement with the BOBYQA derivative-free optimizer. Each
 * level optimizes six parameters on top of the current pose: three
 * translations in full-resolution voxels and three rotation angles in degrees,
 * minimizing the RMS difference between the fixed and the posed moving volume.
 */
public class BOBYQARefiner implements ContinuousRefiner
{
  private static final Logger cLogger =
                                      LoggerFactory.getLogger(BOBYQARefiner.class);

  private static final int cNumberOfParameters = 6;
  private static final int cNumberOfRandomSamples = 30;

  private double mTranslationRadius = 10;
  private double mRotationRadius = 10;
  private double mInitialTrustRegionRadius = 2;
  private double mStoppingTrustRegionRadius = 1e-3;
  private int mMaxNumberOfEvaluations = 200;
  private int mNumberOfRestarts = 0;
  private final RandomDataGenerator mRNG = new RandomDataGenerator();

  @Override
  public RefinementResult refine(Volume pFixed,
                                 Volume pMoving,
                                 Pose pInitialPose,
                                 RefinementSchedule pSchedule,
                                 BooleanSupplier pCancel)
  {
    VolumeOps.checkSameDimensions(pFixed, pMoving);

    double lInitialResidual =
                            VolumeOps.l2Norm(pFixed,
                                             pInitialPose.apply(pMoving));
    Pose lPose = pInitialPose;
    for (RefinementSchedule.Level lLevel : pSchedule.getLevels())
    {
      checkCancel(pCancel);
      lPose = refineLevel(pFixed, pMoving, lPose, lLevel, pCancel);
    }

    double lResidual = VolumeOps.l2Norm(pFixed, lPose.apply(pMoving));
    if (!(lResidual < lInitialResidual))
    {
      cLogger.warn("Refinement did not converge to a better pose (residual {}, initial {}), keeping the initial pose",
                   lResidual,
                   lInitialResidual);
      return new RefinementResult(pInitialPose, lInitialResidual, false);
    }
    cLogger.debug("Refined residual {} -> {}", lInitialResidual, lResidual);
    return new RefinementResult(lPose, lResidual, true);
  }

  private Pose refineLevel(Volume pFixed,
                           Volume pMoving,
                           Pose pPose,
                           RefinementSchedule.Level pLevel,
                           BooleanSupplier pCancel)
  {
    final int lShrink = pLevel.getShrink();
    final Volume lFixed = VolumeOps.smoothAndSubsample(pFixed,
                                                       lShrink,
                                                       pLevel.getSmoothing());
    final Volume lMoving =
                         VolumeOps.smoothAndSubsample(pMoving,
                                                      lShrink,
                                                      pLevel.getSmoothing());

    // keeps the best point seen, the optimizer may stop on its budget
    final MutablePair<double[], Double> lBest =
                                              MutablePair.of(new double[cNumberOfParameters],
                                                             Double.POSITIVE_INFINITY);
    MultivariateFunction J = theta -> {
      Pose lCandidate = compose(pPose, theta);
      double lValue =
                    VolumeOps.l2Norm(lFixed,
                                     VolumeOps.affine(lMoving,
                                                      lCandidate.getRotation(),
                                                      lCandidate.scaleTranslation(1.0
                                                                                  / lShrink)
                                                                .getTranslation()));
      if (lValue < lBest.getRight())
      {
        lBest.setLeft(theta.clone());
        lBest.setRight(lValue);
      }
      return lValue;
    };

    BOBYQAOptimizer lOptimizer =
                               new BOBYQAOptimizer(2 * cNumberOfParameters + 1,
                                                   mInitialTrustRegionRadius,
                                                   mStoppingTrustRegionRadius);
    SimpleBounds lBounds = new SimpleBounds(getLowerBounds(),
                                            getUpperBounds());

    double[] lInitialTheta = new double[cNumberOfParameters];
    J.value(lInitialTheta);

    for (int i = 0; i < 1 + mNumberOfRestarts; i++)
    {
      if (i > 0)
        checkCancel(pCancel);
      double[] theta = 0 == i ? lInitialTheta
                              : randomSearch(J,
                                             lInitialTheta,
                                             cNumberOfRandomSamples);
      try
      {
        lOptimizer.optimize(new MaxEval(mMaxNumberOfEvaluations),
                            new ObjectiveFunction(J),
                            GoalType.MINIMIZE,
                            lBounds,
                            new InitialGuess(theta));
      }
      catch (TooManyEvaluationsException e)
      {
        cLogger.debug("Evaluation budget of {} exhausted at shrink {}, using best point seen",
                      mMaxNumberOfEvaluations,
                      lShrink);
      }
      cLogger.debug("level {} run {} - {}: {}",
                    pLevel,
                    i + 1,
                    lBest.getRight(),
                    Arrays.toString(lBest.getLeft()));
    }
    return compose(pPose, lBest.getLeft());
  }

  private double[] randomSearch(MultivariateFunction J,
                                double[] pInitTheta,
                                int pNumberOfSamples)
  {
    double lBestJ = Double.POSITIVE_INFINITY;
    double[] lBestTheta = pInitTheta;
    for (int i = 0; i < pNumberOfSamples; i++)
    {
      double[] lTheta = perturbTransformation(pInitTheta);
      double j = J.value(lTheta);
      if (j < lBestJ)
      {
        lBestTheta = lTheta;
        lBestJ = j;
      }
    }
    return lBestTheta;
  }

  /**
   * Applies the parameter vector on top of a pose: R = rotation(angles) * R0,
   * T = T0 + t
   *
   * @param pPose
   *          base pose
   * @param theta
   *          three translations followed by three angles in degrees
   * @return composed pose
   */
  static Pose compose(Pose pPose, double... theta)
  {
    assert theta.length == cNumberOfParameters;
    Matrix3d R = AffineMatrix.multiply(AffineMatrix.rotation(theta[3],
                                                             theta[4],
                                                             theta[5]),
                                       pPose.getRotation());
    double[] T = pPose.getTranslation();
    for (int i = 0; i < 3; i++)
      T[i] += theta[i];
    return new Pose(R, T);
  }

  public double[] perturbTransformation(double... theta)
  {
    assert theta.length == cNumberOfParameters;
    double[] lPerturbedTheta = new double[theta.length];
    double[] lb = getLowerBounds(), ub = getUpperBounds();
    for (int i = 0; i < theta.length; i++)
    {
      double c = i < 3 ? mTranslationRadius : mRotationRadius;
      lPerturbedTheta[i] = theta[i] + mRNG.nextUniform(-c, c);
      lPerturbedTheta[i] = Math.max(lb[i], lPerturbedTheta[i]);
      lPerturbedTheta[i] = Math.min(ub[i], lPerturbedTheta[i]);
    }
    return lPerturbedTheta;
  }

  private static void checkCancel(BooleanSupplier pCancel)
  {
    if (pCancel != null && pCancel.getAsBoolean())
      throw new CancellationException("Refinement cancelled");
  }

  public double[] getUpperBounds()
  {
    return new double[]
    { +mTranslationRadius,
      +mTranslationRadius,
      +mTranslationRadius,
      +mRotationRadius,
      +mRotationRadius,
      +mRotationRadius };
  }

  public double[] getLowerBounds()
  {
    return new double[]
    { -mTranslationRadius,
      -mTranslationRadius,
      -mTranslationRadius,
      -mRotationRadius,
      -mRotationRadius,
      -mRotationRadius };
  }

  public double getTranslationRadius()
  {
    return mTranslationRadius;
  }

  /**
   * Sets the search radius of the translation per level
   *
   * @param pTranslationRadius
   *          radius in full-resolution voxels
   */
  public void setTranslationRadius(double pTranslationRadius)
  {
    assert pTranslationRadius > 0;
    mTranslationRadius = pTranslationRadius;
  }

  public double getRotationRadius()
  {
    return mRotationRadius;
  }

  /**
   * Sets the search radius of the rotation angles per level
   *
   * @param pRotationRadius
   *          radius in degrees
   */
  public void setRotationRadius(double pRotationRadius)
  {
    assert pRotationRadius > 0;
    mRotationRadius = pRotationRadius;
  }

  public void setTrustRegionRadii(double pInitial, double pStopping)
  {
    assert pInitial > pStopping && pStopping > 0;
    mInitialTrustRegionRadius = pInitial;
    mStoppingTrustRegionRadius = pStopping;
  }

  public int getMaxNumberOfEvaluations()
  {
    return mMaxNumberOfEvaluations;
  }

  public void setMaxNumberOfEvaluations(int pMaxNumberOfEvaluations)
  {
    assert pMaxNumberOfEvaluations > 2 * cNumberOfParameters + 1;
    mMaxNumberOfEvaluations = pMaxNumberOfEvaluations;
  }

  public int getNumberOfRestarts()
  {
    return mNumberOfRestarts;
  }

  public void setNumberOfRestarts(int pNumberOfRestarts)
  {
    assert pNumberOfRestarts >= 0;
    mNumberOfRestarts = pNumberOfRestarts;
  }

  /**
   * Seeds the generator used for restart perturbations
   *
   * @param pSeed
   *          seed
   */
  public void setSeed(long pSeed)
  {
    mRNG.reSeed(pSeed);
  }

}
