package fastcalib.registration.test;

import javax.vecmath.Matrix3d;

import fastcalib.data.Volume;
import fastcalib.data.VolumeOps;

/**
 * Synthetic volumes for registration tests
 */
public class Phantoms
{

  /**
   * Ellipsoid with semi-axes proportional to (10, 14, 22) for a 64 voxel volume
   * and a brighter off-center sphere, so that no half turn maps it onto itself.
   * The phantom is sampled at M (p - c) + c + k for every voxel p, c being the
   * volume center.
   *
   * @param pSize
   *          edge length of the cubic volume
   * @param M
   *          rotation applied to the sampling positions
   * @param k
   *          shift applied to the sampling positions, (Z,Y,X)
   * @return phantom volume
   */
  public static Volume ellipsoid(int pSize, Matrix3d M, double... k)
  {
    double lScale = pSize / 64.0;
    double az = 10 * lScale, ay = 14 * lScale, ax = 22 * lScale;
    double bz = 4 * lScale, by = 8 * lScale, bx = 12 * lScale;
    double lRadius = 6 * lScale;

    Volume lVolume = new Volume(pSize, pSize, pSize);
    int c = pSize / 2;
    for (int z = 0; z < pSize; z++)
      for (int y = 0; y < pSize; y++)
        for (int x = 0; x < pSize; x++)
        {
          double vz = z - c, vy = y - c, vx = x - c;
          double dz = M.m00 * vz + M.m01 * vy + M.m02 * vx + k[0];
          double dy = M.m10 * vz + M.m11 * vy + M.m12 * vx + k[1];
          double dx = M.m20 * vz + M.m21 * vy + M.m22 * vx + k[2];

          float lValue = 0;
          double e = (dz / az) * (dz / az)
                     + (dy / ay) * (dy / ay)
                     + (dx / ax) * (dx / ax);
          if (e <= 1)
            lValue += 1;
          double s = (dz - bz) * (dz - bz)
                     + (dy - by) * (dy - by)
                     + (dx - bx) * (dx - bx);
          if (s <= lRadius * lRadius)
            lValue += 0.5f;
          lVolume.set(z, y, x, lValue);
        }
    return lVolume;
  }

  public static Volume ellipsoid(int pSize)
  {
    Matrix3d lIdentity = new Matrix3d();
    lIdentity.setIdentity();
    return ellipsoid(pSize, lIdentity, 0, 0, 0);
  }

  /**
   * Anisotropic Gaussian with standard deviations (7, 4.5, 2.5) along the rows
   * of A M, centered in the volume
   *
   * @param pSize
   *          edge length of the cubic volume
   * @param A
   *          orientation of the blob
   * @param M
   *          rotation applied to the sampling positions
   * @return blob volume
   */
  public static Volume blob(int pSize, Matrix3d A, Matrix3d M)
  {
    double[] lSigmas =
    { 7, 4.5, 2.5 };
    Matrix3d AM = new Matrix3d(A);
    AM.mul(M);
    Volume lVolume = new Volume(pSize, pSize, pSize);
    int c = pSize / 2;
    for (int z = 0; z < pSize; z++)
      for (int y = 0; y < pSize; y++)
        for (int x = 0; x < pSize; x++)
        {
          double[] v =
          { z - c, y - c, x - c };
          double lExponent = 0;
          for (int i = 0; i < 3; i++)
          {
            double u = AM.getElement(i, 0) * v[0]
                       + AM.getElement(i, 1) * v[1]
                       + AM.getElement(i, 2) * v[2];
            lExponent += u * u / (2 * lSigmas[i] * lSigmas[i]);
          }
          lVolume.set(z, y, x, (float) Math.exp(-lExponent));
        }
    return lVolume;
  }

  public static Volume smooth(Volume pVolume, double pSigma)
  {
    return VolumeOps.gaussianBlur(pVolume, pSigma);
  }

}
