package fastcalib.data;

import java.util.Arrays;

import fastcalib.ShapeMismatchException;
import fastcalib.ValidationException;

/**
 * Dense 3D float volume stored in (Z,Y,X) order, X being the fastest varying
 * index. Also used for projection stacks, in which case the axes are (detector
 * rows, angles, detector columns).
 */
public class Volume
{
  private final int mDepth, mHeight, mWidth;
  private final float[] mData;
  private final double mVoxelSize;

  /**
   * Instantiates a zero-filled volume with unit voxel size
   *
   * @param pDepth
   *          size along Z
   * @param pHeight
   *          size along Y
   * @param pWidth
   *          size along X
   */
  public Volume(int pDepth, int pHeight, int pWidth)
  {
    this(pDepth, pHeight, pWidth, 1);
  }

  public Volume(int pDepth, int pHeight, int pWidth, double pVoxelSize)
  {
    this(new float[checkedLength(pDepth, pHeight, pWidth)],
         pDepth,
         pHeight,
         pWidth,
         pVoxelSize);
  }

  /**
   * Wraps an existing array, no copy is made
   *
   * @param pData
   *          voxel data of length depth*height*width
   * @param pDepth
   *          size along Z
   * @param pHeight
   *          size along Y
   * @param pWidth
   *          size along X
   * @param pVoxelSize
   *          voxel size
   */
  public Volume(float[] pData,
                int pDepth,
                int pHeight,
                int pWidth,
                double pVoxelSize)
  {
    if (pData.length != checkedLength(pDepth, pHeight, pWidth))
      throw new ShapeMismatchException("Data of length %d cannot hold a volume of shape (%d, %d, %d)",
                                       pData.length,
                                       pDepth,
                                       pHeight,
                                       pWidth);
    mData = pData;
    mDepth = pDepth;
    mHeight = pHeight;
    mWidth = pWidth;
    mVoxelSize = pVoxelSize;
  }

  private static int checkedLength(int pDepth, int pHeight, int pWidth)
  {
    if (pDepth < 1 || pHeight < 1 || pWidth < 1)
      throw new ValidationException("Invalid volume shape (%d, %d, %d)",
                                    pDepth,
                                    pHeight,
                                    pWidth);
    return Math.multiplyExact(Math.multiplyExact(pDepth, pHeight),
                              pWidth);
  }

  public int getDepth()
  {
    return mDepth;
  }

  public int getHeight()
  {
    return mHeight;
  }

  public int getWidth()
  {
    return mWidth;
  }

  /**
   * Returns the shape as (Z,Y,X)
   *
   * @return shape
   */
  public int[] getDimensions()
  {
    return new int[]
    { mDepth, mHeight, mWidth };
  }

  public int getDimension(int pAxis)
  {
    switch (pAxis)
    {
    case 0:
      return mDepth;
    case 1:
      return mHeight;
    case 2:
      return mWidth;
    default:
      throw new ValidationException("Invalid axis %d", pAxis);
    }
  }

  /**
   * Geometric center of the volume, i.e. shape // 2 per axis
   *
   * @return center in (Z,Y,X) order
   */
  public int[] getCenter()
  {
    return new int[]
    { mDepth / 2, mHeight / 2, mWidth / 2 };
  }

  public double getVoxelSize()
  {
    return mVoxelSize;
  }

  public float[] getData()
  {
    return mData;
  }

  public long getVolume()
  {
    return mData.length;
  }

  public final int index(int z, int y, int x)
  {
    return (z * mHeight + y) * mWidth + x;
  }

  public final float get(int z, int y, int x)
  {
    return mData[index(z, y, x)];
  }

  public final void set(int z, int y, int x, float pValue)
  {
    mData[index(z, y, x)] = pValue;
  }

  public boolean hasSameDimensions(Volume pOther)
  {
    return mDepth == pOther.mDepth && mHeight == pOther.mHeight
           && mWidth == pOther.mWidth;
  }

  public Volume copy()
  {
    return new Volume(mData.clone(),
                      mDepth,
                      mHeight,
                      mWidth,
                      mVoxelSize);
  }

  /**
   * Strided copy of this volume, equivalent to taking every n-th voxel along
   * each axis starting at 0.
   *
   * @param pStride
   *          stride, at least 1
   * @return subsampled copy
   */
  public Volume subsample(int pStride)
  {
    if (pStride < 1)
      throw new ValidationException("Subsampling stride must be at least 1, got %d",
                                    pStride);
    if (pStride == 1)
      return copy();

    int lDepth = (mDepth + pStride - 1) / pStride;
    int lHeight = (mHeight + pStride - 1) / pStride;
    int lWidth = (mWidth + pStride - 1) / pStride;
    Volume lResult = new Volume(lDepth,
                                lHeight,
                                lWidth,
                                mVoxelSize * pStride);
    int i = 0;
    for (int z = 0; z < lDepth; z++)
      for (int y = 0; y < lHeight; y++)
        for (int x = 0; x < lWidth; x++)
          lResult.mData[i++] = get(z * pStride,
                                   y * pStride,
                                   x * pStride);
    return lResult;
  }

  /**
   * Trilinear interpolation, zero outside of the volume
   *
   * @param z
   *          z coordinate
   * @param y
   *          y coordinate
   * @param x
   *          x coordinate
   * @return interpolated value
   */
  public final float interpolate(double z, double y, double x)
  {
    if (z < 0 || y < 0 || x < 0 || z > mDepth - 1 || y > mHeight - 1
        || x > mWidth - 1)
      return 0;

    int z0 = Math.min((int) z, mDepth - 1);
    int y0 = Math.min((int) y, mHeight - 1);
    int x0 = Math.min((int) x, mWidth - 1);
    int z1 = Math.min(z0 + 1, mDepth - 1);
    int y1 = Math.min(y0 + 1, mHeight - 1);
    int x1 = Math.min(x0 + 1, mWidth - 1);
    double dz = z - z0, dy = y - y0, dx = x - x0;

    double c00 = get(z0, y0, x0) * (1 - dx) + get(z0, y0, x1) * dx;
    double c01 = get(z0, y1, x0) * (1 - dx) + get(z0, y1, x1) * dx;
    double c10 = get(z1, y0, x0) * (1 - dx) + get(z1, y0, x1) * dx;
    double c11 = get(z1, y1, x0) * (1 - dx) + get(z1, y1, x1) * dx;
    double c0 = c00 * (1 - dy) + c01 * dy;
    double c1 = c10 * (1 - dy) + c11 * dy;
    return (float) (c0 * (1 - dz) + c1 * dz);
  }

  /**
   * Extracts a 2D slice perpendicular to the given axis. The remaining axes keep
   * their order, e.g. a slice along axis 1 has (Z, X) as (rows, columns).
   *
   * @param pAxis
   *          axis perpendicular to the slice
   * @param pIndex
   *          slice index along that axis
   * @return copy of the slice
   */
  public Image2D getSlice(int pAxis, int pIndex)
  {
    int[] lDims = sliceDimensions(pAxis);
    Image2D lSlice = new Image2D(lDims[0], lDims[1]);
    for (int r = 0; r < lDims[0]; r++)
      for (int c = 0; c < lDims[1]; c++)
        lSlice.set(r, c, mData[sliceIndex(pAxis, pIndex, r, c)]);
    return lSlice;
  }

  /**
   * Writes a 2D slice perpendicular to the given axis
   *
   * @param pAxis
   *          axis perpendicular to the slice
   * @param pIndex
   *          slice index along that axis
   * @param pSlice
   *          slice data, must match the slice dimensions
   */
  public void setSlice(int pAxis, int pIndex, Image2D pSlice)
  {
    int[] lDims = sliceDimensions(pAxis);
    if (pSlice.getRows() != lDims[0] || pSlice.getColumns() != lDims[1])
      throw new ShapeMismatchException("Slice of shape (%d, %d) does not fit slice shape %s of axis %d",
                                       pSlice.getRows(),
                                       pSlice.getColumns(),
                                       Arrays.toString(lDims),
                                       pAxis);
    for (int r = 0; r < lDims[0]; r++)
      for (int c = 0; c < lDims[1]; c++)
        mData[sliceIndex(pAxis, pIndex, r, c)] = pSlice.get(r, c);
  }

  private int[] sliceDimensions(int pAxis)
  {
    switch (pAxis)
    {
    case 0:
      return new int[]
      { mHeight, mWidth };
    case 1:
      return new int[]
      { mDepth, mWidth };
    case 2:
      return new int[]
      { mDepth, mHeight };
    default:
      throw new ValidationException("Invalid axis %d", pAxis);
    }
  }

  private int sliceIndex(int pAxis, int pIndex, int r, int c)
  {
    switch (pAxis)
    {
    case 0:
      return index(pIndex, r, c);
    case 1:
      return index(r, pIndex, c);
    default:
      return index(r, c, pIndex);
    }
  }

  public double sum()
  {
    double lSum = 0;
    for (float lValue : mData)
      lSum += lValue;
    return lSum;
  }

  @Override
  public String toString()
  {
    return String.format("Volume(%d, %d, %d, voxel = %g)",
                         mDepth,
                         mHeight,
                         mWidth,
                         mVoxelSize);
  }

}
