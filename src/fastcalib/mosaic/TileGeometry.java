package fastcalib.mosaic;

import fastcalib.geometry.Geometry;

/**
 * Detector placement of a projection tile: horizontal and vertical detector
 * position (mm) and detector pixel size (mm)
 */
public class TileGeometry
{
  private final double mHorizontal, mVertical, mPixelSize;

  public TileGeometry(double pHorizontal, double pVertical, double pPixelSize)
  {
    assert pPixelSize > 0;
    mHorizontal = pHorizontal;
    mVertical = pVertical;
    mPixelSize = pPixelSize;
  }

  public static TileGeometry from(Geometry pGeometry)
  {
    return new TileGeometry(pGeometry.getScalar(Geometry.DET_HRZ),
                            pGeometry.getScalar(Geometry.DET_VRT),
                            pGeometry.getScalar(Geometry.DET_PIXEL));
  }

  public double getHorizontal()
  {
    return mHorizontal;
  }

  public double getVertical()
  {
    return mVertical;
  }

  public double getPixelSize()
  {
    return mPixelSize;
  }

  @Override
  public String toString()
  {
    return String.format("TileGeometry(hrz = %g, vrt = %g, pixel = %g)",
                         mHorizontal,
                         mVertical,
                         mPixelSize);
  }

}
