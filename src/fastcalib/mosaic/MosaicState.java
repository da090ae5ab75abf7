package fastcalib.mosaic;

import fastcalib.data.Image2D;
import fastcalib.data.Volume;

/**
 * Projection stack (rows, angles, columns) that tiles are blended into, with
 * the weight maps of the last appended tile
 */
public class MosaicState
{
  private final Volume mStack;
  private final TileGeometry mGeometry;
  private Image2D mBaseDistance, mNewDistance, mNormalization;
  private int mNumberOfTiles;

  /**
   * @param pStack
   *          target stack, modified in place by every appended tile
   * @param pGeometry
   *          detector placement of the target stack
   */
  public MosaicState(Volume pStack, TileGeometry pGeometry)
  {
    mStack = pStack;
    mGeometry = pGeometry;
  }

  public Volume getStack()
  {
    return mStack;
  }

  public TileGeometry getGeometry()
  {
    return mGeometry;
  }

  public Image2D getBaseDistance()
  {
    return mBaseDistance;
  }

  public Image2D getNewDistance()
  {
    return mNewDistance;
  }

  public Image2D getNormalization()
  {
    return mNormalization;
  }

  public int getNumberOfTiles()
  {
    return mNumberOfTiles;
  }

  void setWeights(Image2D pBaseDistance,
                  Image2D pNewDistance,
                  Image2D pNormalization)
  {
    mBaseDistance = pBaseDistance;
    mNewDistance = pNewDistance;
    mNormalization = pNormalization;
  }

  void incrementNumberOfTiles()
  {
    mNumberOfTiles++;
  }

}
