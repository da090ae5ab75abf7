package fastcalib.mosaic;

import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import fastcalib.ShapeMismatchException;
import fastcalib.data.DistanceMap;
import fastcalib.data.Image2D;
import fastcalib.data.Volume;
import fastcalib.shift.RobustShiftEstimator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stitches projection tiles into a larger projection stack. Each tile is placed
 * at its nominal detector offset, corrected by a {@link RobustShiftEstimator},
 * and feathered into the stack with weights that grow with the distance to the
 * empty part of each footprint. The frame of the stack does not bound a
 * footprint, so tile data reaching the border is kept.
 */
public class MosaicAccumulator
{
  private static final Logger cLogger =
                                      LoggerFactory.getLogger(MosaicAccumulator.class);

  // axis of the projection angles in a (rows, angles, columns) stack
  private static final int cAngleAxis = 1;
  private static final int cOccupancyStep = 100;

  private final RobustShiftEstimator mShiftEstimator;

  public MosaicAccumulator()
  {
    this(new RobustShiftEstimator());
  }

  public MosaicAccumulator(RobustShiftEstimator pShiftEstimator)
  {
    mShiftEstimator = pShiftEstimator;
  }

  /**
   * Blends a tile placed relative to the mosaic's own geometry
   *
   * @return applied (rows, columns) offset of the tile in the mosaic
   */
  public double[] appendTile(MosaicState pState,
                             Volume pTile,
                             TileGeometry pTileGeometry)
  {
    return appendTile(pState,
                      pTile,
                      pTileGeometry,
                      pState.getGeometry(),
                      null);
  }

  /**
   * Blends a tile into the mosaic stack, in place. Appending the same tile
   * twice blends it twice.
   *
   * @param pState
   *          mosaic, its stack is modified
   * @param pTile
   *          tile stack (rows, angles, columns), not modified
   * @param pTileGeometry
   *          detector placement of the tile
   * @param pMosaicGeometry
   *          detector placement of the mosaic
   * @param pCancel
   *          checked before each angle, may be null
   * @return applied (rows, columns) offset of the tile in the mosaic
   */
  public double[] appendTile(MosaicState pState,
                             Volume pTile,
                             TileGeometry pTileGeometry,
                             TileGeometry pMosaicGeometry,
                             BooleanSupplier pCancel)
  {
    Volume lStack = pState.getStack();
    if (lStack.getHeight() != pTile.getHeight())
      throw new ShapeMismatchException("Tile has %d projections, mosaic has %d",
                                       pTile.getHeight(),
                                       lStack.getHeight());

    int[] lOffset = nominalOffset(lStack,
                                  pTile,
                                  pTileGeometry,
                                  pMosaicGeometry);
    double[] lShift = mShiftEstimator.estimateShift(lStack,
                                                    pTile,
                                                    lOffset,
                                                    cAngleAxis);
    double lRowOffset = lOffset[0] + lShift[0];
    double lColumnOffset = lOffset[1] + lShift[1];
    cLogger.info("Appending tile at offset ({}, {}), nominal ({}, {})",
                 lRowOffset,
                 lColumnOffset,
                 lOffset[0],
                 lOffset[1]);

    int lRows = lStack.getDepth(), lColumns = lStack.getWidth();
    Image2D lBaseDistance = trimmedDistance(baseOccupancy(lStack));
    Image2D lNewDistance = trimmedDistance(tileOccupancy(lRows,
                                                         lColumns,
                                                         pTile,
                                                         lRowOffset,
                                                         lColumnOffset));
    Image2D lNormalization = new Image2D(lRows, lColumns);
    float[] lNorm = lNormalization.getData();
    for (int i = 0; i < lNorm.length; i++)
    {
      lNorm[i] = lBaseDistance.getData()[i] + lNewDistance.getData()[i];
      if (lNorm[i] == 0)
        lNorm[i] = Float.POSITIVE_INFINITY;
    }
    pState.setWeights(lBaseDistance, lNewDistance, lNormalization);

    boolean lShifted = lRowOffset != 0 || lColumnOffset != 0;
    float[] lBase = lBaseDistance.getData(), lNew = lNewDistance.getData();
    for (int a = 0; a < lStack.getHeight(); a++)
    {
      if (pCancel != null && pCancel.getAsBoolean())
        throw new CancellationException(String.format("Tile append cancelled before angle %d",
                                                      a));
      Image2D lTile = pTile.getSlice(cAngleAxis, a).padTo(lRows, lColumns);
      if (lShifted)
        lTile = lTile.shift(lRowOffset, lColumnOffset);
      Image2D lSlice = lStack.getSlice(cAngleAxis, a);
      float[] lOld = lSlice.getData(), lAdded = lTile.getData();
      for (int i = 0; i < lOld.length; i++)
        lOld[i] = (lBase[i] * lOld[i] + lNew[i] * lAdded[i]) / lNorm[i];
      lStack.setSlice(cAngleAxis, a, lSlice);
    }
    pState.incrementNumberOfTiles();
    return new double[]
    { lRowOffset, lColumnOffset };
  }

  /**
   * Integer offset of the tile's top-left corner in the mosaic from the
   * detector positions, both frames being centered on their detector position
   *
   * @param pStack
   *          mosaic stack
   * @param pTile
   *          tile stack
   * @param pTileGeometry
   *          tile placement
   * @param pMosaicGeometry
   *          mosaic placement
   * @return (rows, columns) offset
   */
  public static int[] nominalOffset(Volume pStack,
                                    Volume pTile,
                                    TileGeometry pTileGeometry,
                                    TileGeometry pMosaicGeometry)
  {
    double lPixel = pTileGeometry.getPixelSize();
    double lTotalHeight = pStack.getDepth()
                          * pMosaicGeometry.getPixelSize();
    double lTotalWidth = pStack.getWidth()
                         * pMosaicGeometry.getPixelSize();
    double lTileHeight = pTile.getDepth() * lPixel;
    double lTileWidth = pTile.getWidth() * lPixel;

    double lRow = ((pTileGeometry.getVertical()
                    - pMosaicGeometry.getVertical())
                   + lTotalHeight / 2
                   - lTileHeight / 2)
                  / lPixel;
    double lColumn = ((pTileGeometry.getHorizontal()
                       - pMosaicGeometry.getHorizontal())
                      + lTotalWidth / 2
                      - lTileWidth / 2)
                     / lPixel;
    return new int[]
    { (int) Math.rint(lRow), (int) Math.rint(lColumn) };
  }

  // pixels with data in the mean of every 100th projection
  private static Image2D baseOccupancy(Volume pStack)
  {
    Image2D lOccupancy = new Image2D(pStack.getDepth(), pStack.getWidth());
    float[] lData = lOccupancy.getData();
    int lCount = 0;
    for (int a = 0; a < pStack.getHeight(); a += cOccupancyStep)
    {
      float[] lSlice = pStack.getSlice(cAngleAxis, a).getData();
      for (int i = 0; i < lData.length; i++)
        lData[i] += lSlice[i];
      lCount++;
    }
    for (int i = 0; i < lData.length; i++)
      lData[i] = lData[i] / lCount != 0 ? 1 : 0;
    return lOccupancy;
  }

  private static Image2D tileOccupancy(int pRows,
                                       int pColumns,
                                       Volume pTile,
                                       double pRowOffset,
                                       double pColumnOffset)
  {
    Image2D lOccupancy = new Image2D(pRows, pColumns);
    for (int r = 0; r < Math.min(pTile.getDepth(), pRows); r++)
      for (int c = 0; c < Math.min(pTile.getWidth(), pColumns); c++)
        lOccupancy.set(r, c, 1);
    return lOccupancy.shift(pRowOffset, pColumnOffset);
  }

  // distance to the nearest empty pixel minus one, floored at zero
  private static Image2D trimmedDistance(Image2D pOccupancy)
  {
    Image2D lDistance = DistanceMap.compute(pOccupancy);
    float[] lData = lDistance.getData();
    for (int i = 0; i < lData.length; i++)
      lData[i] = Math.max(0, lData[i] - 1);
    return lDistance;
  }

}
