package fastcalib.data;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.algorithm.morphology.distance.DistanceTransform;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Euclidean distance of every pixel of an occupancy image to the nearest
 * background (zero) pixel inside the image. The image frame is not a
 * boundary: a footprint touching the frame keeps growing towards it.
 */
public class DistanceMap
{

  /**
   * Computes the distance map of a 2D occupancy image
   *
   * @param pOccupancy
   *          image whose nonzero pixels are foreground
   * @return distance to the nearest background pixel, zero on background; the
   *         length of the image diagonal everywhere if there is no background
   */
  public static Image2D compute(Image2D pOccupancy)
  {
    int lRows = pOccupancy.getRows(), lColumns = pOccupancy.getColumns();
    float[] lOccupancy = pOccupancy.getData();

    ArrayImg<BitType, LongArray> lBackground = ArrayImgs.bits(lColumns,
                                                              lRows);
    boolean lHasBackground = false;
    Cursor<BitType> lCursor = lBackground.cursor();
    for (int i = 0; lCursor.hasNext(); i++)
    {
      boolean lIsBackground = lOccupancy[i] == 0;
      lCursor.next().set(lIsBackground);
      lHasBackground |= lIsBackground;
    }

    Image2D lResult = new Image2D(lRows, lColumns);
    float[] lData = lResult.getData();
    if (!lHasBackground)
    {
      Arrays.fill(lData, (float) Math.hypot(lRows, lColumns));
      return lResult;
    }

    // squared distances, written straight into the result buffer
    ArrayImg<FloatType, FloatArray> lDistance = ArrayImgs.floats(lData,
                                                                 lColumns,
                                                                 lRows);
    DistanceTransform.binaryTransform(lBackground,
                                      lDistance,
                                      DistanceTransform.DISTANCE_TYPE.EUCLIDIAN);
    for (int i = 0; i < lData.length; i++)
      lData[i] = (float) Math.sqrt(lData[i]);
    return lResult;
  }

}
