package fastcalib.data;

import fastcalib.ShapeMismatchException;
import fastcalib.ValidationException;

/**
 * Dense 2D float image stored row by row.
 */
public class Image2D
{
  private final int mRows, mColumns;
  private final float[] mData;

  public Image2D(int pRows, int pColumns)
  {
    this(new float[checkedLength(pRows, pColumns)], pRows, pColumns);
  }

  public Image2D(float[] pData, int pRows, int pColumns)
  {
    if (pData.length != checkedLength(pRows, pColumns))
      throw new ShapeMismatchException("Data of length %d cannot hold an image of shape (%d, %d)",
                                       pData.length,
                                       pRows,
                                       pColumns);
    mData = pData;
    mRows = pRows;
    mColumns = pColumns;
  }

  private static int checkedLength(int pRows, int pColumns)
  {
    if (pRows < 1 || pColumns < 1)
      throw new ValidationException("Invalid image shape (%d, %d)",
                                    pRows,
                                    pColumns);
    return Math.multiplyExact(pRows, pColumns);
  }

  public int getRows()
  {
    return mRows;
  }

  public int getColumns()
  {
    return mColumns;
  }

  public float[] getData()
  {
    return mData;
  }

  public final float get(int r, int c)
  {
    return mData[r * mColumns + c];
  }

  public final void set(int r, int c, float pValue)
  {
    mData[r * mColumns + c] = pValue;
  }

  public Image2D copy()
  {
    return new Image2D(mData.clone(), mRows, mColumns);
  }

  public boolean hasSameDimensions(Image2D pOther)
  {
    return mRows == pOther.mRows && mColumns == pOther.mColumns;
  }

  /**
   * Copies a rectangular region
   *
   * @param pRow
   *          first row
   * @param pColumn
   *          first column
   * @param pRows
   *          number of rows
   * @param pColumns
   *          number of columns
   * @return cropped copy
   */
  public Image2D crop(int pRow, int pColumn, int pRows, int pColumns)
  {
    if (pRow < 0 || pColumn < 0 || pRow + pRows > mRows
        || pColumn + pColumns > mColumns)
      throw new ShapeMismatchException("Crop (%d, %d) + (%d, %d) exceeds image of shape (%d, %d)",
                                       pRow,
                                       pColumn,
                                       pRows,
                                       pColumns,
                                       mRows,
                                       mColumns);
    Image2D lResult = new Image2D(pRows, pColumns);
    for (int r = 0; r < pRows; r++)
      System.arraycopy(mData,
                       (pRow + r) * mColumns + pColumn,
                       lResult.mData,
                       r * pColumns,
                       pColumns);
    return lResult;
  }

  /**
   * Zero-pads this image at the bottom and right to the given size
   *
   * @param pRows
   *          target number of rows
   * @param pColumns
   *          target number of columns
   * @return padded copy
   */
  public Image2D padTo(int pRows, int pColumns)
  {
    if (pRows < mRows || pColumns < mColumns)
      throw new ShapeMismatchException("Cannot pad image of shape (%d, %d) to smaller shape (%d, %d)",
                                       mRows,
                                       mColumns,
                                       pRows,
                                       pColumns);
    Image2D lResult = new Image2D(pRows, pColumns);
    for (int r = 0; r < mRows; r++)
      System.arraycopy(mData,
                       r * mColumns,
                       lResult.mData,
                       r * pColumns,
                       mColumns);
    return lResult;
  }

  /**
   * Bilinear interpolation, zero outside of the image
   *
   * @param r
   *          row coordinate
   * @param c
   *          column coordinate
   * @return interpolated value
   */
  public final float interpolate(double r, double c)
  {
    if (r < 0 || c < 0 || r > mRows - 1 || c > mColumns - 1)
      return 0;
    int r0 = Math.min((int) r, mRows - 1);
    int c0 = Math.min((int) c, mColumns - 1);
    int r1 = Math.min(r0 + 1, mRows - 1);
    int c1 = Math.min(c0 + 1, mColumns - 1);
    double dr = r - r0, dc = c - c0;
    double lTop = get(r0, c0) * (1 - dc) + get(r0, c1) * dc;
    double lBottom = get(r1, c0) * (1 - dc) + get(r1, c1) * dc;
    return (float) (lTop * (1 - dr) + lBottom * dr);
  }

  /**
   * Translates the content by a sub-pixel amount using bilinear interpolation,
   * areas moved in from outside are zero.
   *
   * @param pRowShift
   *          shift along rows
   * @param pColumnShift
   *          shift along columns
   * @return shifted copy
   */
  public Image2D shift(double pRowShift, double pColumnShift)
  {
    Image2D lResult = new Image2D(mRows, mColumns);
    for (int r = 0; r < mRows; r++)
      for (int c = 0; c < mColumns; c++)
        lResult.set(r, c, interpolate(r - pRowShift, c - pColumnShift));
    return lResult;
  }

  /**
   * Discrete Laplacian ([1, -2, 1] along both axes) with mirrored borders
   *
   * @return filtered copy
   */
  public Image2D laplace()
  {
    Image2D lResult = new Image2D(mRows, mColumns);
    for (int r = 0; r < mRows; r++)
      for (int c = 0; c < mColumns; c++)
      {
        float lCenter = get(r, c);
        float lUp = get(reflect(r - 1, mRows), c);
        float lDown = get(reflect(r + 1, mRows), c);
        float lLeft = get(r, reflect(c - 1, mColumns));
        float lRight = get(r, reflect(c + 1, mColumns));
        lResult.set(r, c, lUp + lDown + lLeft + lRight - 4 * lCenter);
      }
    return lResult;
  }

  private static int reflect(int i, int n)
  {
    if (i < 0)
      return Math.min(-i - 1, n - 1);
    if (i >= n)
      return Math.max(2 * n - i - 1, 0);
    return i;
  }

  public double sumOfSquares()
  {
    double lSum = 0;
    for (float lValue : mData)
      lSum += (double) lValue * lValue;
    return lSum;
  }

  @Override
  public String toString()
  {
    return String.format("Image2D(%d, %d)", mRows, mColumns);
  }

}
