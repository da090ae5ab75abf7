package fastcalib.geometry;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import fastcalib.ValidationException;

/**
 * Acquisition geometry record: named scalar and vector fields, lengths in mm
 * and angles in radians. Records are mutable; code that derives a modified
 * geometry works on a {@link #copy()}.
 */
public class Geometry
{
  /** detector pixel size */
  public static final String DET_PIXEL = "det_pixel";
  /** reconstruction voxel size */
  public static final String IMG_PIXEL = "img_pixel";
  /** horizontal detector position */
  public static final String DET_HRZ = "det_hrz";
  /** vertical detector position */
  public static final String DET_VRT = "det_vrt";
  /** horizontal rotation axis offset */
  public static final String AXS_HRZ = "axs_hrz";
  /** detector in-plane rotation */
  public static final String DET_ROT = "det_rot";
  /** volume rotation, three Euler angles */
  public static final String VOL_ROT = "vol_rot";
  /** volume translation, three components */
  public static final String VOL_TRA = "vol_tra";

  private final Map<String, Object> mFields = new LinkedHashMap<>();

  public Geometry()
  {
  }

  /**
   * Geometry with the given detector pixel size and voxel size, detector and
   * rotation axis centered
   *
   * @param pDetectorPixel
   *          detector pixel size
   * @param pImagePixel
   *          voxel size
   * @return geometry
   */
  public static Geometry of(double pDetectorPixel, double pImagePixel)
  {
    Geometry lGeometry = new Geometry();
    lGeometry.set(DET_PIXEL, pDetectorPixel);
    lGeometry.set(IMG_PIXEL, pImagePixel);
    lGeometry.set(DET_HRZ, 0);
    lGeometry.set(DET_VRT, 0);
    lGeometry.set(AXS_HRZ, 0);
    lGeometry.set(DET_ROT, 0);
    lGeometry.setVector(VOL_ROT, 0, 0, 0);
    lGeometry.setVector(VOL_TRA, 0, 0, 0);
    return lGeometry;
  }

  public Geometry copy()
  {
    Geometry lCopy = new Geometry();
    for (Map.Entry<String, Object> lEntry : mFields.entrySet())
    {
      Object lValue = lEntry.getValue();
      lCopy.mFields.put(lEntry.getKey(),
                        lValue instanceof double[] ? ((double[]) lValue).clone()
                                                   : lValue);
    }
    return lCopy;
  }

  public boolean has(String pKey)
  {
    return mFields.containsKey(pKey);
  }

  public Set<String> keys()
  {
    return Collections.unmodifiableSet(mFields.keySet());
  }

  public Geometry set(String pKey, double pValue)
  {
    mFields.put(pKey, pValue);
    return this;
  }

  public Geometry setVector(String pKey, double... pValues)
  {
    mFields.put(pKey, pValues.clone());
    return this;
  }

  public double getScalar(String pKey)
  {
    Object lValue = mFields.get(pKey);
    if (!(lValue instanceof Double))
      throw new ValidationException("Geometry field '%s' is not a scalar: %s",
                                    pKey,
                                    describe(lValue));
    return (Double) lValue;
  }

  public double getScalar(String pKey, double pDefault)
  {
    return has(pKey) ? getScalar(pKey) : pDefault;
  }

  public double[] getVector(String pKey)
  {
    Object lValue = mFields.get(pKey);
    if (!(lValue instanceof double[]))
      throw new ValidationException("Geometry field '%s' is not a vector: %s",
                                    pKey,
                                    describe(lValue));
    return ((double[]) lValue).clone();
  }

  public double[] getVector(String pKey, double... pDefault)
  {
    return has(pKey) ? getVector(pKey) : pDefault.clone();
  }

  private static String describe(Object pValue)
  {
    if (pValue == null)
      return "missing";
    if (pValue instanceof double[])
      return Arrays.toString((double[]) pValue);
    return pValue.toString();
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder("Geometry{");
    String lSeparator = "";
    for (Map.Entry<String, Object> lEntry : mFields.entrySet())
    {
      lBuilder.append(lSeparator)
              .append(lEntry.getKey())
              .append('=')
              .append(describe(lEntry.getValue()));
      lSeparator = ", ";
    }
    return lBuilder.append('}').toString();
  }

}
