package fastcalib;

/**
 * Thrown when a tile footprint does not fit inside the target data.
 */
public class TileBoundsException extends FastCalibException
{

  private static final long serialVersionUID = 1L;

  public TileBoundsException(String pFormat, Object... pArgs)
  {
    super(pFormat, pArgs);
  }

}
