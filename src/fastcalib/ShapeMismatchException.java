package fastcalib;

/**
 * Thrown when two volumes, tiles or images have incompatible dimensions.
 */
public class ShapeMismatchException extends FastCalibException
{

  private static final long serialVersionUID = 1L;

  public ShapeMismatchException(String pFormat, Object... pArgs)
  {
    super(pFormat, pArgs);
  }

}
