package fastcalib;

/**
 * Thrown when a parameter is outside of its admissible range.
 */
public class ValidationException extends FastCalibException
{

  private static final long serialVersionUID = 1L;

  public ValidationException(String pFormat, Object... pArgs)
  {
    super(pFormat, pArgs);
  }

}
