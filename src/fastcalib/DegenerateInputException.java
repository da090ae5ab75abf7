package fastcalib;

/**
 * Thrown when the input carries no usable signal, e.g. a zero-mass volume.
 */
public class DegenerateInputException extends FastCalibException
{

  private static final long serialVersionUID = 1L;

  public DegenerateInputException(String pFormat, Object... pArgs)
  {
    super(pFormat, pArgs);
  }

}
