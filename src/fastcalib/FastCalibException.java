package fastcalib;

/**
 * Base class of all exceptions thrown by FastCalib
 */
public class FastCalibException extends RuntimeException
{

  private static final long serialVersionUID = 1L;

  /**
   * Instantiates an exception given a format string and arguments
   * 
   * @param pFormat
   *          format string
   * @param pArgs
   *          format arguments
   */
  public FastCalibException(String pFormat, Object... pArgs)
  {
    super(String.format(pFormat, pArgs));
  }

  /**
   * Instantiates an exception given a cause, a format string and arguments
   * 
   * @param pCause
   *          cause
   * @param pFormat
   *          format string
   * @param pArgs
   *          format arguments
   */
  public FastCalibException(Throwable pCause,
                            String pFormat,
                            Object... pArgs)
  {
    super(String.format(pFormat, pArgs), pCause);
  }

}
