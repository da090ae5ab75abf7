package fastcalib.calibration;

/**
 * Cost of a trial value of a scalar acquisition parameter, lower is better
 */
@FunctionalInterface
public interface ScalarCostFunction
{

  /**
   * Evaluates the cost
   *
   * @param pValue
   *          trial value
   * @param pSubscale
   *          current subscale of the search, costs may reduce their
   *          resolution accordingly
   * @return cost
   */
  double evaluate(double pValue, int pSubscale);

}
