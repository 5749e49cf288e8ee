package workbench.tester;

interface TestReporter {

  /**
   * Handler for a test whose expected outcome cannot be understood.
   *
   * @param testCase test which is malformed
   */
  public void onMalformedCase(TestCase testCase);

  /**
   * Handler for when the simulation outcome does not match the expected one.
   *
   * @param testCase test which failed
   * @param foundOutput output which was found
   */
  public void onUnexpectedOutcome(TestCase testCase, String foundOutput);

  /**
   * Handler for a test passing.
   *
   * @param testCase test which passed
   */
  public void onSuccess(TestCase testCase);
}
