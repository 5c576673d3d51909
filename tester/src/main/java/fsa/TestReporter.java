package fsa;

interface TestReporter {

  /**
   * Handler for when an automaton (unexpectedly) fails to load.
   *
   * @param testCase test which failed
   * @param error exception that was thrown
   */
  public void onAutomatonError(TestCase testCase, Exception error);

  /**
   * Handler for when some form of the automaton does not produce the expected output.
   *
   * @param testCase test which failed
   * @param form which form of the automaton disagreed (eg. {@code "minimized"})
   * @param foundOutput output which was found
   */
  public void onUnexpectedOutput(TestCase testCase, String form, String foundOutput);

  /**
   * Handler for a test passing.
   *
   * @param testCase test which passed
   * @param expectedFailure the successful behaviour was an error
   */
  public void onSuccess(TestCase testCase, boolean expectedFailure);
}
