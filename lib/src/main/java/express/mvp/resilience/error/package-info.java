/**
 * Error taxonomy and classification.
 *
 * <p>Every failure seen by the retry executor is turned into a {@link
 * express.mvp.resilience.error.ClassifiedError}: a kind, a severity, a retry decision and a list
 * of recovery hints for the user.
 *
 * <h2>Error Kinds</h2>
 *
 * <ul>
 *   <li><b>CONNECTION:</b> The remote service could not be reached (retryable)
 *   <li><b>TIMEOUT:</b> The remote service did not answer in time (retryable)
 *   <li><b>VALIDATION:</b> The request was rejected as invalid
 *   <li><b>API:</b> The remote service answered with an error; retryable for 5xx statuses
 *   <li><b>PARSING:</b> The response could not be read
 *   <li><b>UNKNOWN:</b> Anything else (retryable)
 * </ul>
 *
 * @see express.mvp.resilience.error.ErrorClassifier
 */
package express.mvp.resilience.error;
