package mailqueue.worker;

/**
 * A job handler reported an unsuccessful result.
 */
public class JobExecutionException extends Exception {

  public JobExecutionException(String message) {
    super(message);
  }
}
