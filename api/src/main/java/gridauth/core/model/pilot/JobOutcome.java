package gridauth.core.model.pilot;

/**
 * How a job ended.
 */
public enum JobOutcome {
    SUCCEEDED,
    FAILED,
    KILLED
}
