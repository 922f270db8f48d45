package gridauth.core.model.pilot;

import java.util.Map;
import java.util.Objects;

/**
 * A job handed to a pilot by the job matcher.
 *
 * @param jobId   job id
 * @param vo      VO of the job
 * @param owner   owner of the job
 * @param group   group the job was submitted with
 * @param details opaque job description forwarded to the pilot
 */
public record MatchedJob(String jobId, String vo, String owner, String group, Map<String, String> details) {

    public MatchedJob {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(vo, "vo is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }
}
