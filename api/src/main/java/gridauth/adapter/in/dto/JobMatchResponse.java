package gridauth.adapter.in.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import gridauth.core.model.pilot.JobAssignment;

/**
 * A matched job with the credential the pilot hands to the job payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobMatchResponse(
        String jobId, String owner, String group, Map<String, String> details, TokenResponse credential) {

    public static JobMatchResponse from(JobAssignment assignment) {
        final var job = assignment.job();
        return new JobMatchResponse(
                job.jobId(), job.owner(), job.group(), job.details(), TokenResponse.from(assignment.credential()));
    }
}
