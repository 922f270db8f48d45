package gridauth.adapter.in.dto;

import java.util.Set;

import gridauth.core.model.pilot.JobMatchRequest;

/**
 * Resources a pilot offers when asking for a job.
 */
public record JobMatchRequestDto(String site, String computingElement, Set<String> tags) {

    public JobMatchRequest toRequest() {
        return new JobMatchRequest(site, computingElement, tags);
    }
}
