package gridauth.core.model.pilot;

import java.util.Set;

/**
 * What a pilot can run.
 *
 * @param site             site the pilot runs at
 * @param computingElement computing element, may be null
 * @param tags             capabilities of the worker node (e.g. {@code GPU})
 */
public record JobMatchRequest(String site, String computingElement, Set<String> tags) {

    public JobMatchRequest {
        tags = tags != null ? Set.copyOf(tags) : Set.of();
    }
}
