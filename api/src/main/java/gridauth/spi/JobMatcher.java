package gridauth.spi;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.pilot.JobMatchRequest;
import gridauth.core.model.pilot.MatchedJob;

/**
 * SPI to the task queue that hands jobs to pilots.
 *
 * <p>The token core only needs to know which job, if any, a pilot received;
 * queueing and scheduling policy live behind this interface.
 */
public interface JobMatcher {

    /**
     * Pick a job for the pilot, removing it from the queue.
     *
     * @param vo         VO of the pilot
     * @param pilotStamp stamp of the pilot
     * @param request    what the pilot can run
     * @return the matched job, or empty if nothing fits
     */
    Uni<Optional<MatchedJob>> match(String vo, String pilotStamp, JobMatchRequest request);
}
