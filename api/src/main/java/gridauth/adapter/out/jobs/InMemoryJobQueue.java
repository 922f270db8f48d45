package gridauth.adapter.out.jobs;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.model.pilot.JobMatchRequest;
import gridauth.core.model.pilot.MatchedJob;
import gridauth.spi.JobMatcher;

/**
 * In-memory job queue.
 *
 * <p>Jobs are handed out first-in first-out to pilots of the same VO whose site matches the
 * job's {@code site} detail (when set) and whose tags cover the job's {@code tags} detail
 * (comma-separated, when set). Not shared across instances; real deployments plug their
 * task queue in through {@link JobMatcher}.
 */
@ApplicationScoped
public class InMemoryJobQueue implements JobMatcher {

    private static final Logger LOG = Logger.getLogger(InMemoryJobQueue.class);

    static final String SITE_DETAIL = "site";
    static final String TAGS_DETAIL = "tags";

    private final ConcurrentLinkedQueue<MatchedJob> queue = new ConcurrentLinkedQueue<>();

    /**
     * Add a job to the back of the queue.
     */
    public void submit(MatchedJob job) {
        queue.add(job);
        LOG.debugv("Queued job {0} for VO {1}", job.jobId(), job.vo());
    }

    @Override
    public Uni<Optional<MatchedJob>> match(String vo, String pilotStamp, JobMatchRequest request) {
        return Uni.createFrom().item(() -> {
            final Iterator<MatchedJob> it = queue.iterator();
            while (it.hasNext()) {
                final var job = it.next();
                if (fits(job, vo, request) && queue.remove(job)) {
                    LOG.debugv("Matched job {0} to pilot {1}", job.jobId(), pilotStamp);
                    return Optional.of(job);
                }
            }
            return Optional.empty();
        });
    }

    public int size() {
        return queue.size();
    }

    private static boolean fits(MatchedJob job, String vo, JobMatchRequest request) {
        if (!job.vo().equals(vo)) {
            return false;
        }
        final Map<String, String> details = job.details();
        final var site = details.get(SITE_DETAIL);
        if (site != null && !site.equals(request.site())) {
            return false;
        }
        final var tags = details.get(TAGS_DETAIL);
        if (tags != null && !tags.isBlank()) {
            for (var tag : tags.split(",")) {
                if (!request.tags().contains(tag.trim())) {
                    return false;
                }
            }
        }
        return true;
    }
}
