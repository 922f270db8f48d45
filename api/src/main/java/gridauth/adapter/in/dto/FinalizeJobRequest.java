package gridauth.adapter.in.dto;

import gridauth.core.model.pilot.JobOutcome;

/**
 * @param outcome how the job ended, defaults to {@link JobOutcome#SUCCEEDED}
 */
public record FinalizeJobRequest(JobOutcome outcome) {

    public JobOutcome outcomeOrDefault() {
        return outcome != null ? outcome : JobOutcome.SUCCEEDED;
    }
}
