package gridauth.core.model.auth;

import java.time.Duration;

/**
 * Optional claims and overrides for a minted access token.
 *
 * @param pilotStamp       value of the {@code pilot_stamp} claim
 * @param jobId            value of the {@code job_id} claim
 * @param legacyExchange   whether to set {@code legacy_exchange=true}
 * @param lifetimeOverride lifetime replacing the lifetime class default
 */
public record TokenExtras(String pilotStamp, String jobId, boolean legacyExchange, Duration lifetimeOverride) {

    public static final TokenExtras NONE = new TokenExtras(null, null, false, null);

    public static TokenExtras pilot(String pilotStamp) {
        return new TokenExtras(pilotStamp, null, false, null);
    }

    public static TokenExtras job(String pilotStamp, String jobId) {
        return new TokenExtras(pilotStamp, jobId, false, null);
    }

    public static TokenExtras legacy(Duration lifetimeOverride) {
        return new TokenExtras(null, null, true, lifetimeOverride);
    }
}
