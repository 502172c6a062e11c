package io.invoiceops.internal.s3;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts applied to every S3 client opened for a job.
 *
 * @param apiCallTimeout        upper bound for one API call including SDK retries
 * @param apiCallAttemptTimeout upper bound for a single HTTP attempt
 */
public record S3ClientSettings(
        Duration apiCallTimeout,
        Duration apiCallAttemptTimeout
) {
    public static final S3ClientSettings DEFAULTS =
            new S3ClientSettings(Duration.ofSeconds(60), Duration.ofSeconds(20));

    public S3ClientSettings {
        Objects.requireNonNull(apiCallTimeout, "apiCallTimeout must not be null");
        Objects.requireNonNull(apiCallAttemptTimeout, "apiCallAttemptTimeout must not be null");
        if (apiCallTimeout.isZero() || apiCallTimeout.isNegative()) {
            throw new IllegalArgumentException("apiCallTimeout must be positive");
        }
        if (apiCallAttemptTimeout.isZero() || apiCallAttemptTimeout.isNegative()) {
            throw new IllegalArgumentException("apiCallAttemptTimeout must be positive");
        }
    }
}
