package ae.teletronics.mediaupload.ports;

import java.time.Instant;

/**
 * Testable clock abstraction. Elapsed upload times and cache freshness are both measured against it.
 */
public interface ClockProvider {
    Instant now();

    default long nowMillis() {
        return now().toEpochMilli();
    }
}
