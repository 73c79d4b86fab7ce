package ae.teletronics.mediaupload.adapters.time;

import ae.teletronics.mediaupload.ports.ClockProvider;

import java.time.Clock;
import java.time.Instant;

/** Production clock based on system time. */
public class SystemClockProvider implements ClockProvider {
    private final Clock clock = Clock.systemUTC();

    @Override public Instant now() { return clock.instant(); }

    @Override public long nowMillis() { return clock.millis(); }
}
