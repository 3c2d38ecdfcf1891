package ca.gc.cra.dfmet.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {

  @Test
  void delegatesToInjectedClock() {
    Clock fixed = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    assertEquals(1_717_243_200_000L, new SystemClockAdapter(fixed).nowMillis());
  }
}
