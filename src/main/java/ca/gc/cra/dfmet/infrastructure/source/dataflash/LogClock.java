package ca.gc.cra.dfmet.infrastructure.source.dataflash;

/**
 * Maps the autopilot's boot-relative microsecond clock onto Unix seconds.
 *
 * <p>Anchored on a GPS message: {@code unix = week * 604800 + ms / 1000 + 315964800 - leapSeconds}, where 315964800
 * is the Unix time of the GPS epoch (1980-01-06). Every other message is offset from the anchor by its own
 * {@code TimeUS} delta.
 *
 * @param anchorUnix Unix seconds at the anchor
 * @param anchorMicros boot-relative microseconds at the anchor
 * @param absolute whether the clock is GPS-anchored; {@code false} means boot-relative seconds
 * @since 0.1.0
 */
record LogClock(double anchorUnix, double anchorMicros, boolean absolute) {
  static final long GPS_TO_UNIX_OFFSET = 315_964_800L;
  static final long SECONDS_PER_WEEK = 604_800L;
  static final int DEFAULT_LEAP_SECONDS = 18;

  /** Clock used when no GPS week/time is available: seconds since boot. */
  static final LogClock BOOT_RELATIVE = new LogClock(0.0, 0.0, false);

  /**
   * Anchors the clock on a GPS fix.
   *
   * @param gpsWeek GPS week number
   * @param gpsMillis milliseconds into the GPS week
   * @param timeMicros boot-relative time of the fix
   * @param leapSeconds GPS minus UTC offset in seconds
   * @return anchored clock
   */
  static LogClock anchored(double gpsWeek, double gpsMillis, double timeMicros, int leapSeconds) {
    double unix = gpsWeek * SECONDS_PER_WEEK + gpsMillis / 1000.0 + GPS_TO_UNIX_OFFSET - leapSeconds;
    return new LogClock(unix, timeMicros, true);
  }

  /**
   * Converts a boot-relative timestamp.
   *
   * @param timeMicros boot-relative microseconds
   * @return Unix seconds, or seconds since boot for an unanchored clock
   */
  double toUnixSeconds(double timeMicros) {
    return anchorUnix + (timeMicros - anchorMicros) / 1e6;
  }
}
