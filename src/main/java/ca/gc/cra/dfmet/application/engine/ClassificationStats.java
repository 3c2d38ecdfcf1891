package ca.gc.cra.dfmet.application.engine;

import ca.gc.cra.dfmet.domain.sample.Channel;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts gathered while classifying one record stream.
 *
 * @param recordsSeen records handed to the engine
 * @param recordsDropped records that matched no channel
 * @param samplesPerChannel classified samples per channel; every channel is present
 * @since 0.1.0
 */
public record ClassificationStats(long recordsSeen, long recordsDropped, Map<Channel, Long> samplesPerChannel) {

  /** Copies the per-channel counts, filling missing channels with zero. */
  public ClassificationStats {
    EnumMap<Channel, Long> copy = new EnumMap<>(Channel.class);
    for (Channel channel : Channel.values()) {
      copy.put(channel, 0L);
    }
    if (samplesPerChannel != null) {
      copy.putAll(samplesPerChannel);
    }
    samplesPerChannel = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the sample count of one channel.
   *
   * @param channel channel
   * @return number of samples
   */
  public long samples(Channel channel) {
    return samplesPerChannel.get(channel);
  }
}
