package ca.gc.cra.dfmet.domain.sample;

import java.util.OptionalDouble;

/**
 * <strong>What:</strong> A classified, typed reading from one sensor channel.
 * <p><strong>Why:</strong> Replaces name-based optional field access with explicit per-channel shapes, so an absent
 * sub-reading and a present-but-NaN one stay distinguishable.</p>
 * <p><strong>Role:</strong> Domain value produced by the channel classifier and consumed by the aggregator.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface Sample
    permits PositionSample,
        PressureSample,
        TemperatureSample,
        HumiditySample,
        InertialTemperatureSample {

  /**
   * Returns the 0-based position of the originating record in the decoded stream.
   *
   * @return decode ordinal, used to break ties deterministically
   */
  long sequence();

  /**
   * Returns the absolute timestamp of the originating record.
   *
   * @return seconds since the Unix epoch
   */
  double timestamp();

  /**
   * Returns the channel this sample belongs to.
   *
   * @return sample channel
   */
  Channel channel();

  /**
   * Returns this sample's contribution to the pooled air-temperature column.
   *
   * @return Celsius reading, or empty when the sample carries no temperature
   */
  OptionalDouble airTemperature();
}
