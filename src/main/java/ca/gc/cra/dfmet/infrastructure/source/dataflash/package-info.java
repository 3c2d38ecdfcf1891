/**
 * Reader for ArduPilot DataFlash binary logs.
 * <p><strong>Format:</strong> little-endian messages framed by {@code 0xA3 0x95 <id>}; message id 128 ({@code FMT})
 * declares the layout of every other id.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dfmet.infrastructure.source.dataflash;
