package ca.gc.cra.dfmet.infrastructure.persistence.netcdf;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ClassicNetcdfEncoderTest {

  @Test
  void encodesHeaderOffsetsAndBigEndianData() throws IOException {
    ClassicNetcdfEncoder encoder = new ClassicNetcdfEncoder()
        .dimension("obs", 2)
        .globalAttribute("title", "x");
    encoder.intVariable("n", "obs", new int[] {1, 2});
    encoder.doubleVariable("v", "obs", new double[] {1.5, Double.NaN}).attribute("units", "m");

    byte[] bytes = encoder.encode();
    ByteBuffer buf = ByteBuffer.wrap(bytes);

    assertEquals(188, bytes.length);
    assertArrayEquals(ClassicNetcdfEncoder.MAGIC, Arrays.copyOf(bytes, 4));
    assertEquals(0, buf.getInt(4));
    assertEquals(ClassicNetcdfEncoder.NC_DIMENSION, buf.getInt(8));
    assertEquals(1, buf.getInt(12));
    assertEquals(3, buf.getInt(16));
    assertEquals(2, buf.getInt(24));
    assertEquals(ClassicNetcdfEncoder.NC_ATTRIBUTE, buf.getInt(28));
    assertEquals(ClassicNetcdfEncoder.NC_CHAR, buf.getInt(48));
    assertEquals(ClassicNetcdfEncoder.NC_VARIABLE, buf.getInt(60));
    assertEquals(2, buf.getInt(64));

    assertEquals(ClassicNetcdfEncoder.NC_INT, buf.getInt(92));
    assertEquals(8, buf.getInt(96));
    assertEquals(164, buf.getInt(100));
    assertEquals(ClassicNetcdfEncoder.NC_DOUBLE, buf.getInt(152));
    assertEquals(16, buf.getInt(156));
    assertEquals(172, buf.getInt(160));

    assertEquals(1, buf.getInt(164));
    assertEquals(2, buf.getInt(168));
    assertEquals(1.5, buf.getDouble(172));
    assertTrue(Double.isNaN(buf.getDouble(180)));
  }

  @Test
  void emptyListsAreEncodedAsAbsent() throws IOException {
    byte[] bytes = new ClassicNetcdfEncoder().encode();

    assertEquals(32, bytes.length);
    ByteBuffer buf = ByteBuffer.wrap(bytes);
    for (int offset = 8; offset < 32; offset += 4) {
      assertEquals(0, buf.getInt(offset));
    }
  }

  @Test
  void variableMustMatchItsDimension() {
    ClassicNetcdfEncoder encoder = new ClassicNetcdfEncoder().dimension("time", 3);

    assertThrows(IllegalArgumentException.class, () -> encoder.doubleVariable("v", "time", new double[2]));
    assertThrows(IllegalArgumentException.class, () -> encoder.intVariable("n", "obs", new int[3]));
    assertThrows(IllegalArgumentException.class, () -> encoder.dimension("bad", -1));
  }
}
