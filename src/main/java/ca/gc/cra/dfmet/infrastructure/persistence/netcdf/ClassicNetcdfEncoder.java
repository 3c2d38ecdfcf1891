package ca.gc.cra.dfmet.infrastructure.persistence.netcdf;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Minimal encoder for the NetCDF classic format (CDF-1, 32-bit offsets).
 *
 * <p>Supports fixed-size dimensions, text and double attributes, and one-dimensional {@code int} and {@code double}
 * variables, which is all the observation table needs. The file is assembled in memory: the header is encoded once
 * to measure it, then again with the variable offsets filled in. All values are big-endian and every name, attribute
 * value and variable is padded to a four-byte boundary.
 *
 * <p>Not thread-safe; build one file per instance.
 */
final class ClassicNetcdfEncoder {
  static final byte[] MAGIC = {'C', 'D', 'F', 1};
  static final int NC_DIMENSION = 10;
  static final int NC_VARIABLE = 11;
  static final int NC_ATTRIBUTE = 12;
  static final int NC_CHAR = 2;
  static final int NC_INT = 4;
  static final int NC_DOUBLE = 6;

  private final List<Dimension> dimensions = new ArrayList<>();
  private final List<Attribute> globalAttributes = new ArrayList<>();
  private final List<Variable> variables = new ArrayList<>();

  ClassicNetcdfEncoder dimension(String name, int length) {
    if (length < 0) {
      throw new IllegalArgumentException("dimension length must be >= 0: " + name);
    }
    dimensions.add(new Dimension(name, length));
    return this;
  }

  ClassicNetcdfEncoder globalAttribute(String name, String value) {
    globalAttributes.add(Attribute.text(name, value));
    return this;
  }

  Variable doubleVariable(String name, String dimension, double[] values) {
    return addVariable(new Variable(name, dimensionIndex(dimension, values.length), NC_DOUBLE, values, null));
  }

  Variable intVariable(String name, String dimension, int[] values) {
    return addVariable(new Variable(name, dimensionIndex(dimension, values.length), NC_INT, null, values));
  }

  /**
   * Encodes the complete file.
   *
   * @return file bytes
   * @throws IOException if the data section does not fit 32-bit offsets
   */
  byte[] encode() throws IOException {
    int headerSize = header(new long[variables.size()]).length;
    long[] begins = new long[variables.size()];
    long offset = headerSize;
    for (int i = 0; i < variables.size(); i++) {
      begins[i] = offset;
      offset += variables.get(i).vsize();
    }
    if (offset > Integer.MAX_VALUE) {
      throw new IOException("NetCDF classic file would exceed 2 GiB (" + offset + " bytes)");
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream((int) offset);
    bytes.write(header(begins));
    DataOutputStream out = new DataOutputStream(bytes);
    for (Variable variable : variables) {
      variable.writeData(out);
    }
    out.flush();
    return bytes.toByteArray();
  }

  private Variable addVariable(Variable variable) {
    variables.add(variable);
    return variable;
  }

  private int dimensionIndex(String name, int length) {
    for (int i = 0; i < dimensions.size(); i++) {
      Dimension dimension = dimensions.get(i);
      if (dimension.name().equals(name)) {
        if (dimension.length() != length) {
          throw new IllegalArgumentException(
              "variable length " + length + " does not match dimension " + name + " (" + dimension.length() + ")");
        }
        return i;
      }
    }
    throw new IllegalArgumentException("unknown dimension: " + name);
  }

  private byte[] header(long[] begins) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    out.write(MAGIC);
    out.writeInt(0);
    if (dimensions.isEmpty()) {
      writeAbsent(out);
    } else {
      out.writeInt(NC_DIMENSION);
      out.writeInt(dimensions.size());
      for (Dimension dimension : dimensions) {
        writeName(out, dimension.name());
        out.writeInt(dimension.length());
      }
    }
    writeAttributes(out, globalAttributes);
    if (variables.isEmpty()) {
      writeAbsent(out);
    } else {
      out.writeInt(NC_VARIABLE);
      out.writeInt(variables.size());
      for (int i = 0; i < variables.size(); i++) {
        Variable variable = variables.get(i);
        writeName(out, variable.name());
        out.writeInt(1);
        out.writeInt(variable.dimension());
        writeAttributes(out, variable.attributes);
        out.writeInt(variable.type());
        out.writeInt((int) variable.vsize());
        out.writeInt((int) begins[i]);
      }
    }
    out.flush();
    return bytes.toByteArray();
  }

  private static void writeAttributes(DataOutputStream out, List<Attribute> attributes) throws IOException {
    if (attributes.isEmpty()) {
      writeAbsent(out);
      return;
    }
    out.writeInt(NC_ATTRIBUTE);
    out.writeInt(attributes.size());
    for (Attribute attribute : attributes) {
      writeName(out, attribute.name());
      out.writeInt(attribute.type());
      if (attribute.type() == NC_CHAR) {
        byte[] text = attribute.text().getBytes(StandardCharsets.UTF_8);
        out.writeInt(text.length);
        out.write(text);
        pad(out, text.length);
      } else {
        out.writeInt(attribute.values().length);
        for (double value : attribute.values()) {
          out.writeDouble(value);
        }
      }
    }
  }

  private static void writeAbsent(DataOutputStream out) throws IOException {
    out.writeInt(0);
    out.writeInt(0);
  }

  private static void writeName(DataOutputStream out, String name) throws IOException {
    byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
    out.writeInt(bytes.length);
    out.write(bytes);
    pad(out, bytes.length);
  }

  private static void pad(DataOutputStream out, int length) throws IOException {
    for (int i = length; i % 4 != 0; i++) {
      out.writeByte(0);
    }
  }

  private record Dimension(String name, int length) {}

  private record Attribute(String name, int type, String text, double[] values) {
    static Attribute text(String name, String value) {
      return new Attribute(name, NC_CHAR, Objects.requireNonNull(value, name), null);
    }

    static Attribute doubles(String name, double... values) {
      return new Attribute(name, NC_DOUBLE, null, values.clone());
    }
  }

  /** One-dimensional variable; attributes are appended in declaration order. */
  static final class Variable {
    private final String name;
    private final int dimension;
    private final int type;
    private final double[] doubles;
    private final int[] ints;
    private final List<Attribute> attributes = new ArrayList<>();

    private Variable(String name, int dimension, int type, double[] doubles, int[] ints) {
      this.name = Objects.requireNonNull(name, "name");
      this.dimension = dimension;
      this.type = type;
      this.doubles = doubles == null ? null : doubles.clone();
      this.ints = ints == null ? null : ints.clone();
    }

    Variable attribute(String attributeName, String value) {
      attributes.add(Attribute.text(attributeName, value));
      return this;
    }

    Variable attribute(String attributeName, double value) {
      attributes.add(Attribute.doubles(attributeName, value));
      return this;
    }

    String name() {
      return name;
    }

    int dimension() {
      return dimension;
    }

    int type() {
      return type;
    }

    // 4 and 8 byte elements are always aligned, so no padding is needed.
    long vsize() {
      return type == NC_DOUBLE ? (long) doubles.length * 8 : (long) ints.length * 4;
    }

    private void writeData(DataOutputStream out) throws IOException {
      if (type == NC_DOUBLE) {
        for (double value : doubles) {
          out.writeDouble(value);
        }
      } else {
        for (int value : ints) {
          out.writeInt(value);
        }
      }
    }
  }
}
