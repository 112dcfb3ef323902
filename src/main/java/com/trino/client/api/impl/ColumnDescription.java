package com.trino.client.api.impl;

import com.google.common.base.MoreObjects;
import com.trino.client.api.impl.converters.TypeSignature;
import com.trino.client.api.impl.converters.TypeSignatureParser;
import com.trino.client.exception.TrinoProtocolException;
import com.trino.client.model.core.Column;
import java.util.Objects;

/**
 * Describes one result column: name, type text and the size attributes derived from the parsed
 * type. Display size and nullability are not reported by the server and are always null.
 */
public class ColumnDescription {

  private final String name;
  private final String type;
  private final TypeSignature signature;
  private final Integer internalSize;
  private final Integer precision;
  private final Integer scale;

  ColumnDescription(String name, String type, TypeSignature signature) {
    this.name = name;
    this.type = type;
    this.signature = signature;
    this.internalSize = internalSizeOf(signature);
    this.precision = precisionOf(signature);
    this.scale = scaleOf(signature);
  }

  public static ColumnDescription fromColumn(Column column) throws TrinoProtocolException {
    if (column.getName() == null || column.getType() == null) {
      throw new TrinoProtocolException("Column without name or type: " + column);
    }
    return new ColumnDescription(
        column.getName(), column.getType(), TypeSignatureParser.parse(column.getType()));
  }

  private static Integer internalSizeOf(TypeSignature signature) {
    switch (signature.getRawType()) {
      case "boolean":
      case "tinyint":
        return 1;
      case "smallint":
        return 2;
      case "integer":
      case "real":
        return 4;
      case "bigint":
      case "double":
        return 8;
      case "uuid":
        return 16;
      case "varchar":
      case "char":
        return signature.getFirstNumericArgument();
      default:
        return null;
    }
  }

  private static Integer precisionOf(TypeSignature signature) {
    switch (signature.getRawType()) {
      case "tinyint":
        return 3;
      case "smallint":
        return 5;
      case "integer":
        return 10;
      case "bigint":
        return 19;
      case "real":
        return 7;
      case "double":
        return 15;
      case "decimal":
      case "varchar":
      case "char":
        return signature.getFirstNumericArgument();
      case "time":
      case "time with time zone":
      case "timestamp":
      case "timestamp with time zone":
        Integer declared = signature.getFirstNumericArgument();
        return declared == null ? AbstractTrinoTemporal.DEFAULT_PRECISION : declared;
      default:
        return null;
    }
  }

  private static Integer scaleOf(TypeSignature signature) {
    switch (signature.getRawType()) {
      case "tinyint":
      case "smallint":
      case "integer":
      case "bigint":
        return 0;
      case "decimal":
        return signature.getSecondNumericArgument();
      default:
        return null;
    }
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public TypeSignature getSignature() {
    return signature;
  }

  public Integer getDisplaySize() {
    return null;
  }

  public Integer getInternalSize() {
    return internalSize;
  }

  public Integer getPrecision() {
    return precision;
  }

  public Integer getScale() {
    return scale;
  }

  public Boolean getNullOk() {
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ColumnDescription that = (ColumnDescription) o;
    return name.equals(that.name) && type.equals(that.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("type", type)
        .add("internalSize", internalSize)
        .add("precision", precision)
        .add("scale", scale)
        .toString();
  }
}
