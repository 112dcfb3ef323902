package com.trino.client.api.impl.converters;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parsed form of a Trino column type such as {@code decimal(18,4)} or {@code array(row(a integer,
 * b varchar))}.
 *
 * <p>Leaf types carry only numeric arguments (length, precision, scale). Composite types carry
 * child signatures: one for {@code array}, two for {@code map} and one per field for {@code row},
 * where each field may also have a name.
 */
public final class TypeSignature {

  public static final String ARRAY = "array";
  public static final String MAP = "map";
  public static final String ROW = "row";

  private final String rawType;
  private final List<Long> numericArguments;
  private final List<TypeSignature> typeArguments;
  private final List<String> fieldNames;

  TypeSignature(
      String rawType,
      List<Long> numericArguments,
      List<TypeSignature> typeArguments,
      List<String> fieldNames) {
    this.rawType = Objects.requireNonNull(rawType, "rawType");
    this.numericArguments = ImmutableList.copyOf(numericArguments);
    this.typeArguments = ImmutableList.copyOf(typeArguments);
    // Row field names may be null for anonymous fields.
    this.fieldNames = Collections.unmodifiableList(new ArrayList<>(fieldNames));
  }

  public static TypeSignature leaf(String rawType, Long... numericArguments) {
    return new TypeSignature(
        rawType, ImmutableList.copyOf(numericArguments), ImmutableList.of(), ImmutableList.of());
  }

  public static TypeSignature array(TypeSignature elementType) {
    return new TypeSignature(
        ARRAY, ImmutableList.of(), ImmutableList.of(elementType), ImmutableList.of());
  }

  public static TypeSignature map(TypeSignature keyType, TypeSignature valueType) {
    return new TypeSignature(
        MAP, ImmutableList.of(), ImmutableList.of(keyType, valueType), ImmutableList.of());
  }

  public static TypeSignature row(List<String> fieldNames, List<TypeSignature> fieldTypes) {
    Preconditions.checkArgument(
        fieldNames.size() == fieldTypes.size(), "row names and types differ in size");
    return new TypeSignature(ROW, ImmutableList.of(), fieldTypes, fieldNames);
  }

  /** Lower-case base name, including suffixes such as {@code with time zone}. */
  public String getRawType() {
    return rawType;
  }

  public List<Long> getNumericArguments() {
    return numericArguments;
  }

  public List<TypeSignature> getTypeArguments() {
    return typeArguments;
  }

  public List<String> getFieldNames() {
    return fieldNames;
  }

  public boolean isArray() {
    return ARRAY.equals(rawType);
  }

  public boolean isMap() {
    return MAP.equals(rawType);
  }

  public boolean isRow() {
    return ROW.equals(rawType);
  }

  public TypeSignature getElementType() {
    Preconditions.checkState(isArray(), "%s is not an array type", this);
    return typeArguments.get(0);
  }

  public TypeSignature getKeyType() {
    Preconditions.checkState(isMap(), "%s is not a map type", this);
    return typeArguments.get(0);
  }

  public TypeSignature getValueType() {
    Preconditions.checkState(isMap(), "%s is not a map type", this);
    return typeArguments.get(1);
  }

  /** First numeric argument, if any; e.g. the precision of {@code timestamp(6)}. */
  public Integer getFirstNumericArgument() {
    return numericArguments.isEmpty() ? null : numericArguments.get(0).intValue();
  }

  /** Second numeric argument, if any; e.g. the scale of {@code decimal(18,4)}. */
  public Integer getSecondNumericArgument() {
    return numericArguments.size() < 2 ? null : numericArguments.get(1).intValue();
  }

  /** Renders the signature back to Trino's type syntax. */
  @Override
  public String toString() {
    if (numericArguments.isEmpty() && typeArguments.isEmpty()) {
      return rawType;
    }
    String base = rawType;
    String suffix = "";
    int zone = rawType.indexOf(" with time zone");
    if (zone > 0) {
      base = rawType.substring(0, zone);
      suffix = rawType.substring(zone);
    }
    StringBuilder builder = new StringBuilder(base).append('(');
    if (!typeArguments.isEmpty()) {
      for (int i = 0; i < typeArguments.size(); i++) {
        if (i > 0) {
          builder.append(", ");
        }
        if (isRow() && fieldNames.get(i) != null) {
          builder.append(quoteIfNeeded(fieldNames.get(i))).append(' ');
        }
        builder.append(typeArguments.get(i));
      }
    } else {
      for (int i = 0; i < numericArguments.size(); i++) {
        if (i > 0) {
          builder.append(',');
        }
        builder.append(numericArguments.get(i));
      }
    }
    return builder.append(')').append(suffix).toString();
  }

  private static String quoteIfNeeded(String name) {
    if (name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
      return name;
    }
    return '"' + name.replace("\"", "\"\"") + '"';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TypeSignature that = (TypeSignature) o;
    return rawType.equals(that.rawType)
        && numericArguments.equals(that.numericArguments)
        && typeArguments.equals(that.typeArguments)
        && fieldNames.equals(that.fieldNames);
  }

  @Override
  public int hashCode() {
    return Objects.hash(rawType, numericArguments, typeArguments, fieldNames);
  }
}
