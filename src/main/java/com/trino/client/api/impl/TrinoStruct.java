package com.trino.client.api.impl;

import com.trino.client.exception.TrinoValidationException;
import java.sql.Struct;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value of a {@code row(...)} column.
 *
 * <p>Fields are addressable by position and, when the row type declares names, by name. Anonymous
 * fields have a null name. Looking up a name that is declared more than once is an error rather
 * than silently picking one.
 */
public class TrinoStruct implements Struct {

  private final List<Object> values;
  private final List<String> fieldNames;
  private final List<String> fieldTypes;

  public TrinoStruct(List<Object> values, List<String> fieldNames, List<String> fieldTypes) {
    if (values.size() != fieldNames.size() || values.size() != fieldTypes.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Row has %d values but %d names and %d types",
              values.size(), fieldNames.size(), fieldTypes.size()));
    }
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
    this.fieldNames = Collections.unmodifiableList(new ArrayList<>(fieldNames));
    this.fieldTypes = Collections.unmodifiableList(new ArrayList<>(fieldTypes));
  }

  public int size() {
    return values.size();
  }

  public Object get(int index) {
    return values.get(index);
  }

  public Object get(String name) throws TrinoValidationException {
    int found = -1;
    for (int i = 0; i < fieldNames.size(); i++) {
      if (name.equals(fieldNames.get(i))) {
        if (found >= 0) {
          throw new TrinoValidationException("Ambiguous row field reference: " + name);
        }
        found = i;
      }
    }
    if (found < 0) {
      throw new TrinoValidationException("Row has no field named " + name);
    }
    return values.get(found);
  }

  public List<Object> getValues() {
    return values;
  }

  public List<String> getFieldNames() {
    return fieldNames;
  }

  public List<String> getFieldTypes() {
    return fieldTypes;
  }

  @Override
  public String getSQLTypeName() {
    return "ROW";
  }

  @Override
  public Object[] getAttributes() {
    return values.toArray();
  }

  @Override
  public Object[] getAttributes(Map<String, Class<?>> map) {
    return getAttributes();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TrinoStruct)) {
      return false;
    }
    TrinoStruct that = (TrinoStruct) obj;
    return valuesEqual(values, that.values) && fieldNames.equals(that.fieldNames);
  }

  private static boolean valuesEqual(List<Object> left, List<Object> right) {
    if (left.size() != right.size()) {
      return false;
    }
    for (int i = 0; i < left.size(); i++) {
      if (!Objects.deepEquals(left.get(i), right.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(values, fieldNames);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("(");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      if (fieldNames.get(i) != null) {
        builder.append(fieldNames.get(i)).append(": ");
      }
      Object value = values.get(i);
      builder.append(value instanceof byte[] ? Arrays.toString((byte[]) value) : value);
    }
    return builder.append(')').toString();
  }
}
