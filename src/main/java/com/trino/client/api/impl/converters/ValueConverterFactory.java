package com.trino.client.api.impl.converters;

import com.trino.client.api.impl.AbstractTrinoTemporal;
import java.util.ArrayList;
import java.util.List;

/** Builds the converter tree for a column type. */
public final class ValueConverterFactory {

  private ValueConverterFactory() {}

  public static ValueConverter create(TypeSignature signature, TypeMappingMode mode) {
    if (mode == TypeMappingMode.LEGACY_PRIMITIVE) {
      return PassThroughConverter.INSTANCE;
    }
    return create(signature);
  }

  private static ValueConverter create(TypeSignature signature) {
    switch (signature.getRawType()) {
      case "boolean":
        return new BooleanConverter();
      case "tinyint":
        return new IntegerConverter(IntegerConverter.Width.TINYINT);
      case "smallint":
        return new IntegerConverter(IntegerConverter.Width.SMALLINT);
      case "integer":
        return new IntegerConverter(IntegerConverter.Width.INTEGER);
      case "bigint":
        return new IntegerConverter(IntegerConverter.Width.BIGINT);
      case "real":
        return new DoubleConverter(true);
      case "double":
        return new DoubleConverter(false);
      case "decimal":
        return new DecimalConverter(signature.getSecondNumericArgument());
      case "varchar":
      case "char":
      case "json":
      case "ipaddress":
        return new StringConverter();
      case "varbinary":
        return new BinaryConverter();
      case "date":
        return TemporalConverters.date();
      case "time":
        return TemporalConverters.time(precisionOf(signature));
      case "time with time zone":
        return TemporalConverters.timeWithTimeZone(precisionOf(signature));
      case "timestamp":
        return TemporalConverters.timestamp(precisionOf(signature));
      case "timestamp with time zone":
        return TemporalConverters.timestampWithTimeZone(precisionOf(signature));
      case "interval year to month":
        return TemporalConverters.intervalYearToMonth();
      case "interval day to second":
        return TemporalConverters.intervalDayToSecond();
      case "uuid":
        return new UuidConverter();
      case TypeSignature.ARRAY:
        return new ArrayConverter(create(signature.getElementType()));
      case TypeSignature.MAP:
        return new MapConverter(create(signature.getKeyType()), create(signature.getValueType()));
      case TypeSignature.ROW:
        return createRow(signature);
      default:
        return PassThroughConverter.INSTANCE;
    }
  }

  private static ValueConverter createRow(TypeSignature signature) {
    List<ValueConverter> converters = new ArrayList<>();
    List<String> types = new ArrayList<>();
    for (TypeSignature field : signature.getTypeArguments()) {
      converters.add(create(field));
      types.add(field.getRawType());
    }
    return new RowConverter(converters, signature.getFieldNames(), types);
  }

  private static int precisionOf(TypeSignature signature) {
    Integer precision = signature.getFirstNumericArgument();
    return precision == null ? AbstractTrinoTemporal.DEFAULT_PRECISION : precision;
  }
}
