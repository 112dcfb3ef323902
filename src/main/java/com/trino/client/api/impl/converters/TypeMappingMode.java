package com.trino.client.api.impl.converters;

/** How wire values are turned into Java objects. */
public enum TypeMappingMode {
  /** Typed values: numbers, {@code java.time} wrappers, structs, lists and maps. */
  TYPED,
  /** Values exactly as parsed from JSON: strings, numbers, booleans, lists and maps. */
  LEGACY_PRIMITIVE
}
