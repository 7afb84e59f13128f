/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.pipeline.schema;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.sql.Types;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Primitive column types understood by the pipeline.
 *
 * <p>Names match DuckDB SQL type names so that a column definition can be
 * used verbatim in {@code CREATE TABLE} statements. Java values are:
 * <ul>
 *   <li>BOOLEAN - {@link Boolean}</li>
 *   <li>INTEGER - {@link Integer}</li>
 *   <li>BIGINT - {@link Long}</li>
 *   <li>DOUBLE - {@link Double}</li>
 *   <li>VARCHAR - {@link String}</li>
 *   <li>DATE - {@link LocalDate}</li>
 * </ul>
 */
public enum ColumnType {
  BOOLEAN(Types.BOOLEAN),
  INTEGER(Types.INTEGER),
  BIGINT(Types.BIGINT),
  DOUBLE(Types.DOUBLE),
  VARCHAR(Types.VARCHAR),
  DATE(Types.DATE);

  private final int jdbcType;

  ColumnType(int jdbcType) {
    this.jdbcType = jdbcType;
  }

  /** Returns the {@link Types} constant for this type. */
  public int getJdbcType() {
    return jdbcType;
  }

  /** Returns the SQL name of this type. */
  public String sqlName() {
    return name();
  }

  /**
   * Returns whether a value of this type may be stored in a column of
   * {@code target} type without loss. Only numeric widening is permitted:
   * INTEGER to BIGINT or DOUBLE, and BIGINT to DOUBLE.
   */
  public boolean canWidenTo(ColumnType target) {
    if (this == target) {
      return true;
    }
    switch (this) {
    case INTEGER:
      return target == BIGINT || target == DOUBLE;
    case BIGINT:
      return target == DOUBLE;
    default:
      return false;
    }
  }

  /**
   * Converts a value already of a compatible Java type to this type's
   * canonical Java representation.
   *
   * @throws IllegalArgumentException if the value cannot be represented
   */
  public @Nullable Object coerce(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    switch (this) {
    case BOOLEAN:
      if (value instanceof Boolean) {
        return value;
      }
      break;
    case INTEGER:
      if (value instanceof Integer) {
        return value;
      }
      if (value instanceof Short || value instanceof Byte) {
        return ((Number) value).intValue();
      }
      break;
    case BIGINT:
      if (value instanceof Long) {
        return value;
      }
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
        return ((Number) value).longValue();
      }
      break;
    case DOUBLE:
      if (value instanceof Double) {
        return value;
      }
      if (value instanceof Number) {
        return ((Number) value).doubleValue();
      }
      break;
    case VARCHAR:
      if (value instanceof String) {
        return value;
      }
      break;
    case DATE:
      if (value instanceof LocalDate) {
        return value;
      }
      if (value instanceof java.sql.Date) {
        return ((java.sql.Date) value).toLocalDate();
      }
      if (value instanceof String) {
        return LocalDate.parse((String) value);
      }
      break;
    default:
      break;
    }
    throw new IllegalArgumentException("Cannot convert " + value.getClass().getSimpleName()
        + " value '" + value + "' to " + this);
  }

  /**
   * Parses a text cell into this type. Empty text is null.
   *
   * @throws IllegalArgumentException if the text is not a valid literal
   */
  public @Nullable Object parse(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    try {
      switch (this) {
      case BOOLEAN:
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "1".equals(lower)) {
          return Boolean.TRUE;
        }
        if ("false".equals(lower) || "0".equals(lower)) {
          return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a BOOLEAN: '" + text + "'");
      case INTEGER:
        return Integer.valueOf(trimmed);
      case BIGINT:
        return Long.valueOf(trimmed);
      case DOUBLE:
        double d = Double.parseDouble(trimmed);
        if (Double.isNaN(d) || Double.isInfinite(d)) {
          throw new IllegalArgumentException("Not a finite DOUBLE: '" + text + "'");
        }
        return d;
      case VARCHAR:
        return text;
      case DATE:
        return LocalDate.parse(trimmed);
      default:
        throw new IllegalArgumentException("Unsupported type " + this);
      }
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new IllegalArgumentException("Not a " + this + ": '" + text + "'", e);
    }
  }

  /**
   * Returns the type of a Java value, or null for null.
   *
   * @throws IllegalArgumentException for unsupported Java classes
   */
  public static @Nullable ColumnType of(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean) {
      return BOOLEAN;
    }
    if (value instanceof Integer) {
      return INTEGER;
    }
    if (value instanceof Long) {
      return BIGINT;
    }
    if (value instanceof Double) {
      return DOUBLE;
    }
    if (value instanceof String) {
      return VARCHAR;
    }
    if (value instanceof LocalDate) {
      return DATE;
    }
    throw new IllegalArgumentException("Unsupported value class " + value.getClass().getName());
  }

  /** Parses a type name, case-insensitively, accepting a few SQL aliases. */
  public static ColumnType fromName(String name) {
    String upper = name.trim().toUpperCase(Locale.ROOT);
    switch (upper) {
    case "INT":
    case "INT4":
      return INTEGER;
    case "LONG":
    case "INT8":
      return BIGINT;
    case "FLOAT8":
    case "DOUBLE PRECISION":
      return DOUBLE;
    case "STRING":
    case "TEXT":
      return VARCHAR;
    case "BOOL":
      return BOOLEAN;
    default:
      return ColumnType.valueOf(upper);
    }
  }
}
