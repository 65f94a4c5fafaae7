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
package org.apache.calcite.adapter.profiler.value;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A decoded field value.
 *
 * <p>The set of variants is closed: {@link Missing}, {@link IntValue},
 * {@link FloatValue}, {@link BoolValue}, {@link TextValue} and
 * {@link TemporalValue}. Every non-missing value keeps its trimmed source text,
 * which is what cardinality, frequency and length statistics are computed on.
 */
public abstract class Value {

  /** Discriminator of the variants. */
  public enum Kind {
    MISSING, INT, FLOAT, BOOL, TEXT, TEMPORAL
  }

  private static final Missing MISSING = new Missing();

  private final String text;

  private Value(String text) {
    this.text = text;
  }

  public abstract Kind kind();

  /**
   * Returns the trimmed source text; empty for {@link Missing}.
   */
  public String text() {
    return text;
  }

  public boolean isMissing() {
    return kind() == Kind.MISSING;
  }

  public static Value missing() {
    return MISSING;
  }

  public static Value ofLong(long value, String text) {
    return new IntValue(value, text);
  }

  public static Value ofDouble(double value, String text) {
    return new FloatValue(value, text);
  }

  public static Value ofBoolean(boolean value, String text) {
    return new BoolValue(value, text);
  }

  public static Value ofText(String text) {
    return new TextValue(text);
  }

  public static Value ofTemporal(LocalDateTime value, boolean dateOnly, String text) {
    return new TemporalValue(value, dateOnly, text);
  }

  @Override public String toString() {
    return kind() + "(" + text + ")";
  }

  /** Absent value. */
  public static final class Missing extends Value {
    private Missing() {
      super("");
    }

    @Override public Kind kind() {
      return Kind.MISSING;
    }
  }

  /** 64-bit integer. */
  public static final class IntValue extends Value {
    private final long value;

    private IntValue(long value, String text) {
      super(text);
      this.value = value;
    }

    @Override public Kind kind() {
      return Kind.INT;
    }

    public long longValue() {
      return value;
    }
  }

  /** Double precision floating point number. */
  public static final class FloatValue extends Value {
    private final double value;

    private FloatValue(double value, String text) {
      super(text);
      this.value = value;
    }

    @Override public Kind kind() {
      return Kind.FLOAT;
    }

    public double doubleValue() {
      return value;
    }
  }

  /** Boolean literal. */
  public static final class BoolValue extends Value {
    private final boolean value;

    private BoolValue(boolean value, String text) {
      super(text);
      this.value = value;
    }

    @Override public Kind kind() {
      return Kind.BOOL;
    }

    public boolean booleanValue() {
      return value;
    }
  }

  /** Free text. */
  public static final class TextValue extends Value {
    private TextValue(String text) {
      super(text);
    }

    @Override public Kind kind() {
      return Kind.TEXT;
    }
  }

  /** Date or date-time; dates sit at the start of their day. */
  public static final class TemporalValue extends Value {
    private final LocalDateTime value;
    private final boolean dateOnly;

    private TemporalValue(LocalDateTime value, boolean dateOnly, String text) {
      super(text);
      this.value = Objects.requireNonNull(value, "value");
      this.dateOnly = dateOnly;
    }

    @Override public Kind kind() {
      return Kind.TEMPORAL;
    }

    public LocalDateTime temporalValue() {
      return value;
    }

    public boolean isDateOnly() {
      return dateOnly;
    }
  }

  /**
   * Returns the numeric value of an {@link IntValue} or {@link FloatValue}.
   *
   * @throws IllegalStateException for any other variant
   */
  public double asDouble() {
    if (this instanceof IntValue) {
      return ((IntValue) this).longValue();
    }
    if (this instanceof FloatValue) {
      return ((FloatValue) this).doubleValue();
    }
    throw new IllegalStateException("Not a numeric value: " + this);
  }
}
