// This file is part of tsbridge.
// Copyright (C) 2026  The tsbridge Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsbridge.query;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.tsbridge.data.TagValue;
import net.tsbridge.exceptions.QueryValidationException;
import net.tsbridge.utils.DateTime;

/**
 * One step of a stream's pipeline. Rate steps may carry a sampling 
 * interval, math steps always carry exactly one operator and operand and 
 * group-by steps carry the labels to group on.
 * 
 * @since 1.0
 */
public class Transformation extends Validatable {
  private final TransformationType type;
  private final String interval;
  private final MathOperator operator;
  private final double operand;
  private final List<String> labels;
  
  private Transformation(final TransformationType type, 
                         final String interval,
                         final MathOperator operator, 
                         final double operand, 
                         final List<String> labels) {
    this.type = type;
    this.interval = interval;
    this.operator = operator;
    this.operand = operand;
    this.labels = labels;
    validate();
  }
  
  /** @return A rate transformation without an explicit interval. */
  public static Transformation rate() {
    return new Transformation(TransformationType.RATE, null, null, 0, 
        Collections.<String>emptyList());
  }
  
  /**
   * @param interval A sampling interval such as "5m".
   * @return A rate transformation.
   */
  public static Transformation rate(final String interval) {
    return new Transformation(TransformationType.RATE, interval, null, 0, 
        Collections.<String>emptyList());
  }
  
  /** @return A delta transformation. */
  public static Transformation delta() {
    return new Transformation(TransformationType.DELTA, null, null, 0, 
        Collections.<String>emptyList());
  }
  
  /**
   * @param operator The non-null operator.
   * @param operand The constant operand.
   * @return A math transformation.
   */
  public static Transformation math(final MathOperator operator, 
                                    final double operand) {
    return new Transformation(TransformationType.MATH, null, operator, 
        operand, Collections.<String>emptyList());
  }
  
  /**
   * @param labels One or more labels to group on.
   * @return A group-by transformation.
   */
  public static Transformation groupBy(final String... labels) {
    return groupBy(Arrays.asList(labels));
  }
  
  /**
   * @param labels One or more labels to group on.
   * @return A group-by transformation.
   */
  public static Transformation groupBy(final List<String> labels) {
    return new Transformation(TransformationType.GROUP_BY, null, null, 0, 
        labels == null ? Collections.<String>emptyList() : 
          ImmutableList.copyOf(labels));
  }
  
  /** @return The type of step. */
  public TransformationType getType() {
    return type;
  }
  
  /** @return The rate interval, may be null. */
  public String getInterval() {
    return interval;
  }
  
  /** @return The math operator, null for other types. */
  public MathOperator getOperator() {
    return operator;
  }
  
  /** @return The math operand. */
  public double getOperand() {
    return operand;
  }
  
  /** @return The operand formatted without trailing zeros. */
  public String getOperandString() {
    return TagValue.formatDouble(operand);
  }
  
  /** @return The group-by labels, empty for other types. */
  public List<String> getLabels() {
    return labels;
  }
  
  @Override
  public void validate() {
    if (type == null) {
      throw new QueryValidationException("Transformation type cannot be "
          + "null.", "type");
    }
    switch (type) {
    case RATE:
      if (!Strings.isNullOrEmpty(interval)) {
        try {
          DateTime.parseDuration(interval);
        } catch (IllegalArgumentException e) {
          throw new QueryValidationException("Invalid rate interval: " 
              + interval, "interval", e);
        }
      }
      break;
    case MATH:
      if (operator == null) {
        throw new QueryValidationException("Math transformation requires "
            + "an operator.", "operator");
      }
      if (Double.isNaN(operand) || Double.isInfinite(operand)) {
        throw new QueryValidationException("Math operand must be finite: " 
            + operand, "operand");
      }
      if (operator == MathOperator.DIVIDE && operand == 0) {
        throw new QueryValidationException("Division by zero.", "operand");
      }
      break;
    case GROUP_BY:
      if (labels.isEmpty()) {
        throw new QueryValidationException("Group by requires at least one "
            + "label.", "labels");
      }
      break;
    default:
      break;
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Transformation that = (Transformation) o;
    return type == that.type
        && Objects.equal(interval, that.interval)
        && operator == that.operator
        && Double.compare(operand, that.operand) == 0
        && Objects.equal(labels, that.labels);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(type, interval, operator, operand, labels);
  }
  
  @Override
  public String toString() {
    switch (type) {
    case RATE:
      return interval == null ? "rate" : "rate(" + interval + ")";
    case MATH:
      return operator.symbol() + " " + getOperandString();
    case GROUP_BY:
      return "group by " + labels;
    default:
      return type.name().toLowerCase(Locale.ROOT);
    }
  }
}
