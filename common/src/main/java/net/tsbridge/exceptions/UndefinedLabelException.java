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
package net.tsbridge.exceptions;

import java.util.Collection;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Thrown when a write or query references labels that the metric did not
 * declare. The message lists the allowed labels so the caller can correct
 * the request.
 * 
 * @since 1.0
 */
public class UndefinedLabelException extends QueryValidationException {
  private static final long serialVersionUID = -1730470522116925934L;

  /** The metric key. */
  private final String metric;
  
  /** The labels that were not declared. */
  private final List<String> undefined;
  
  /** The labels declared by the metric. */
  private final List<String> allowed;
  
  /**
   * Default ctor.
   * @param metric The non-null metric key.
   * @param undefined The non-null undeclared labels.
   * @param allowed The non-null declared labels.
   */
  public UndefinedLabelException(final String metric, 
                                 final Collection<String> undefined,
                                 final Collection<String> allowed) {
    super("Undefined label(s): " + Joiner.on(", ").join(undefined) 
        + ". Allowed labels for " + metric + ": " 
        + Joiner.on(", ").join(allowed), "labels");
    this.metric = metric;
    this.undefined = ImmutableList.copyOf(undefined);
    this.allowed = ImmutableList.copyOf(allowed);
  }
  
  /** @return The metric key. */
  public String metric() {
    return metric;
  }
  
  /** @return The labels that were not declared. */
  public List<String> undefinedLabels() {
    return undefined;
  }
  
  /** @return The labels declared by the metric. */
  public List<String> allowedLabels() {
    return allowed;
  }
}
