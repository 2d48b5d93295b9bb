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
package net.tsbridge.data;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.tsbridge.exceptions.UndefinedLabelException;

/**
 * A named, typed measurable quantity. The namespace and name pair is unique
 * within a metric registry and the declared labels are the only labels 
 * writers and readers may use with the metric. Immutable once built.
 * 
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = MetricIdentifier.Builder.class)
public class MetricIdentifier implements Comparable<MetricIdentifier> {
  private final String namespace;
  private final String name;
  private final String unit;
  private final MetricType type;
  private final List<String> labels;
  private final List<String> aggregations;
  private final List<RetentionPolicy> retention_policies;
  
  protected MetricIdentifier(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.namespace)) {
      throw new IllegalArgumentException("Namespace cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(builder.name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    namespace = builder.namespace;
    name = builder.name;
    unit = builder.unit;
    type = builder.type == null ? MetricType.GAUGE : builder.type;
    if (builder.labels == null) {
      labels = Collections.emptyList();
    } else {
      final Set<String> dedupe = Sets.newHashSet();
      for (final String label : builder.labels) {
        if (Strings.isNullOrEmpty(label)) {
          throw new IllegalArgumentException("Label names cannot be null "
              + "or empty for " + builder.namespace + "." + builder.name);
        }
        if (!dedupe.add(label)) {
          throw new IllegalArgumentException("Duplicate label [" + label 
              + "] for " + builder.namespace + "." + builder.name);
        }
      }
      labels = ImmutableList.copyOf(builder.labels);
    }
    aggregations = builder.aggregations == null ? 
        Collections.<String>emptyList() : 
          ImmutableList.copyOf(builder.aggregations);
    retention_policies = builder.retentionPolicies == null ? 
        Collections.<RetentionPolicy>emptyList() : 
          ImmutableList.copyOf(builder.retentionPolicies);
  }
  
  /** @return The namespace. */
  public String getNamespace() {
    return namespace;
  }
  
  /** @return The metric name within the namespace. */
  public String getName() {
    return name;
  }
  
  /** @return An optional unit, e.g. "bytes". May be null. */
  public String getUnit() {
    return unit;
  }
  
  /** @return The declared type, defaults to {@link MetricType#GAUGE}. */
  public MetricType getType() {
    return type;
  }
  
  /** @return The declared label names in declaration order. */
  public List<String> getLabels() {
    return labels;
  }
  
  /** @return The default aggregations, may be empty. */
  public List<String> getAggregations() {
    return aggregations;
  }
  
  /** @return The retention policies, may be empty. */
  @JsonProperty("retention_policies")
  public List<RetentionPolicy> getRetentionPolicies() {
    return retention_policies;
  }
  
  /** @return The unique key "namespace.name". */
  @JsonIgnore
  public String key() {
    return namespace + "." + name;
  }
  
  /**
   * @param label The label name to look for.
   * @return True if the metric declared the label.
   */
  public boolean hasLabel(final String label) {
    return labels.contains(label);
  }
  
  /**
   * Validates that all of the given label names were declared by this metric.
   * @param names A non-null collection of label names.
   * @throws UndefinedLabelException if one or more labels were not declared.
   */
  public void validateLabels(final Collection<String> names) {
    List<String> undefined = null;
    for (final String label : names) {
      if (!labels.contains(label)) {
        if (undefined == null) {
          undefined = Lists.newArrayList();
        }
        undefined.add(label);
      }
    }
    if (undefined != null) {
      Collections.sort(undefined);
      throw new UndefinedLabelException(key(), undefined, labels);
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final MetricIdentifier that = (MetricIdentifier) o;
    return Objects.equal(namespace, that.namespace)
        && Objects.equal(name, that.name)
        && Objects.equal(unit, that.unit)
        && type == that.type
        && Objects.equal(labels, that.labels)
        && Objects.equal(aggregations, that.aggregations)
        && Objects.equal(retention_policies, that.retention_policies);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(namespace, name, unit, type, labels);
  }
  
  @Override
  public int compareTo(final MetricIdentifier o) {
    return ComparisonChain.start()
        .compare(namespace, o.namespace)
        .compare(name, o.name)
        .result();
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("namespace=")
        .append(namespace)
        .append(", name=")
        .append(name)
        .append(", unit=")
        .append(unit)
        .append(", type=")
        .append(type)
        .append(", labels=")
        .append(labels)
        .append(", aggregations=")
        .append(aggregations)
        .append(", retentionPolicies=")
        .append(retention_policies)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    @JsonProperty
    private String namespace;
    @JsonProperty
    private String name;
    @JsonProperty
    private String unit;
    @JsonProperty
    private MetricType type;
    @JsonProperty
    private List<String> labels;
    @JsonProperty
    private List<String> aggregations;
    @JsonProperty("retention_policies")
    private List<RetentionPolicy> retentionPolicies;
    
    public Builder setNamespace(final String namespace) {
      this.namespace = namespace;
      return this;
    }
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setUnit(final String unit) {
      this.unit = unit;
      return this;
    }
    
    public Builder setType(final MetricType type) {
      this.type = type;
      return this;
    }
    
    public Builder setLabels(final List<String> labels) {
      this.labels = labels;
      return this;
    }
    
    public Builder addLabel(final String label) {
      if (labels == null) {
        labels = Lists.newArrayList();
      }
      labels.add(label);
      return this;
    }
    
    public Builder setAggregations(final List<String> aggregations) {
      this.aggregations = aggregations;
      return this;
    }
    
    @JsonProperty("retention_policies")
    public Builder setRetentionPolicies(
        final List<RetentionPolicy> retention_policies) {
      this.retentionPolicies = retention_policies;
      return this;
    }
    
    public Builder addRetentionPolicy(final RetentionPolicy policy) {
      if (retentionPolicies == null) {
        retentionPolicies = Lists.newArrayList();
      }
      retentionPolicies.add(policy);
      return this;
    }
    
    public MetricIdentifier build() {
      return new MetricIdentifier(this);
    }
  }
}
