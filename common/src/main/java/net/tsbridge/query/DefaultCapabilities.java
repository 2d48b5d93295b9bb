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

import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * A simple capability descriptor backed by a map of named flags. Unknown
 * names are unsupported.
 * 
 * @since 1.0
 */
public class DefaultCapabilities implements Capabilities {
  private final Map<String, Boolean> flags;
  
  protected DefaultCapabilities(final Builder builder) {
    flags = ImmutableMap.copyOf(builder.flags);
  }
  
  @Override
  public boolean supportsRate() {
    return supports(RATE);
  }

  @Override
  public boolean supportsHistogram() {
    return supports(HISTOGRAM);
  }

  @Override
  public boolean supportsLabelJoin() {
    return supports(LABEL_JOIN);
  }

  @Override
  public boolean supports(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      return false;
    }
    final Boolean flag = flags.get(name);
    return flag != null && flag;
  }
  
  @Override
  public String toString() {
    return flags.toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private final Map<String, Boolean> flags = Maps.newTreeMap();
    
    public Builder setRate(final boolean rate) {
      flags.put(RATE, rate);
      return this;
    }
    
    public Builder setHistogram(final boolean histogram) {
      flags.put(HISTOGRAM, histogram);
      return this;
    }
    
    public Builder setLabelJoin(final boolean label_join) {
      flags.put(LABEL_JOIN, label_join);
      return this;
    }
    
    public Builder setFlag(final String name, final boolean flag) {
      if (Strings.isNullOrEmpty(name)) {
        throw new IllegalArgumentException("Capability name cannot be null "
            + "or empty.");
      }
      flags.put(name, flag);
      return this;
    }
    
    public DefaultCapabilities build() {
      return new DefaultCapabilities(this);
    }
  }
}
