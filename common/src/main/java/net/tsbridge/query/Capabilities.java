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

/**
 * Declares which operators a backend supports natively. Compilers consult
 * it before emitting a construct and either emulate an unsupported 
 * operator client side or fail with an 
 * {@link net.tsbridge.exceptions.UnsupportedQueryOperationException}.
 * 
 * @since 1.0
 */
public interface Capabilities {
  public static final String RATE = "rate";
  public static final String HISTOGRAM = "histogram";
  public static final String LABEL_JOIN = "label_join";
  
  /** @return Whether or not the backend computes rates natively. */
  public boolean supportsRate();
  
  /** @return Whether or not the backend handles histograms. */
  public boolean supportsHistogram();
  
  /** @return Whether or not the backend can group or join on labels. */
  public boolean supportsLabelJoin();
  
  /**
   * @param name A capability name.
   * @return True if the backend supports the named capability.
   */
  public boolean supports(final String name);
}
