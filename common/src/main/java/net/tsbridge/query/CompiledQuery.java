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
 * A backend ready representation of one part of a {@link DataQuery}. The
 * shape is owned by each driver. Implementations must render the native 
 * command text from {@link #toString()} so that the same AST always 
 * yields the same text.
 * 
 * @since 1.0
 */
public interface CompiledQuery {
  
  /** @return The name of the driver that compiled the query. */
  public String driver();
  
  /** @return The alias the results of this query are bound to. */
  public String alias();
  
  /** @return The native command text. */
  @Override
  public String toString();
}
