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

import java.util.List;

/**
 * Translates the universal query AST into one or more backend specific
 * commands. Compilers must be stateless so they can be shared across 
 * threads.
 * 
 * @param <T> The type of compiled query.
 * 
 * @since 1.0
 */
public interface QueryCompiler<T extends CompiledQuery> {

  /**
   * Compiles the query.
   * @param query A non-null and validated query.
   * @return A non-null list of compiled queries in stream order.
   * @throws net.tsbridge.exceptions.QueryValidationException if the query 
   * was malformed.
   * @throws net.tsbridge.exceptions.UnsupportedQueryOperationException if
   * the query used an operator the backend does not support.
   */
  public List<T> compile(final DataQuery query);
}
