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

import java.util.Collection;
import java.util.Iterator;

import net.tsbridge.exceptions.QueryValidationException;

/**
 * Base for the AST nodes to make sure all the bits of a query are there
 * before a compiler sees them.
 * 
 * @since 1.0
 */
public abstract class Validatable {
  
  /**
   * Validates the node.
   * @throws IllegalArgumentException if one or more fields were invalid.
   */
  abstract public void validate();

  /**
   * Iterate through a field that is a collection of nodes and validate each 
   * of them. Inherit the member's error message.
   * @param collection the validatable collection
   * @param name name of the field
   */
  <T extends Validatable> void validateCollection(final Collection<T> collection,
                                                  final String name) {
    Iterator<T> iterator = collection.iterator();
    int i = 0;
    while (iterator.hasNext()) {
      try {
        iterator.next().validate();
      } catch (final QueryValidationException e) {
        throw new QueryValidationException("Invalid " + name + 
            " at index " + i + ": " + e.getMessage(), e.field(), e);
      } catch (final IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid " + name + 
            " at index " + i + ": " + e.getMessage(), e);
      }
      i++;
    }
  }
}
