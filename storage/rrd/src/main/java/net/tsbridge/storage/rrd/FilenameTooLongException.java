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
package net.tsbridge.storage.rrd;

import net.tsbridge.exceptions.QueryValidationException;

/**
 * Thrown when the encoded file name for a label set exceeds the file 
 * system limit.
 * 
 * @since 1.0
 */
public class FilenameTooLongException extends QueryValidationException {
  private static final long serialVersionUID = 4301837465529125781L;

  /** The maximum number of bytes in a single path component. */
  public static final int MAX_LENGTH = 255;
  
  /**
   * Default ctor.
   * @param filename The offending file name.
   */
  public FilenameTooLongException(final String filename) {
    super("Encoded file name is " + filename.length() + " bytes, more than " 
        + MAX_LENGTH + ": " + filename, "labels");
  }
}
