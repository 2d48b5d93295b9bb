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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reversible escaping of names, label keys and label values for use in
 * RRD file paths. Bytes outside {@code [A-Za-z0-9._-]} are written as 
 * {@code %XX} over the UTF-8 encoding, so the path delimiters {@code /}, 
 * {@code ,} and {@code =} never appear in an encoded component. A leading
 * dot is escaped as well so no component resolves to {@code .} or 
 * {@code ..} or a hidden file.
 * 
 * @since 1.0
 */
public final class LabelCodec {
  private static final char[] HEX = "0123456789ABCDEF".toCharArray();
  
  private LabelCodec() { }
  
  /**
   * Escapes the given string.
   * @param value A non-null string, may be empty.
   * @return The escaped string, empty if the value was empty.
   * @throws IllegalArgumentException if the value was null.
   */
  public static String encode(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    final StringBuilder buf = new StringBuilder(bytes.length);
    for (int i = 0; i < bytes.length; i++) {
      final int b = bytes[i] & 0xFF;
      if (isSafe(b) && !(i == 0 && b == '.')) {
        buf.append((char) b);
      } else {
        buf.append('%')
           .append(HEX[b >> 4])
           .append(HEX[b & 0x0F]);
      }
    }
    return buf.toString();
  }
  
  /**
   * Reverses {@link #encode(String)}.
   * @param value A non-null encoded string.
   * @return The decoded string.
   * @throws IllegalArgumentException if the value was null or contained a
   * malformed escape sequence or an unescaped reserved character.
   */
  public static String decode(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream(
        value.length());
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c == '%') {
        if (i + 2 >= value.length()) {
          throw new IllegalArgumentException("Truncated escape sequence at "
              + i + " in: " + value);
        }
        final int hi = Character.digit(value.charAt(i + 1), 16);
        final int lo = Character.digit(value.charAt(i + 2), 16);
        if (hi < 0 || lo < 0) {
          throw new IllegalArgumentException("Invalid escape sequence at "
              + i + " in: " + value);
        }
        bytes.write((hi << 4) | lo);
        i += 2;
      } else if (c < 128 && isSafe(c)) {
        bytes.write(c);
      } else {
        throw new IllegalArgumentException("Unescaped character '" + c 
            + "' at " + i + " in: " + value);
      }
    }
    return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
  }
  
  private static boolean isSafe(final int b) {
    return (b >= 'a' && b <= 'z') 
        || (b >= 'A' && b <= 'Z') 
        || (b >= '0' && b <= '9')
        || b == '.' 
        || b == '_' 
        || b == '-';
  }
}
