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
package net.tsbridge.utils;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import com.google.common.base.Strings;

/**
 * Utility class for parsing durations and converting timestamps.
 * 
 * @since 1.0
 */
public class DateTime {

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into 
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li> 
   * <li>{@code n}: month (30 days)</li>
   * <li>{@code y}: years (365 days)</li></ul>
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of milliseconds.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static final long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    long interval;
    long multiplier;
    double temp;
    int unit = 0;
    while (Character.isDigit(duration.charAt(unit))) {
      unit++;
      if (unit >= duration.length()) {
        throw new IllegalArgumentException("Invalid duration, must have an "
            + "integer and unit: " + duration);
      }
    }
    try {
      interval = Long.parseLong(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " + duration);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: " + duration);
    }
    final String units = duration.substring(unit).toLowerCase(Locale.ROOT);
    switch (units) {
      case "ms": return interval;
      case "s": multiplier = 1; break;
      case "m": multiplier = 60; break;
      case "h": multiplier = 3600; break;
      case "d": multiplier = 3600 * 24; break;
      case "w": multiplier = 3600 * 24 * 7; break;
      case "n": multiplier = 3600 * 24 * 30; break;
      case "y": multiplier = 3600 * 24 * 365; break;
      default: throw new IllegalArgumentException("Invalid duration (suffix): " + duration);
    }
    multiplier *= 1000;
    temp = (double) interval * multiplier;
    if (temp > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE ms: " + duration);
    }
    return interval * multiplier;
  }
  
  /**
   * Parses a duration into whole seconds. Sub-second durations are rounded 
   * up to one second.
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of seconds.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static final long parseDurationSeconds(final String duration) {
    final long ms = parseDuration(duration);
    return ms < 1000 ? 1 : ms / 1000;
  }
  
  /**
   * Returns the suffix or "units" of the duration as a string. The result will
   * be ms, s, m, h, d, w, n or y.
   * @param duration The duration in the format #units, e.g. 1d or 6h
   * @return Just the suffix, e.g. 'd' or 'h'
   * @throws IllegalArgumentException if the duration is null, empty or if 
   * the units are invalid.
   */
  public static final String getDurationUnits(final String duration) {
    if (duration == null || duration.isEmpty()) {
      throw new IllegalArgumentException("Duration cannot be null or empty");
    }
    int unit = 0;
    while (unit < duration.length() && 
        Character.isDigit(duration.charAt(unit))) {
      unit++;
    }
    final String units = duration.substring(unit).toLowerCase(Locale.ROOT);
    if (units.equals("ms") || units.equals("s") || units.equals("m") || 
        units.equals("h") || units.equals("d") || units.equals("w") || 
        units.equals("n") || units.equals("y")) {
      return units;
    }
    throw new IllegalArgumentException("Invalid units in the duration: " + units);
  }
  
  /**
   * Parses the prefix of the duration, the interval and returns it as a number.
   * E.g. if you supply "1d" it will return "1". If you supply "60m" it will
   * return "60".
   * @param duration The duration to parse in the format #units, e.g. "1d" or "60m"
   * @return The interval as an integer, regardless of units.
   * @throws IllegalArgumentException if the duration is null, empty or parsing
   * of the integer failed.
   */
  public static final int getDurationInterval(final String duration) {
    if (duration == null || duration.isEmpty()) {
      throw new IllegalArgumentException("Duration cannot be null or empty");
    }
    if (duration.contains(".")) {
      throw new IllegalArgumentException("Floating point intervals are not supported");
    }
    int unit = 0;
    while (unit < duration.length() && Character.isDigit(duration.charAt(unit))) {
      unit++;
    }
    int interval;
    try {
      interval = Integer.parseInt(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " + duration);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: " + duration);
    }
    return interval;
  }
  
  /** @return The current Unix epoch time in seconds. */
  public static final long currentTimeSeconds() {
    return System.currentTimeMillis() / 1000;
  }
  
  /**
   * Formats the Unix epoch seconds as an RFC 3339 UTC timestamp, e.g.
   * {@code 2024-01-01T00:00:00Z}.
   * @param epoch_seconds The timestamp in seconds.
   * @return A non-null string.
   */
  public static final String toRfc3339(final long epoch_seconds) {
    return DateTimeFormatter.ISO_INSTANT.format(
        Instant.ofEpochSecond(epoch_seconds));
  }
  
  /**
   * Parses an RFC 3339 timestamp into Unix epoch seconds.
   * @param timestamp The non-null and non-empty timestamp.
   * @return The epoch seconds, truncating sub-second precision.
   * @throws IllegalArgumentException if the timestamp was malformed.
   */
  public static final long parseRfc3339(final String timestamp) {
    if (Strings.isNullOrEmpty(timestamp)) {
      throw new IllegalArgumentException("Timestamp cannot be null or empty.");
    }
    try {
      return Instant.from(DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(
          timestamp)).getEpochSecond();
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid RFC 3339 timestamp: " 
          + timestamp, e);
    }
  }
}
