/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * Copyright 2019-2025 The TurnKey Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tools.aqua.euf.config;

import java.util.Properties;

/**
 * Tuning knobs for the oracle and the lazy loop. Values are read from JVM system properties; every
 * property is optional.
 *
 * <ul>
 *   <li>{@value #ORACLE_TIMEOUT}: timeout per oracle call in milliseconds, {@code 0} for none.
 *   <li>{@value #ORACLE_SEED}: random seed handed to the oracle.
 *   <li>{@value #MAX_ROUNDS}: maximum oracle calls per lazy query, {@code 0} for no limit.
 * </ul>
 */
public final class SolverSettings {

  /** Property name of the oracle timeout. */
  public static final String ORACLE_TIMEOUT = "euf.oracle.timeout";

  /** Property name of the oracle random seed. */
  public static final String ORACLE_SEED = "euf.oracle.seed";

  /** Property name of the lazy loop's round limit. */
  public static final String MAX_ROUNDS = "euf.lazy.maxRounds";

  /** The oracle timeout in milliseconds, {@code 0} for none. */
  private final int oracleTimeoutMillis;

  /** The oracle random seed. */
  private final int oracleSeed;

  /** The round limit, {@code 0} for none. */
  private final int maxRounds;

  /**
   * Create a new settings object.
   *
   * @param oracleTimeoutMillis the {@link #oracleTimeoutMillis}.
   * @param oracleSeed the {@link #oracleSeed}.
   * @param maxRounds the {@link #maxRounds}.
   * @throws IllegalArgumentException if the timeout or the round limit is negative.
   */
  public SolverSettings(final int oracleTimeoutMillis, final int oracleSeed, final int maxRounds) {
    if (oracleTimeoutMillis < 0) {
      throw new IllegalArgumentException("Negative oracle timeout: " + oracleTimeoutMillis);
    }
    if (maxRounds < 0) {
      throw new IllegalArgumentException("Negative round limit: " + maxRounds);
    }
    this.oracleTimeoutMillis = oracleTimeoutMillis;
    this.oracleSeed = oracleSeed;
    this.maxRounds = maxRounds;
  }

  /**
   * Get the default settings: no timeout, seed zero, no round limit.
   *
   * @return the defaults.
   */
  public static SolverSettings defaults() {
    return new SolverSettings(0, 0, 0);
  }

  /**
   * Read the settings from the JVM system properties.
   *
   * @return the settings.
   * @throws IllegalArgumentException if a property holds an invalid value.
   */
  public static SolverSettings fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /**
   * Read the settings from a property set. Missing properties fall back to the defaults.
   *
   * @param properties the properties.
   * @return the settings.
   * @throws IllegalArgumentException if a property holds an invalid value.
   */
  public static SolverSettings fromProperties(final Properties properties) {
    return new SolverSettings(
        readInt(properties, ORACLE_TIMEOUT, 0),
        readInt(properties, ORACLE_SEED, 0),
        readInt(properties, MAX_ROUNDS, 0));
  }

  private static int readInt(
      final Properties properties, final String name, final int defaultValue) {
    final String value = properties.getProperty(name);
    if (value == null || value.trim().isEmpty()) return defaultValue;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
    }
  }

  /**
   * Get the timeout per oracle call.
   *
   * @return the timeout in milliseconds, {@code 0} for none.
   */
  public int getOracleTimeoutMillis() {
    return oracleTimeoutMillis;
  }

  /**
   * Get the random seed handed to the oracle.
   *
   * @return the seed.
   */
  public int getOracleSeed() {
    return oracleSeed;
  }

  /**
   * Get the maximum number of oracle calls per lazy query.
   *
   * @return the round limit, {@code 0} for none.
   */
  public int getMaxRounds() {
    return maxRounds;
  }

  /**
   * Check if the lazy loop has a round limit.
   *
   * @return {@code true} iff {@link #getMaxRounds()} is positive.
   */
  public boolean hasRoundLimit() {
    return maxRounds > 0;
  }

  @Override
  public String toString() {
    return "SolverSettings{oracleTimeoutMillis="
        + oracleTimeoutMillis
        + ", oracleSeed="
        + oracleSeed
        + ", maxRounds="
        + maxRounds
        + "}";
  }
}
