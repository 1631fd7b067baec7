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

package tools.aqua.euf.oracle;

/**
 * Signals that the oracle could not answer: it gave up, timed out, or failed internally. Never
 * stands for unsatisfiability.
 */
public class OracleException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Create an exception without an underlying cause.
   *
   * @param message the reason the oracle gave no answer.
   */
  public OracleException(final String message) {
    super(message);
  }

  /**
   * Create an exception wrapping a backend failure.
   *
   * @param message the reason the oracle gave no answer.
   * @param cause the backend's exception.
   */
  public OracleException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
