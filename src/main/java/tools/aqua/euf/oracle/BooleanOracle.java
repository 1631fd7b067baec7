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
 * A boolean satisfiability oracle. Each query runs in its own {@link OracleSession}, so one oracle
 * can serve independent callers.
 */
public interface BooleanOracle {

  /**
   * Open a fresh session without any assertions.
   *
   * @return the session.
   * @throws OracleException if the backend cannot provide a session.
   */
  OracleSession newSession();
}
