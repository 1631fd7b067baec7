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

import com.microsoft.z3.BoolExpr;
import java.util.Optional;

/**
 * An incremental solving session. Assertions accumulate for the session's lifetime; there is no
 * retraction. A session must be closed once its query is answered.
 */
public interface OracleSession extends AutoCloseable {

  /**
   * Add an assertion to the session.
   *
   * @param assertion a propositional formula.
   * @throws OracleException if the backend rejects the assertion.
   */
  void add(BoolExpr assertion);

  /**
   * Solve the conjunction of all assertions added so far.
   *
   * @return a satisfying model, or empty if the assertions are unsatisfiable.
   * @throws OracleException if the backend can decide neither way.
   */
  Optional<BooleanModel> solve();

  /**
   * Release the session's backend resources. The session must not be used afterwards.
   *
   * @throws OracleException if the backend fails to release them.
   */
  @Override
  void close();
}
