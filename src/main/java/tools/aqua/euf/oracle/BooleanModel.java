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

/** A satisfying assignment returned by an {@link OracleSession}. */
@FunctionalInterface
public interface BooleanModel {

  /**
   * Get the value of a boolean variable. Variables the model leaves open are completed with an
   * arbitrary value.
   *
   * @param variable the variable.
   * @return its value.
   */
  boolean valueOf(BoolExpr variable);
}
