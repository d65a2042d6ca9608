/*
 * Copyright 2026 The Arisbe Authors.
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
package org.arisbe.egi;

/**
 * The eight transformation rules of the calculus. The set is closed: {@link EgiRuleEngine#apply}
 * switches over every constant.
 */
public enum EgiRule {
  /** Rule 1: remove a subgraph from a positive context. */
  ERASURE(1),
  /** Rule 2: add any graph into a negative context. */
  INSERTION(2),
  /** Rule 3: copy a subgraph into its own context or a context nested inside it. */
  ITERATION(3),
  /** Rule 4: remove a subgraph that could have been produced by iteration. */
  DEITERATION(4),
  /** Rule 5: wrap co-located elements in two nested cuts. */
  DOUBLE_CUT_ADDITION(5),
  /** Rule 6: unwrap two nested cuts with nothing between them. */
  DOUBLE_CUT_REMOVAL(6),
  /** Rule 7: add a vertex with no incident edges to any context. */
  ISOLATED_VERTEX_ADDITION(7),
  /** Rule 8: remove a vertex with no incident edges. */
  ISOLATED_VERTEX_REMOVAL(8);

  private final int number;

  private EgiRule(int number) {
    this.number = number;
  }

  /** Returns the rule's number in the canonical ordering, 1 to 8. */
  public int number() {
    return number;
  }
}
