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

import com.google.common.collect.ImmutableSet;

/** The successful outcome of one rule application: the new EGI and what changed. */
public final class EgiTransformation {
  private final EgiRule rule;
  private final Egi result;
  private final ImmutableSet<ElementId> added;
  private final ImmutableSet<ElementId> removed;

  EgiTransformation(
      EgiRule rule, Egi result, ImmutableSet<ElementId> added, ImmutableSet<ElementId> removed) {
    this.rule = rule;
    this.result = result;
    this.added = added;
    this.removed = removed;
  }

  public EgiRule rule() {
    return rule;
  }

  /** Returns the new EGI. The input EGI is unchanged. */
  public Egi result() {
    return result;
  }

  /** Returns the ids of the vertices, edges and cuts that exist only in the result. */
  public ImmutableSet<ElementId> added() {
    return added;
  }

  /** Returns the ids of the vertices, edges and cuts that exist only in the input. */
  public ImmutableSet<ElementId> removed() {
    return removed;
  }

  @Override
  public String toString() {
    return rule + ": +" + added + " -" + removed;
  }
}
