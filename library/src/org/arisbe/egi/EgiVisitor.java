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
 * Receives a depth-first walk of an EGI from {@link Egi#traverse(EgiVisitor)}. For each context,
 * starting at the sheet, the walk calls startContext(), then visits the context's vertices, then
 * its edges, then recurses into its child cuts, and finally calls finishContext(). Within each
 * group elements are visited in id order, so the walk is deterministic.
 *
 * <p>All methods have empty defaults; override the ones you need.
 */
public interface EgiVisitor {
  default void startContext(EgiContext context) {}

  default void visitVertex(EgiVertex vertex) {}

  default void visitEdge(EgiEdge edge) {}

  default void finishContext(EgiContext context) {}
}
