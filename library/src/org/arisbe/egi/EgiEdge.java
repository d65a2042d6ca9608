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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/**
 * A hyperedge: one occurrence of a relation, applied to an ordered list of vertices. The same
 * vertex may appear at more than one position. Edges of the identity relation "=" link two
 * vertices into one ligature.
 */
@Immutable
public final class EgiEdge {
  private final ElementId id;
  private final ElementId context;
  private final String relation;
  private final ImmutableList<ElementId> vertices;

  EgiEdge(ElementId id, ElementId context, String relation, ImmutableList<ElementId> vertices) {
    Preconditions.checkArgument(id.isEdge(), "%s is not an edge id", id);
    Preconditions.checkArgument(context.isContext(), "%s is not a context id", context);
    Preconditions.checkNotNull(relation);
    this.id = id;
    this.context = context;
    this.relation = relation;
    this.vertices = vertices;
  }

  public ElementId id() {
    return id;
  }

  /** Returns the context that directly encloses this edge. */
  public ElementId context() {
    return context;
  }

  /** Returns the relation name. */
  public String relation() {
    return relation;
  }

  /** Returns the number of vertex positions. */
  public int arity() {
    return vertices.size();
  }

  /** Returns the attached vertices in argument order. */
  public ImmutableList<ElementId> vertices() {
    return vertices;
  }

  /** Returns the vertex at argument position i. */
  public ElementId vertex(int i) {
    return vertices.get(i);
  }

  /** Returns true for edges of the identity relation. */
  public boolean isIdentity() {
    return EgiAlphabet.IDENTITY.equals(relation);
  }

  /** Returns a copy of this edge enclosed by a different context. */
  EgiEdge withContext(ElementId newContext) {
    return new EgiEdge(id, newContext, relation, vertices);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof EgiEdge)) {
      return false;
    }
    EgiEdge that = (EgiEdge) other;
    return id.equals(that.id)
        && context.equals(that.context)
        && relation.equals(that.relation)
        && vertices.equals(that.vertices);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, context, relation, vertices);
  }

  @Override
  public String toString() {
    return id + ":" + relation + "(" + Joiner.on(", ").join(vertices) + ")";
  }
}
