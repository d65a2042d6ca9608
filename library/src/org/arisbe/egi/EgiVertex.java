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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A vertex: one existentially quantified individual, or a named constant when it carries a label.
 * A vertex with no incident edges is isolated (a "heavy dot").
 */
@Immutable
public final class EgiVertex {
  private final ElementId id;
  private final ElementId context;
  private final @Nullable String label;
  private final ImmutableSet<ElementId> incidentEdges;

  EgiVertex(
      ElementId id,
      ElementId context,
      @Nullable String label,
      ImmutableSet<ElementId> incidentEdges) {
    Preconditions.checkArgument(id.isVertex(), "%s is not a vertex id", id);
    Preconditions.checkArgument(context.isContext(), "%s is not a context id", context);
    Preconditions.checkArgument(label == null || !label.isEmpty(), "Empty constant label");
    this.id = id;
    this.context = context;
    this.label = label;
    this.incidentEdges = incidentEdges;
  }

  public ElementId id() {
    return id;
  }

  /** Returns the context that directly encloses this vertex. */
  public ElementId context() {
    return context;
  }

  /** Returns true if this vertex names a constant; exactly when {@link #label()} is non-null. */
  public boolean isConstant() {
    return label != null;
  }

  /** Returns the constant's name, or null for a generic vertex. */
  public @Nullable String label() {
    return label;
  }

  /** Returns the edges attached to this vertex, in the order they were attached. */
  public ImmutableSet<ElementId> incidentEdges() {
    return incidentEdges;
  }

  /** Returns true if no edge is attached. */
  public boolean isIsolated() {
    return incidentEdges.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof EgiVertex)) {
      return false;
    }
    EgiVertex that = (EgiVertex) other;
    return id.equals(that.id)
        && context.equals(that.context)
        && Objects.equals(label, that.label)
        && incidentEdges.equals(that.incidentEdges);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, context, label, incidentEdges);
  }

  @Override
  public String toString() {
    return label == null ? id.toString() : id + "\"" + label + "\"";
  }
}
