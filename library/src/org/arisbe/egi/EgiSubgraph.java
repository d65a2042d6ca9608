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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A selection of elements that are all directly enclosed by one context (the container), together
 * with its closure: the selection plus everything enclosed by selected cuts, at any depth.
 */
final class EgiSubgraph {
  private final ElementId container;
  private final ImmutableSet<ElementId> selection;
  private final ImmutableSet<ElementId> closure;
  /** Cuts of the closure, each listed after the cut that encloses it. */
  private final ImmutableList<ElementId> cutsTopDown;

  private EgiSubgraph(
      ElementId container,
      ImmutableSet<ElementId> selection,
      ImmutableSet<ElementId> closure,
      ImmutableList<ElementId> cutsTopDown) {
    this.container = container;
    this.selection = selection;
    this.closure = closure;
    this.cutsTopDown = cutsTopDown;
  }

  /**
   * Returns the subgraph for the selection, or null with INVALID_ARGUMENT (empty selection, or the
   * sheet selected), NOT_FOUND (unknown id) or INVALID_NESTING (ids in different contexts).
   */
  static @Nullable EgiSubgraph of(Egi egi, Set<ElementId> selection, EgiError error) {
    if (selection.isEmpty()) {
      error.init(EgiError.Code.INVALID_ARGUMENT, "Empty selection");
      return null;
    }
    ElementId container = null;
    for (ElementId id : Ordering.natural().sortedCopy(selection)) {
      if (id.isSheet()) {
        error.init(EgiError.Code.INVALID_ARGUMENT, "The sheet of assertion cannot be selected");
        return null;
      }
      if (!egi.contains(id)) {
        error.init(EgiError.Code.NOT_FOUND, "Selected element %s does not exist", id);
        return null;
      }
      ElementId context = egi.contextOf(id);
      if (container == null) {
        container = context;
      } else if (!container.equals(context)) {
        error.init(
            EgiError.Code.INVALID_NESTING,
            "Selected elements lie in different contexts, %s and %s",
            container,
            context);
        return null;
      }
    }

    ImmutableSet.Builder<ElementId> closure = ImmutableSet.builder();
    ImmutableList.Builder<ElementId> cuts = ImmutableList.builder();
    closure.addAll(selection);
    Deque<ElementId> queue = new ArrayDeque<>();
    for (ElementId id : selection) {
      if (id.isCut()) {
        queue.add(id);
      }
    }
    while (!queue.isEmpty()) {
      ElementId cut = queue.poll();
      cuts.add(cut);
      EgiContext c = egi.context(cut);
      closure.addAll(c.enclosed());
      queue.addAll(c.children());
    }
    return new EgiSubgraph(
        container, ImmutableSet.copyOf(selection), closure.build(), cuts.build());
  }

  /** Returns the context directly enclosing every selected element. */
  ElementId container() {
    return container;
  }

  /** Returns the selected elements themselves. */
  ImmutableSet<ElementId> selection() {
    return selection;
  }

  /** Returns the selection plus everything inside selected cuts. */
  ImmutableSet<ElementId> closure() {
    return closure;
  }

  boolean contains(ElementId id) {
    return closure.contains(id);
  }

  /** Returns the cuts of the closure, outer cuts first. */
  ImmutableList<ElementId> cutsTopDown() {
    return cutsTopDown;
  }

  /** Returns the vertices of the closure in id order. */
  ImmutableList<ElementId> vertices() {
    return ofKind(ElementId.Kind.VERTEX);
  }

  /** Returns the edges of the closure in id order. */
  ImmutableList<ElementId> edges() {
    return ofKind(ElementId.Kind.EDGE);
  }

  private ImmutableList<ElementId> ofKind(ElementId.Kind kind) {
    ImmutableList.Builder<ElementId> result = ImmutableList.builder();
    for (ElementId id : Ordering.natural().sortedCopy(closure)) {
      if (id.kind() == kind) {
        result.add(id);
      }
    }
    return result.build();
  }

  /**
   * Returns an edge outside the closure that is attached to a vertex inside it, or null if there is
   * none. Removing the closure is only possible when this returns null.
   */
  @Nullable EgiEdge findEdgeLeavingClosure(Egi egi) {
    for (ElementId v : vertices()) {
      for (ElementId e : egi.vertex(v).incidentEdges()) {
        if (!closure.contains(e)) {
          return egi.edge(e);
        }
      }
    }
    return null;
  }

  /**
   * Returns an edge inside the closure that is attached to a vertex outside it, or null if there is
   * none.
   */
  @Nullable EgiEdge findEdgeReachingOutside(Egi egi) {
    for (ElementId e : edges()) {
      EgiEdge edge = egi.edge(e);
      for (ElementId v : edge.vertices()) {
        if (!closure.contains(v)) {
          return edge;
        }
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "Subgraph in " + container + ": " + selection;
  }
}
