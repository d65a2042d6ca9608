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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Searches an EGI for another occurrence of a subgraph, as needed by de-iteration. An occurrence is
 * an injective mapping of the subgraph's closure onto elements outside it such that:
 *
 * <ul>
 *   <li>selected elements map to elements directly enclosed by the host context, and elements
 *       inside a selected cut map to elements directly enclosed by that cut's image;
 *   <li>cuts map to cuts enclosing the same number of elements;
 *   <li>vertices map to vertices with the same constant label (or both generic), and a vertex
 *       joined by an identity edge to a vertex outside the subgraph maps to a vertex in that
 *       vertex's ligature;
 *   <li>edges map to edges of the same relation, position by position: a vertex of the subgraph
 *       must map to the image vertex, and a vertex outside the subgraph must be in the same
 *       ligature as the vertex at that position of the image edge.
 * </ul>
 *
 * <p>Pattern elements are visited breadth first, each cut before its contents and, within one
 * context, cuts then edges then vertices, so vertices are usually already bound by an edge when
 * they are reached. The search backtracks and gives up after a fixed number of steps.
 */
final class EgiSubgraphMatcher {
  private static final Logger logger =
      Logger.getLogger(EgiSubgraphMatcher.class.getCanonicalName());

  private final Egi egi;
  private final EgiSubgraph pattern;
  private final long maxSteps;
  /** Pattern elements in visiting order. */
  private final ImmutableList<ElementId> order;

  private final Map<ElementId, ElementId> mapping = new HashMap<>();
  private final Set<ElementId> used = new HashSet<>();
  private @Nullable Set<ElementId> allowedTopLevel;
  private ElementId hostContext;
  private long steps;
  private boolean exhausted;

  EgiSubgraphMatcher(Egi egi, EgiSubgraph pattern, long maxSteps) {
    this.egi = egi;
    this.pattern = pattern;
    this.maxSteps = maxSteps;
    this.order = visitingOrder(egi, pattern);
  }

  private static ImmutableList<ElementId> visitingOrder(Egi egi, EgiSubgraph pattern) {
    ImmutableList.Builder<ElementId> result = ImmutableList.builder();
    Deque<List<ElementId>> levels = new ArrayDeque<>();
    levels.add(Ordering.natural().sortedCopy(pattern.selection()));
    while (!levels.isEmpty()) {
      List<ElementId> level = levels.poll();
      for (ElementId.Kind kind :
          new ElementId.Kind[] {ElementId.Kind.CUT, ElementId.Kind.EDGE, ElementId.Kind.VERTEX}) {
        for (ElementId id : level) {
          if (id.kind() == kind) {
            result.add(id);
          }
        }
      }
      for (ElementId id : level) {
        if (id.isCut()) {
          levels.add(Ordering.natural().sortedCopy(egi.context(id).enclosed()));
        }
      }
    }
    return result.build();
  }

  /** Returns the number of search steps taken by the last call to {@link #findOccurrence}. */
  long steps() {
    return steps;
  }

  /** Returns true if the last search gave up before it was complete. */
  boolean exhausted() {
    return exhausted;
  }

  /**
   * Returns a mapping from the pattern's closure to an occurrence whose selected elements lie
   * directly in the given host context, or null if there is none. If {@code topLevel} is not null,
   * the images of the pattern's selected elements must be exactly that set.
   */
  @Nullable ImmutableMap<ElementId, ElementId> findOccurrence(
      ElementId hostContext, @Nullable Set<ElementId> topLevel) {
    mapping.clear();
    used.clear();
    steps = 0;
    exhausted = false;
    this.hostContext = hostContext;
    this.allowedTopLevel = topLevel;
    if (topLevel != null && topLevel.size() != pattern.selection().size()) {
      return null;
    }
    if (!match(0)) {
      if (exhausted) {
        logger.fine("Gave up matching " + pattern + " in " + hostContext + " after " + steps);
      }
      return null;
    }
    return ImmutableMap.copyOf(mapping);
  }

  private boolean match(int index) {
    if (++steps > maxSteps) {
      exhausted = true;
      return false;
    }
    if (index == order.size()) {
      return true;
    }
    ElementId x = order.get(index);
    ElementId hostParent = hostParentOf(x);
    ElementId bound = mapping.get(x);
    if (bound != null) {
      // A vertex already bound through an edge; only its position remains to be checked.
      return egi.contextOf(bound).equals(hostParent) && allowedAt(x, bound) && match(index + 1);
    }
    for (ElementId candidate : Ordering.natural().sortedCopy(egi.context(hostParent).enclosed())) {
      if (candidate.kind() != x.kind()
          || used.contains(candidate)
          || pattern.contains(candidate)
          || !allowedAt(x, candidate)
          || !compatible(x, candidate)) {
        continue;
      }
      List<ElementId> bound1 = new ArrayList<>();
      if (bind(x, candidate, bound1) && match(index + 1)) {
        return true;
      }
      for (ElementId p : bound1) {
        used.remove(mapping.remove(p));
      }
      if (exhausted) {
        return false;
      }
    }
    return false;
  }

  private ElementId hostParentOf(ElementId patternElement) {
    ElementId parent = egi.contextOf(patternElement);
    return parent.equals(pattern.container()) ? hostContext : mapping.get(parent);
  }

  private boolean allowedAt(ElementId patternElement, ElementId hostElement) {
    return allowedTopLevel == null
        || !pattern.selection().contains(patternElement)
        || allowedTopLevel.contains(hostElement);
  }

  private boolean compatible(ElementId p, ElementId h) {
    switch (p.kind()) {
      case VERTEX:
        return Objects.equals(egi.vertex(p).label(), egi.vertex(h).label())
            && keepsIdentities(p, h);
      case EDGE:
        EgiEdge pe = egi.edge(p);
        EgiEdge he = egi.edge(h);
        return pe.relation().equals(he.relation()) && pe.arity() == he.arity();
      case CUT:
        EgiContext pc = egi.context(p);
        EgiContext hc = egi.context(h);
        return pc.enclosed().size() == hc.enclosed().size()
            && pc.children().size() == hc.children().size();
      case SHEET:
        break;
    }
    return false;
  }

  /**
   * Returns true if every vertex outside the pattern that p is joined to by an identity edge is in
   * the same ligature as h, so removing p and those edges loses no coreference.
   */
  private boolean keepsIdentities(ElementId p, ElementId h) {
    for (ElementId e : egi.vertex(p).incidentEdges()) {
      if (pattern.contains(e)) {
        continue;
      }
      EgiEdge edge = egi.edge(e);
      if (!edge.isIdentity()) {
        continue;
      }
      for (ElementId u : edge.vertices()) {
        if (!u.equals(p) && !pattern.contains(u) && !egi.areConnected(u, h)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Maps p to h, and for an edge also binds or checks its vertices. Every pattern element bound
   * here is appended to {@code bound} so the caller can undo it.
   */
  private boolean bind(ElementId p, ElementId h, List<ElementId> bound) {
    mapping.put(p, h);
    used.add(h);
    bound.add(p);
    if (!p.isEdge()) {
      return true;
    }
    EgiEdge pe = egi.edge(p);
    EgiEdge he = egi.edge(h);
    for (int i = 0; i < pe.arity(); i++) {
      ElementId pv = pe.vertex(i);
      ElementId hv = he.vertex(i);
      if (pattern.contains(hv)) {
        return false;
      }
      if (pattern.contains(pv)) {
        ElementId existing = mapping.get(pv);
        if (existing != null) {
          if (!existing.equals(hv)) {
            return false;
          }
        } else {
          if (used.contains(hv) || !compatible(pv, hv)) {
            return false;
          }
          mapping.put(pv, hv);
          used.add(hv);
          bound.add(pv);
        }
      } else if (!egi.areConnected(pv, hv)) {
        return false;
      }
    }
    return true;
  }
}
