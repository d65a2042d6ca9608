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
import java.util.HashMap;
import java.util.Map;

/**
 * Checks the invariants of an {@link Egi}. The checks run in dependency order: the context tree
 * first, since the others walk it; then element enclosure; then edge incidence and domination;
 * then ligature consistency. Validation stops at the first violation found.
 */
final class EgiValidator {
  private EgiValidator() {}

  /** Returns true and sets the error if the EGI violates an invariant; false otherwise. */
  static boolean findValidationError(Egi egi, EgiError error) {
    return findContextTreeError(egi, error)
        || findEnclosureError(egi, error)
        || findIncidenceError(egi, error)
        || findLigatureError(egi, error);
  }

  private static boolean findContextTreeError(Egi egi, EgiError error) {
    Map<ElementId, EgiContext> contexts = egi.contexts();
    EgiContext sheet = contexts.get(egi.sheet());
    if (sheet == null || !sheet.isSheet() || sheet.parent() != null || sheet.depth() != 0) {
      error.init(EgiError.Code.INVALID_CONTEXT_TREE, "Sheet %s is missing or not a root", sheet);
      return true;
    }
    for (EgiContext c : contexts.values()) {
      if (c.isSheet()) {
        if (!c.id().equals(egi.sheet())) {
          error.init(EgiError.Code.INVALID_CONTEXT_TREE, "Second sheet %s", c.id());
          return true;
        }
      } else {
        EgiContext parent = c.parent() == null ? null : contexts.get(c.parent());
        if (parent == null) {
          error.init(EgiError.Code.INVALID_CONTEXT_TREE, "Cut %s has no live parent", c.id());
          return true;
        }
        if (c.depth() != parent.depth() + 1) {
          error.init(
              EgiError.Code.INVALID_CONTEXT_TREE,
              "Cut %s has depth %d but its parent %s has depth %d",
              c.id(),
              c.depth(),
              parent.id(),
              parent.depth());
          return true;
        }
        if (!parent.children().contains(c.id())) {
          error.init(
              EgiError.Code.INVALID_CONTEXT_TREE,
              "Cut %s is not a child of its parent %s",
              c.id(),
              parent.id());
          return true;
        }
      }
      for (ElementId child : c.children()) {
        EgiContext cc = contexts.get(child);
        if (cc == null || !c.id().equals(cc.parent()) || !c.enclosed().contains(child)) {
          error.init(
              EgiError.Code.INVALID_CONTEXT_TREE,
              "Context %s lists %s as a child, but it is not a cut enclosed there",
              c.id(),
              child);
          return true;
        }
      }
      for (ElementId id : c.enclosed()) {
        if (id.isCut() && !c.children().contains(id)) {
          error.init(
              EgiError.Code.INVALID_CONTEXT_TREE,
              "Context %s encloses cut %s without listing it as a child",
              c.id(),
              id);
          return true;
        }
      }
    }
    // Every parent chain must reach the sheet within as many steps as there are contexts.
    int limit = contexts.size();
    for (EgiContext c : contexts.values()) {
      EgiContext walk = c;
      int steps = 0;
      while (!walk.isSheet()) {
        if (++steps > limit) {
          error.init(EgiError.Code.INVALID_CONTEXT_TREE, "Cut %s is on a cycle", c.id());
          return true;
        }
        walk = contexts.get(walk.parent());
      }
    }
    return false;
  }

  private static boolean findEnclosureError(Egi egi, EgiError error) {
    Map<ElementId, ElementId> owner = new HashMap<>();
    for (EgiContext c : egi.contexts().values()) {
      for (ElementId id : c.enclosed()) {
        if (id.isSheet() || !egi.contains(id)) {
          error.init(
              EgiError.Code.ENCLOSURE_MISMATCH,
              "Context %s encloses unknown element %s",
              c.id(),
              id);
          return true;
        }
        ElementId previous = owner.put(id, c.id());
        if (previous != null) {
          error.init(
              EgiError.Code.ENCLOSURE_MISMATCH,
              "Element %s is enclosed by both %s and %s",
              id,
              previous,
              c.id());
          return true;
        }
      }
    }
    for (EgiVertex v : egi.vertices().values()) {
      if (!v.context().equals(owner.get(v.id()))) {
        return enclosureMismatch(error, v.id(), v.context(), owner.get(v.id()));
      }
    }
    for (EgiEdge e : egi.edges().values()) {
      if (!e.context().equals(owner.get(e.id()))) {
        return enclosureMismatch(error, e.id(), e.context(), owner.get(e.id()));
      }
    }
    for (EgiContext c : egi.contexts().values()) {
      if (!c.isSheet() && !c.parent().equals(owner.get(c.id()))) {
        return enclosureMismatch(error, c.id(), c.parent(), owner.get(c.id()));
      }
    }
    return false;
  }

  private static boolean enclosureMismatch(
      EgiError error, ElementId id, ElementId recorded, ElementId actual) {
    error.init(
        EgiError.Code.ENCLOSURE_MISMATCH,
        "Element %s records context %s but is enclosed by %s",
        id,
        recorded,
        actual);
    return true;
  }

  private static boolean findIncidenceError(Egi egi, EgiError error) {
    for (EgiEdge e : egi.edges().values()) {
      if (!egi.alphabet().contains(e.relation(), e.arity())) {
        error.init(
            EgiError.Code.UNREGISTERED_RELATION,
            "Edge %s uses unregistered relation '%s' with arity %d",
            e.id(),
            e.relation(),
            e.arity());
        return true;
      }
      for (ElementId id : e.vertices()) {
        EgiVertex v = egi.vertex(id);
        if (v == null || !v.incidentEdges().contains(e.id())) {
          error.init(
              EgiError.Code.INCIDENCE_MISMATCH,
              "Edge %s names vertex %s, which does not list it as incident",
              e.id(),
              id);
          return true;
        }
        if (!egi.dominates(e.context(), v.context())) {
          error.init(
              EgiError.Code.DOMINATION_VIOLATION,
              "Edge %s in %s does not dominate vertex %s in %s",
              e.id(),
              e.context(),
              id,
              v.context());
          return true;
        }
      }
    }
    for (EgiVertex v : egi.vertices().values()) {
      for (ElementId id : v.incidentEdges()) {
        EgiEdge e = egi.edge(id);
        if (e == null || !e.vertices().contains(v.id())) {
          error.init(
              EgiError.Code.INCIDENCE_MISMATCH,
              "Vertex %s lists %s as incident, but the edge does not name it",
              v.id(),
              id);
          return true;
        }
      }
    }
    return false;
  }

  private static boolean findLigatureError(Egi egi, EgiError error) {
    ImmutableSet.Builder<ElementId> scanned = ImmutableSet.builder();
    for (EgiEdge e : egi.edges().values()) {
      if (e.isIdentity()) {
        scanned.add(e.id());
      }
    }
    // Recompute from scratch rather than trusting the cached copy.
    EgiLigatures fresh = EgiLigatures.compute(egi.vertices().keySet(), egi.edges().values());
    ImmutableSet<ElementId> expected = scanned.build();
    ImmutableSet<ElementId> found = fresh.allIdentityEdges();
    if (!expected.equals(found)) {
      error.init(
          EgiError.Code.LIGATURE_MISMATCH,
          "Identity edges %s are not the ligature edges %s",
          expected,
          found);
      return true;
    }
    EgiLigatures cached = egi.ligatures();
    for (ElementId v : egi.vertices().keySet()) {
      ElementId component = fresh.componentOf(v);
      if (component == null || !component.equals(cached.componentOf(v))) {
        error.init(
            EgiError.Code.LIGATURE_MISMATCH,
            "Vertex %s is in component %s, but the cached ligatures say %s",
            v,
            component,
            cached.componentOf(v));
        return true;
      }
    }
    return false;
  }
}
