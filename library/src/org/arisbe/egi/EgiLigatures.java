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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.arisbe.egi.primitives.DisjointSet;
import org.jspecify.annotations.Nullable;

/**
 * The ligatures of an EGI: the connected components of its vertices under the identity edges.
 * Every vertex belongs to exactly one component; a vertex with no identity edges forms a
 * singleton component of its own.
 *
 * <p>An EgiLigatures is computed in one pass from a fixed EGI and never changes afterwards, so it
 * cannot go stale: a different EGI has different ligatures. Components are named by their
 * smallest vertex id, which makes the names independent of the order the identity edges were
 * created in.
 */
public final class EgiLigatures {
  private static final Logger logger = Logger.getLogger(EgiLigatures.class.getCanonicalName());

  /** One connected component: the vertices it joins and the identity edges that join them. */
  public static final class Ligature {
    private final ElementId id;
    private final ImmutableSet<ElementId> vertices;
    private final ImmutableSet<ElementId> identityEdges;

    Ligature(
        ElementId id, ImmutableSet<ElementId> vertices, ImmutableSet<ElementId> identityEdges) {
      this.id = id;
      this.vertices = vertices;
      this.identityEdges = identityEdges;
    }

    /** Returns the component id, the smallest vertex id among its members. */
    public ElementId id() {
      return id;
    }

    public ImmutableSet<ElementId> vertices() {
      return vertices;
    }

    public ImmutableSet<ElementId> identityEdges() {
      return identityEdges;
    }

    /** Returns true if the component is a single vertex with no identity edges. */
    public boolean isTrivial() {
      return identityEdges.isEmpty();
    }

    @Override
    public String toString() {
      return "Ligature " + id + " " + vertices + " via " + identityEdges;
    }
  }

  /** Component id of every vertex. */
  private final ImmutableMap<ElementId, ElementId> componentOf;
  /** Component id to component. */
  private final ImmutableMap<ElementId, Ligature> components;

  private EgiLigatures(
      ImmutableMap<ElementId, ElementId> componentOf,
      ImmutableMap<ElementId, Ligature> components) {
    this.componentOf = componentOf;
    this.components = components;
  }

  /** Computes the ligatures of the given EGI from its current vertices and edges. */
  public static EgiLigatures of(Egi egi) {
    return compute(egi.vertices().keySet(), egi.edges().values());
  }

  /**
   * Computes ligatures over the given vertices, joined by the identity edges among the given
   * edges. Identity edges naming a vertex outside the set are ignored.
   */
  static EgiLigatures compute(Iterable<ElementId> vertices, Iterable<EgiEdge> edges) {
    DisjointSet<ElementId> set = new DisjointSet<>();
    for (ElementId v : vertices) {
      set.add(v);
    }
    ImmutableSetMultimap.Builder<ElementId, ElementId> edgesByVertex =
        ImmutableSetMultimap.builder();
    for (EgiEdge edge : edges) {
      if (!edge.isIdentity() || edge.arity() != EgiAlphabet.IDENTITY_ARITY) {
        continue;
      }
      if (set.union(edge.vertex(0), edge.vertex(1))) {
        edgesByVertex.put(edge.vertex(0), edge.id());
      }
    }
    ImmutableSetMultimap<ElementId, ElementId> identityEdges = edgesByVertex.build();

    ImmutableMap.Builder<ElementId, ElementId> componentOf = ImmutableMap.builder();
    ImmutableMap.Builder<ElementId, Ligature> components = ImmutableMap.builder();
    for (Map.Entry<ElementId, List<ElementId>> group : set.groups().entrySet()) {
      List<ElementId> members = group.getValue();
      ElementId id = Collections.min(members);
      ImmutableSet.Builder<ElementId> edgeIds = ImmutableSet.builder();
      for (ElementId member : members) {
        componentOf.put(member, id);
        edgeIds.addAll(identityEdges.get(member));
      }
      components.put(id, new Ligature(id, ImmutableSet.copyOf(members), edgeIds.build()));
    }
    EgiLigatures result = new EgiLigatures(componentOf.buildOrThrow(), components.buildOrThrow());
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(
          "Computed " + result.components.size() + " components over " + set.size() + " vertices");
    }
    return result;
  }

  /** Returns the component id of the vertex, or null if it isn't a vertex of the EGI. */
  public @Nullable ElementId componentOf(ElementId vertex) {
    return componentOf.get(vertex);
  }

  /**
   * Returns true if the two vertices are joined by a chain of identity edges. A vertex is always
   * connected to itself.
   */
  public boolean areConnected(ElementId v1, ElementId v2) {
    ElementId c1 = componentOf.get(v1);
    return c1 != null && c1.equals(componentOf.get(v2));
  }

  /** Returns the identity edges of the component, or an empty set for an unknown component id. */
  public ImmutableSet<ElementId> identityEdgesOf(ElementId component) {
    Ligature ligature = components.get(component);
    return ligature == null ? ImmutableSet.of() : ligature.identityEdges();
  }

  /** Returns the vertices of the component, or an empty set for an unknown component id. */
  public ImmutableSet<ElementId> verticesOf(ElementId component) {
    Ligature ligature = components.get(component);
    return ligature == null ? ImmutableSet.of() : ligature.vertices();
  }

  /** Returns the component with the given id, or null. */
  public @Nullable Ligature ligature(ElementId component) {
    return components.get(component);
  }

  /** Returns the non-trivial components, those joined by at least one identity edge. */
  public ImmutableList<Ligature> ligatures() {
    ImmutableList.Builder<Ligature> result = ImmutableList.builder();
    for (Ligature ligature : components.values()) {
      if (!ligature.isTrivial()) {
        result.add(ligature);
      }
    }
    return result.build();
  }

  /** Returns the number of components, trivial ones included. */
  public int componentCount() {
    return components.size();
  }

  /** Returns the identity edges of every component. */
  ImmutableSet<ElementId> allIdentityEdges() {
    ImmutableSet.Builder<ElementId> result = ImmutableSet.builder();
    for (Ligature ligature : components.values()) {
      result.addAll(ligature.identityEdges());
    }
    return result.build();
  }
}
