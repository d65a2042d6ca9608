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
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * An Existential Graph Instance in Dau's formalism: a sheet of assertion, a tree of cuts below it,
 * and vertices and relation edges placed in those contexts. An Egi is immutable. New instances are
 * produced by an {@link Builder}, which holds the mutation primitives, or by the
 * {@link EgiRuleEngine}; neither ever changes an existing Egi.
 *
 * <p>A well-formed Egi satisfies four invariants, checked by {@link #findValidationError}:
 *
 * <ol>
 *   <li>Dominating context: every edge's context equals or encloses the context of each of its
 *       vertices.
 *   <li>Enclosure: every vertex, edge and cut is directly enclosed by exactly one context, and that
 *       context is the one the element records.
 *   <li>Context tree: the contexts form a tree rooted at the sheet, with each cut's depth one more
 *       than its parent's.
 *   <li>Ligatures: the identity edges found by scanning the edges are exactly those inside the
 *       computed ligature components.
 * </ol>
 *
 * <p>The read accessors below are the traversal contract used by printers and layout engines.
 * Instances are safe to share between threads.
 */
public final class Egi {
  private final ElementId sheet;
  private final ImmutableMap<ElementId, EgiContext> contexts;
  private final ImmutableMap<ElementId, EgiVertex> vertices;
  private final ImmutableMap<ElementId, EgiEdge> edges;
  private final EgiAlphabet alphabet;
  private final EgiIdAllocator allocator;
  private final Supplier<EgiLigatures> ligatures = Suppliers.memoize(() -> EgiLigatures.of(this));

  private Egi(
      ElementId sheet,
      ImmutableMap<ElementId, EgiContext> contexts,
      ImmutableMap<ElementId, EgiVertex> vertices,
      ImmutableMap<ElementId, EgiEdge> edges,
      EgiAlphabet alphabet,
      EgiIdAllocator allocator) {
    this.sheet = sheet;
    this.contexts = contexts;
    this.vertices = vertices;
    this.edges = edges;
    this.alphabet = alphabet;
    this.allocator = allocator;
  }

  /** Returns a new EGI holding only an empty sheet, with the identity-only alphabet. */
  public static Egi empty() {
    return new Builder().buildUnchecked();
  }

  /** Returns a new EGI holding only an empty sheet, with the given alphabet. */
  public static Egi empty(EgiAlphabet alphabet) {
    return new Builder(alphabet).buildUnchecked();
  }

  /** Returns a builder holding a copy of this EGI. This EGI is not affected by the builder. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Returns the id of the sheet of assertion. */
  public ElementId sheet() {
    return sheet;
  }

  /** Returns the sheet of assertion. */
  public EgiContext sheetContext() {
    return contexts.get(sheet);
  }

  /** Returns every context, the sheet included, keyed by id. */
  public ImmutableMap<ElementId, EgiContext> contexts() {
    return contexts;
  }

  /** Returns every vertex, keyed by id. */
  public ImmutableMap<ElementId, EgiVertex> vertices() {
    return vertices;
  }

  /** Returns every edge, keyed by id. */
  public ImmutableMap<ElementId, EgiEdge> edges() {
    return edges;
  }

  /** Returns the relation alphabet. */
  public EgiAlphabet alphabet() {
    return alphabet;
  }

  /** Returns the context with the given id, or null. */
  public @Nullable EgiContext context(ElementId id) {
    return contexts.get(id);
  }

  /** Returns the vertex with the given id, or null. */
  public @Nullable EgiVertex vertex(ElementId id) {
    return vertices.get(id);
  }

  /** Returns the edge with the given id, or null. */
  public @Nullable EgiEdge edge(ElementId id) {
    return edges.get(id);
  }

  /** Returns true if the id names the sheet or a live vertex, edge or cut. */
  public boolean contains(ElementId id) {
    return contexts.containsKey(id) || vertices.containsKey(id) || edges.containsKey(id);
  }

  /** Returns the number of cuts. */
  public int numCuts() {
    return contexts.size() - 1;
  }

  /**
   * Returns the context directly enclosing the given vertex, edge or cut, or null for the sheet or
   * an unknown id.
   */
  public @Nullable ElementId contextOf(ElementId element) {
    switch (element.kind()) {
      case VERTEX:
        EgiVertex v = vertices.get(element);
        return v == null ? null : v.context();
      case EDGE:
        EgiEdge e = edges.get(element);
        return e == null ? null : e.context();
      case CUT:
        EgiContext c = contexts.get(element);
        return c == null ? null : c.parent();
      case SHEET:
        return null;
    }
    throw new AssertionError(element.kind());
  }

  /**
   * Returns the number of cuts strictly enclosing the element. For vertices and edges this is the
   * depth of their context; for a cut it is one less than the cut's own depth.
   *
   * @throws IllegalArgumentException if the element is not in this EGI
   */
  public int depthOf(ElementId element) {
    if (element.isContext()) {
      EgiContext c = contexts.get(element);
      Preconditions.checkArgument(c != null, "Unknown context %s", element);
      return Math.max(c.depth() - 1, 0);
    }
    ElementId context = contextOf(element);
    Preconditions.checkArgument(context != null, "Unknown element %s", element);
    return contexts.get(context).depth();
  }

  /**
   * Returns true if the context has even depth.
   *
   * @throws IllegalArgumentException if the id is not a context of this EGI
   */
  public boolean isPositive(ElementId context) {
    EgiContext c = contexts.get(context);
    Preconditions.checkArgument(c != null, "Unknown context %s", context);
    return c.isPositive();
  }

  /**
   * Returns true if context a equals or transitively encloses context b. Dominance is reflexive and
   * transitive. Returns false if either id is not a context of this EGI.
   */
  public boolean dominates(ElementId a, ElementId b) {
    return dominates(contexts, a, b);
  }

  private static boolean dominates(Map<ElementId, EgiContext> contexts, ElementId a, ElementId b) {
    if (!contexts.containsKey(a)) {
      return false;
    }
    EgiContext c = contexts.get(b);
    while (c != null) {
      if (c.id().equals(a)) {
        return true;
      }
      c = c.parent() == null ? null : contexts.get(c.parent());
    }
    return false;
  }

  /** Returns the deepest context dominating both given contexts. */
  ElementId lowestCommonAncestor(ElementId a, ElementId b) {
    EgiContext ca = contexts.get(a);
    EgiContext cb = contexts.get(b);
    Preconditions.checkArgument(ca != null && cb != null, "Unknown context %s or %s", a, b);
    while (ca.depth() > cb.depth()) {
      ca = contexts.get(ca.parent());
    }
    while (cb.depth() > ca.depth()) {
      cb = contexts.get(cb.parent());
    }
    while (!ca.id().equals(cb.id())) {
      ca = contexts.get(ca.parent());
      cb = contexts.get(cb.parent());
    }
    return ca.id();
  }

  /**
   * Returns the ligatures of this EGI. They are computed on first use and cached; the cache is
   * never stale because the EGI never changes.
   */
  public EgiLigatures ligatures() {
    return ligatures.get();
  }

  /** Returns true if the two vertices are joined by a chain of identity edges. */
  public boolean areConnected(ElementId v1, ElementId v2) {
    return ligatures().areConnected(v1, v2);
  }

  /** Returns the vertices with no incident edges. */
  public ImmutableSet<ElementId> isolatedVertices() {
    ImmutableSet.Builder<ElementId> result = ImmutableSet.builder();
    for (EgiVertex v : vertices.values()) {
      if (v.isIsolated()) {
        result.add(v.id());
      }
    }
    return result.build();
  }

  /**
   * Returns every element the context encloses directly or through nested cuts, which is Dau's
   * notion of the context of a cut as opposed to its area. The context itself is not included.
   */
  public ImmutableSet<ElementId> transitiveContents(ElementId context) {
    Preconditions.checkArgument(contexts.containsKey(context), "Unknown context %s", context);
    ImmutableSet.Builder<ElementId> result = ImmutableSet.builder();
    Deque<ElementId> stack = new ArrayDeque<>();
    stack.push(context);
    while (!stack.isEmpty()) {
      EgiContext c = contexts.get(stack.pop());
      result.addAll(c.enclosed());
      for (ElementId child : c.children()) {
        stack.push(child);
      }
    }
    return result.build();
  }

  /**
   * Walks the whole EGI depth-first, as described on {@link EgiVisitor}. Uses an explicit stack, so
   * arbitrarily deep nesting is fine.
   */
  public void traverse(EgiVisitor visitor) {
    // Each entry is a context to open, or, when 'close' is set, a context to finish.
    final class Frame {
      final EgiContext context;
      final boolean close;

      Frame(EgiContext context, boolean close) {
        this.context = context;
        this.close = close;
      }
    }
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(sheetContext(), false));
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      EgiContext c = frame.context;
      if (frame.close) {
        visitor.finishContext(c);
        continue;
      }
      visitor.startContext(c);
      List<ElementId> ids = Ordering.natural().sortedCopy(c.enclosed());
      for (ElementId id : ids) {
        if (id.isVertex()) {
          visitor.visitVertex(vertices.get(id));
        }
      }
      for (ElementId id : ids) {
        if (id.isEdge()) {
          visitor.visitEdge(edges.get(id));
        }
      }
      stack.push(new Frame(c, true));
      for (ElementId id : Ordering.natural().reverse().sortedCopy(c.children())) {
        stack.push(new Frame(contexts.get(id), false));
      }
    }
  }

  /** Returns true if all four invariants hold. */
  public boolean isWellFormed() {
    return !findValidationError(new EgiError());
  }

  /**
   * Checks every invariant. Returns true and fills in the error if one is violated; returns false
   * if the EGI is well-formed.
   */
  @CanIgnoreReturnValue
  public boolean findValidationError(EgiError error) {
    return EgiValidator.findValidationError(this, error);
  }

  EgiIdAllocator allocator() {
    return allocator;
  }

  /** Structural equality: same sheet, contexts, vertices, edges and alphabet. */
  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Egi)) {
      return false;
    }
    Egi that = (Egi) other;
    return sheet.equals(that.sheet)
        && contexts.equals(that.contexts)
        && vertices.equals(that.vertices)
        && edges.equals(that.edges)
        && alphabet.equals(that.alphabet);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sheet, contexts, vertices, edges, alphabet);
  }

  @Override
  public String toString() {
    return EgiTextFormat.toDebugString(this);
  }

  /**
   * The construction contract and the mutation primitives. A Builder starts either from an empty
   * sheet or from a copy of an existing Egi, applies primitive edits to its own private state, and
   * produces a new immutable Egi with {@link #build(EgiError)}. Each primitive keeps the
   * invariants:
   * it refuses an edit that would break one, reporting why through its EgiError parameter.
   *
   * <p>A surface-syntax parser builds an EGI like this:
   *
   * <pre>{@code
   * Egi.Builder builder = new Egi.Builder(EgiAlphabet.builder().add("Human", 1).build());
   * ElementId cut = builder.addCutUnsafe(builder.sheet());
   * ElementId x = builder.addVertexUnsafe(cut, null);
   * builder.addEdgeUnsafe(cut, "Human", ImmutableList.of(x));
   * Egi egi = builder.buildUnsafe();
   * }</pre>
   *
   * <p>Builders are not thread-safe.
   */
  public static final class Builder {
    /** A context under construction. */
    private static final class MutableContext {
      final ElementId id;
      @Nullable ElementId parent;
      int depth;
      final Set<ElementId> enclosed = new LinkedHashSet<>();

      MutableContext(ElementId id, @Nullable ElementId parent, int depth) {
        this.id = id;
        this.parent = parent;
        this.depth = depth;
      }
    }

    /** A vertex under construction. */
    private static final class MutableVertex {
      final ElementId id;
      ElementId context;
      final @Nullable String label;
      final Set<ElementId> incidentEdges = new LinkedHashSet<>();

      MutableVertex(ElementId id, ElementId context, @Nullable String label) {
        this.id = id;
        this.context = context;
        this.label = label;
      }
    }

    private final EgiIdAllocator allocator;
    private final ElementId sheet;
    private EgiAlphabet alphabet;
    private final Map<ElementId, MutableContext> contexts = new LinkedHashMap<>();
    private final Map<ElementId, MutableVertex> vertices = new LinkedHashMap<>();
    private final Map<ElementId, EgiEdge> edges = new LinkedHashMap<>();

    /** Starts a new EGI lineage with an empty sheet and the identity-only alphabet. */
    public Builder() {
      this(EgiAlphabet.identityOnly());
    }

    /** Starts a new EGI lineage with an empty sheet and the given alphabet. */
    public Builder(EgiAlphabet alphabet) {
      this.allocator = new EgiIdAllocator();
      this.alphabet = Preconditions.checkNotNull(alphabet);
      this.sheet = allocator.allocate(ElementId.Kind.SHEET);
      contexts.put(sheet, new MutableContext(sheet, null, 0));
    }

    private Builder(Egi egi) {
      this.allocator = egi.allocator;
      this.alphabet = egi.alphabet;
      this.sheet = egi.sheet;
      for (EgiContext c : egi.contexts.values()) {
        MutableContext copy = new MutableContext(c.id(), c.parent(), c.depth());
        copy.enclosed.addAll(c.enclosed());
        contexts.put(c.id(), copy);
      }
      for (EgiVertex v : egi.vertices.values()) {
        MutableVertex copy = new MutableVertex(v.id(), v.context(), v.label());
        copy.incidentEdges.addAll(v.incidentEdges());
        vertices.put(v.id(), copy);
      }
      edges.putAll(egi.edges);
    }

    /** Returns the id of the sheet of assertion. */
    public ElementId sheet() {
      return sheet;
    }

    /** Returns the current alphabet. */
    public EgiAlphabet alphabet() {
      return alphabet;
    }

    /**
     * Registers a relation with the alphabet. Returns false with RELATION_ARITY_CONFLICT if the
     * name is already registered with another arity.
     */
    @CanIgnoreReturnValue
    public boolean registerRelation(String name, int arity, EgiError error) {
      EgiAlphabet extended = alphabet.withRelation(name, arity, error);
      if (extended == null) {
        return false;
      }
      alphabet = extended;
      return true;
    }

    /** As {@link #registerRelation(String, int, EgiError)}, but throws on failure. */
    @CanIgnoreReturnValue
    public Builder registerRelationUnsafe(String name, int arity) {
      EgiError error = new EgiError();
      if (!registerRelation(name, arity, error)) {
        throw new EgiException(error);
      }
      return this;
    }

    /** Returns true if the id names the sheet or a cut in this builder. */
    public boolean isContext(ElementId id) {
      return contexts.containsKey(id);
    }

    /** Returns true if the id names a vertex in this builder. */
    public boolean isVertex(ElementId id) {
      return vertices.containsKey(id);
    }

    /** Returns true if the id names an edge in this builder. */
    public boolean isEdge(ElementId id) {
      return edges.containsKey(id);
    }

    /** Returns the depth of a context in this builder. */
    int depth(ElementId context) {
      return contexts.get(context).depth;
    }

    /** Returns the ids directly enclosed by a context, in insertion order. */
    ImmutableList<ElementId> enclosed(ElementId context) {
      return ImmutableList.copyOf(contexts.get(context).enclosed);
    }

    /**
     * Creates a new, empty cut directly inside the given parent context. Returns null with
     * UNKNOWN_CONTEXT if the parent is not live.
     */
    public @Nullable ElementId addCut(ElementId parent, EgiError error) {
      MutableContext p = contexts.get(parent);
      if (p == null) {
        error.init(EgiError.Code.UNKNOWN_CONTEXT, "No context %s to add a cut to", parent);
        return null;
      }
      ElementId id = allocator.allocate(ElementId.Kind.CUT);
      contexts.put(id, new MutableContext(id, parent, p.depth + 1));
      p.enclosed.add(id);
      return id;
    }

    /** As {@link #addCut(ElementId, EgiError)}, but throws on failure. */
    public ElementId addCutUnsafe(ElementId parent) {
      EgiError error = new EgiError();
      ElementId id = addCut(parent, error);
      if (id == null) {
        throw new EgiException(error);
      }
      return id;
    }

    /**
     * Creates a new isolated vertex in the given context: a constant if a label is given, a generic
     * vertex otherwise. Returns null with UNKNOWN_CONTEXT if the context is not live.
     */
    public @Nullable ElementId addVertex(
        ElementId context, @Nullable String constantLabel, EgiError error) {
      MutableContext c = contexts.get(context);
      if (c == null) {
        error.init(EgiError.Code.UNKNOWN_CONTEXT, "No context %s to add a vertex to", context);
        return null;
      }
      if (constantLabel != null && constantLabel.isEmpty()) {
        error.init(EgiError.Code.INVALID_ARGUMENT, "Constant labels must not be empty");
        return null;
      }
      ElementId id = allocator.allocate(ElementId.Kind.VERTEX);
      vertices.put(id, new MutableVertex(id, context, constantLabel));
      c.enclosed.add(id);
      return id;
    }

    /** As {@link #addVertex(ElementId, String, EgiError)}, but throws on failure. */
    public ElementId addVertexUnsafe(ElementId context, @Nullable String constantLabel) {
      EgiError error = new EgiError();
      ElementId id = addVertex(context, constantLabel, error);
      if (id == null) {
        throw new EgiException(error);
      }
      return id;
    }

    /**
     * Creates a new edge of the named relation over the given vertices, in the given context.
     * Returns null if the context is not live (UNKNOWN_CONTEXT), the (relation, arity) pair is not
     * registered (UNREGISTERED_RELATION), a vertex does not exist (NOT_FOUND), or the context does
     * not dominate some vertex's context (DOMINATION_VIOLATION).
     */
    public @Nullable ElementId addEdge(
        ElementId context, String relation, List<ElementId> vertexIds, EgiError error) {
      Preconditions.checkNotNull(relation);
      if (!contexts.containsKey(context)) {
        error.init(EgiError.Code.UNKNOWN_CONTEXT, "No context %s to add an edge to", context);
        return null;
      }
      if (!alphabet.contains(relation, vertexIds.size())) {
        error.init(
            EgiError.Code.UNREGISTERED_RELATION,
            "Relation '%s' with arity %d is not registered (alphabet: %s)",
            relation,
            vertexIds.size(),
            alphabet);
        return null;
      }
      for (ElementId v : vertexIds) {
        MutableVertex vertex = vertices.get(v);
        if (vertex == null) {
          error.init(EgiError.Code.NOT_FOUND, "No vertex %s for relation '%s'", v, relation);
          return null;
        }
        if (!dominates(context, vertex.context)) {
          error.init(
              EgiError.Code.DOMINATION_VIOLATION,
              "Edge context %s does not dominate context %s of vertex %s",
              context,
              vertex.context,
              v);
          return null;
        }
      }
      ElementId id = allocator.allocate(ElementId.Kind.EDGE);
      edges.put(id, new EgiEdge(id, context, relation, ImmutableList.copyOf(vertexIds)));
      contexts.get(context).enclosed.add(id);
      for (ElementId v : vertexIds) {
        vertices.get(v).incidentEdges.add(id);
      }
      return id;
    }

    /** As {@link #addEdge(ElementId, String, List, EgiError)}, but throws on failure. */
    public ElementId addEdgeUnsafe(ElementId context, String relation, List<ElementId> vertexIds) {
      EgiError error = new EgiError();
      ElementId id = addEdge(context, relation, vertexIds, error);
      if (id == null) {
        throw new EgiException(error);
      }
      return id;
    }

    /**
     * Removes a vertex together with every edge attached to it. Returns false with NOT_FOUND if
     * there is no such vertex.
     */
    @CanIgnoreReturnValue
    public boolean removeVertex(ElementId id, EgiError error) {
      MutableVertex v = vertices.get(id);
      if (v == null) {
        error.init(EgiError.Code.NOT_FOUND, "No vertex %s to remove", id);
        return false;
      }
      for (ElementId e : new ArrayList<>(v.incidentEdges)) {
        detachEdge(e);
      }
      vertices.remove(id);
      contexts.get(v.context).enclosed.remove(id);
      return true;
    }

    /** Removes an edge. Returns false with NOT_FOUND if there is no such edge. */
    @CanIgnoreReturnValue
    public boolean removeEdge(ElementId id, EgiError error) {
      if (!edges.containsKey(id)) {
        error.init(EgiError.Code.NOT_FOUND, "No edge %s to remove", id);
        return false;
      }
      detachEdge(id);
      return true;
    }

    private void detachEdge(ElementId id) {
      EgiEdge edge = edges.remove(id);
      for (ElementId v : edge.vertices()) {
        vertices.get(v).incidentEdges.remove(id);
      }
      contexts.get(edge.context()).enclosed.remove(id);
    }

    /**
     * Removes a cut and everything it encloses, directly or through nested cuts. Edges outside the
     * cut that are attached to a vertex inside it are removed too, as {@link #removeVertex} would.
     * Returns false with NOT_FOUND if the id is not a cut.
     */
    @CanIgnoreReturnValue
    public boolean removeCut(ElementId id, EgiError error) {
      MutableContext cut = contexts.get(id);
      if (cut == null || cut.parent == null) {
        error.init(EgiError.Code.NOT_FOUND, "No cut %s to remove", id);
        return false;
      }
      // Collect the subtree with a worklist; nesting depth is unbounded.
      List<MutableContext> subtree = new ArrayList<>();
      Deque<MutableContext> stack = new ArrayDeque<>();
      stack.push(cut);
      while (!stack.isEmpty()) {
        MutableContext c = stack.pop();
        subtree.add(c);
        for (ElementId child : c.enclosed) {
          if (child.isCut()) {
            stack.push(contexts.get(child));
          }
        }
      }
      for (MutableContext c : subtree) {
        for (ElementId e : new ArrayList<>(c.enclosed)) {
          if (e.isEdge() && edges.containsKey(e)) {
            detachEdge(e);
          }
        }
      }
      for (MutableContext c : subtree) {
        for (ElementId v : new ArrayList<>(c.enclosed)) {
          if (v.isVertex()) {
            removeVertex(v, error);
          }
        }
      }
      for (MutableContext c : subtree) {
        contexts.remove(c.id);
      }
      contexts.get(cut.parent).enclosed.remove(id);
      return true;
    }

    /** Removes any vertex, edge or cut. Returns false with NOT_FOUND for an unknown id. */
    @CanIgnoreReturnValue
    public boolean removeElement(ElementId id, EgiError error) {
      switch (id.kind()) {
        case VERTEX:
          return removeVertex(id, error);
        case EDGE:
          return removeEdge(id, error);
        case CUT:
          return removeCut(id, error);
        case SHEET:
          break;
      }
      error.init(EgiError.Code.INVALID_ARGUMENT, "The sheet of assertion cannot be removed");
      return false;
    }

    /**
     * Moves a vertex, edge or cut (with its whole subtree) to another context, updating depths. The
     * caller is responsible for domination; {@link #build} reports any violation.
     */
    void moveElement(ElementId id, ElementId target) {
      MutableContext to = contexts.get(target);
      Preconditions.checkArgument(to != null, "Unknown target context %s", target);
      switch (id.kind()) {
        case VERTEX:
          MutableVertex v = vertices.get(id);
          contexts.get(v.context).enclosed.remove(id);
          v.context = target;
          break;
        case EDGE:
          EgiEdge e = edges.get(id);
          contexts.get(e.context()).enclosed.remove(id);
          edges.put(id, e.withContext(target));
          break;
        case CUT:
          MutableContext c = contexts.get(id);
          Preconditions.checkArgument(
              !dominates(id, target), "Cannot move cut %s into itself (%s)", id, target);
          contexts.get(c.parent).enclosed.remove(id);
          c.parent = target;
          redepth(c, to.depth + 1);
          break;
        case SHEET:
          throw new IllegalArgumentException("The sheet cannot be moved");
      }
      to.enclosed.add(id);
    }

    private void redepth(MutableContext root, int depth) {
      root.depth = depth;
      Deque<MutableContext> stack = new ArrayDeque<>();
      stack.push(root);
      while (!stack.isEmpty()) {
        MutableContext c = stack.pop();
        for (ElementId child : c.enclosed) {
          if (child.isCut()) {
            MutableContext cc = contexts.get(child);
            cc.depth = c.depth + 1;
            stack.push(cc);
          }
        }
      }
    }

    /** Returns true if context a equals or encloses context b, in this builder's current tree. */
    boolean dominates(ElementId a, ElementId b) {
      MutableContext c = contexts.get(b);
      while (c != null) {
        if (c.id.equals(a)) {
          return true;
        }
        c = c.parent == null ? null : contexts.get(c.parent);
      }
      return false;
    }

    /** Returns the context of a vertex in this builder. */
    ElementId vertexContext(ElementId vertex) {
      return vertices.get(vertex).context;
    }

    /**
     * Returns a new Egi holding this builder's contents, or null if the contents are not
     * well-formed, in which case the error describes the first violation found. The builder may be
     * used further afterwards; later edits do not affect the returned Egi.
     */
    public @Nullable Egi build(EgiError error) {
      Egi egi = buildUnchecked();
      if (egi.findValidationError(error)) {
        return null;
      }
      return egi;
    }

    /** As {@link #build(EgiError)}, but throws on failure. */
    public Egi buildUnsafe() {
      EgiError error = new EgiError();
      Egi egi = build(error);
      if (egi == null) {
        throw new EgiException(error);
      }
      return egi;
    }

    /** Returns a new Egi without running the validator. */
    Egi buildUnchecked() {
      ImmutableMap.Builder<ElementId, EgiContext> builtContexts = ImmutableMap.builder();
      for (MutableContext c : contexts.values()) {
        ImmutableSet.Builder<ElementId> children = ImmutableSet.builder();
        for (ElementId id : c.enclosed) {
          if (id.isCut()) {
            children.add(id);
          }
        }
        builtContexts.put(
            c.id,
            new EgiContext(
                c.id, c.parent, c.depth, ImmutableSet.copyOf(c.enclosed), children.build()));
      }
      ImmutableMap.Builder<ElementId, EgiVertex> builtVertices = ImmutableMap.builder();
      for (MutableVertex v : vertices.values()) {
        builtVertices.put(
            v.id, new EgiVertex(v.id, v.context, v.label, ImmutableSet.copyOf(v.incidentEdges)));
      }
      return new Egi(
          sheet,
          builtContexts.buildOrThrow(),
          builtVertices.buildOrThrow(),
          ImmutableMap.copyOf(edges),
          alphabet,
          allocator);
    }
  }
}
