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
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;
import com.google.common.collect.Table;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Applies the eight transformation rules of the calculus to EGIs. Every rule checks its
 * preconditions first; on failure it returns null and fills in the error, and on success it
 * returns a new EGI and leaves the input untouched. Rules never change the relation alphabet,
 * except that insertion may not use relations the host does not already know.
 *
 * <p>Polarity decides which rules apply where: erasure needs a positive context, insertion a
 * negative one. Iteration, de-iteration, the double-cut rules and the isolated-vertex rules apply
 * in any context.
 *
 * <p>Unless disabled in the {@link Options}, every result is validated before it is returned. A
 * result that fails validation indicates a bug in the engine; it is logged and reported by
 * throwing an {@link EgiException} with code MALFORMED_RESULT.
 *
 * <p>An engine holds only its options, so one instance may be shared between threads.
 */
public final class EgiRuleEngine {
  private static final Logger logger = Logger.getLogger(EgiRuleEngine.class.getCanonicalName());

  /** Options for an {@link EgiRuleEngine}. */
  public static final class Options {
    private final boolean validateResults;
    private final boolean linkIteratedVertices;
    private final long maxMatchSteps;

    private Options(Builder builder) {
      this.validateResults = builder.validateResults;
      this.linkIteratedVertices = builder.linkIteratedVertices;
      this.maxMatchSteps = builder.maxMatchSteps;
    }

    public static Options defaults() {
      return builder().build();
    }

    public static Builder builder() {
      return new Builder();
    }

    public Builder toBuilder() {
      return new Builder()
          .setValidateResults(validateResults)
          .setLinkIteratedVertices(linkIteratedVertices)
          .setMaxMatchSteps(maxMatchSteps);
    }

    /** If true (the default), every result is run through the validator before it is returned. */
    public boolean validateResults() {
      return validateResults;
    }

    /**
     * If true, iteration joins each copied vertex to its original with an identity edge, so the
     * copy is about the same individuals as the original. Defaults to false.
     */
    public boolean linkIteratedVertices() {
      return linkIteratedVertices;
    }

    /**
     * The maximum number of steps the de-iteration search may take before it gives up with
     * RESOURCE_EXHAUSTED. Defaults to 1,000,000.
     */
    public long maxMatchSteps() {
      return maxMatchSteps;
    }

    /** Builder for {@link Options}. */
    public static final class Builder {
      private boolean validateResults = true;
      private boolean linkIteratedVertices = false;
      private long maxMatchSteps = 1_000_000;

      private Builder() {}

      @CanIgnoreReturnValue
      public Builder setValidateResults(boolean validateResults) {
        this.validateResults = validateResults;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder setLinkIteratedVertices(boolean linkIteratedVertices) {
        this.linkIteratedVertices = linkIteratedVertices;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder setMaxMatchSteps(long maxMatchSteps) {
        Preconditions.checkArgument(maxMatchSteps > 0, "maxMatchSteps must be positive");
        this.maxMatchSteps = maxMatchSteps;
        return this;
      }

      public Options build() {
        return new Options(this);
      }
    }
  }

  private final Options options;

  public EgiRuleEngine() {
    this(Options.defaults());
  }

  public EgiRuleEngine(Options options) {
    this.options = Preconditions.checkNotNull(options);
  }

  public Options options() {
    return options;
  }

  /**
   * Applies the requested rule to the EGI. Returns the transformation, or null if the rule's
   * preconditions do not hold, in which case the error says why.
   */
  public @Nullable EgiTransformation apply(
      Egi egi, EgiRuleApplication application, EgiError error) {
    Preconditions.checkNotNull(egi);
    switch (application.rule()) {
      case ERASURE:
        return erase(egi, application.selection(), error);
      case INSERTION:
        return insert(
            egi, application.target(), application.fragment(), application.bindings(), error);
      case ITERATION:
        return iterate(egi, application.selection(), application.target(), error);
      case DEITERATION:
        return deiterate(egi, application.selection(), application.source(), error);
      case DOUBLE_CUT_ADDITION:
        return addDoubleCut(egi, application.target(), application.selection(), error);
      case DOUBLE_CUT_REMOVAL:
        return removeDoubleCut(egi, application.target(), error);
      case ISOLATED_VERTEX_ADDITION:
        return addIsolatedVertex(egi, application.target(), application.label(), error);
      case ISOLATED_VERTEX_REMOVAL:
        return removeIsolatedVertex(
            egi, application.selection().iterator().next(), error);
    }
    throw new AssertionError("Unknown rule " + application.rule());
  }

  /** As {@link #apply(Egi, EgiRuleApplication, EgiError)}, but throws on failure. */
  public EgiTransformation applyUnsafe(Egi egi, EgiRuleApplication application) {
    EgiError error = new EgiError();
    EgiTransformation result = apply(egi, application, error);
    if (result == null) {
      throw new EgiException(error);
    }
    return result;
  }

  /** Returns true if the rule application is legal for the EGI, filling in the error otherwise. */
  public boolean check(Egi egi, EgiRuleApplication application, EgiError error) {
    return apply(egi, application, error) != null;
  }

  /**
   * Returns applications that are legal for the EGI and need no further arguments: erasure of
   * each edge, and of each cut that can be removed cleanly, in a positive context; removal of each
   * double cut; and removal of each isolated vertex. Insertion, iteration, de-iteration and the
   * additions need a payload or target of the caller's choosing and are not enumerated.
   */
  public ImmutableList<EgiRuleApplication> availableApplications(Egi egi) {
    ImmutableList.Builder<EgiRuleApplication> result = ImmutableList.builder();
    EgiError error = new EgiError();
    for (ElementId e : Ordering.natural().sortedCopy(egi.edges().keySet())) {
      if (egi.isPositive(egi.edge(e).context())) {
        result.add(EgiRuleApplication.erasure(ImmutableSet.of(e)));
      }
    }
    for (ElementId c : Ordering.natural().sortedCopy(egi.contexts().keySet())) {
      EgiContext cut = egi.context(c);
      if (cut.isSheet()) {
        continue;
      }
      if (egi.isPositive(cut.parent())) {
        EgiSubgraph subgraph = EgiSubgraph.of(egi, ImmutableSet.of(c), error);
        if (subgraph != null && subgraph.findEdgeLeavingClosure(egi) == null) {
          result.add(EgiRuleApplication.erasure(ImmutableSet.of(c)));
        }
      }
      if (cut.enclosed().size() == 1 && cut.children().size() == 1) {
        result.add(EgiRuleApplication.doubleCutRemoval(c));
      }
    }
    for (ElementId v : Ordering.natural().sortedCopy(egi.isolatedVertices())) {
      result.add(EgiRuleApplication.isolatedVertexRemoval(v));
    }
    return result.build();
  }

  // Rule 1.

  /**
   * Removes the selection, and everything inside selected cuts, from a positive context. Fails
   * with WRONG_POLARITY in a negative context, and with INCOMPLETE_SELECTION if an edge outside
   * the selection is attached to a vertex that would be removed.
   */
  public @Nullable EgiTransformation erase(Egi egi, Set<ElementId> selection, EgiError error) {
    EgiSubgraph subgraph = EgiSubgraph.of(egi, selection, error);
    if (subgraph == null) {
      return rejected(EgiRule.ERASURE, error);
    }
    if (!egi.isPositive(subgraph.container())) {
      return reject(
          EgiRule.ERASURE,
          error,
          EgiError.Code.WRONG_POLARITY,
          "Cannot erase from %s, which is negative (depth %s)",
          subgraph.container(),
          egi.context(subgraph.container()).depth());
    }
    EgiEdge leaving = subgraph.findEdgeLeavingClosure(egi);
    if (leaving != null) {
      return reject(
          EgiRule.ERASURE,
          error,
          EgiError.Code.INCOMPLETE_SELECTION,
          "Edge %s is attached to an erased vertex but is not selected",
          leaving);
    }
    Egi.Builder builder = egi.toBuilder();
    removeSelection(builder, subgraph);
    return finish(EgiRule.ERASURE, builder, ImmutableSet.of(), subgraph.closure());
  }

  // Rule 2.

  /**
   * Copies the contents of the fragment's sheet into a negative context of the EGI. Each fragment
   * vertex that is a key of {@code bindings} is not copied; edges attached to it are attached to
   * the bound host vertex instead, which must be visible from where the edge lands. Fails with
   * WRONG_POLARITY in a positive context, and with UNREGISTERED_RELATION if the fragment uses a
   * relation the host alphabet lacks.
   */
  public @Nullable EgiTransformation insert(
      Egi egi,
      ElementId context,
      Egi fragment,
      Map<ElementId, ElementId> bindings,
      EgiError error) {
    Preconditions.checkNotNull(fragment);
    EgiContext target = egi.context(context);
    if (target == null) {
      return reject(
          EgiRule.INSERTION, error, EgiError.Code.NOT_FOUND, "No context %s", context);
    }
    if (target.isPositive()) {
      return reject(
          EgiRule.INSERTION,
          error,
          EgiError.Code.WRONG_POLARITY,
          "Cannot insert into %s, which is positive (depth %s)",
          context,
          target.depth());
    }
    for (Map.Entry<ElementId, ElementId> binding : bindings.entrySet()) {
      EgiVertex fv = fragment.vertex(binding.getKey());
      if (fv == null || !fv.context().equals(fragment.sheet())) {
        return reject(
            EgiRule.INSERTION,
            error,
            EgiError.Code.INVALID_ARGUMENT,
            "Bound vertex %s is not a vertex on the fragment's sheet",
            binding.getKey());
      }
      if (egi.vertex(binding.getValue()) == null) {
        return reject(
            EgiRule.INSERTION,
            error,
            EgiError.Code.NOT_FOUND,
            "No host vertex %s to bind %s to",
            binding.getValue(),
            binding.getKey());
      }
    }

    Egi.Builder builder = egi.toBuilder();
    ImmutableSet.Builder<ElementId> added = ImmutableSet.builder();
    Map<ElementId, ElementId> copies = new HashMap<>(bindings);
    copies.put(fragment.sheet(), context);
    Deque<ElementId> queue = new ArrayDeque<>();
    queue.add(fragment.sheet());
    while (!queue.isEmpty()) {
      ElementId c = queue.poll();
      for (ElementId child : Ordering.natural().sortedCopy(fragment.context(c).children())) {
        ElementId copy = require(builder.addCut(copies.get(c), error), error);
        copies.put(child, copy);
        added.add(copy);
        queue.add(child);
      }
    }
    for (EgiVertex fv : sorted(fragment.vertices())) {
      if (copies.containsKey(fv.id())) {
        continue;
      }
      ElementId copy =
          require(builder.addVertex(copies.get(fv.context()), fv.label(), error), error);
      copies.put(fv.id(), copy);
      added.add(copy);
    }
    for (EgiEdge fe : sorted(fragment.edges())) {
      List<ElementId> vertices = new ArrayList<>(fe.arity());
      for (ElementId v : fe.vertices()) {
        vertices.add(copies.get(v));
      }
      ElementId copy = builder.addEdge(copies.get(fe.context()), fe.relation(), vertices, error);
      if (copy == null) {
        return rejected(EgiRule.INSERTION, error);
      }
      added.add(copy);
    }
    return finish(EgiRule.INSERTION, builder, added.build(), ImmutableSet.of());
  }

  // Rule 3.

  /**
   * Copies the selection into the target, which must be the selection's own context or a context
   * nested inside it but not inside the selection. Copied elements get fresh ids. Where a copied
   * edge is attached to a vertex outside the selection, the copy is attached to a new vertex in
   * the copy's context instead, joined to the outside vertex by an identity edge, so the copy
   * talks about the same individual.
   */
  public @Nullable EgiTransformation iterate(
      Egi egi, Set<ElementId> selection, ElementId target, EgiError error) {
    EgiSubgraph subgraph = EgiSubgraph.of(egi, selection, error);
    if (subgraph == null) {
      return rejected(EgiRule.ITERATION, error);
    }
    if (egi.context(target) == null) {
      return reject(EgiRule.ITERATION, error, EgiError.Code.NOT_FOUND, "No context %s", target);
    }
    if (!egi.dominates(subgraph.container(), target)) {
      return reject(
          EgiRule.ITERATION,
          error,
          EgiError.Code.INVALID_NESTING,
          "Target %s is neither %s nor nested inside it",
          target,
          subgraph.container());
    }
    if (subgraph.contains(target)) {
      return reject(
          EgiRule.ITERATION,
          error,
          EgiError.Code.INVALID_NESTING,
          "Target %s lies inside the iterated subgraph",
          target);
    }

    Egi.Builder builder = egi.toBuilder();
    ImmutableSet.Builder<ElementId> added = ImmutableSet.builder();
    Map<ElementId, ElementId> copies = new HashMap<>();
    copies.put(subgraph.container(), target);
    for (ElementId cut : subgraph.cutsTopDown()) {
      ElementId copy = require(builder.addCut(copies.get(egi.contextOf(cut)), error), error);
      copies.put(cut, copy);
      added.add(copy);
    }
    for (ElementId v : subgraph.vertices()) {
      EgiVertex vertex = egi.vertex(v);
      ElementId copy =
          require(builder.addVertex(copies.get(vertex.context()), vertex.label(), error), error);
      copies.put(v, copy);
      added.add(copy);
      if (options.linkIteratedVertices()) {
        ElementId join = egi.lowestCommonAncestor(vertex.context(), target);
        added.add(
            require(
                builder.addEdge(join, EgiAlphabet.IDENTITY, ImmutableList.of(v, copy), error),
                error));
      }
    }
    // Proxies for outside vertices, keyed by (outside vertex, context of the copied edge).
    Table<ElementId, ElementId, ElementId> proxies = HashBasedTable.create();
    for (ElementId e : subgraph.edges()) {
      EgiEdge edge = egi.edge(e);
      ElementId context = copies.get(edge.context());
      List<ElementId> vertices = new ArrayList<>(edge.arity());
      for (ElementId v : edge.vertices()) {
        if (subgraph.contains(v)) {
          vertices.add(copies.get(v));
          continue;
        }
        ElementId proxy = proxies.get(v, context);
        if (proxy == null) {
          proxy = require(builder.addVertex(context, egi.vertex(v).label(), error), error);
          ElementId join = egi.lowestCommonAncestor(egi.vertex(v).context(), target);
          added.add(proxy);
          added.add(
              require(
                  builder.addEdge(join, EgiAlphabet.IDENTITY, ImmutableList.of(v, proxy), error),
                  error));
          proxies.put(v, context, proxy);
        }
        vertices.add(proxy);
      }
      added.add(require(builder.addEdge(context, edge.relation(), vertices, error), error));
    }
    return finish(EgiRule.ITERATION, builder, added.build(), ImmutableSet.of());
  }

  // Rule 4.

  /**
   * Removes the selection if an equivalent occurrence, disjoint from it, lies directly in the
   * selection's context or in a context enclosing it. If {@code source} is given, that occurrence
   * is used; otherwise the nearest one is searched for, innermost context first. Identity edges
   * joining removed vertices to vertices that stay are removed with them, provided each removed
   * vertex's counterpart in the occurrence is in the same ligature as the vertices it was joined to
   * and no remaining ligature falls apart as a result.
   *
   * <p>Fails with STRUCTURAL_MISMATCH if there is no equivalent occurrence, RESOURCE_EXHAUSTED if
   * the search takes too long, and INCOMPLETE_SELECTION if any other edge outside the selection is
   * attached to a removed vertex.
   */
  public @Nullable EgiTransformation deiterate(
      Egi egi, Set<ElementId> selection, @Nullable Set<ElementId> source, EgiError error) {
    EgiSubgraph subgraph = EgiSubgraph.of(egi, selection, error);
    if (subgraph == null) {
      return rejected(EgiRule.DEITERATION, error);
    }
    EgiSubgraph sourceGraph = null;
    if (source != null) {
      sourceGraph = EgiSubgraph.of(egi, source, error);
      if (sourceGraph == null) {
        return rejected(EgiRule.DEITERATION, error);
      }
      if (!egi.dominates(sourceGraph.container(), subgraph.container())) {
        return reject(
            EgiRule.DEITERATION,
            error,
            EgiError.Code.INVALID_NESTING,
            "Source context %s does not enclose %s",
            sourceGraph.container(),
            subgraph.container());
      }
      if (!Sets.intersection(sourceGraph.closure(), subgraph.closure()).isEmpty()) {
        return reject(
            EgiRule.DEITERATION,
            error,
            EgiError.Code.INVALID_ARGUMENT,
            "Source and selection overlap");
      }
    }

    EgiSubgraphMatcher matcher =
        new EgiSubgraphMatcher(egi, subgraph, options.maxMatchSteps());
    ImmutableMap<ElementId, ElementId> occurrence = null;
    if (sourceGraph != null) {
      occurrence = matcher.findOccurrence(sourceGraph.container(), sourceGraph.selection());
    } else {
      ElementId c = subgraph.container();
      while (c != null && occurrence == null && !matcher.exhausted()) {
        occurrence = matcher.findOccurrence(c, null);
        c = egi.context(c).parent();
      }
    }
    if (matcher.exhausted()) {
      return reject(
          EgiRule.DEITERATION,
          error,
          EgiError.Code.RESOURCE_EXHAUSTED,
          "Gave up looking for a copy of %s after %s steps",
          subgraph,
          matcher.steps());
    }
    if (occurrence == null) {
      return reject(
          EgiRule.DEITERATION,
          error,
          EgiError.Code.STRUCTURAL_MISMATCH,
          "No equivalent copy of %s in an enclosing context",
          subgraph);
    }

    Set<ElementId> removed = new LinkedHashSet<>(subgraph.closure());
    for (ElementId v : subgraph.vertices()) {
      for (ElementId e : egi.vertex(v).incidentEdges()) {
        if (subgraph.contains(e)) {
          continue;
        }
        EgiEdge edge = egi.edge(e);
        if (!edge.isIdentity()) {
          return reject(
              EgiRule.DEITERATION,
              error,
              EgiError.Code.INCOMPLETE_SELECTION,
              "Edge %s is attached to a removed vertex but is not selected",
              edge);
        }
        removed.add(e);
      }
    }
    Egi.Builder builder = egi.toBuilder();
    removeSelection(builder, subgraph);
    Egi result = builder.buildUnchecked();
    ElementId split = findSplitLigature(egi, result);
    if (split != null) {
      return reject(
          EgiRule.DEITERATION,
          error,
          EgiError.Code.STRUCTURAL_MISMATCH,
          "Removing %s would split the ligature of %s",
          subgraph,
          split);
    }
    for (ElementId v : subgraph.vertices()) {
      for (ElementId e : egi.vertex(v).incidentEdges()) {
        if (subgraph.contains(e)) {
          continue;
        }
        for (ElementId u : egi.edge(e).vertices()) {
          ElementId image = subgraph.contains(u) ? occurrence.get(u) : u;
          if (!result.areConnected(occurrence.get(v), image)) {
            return reject(
                EgiRule.DEITERATION,
                error,
                EgiError.Code.STRUCTURAL_MISMATCH,
                "Removing %s would lose its identity with %s",
                v,
                u);
          }
        }
      }
    }
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("De-iterating " + subgraph + " against " + occurrence);
    }
    return complete(EgiRule.DEITERATION, result, ImmutableSet.of(), ImmutableSet.copyOf(removed));
  }

  /**
   * Returns a vertex of {@code after} that was connected to another surviving vertex in {@code
   * before} but no longer is, or null if every ligature survives intact.
   */
  private static @Nullable ElementId findSplitLigature(Egi before, Egi after) {
    EgiLigatures old = before.ligatures();
    EgiLigatures now = after.ligatures();
    for (EgiLigatures.Ligature ligature : old.ligatures()) {
      ElementId first = null;
      for (ElementId v : Ordering.natural().sortedCopy(ligature.vertices())) {
        if (!after.vertices().containsKey(v)) {
          continue;
        }
        if (first == null) {
          first = v;
        } else if (!now.areConnected(first, v)) {
          return v;
        }
      }
    }
    return null;
  }

  // Rule 5.

  /**
   * Adds two nested cuts to the context and moves the selection, which must lie directly in the
   * context, into the inner one. The selection may be empty. Fails with INVALID_NESTING if a
   * selected edge is attached to a vertex that would stay outside the double cut.
   */
  public @Nullable EgiTransformation addDoubleCut(
      Egi egi, ElementId context, Set<ElementId> selection, EgiError error) {
    if (egi.context(context) == null) {
      return reject(
          EgiRule.DOUBLE_CUT_ADDITION, error, EgiError.Code.NOT_FOUND, "No context %s", context);
    }
    if (!selection.isEmpty()) {
      EgiSubgraph subgraph = EgiSubgraph.of(egi, selection, error);
      if (subgraph == null) {
        return rejected(EgiRule.DOUBLE_CUT_ADDITION, error);
      }
      if (!subgraph.container().equals(context)) {
        return reject(
            EgiRule.DOUBLE_CUT_ADDITION,
            error,
            EgiError.Code.INVALID_NESTING,
            "Selection lies in %s, not %s",
            subgraph.container(),
            context);
      }
      EgiEdge reaching = subgraph.findEdgeReachingOutside(egi);
      if (reaching != null) {
        return reject(
            EgiRule.DOUBLE_CUT_ADDITION,
            error,
            EgiError.Code.INVALID_NESTING,
            "Edge %s would end up inside the double cut while one of its vertices stays outside",
            reaching);
      }
    }
    Egi.Builder builder = egi.toBuilder();
    ElementId outer = require(builder.addCut(context, error), error);
    ElementId inner = require(builder.addCut(outer, error), error);
    for (ElementId id : Ordering.natural().sortedCopy(selection)) {
      builder.moveElement(id, inner);
    }
    return finish(
        EgiRule.DOUBLE_CUT_ADDITION, builder, ImmutableSet.of(outer, inner), ImmutableSet.of());
  }

  // Rule 6.

  /**
   * Removes a cut whose only element is another cut, moving the inner cut's contents to the outer
   * cut's context. Fails with INVALID_NESTING if the outer cut encloses anything else.
   */
  public @Nullable EgiTransformation removeDoubleCut(
      Egi egi, ElementId outerCut, EgiError error) {
    EgiContext outer = egi.context(outerCut);
    if (outer == null || outer.isSheet()) {
      return reject(
          EgiRule.DOUBLE_CUT_REMOVAL, error, EgiError.Code.NOT_FOUND, "No cut %s", outerCut);
    }
    if (outer.enclosed().size() != 1 || outer.children().size() != 1) {
      return reject(
          EgiRule.DOUBLE_CUT_REMOVAL,
          error,
          EgiError.Code.INVALID_NESTING,
          "Cut %s must enclose exactly one cut and nothing else",
          outerCut);
    }
    EgiContext inner = egi.context(outer.children().iterator().next());
    Egi.Builder builder = egi.toBuilder();
    for (ElementId id : Ordering.natural().sortedCopy(inner.enclosed())) {
      builder.moveElement(id, outer.parent());
    }
    builder.removeCut(inner.id(), error);
    builder.removeCut(outerCut, error);
    return finish(
        EgiRule.DOUBLE_CUT_REMOVAL,
        builder,
        ImmutableSet.of(),
        ImmutableSet.of(outerCut, inner.id()));
  }

  // Rule 7.

  /** Adds an isolated vertex, a constant if a label is given, to any context. */
  public @Nullable EgiTransformation addIsolatedVertex(
      Egi egi, ElementId context, @Nullable String constantLabel, EgiError error) {
    if (egi.context(context) == null) {
      return reject(
          EgiRule.ISOLATED_VERTEX_ADDITION,
          error,
          EgiError.Code.NOT_FOUND,
          "No context %s",
          context);
    }
    Egi.Builder builder = egi.toBuilder();
    ElementId vertex = builder.addVertex(context, constantLabel, error);
    if (vertex == null) {
      return rejected(EgiRule.ISOLATED_VERTEX_ADDITION, error);
    }
    return finish(
        EgiRule.ISOLATED_VERTEX_ADDITION, builder, ImmutableSet.of(vertex), ImmutableSet.of());
  }

  // Rule 8.

  /** Removes a vertex with no incident edges. Fails with NOT_ISOLATED otherwise. */
  public @Nullable EgiTransformation removeIsolatedVertex(
      Egi egi, ElementId vertex, EgiError error) {
    EgiVertex v = egi.vertex(vertex);
    if (v == null) {
      return reject(
          EgiRule.ISOLATED_VERTEX_REMOVAL, error, EgiError.Code.NOT_FOUND, "No vertex %s", vertex);
    }
    if (!v.isIsolated()) {
      return reject(
          EgiRule.ISOLATED_VERTEX_REMOVAL,
          error,
          EgiError.Code.NOT_ISOLATED,
          "Vertex %s has %s incident edges",
          vertex,
          v.incidentEdges().size());
    }
    Egi.Builder builder = egi.toBuilder();
    builder.removeVertex(vertex, error);
    return finish(
        EgiRule.ISOLATED_VERTEX_REMOVAL, builder, ImmutableSet.of(), ImmutableSet.of(vertex));
  }

  /** Removes the selected elements; cuts take their contents with them. */
  private static void removeSelection(Egi.Builder builder, EgiSubgraph subgraph) {
    EgiError error = new EgiError();
    List<ElementId> vertices = new ArrayList<>();
    for (ElementId id : Ordering.natural().sortedCopy(subgraph.selection())) {
      if (id.isVertex()) {
        vertices.add(id);
      } else {
        builder.removeElement(id, error);
      }
    }
    for (ElementId v : vertices) {
      builder.removeVertex(v, error);
    }
  }

  private static <T> List<T> sorted(Map<ElementId, T> elements) {
    List<T> result = new ArrayList<>();
    for (ElementId id : Ordering.natural().sortedCopy(elements.keySet())) {
      result.add(elements.get(id));
    }
    return result;
  }

  /** Returns the id, or throws MALFORMED_RESULT if an edit the engine relies on failed. */
  private static ElementId require(@Nullable ElementId id, EgiError error) {
    if (id == null) {
      throw malformed("Internal edit failed: %s", error);
    }
    return id;
  }

  private static EgiException malformed(String format, Object... args) {
    EgiError error = new EgiError();
    error.init(EgiError.Code.MALFORMED_RESULT, format, args);
    logger.severe(error.toString());
    return new EgiException(error);
  }

  private @Nullable EgiTransformation finish(
      EgiRule rule,
      Egi.Builder builder,
      ImmutableSet<ElementId> added,
      ImmutableSet<ElementId> removed) {
    return complete(rule, builder.buildUnchecked(), added, removed);
  }

  private EgiTransformation complete(
      EgiRule rule, Egi result, ImmutableSet<ElementId> added, ImmutableSet<ElementId> removed) {
    if (options.validateResults()) {
      EgiError error = new EgiError();
      if (result.findValidationError(error)) {
        throw malformed("%s produced an invalid EGI: %s", rule, error);
      }
    }
    if (logger.isLoggable(Level.FINER)) {
      logger.finer(rule + " applied: +" + added + " -" + removed);
    }
    return new EgiTransformation(rule, result, added, removed);
  }

  private static @Nullable EgiTransformation reject(
      EgiRule rule, EgiError error, EgiError.Code code, String format, Object... args) {
    error.init(code, format, args);
    return rejected(rule, error);
  }

  private static @Nullable EgiTransformation rejected(EgiRule rule, EgiError error) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(rule + " refused: " + error);
    }
    return null;
  }
}
