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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A request to apply one transformation rule: the rule plus whatever it needs, a selection of
 * elements, a target context, an insertion payload or a constant label. Requests are immutable
 * and independent of any particular EGI, so one request may be tried against many EGIs. Create
 * them with the static factory for each rule.
 */
public final class EgiRuleApplication {
  private final EgiRule rule;
  private final ImmutableSet<ElementId> selection;
  private final @Nullable ElementId target;
  private final @Nullable Egi fragment;
  private final ImmutableMap<ElementId, ElementId> bindings;
  private final @Nullable String label;
  private final @Nullable ImmutableSet<ElementId> source;

  private EgiRuleApplication(
      EgiRule rule,
      Set<ElementId> selection,
      @Nullable ElementId target,
      @Nullable Egi fragment,
      Map<ElementId, ElementId> bindings,
      @Nullable String label,
      @Nullable Set<ElementId> source) {
    this.rule = rule;
    this.selection = ImmutableSet.copyOf(selection);
    this.target = target;
    this.fragment = fragment;
    this.bindings = ImmutableMap.copyOf(bindings);
    this.label = label;
    this.source = source == null ? null : ImmutableSet.copyOf(source);
  }

  /** Rule 1: erase the selected elements (and everything inside selected cuts). */
  public static EgiRuleApplication erasure(Set<ElementId> selection) {
    return new EgiRuleApplication(
        EgiRule.ERASURE, selection, null, null, ImmutableMap.of(), null, null);
  }

  /** Rule 2: copy the fragment's sheet contents into the given negative context. */
  public static EgiRuleApplication insertion(ElementId context, Egi fragment) {
    return insertion(context, fragment, ImmutableMap.of());
  }

  /**
   * Rule 2: copy the fragment's sheet contents into the given negative context. Each fragment
   * vertex that is a key of the bindings map is not copied; the existing host vertex it maps to is
   * used instead.
   */
  public static EgiRuleApplication insertion(
      ElementId context, Egi fragment, Map<ElementId, ElementId> bindings) {
    Preconditions.checkNotNull(context);
    Preconditions.checkNotNull(fragment);
    return new EgiRuleApplication(
        EgiRule.INSERTION, ImmutableSet.of(), context, fragment, bindings, null, null);
  }

  /** Rule 3: copy the selection into the target context. */
  public static EgiRuleApplication iteration(Set<ElementId> selection, ElementId target) {
    Preconditions.checkNotNull(target);
    return new EgiRuleApplication(
        EgiRule.ITERATION, selection, target, null, ImmutableMap.of(), null, null);
  }

  /** Rule 4: remove the selection if an equivalent occurrence exists in an enclosing position. */
  public static EgiRuleApplication deiteration(Set<ElementId> selection) {
    return new EgiRuleApplication(
        EgiRule.DEITERATION, selection, null, null, ImmutableMap.of(), null, null);
  }

  /** Rule 4: remove the selection, which must be equivalent to the given source occurrence. */
  public static EgiRuleApplication deiteration(Set<ElementId> selection, Set<ElementId> source) {
    Preconditions.checkNotNull(source);
    return new EgiRuleApplication(
        EgiRule.DEITERATION, selection, null, null, ImmutableMap.of(), null, source);
  }

  /** Rule 5: wrap the selection, all directly in the given context, in a double cut. */
  public static EgiRuleApplication doubleCutAddition(ElementId context, Set<ElementId> selection) {
    Preconditions.checkNotNull(context);
    return new EgiRuleApplication(
        EgiRule.DOUBLE_CUT_ADDITION, selection, context, null, ImmutableMap.of(), null, null);
  }

  /** Rule 6: remove the double cut whose outer cut is given. */
  public static EgiRuleApplication doubleCutRemoval(ElementId outerCut) {
    Preconditions.checkNotNull(outerCut);
    return new EgiRuleApplication(
        EgiRule.DOUBLE_CUT_REMOVAL,
        ImmutableSet.of(),
        outerCut,
        null,
        ImmutableMap.of(),
        null,
        null);
  }

  /** Rule 7: add a generic isolated vertex to the context. */
  public static EgiRuleApplication isolatedVertexAddition(ElementId context) {
    return isolatedVertexAddition(context, null);
  }

  /** Rule 7: add an isolated vertex, a constant if a label is given, to the context. */
  public static EgiRuleApplication isolatedVertexAddition(
      ElementId context, @Nullable String constantLabel) {
    Preconditions.checkNotNull(context);
    return new EgiRuleApplication(
        EgiRule.ISOLATED_VERTEX_ADDITION,
        ImmutableSet.of(),
        context,
        null,
        ImmutableMap.of(),
        constantLabel,
        null);
  }

  /** Rule 8: remove the given isolated vertex. */
  public static EgiRuleApplication isolatedVertexRemoval(ElementId vertex) {
    Preconditions.checkNotNull(vertex);
    return new EgiRuleApplication(
        EgiRule.ISOLATED_VERTEX_REMOVAL,
        ImmutableSet.of(vertex),
        null,
        null,
        ImmutableMap.of(),
        null,
        null);
  }

  public EgiRule rule() {
    return rule;
  }

  /** Returns the selected elements; empty for rules that take none. */
  public ImmutableSet<ElementId> selection() {
    return selection;
  }

  /**
   * Returns the target context (insertion, iteration, double-cut addition, isolated-vertex
   * addition) or outer cut (double-cut removal); null for the other rules.
   */
  public @Nullable ElementId target() {
    return target;
  }

  /** Returns the insertion payload, or null. */
  public @Nullable Egi fragment() {
    return fragment;
  }

  /** Returns the insertion bindings from fragment vertices to host vertices. */
  public ImmutableMap<ElementId, ElementId> bindings() {
    return bindings;
  }

  /** Returns the constant label for isolated-vertex addition, or null. */
  public @Nullable String label() {
    return label;
  }

  /** Returns the explicit de-iteration source occurrence, or null to search for one. */
  public @Nullable ImmutableSet<ElementId> source() {
    return source;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof EgiRuleApplication)) {
      return false;
    }
    EgiRuleApplication that = (EgiRuleApplication) other;
    return rule == that.rule
        && selection.equals(that.selection)
        && Objects.equals(target, that.target)
        && Objects.equals(fragment, that.fragment)
        && bindings.equals(that.bindings)
        && Objects.equals(label, that.label)
        && Objects.equals(source, that.source);
  }

  @Override
  public int hashCode() {
    return Objects.hash(rule, selection, target, fragment, bindings, label, source);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("rule", rule)
        .add("selection", selection.isEmpty() ? null : selection)
        .add("target", target)
        .add("fragment", fragment)
        .add("bindings", bindings.isEmpty() ? null : bindings)
        .add("label", label)
        .add("source", source)
        .toString();
  }
}
