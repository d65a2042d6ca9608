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
 * A node of the context tree: either the sheet of assertion (the root, depth 0) or a cut. The
 * enclosed set holds the ids of every vertex, edge and cut directly inside this context; the
 * children are the cuts among them.
 *
 * <p>A context is positive when its depth is even and negative when it is odd.
 */
@Immutable
public final class EgiContext {
  private final ElementId id;
  private final @Nullable ElementId parent;
  private final int depth;
  private final ImmutableSet<ElementId> enclosed;
  private final ImmutableSet<ElementId> children;

  EgiContext(
      ElementId id,
      @Nullable ElementId parent,
      int depth,
      ImmutableSet<ElementId> enclosed,
      ImmutableSet<ElementId> children) {
    Preconditions.checkArgument(id.isContext(), "%s is not a context id", id);
    Preconditions.checkArgument(
        (parent == null) == id.isSheet(), "Only the sheet has no parent: %s", id);
    Preconditions.checkArgument(depth >= 0, "Negative depth %s", depth);
    this.id = id;
    this.parent = parent;
    this.depth = depth;
    this.enclosed = enclosed;
    this.children = children;
  }

  public ElementId id() {
    return id;
  }

  /** Returns the enclosing context, or null for the sheet. */
  public @Nullable ElementId parent() {
    return parent;
  }

  /** Returns the number of cuts enclosing this context. The sheet has depth 0. */
  public int depth() {
    return depth;
  }

  public boolean isSheet() {
    return id.isSheet();
  }

  /** Returns true if the depth is even. */
  public boolean isPositive() {
    return depth % 2 == 0;
  }

  /** Returns true if the depth is odd. */
  public boolean isNegative() {
    return !isPositive();
  }

  /** Returns the ids of the vertices, edges and cuts directly in this context (Dau's area). */
  public ImmutableSet<ElementId> enclosed() {
    return enclosed;
  }

  /** Returns the ids of the cuts directly in this context. */
  public ImmutableSet<ElementId> children() {
    return children;
  }

  /** Returns true if nothing at all is enclosed. */
  public boolean isEmpty() {
    return enclosed.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof EgiContext)) {
      return false;
    }
    EgiContext that = (EgiContext) other;
    return id.equals(that.id)
        && Objects.equals(parent, that.parent)
        && depth == that.depth
        && enclosed.equals(that.enclosed)
        && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, parent, depth, enclosed, children);
  }

  @Override
  public String toString() {
    return id + "(depth " + depth + ", " + (isPositive() ? "positive" : "negative") + ")";
  }
}
