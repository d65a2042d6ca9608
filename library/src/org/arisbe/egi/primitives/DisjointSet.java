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
package org.arisbe.egi.primitives;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A disjoint set (union-find) over arbitrary elements. Used to partition EGI vertices into
 * ligatures, the connected components of the identity-edge relation.
 *
 * <p>Both path compression and union-by-size are applied, so union() and findRoot() have
 * O(a(N)) amortized cost, where a(N) is the inverse Ackermann function. Root finding is iterative,
 * so long chains built before compression kicks in cannot overflow the stack.
 *
 * <p>The partition does not depend on the order of union() calls; only the choice of root element
 * does. Callers that need an order-independent name for a set should derive it from the members
 * of {@link #groups()}.
 */
public class DisjointSet<T> {
  /** Map from elements to their indices in the parallel arrays below. */
  private final Map<T, Integer> elementIndices;
  /** The inverse of elementIndices. */
  private final ArrayList<T> elements;
  /** Index of the parent of each element. Roots are their own parent. */
  private int[] parents;
  /** For roots, the number of elements in the set. Meaningless for non-roots. */
  private int[] sizes;

  /** Creates a new disjoint set with default capacity. */
  public DisjointSet() {
    this(16);
  }

  /** Creates a new disjoint set with an initial capacity. */
  public DisjointSet(int capacity) {
    Preconditions.checkArgument(capacity >= 0, "Negative capacity %s", capacity);
    elementIndices = new HashMap<>((int) Math.ceil(capacity / 0.75));
    elements = new ArrayList<>(capacity);
    parents = new int[Math.max(capacity, 1)];
    sizes = new int[Math.max(capacity, 1)];
  }

  /**
   * Adds a new singleton element. Returns false, leaving the set unchanged, if the element was
   * already present.
   */
  @CanIgnoreReturnValue
  public boolean add(T val) {
    Preconditions.checkNotNull(val);
    if (elementIndices.containsKey(val)) {
      return false;
    }
    int index = elements.size();
    if (index == parents.length) {
      parents = Arrays.copyOf(parents, 2 * index);
      sizes = Arrays.copyOf(sizes, 2 * index);
    }
    elements.add(val);
    elementIndices.put(val, index);
    parents[index] = index;
    sizes[index] = 1;
    return true;
  }

  /** Returns true if the element has been added. */
  public boolean contains(T val) {
    return elementIndices.containsKey(val);
  }

  /** Returns the root of the set holding the given element, or null if it isn't present. */
  public @Nullable T findRoot(T val) {
    Integer index = elementIndices.get(val);
    if (index == null) {
      return null;
    }
    return elements.get(findRootIndex(index));
  }

  /** Follows parent links to the root, then points every visited element directly at it. */
  private int findRootIndex(int index) {
    int root = index;
    while (parents[root] != root) {
      root = parents[root];
    }
    // Path compression.
    while (parents[index] != root) {
      int next = parents[index];
      parents[index] = root;
      index = next;
    }
    return root;
  }

  /**
   * Merges the sets holding a and b, attaching the smaller set below the larger. Returns false and
   * does nothing if either element is missing; returns true otherwise, including when a and b are
   * already in the same set.
   */
  @CanIgnoreReturnValue
  public boolean union(T a, T b) {
    Integer aIndex = elementIndices.get(a);
    Integer bIndex = elementIndices.get(b);
    if (aIndex == null || bIndex == null) {
      return false;
    }
    int aRoot = findRootIndex(aIndex);
    int bRoot = findRootIndex(bIndex);
    if (aRoot == bRoot) {
      return true;
    }
    if (sizes[aRoot] < sizes[bRoot]) {
      parents[aRoot] = bRoot;
      sizes[bRoot] += sizes[aRoot];
    } else {
      parents[bRoot] = aRoot;
      sizes[aRoot] += sizes[bRoot];
    }
    return true;
  }

  /** Returns true if both elements are present and belong to the same set. */
  public boolean sameSet(T a, T b) {
    Integer aIndex = elementIndices.get(a);
    Integer bIndex = elementIndices.get(b);
    return aIndex != null && bIndex != null && findRootIndex(aIndex) == findRootIndex(bIndex);
  }

  /** Returns the number of elements in the set holding val, or 0 if val isn't present. */
  public int setSize(T val) {
    Integer index = elementIndices.get(val);
    return index == null ? 0 : sizes[findRootIndex(index)];
  }

  /**
   * Returns the partition as a map from each root to the members of its set, in the order the
   * members were added.
   */
  public Map<T, List<T>> groups() {
    Map<T, List<T>> groups = new LinkedHashMap<>();
    for (int i = 0; i < elements.size(); i++) {
      T root = elements.get(findRootIndex(i));
      groups.computeIfAbsent(root, unused -> new ArrayList<>()).add(elements.get(i));
    }
    return groups;
  }

  /** Returns the total number of elements. */
  public int size() {
    return elements.size();
  }

  /** Removes all elements. */
  public void clear() {
    elementIndices.clear();
    elements.clear();
  }
}
