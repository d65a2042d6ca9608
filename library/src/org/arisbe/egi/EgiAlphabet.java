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
import com.google.common.collect.ImmutableSortedMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * The relation alphabet: an immutable map from relation names to fixed arities. Every alphabet
 * contains the identity relation {@code "=" -> 2}, and an edge may only be created for a (name,
 * arity) pair that is registered.
 *
 * <p>A name has exactly one arity. Registering it again with the same arity is a no-op; with a
 * different arity it is an error.
 */
@Immutable
public final class EgiAlphabet {
  /** The name of the identity relation. */
  public static final String IDENTITY = "=";

  /** The arity of the identity relation. */
  public static final int IDENTITY_ARITY = 2;

  private static final EgiAlphabet DEFAULT =
      new EgiAlphabet(ImmutableSortedMap.of(IDENTITY, IDENTITY_ARITY));

  private final ImmutableSortedMap<String, Integer> arities;

  private EgiAlphabet(ImmutableSortedMap<String, Integer> arities) {
    this.arities = arities;
  }

  /** Returns the alphabet holding only the identity relation. */
  public static EgiAlphabet identityOnly() {
    return DEFAULT;
  }

  /** Returns a new Builder, pre-populated with the identity relation. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns true if the relation is registered with exactly this arity. */
  public boolean contains(String name, int arity) {
    Integer registered = arities.get(name);
    return registered != null && registered == arity;
  }

  /** Returns true if the relation name is registered with any arity. */
  public boolean contains(String name) {
    return arities.containsKey(name);
  }

  /** Returns the registered arity of the relation, or null if it isn't registered. */
  public @Nullable Integer arity(String name) {
    return arities.get(name);
  }

  /** Returns every registered relation, sorted by name. */
  public ImmutableSortedMap<String, Integer> relations() {
    return arities;
  }

  /**
   * Returns an alphabet extended with the given relation, or null if the name is already
   * registered with a different arity, in which case the error is set to RELATION_ARITY_CONFLICT.
   */
  public @Nullable EgiAlphabet withRelation(String name, int arity, EgiError error) {
    checkRelation(name, arity);
    Integer registered = arities.get(name);
    if (registered != null) {
      if (registered != arity) {
        error.init(
            EgiError.Code.RELATION_ARITY_CONFLICT,
            "Relation '%s' is registered with arity %d, not %d",
            name,
            registered,
            arity);
        return null;
      }
      return this;
    }
    Map<String, Integer> extended = new TreeMap<>(arities);
    extended.put(name, arity);
    return new EgiAlphabet(ImmutableSortedMap.copyOf(extended));
  }

  /** As {@link #withRelation(String, int, EgiError)}, but throws EgiException on conflict. */
  public EgiAlphabet withRelationUnsafe(String name, int arity) {
    EgiError error = new EgiError();
    EgiAlphabet result = withRelation(name, arity, error);
    if (result == null) {
      throw new EgiException(error);
    }
    return result;
  }

  private static void checkRelation(String name, int arity) {
    Preconditions.checkNotNull(name);
    Preconditions.checkArgument(!name.isEmpty(), "Empty relation name");
    Preconditions.checkArgument(arity >= 0, "Negative arity %s for '%s'", arity, name);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof EgiAlphabet && arities.equals(((EgiAlphabet) other).arities);
  }

  @Override
  public int hashCode() {
    return arities.hashCode();
  }

  @Override
  public String toString() {
    return arities.toString();
  }

  /** Accumulates relations for a new alphabet. */
  public static final class Builder {
    private final Map<String, Integer> arities = new TreeMap<>();

    private Builder() {
      arities.put(IDENTITY, IDENTITY_ARITY);
    }

    /**
     * Registers a relation.
     *
     * @throws IllegalArgumentException if the name is already registered with another arity
     */
    @CanIgnoreReturnValue
    public Builder add(String name, int arity) {
      checkRelation(name, arity);
      Integer registered = arities.putIfAbsent(name, arity);
      Preconditions.checkArgument(
          registered == null || registered == arity,
          "Relation '%s' is registered with arity %s, not %s",
          name,
          registered,
          arity);
      return this;
    }

    public EgiAlphabet build() {
      return new EgiAlphabet(ImmutableSortedMap.copyOf(arities));
    }
  }
}
