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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * A proof: a starting EGI followed by the rule applications that transform it, one after the
 * other. Derivations are immutable; {@link #apply} returns a longer derivation and leaves this one
 * as it was, so a derivation can be branched by applying different rules to the same prefix.
 */
@CheckReturnValue
public final class EgiDerivation {
  /** One step of a derivation: the request and what it produced. */
  public static final class Step {
    private final EgiRuleApplication application;
    private final EgiTransformation transformation;

    Step(EgiRuleApplication application, EgiTransformation transformation) {
      this.application = application;
      this.transformation = transformation;
    }

    public EgiRuleApplication application() {
      return application;
    }

    public EgiTransformation transformation() {
      return transformation;
    }

    @Override
    public String toString() {
      return transformation.toString();
    }
  }

  private final Egi start;
  private final ImmutableList<Step> steps;

  private EgiDerivation(Egi start, ImmutableList<Step> steps) {
    this.start = start;
    this.steps = steps;
  }

  /** Returns a derivation with no steps, starting from the given EGI. */
  public static EgiDerivation startingFrom(Egi start) {
    return new EgiDerivation(Preconditions.checkNotNull(start), ImmutableList.of());
  }

  public Egi start() {
    return start;
  }

  public ImmutableList<Step> steps() {
    return steps;
  }

  /** Returns the number of steps. */
  public int size() {
    return steps.size();
  }

  /** Returns the EGI reached after the last step, or the start if there are no steps. */
  public Egi current() {
    return steps.isEmpty() ? start : steps.get(steps.size() - 1).transformation().result();
  }

  /** Returns the EGI reached after {@code i} steps; {@code egiAt(0)} is the start. */
  public Egi egiAt(int i) {
    Preconditions.checkElementIndex(i, steps.size() + 1);
    return i == 0 ? start : steps.get(i - 1).transformation().result();
  }

  /**
   * Applies the rule to the current EGI and returns the extended derivation, or null if the rule
   * does not apply, in which case the error says why and is prefixed with the step number.
   */
  public @Nullable EgiDerivation apply(
      EgiRuleEngine engine, EgiRuleApplication application, EgiError error) {
    EgiTransformation transformation = engine.apply(current(), application, error);
    if (transformation == null) {
      error.init(error.code(), "Step %s: %s", steps.size() + 1, error.text());
      return null;
    }
    return new EgiDerivation(
        start,
        ImmutableList.<Step>builder()
            .addAll(steps)
            .add(new Step(application, transformation))
            .build());
  }

  /** As {@link #apply(EgiRuleEngine, EgiRuleApplication, EgiError)}, but throws on failure. */
  public EgiDerivation applyUnsafe(EgiRuleEngine engine, EgiRuleApplication application) {
    EgiError error = new EgiError();
    EgiDerivation result = apply(engine, application, error);
    if (result == null) {
      throw new EgiException(error);
    }
    return result;
  }

  @Override
  public String toString() {
    return "Derivation from " + start + " " + steps;
  }
}
