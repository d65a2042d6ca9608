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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.jspecify.annotations.Nullable;
import org.junit.Before;

/** Common code for EGI tests. */
public class EgiTestCase {
  /** Seed for the random number generator, fixed so failures can be reproduced. */
  public static final long SEED = 20260101L;

  /** Unary and binary relations used by most tests. */
  public static final EgiAlphabet ALPHABET =
      EgiAlphabet.builder()
          .add("Human", 1)
          .add("Mortal", 1)
          .add("P", 1)
          .add("Q", 1)
          .add("Loves", 2)
          .add("Between", 3)
          .build();

  private Random rand;

  @Before
  public final void setUp() {
    rand = new Random(SEED);
  }

  protected Random rand() {
    return rand;
  }

  /** Returns a new builder over {@link #ALPHABET}. */
  protected static Egi.Builder builder() {
    return new Egi.Builder(ALPHABET);
  }

  /** Asserts that the EGI passes every validation check, reporting the first failure if not. */
  public static void assertWellFormed(Egi egi) {
    EgiError error = new EgiError();
    assertFalse(error + " in " + egi, egi.findValidationError(error));
    assertEquals(EgiError.Code.NO_ERROR, error.code());
  }

  /** Asserts that the result is null and the error holds the expected code. */
  public static void assertFails(EgiError.Code expected, @Nullable Object result, EgiError error) {
    assertNull("Expected " + expected + " but got " + result, result);
    assertEquals(error.toString(), expected, error.code());
  }

  /** Asserts that the transformation succeeded and its result is well-formed. */
  public static Egi assertApplied(@Nullable EgiTransformation result, EgiError error) {
    assertNotNull(error.toString(), result);
    assertWellFormed(result.result());
    return result.result();
  }

  /** Returns the single element of the given kind in the EGI's context. */
  public static ElementId only(Egi egi, ElementId context, ElementId.Kind kind) {
    List<ElementId> ids = new ArrayList<>();
    for (ElementId id : egi.context(context).enclosed()) {
      if (id.kind() == kind) {
        ids.add(id);
      }
    }
    return Iterables.getOnlyElement(ids);
  }

  /**
   * Returns "Socrates is human, and it is not the case that some human is not mortal", with the
   * second part written over its own vertices:
   *
   * <pre>
   * sheet0 v1"Socrates" Human(v1) ~c3[ v4 Human(v4) ~c6[ v7 Mortal(v7) ] ]
   * </pre>
   */
  protected static Egi socrates() {
    Egi.Builder b = builder();
    ElementId socrates = b.addVertexUnsafe(b.sheet(), "Socrates");
    b.addEdgeUnsafe(b.sheet(), "Human", ImmutableList.of(socrates));
    ElementId outer = b.addCutUnsafe(b.sheet());
    ElementId w = b.addVertexUnsafe(outer, null);
    b.addEdgeUnsafe(outer, "Human", ImmutableList.of(w));
    ElementId inner = b.addCutUnsafe(outer);
    ElementId u = b.addVertexUnsafe(inner, null);
    b.addEdgeUnsafe(inner, "Mortal", ImmutableList.of(u));
    return b.buildUnsafe();
  }

  /**
   * Returns a random well-formed EGI built with the given number of primitive additions. Roughly
   * half of the additions are vertices, the rest cuts and edges; edges are placed in a context
   * dominating all of their vertices.
   */
  protected Egi randomEgi(int additions) {
    Egi.Builder b = builder();
    List<ElementId> contexts = new ArrayList<>();
    List<ElementId> vertices = new ArrayList<>();
    contexts.add(b.sheet());
    for (int i = 0; i < additions; i++) {
      int choice = rand.nextInt(10);
      if (choice < 2) {
        contexts.add(b.addCutUnsafe(contexts.get(rand.nextInt(contexts.size()))));
      } else if (choice < 6 || vertices.isEmpty()) {
        String label = rand.nextInt(4) == 0 ? "c" + rand.nextInt(3) : null;
        vertices.add(b.addVertexUnsafe(contexts.get(rand.nextInt(contexts.size())), label));
      } else {
        ElementId v1 = vertices.get(rand.nextInt(vertices.size()));
        ElementId v2 = vertices.get(rand.nextInt(vertices.size()));
        ElementId c1 = b.vertexContext(v1);
        ElementId c2 = b.vertexContext(v2);
        ElementId both =
            b.dominates(c1, c2) ? c1 : b.dominates(c2, c1) ? c2 : b.sheet();
        switch (rand.nextInt(3)) {
          case 0:
            b.addEdgeUnsafe(c1, rand.nextBoolean() ? "P" : "Q", ImmutableList.of(v1));
            break;
          case 1:
            b.addEdgeUnsafe(both, "Loves", ImmutableList.of(v1, v2));
            break;
          default:
            b.addEdgeUnsafe(both, "=", ImmutableList.of(v1, v2));
            break;
        }
      }
    }
    return b.buildUnsafe();
  }
}
