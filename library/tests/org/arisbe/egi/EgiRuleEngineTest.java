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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link EgiRuleEngine}, rule by rule. */
@RunWith(JUnit4.class)
public class EgiRuleEngineTest extends EgiTestCase {
  private final EgiRuleEngine engine = new EgiRuleEngine();
  private final EgiError error = new EgiError();

  /** The {@link #socrates()} fixture and its elements. */
  private Egi egi;

  private ElementId sheet;
  private ElementId socrates;
  private ElementId socratesIsHuman;
  private ElementId outer;
  private ElementId w;
  private ElementId wIsHuman;
  private ElementId inner;
  private ElementId u;
  private ElementId uIsMortal;

  @Before
  public void setUpSocrates() {
    egi = socrates();
    sheet = egi.sheet();
    socrates = only(egi, sheet, ElementId.Kind.VERTEX);
    socratesIsHuman = only(egi, sheet, ElementId.Kind.EDGE);
    outer = only(egi, sheet, ElementId.Kind.CUT);
    w = only(egi, outer, ElementId.Kind.VERTEX);
    wIsHuman = only(egi, outer, ElementId.Kind.EDGE);
    inner = only(egi, outer, ElementId.Kind.CUT);
    u = only(egi, inner, ElementId.Kind.VERTEX);
    uIsMortal = only(egi, inner, ElementId.Kind.EDGE);
  }

  // Erasure.

  @Test
  public void testErasurePolarityGate() {
    Egi.Builder b = builder();
    ElementId cut1 = b.addCutUnsafe(b.sheet());
    ElementId cut2 = b.addCutUnsafe(cut1);
    ElementId v1 = b.addVertexUnsafe(cut1, null);
    ElementId e1 = b.addEdgeUnsafe(cut1, "Human", ImmutableList.of(v1));
    Egi negative = b.buildUnsafe();
    assertEquals(2, negative.context(cut2).depth());
    assertFails(
        EgiError.Code.WRONG_POLARITY, engine.erase(negative, ImmutableSet.of(e1), error), error);

    // The same edge placed on the sheet may be erased.
    b = builder();
    cut1 = b.addCutUnsafe(b.sheet());
    b.addCutUnsafe(cut1);
    v1 = b.addVertexUnsafe(cut1, null);
    e1 = b.addEdgeUnsafe(b.sheet(), "Human", ImmutableList.of(v1));
    Egi positive = b.buildUnsafe();
    EgiTransformation t = engine.erase(positive, ImmutableSet.of(e1), error);
    Egi result = assertApplied(t, error);
    assertFalse(result.edges().containsKey(e1));
    assertTrue(result.vertices().containsKey(v1));
    assertEquals(ImmutableSet.of(e1), t.removed());
    assertTrue(t.added().isEmpty());
    assertEquals(EgiRule.ERASURE, t.rule());
    // The input is untouched.
    assertTrue(positive.edges().containsKey(e1));
  }

  @Test
  public void testErasureOfCutRemovesItsContents() {
    EgiTransformation t = engine.erase(egi, ImmutableSet.of(outer), error);
    Egi result = assertApplied(t, error);
    assertEquals("sheet0 v1\"Socrates\" Human(v1)", result.toString());
    assertEquals(ImmutableSet.of(outer, w, wIsHuman, inner, u, uIsMortal), t.removed());
  }

  @Test
  public void testErasureInsidePositiveCut() {
    Egi result =
        assertApplied(engine.erase(egi, ImmutableSet.of(u, uIsMortal), error), error);
    assertTrue(result.context(inner).isEmpty());
    assertFails(
        EgiError.Code.WRONG_POLARITY,
        engine.erase(egi, ImmutableSet.of(wIsHuman), error),
        error);
  }

  @Test
  public void testErasureNeedsIncidentEdges() {
    assertFails(
        EgiError.Code.INCOMPLETE_SELECTION,
        engine.erase(egi, ImmutableSet.of(socrates), error),
        error);
    Egi result =
        assertApplied(engine.erase(egi, ImmutableSet.of(socrates, socratesIsHuman), error), error);
    assertFalse(result.contains(socrates));
  }

  @Test
  public void testBadSelections() {
    assertFails(EgiError.Code.INVALID_ARGUMENT, engine.erase(egi, ImmutableSet.of(), error), error);
    assertFails(
        EgiError.Code.INVALID_ARGUMENT, engine.erase(egi, ImmutableSet.of(sheet), error), error);
    assertFails(
        EgiError.Code.NOT_FOUND,
        engine.erase(egi, ImmutableSet.of(new ElementId(ElementId.Kind.EDGE, 77)), error),
        error);
    assertFails(
        EgiError.Code.INVALID_NESTING,
        engine.erase(egi, ImmutableSet.of(socratesIsHuman, wIsHuman), error),
        error);
  }

  // Insertion.

  /** Returns "something is P and it is not the case that something is Q". */
  private static Egi fragment() {
    Egi.Builder b = builder();
    ElementId x = b.addVertexUnsafe(b.sheet(), null);
    b.addEdgeUnsafe(b.sheet(), "P", ImmutableList.of(x));
    ElementId cut = b.addCutUnsafe(b.sheet());
    ElementId y = b.addVertexUnsafe(cut, null);
    b.addEdgeUnsafe(cut, "Q", ImmutableList.of(y));
    return b.buildUnsafe();
  }

  @Test
  public void testInsertion() {
    EgiTransformation t = engine.insert(egi, outer, fragment(), ImmutableMap.of(), error);
    Egi result = assertApplied(t, error);
    assertEquals(5, t.added().size());
    assertEquals(2, result.context(outer).children().size());
    assertEquals(egi.vertices().size() + 2, result.vertices().size());
    for (ElementId id : t.added()) {
      assertFalse(egi.contains(id));
      assertTrue(result.dominates(outer, result.contextOf(id)));
    }
  }

  @Test
  public void testInsertionPolarityGate() {
    assertFails(
        EgiError.Code.WRONG_POLARITY,
        engine.insert(egi, sheet, fragment(), ImmutableMap.of(), error),
        error);
    assertFails(
        EgiError.Code.WRONG_POLARITY,
        engine.insert(egi, inner, fragment(), ImmutableMap.of(), error),
        error);
    assertFails(
        EgiError.Code.NOT_FOUND,
        engine.insert(egi, u, fragment(), ImmutableMap.of(), error),
        error);
  }

  @Test
  public void testInsertionWithBindings() {
    Egi.Builder b = builder();
    ElementId x = b.addVertexUnsafe(b.sheet(), null);
    ElementId y = b.addVertexUnsafe(b.sheet(), null);
    b.addEdgeUnsafe(b.sheet(), "Loves", ImmutableList.of(x, y));
    Egi payload = b.buildUnsafe();

    // Binding x to a vertex of the target context attaches the new edge to it.
    EgiTransformation t = engine.insert(egi, outer, payload, ImmutableMap.of(x, w), error);
    Egi result = assertApplied(t, error);
    assertEquals(2, t.added().size());
    assertEquals(2, result.vertex(w).incidentEdges().size());

    // A vertex nested deeper than the target is visible from it.
    assertApplied(engine.insert(egi, outer, payload, ImmutableMap.of(x, u), error), error);

    // A vertex outside the target is not: the new edge would be deeper than its vertex.
    assertFails(
        EgiError.Code.DOMINATION_VIOLATION,
        engine.insert(egi, outer, payload, ImmutableMap.of(x, socrates), error),
        error);
    assertFails(
        EgiError.Code.INVALID_ARGUMENT,
        engine.insert(egi, outer, payload, ImmutableMap.of(payload.sheet(), w), error),
        error);
    assertFails(
        EgiError.Code.NOT_FOUND,
        engine.insert(
            egi,
            outer,
            payload,
            ImmutableMap.of(x, new ElementId(ElementId.Kind.VERTEX, 99)),
            error),
        error);
  }

  @Test
  public void testInsertionNeedsKnownRelations() {
    Egi.Builder b = new Egi.Builder(EgiAlphabet.builder().add("Dog", 1).build());
    ElementId d = b.addVertexUnsafe(b.sheet(), null);
    b.addEdgeUnsafe(b.sheet(), "Dog", ImmutableList.of(d));
    assertFails(
        EgiError.Code.UNREGISTERED_RELATION,
        engine.insert(egi, outer, b.buildUnsafe(), ImmutableMap.of(), error),
        error);
  }

  // Iteration.

  @Test
  public void testIterationIntoNestedContext() {
    EgiTransformation t =
        engine.iterate(egi, ImmutableSet.of(socrates, socratesIsHuman), outer, error);
    Egi result = assertApplied(t, error);
    assertEquals(2, t.added().size());
    ElementId copy = Iterables.get(t.added(), 0);
    assertEquals(outer, result.contextOf(copy));
    assertEquals("Socrates", result.vertex(copy).label());
    assertFalse(result.areConnected(socrates, copy));
  }

  @Test
  public void testIterationOfCut() {
    EgiTransformation t = engine.iterate(egi, ImmutableSet.of(inner), outer, error);
    Egi result = assertApplied(t, error);
    assertEquals(3, t.added().size());
    assertEquals(2, result.context(outer).children().size());
  }

  @Test
  public void testIterationDirection() {
    assertFails(
        EgiError.Code.INVALID_NESTING,
        engine.iterate(egi, ImmutableSet.of(w, wIsHuman), sheet, error),
        error);
    assertFails(
        EgiError.Code.INVALID_NESTING,
        engine.iterate(egi, ImmutableSet.of(inner), inner, error),
        error);
    assertFails(
        EgiError.Code.NOT_FOUND,
        engine.iterate(egi, ImmutableSet.of(inner), new ElementId(ElementId.Kind.CUT, 99), error),
        error);
    // The same context is allowed.
    assertApplied(engine.iterate(egi, ImmutableSet.of(wIsHuman, w), outer, error), error);
  }

  @Test
  public void testIterationJoinsOutsideVertices() {
    Egi.Builder b = builder();
    ElementId v = b.addVertexUnsafe(b.sheet(), "Plato");
    ElementId p = b.addEdgeUnsafe(b.sheet(), "P", ImmutableList.of(v));
    ElementId cut = b.addCutUnsafe(b.sheet());
    Egi start = b.buildUnsafe();

    EgiTransformation t = engine.iterate(start, ImmutableSet.of(p), cut, error);
    Egi result = assertApplied(t, error);
    assertEquals(3, t.added().size());
    ElementId proxy = only(result, cut, ElementId.Kind.VERTEX);
    assertEquals("Plato", result.vertex(proxy).label());
    assertTrue(result.areConnected(v, proxy));
    EgiLigatures.Ligature ligature = Iterables.getOnlyElement(result.ligatures().ligatures());
    assertEquals(ImmutableSet.of(v, proxy), ligature.vertices());
    ElementId identity = Iterables.getOnlyElement(ligature.identityEdges());
    assertEquals(sheet, result.contextOf(identity));
  }

  @Test
  public void testLinkIteratedVertices() {
    EgiRuleEngine linking =
        new EgiRuleEngine(EgiRuleEngine.Options.builder().setLinkIteratedVertices(true).build());
    EgiTransformation t =
        linking.iterate(egi, ImmutableSet.of(socrates, socratesIsHuman), outer, error);
    Egi result = assertApplied(t, error);
    assertEquals(3, t.added().size());
    ElementId copy = Iterables.get(t.added(), 0);
    assertEquals(outer, result.contextOf(copy));
    assertTrue(result.areConnected(socrates, copy));
  }

  // De-iteration.

  @Test
  public void testDeiterationUndoesIteration() {
    EgiTransformation iterated =
        engine.iterate(egi, ImmutableSet.of(socrates, socratesIsHuman), outer, error);
    Egi copied = assertApplied(iterated, error);
    EgiTransformation t = engine.deiterate(copied, iterated.added(), null, error);
    Egi result = assertApplied(t, error);
    assertEquals(egi, result);
    assertEquals(iterated.added(), t.removed());
  }

  @Test
  public void testDeiterationOfCut() {
    EgiTransformation iterated = engine.iterate(egi, ImmutableSet.of(inner), outer, error);
    Egi copied = assertApplied(iterated, error);
    ElementId copy = Iterables.get(iterated.added(), 0);
    assertTrue(copy.isCut());
    assertEquals(
        egi, assertApplied(engine.deiterate(copied, ImmutableSet.of(copy), null, error), error));
    // The original may be removed too, as the copy is an occurrence in the same context.
    assertEquals(
        egi.contexts().size(),
        assertApplied(engine.deiterate(copied, ImmutableSet.of(inner), null, error), error)
            .contexts()
            .size());
  }

  @Test
  public void testDeiterationNeedsOccurrenceOutside() {
    EgiTransformation iterated =
        engine.iterate(egi, ImmutableSet.of(socrates, socratesIsHuman), outer, error);
    Egi copied = assertApplied(iterated, error);
    // The original is on the sheet; the copy is deeper, so it does not count.
    assertFails(
        EgiError.Code.STRUCTURAL_MISMATCH,
        engine.deiterate(copied, ImmutableSet.of(socrates, socratesIsHuman), null, error),
        error);
    // w is not a constant, so w's edge is not a copy of Socrates's.
    assertFails(
        EgiError.Code.STRUCTURAL_MISMATCH,
        engine.deiterate(egi, ImmutableSet.of(w, wIsHuman), null, error),
        error);
  }

  @Test
  public void testDeiterationRemovesLinkingIdentityEdges() {
    EgiRuleEngine linking =
        new EgiRuleEngine(EgiRuleEngine.Options.builder().setLinkIteratedVertices(true).build());
    EgiTransformation iterated =
        linking.iterate(egi, ImmutableSet.of(socrates, socratesIsHuman), outer, error);
    Egi copied = assertApplied(iterated, error);
    ImmutableSet.Builder<ElementId> selection = ImmutableSet.builder();
    for (ElementId id : iterated.added()) {
      if (copied.contextOf(id).equals(outer)) {
        selection.add(id);
      }
    }
    EgiTransformation t = engine.deiterate(copied, selection.build(), null, error);
    assertEquals(egi, assertApplied(t, error));
    assertEquals(iterated.added(), t.removed());
  }

  @Test
  public void testDeiterationAcrossLigature() {
    Egi.Builder b = builder();
    ElementId v = b.addVertexUnsafe(b.sheet(), null);
    ElementId p = b.addEdgeUnsafe(b.sheet(), "P", ImmutableList.of(v));
    ElementId cut = b.addCutUnsafe(b.sheet());
    Egi start = b.buildUnsafe();
    EgiTransformation iterated = engine.iterate(start, ImmutableSet.of(p), cut, error);
    Egi copied = assertApplied(iterated, error);
    ElementId copiedEdge = only(copied, cut, ElementId.Kind.EDGE);

    // P(proxy) is a copy of P(v) because proxy and v are the same individual.
    EgiTransformation t = engine.deiterate(copied, ImmutableSet.of(copiedEdge), null, error);
    Egi result = assertApplied(t, error);
    assertEquals(ImmutableSet.of(copiedEdge), t.removed());
    assertTrue(result.areConnected(v, only(result, cut, ElementId.Kind.VERTEX)));
  }

  @Test
  public void testDeiterationWithExplicitSource() {
    EgiTransformation iterated =
        engine.iterate(egi, ImmutableSet.of(socrates, socratesIsHuman), outer, error);
    Egi copied = assertApplied(iterated, error);
    ImmutableSet<ElementId> original = ImmutableSet.of(socrates, socratesIsHuman);
    assertEquals(
        egi,
        assertApplied(engine.deiterate(copied, iterated.added(), original, error), error));
    assertFails(
        EgiError.Code.STRUCTURAL_MISMATCH,
        engine.deiterate(copied, iterated.added(), ImmutableSet.of(socratesIsHuman), error),
        error);
    assertFails(
        EgiError.Code.INVALID_NESTING,
        engine.deiterate(copied, original, iterated.added(), error),
        error);
    assertFails(
        EgiError.Code.INVALID_ARGUMENT,
        engine.deiterate(copied, iterated.added(), iterated.added(), error),
        error);
  }

  @Test
  public void testDeiterationGivesUp() {
    EgiTransformation iterated =
        engine.iterate(egi, ImmutableSet.of(socrates, socratesIsHuman), outer, error);
    Egi copied = assertApplied(iterated, error);
    EgiRuleEngine impatient =
        new EgiRuleEngine(EgiRuleEngine.Options.builder().setMaxMatchSteps(1).build());
    assertFails(
        EgiError.Code.RESOURCE_EXHAUSTED,
        impatient.deiterate(copied, iterated.added(), null, error),
        error);
  }

  @Test
  public void testDeiterationRejectsOtherOutsideEdges() {
    Egi.Builder b = builder();
    ElementId v = b.addVertexUnsafe(b.sheet(), null);
    b.addEdgeUnsafe(b.sheet(), "P", ImmutableList.of(v));
    ElementId v2 = b.addVertexUnsafe(b.sheet(), null);
    b.addEdgeUnsafe(b.sheet(), "Q", ImmutableList.of(v2));
    Egi start = b.buildUnsafe();
    EgiTransformation iterated = engine.iterate(start, ImmutableSet.of(v), start.sheet(), error);
    Egi copied = assertApplied(iterated, error);
    ElementId copy = Iterables.getOnlyElement(iterated.added());
    Egi.Builder withEdge = copied.toBuilder();
    withEdge.addEdgeUnsafe(copied.sheet(), "Q", ImmutableList.of(copy));
    Egi attached = withEdge.buildUnsafe();
    // The copy matches v, but removing it would leave Q(copy) dangling.
    assertFails(
        EgiError.Code.INCOMPLETE_SELECTION,
        engine.deiterate(attached, ImmutableSet.of(copy), null, error),
        error);
  }

  @Test
  public void testDeiterationKeepsCoreference() {
    // ~[ P(x) P(y) Q(z) y = z ]: y is not a copy of x, because only y is also z.
    Egi.Builder b = builder();
    ElementId cut = b.addCutUnsafe(b.sheet());
    ElementId x = b.addVertexUnsafe(cut, null);
    b.addEdgeUnsafe(cut, "P", ImmutableList.of(x));
    ElementId y = b.addVertexUnsafe(cut, null);
    ElementId yIsP = b.addEdgeUnsafe(cut, "P", ImmutableList.of(y));
    ElementId z = b.addVertexUnsafe(cut, null);
    b.addEdgeUnsafe(cut, "Q", ImmutableList.of(z));
    ElementId yIsZ = b.addEdgeUnsafe(cut, "=", ImmutableList.of(y, z));
    Egi unlinked = b.buildUnsafe();
    assertFails(
        EgiError.Code.STRUCTURAL_MISMATCH,
        engine.deiterate(unlinked, ImmutableSet.of(y, yIsP), null, error),
        error);

    // Once x is z as well, y is a copy of x and may go along with y = z.
    b.addEdgeUnsafe(cut, "=", ImmutableList.of(x, z));
    Egi linked = b.buildUnsafe();
    EgiTransformation t = engine.deiterate(linked, ImmutableSet.of(y, yIsP), null, error);
    Egi result = assertApplied(t, error);
    assertEquals(ImmutableSet.of(y, yIsP, yIsZ), t.removed());
    assertTrue(result.areConnected(x, z));
  }

  // Double cuts.

  @Test
  public void testDoubleCutRoundTrip() {
    EgiTransformation added =
        engine.addDoubleCut(egi, sheet, ImmutableSet.of(socrates, socratesIsHuman), error);
    Egi wrapped = assertApplied(added, error);
    ElementId newOuter = Iterables.get(added.added(), 0);
    ElementId newInner = Iterables.get(added.added(), 1);
    assertEquals(sheet, wrapped.context(newOuter).parent());
    assertEquals(newOuter, wrapped.context(newInner).parent());
    assertEquals(2, wrapped.depthOf(socrates));
    assertTrue(wrapped.isPositive(wrapped.contextOf(socratesIsHuman)));

    EgiTransformation removed = engine.removeDoubleCut(wrapped, newOuter, error);
    assertEquals(egi, assertApplied(removed, error));
    assertEquals(ImmutableSet.of(newOuter, newInner), removed.removed());
  }

  @Test
  public void testEmptyDoubleCut() {
    Egi wrapped = assertApplied(engine.addDoubleCut(egi, inner, ImmutableSet.of(), error), error);
    assertEquals(egi.numCuts() + 2, wrapped.numCuts());
    ElementId newOuter = Iterables.getLast(wrapped.context(inner).children());
    assertEquals(egi, assertApplied(engine.removeDoubleCut(wrapped, newOuter, error), error));
  }

  @Test
  public void testDoubleCutWithCutInside() {
    EgiTransformation added = engine.addDoubleCut(egi, outer, ImmutableSet.of(inner), error);
    Egi wrapped = assertApplied(added, error);
    assertEquals(4, wrapped.context(inner).depth());
    assertEquals(
        egi,
        assertApplied(
            engine.removeDoubleCut(wrapped, Iterables.get(added.added(), 0), error), error));
  }

  @Test
  public void testDoubleCutErrors() {
    // Human(v1) cannot move inward without v1.
    assertFails(
        EgiError.Code.INVALID_NESTING,
        engine.addDoubleCut(egi, sheet, ImmutableSet.of(socratesIsHuman), error),
        error);
    // v1 can move inward: its edge stays outside, which is allowed.
    assertApplied(engine.addDoubleCut(egi, sheet, ImmutableSet.of(socrates), error), error);
    assertFails(
        EgiError.Code.INVALID_NESTING,
        engine.addDoubleCut(egi, sheet, ImmutableSet.of(w), error),
        error);
    assertFails(
        EgiError.Code.NOT_FOUND,
        engine.addDoubleCut(egi, u, ImmutableSet.of(), error),
        error);
    assertFails(EgiError.Code.INVALID_NESTING, engine.removeDoubleCut(egi, outer, error), error);
    assertFails(EgiError.Code.INVALID_NESTING, engine.removeDoubleCut(egi, inner, error), error);
    assertFails(EgiError.Code.NOT_FOUND, engine.removeDoubleCut(egi, sheet, error), error);
    assertFails(EgiError.Code.NOT_FOUND, engine.removeDoubleCut(egi, socrates, error), error);
  }

  // Isolated vertices.

  @Test
  public void testIsolatedVertexRoundTrip() {
    EgiTransformation added = engine.addIsolatedVertex(egi, inner, "Plato", error);
    Egi result = assertApplied(added, error);
    ElementId plato = Iterables.getOnlyElement(added.added());
    assertTrue(result.vertex(plato).isIsolated());
    assertEquals("Plato", result.vertex(plato).label());
    assertEquals(egi, assertApplied(engine.removeIsolatedVertex(result, plato, error), error));
  }

  @Test
  public void testIsolatedVertexErrors() {
    assertFails(
        EgiError.Code.NOT_ISOLATED, engine.removeIsolatedVertex(egi, socrates, error), error);
    assertFails(
        EgiError.Code.NOT_FOUND, engine.removeIsolatedVertex(egi, socratesIsHuman, error), error);
    assertFails(
        EgiError.Code.NOT_FOUND, engine.addIsolatedVertex(egi, socrates, null, error), error);
    assertFails(
        EgiError.Code.INVALID_ARGUMENT, engine.addIsolatedVertex(egi, sheet, "", error), error);
  }

  // Dispatch.

  @Test
  public void testApplyDispatches() {
    assertEquals(
        EgiRule.DOUBLE_CUT_ADDITION,
        engine
            .applyUnsafe(egi, EgiRuleApplication.doubleCutAddition(sheet, ImmutableSet.of()))
            .rule());
    assertEquals(
        EgiRule.INSERTION,
        engine.applyUnsafe(egi, EgiRuleApplication.insertion(outer, fragment())).rule());
    assertEquals(
        EgiRule.ISOLATED_VERTEX_ADDITION,
        engine.applyUnsafe(egi, EgiRuleApplication.isolatedVertexAddition(outer)).rule());
    EgiException e =
        assertThrows(
            EgiException.class,
            () -> engine.applyUnsafe(egi, EgiRuleApplication.isolatedVertexRemoval(socrates)));
    assertEquals(EgiError.Code.NOT_ISOLATED, e.code());
    assertFalse(
        engine.check(egi, EgiRuleApplication.erasure(ImmutableSet.of(wIsHuman)), error));
    assertEquals(EgiError.Code.WRONG_POLARITY, error.code());
    assertTrue(
        engine.check(egi, EgiRuleApplication.erasure(ImmutableSet.of(uIsMortal)), error));
  }

  @Test
  public void testAvailableApplications() {
    ImmutableList<EgiRuleApplication> available = engine.availableApplications(egi);
    assertEquals(
        ImmutableList.of(
            EgiRuleApplication.erasure(ImmutableSet.of(socratesIsHuman)),
            EgiRuleApplication.erasure(ImmutableSet.of(uIsMortal)),
            EgiRuleApplication.erasure(ImmutableSet.of(outer))),
        available);
    for (EgiRuleApplication application : available) {
      assertTrue(application.toString(), engine.check(egi, application, error));
    }

    Egi wrapped =
        engine
            .applyUnsafe(egi, EgiRuleApplication.doubleCutAddition(inner, ImmutableSet.of()))
            .result();
    Egi withLoner =
        engine.applyUnsafe(wrapped, EgiRuleApplication.isolatedVertexAddition(sheet)).result();
    int removals = 0;
    for (EgiRuleApplication application : engine.availableApplications(withLoner)) {
      assertTrue(application.toString(), engine.check(withLoner, application, error));
      if (application.rule() != EgiRule.ERASURE) {
        removals++;
      }
    }
    assertEquals(2, removals);
  }

  @Test
  public void testResultsSkipValidationWhenDisabled() {
    EgiRuleEngine fast =
        new EgiRuleEngine(EgiRuleEngine.Options.builder().setValidateResults(false).build());
    assertFalse(fast.options().validateResults());
    assertApplied(fast.erase(egi, ImmutableSet.of(outer), error), error);
    assertEquals(1_000_000, EgiRuleEngine.Options.defaults().maxMatchSteps());
    assertThrows(
        IllegalArgumentException.class,
        () -> EgiRuleEngine.Options.builder().setMaxMatchSteps(0));
  }
}
