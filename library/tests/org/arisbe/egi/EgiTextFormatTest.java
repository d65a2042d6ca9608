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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link EgiTextFormat} and {@link Egi#traverse(EgiVisitor)}. */
@RunWith(JUnit4.class)
public class EgiTextFormatTest extends EgiTestCase {

  @Test
  public void testEmptySheet() {
    assertEquals("sheet0", EgiTextFormat.toDebugString(Egi.empty()));
  }

  @Test
  public void testSocrates() {
    assertEquals(
        "sheet0 v1\"Socrates\" Human(v1) ~c3[ v4 Human(v4) ~c6[ v7 Mortal(v7) ] ]",
        socrates().toString());
  }

  @Test
  public void testEdgeArgumentOrder() {
    Egi.Builder b = builder();
    ElementId v1 = b.addVertexUnsafe(b.sheet(), null);
    ElementId v2 = b.addVertexUnsafe(b.sheet(), null);
    b.addEdgeUnsafe(b.sheet(), "Loves", ImmutableList.of(v2, v1));
    assertEquals("sheet0 v1 v2 Loves(v2 v1)", EgiTextFormat.toDebugString(b.buildUnsafe()));
  }

  @Test
  public void testTraversalOrder() {
    Egi.Builder b = builder();
    ElementId c1 = b.addCutUnsafe(b.sheet());
    ElementId c2 = b.addCutUnsafe(b.sheet());
    ElementId c11 = b.addCutUnsafe(c1);
    List<String> events = new ArrayList<>();
    b.buildUnsafe()
        .traverse(
            new EgiVisitor() {
              @Override
              public void startContext(EgiContext context) {
                events.add("+" + context.id());
              }

              @Override
              public void finishContext(EgiContext context) {
                events.add("-" + context.id());
              }
            });
    assertEquals(
        ImmutableList.of(
            "+sheet0", "+" + c1, "+" + c11, "-" + c11, "-" + c1, "+" + c2, "-" + c2, "-sheet0"),
        events);
  }
}
