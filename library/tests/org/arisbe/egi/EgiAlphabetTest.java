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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link EgiAlphabet}. */
@RunWith(JUnit4.class)
public class EgiAlphabetTest {

  @Test
  public void testIdentityAlwaysPresent() {
    assertTrue(EgiAlphabet.identityOnly().contains("=", 2));
    assertTrue(EgiAlphabet.builder().build().contains("=", 2));
    assertEquals(1, EgiAlphabet.identityOnly().relations().size());
  }

  @Test
  public void testContains() {
    EgiAlphabet alphabet = EgiAlphabet.builder().add("Mortal", 1).add("Loves", 2).build();
    assertTrue(alphabet.contains("Mortal", 1));
    assertFalse(alphabet.contains("Mortal", 2));
    assertTrue(alphabet.contains("Loves"));
    assertFalse(alphabet.contains("Human"));
    assertEquals(2, (int) alphabet.arity("Loves"));
    assertNull(alphabet.arity("Human"));
    assertEquals("[=, Loves, Mortal]", alphabet.relations().keySet().toString());
  }

  @Test
  public void testWithRelation() {
    EgiError error = new EgiError();
    EgiAlphabet base = EgiAlphabet.identityOnly();
    EgiAlphabet extended = base.withRelation("Human", 1, error);
    assertTrue(error.ok());
    assertTrue(extended.contains("Human", 1));
    assertFalse(base.contains("Human"));
    assertSame(extended, extended.withRelation("Human", 1, error));
  }

  @Test
  public void testArityConflict() {
    EgiError error = new EgiError();
    EgiAlphabet alphabet = EgiAlphabet.builder().add("Mortal", 1).build();
    assertNull(alphabet.withRelation("Mortal", 2, error));
    assertEquals(EgiError.Code.RELATION_ARITY_CONFLICT, error.code());
    assertNull(alphabet.withRelation("=", 3, error));
    EgiException e =
        assertThrows(EgiException.class, () -> alphabet.withRelationUnsafe("Mortal", 0));
    assertEquals(EgiError.Code.RELATION_ARITY_CONFLICT, e.code());
    assertThrows(
        IllegalArgumentException.class,
        () -> EgiAlphabet.builder().add("Mortal", 1).add("Mortal", 2));
  }

  @Test
  public void testBadArguments() {
    assertThrows(IllegalArgumentException.class, () -> EgiAlphabet.builder().add("", 1));
    assertThrows(IllegalArgumentException.class, () -> EgiAlphabet.builder().add("P", -1));
  }

  @Test
  public void testEquality() {
    EgiAlphabet a = EgiAlphabet.builder().add("P", 1).add("Q", 1).build();
    EgiAlphabet b =
        EgiAlphabet.identityOnly().withRelationUnsafe("Q", 1).withRelationUnsafe("P", 1);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }
}
