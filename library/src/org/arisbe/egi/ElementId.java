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
import com.google.errorprone.annotations.Immutable;

/**
 * An opaque identifier for one element of an EGI, tagged with the element's kind. Identifiers are
 * the only way elements refer to each other: an edge holds the ids of its vertices, a context the
 * ids of what it encloses, and every lookup goes through the owning {@link Egi}.
 *
 * <p>Ids are ordered by serial number, then kind. Serials come from an {@link EgiIdAllocator}
 * shared by every EGI derived from the same sheet, so an id is never reused within a lineage.
 */
@Immutable
public final class ElementId implements Comparable<ElementId> {
  /** The kind of element an id names. */
  public enum Kind {
    SHEET("sheet"),
    CUT("c"),
    VERTEX("v"),
    EDGE("e");

    private final String prefix;

    private Kind(String prefix) {
      this.prefix = prefix;
    }

    /** Returns true for the two kinds of context, the sheet and cuts. */
    public boolean isContext() {
      return this == SHEET || this == CUT;
    }
  }

  private final Kind kind;
  private final long serial;

  ElementId(Kind kind, long serial) {
    Preconditions.checkNotNull(kind);
    Preconditions.checkArgument(serial >= 0, "Negative serial %s", serial);
    this.kind = kind;
    this.serial = serial;
  }

  /** Returns the kind of element this id names. */
  public Kind kind() {
    return kind;
  }

  /** Returns the serial number, unique within the id's lineage. */
  public long serial() {
    return serial;
  }

  public boolean isVertex() {
    return kind == Kind.VERTEX;
  }

  public boolean isEdge() {
    return kind == Kind.EDGE;
  }

  public boolean isCut() {
    return kind == Kind.CUT;
  }

  public boolean isSheet() {
    return kind == Kind.SHEET;
  }

  /** Returns true if this id names the sheet or a cut. */
  public boolean isContext() {
    return kind.isContext();
  }

  @Override
  public int compareTo(ElementId other) {
    int c = Long.compare(serial, other.serial);
    return c != 0 ? c : kind.compareTo(other.kind);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof ElementId)) {
      return false;
    }
    ElementId that = (ElementId) other;
    return serial == that.serial && kind == that.kind;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(serial) + kind.hashCode();
  }

  @Override
  public String toString() {
    return kind.prefix + serial;
  }
}
