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

import com.google.common.base.Strings;

/**
 * An error code and text describing why an EGI operation was refused. Operations that can fail on
 * legitimate input take an EgiError parameter, fill it in and return null or false; they never
 * throw for an illegal request. Variants with an "Unsafe" suffix throw {@link EgiException}
 * instead.
 */
public class EgiError {
  /** Numeric values for EGI errors. */
  public enum Code {
    /** No problems detected. */
    NO_ERROR(0),

    ////////////////////////////////////////////////////////////////////
    // Generic errors:

    /** Invalid argument, such as an empty selection or the sheet being selected. */
    INVALID_ARGUMENT(1000),
    /** A bounded search ran out of steps before reaching an answer. */
    RESOURCE_EXHAUSTED(1001),

    ////////////////////////////////////////////////////////////////////
    // Construction errors:

    /** A referenced identifier does not exist in the EGI. */
    NOT_FOUND(1),
    /** An element was placed in a context that is not live. */
    UNKNOWN_CONTEXT(2),
    /** The (relation name, arity) pair is not in the alphabet. */
    UNREGISTERED_RELATION(3),
    /** A relation name was registered a second time with a different arity. */
    RELATION_ARITY_CONFLICT(4),
    /** An edge's context does not dominate the context of one of its vertices. */
    DOMINATION_VIOLATION(5),

    ////////////////////////////////////////////////////////////////////
    // Transformation rule errors:

    /** Erasure from a negative context, or insertion into a positive one. */
    WRONG_POLARITY(100),
    /** Isolated-vertex removal of a vertex that still has incident edges. */
    NOT_ISOLATED(101),
    /** A de-iteration target has no equivalent occurrence it could have been iterated from. */
    STRUCTURAL_MISMATCH(102),
    /** A target context is outside the legal nesting, or a cut is not a bare double cut. */
    INVALID_NESTING(103),
    /** Removing the selection would leave an edge without one of its vertices. */
    INCOMPLETE_SELECTION(104),

    ////////////////////////////////////////////////////////////////////
    // Well-formedness errors:

    /** The contexts do not form a tree rooted at the sheet with consistent depths. */
    INVALID_CONTEXT_TREE(200),
    /** Elements and enclosing contexts are not in one-to-one correspondence. */
    ENCLOSURE_MISMATCH(201),
    /** Edge vertex lists and vertex incident-edge sets disagree. */
    INCIDENCE_MISMATCH(202),
    /** The ligature components disagree with the identity edges present. */
    LIGATURE_MISMATCH(203),

    /**
     * A rule produced an EGI that failed its post-condition. This indicates a defect in the rule
     * engine, never a user error, and is only ever thrown.
     */
    MALFORMED_RESULT(900);

    private final int code;

    private Code(int code) {
      this.code = code;
    }

    /** Returns the numeric value of this error code. */
    public int code() {
      return code;
    }
  }

  private Code code = Code.NO_ERROR;
  private String text = "";

  /** Resets this error to NO_ERROR with empty text. */
  public void clear() {
    code = Code.NO_ERROR;
    text = "";
  }

  /**
   * Sets the code and text. The text is formatted by {@link Strings#lenientFormat(String,
   * Object...)}, with '%d' treated like '%s'. May be called again to wrap the text in more context:
   *
   * <pre>{@code
   * error.init(error.code(), "Step %d: %s", step, error.text());
   * }</pre>
   */
  public void init(Code code, String format, Object... args) {
    this.code = code;
    format = format.replace("%d", "%s");
    this.text = Strings.lenientFormat(format, args);
  }

  /** Returns the code of this error. */
  public Code code() {
    return code;
  }

  /** Returns true if this error's code is NO_ERROR. */
  public boolean ok() {
    return code == Code.NO_ERROR;
  }

  /** Returns the text string. */
  public String text() {
    return text;
  }

  @Override
  public String toString() {
    if (code == Code.NO_ERROR) {
      return "OK";
    }
    return Strings.lenientFormat("%s: %s", code, text);
  }
}
