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

/**
 * An unchecked exception wrapping an {@link EgiError}. Methods that accept an EgiError parameter
 * often have a twin with an "Unsafe" suffix that throws EgiException instead, for clients that
 * prefer exceptions. For example, {@link Egi.Builder#addVertexUnsafe(ElementId, String)} wraps
 * {@link Egi.Builder#addVertex(ElementId, String, EgiError)}.
 *
 * <p>The rule engine also throws EgiException with code {@link EgiError.Code#MALFORMED_RESULT} when
 * one of its own outputs fails validation; that is an internal defect and is not meant to be
 * caught and recovered from.
 */
public class EgiException extends RuntimeException {

  private final EgiError error;

  /** Creates a new EgiException wrapping the given EgiError. */
  public EgiException(EgiError error) {
    this.error = error;
  }

  /** Returns the code of the wrapped EgiError. */
  public EgiError.Code code() {
    return error.code();
  }

  /** Returns the wrapped EgiError. */
  public EgiError error() {
    return error;
  }

  @Override
  public String getMessage() {
    return error.toString();
  }
}
