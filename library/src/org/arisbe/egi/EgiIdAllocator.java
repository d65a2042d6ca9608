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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out element ids for one EGI lineage: the EGI created with a fresh {@link Egi.Builder}
 * and every EGI derived from it by the builder or the rule engine. The counter is shared, so two
 * EGIs derived concurrently from a common ancestor never hand out the same id.
 */
final class EgiIdAllocator {
  private final AtomicLong next = new AtomicLong();

  /** Returns a new id of the given kind. */
  ElementId allocate(ElementId.Kind kind) {
    return new ElementId(kind, next.getAndIncrement());
  }
}
