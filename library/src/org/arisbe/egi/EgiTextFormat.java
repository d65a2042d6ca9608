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

import com.google.common.base.Joiner;

/**
 * Renders an EGI as a compact, deterministic string for debugging and test failure messages. This
 * is not a surface syntax and cannot be parsed back. The sheet is written as its id followed by its
 * contents; each cut as {@code ~cN[ ... ]}; vertices as their id, followed by the constant label in
 * quotes if they have one; edges as {@code relation(v1 v2 ...)}. For example:
 *
 * <pre>
 * sheet0 v1 ~c2[ v3 Human(v3) ]
 * </pre>
 */
public final class EgiTextFormat {
  private EgiTextFormat() {}

  /** Returns the debug rendering of the given EGI. */
  public static String toDebugString(Egi egi) {
    StringBuilder out = new StringBuilder();
    egi.traverse(
        new EgiVisitor() {
          @Override
          public void startContext(EgiContext context) {
            if (context.isSheet()) {
              out.append(context.id());
            } else {
              out.append(" ~").append(context.id()).append('[');
            }
          }

          @Override
          public void visitVertex(EgiVertex vertex) {
            out.append(' ').append(vertex.id());
            if (vertex.isConstant()) {
              out.append('"').append(vertex.label()).append('"');
            }
          }

          @Override
          public void visitEdge(EgiEdge edge) {
            out.append(' ')
                .append(edge.relation())
                .append('(')
                .append(Joiner.on(' ').join(edge.vertices()))
                .append(')');
          }

          @Override
          public void finishContext(EgiContext context) {
            if (!context.isSheet()) {
              out.append(" ]");
            }
          }
        });
    return out.toString();
  }
}
