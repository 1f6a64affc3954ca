/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.swiftsyntax.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Collects the children of a node in source order, skipping absent
 * optional children.
 */
class Children {
  private final ImmutableList.Builder<SyntaxNode> builder =
                                          ImmutableList.builder();

  static Children create() {
    return new Children();
  }

  Children add(SyntaxNode child) {
    if (child != null) {
      builder.add(child);
    }
    return this;
  }

  Children addAll(List<? extends SyntaxNode> children) {
    builder.addAll(children);
    return this;
  }

  List<SyntaxNode> build() {
    return builder.build();
  }
}
