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

/**
 * Any node of a syntax tree: a type, expression, statement, pattern or
 * declaration, or one of the shapes nested inside them (arguments,
 * parameters, switch cases, ...).
 *
 * Nodes own their children exclusively and hold no reference to their
 * parent.  Leaf data (literals, identifiers, operator symbols, names)
 * is stored inline and is not a node.
 */
public interface SyntaxNode {

  /**
   * @return the direct child nodes, in source order.  Absent optional
   *         children are left out.
   */
  public List<SyntaxNode> children();
}
