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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Base of every node class in this package.
 *
 * Structural equality and hashing are implemented here once, without
 * recursion, so that they work on trees of any depth.  Each node class
 * only supplies {@link #attributes()}: its fields that are not child
 * nodes.  Two nodes are equal if they have the same class, equal
 * attributes and pairwise equal children.
 */
public abstract class AbstractSyntaxNode implements SyntaxNode {

  static final List<Object> NO_ATTRIBUTES = Collections.emptyList();

  /** Cached hash, 0 if not yet computed */
  private int hash;

  AbstractSyntaxNode() {
  }

  /**
   * @return the fields of this node that are not child nodes, in a fixed
   *    order.  Optional children are represented by a presence flag, so
   *    that an absent child never lines up with a different present one.
   */
  abstract List<Object> attributes();

  @Override
  public final boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AbstractSyntaxNode)) {
      return false;
    }
    return structurallyEqual(this, (AbstractSyntaxNode) o);
  }

  @Override
  public final int hashCode() {
    int h = hash;
    if (h == 0) {
      fillHashes(this);
      h = hash;
    }
    return h;
  }

  private static AbstractSyntaxNode node(SyntaxNode n) {
    return (AbstractSyntaxNode) n;
  }

  /**
   * Compare two trees in lockstep with a pair of explicit stacks.
   */
  private static boolean structurallyEqual(AbstractSyntaxNode a,
                                           AbstractSyntaxNode b) {
    Deque<AbstractSyntaxNode> left = new ArrayDeque<AbstractSyntaxNode>();
    Deque<AbstractSyntaxNode> right = new ArrayDeque<AbstractSyntaxNode>();
    left.push(a);
    right.push(b);
    while (!left.isEmpty()) {
      AbstractSyntaxNode x = left.pop();
      AbstractSyntaxNode y = right.pop();
      if (x == y) {
        continue;
      }
      if (x.getClass() != y.getClass()) {
        return false;
      }
      int hx = x.hash, hy = y.hash;
      if (hx != 0 && hy != 0 && hx != hy) {
        return false;
      }
      if (!x.attributes().equals(y.attributes())) {
        return false;
      }
      List<SyntaxNode> xs = x.children();
      List<SyntaxNode> ys = y.children();
      if (xs.size() != ys.size()) {
        return false;
      }
      for (int i = xs.size() - 1; i >= 0; i--) {
        left.push(node(xs.get(i)));
        right.push(node(ys.get(i)));
      }
    }
    return true;
  }

  /**
   * Compute hashes bottom-up for root and every descendant that has
   * none yet.  A node is hashed only once all its children are.
   */
  private static void fillHashes(AbstractSyntaxNode root) {
    Deque<AbstractSyntaxNode> stack = new ArrayDeque<AbstractSyntaxNode>();
    stack.push(root);
    while (!stack.isEmpty()) {
      AbstractSyntaxNode curr = stack.peek();
      if (curr.hash != 0) {
        stack.pop();
        continue;
      }
      boolean ready = true;
      List<SyntaxNode> children = curr.children();
      for (SyntaxNode child: children) {
        if (node(child).hash == 0) {
          stack.push(node(child));
          ready = false;
        }
      }
      if (ready) {
        stack.pop();
        int h = curr.getClass().getName().hashCode();
        h = 31 * h + curr.attributes().hashCode();
        for (SyntaxNode child: children) {
          h = 31 * h + node(child).hash;
        }
        // 0 is reserved for "not computed"
        curr.hash = (h == 0) ? 1 : h;
      }
    }
  }
}
