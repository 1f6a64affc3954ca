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
package exm.swiftsyntax.walk;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

import exm.swiftsyntax.common.Logging;
import exm.swiftsyntax.common.Settings;
import exm.swiftsyntax.common.exceptions.InvalidOptionException;
import exm.swiftsyntax.common.exceptions.MalformedTreeException;
import exm.swiftsyntax.tree.SyntaxNode;

/**
 * Depth-first, pre-order traversal of a syntax tree.
 *
 * The walk keeps its own stack rather than recursing, so arbitrarily
 * deep trees (long operator chains, deeply nested blocks) can be walked
 * without exhausting the Java call stack.  Depth is passed down with
 * each pending node, so nodes need no parent pointers.
 */
public class SyntaxWalker {

  private static final Logger logger = Logging.getLogger();

  private static final int DEFAULT_DEPTH_LIMIT = 1000;

  public static interface Listener {
    /**
     * Called once per node, parents before children, siblings in
     * source order.
     * @param node
     * @param depth 0 for the root
     */
    public void visit(SyntaxNode node, int depth);
  }

  /** A node waiting to be visited */
  private static class Pending {
    final SyntaxNode node;
    final int depth;

    Pending(SyntaxNode node, int depth) {
      this.node = node;
      this.depth = depth;
    }
  }

  public static void walk(SyntaxNode root, Listener listener) {
    Preconditions.checkNotNull(root, "root");
    Deque<Pending> stack = new ArrayDeque<Pending>();
    stack.push(new Pending(root, 0));
    while (!stack.isEmpty()) {
      Pending curr = stack.pop();
      listener.visit(curr.node, curr.depth);

      List<SyntaxNode> children = curr.node.children();
      // Push in reverse so first child is visited first
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new Pending(children.get(i), curr.depth + 1));
      }
    }
  }

  public static int countNodes(SyntaxNode root) {
    final int count[] = new int[] {0};
    walk(root, new Listener() {
      @Override
      public void visit(SyntaxNode node, int depth) {
        count[0]++;
      }
    });
    return count[0];
  }

  /**
   * @return depth of the deepest node, where the root is at depth 0
   */
  public static int maxDepth(SyntaxNode root) {
    final int max[] = new int[] {0};
    walk(root, new Listener() {
      @Override
      public void visit(SyntaxNode node, int depth) {
        max[0] = Math.max(max[0], depth);
      }
    });
    return max[0];
  }

  /**
   * @return the configured depth limit for printing and serialization
   */
  public static int depthLimit() {
    try {
      int limit = Settings.getInt(Settings.MAX_DEPTH);
      if (limit < 1) {
        throw new InvalidOptionException(Settings.MAX_DEPTH +
                                         " must be positive");
      }
      return limit;
    } catch (InvalidOptionException e) {
      Logging.uniqueWarn("Bad depth limit, using " + DEFAULT_DEPTH_LIMIT +
                         ": " + e.getMessage());
      return DEFAULT_DEPTH_LIMIT;
    }
  }

  /**
   * Like {@code maxDepth(root) > limit}, but stops at the first node
   * below the limit.
   */
  public static boolean deeperThan(SyntaxNode root, int limit) {
    Preconditions.checkNotNull(root, "root");
    Deque<Pending> stack = new ArrayDeque<Pending>();
    stack.push(new Pending(root, 0));
    while (!stack.isEmpty()) {
      Pending curr = stack.pop();
      if (curr.depth > limit) {
        return true;
      }
      for (SyntaxNode child: curr.node.children()) {
        stack.push(new Pending(child, curr.depth + 1));
      }
    }
    return false;
  }

  /**
   * Check that no node object appears more than once in the tree, i.e.
   * that every node has exactly one parent.  Nodes are compared by
   * identity: equal but distinct subtrees are fine.
   * @throws MalformedTreeException if a node is shared
   */
  public static void checkExclusiveOwnership(SyntaxNode root)
      throws MalformedTreeException {
    Preconditions.checkNotNull(root, "root");
    Set<SyntaxNode> seen = Sets.newIdentityHashSet();
    Deque<Pending> stack = new ArrayDeque<Pending>();
    stack.push(new Pending(root, 0));
    while (!stack.isEmpty()) {
      Pending curr = stack.pop();
      if (!seen.add(curr.node)) {
        throw new MalformedTreeException("Shared subtree: " +
            curr.node.getClass().getSimpleName() + " at depth " +
            curr.depth + " is reachable from more than one parent");
      }
      List<SyntaxNode> children = curr.node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new Pending(children.get(i), curr.depth + 1));
      }
    }
    if (logger.isTraceEnabled()) {
      logger.trace("Ownership check passed for " + seen.size() + " nodes");
    }
  }
}
