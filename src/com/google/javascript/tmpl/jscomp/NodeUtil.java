/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.javascript.tmpl.jscomp;

import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableList;
import com.google.javascript.tmpl.lexer.Node;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful token tree utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /**
   * Interface for use with the visit method.
   *
   * @see #visitPreOrder
   */
  public static interface Visitor {
    void visit(Node node);
  }

  /** A pre-order traversal, calling Visitor.visit for each descendant. */
  public static void visitPreOrder(Node node, Visitor visitor) {
    visitPreOrder(node, visitor, Predicates.alwaysTrue());
  }

  /**
   * A pre-order traversal, calling Visitor.visit for each node in the tree. Children of nodes that
   * do not match the predicate will not be visited.
   */
  public static void visitPreOrder(
      Node node, Visitor visitor, Predicate<Node> traverseChildrenPred) {
    visitor.visit(node);

    if (traverseChildrenPred.apply(node)) {
      for (Node c = node.getFirstChild(); c != null; c = c.getNext()) {
        visitPreOrder(c, visitor, traverseChildrenPred);
      }
    }
  }

  /**
   * Returns the nodes of the tree below {@code root}, {@code root} included, that match the
   * predicate, in pre-order. The list is a snapshot, so the tree may be changed while iterating it.
   */
  public static ImmutableList<Node> collect(Node root, Predicate<Node> pred) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    visitPreOrder(
        root,
        n -> {
          if (pred.apply(n)) {
            result.add(n);
          }
        });
    return result.build();
  }

  /** Returns the first sibling after {@code n} that is not whitespace. */
  public static @Nullable Node getNextNonWhitespace(Node n) {
    Node next = n.getNext();
    while (next != null && next.isWhitespace()) {
      next = next.getNext();
    }
    return next;
  }

  /** Returns the last sibling before {@code n} that is not whitespace. */
  public static @Nullable Node getPreviousNonWhitespace(Node n) {
    Node previous = n.getPrevious();
    while (previous != null && previous.isWhitespace()) {
      previous = previous.getPrevious();
    }
    return previous;
  }
}
