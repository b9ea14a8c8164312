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

package com.google.javascript.tmpl.lexer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node of a template script tree.
 *
 * <p>The kind of a node is fixed when it is created. Leaf kinds carry a string, container kinds
 * carry children. Scopes and variables carry extra state used by the renaming pass; that state
 * lives in private subclasses and is reached through the accessors below, which fail on nodes of
 * any other kind.
 *
 * <p>Children are kept in a doubly linked sibling list. The previous pointer of the first child
 * points at the last child, so that appending is constant time.
 */
public class Node {

  private final Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  /** Content of leaf nodes. Null for containers. */
  private @Nullable String str;

  private int lineno = -1;
  private int charno = -1;
  private @Nullable String sourceFileName;

  private static final class ScopeNode extends Node {
    /** Declared name to declaring variable, in declaration order. */
    private final Map<String, Node> symbolTable = new LinkedHashMap<>();

    ScopeNode() {
      super(Token.SCOPE);
    }
  }

  private static final class VariableNode extends Node {
    private @Nullable String newName;
    private @Nullable Node linkedTo;

    VariableNode(String name) {
      super(Token.VARIABLE, name);
    }
  }

  private Node(Token token) {
    this.token = token;
    this.str = token.isLeaf() ? "" : null;
  }

  private Node(Token token, String str) {
    checkArgument(token.isLeaf(), "Not a leaf kind: %s", token);
    this.token = token;
    this.str = checkNotNull(str);
  }

  /** Creates an empty node of the given kind, with the state that kind needs. */
  public static Node newToken(Token token) {
    switch (token) {
      case SCOPE:
        return new ScopeNode();
      case VARIABLE:
        return new VariableNode("");
      default:
        return new Node(token);
    }
  }

  public static Node newString(Token token, String str) {
    if (token == Token.VARIABLE) {
      return new VariableNode(str);
    }
    return new Node(token, str);
  }

  public static Node newText(String text) {
    return new Node(Token.TEXT, text);
  }

  /**
   * Creates an opaque node standing for an already parsed directive of the host template
   * language.
   *
   * @param renderedText the text the directive renders to
   */
  public static Node newEmbeddedTag(String renderedText) {
    return new Node(Token.EMBEDDED_TAG, renderedText);
  }

  public static Node newRoot(@Nullable String sourceFileName) {
    Node root = new Node(Token.ROOT);
    root.sourceFileName = sourceFileName;
    return root.setLinenoCharno(1, 0);
  }

  public final Token getToken() {
    return token;
  }

  // ==========================================================================
  // Kind tests

  public final boolean isRoot() {
    return token == Token.ROOT;
  }

  public final boolean isScope() {
    return token == Token.SCOPE;
  }

  public final boolean isParentheses() {
    return token == Token.PARENTHESES;
  }

  public final boolean isSquareBrackets() {
    return token == Token.SQUARE_BRACKETS;
  }

  public final boolean isWhitespace() {
    return token == Token.WHITESPACE;
  }

  public final boolean isOperator() {
    return token == Token.OPERATOR;
  }

  public final boolean isKeyword() {
    return token == Token.KEYWORD;
  }

  public final boolean isVariable() {
    return token == Token.VARIABLE;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isString() {
    return token.isString();
  }

  public final boolean isRegexObject() {
    return token == Token.REGEX_OBJECT;
  }

  public final boolean isEmbeddedTag() {
    return token == Token.EMBEDDED_TAG;
  }

  public final boolean isText() {
    return token == Token.TEXT;
  }

  public final boolean isKeyword(String keyword) {
    return isKeyword() && str.equals(keyword);
  }

  public final boolean isOperator(String operator) {
    return isOperator() && getOperator().equals(operator);
  }

  public final boolean isComma() {
    return isOperator(",");
  }

  public final boolean isSemicolon() {
    return isOperator(";");
  }

  public final boolean isColon() {
    return isOperator(":");
  }

  /** Returns the operator without any surrounding whitespace. */
  public final String getOperator() {
    checkState(isOperator(), "Not an operator: %s", this);
    return str.trim();
  }

  // ==========================================================================
  // Leaf content

  public final String getString() {
    checkState(str != null, "Not a leaf: %s", token);
    return str;
  }

  public final void setString(String str) {
    checkState(this.str != null, "Not a leaf: %s", token);
    this.str = checkNotNull(str);
  }

  final void appendString(String s) {
    checkState(str != null, "Not a leaf: %s", token);
    str = str + s;
  }

  // ==========================================================================
  // Strings

  /**
   * Returns the value of a string literal: the recorded fragments with the escape of the
   * delimiting quote removed. Other escapes keep their backslash.
   */
  public final String getStringValue() {
    checkState(isString(), "Not a string: %s", this);
    String escapedQuote = token == Token.DOUBLE_QUOTED_STRING ? "\\\"" : "\\'";
    StringBuilder sb = new StringBuilder();
    for (Node child = first; child != null; child = child.next) {
      String text = child.toSource();
      sb.append(text.equals(escapedQuote) ? text.substring(1) : text);
    }
    return sb.toString();
  }

  /** Whether an embedded tag occurs anywhere below this node. */
  public final boolean containsEmbeddedTag() {
    for (Node child = first; child != null; child = child.next) {
      if (child.isEmbeddedTag() || child.containsEmbeddedTag()) {
        return true;
      }
    }
    return false;
  }

  // ==========================================================================
  // Scopes and variables

  /** The names declared directly in this scope, mapped to their declaring variables. */
  public final Map<String, Node> getSymbolTable() {
    checkState(isScope(), "Not a scope: %s", this);
    return ((ScopeNode) this).symbolTable;
  }

  /** The name this variable had in the source. */
  public final String getOriginalName() {
    checkState(isVariable(), "Not a variable: %s", this);
    return str;
  }

  public final @Nullable String getNewName() {
    checkState(isVariable(), "Not a variable: %s", this);
    return ((VariableNode) this).newName;
  }

  public final void setNewName(String newName) {
    checkState(isVariable(), "Not a variable: %s", this);
    ((VariableNode) this).newName = checkNotNull(newName);
  }

  /**
   * Makes this variable render with the name of {@code declaration}. Linking a variable to
   * itself is ignored.
   */
  public final void linkTo(Node declaration) {
    checkState(isVariable(), "Not a variable: %s", this);
    checkArgument(declaration.isVariable(), "Not a variable: %s", declaration);
    if (declaration == this) {
      return;
    }
    checkArgument(!declaration.isLinked(), "Cannot link to a linked variable: %s", declaration);
    ((VariableNode) this).linkedTo = declaration;
  }

  public final boolean isLinked() {
    checkState(isVariable(), "Not a variable: %s", this);
    return ((VariableNode) this).linkedTo != null;
  }

  public final @Nullable Node getLinkedVariable() {
    checkState(isVariable(), "Not a variable: %s", this);
    return ((VariableNode) this).linkedTo;
  }

  // ==========================================================================
  // Tree structure

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final int getChildCount() {
    int count = 0;
    for (Node n = first; n != null; n = n.next) {
      count++;
    }
    return count;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return checkNotNull(n);
  }

  /** Iterates over the direct children. Structural changes while iterating are not supported. */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    final Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.next;
      return n;
    }
  }

  public final void addChildToBack(Node child) {
    checkState(!token.isLeaf(), "Leaf nodes have no children: %s", this);
    child.checkDetached();
    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  public final void addChildToFront(Node child) {
    checkState(!token.isLeaf(), "Leaf nodes have no children: %s", this);
    child.checkDetached();
    child.parent = this;
    if (first == null) {
      child.previous = child;
    } else {
      child.previous = first.previous;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  /** Inserts this detached node right before {@code existing}. */
  public final void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    Node existingParent = existing.parent;
    Node existingPrevious = existing.previous;

    this.parent = existingParent;
    this.next = existing;
    existing.previous = this;

    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
    } else {
      existingPrevious.next = this;
    }
  }

  /** Swaps {@code replacement} and its subtree into the position of this node. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    Node existingParent = this.parent;
    Node existingNext = this.next;
    Node existingPrevious = this.previous;

    replacement.setLinenoCharno(lineno, charno);

    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
    } else {
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      existingParent.first.previous = replacement;
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  public final Node detach() {
    this.checkAttached();

    Node existingParent = this.parent;
    Node existingNext = this.next;
    Node existingPrevious = this.previous;

    this.parent = null;

    if (existingNext == null) {
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
    } else {
      existingPrevious.next = existingNext;
    }
    return this;
  }

  /** Removes all children and returns them, each detached from the others. */
  public final ImmutableList<Node> detachChildren() {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (Node child = first; child != null; ) {
      Node nextChild = child.next;
      child.parent = null;
      child.next = null;
      child.previous = null;
      children.add(child);
      child = nextChild;
    }
    first = null;
    return children.build();
  }

  private void checkAttached() {
    checkState(parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(parent == null, "Has parent: %s", this);
    checkState(next == null, "Has next: %s", this);
    checkState(previous == null, "Has previous: %s", this);
  }

  // ==========================================================================
  // Source positions

  public final int getLineno() {
    return lineno;
  }

  /** Returns the 0-based column number. */
  public final int getCharno() {
    return charno;
  }

  public final Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  /** Returns the source name of the unit this node belongs to, if it is known. */
  public final @Nullable String getSourceFileName() {
    for (Node n = this; n != null; n = n.parent) {
      if (n.sourceFileName != null) {
        return n.sourceFileName;
      }
    }
    return null;
  }

  public final void setSourceFileName(@Nullable String sourceFileName) {
    this.sourceFileName = sourceFileName;
  }

  public final String getLocation() {
    return getSourceFileName() + ":" + lineno + ":" + charno;
  }

  // ==========================================================================
  // Output

  /** Renders this node and its subtree as source text. */
  public final String toSource() {
    StringBuilder sb = new StringBuilder();
    appendSource(sb);
    return sb.toString();
  }

  private void appendSource(StringBuilder sb) {
    switch (token) {
      case SCOPE:
        appendChildren(sb.append('{')).append('}');
        break;
      case PARENTHESES:
        appendChildren(sb.append('(')).append(')');
        break;
      case SQUARE_BRACKETS:
        appendChildren(sb.append('[')).append(']');
        break;
      case DOUBLE_QUOTED_STRING:
        appendChildren(sb.append('"')).append('"');
        break;
      case SINGLE_QUOTED_STRING:
        appendChildren(sb.append('\'')).append('\'');
        break;
      case ROOT:
      case REGEX_OBJECT:
        appendChildren(sb);
        break;
      case VARIABLE:
        VariableNode variable = (VariableNode) this;
        if (variable.newName != null) {
          sb.append(variable.newName);
        } else if (variable.linkedTo != null) {
          variable.linkedTo.appendSource(sb);
        } else {
          sb.append(str);
        }
        break;
      default:
        sb.append(str);
        break;
    }
  }

  private StringBuilder appendChildren(StringBuilder sb) {
    for (Node child = first; child != null; child = child.next) {
      child.appendSource(sb);
    }
    return sb;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder().append(token);
    if (str != null) {
      sb.append(' ').append('"').append(str).append('"');
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  /** Prints the tree below this node, one node per line. Useful in tests and debugging. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    toStringTreeHelper(this, 0, sb);
    return sb.toString();
  }

  private static void toStringTreeHelper(Node n, int level, StringBuilder sb) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(n).append('\n');
    for (Node child = n.first; child != null; child = child.next) {
      toStringTreeHelper(child, level + 1, sb);
    }
  }
}
