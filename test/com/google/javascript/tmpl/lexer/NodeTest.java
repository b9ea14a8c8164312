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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  private static Node variable(String name) {
    return Node.newString(Token.VARIABLE, name);
  }

  private static Node operator(String op) {
    return Node.newString(Token.OPERATOR, op);
  }

  @Test
  public void testSiblingLinks() {
    Node root = Node.newRoot("test.js");
    Node a = variable("a");
    Node b = variable("b");
    Node c = variable("c");
    root.addChildToBack(b);
    root.addChildToBack(c);
    root.addChildToFront(a);

    assertThat(root.getChildCount()).isEqualTo(3);
    assertThat(root.getFirstChild()).isSameInstanceAs(a);
    assertThat(root.getLastChild()).isSameInstanceAs(c);
    assertThat(a.getPrevious()).isNull();
    assertThat(b.getPrevious()).isSameInstanceAs(a);
    assertThat(c.getNext()).isNull();
    assertThat(root.getChildAtIndex(1)).isSameInstanceAs(b);
    assertThat(root.children()).containsExactly(a, b, c).inOrder();
  }

  @Test
  public void testInsertBefore() {
    Node root = Node.newRoot(null);
    Node b = variable("b");
    root.addChildToBack(b);

    Node a = variable("a");
    a.insertBefore(b);
    Node space = Node.newString(Token.WHITESPACE, " ");
    space.insertBefore(b);

    assertThat(root.toSource()).isEqualTo("a b");
    assertThat(root.getFirstChild()).isSameInstanceAs(a);
    assertThat(b.getPrevious()).isSameInstanceAs(space);
  }

  @Test
  public void testReplaceWithKeepsPosition() {
    Node root = Node.newRoot(null);
    Node a = variable("a").setLinenoCharno(3, 7);
    root.addChildToBack(a);
    root.addChildToBack(operator(";"));

    Node b = variable("b");
    a.replaceWith(b);

    assertThat(root.toSource()).isEqualTo("b;");
    assertThat(a.getParent()).isNull();
    assertThat(b.getLineno()).isEqualTo(3);
    assertThat(b.getCharno()).isEqualTo(7);
  }

  @Test
  public void testReplaceLastChild() {
    Node root = Node.newRoot(null);
    root.addChildToBack(variable("a"));
    Node b = variable("b");
    root.addChildToBack(b);

    Node c = variable("c");
    b.replaceWith(c);
    root.addChildToBack(variable("d"));

    assertThat(root.toSource()).isEqualTo("acd");
    assertThat(root.getLastChild().getPrevious()).isSameInstanceAs(c);
  }

  @Test
  public void testDetach() {
    Node root = Node.newRoot(null);
    Node a = variable("a");
    Node b = variable("b");
    Node c = variable("c");
    root.addChildToBack(a);
    root.addChildToBack(b);
    root.addChildToBack(c);

    b.detach();
    assertThat(root.toSource()).isEqualTo("ac");
    c.detach();
    assertThat(root.getLastChild()).isSameInstanceAs(a);
    a.detach();
    assertThat(root.hasChildren()).isFalse();
  }

  @Test
  public void testDetachChildren() {
    Node root = Node.newRoot(null);
    root.addChildToBack(Node.newText("x"));
    root.addChildToBack(Node.newEmbeddedTag("{{ y }}"));

    assertThat(root.detachChildren()).hasSize(2);
    assertThat(root.hasChildren()).isFalse();
  }

  @Test
  public void testAddingAttachedNodeFails() {
    Node root = Node.newRoot(null);
    Node a = variable("a");
    root.addChildToBack(a);

    assertThrows(IllegalStateException.class, () -> Node.newRoot(null).addChildToBack(a));
  }

  @Test
  public void testLeavesHaveNoChildren() {
    assertThrows(IllegalStateException.class, () -> variable("a").addChildToBack(variable("b")));
  }

  @Test
  public void testToSourceOfContainers() {
    Node root = Node.newRoot(null);
    Node scope = Node.newToken(Token.SCOPE);
    Node parens = Node.newToken(Token.PARENTHESES);
    Node brackets = Node.newToken(Token.SQUARE_BRACKETS);
    Node string = Node.newToken(Token.SINGLE_QUOTED_STRING);
    root.addChildToBack(parens);
    root.addChildToBack(scope);
    scope.addChildToBack(brackets);
    brackets.addChildToBack(string);
    string.addChildToBack(Node.newText("s"));

    assertThat(root.toSource()).isEqualTo("({['s']})");
  }

  @Test
  public void testOperators() {
    Node in = operator(" in ");

    assertThat(in.getOperator()).isEqualTo("in");
    assertThat(in.isOperator("in")).isTrue();
    assertThat(in.toSource()).isEqualTo(" in ");
    assertThat(operator(",").isComma()).isTrue();
    assertThat(operator(";").isSemicolon()).isTrue();
    assertThat(operator(":").isColon()).isTrue();
    assertThat(operator(":").isComma()).isFalse();
  }

  @Test
  public void testStringValueUnescapesOwnQuote() {
    Node string = Node.newToken(Token.DOUBLE_QUOTED_STRING);
    string.addChildToBack(Node.newText("say "));
    string.addChildToBack(Node.newText("\\\""));
    string.addChildToBack(Node.newText("hi"));
    string.addChildToBack(Node.newText("\\\""));
    string.addChildToBack(Node.newText("\\n"));

    assertThat(string.toSource()).isEqualTo("\"say \\\"hi\\\"\\n\"");
    assertThat(string.getStringValue()).isEqualTo("say \"hi\"\\n");
  }

  @Test
  public void testContainsEmbeddedTag() {
    Node parens = Node.newToken(Token.PARENTHESES);
    Node string = Node.newToken(Token.DOUBLE_QUOTED_STRING);
    parens.addChildToBack(string);

    assertThat(parens.containsEmbeddedTag()).isFalse();
    string.addChildToBack(Node.newEmbeddedTag("{{ x }}"));
    assertThat(parens.containsEmbeddedTag()).isTrue();
  }

  @Test
  public void testVariableRendering() {
    Node declaration = variable("total");
    Node reference = variable("total");

    assertThat(reference.toSource()).isEqualTo("total");
    reference.linkTo(declaration);
    assertThat(reference.isLinked()).isTrue();
    assertThat(reference.getLinkedVariable()).isSameInstanceAs(declaration);
    declaration.setNewName("a");
    assertThat(declaration.toSource()).isEqualTo("a");
    assertThat(reference.toSource()).isEqualTo("a");
    assertThat(reference.getOriginalName()).isEqualTo("total");
  }

  @Test
  public void testLinkToSelfIsIgnored() {
    Node v = variable("v");
    v.linkTo(v);
    assertThat(v.isLinked()).isFalse();
  }

  @Test
  public void testCannotLinkToLinkedVariable() {
    Node first = variable("x");
    Node second = variable("x");
    second.linkTo(first);

    assertThrows(IllegalArgumentException.class, () -> variable("x").linkTo(second));
  }

  @Test
  public void testKindSpecificStateIsChecked() {
    assertThrows(IllegalStateException.class, () -> operator("+").getNewName());
    assertThrows(IllegalStateException.class, () -> variable("x").getSymbolTable());
    assertThat(Node.newToken(Token.SCOPE).getSymbolTable()).isEmpty();
  }

  @Test
  public void testSourceFileNameIsInherited() {
    Node root = Node.newRoot("page.html");
    Node scope = Node.newToken(Token.SCOPE);
    Node a = variable("a").setLinenoCharno(2, 4);
    root.addChildToBack(scope);
    scope.addChildToBack(a);

    assertThat(a.getSourceFileName()).isEqualTo("page.html");
    assertThat(a.getLocation()).isEqualTo("page.html:2:4");
  }

  @Test
  public void testInnerSourceFileName() {
    Node root = Node.newRoot("page.html");
    Node scope = Node.newToken(Token.SCOPE);
    Node a = variable("a");
    root.addChildToBack(scope);
    scope.addChildToBack(a);

    scope.setSourceFileName("widget.js");

    assertThat(a.getSourceFileName()).isEqualTo("widget.js");
    assertThat(root.getSourceFileName()).isEqualTo("page.html");
  }

  @Test
  public void testToStringTree() {
    Node root = Node.newRoot("page.html");
    Node parens = Node.newToken(Token.PARENTHESES);
    root.addChildToBack(parens);
    parens.addChildToBack(variable("x").setLinenoCharno(1, 1));

    assertThat(root.toStringTree())
        .isEqualTo("ROOT 1:0\n    PARENTHESES\n        VARIABLE \"x\" 1:1\n");
  }
}
