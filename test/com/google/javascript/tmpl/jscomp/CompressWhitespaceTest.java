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

import static com.google.common.truth.Truth.assertThat;

import com.google.javascript.tmpl.lexer.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompressWhitespaceTest {

  private static Node parse(String js) {
    Node root = Node.newRoot("test.js");
    root.addChildToBack(Node.newText(js));
    JsLexer.tokenize(root);
    return root;
  }

  private static String compress(String js) {
    Node root = parse(js);
    new CompressWhitespace().process(root);
    return root.toSource();
  }

  @Test
  public void testWhitespaceShrinks() {
    assertThat(compress("var   x  =  1 ;")).isEqualTo("var x=1;");
    assertThat(compress("typeof  x")).isEqualTo("typeof x");
    assertThat(compress("{var\n\tx}")).isEqualTo("{var x}");
  }

  @Test
  public void testLeadingAndTrailingWhitespace() {
    assertThat(compress("  a  ")).isEqualTo("a");
  }

  @Test
  public void testInOperators() {
    assertThat(compress("if (a in b) {}")).isEqualTo("if(a in b){}");
    assertThat(compress("a  instanceof  B")).isEqualTo("a instanceof B");
  }

  @Test
  public void testOperatorsThatWouldMerge() {
    assertThat(compress("a - -b")).isEqualTo("a- -b");
    assertThat(compress("a + ++b")).isEqualTo("a+ ++b");
    assertThat(compress("a++ + b")).isEqualTo("a++ +b");
    assertThat(compress("a - --b")).isEqualTo("a- --b");
    assertThat(compress("a - +b")).isEqualTo("a-+b");
    assertThat(compress("x = a / /re/.source.length;")).isEqualTo("x=a/ /re/.source.length;");
    assertThat(compress("x = 1 .toString();")).isEqualTo("x=1 .toString();");
    assertThat(compress("x = 1.5 * 2;")).isEqualTo("x=1.5*2;");
  }

  @Test
  public void testRegexAfterOperator() {
    assertThat(compress("x = y || /a/;")).isEqualTo("x=y||/a/;");
    assertThat(compress("x = [/a/, /b/];")).isEqualTo("x=[/a/,/b/];");
  }

  @Test
  public void testLiteralsAreKept() {
    assertThat(compress("x = \"a   b\";")).isEqualTo("x=\"a   b\";");
    assertThat(compress("x = / a  b /;")).isEqualTo("x=/ a  b /;");
  }

  @Test
  public void testIdempotent() {
    Node root = parse("a - -b;\nif (x in y) {  z( 1 .toFixed() ); }");
    CompressWhitespace pass = new CompressWhitespace();

    pass.process(root);
    String once = root.toSource();
    pass.process(root);

    assertThat(root.toSource()).isEqualTo(once);
    assertThat(once).isEqualTo("a- -b;if(x in y){z(1 .toFixed());}");
  }
}
