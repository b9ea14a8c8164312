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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.javascript.tmpl.lexer.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Renames the variables declared inside functions to the shortest names available.
 *
 * <p>Names declared at the top level of the script are visible to other scripts of the page and
 * are never renamed. Inside a block, {@code var x} and {@code function x} declare {@code x}, and
 * the parameters of a function are declared in its body. Every other occurrence of a name is
 * linked to the innermost declaration of that name around it, so that it prints the declaration's
 * new name. Names without a declaration are free, and no variable is renamed to a free name.
 *
 * <p>Property names, after a dot or before the colon of an object literal, are not variables.
 */
final class RenameLocalVars implements CompilerPass {

  static final DiagnosticType MALFORMED_PARAMETER_LIST =
      DiagnosticType.error(
          "JSC_MALFORMED_PARAMETER_LIST", "Unexpected {0} in function parameter list");

  static final DiagnosticType MISSING_OPENING_GROUP =
      DiagnosticType.error("JSC_MISSING_OPENING_GROUP", "Expected ( after function keyword");

  static final DiagnosticType MISSING_FUNCTION_BODY =
      DiagnosticType.error("JSC_MISSING_FUNCTION_BODY", "Expected { after function parameters");

  private final NameGenerator nameGenerator;

  /** Every variable that declares a name. These are never resolved as references. */
  private final Set<Node> declarations = Sets.newIdentityHashSet();

  /** Names used but not declared in the script. */
  private final Set<String> freeNames = new LinkedHashSet<>();

  RenameLocalVars() {
    this(new ShortNameGenerator());
  }

  RenameLocalVars(NameGenerator nameGenerator) {
    this.nameGenerator = nameGenerator;
  }

  @Override
  public void process(Node root) {
    collectDeclarations(root, null);
    resolveReferences(root, new ArrayDeque<>());
    assignNames(root, freeNames);
  }

  /** Names referenced in the script without a declaration. Valid after {@link #process}. */
  Set<String> getFreeNames() {
    return freeNames;
  }

  // ==========================================================================
  // Declarations

  /**
   * Declares the names introduced among the children of {@code parent}.
   *
   * @param scope the innermost scope around {@code parent}, null at the top level
   */
  private void collectDeclarations(Node parent, @Nullable Node scope) {
    boolean nextIsDeclaration = false;
    for (Node c = parent.getFirstChild(); c != null; c = c.getNext()) {
      if (c.isKeyword("function") || c.isKeyword("var")) {
        nextIsDeclaration = scope != null;
        if (c.isKeyword("function")) {
          declareParameters(c);
        }
      } else if (c.isVariable() && nextIsDeclaration) {
        declare(scope, c);
        nextIsDeclaration = false;
      } else if (c.isScope()) {
        collectDeclarations(c, c);
        nextIsDeclaration = false;
      } else if (c.isWhitespace()) {
        continue;
      } else {
        if (!c.getToken().isLeaf()) {
          collectDeclarations(c, scope);
        }
        nextIsDeclaration = false;
      }
    }
  }

  /** Declares the parameters of the function introduced by {@code keyword} in its body. */
  private void declareParameters(Node keyword) {
    Node n = NodeUtil.getNextNonWhitespace(keyword);
    if (n != null && n.isVariable()) {
      n = NodeUtil.getNextNonWhitespace(n);
    }
    if (n == null || !n.isParentheses()) {
      throw new JsCompilationException(
          JSError.make(n != null ? n : keyword, MISSING_OPENING_GROUP));
    }
    ImmutableList<Node> parameters = parseParameterList(n);

    Node body = NodeUtil.getNextNonWhitespace(n);
    if (body == null || !body.isScope()) {
      throw new JsCompilationException(
          JSError.make(body != null ? body : n, MISSING_FUNCTION_BODY));
    }
    for (Node parameter : parameters) {
      declare(body, parameter);
    }
  }

  /** Reads the names of a parameter list: variables separated by commas. */
  private static ImmutableList<Node> parseParameterList(Node parameterList) {
    ImmutableList.Builder<Node> parameters = ImmutableList.builder();
    boolean needComma = false;
    for (Node n : parameterList.children()) {
      if (n.isWhitespace()) {
        continue;
      } else if (n.isVariable() && !needComma) {
        parameters.add(n);
        needComma = true;
      } else if (n.isComma() && needComma) {
        needComma = false;
      } else {
        throw malformedParameter(n);
      }
    }
    Node last = parameterList.getLastChild();
    if (last != null && !needComma) {
      throw malformedParameter(last);
    }
    return parameters.build();
  }

  private static JsCompilationException malformedParameter(Node n) {
    return new JsCompilationException(JSError.make(n, MALFORMED_PARAMETER_LIST, n.toSource()));
  }

  private void declare(Node scope, Node variable) {
    Map<String, Node> symbolTable = scope.getSymbolTable();
    Node existing = symbolTable.get(variable.getOriginalName());
    if (existing != null) {
      // Declared twice in the same scope, as in "function(a) { var a; }". Both keep one name.
      variable.linkTo(existing);
    } else {
      symbolTable.put(variable.getOriginalName(), variable);
    }
    declarations.add(variable);
  }

  // ==========================================================================
  // References

  /**
   * Links the variables among the children of {@code parent} to their declarations.
   *
   * @param scopes the enclosing scopes, innermost first
   */
  private void resolveReferences(Node parent, Deque<Node> scopes) {
    boolean afterDot = false;
    for (Node c = parent.getFirstChild(); c != null; c = c.getNext()) {
      if (c.isOperator()) {
        afterDot = c.isOperator(".");
      } else if (c.isVariable()) {
        if (!afterDot && !isPropertyKey(c) && !declarations.contains(c)) {
          resolve(c, scopes);
        }
        afterDot = false;
      } else if (c.isScope()) {
        scopes.push(c);
        resolveReferences(c, scopes);
        scopes.pop();
      } else if (!c.getToken().isLeaf()) {
        resolveReferences(c, scopes);
      }
    }
  }

  /** Whether {@code variable} is the key of an object literal entry, as in "{key: value}". */
  private static boolean isPropertyKey(Node variable) {
    Node next = variable.getNext();
    if (next == null || !next.isColon()) {
      return false;
    }
    Node previous = variable.getPrevious();
    if (previous != null && previous.isOperator("?")) {
      return false;
    }
    Node previousToken = NodeUtil.getPreviousNonWhitespace(variable);
    return previousToken == null || !previousToken.isKeyword("case");
  }

  private void resolve(Node variable, Deque<Node> scopes) {
    String name = variable.getOriginalName();
    for (Node scope : scopes) {
      Node declaration = scope.getSymbolTable().get(name);
      if (declaration != null) {
        variable.linkTo(declaration);
        return;
      }
    }
    freeNames.add(name);
  }

  // ==========================================================================
  // Names

  /**
   * Names the declarations of every scope at or below {@code n}.
   *
   * @param reservedNames the names that are taken where {@code n} is
   */
  private void assignNames(Node n, Set<String> reservedNames) {
    Set<String> taken = reservedNames;
    if (n.isScope() && !n.getSymbolTable().isEmpty()) {
      taken = new HashSet<>(reservedNames);
      nameGenerator.reset(taken);
      for (Node declaration : n.getSymbolTable().values()) {
        String newName = nameGenerator.generateNextName();
        declaration.setNewName(newName);
        taken.add(newName);
      }
    }

    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (!c.getToken().isLeaf()) {
        assignNames(c, taken);
      }
    }
  }
}
