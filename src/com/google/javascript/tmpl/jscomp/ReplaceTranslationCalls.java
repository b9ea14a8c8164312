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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.javascript.tmpl.lexer.Node;
import com.google.javascript.tmpl.lexer.Token;

/**
 * Finds calls of the translation function whose argument is a literal, such as
 *
 * <pre>
 * gettext("Hello " + "world")
 * </pre>
 *
 * reports their text to the {@link CompilationContext} and, when translating, replaces each call
 * with a string literal holding the translation.
 *
 * <p>Calls whose argument contains an embedded tag are left alone.
 */
final class ReplaceTranslationCalls implements CompilerPass {

  static final DiagnosticType MALFORMED_LITERAL_CALL =
      DiagnosticType.error(
          "JSC_MALFORMED_LITERAL_CALL",
          "Only string literals joined with + may be passed to {0}, found {1}");

  private final CompilerOptions options;
  private final CompilationContext context;
  private final TranslationCache translations;

  ReplaceTranslationCalls(
      CompilerOptions options, CompilationContext context, TranslationCache translations) {
    this.options = checkNotNull(options);
    this.context = checkNotNull(context);
    this.translations = checkNotNull(translations);
  }

  @Override
  public void process(Node root) {
    String functionName = options.getTranslationFunctionName();
    for (Node n :
        NodeUtil.collect(
            root,
            candidate ->
                candidate.isVariable()
                    && candidate.getOriginalName().equals(functionName)
                    && isCallContainer(candidate.getParent()))) {
      Node arguments = NodeUtil.getNextNonWhitespace(n);
      if (arguments != null && arguments.isParentheses() && !arguments.containsEmbeddedTag()) {
        visitCall(n, arguments);
      }
    }
  }

  private static boolean isCallContainer(Node parent) {
    return parent.isRoot() || parent.isScope() || parent.isParentheses()
        || parent.isSquareBrackets();
  }

  private void visitCall(Node function, Node arguments) {
    StringBuilder text = new StringBuilder();
    for (Node argument : arguments.children()) {
      if (argument.isOperator("+")) {
        continue;
      } else if (argument.isString()) {
        text.append(argument.getStringValue());
      } else {
        throw new JsCompilationException(
            JSError.make(
                argument, MALFORMED_LITERAL_CALL, function.getOriginalName(),
                argument.toSource()));
      }
    }

    context.rememberTranslation(function, text.toString());

    if (options.shouldTranslate()) {
      String translation = translations.resolve(options.getLocale(), text.toString());
      Node literal = Node.newToken(Token.DOUBLE_QUOTED_STRING);
      literal.addChildToBack(Node.newText(escape(translation)));

      while (function.getNext() != arguments) {
        function.getNext().detach();
      }
      arguments.detach();
      function.replaceWith(literal);
    }
  }

  /** Escapes a text for a double quoted string literal. */
  static String escape(String text) {
    return text.replace("\"", "\\\"").replace("\r", "\\r").replace("\n", "\\n");
  }
}
