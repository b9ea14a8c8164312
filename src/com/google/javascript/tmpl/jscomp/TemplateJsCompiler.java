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

import com.google.common.collect.ImmutableMap;
import com.google.javascript.tmpl.lexer.Node;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Compiles the scripts of templates: checks that their statements are terminated, removes
 * comments and needless whitespace, renames local variables and replaces literal calls of the
 * translation function with their translation.
 *
 * <p>A script is either plain source text ({@link #compileString}) or a node of the template tree
 * whose children are text fragments and embedded template tags ({@link #compile}). Embedded tags
 * are kept as they are, wherever they occur.
 *
 * <p>Compilation stops at the first error. The error is reported to the {@link ErrorHandler} and
 * thrown as a {@link JsCompilationException}.
 */
public class TemplateJsCompiler {
  private static final Logger logger = Logger.getLogger(TemplateJsCompiler.class.getName());

  private final CompilerOptions options;
  private final TranslationCache translations;
  private final ErrorHandler errorHandler;

  public TemplateJsCompiler() {
    this(new CompilerOptions());
  }

  /** Creates a compiler reading catalogs from the shared cache of the configured location. */
  public TemplateJsCompiler(CompilerOptions options) {
    this(options, TranslationCache.forOptions(options), new LoggerErrorHandler());
  }

  public TemplateJsCompiler(
      CompilerOptions options, TranslationCache translations, ErrorHandler errorHandler) {
    this.options = checkNotNull(options);
    this.translations = checkNotNull(translations);
    this.errorHandler = checkNotNull(errorHandler);
  }

  public CompilerOptions getOptions() {
    return options;
  }

  /**
   * Compiles the text and embedded tag children of {@code jsNode} in place. Afterwards its children
   * are the tokens of the compiled script.
   *
   * @throws JsCompilationException if the script is invalid
   */
  public void compile(Node jsNode, CompilationContext context) {
    checkNotNull(context);
    try {
      logger.fine("Tokenizing " + jsNode.getSourceFileName());
      JsLexer.tokenize(jsNode);
      for (Map.Entry<String, CompilerPass> pass : createPasses(context).entrySet()) {
        logger.fine("Running pass " + pass.getKey());
        pass.getValue().process(jsNode);
      }
    } catch (JsCompilationException e) {
      errorHandler.report(e.getError());
      throw e;
    }
  }

  /**
   * Compiles a whole script.
   *
   * @param sourceName the name errors are reported with
   * @return the compiled script
   * @throws JsCompilationException if the script is invalid
   */
  public String compileString(String js, String sourceName, CompilationContext context) {
    Node root = Node.newRoot(sourceName);
    root.addChildToBack(Node.newText(js).setLinenoCharno(1, 0));
    compile(root, context);
    return root.toSource();
  }

  /** The passes run after tokenizing, in order. */
  private ImmutableMap<String, CompilerPass> createPasses(CompilationContext context) {
    ImmutableMap.Builder<String, CompilerPass> passes = ImmutableMap.builder();
    if (options.shouldValidate()) {
      passes.put("checkStatementTermination", new CheckStatementTermination());
    }
    passes.put("compressWhitespace", new CompressWhitespace());
    passes.put(
        "replaceTranslationCalls", new ReplaceTranslationCalls(options, context, translations));
    passes.put("renameLocalVars", new RenameLocalVars());
    passes.put("fixNestedScopeSpacing", new FixNestedScopeSpacing());
    return passes.buildOrThrow();
  }
}
