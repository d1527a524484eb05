/**
 * LaTeX math lexer and parser.
 *
 * <p>{@link com.phillippitts.mathwords.service.latex.LatexLexer} produces a flat token list;
 * {@link com.phillippitts.mathwords.service.latex.LatexParser} resolves every control sequence
 * through the command registry and builds the expression tree. Author-defined macros are not
 * expanded: they fail as unknown commands.
 */
package com.phillippitts.mathwords.service.latex;
