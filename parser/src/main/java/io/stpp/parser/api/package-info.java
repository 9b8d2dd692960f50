/**
 * Public API of the stpp preprocessor.
 *
 * <p><b>Directives</b>
 *
 * <ul>
 *   <li>{@code #if <expr>}, {@code #elif <expr>}, {@code #else}, {@code #endif} select spans of
 *       text. Only the first branch whose guard is true is emitted.
 *   <li>{@code #define <tag>} and {@code #undef <tag>} update the {@link io.stpp.parser.api.TagContext}.
 *   <li>Any other word after the marker is copied to the output unchanged.
 * </ul>
 *
 * <p><b>Expressions</b> are built from tag names, {@code !}, {@code &&}, {@code ||}, {@code ^} and
 * parentheses. A tag is true when it is defined. Binary operators have no precedence: each one
 * combines its left operand with the whole rest of the expression, so {@code a && b || c} means
 * {@code a && (b || c)}.
 *
 * <p><b>Errors</b> are fatal and reported as {@link io.stpp.parser.api.StppException}; warnings go
 * to the configured {@link io.stpp.parser.api.DiagnosticListener}.
 */
package io.stpp.parser.api;
