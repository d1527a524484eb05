/**
 * Service layer: the verbalization engine and its public facade.
 *
 * <p>Data flows one way: source text, {@code service.latex} lexer and parser (or the
 * {@code service.mathml} reader), an immutable {@code domain.tree} expression, then the
 * {@code service.verbalize} renderer with a style from {@code service.style}.
 * {@link com.phillippitts.mathwords.service.MathWordsService} validates input and ties the
 * stages together.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.registry} - command table and closed operator vocabularies</li>
 *   <li>{@code service.latex} - lexer and precedence-climbing parser</li>
 *   <li>{@code service.mathml} - presentation MathML reader</li>
 *   <li>{@code service.style} - named speech styles</li>
 *   <li>{@code service.verbalize} - tree-to-English renderer</li>
 *   <li>{@code service.metrics}, {@code service.health} - Micrometer and actuator hooks</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans using constructor injection</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services are thread-safe for concurrent requests</li>
 * </ul>
 */
package com.phillippitts.mathwords.service;
