/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST endpoints under {@code /api/v1}</li>
 *   <li>{@code presentation.dto} - request and response records</li>
 *   <li>{@code presentation.exception} - mapping of domain exceptions to HTTP responses</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Controllers are thin adapters - conversion logic lives in services</li>
 *   <li>Controllers never throw HTTP-specific exceptions (use domain exceptions)</li>
 * </ul>
 */
package com.phillippitts.mathwords.presentation;
