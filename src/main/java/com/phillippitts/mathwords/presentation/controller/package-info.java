/**
 * REST API controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/verbalize} - one expression</li>
 *   <li>{@code POST /api/v1/verbalize/batch} - ordered list of expressions, fail-fast</li>
 *   <li>{@code GET /api/v1/styles} - registered speech style names</li>
 *   <li>{@code GET /api/v1/version} - library version</li>
 * </ul>
 */
package com.phillippitts.mathwords.presentation.controller;
