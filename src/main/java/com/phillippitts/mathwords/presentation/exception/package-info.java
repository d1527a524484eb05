/**
 * Global exception handling for HTTP responses.
 */
package com.phillippitts.mathwords.presentation.exception;
