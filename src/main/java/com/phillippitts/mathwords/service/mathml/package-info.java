/**
 * Presentation MathML input.
 */
package com.phillippitts.mathwords.service.mathml;
