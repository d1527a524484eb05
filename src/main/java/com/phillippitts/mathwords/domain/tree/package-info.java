/**
 * Immutable expression tree.
 *
 * <p>{@link com.phillippitts.mathwords.domain.tree.MathNode} is a sealed interface with one record
 * per construct. Trees are built per call and never shared between calls.
 */
package com.phillippitts.mathwords.domain.tree;
