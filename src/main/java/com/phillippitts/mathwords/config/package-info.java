/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.mathwords.config.ThreadPoolConfig} - executor for parallel
 *       batch verbalization</li>
 *   <li>{@link com.phillippitts.mathwords.config.properties.MathWordsProperties} - default style,
 *       input length limit and batch settings ({@code mathwords.*})</li>
 *   <li>{@link com.phillippitts.mathwords.config.properties.ThreadPoolProperties} - pool sizing
 *       ({@code threadpool.verbalizer.*})</li>
 * </ul>
 */
package com.phillippitts.mathwords.config;
