/**
 * Application-specific exception hierarchy.
 *
 * <p>The matching engine itself never throws for malformed text; every input resolves to a defined
 * result. Exceptions here cover startup and configuration failures only.
 *
 * <ul>
 *   <li>{@link com.phillippitts.lineaccuracy.exception.LineAccuracyException} - base for all
 *       application-specific errors</li>
 *   <li>{@link com.phillippitts.lineaccuracy.exception.WordTableException} - a word table resource
 *       is missing or unreadable</li>
 * </ul>
 *
 * @see com.phillippitts.lineaccuracy.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.lineaccuracy.exception;
