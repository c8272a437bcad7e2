/**
 * Immutable values exchanged with callers of the line accuracy engine.
 *
 * <p>All types are Java records created fresh per call. The one exception to "per call" is
 * {@link com.phillippitts.lineaccuracy.domain.LockedWordState}, which the caller threads through
 * repeated live-matching calls for a single line and replaces with a fresh state for the next line.
 *
 * <ul>
 *   <li>{@link com.phillippitts.lineaccuracy.domain.AccuracyResult} - pass/fail verdict for a finished attempt</li>
 *   <li>{@link com.phillippitts.lineaccuracy.domain.LockedWordState} - monotonic live progress</li>
 *   <li>{@link com.phillippitts.lineaccuracy.domain.SubsequenceMatchResult} - gap-tolerant live progress</li>
 *   <li>{@link com.phillippitts.lineaccuracy.domain.WordByWordResult} - per-word rendering verdicts</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.lineaccuracy.domain;
