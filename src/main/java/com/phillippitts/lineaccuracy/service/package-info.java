/**
 * Service layer: the line accuracy engine.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.text} - tokenizing script lines and transcripts, parenthetical stripping,
 *       build-mode segmentation</li>
 *   <li>{@code service.match} - word tables and the word comparator</li>
 *   <li>{@code service.align} - batch, locked, subsequence and word-by-word aligners</li>
 *   <li>{@code service.metrics} - Micrometer instrumentation</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Everything below {@link com.phillippitts.lineaccuracy.service.LineAccuracyService} is plain Java
 *       and can be constructed directly in tests</li>
 *   <li>No string input raises an exception</li>
 *   <li>Word tables are loaded once and shared read-only, so every call is thread-safe</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.lineaccuracy.service;
