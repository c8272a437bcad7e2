/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints (all under {@code /api/accuracy}):
 * <ul>
 *   <li>{@code POST /check} - score a finished attempt</li>
 *   <li>{@code POST /realtime}, {@code POST /locked}, {@code GET /locked/fresh} - live progress</li>
 *   <li>{@code POST /subsequence} - gap-tolerant live progress</li>
 *   <li>{@code POST /word-by-word} - per-word verdicts for rendering</li>
 *   <li>{@code POST /segments} - build-mode segments of a line</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.lineaccuracy.presentation.controller;
