/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application, following a
 * 3-tier architecture where presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for the accuracy API</li>
 *   <li>{@code presentation.dto} - request/response records for API contracts</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; scoring and alignment live in the service layer.
 *
 * @since 1.0
 */
package com.phillippitts.lineaccuracy.presentation;
