/**
 * Logging infrastructure: request-scoped MDC values for Log4j 2.
 *
 * @since 1.0
 */
package com.phillippitts.lineaccuracy.config.logging;
