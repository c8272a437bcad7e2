/**
 * Maps exceptions raised behind the REST boundary to {@code ApiError} responses.
 *
 * @since 1.0
 */
package com.phillippitts.lineaccuracy.presentation.exception;
