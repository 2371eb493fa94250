/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.resumeguard.exception.ResumeGuardException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.resumeguard.exception.SessionRefreshException} - Thrown when the
 *       remote auth service cannot refresh the session</li>
 *   <li>{@link com.phillippitts.resumeguard.exception.SessionExpiredException} - Thrown by wrapped
 *       operations whose session was rejected; always classified as an auth failure</li>
 *   <li>{@link com.phillippitts.resumeguard.exception.OperationTimeoutException} - Thrown when an
 *       attempt exceeds its per-attempt timeout</li>
 * </ul>
 *
 * @see com.phillippitts.resumeguard.exception.ResumeGuardException
 * @see com.phillippitts.resumeguard.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.resumeguard.exception;
