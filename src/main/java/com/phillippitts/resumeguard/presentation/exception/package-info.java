/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>Validation failures, unreadable bodies, {@code IllegalArgumentException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.resumeguard.exception.ResumeGuardException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "MethodArgumentNotValidException",
 *   "message": "Invalid request",
 *   "details": "busy must not be null",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.resumeguard.exception
 * @since 1.0
 */
package com.phillippitts.resumeguard.presentation.exception;
