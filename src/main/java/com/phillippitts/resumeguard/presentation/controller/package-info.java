/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>The host front end drives the coordinator through these endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.resumeguard.presentation.controller.VisibilityController}
 *       - visibility transitions ({@code POST /api/visibility}) and consumer attach/release
 *       ({@code /api/visibility/consumers/{consumerId}})</li>
 *   <li>{@link com.phillippitts.resumeguard.presentation.controller.LoadingStateController}
 *       - loading indicators ({@code /api/loading/{id}})</li>
 *   <li>{@link com.phillippitts.resumeguard.presentation.controller.RecoveryController}
 *       - manual refresh ({@code POST /api/recovery/refresh}) and status</li>
 *   <li>{@link com.phillippitts.resumeguard.presentation.controller.NotificationController}
 *       - recent notifications ({@code GET /api/notifications})</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; exceptions are left to {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.resumeguard.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.resumeguard.presentation.controller;
