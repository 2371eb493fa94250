/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST endpoints used by the host front end</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.resumeguard.presentation;
