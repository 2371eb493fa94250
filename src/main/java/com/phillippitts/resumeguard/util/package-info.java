/**
 * Small utilities shared across services.
 *
 * @since 1.0
 */
package com.phillippitts.resumeguard.util;
