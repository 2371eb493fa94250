/**
 * Logging infrastructure: request-scoped MDC population for Log4j2.
 */
package com.phillippitts.resumeguard.config.logging;
