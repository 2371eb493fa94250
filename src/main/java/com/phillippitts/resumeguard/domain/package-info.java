/**
 * Value types shared by the recovery services: the host visibility state and the session
 * returned by the remote auth client.
 *
 * @since 1.0
 */
package com.phillippitts.resumeguard.domain;
