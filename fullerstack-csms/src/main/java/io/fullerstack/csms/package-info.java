/**
 * Central system for OCPP 1.6 charge points.
 * <p>
 * The core of this module is the per-charge-point session and transaction state machine
 * ({@link io.fullerstack.csms.session.SessionCoordinator}) together with the connection
 * liveness layer ({@link io.fullerstack.csms.connection}) and the authorization cache
 * ({@link io.fullerstack.csms.auth.AuthorizationCache}). Storage and wire framing are
 * collaborators reached through {@link io.fullerstack.csms.store.ChargingStore} and
 * {@link io.fullerstack.csms.connection.ChargePointConnection}.
 * </p>
 */
package io.fullerstack.csms;
