/*******************************************************************************
 * Copyright (c) 2024 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 *******************************************************************************/


package org.eclipse.hubsdk.client.auth;

import java.time.Clock;
import java.util.Objects;

import org.eclipse.hubsdk.util.Constants;
import org.eclipse.hubsdk.util.SharedAccessSignature;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * A provider of shared access signatures that renews the signature proactively.
 * <p>
 * A new signature is valid for a configurable amount of time. When a signature is created,
 * a timer is set to create the next signature a configurable margin before the current one expires.
 * {@link #getCredential()} also creates a new signature if the current one is within the margin
 * of its expiry.
 * <p>
 * Subclasses implement the actual creation of a signature.
 */
public abstract class RenewingTokenAuthenticationProvider extends AbstractAuthenticationProvider {

    /**
     * The default number of seconds that a signature is valid for.
     */
    public static final long DEFAULT_TOKEN_VALIDITY_SECONDS = 3600;
    /**
     * The default number of seconds before expiry that a signature is renewed.
     */
    public static final long DEFAULT_TOKEN_RENEWAL_MARGIN_SECONDS = 900;
    /**
     * The maximum number of milliseconds to wait before retrying a failed proactive renewal.
     */
    public static final long RENEWAL_RETRY_DELAY_MILLIS = 10_000L;
    private static final long MIN_RENEWAL_RETRY_DELAY_MILLIS = 1000L;

    /**
     * The vert.x instance that timers are set on.
     */
    protected final Vertx vertx;
    private final Clock clock;
    private final String hostName;
    private final String gatewayHostName;
    private final String deviceId;
    private final String moduleId;

    private long tokenValiditySeconds;
    private long tokenRenewalMarginSeconds;
    private SharedAccessSignature currentSignature;
    private Long renewalTimerId;
    private long generation;
    private Future<Credential> renewalInProgress;

    /**
     * Creates a new provider.
     *
     * @param vertx The vert.x instance to use for setting timers.
     * @param clock The clock to determine expiry with.
     * @param hostName The host name of the hub.
     * @param gatewayHostName The host name of the gateway or {@code null}.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @param tokenValiditySeconds The number of seconds that a signature is valid for.
     * @param tokenRenewalMarginSeconds The number of seconds before expiry that a signature is renewed.
     * @throws NullPointerException if any of vertx, clock, host name or device ID are {@code null}.
     * @throws IllegalArgumentException if the validity is not greater than the margin.
     */
    protected RenewingTokenAuthenticationProvider(
            final Vertx vertx,
            final Clock clock,
            final String hostName,
            final String gatewayHostName,
            final String deviceId,
            final String moduleId,
            final long tokenValiditySeconds,
            final long tokenRenewalMarginSeconds) {

        this.vertx = Objects.requireNonNull(vertx);
        this.clock = Objects.requireNonNull(clock);
        this.hostName = Objects.requireNonNull(hostName);
        this.deviceId = Objects.requireNonNull(deviceId);
        this.gatewayHostName = gatewayHostName;
        this.moduleId = moduleId;
        validateRenewalValues(tokenValiditySeconds, tokenRenewalMarginSeconds);
        this.tokenValiditySeconds = tokenValiditySeconds;
        this.tokenRenewalMarginSeconds = tokenRenewalMarginSeconds;
    }

    private static void validateRenewalValues(final long validity, final long margin) {
        if (margin < 0) {
            throw new IllegalArgumentException("renewal margin must not be negative");
        }
        if (validity <= margin) {
            throw new IllegalArgumentException("token validity must be greater than renewal margin");
        }
    }

    /**
     * Creates a signature for the identity's resource URI.
     *
     * @param resourceUri The (unencoded) resource URI.
     * @param expiryEpochSeconds The point in time at which the signature expires.
     * @return A future indicating the outcome.
     */
    protected abstract Future<SharedAccessSignature> sign(String resourceUri, long expiryEpochSeconds);

    @Override
    public final AuthenticationType getType() {
        return AuthenticationType.TOKEN;
    }

    /**
     * Gets the resource URI that signatures grant access to.
     *
     * @return The URI.
     */
    protected final String getResourceUri() {
        return hostName + Constants.identityPath(deviceId, moduleId);
    }

    /**
     * Gets the host name of the hub.
     *
     * @return The host name.
     */
    public final String getHostName() {
        return hostName;
    }

    /**
     * Gets the identifier of the device that signatures are created for.
     *
     * @return The identifier.
     */
    public final String getDeviceId() {
        return deviceId;
    }

    /**
     * Gets the identifier of the module that signatures are created for.
     *
     * @return The identifier or {@code null} if signatures are created for the device itself.
     */
    public final String getModuleId() {
        return moduleId;
    }

    /**
     * Gets the number of seconds that a new signature is valid for.
     *
     * @return The seconds.
     */
    public final long getTokenValiditySeconds() {
        return tokenValiditySeconds;
    }

    /**
     * Gets the number of seconds before expiry that a signature is renewed.
     *
     * @return The seconds.
     */
    public final long getTokenRenewalMarginSeconds() {
        return tokenRenewalMarginSeconds;
    }

    /**
     * Checks if a renewal timer is currently armed.
     *
     * @return {@code true} if a timer is pending.
     */
    public final boolean isRenewalScheduled() {
        return renewalTimerId != null;
    }

    private long nowSeconds() {
        return clock.millis() / 1000;
    }

    private Credential toCredential(final SharedAccessSignature signature) {
        return Credential.forSignature(hostName, gatewayHostName, deviceId, moduleId, signature);
    }

    private boolean shouldRenew() {
        return currentSignature == null
                || currentSignature.getExpiry() - nowSeconds() < tokenRenewalMarginSeconds;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Creates a new signature if none exists yet or if the current one expires within the renewal margin.
     * Otherwise the current signature is returned and renewal is scheduled if it has been stopped.
     */
    @Override
    public final Future<Credential> getCredential() {
        if (shouldRenew()) {
            return renew();
        }
        if (renewalInProgress == null && !isRenewalScheduled()) {
            final long delayMillis = (currentSignature.getExpiry() - tokenRenewalMarginSeconds) * 1000 - clock.millis();
            armRenewalTimer(Math.max(0, delayMillis), generation);
        }
        return Future.succeededFuture(toCredential(currentSignature));
    }

    /**
     * Creates a new signature and sets a timer for creating the next one.
     * <p>
     * Concurrent invocations share the same outcome.
     *
     * @return A future indicating the outcome.
     */
    protected final Future<Credential> renew() {

        if (renewalInProgress != null) {
            return renewalInProgress;
        }
        cancelRenewalTimer();
        final long renewalGeneration = ++generation;
        final long expiry = nowSeconds() + tokenValiditySeconds;
        log.debug("creating new signature for {} [expiry: {}]", getResourceUri(), expiry);

        final Future<SharedAccessSignature> signature;
        try {
            signature = sign(getResourceUri(), expiry);
        } catch (final RuntimeException e) {
            return Future.failedFuture(e);
        }
        final Future<Credential> result = signature
                .map(sas -> {
                    currentSignature = sas;
                    final Credential credential = toCredential(sas);
                    if (renewalGeneration == generation) {
                        scheduleRenewal(renewalGeneration);
                        notifyNewCredential(credential);
                    }
                    return credential;
                })
                .onFailure(t -> log.debug("failed to create signature for {}", getResourceUri(), t))
                .onComplete(ar -> {
                    if (renewalGeneration == generation) {
                        renewalInProgress = null;
                    }
                });
        if (!result.isComplete()) {
            renewalInProgress = result;
        }
        return result;
    }

    private void scheduleRenewal(final long renewalGeneration) {
        armRenewalTimer((tokenValiditySeconds - tokenRenewalMarginSeconds) * 1000, renewalGeneration);
    }

    /**
     * Schedules another attempt after a failed proactive renewal.
     * <p>
     * The attempt is made before the current signature expires, if it has not expired already.
     */
    private void scheduleRenewalRetry(final long renewalGeneration) {
        long delayMillis = RENEWAL_RETRY_DELAY_MILLIS;
        if (currentSignature != null) {
            final long untilExpiryMillis = currentSignature.getExpiry() * 1000 - clock.millis();
            delayMillis = Math.min(delayMillis, untilExpiryMillis);
        }
        armRenewalTimer(Math.max(MIN_RENEWAL_RETRY_DELAY_MILLIS, delayMillis), renewalGeneration);
    }

    private void armRenewalTimer(final long delayMillis, final long timerGeneration) {
        renewalTimerId = vertx.setTimer(delayMillis, tid -> {
            if (timerGeneration != generation) {
                log.trace("ignoring superseded renewal timer");
                return;
            }
            renewalTimerId = null;
            log.debug("renewing signature for {}", getResourceUri());
            final Future<Credential> renewal = renew();
            final long renewalGeneration = generation;
            renewal.onFailure(t -> {
                notifyError(t);
                if (renewalGeneration == generation && !isRenewalScheduled()) {
                    log.debug("retrying renewal of signature for {}", getResourceUri());
                    scheduleRenewalRetry(renewalGeneration);
                }
            });
        });
        log.trace("scheduled renewal of signature in {}ms", delayMillis);
    }

    private void cancelRenewalTimer() {
        if (renewalTimerId != null) {
            vertx.cancelTimer(renewalTimerId);
            renewalTimerId = null;
        }
    }

    /**
     * Sets the validity period and renewal margin of new signatures.
     * <p>
     * If a renewal is currently scheduled, a new signature is created immediately
     * and the renewal is rescheduled based on the new values.
     *
     * @param tokenValiditySeconds The number of seconds that a signature is valid for.
     * @param tokenRenewalMarginSeconds The number of seconds before expiry that a signature is renewed.
     * @return A future indicating the outcome of the immediate renewal or a succeeded future
     *         if no renewal was scheduled.
     * @throws IllegalArgumentException if the validity is not greater than the margin.
     */
    public final Future<Void> setTokenRenewalValues(final long tokenValiditySeconds, final long tokenRenewalMarginSeconds) {
        validateRenewalValues(tokenValiditySeconds, tokenRenewalMarginSeconds);
        this.tokenValiditySeconds = tokenValiditySeconds;
        this.tokenRenewalMarginSeconds = tokenRenewalMarginSeconds;
        if (isRenewalScheduled()) {
            log.debug("renewal values changed, renewing signature for {}", getResourceUri());
            return renew().mapEmpty();
        }
        return Future.succeededFuture();
    }

    /**
     * Replaces the current signature.
     * <p>
     * The given signature is used until the next renewal.
     *
     * @param sharedAccessSignature The serialized signature.
     * @throws NullPointerException if signature is {@code null}.
     * @throws org.eclipse.hubsdk.util.MalformedSignatureException if the signature cannot be parsed.
     */
    public final void updateSharedAccessSignature(final String sharedAccessSignature) {
        Objects.requireNonNull(sharedAccessSignature);
        log.debug("replacing signature of {} while automatic renewal is active", getResourceUri());
        currentSignature = SharedAccessSignature.parse(sharedAccessSignature);
        notifyNewCredential(toCredential(currentSignature));
    }

    /**
     * {@inheritDoc}
     * <p>
     * Cancels the pending renewal. A subsequent invocation of {@link #getCredential()} resumes
     * renewal.
     */
    @Override
    public final Future<Void> stop() {
        generation++;
        cancelRenewalTimer();
        renewalInProgress = null;
        log.debug("stopped renewal of signatures for {}", getResourceUri());
        return Future.succeededFuture();
    }
}
