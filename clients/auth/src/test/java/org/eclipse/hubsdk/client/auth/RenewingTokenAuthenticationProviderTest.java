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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.net.HttpURLConnection;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.test.MockTimers;
import org.eclipse.hubsdk.test.VertxMockSupport;
import org.eclipse.hubsdk.util.SharedAccessSignature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Tests verifying the renewal logic of {@link RenewingTokenAuthenticationProvider}
 * for asynchronously created signatures.
 *
 */
public class RenewingTokenAuthenticationProviderTest {

    private Vertx vertx;
    private MockTimers timers;
    private Clock clock;
    private List<Promise<SharedAccessSignature>> signRequests;
    private List<Credential> newCredentials;
    private List<Throwable> errors;
    private RenewingTokenAuthenticationProvider provider;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        vertx = VertxMockSupport.mockVertx();
        timers = VertxMockSupport.captureTimers(vertx);
        clock = mock(Clock.class);
        when(clock.millis()).thenReturn(1_000_000L);
        signRequests = new ArrayList<>();
        newCredentials = new ArrayList<>();
        errors = new ArrayList<>();
        provider = new RenewingTokenAuthenticationProvider(vertx, clock, "hub", null, "device", null, 3600, 900) {
            @Override
            protected Future<SharedAccessSignature> sign(final String resourceUri, final long expiryEpochSeconds) {
                final Promise<SharedAccessSignature> result = Promise.promise();
                signRequests.add(result);
                return result.future();
            }
        };
        provider.addNewCredentialListener(newCredentials::add);
        provider.addErrorListener(errors::add);
    }

    private static SharedAccessSignature signature(final long expiry) {
        return SharedAccessSignature.parse("SharedAccessSignature sr=hub%2Fdevices%2Fdevice&sig=abc&se=" + expiry);
    }

    /**
     * Verifies that concurrent requests share a single signing request.
     */
    @Test
    public void testConcurrentRequestsShareRenewal() {

        final Future<Credential> first = provider.getCredential();
        final Future<Credential> second = provider.getCredential();
        assertThat(signRequests).hasSize(1);

        signRequests.get(0).complete(signature(4600));

        assertThat(first.succeeded()).isTrue();
        assertThat(second.result()).isEqualTo(first.result());
        assertThat(newCredentials).hasSize(1);
    }

    /**
     * Verifies that a signing failure on the caller's path is reported to the caller only.
     */
    @Test
    public void testSigningFailureIsReportedToCaller() {

        final Future<Credential> result = provider.getCredential();
        signRequests.get(0).fail(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE));

        assertThat(result.failed()).isTrue();
        assertThat(errors).isEmpty();
        assertThat(provider.isRenewalScheduled()).isFalse();

        // the next request tries again
        provider.getCredential();
        assertThat(signRequests).hasSize(2);
    }

    /**
     * Verifies that a signing failure during proactive renewal is reported to the error listeners.
     */
    @Test
    public void testSigningFailureOnTimerIsReportedToErrorListeners() {

        provider.getCredential();
        signRequests.get(0).complete(signature(4600));

        timers.fireNext();
        final ServerErrorException error = new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE);
        signRequests.get(1).fail(error);

        assertThat(errors).containsExactly(error);
        assertThat(newCredentials).hasSize(1);
    }

    /**
     * Verifies that a signature which is created after the provider has been stopped
     * does not lead to notifications or a new timer.
     */
    @Test
    public void testStopDuringRenewalSuppressesNotification() {

        final Future<Credential> result = provider.getCredential();
        provider.stop();
        signRequests.get(0).complete(signature(4600));

        assertThat(result.succeeded()).isTrue();
        assertThat(newCredentials).isEmpty();
        assertThat(timers.pendingCount()).isEqualTo(0);
    }

    /**
     * Verifies that a failed proactive renewal is retried after a short delay and that
     * regular renewal resumes once the retry succeeds.
     */
    @Test
    public void testFailedRenewalOnTimerIsRetried() {

        provider.getCredential();
        signRequests.get(0).complete(signature(4600));
        assertThat(timers.getRequestedDelays()).containsExactly(2_700_000L);

        timers.fireNext();
        signRequests.get(1).fail(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE));

        assertThat(errors).hasSize(1);
        assertThat(provider.isRenewalScheduled()).isTrue();
        assertThat(timers.getRequestedDelays()).containsExactly(2_700_000L, RenewingTokenAuthenticationProvider.RENEWAL_RETRY_DELAY_MILLIS);

        timers.fireNext();
        assertThat(signRequests).hasSize(3);
        signRequests.get(2).complete(signature(4600));

        assertThat(newCredentials).hasSize(2);
        assertThat(timers.getRequestedDelays()).containsExactly(
                2_700_000L, RenewingTokenAuthenticationProvider.RENEWAL_RETRY_DELAY_MILLIS, 2_700_000L);
        assertThat(timers.pendingCount()).isEqualTo(1);
    }

    /**
     * Verifies that the retry of a failed renewal is scheduled before the current signature expires.
     */
    @Test
    public void testRetryOfFailedRenewalHappensBeforeExpiry() {

        provider.getCredential();
        // a signature that expires in three seconds
        signRequests.get(0).complete(signature(1003));

        timers.fireNext();
        signRequests.get(1).fail(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE));

        assertThat(timers.getRequestedDelays()).containsExactly(2_700_000L, 3000L);
    }

    /**
     * Verifies that a stopped provider does not retry a renewal that fails after it has been stopped.
     */
    @Test
    public void testFailedRenewalIsNotRetriedAfterStop() {

        provider.getCredential();
        signRequests.get(0).complete(signature(4600));
        timers.fireNext();
        provider.stop();

        signRequests.get(1).fail(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE));

        assertThat(provider.isRenewalScheduled()).isFalse();
        assertThat(timers.pendingCount()).isEqualTo(0);
    }

    /**
     * Verifies that requesting a credential after the provider has been stopped during
     * a renewal starts a new renewal which schedules the next one.
     */
    @Test
    public void testGetCredentialAfterStopDuringRenewalResumesRenewal() {

        provider.getCredential();
        provider.stop();

        final Future<Credential> result = provider.getCredential();
        assertThat(signRequests).hasSize(2);
        signRequests.get(0).complete(signature(4600));
        signRequests.get(1).complete(signature(4600));

        assertThat(result.succeeded()).isTrue();
        assertThat(newCredentials).hasSize(1);
        assertThat(provider.isRenewalScheduled()).isTrue();
        assertThat(timers.pendingCount()).isEqualTo(1);
    }

    /**
     * Verifies that requesting a still valid credential after the provider has been stopped
     * resumes the proactive renewal.
     */
    @Test
    public void testGetCredentialAfterStopResumesRenewal() {

        provider.getCredential();
        signRequests.get(0).complete(signature(4600));
        provider.stop();
        assertThat(provider.isRenewalScheduled()).isFalse();

        final Future<Credential> result = provider.getCredential();

        assertThat(result.succeeded()).isTrue();
        assertThat(signRequests).hasSize(1);
        assertThat(provider.isRenewalScheduled()).isTrue();
        assertThat(timers.getRequestedDelays()).containsExactly(2_700_000L, 2_700_000L);
    }
}
