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

package org.eclipse.hubsdk.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.eclipse.hubsdk.util.Constants;
import org.junit.jupiter.api.Test;


/**
 * Tests verifying behavior of {@link ClientConfigProperties}.
 *
 */
public class ClientConfigPropertiesTest {

    /**
     * Verifies the default values.
     */
    @Test
    public void testDefaults() {

        final ClientConfigProperties props = new ClientConfigProperties();
        assertThat(props.getPort()).isEqualTo(Constants.PORT_AMQPS);
        assertThat(props.isTlsEnabled()).isTrue();
        assertThat(props.getPutTokenTimeout()).isEqualTo(ClientConfigProperties.DEFAULT_PUT_TOKEN_TIMEOUT);
        assertThat(props.getOperationTimeout()).isEqualTo(ClientConfigProperties.DEFAULT_OPERATION_TIMEOUT);
        assertThat(props.getTrustOptions()).isNull();
    }

    /**
     * Verifies that the constructor accepting another instance
     * copies all properties.
     */
    @Test
    public void testCreateFromOtherProperties() {

        final ClientConfigProperties other = new ClientConfigProperties();
        other.setAmqpHostname("gateway.local");
        other.setConnectTimeout(1000);
        other.setHost("hub.example.com");
        other.setHostnameVerificationRequired(false);
        other.setIdleTimeout(2000);
        other.setInitialCredits(20);
        other.setLinkEstablishmentTimeout(3000);
        other.setName("client");
        other.setOperationTimeout(4000);
        other.setPort(12000);
        other.setPutTokenTimeout(5000);
        other.setReconnectTimeout(6000);
        other.setRequestTimeout(7000);
        other.setSendMessageTimeout(8000);
        other.setTlsEnabled(false);
        other.setTrustStorePath("path/to/truststore.pem");
        other.setTrustStorePassword("secret");

        final ClientConfigProperties newProps = new ClientConfigProperties(other);
        assertThat(newProps.getAmqpHostname()).isEqualTo("gateway.local");
        assertThat(newProps.getConnectTimeout()).isEqualTo(1000);
        assertThat(newProps.getHost()).isEqualTo("hub.example.com");
        assertThat(newProps.isHostnameVerificationRequired()).isFalse();
        assertThat(newProps.getIdleTimeout()).isEqualTo(2000);
        assertThat(newProps.getInitialCredits()).isEqualTo(20);
        assertThat(newProps.getLinkEstablishmentTimeout()).isEqualTo(3000);
        assertThat(newProps.getName()).isEqualTo("client");
        assertThat(newProps.getOperationTimeout()).isEqualTo(4000);
        assertThat(newProps.getPort()).isEqualTo(12000);
        assertThat(newProps.getPutTokenTimeout()).isEqualTo(5000);
        assertThat(newProps.getReconnectTimeout()).isEqualTo(6000);
        assertThat(newProps.getRequestTimeout()).isEqualTo(7000);
        assertThat(newProps.getSendMessageTimeout()).isEqualTo(8000);
        assertThat(newProps.isTlsEnabled()).isFalse();
        assertThat(newProps.getTrustStorePath()).isEqualTo("path/to/truststore.pem");
        assertThat(newProps.getTrustStorePassword()).isEqualTo("secret");
    }

    /**
     * Verifies that invalid values are rejected.
     */
    @Test
    public void testSettersRejectInvalidValues() {

        final ClientConfigProperties props = new ClientConfigProperties();
        assertThatThrownBy(() -> props.setPort(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> props.setConnectTimeout(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> props.setPutTokenTimeout(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> props.setReconnectTimeout(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> props.setOperationTimeout(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Verifies that a non-existing trust store is reported.
     */
    @Test
    public void testGetTrustOptionsFailsForMissingFile() {

        final ClientConfigProperties props = new ClientConfigProperties();
        props.setTrustStorePath("/does/not/exist.pem");
        assertThatThrownBy(props::getTrustOptions).isInstanceOf(IllegalArgumentException.class);
    }
}
