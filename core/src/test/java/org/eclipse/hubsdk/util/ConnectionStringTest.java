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

package org.eclipse.hubsdk.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/**
 * Tests verifying behavior of {@link ConnectionString}.
 *
 */
public class ConnectionStringTest {

    /**
     * Verifies that values containing the separator character are parsed correctly.
     */
    @Test
    public void testParseKeepsPaddingOfKeys() {

        final ConnectionString cs = ConnectionString.parseDeviceConnectionString(
                "HostName=hub.example.com;DeviceId=sensor-1;ModuleId=filter;SharedAccessKey=c2VjcmV0MQ==");
        assertThat(cs.getHostName()).isEqualTo("hub.example.com");
        assertThat(cs.getDeviceId()).isEqualTo("sensor-1");
        assertThat(cs.getModuleId()).isEqualTo("filter");
        assertThat(cs.getSharedAccessKey()).isEqualTo("c2VjcmV0MQ==");
        assertThat(cs.isX509()).isFalse();
        assertThat(cs.toString()).doesNotContain("c2VjcmV0MQ==");
    }

    /**
     * Verifies that the X.509 flag is recognized.
     */
    @Test
    public void testParseX509ConnectionString() {

        final ConnectionString cs = ConnectionString.parseDeviceConnectionString(
                "HostName=hub.example.com;DeviceId=sensor-1;x509=true");
        assertThat(cs.isX509()).isTrue();
    }

    /**
     * Verifies that a device connection string requires host name and device ID.
     */
    @Test
    public void testParseFailsForMissingRequiredProperties() {

        assertThatThrownBy(() -> ConnectionString.parseDeviceConnectionString("DeviceId=sensor-1;SharedAccessKey=abc"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(ConnectionString.HOST_NAME);
        assertThatThrownBy(() -> ConnectionString.parseDeviceConnectionString("HostName=hub;SharedAccessKey=abc"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(ConnectionString.DEVICE_ID);
    }

    /**
     * Verifies that a device connection string must contain exactly one type of credentials.
     */
    @Test
    public void testParseFailsForAmbiguousCredentials() {

        assertThatThrownBy(() -> ConnectionString.parseDeviceConnectionString(
                "HostName=hub;DeviceId=dev;SharedAccessKey=abc;x509=true"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConnectionString.parseDeviceConnectionString(
                "HostName=hub;DeviceId=dev;SharedAccessKey=abc;SharedAccessSignature=SharedAccessSignature sr=a&sig=b&se=1"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConnectionString.parseDeviceConnectionString("HostName=hub;DeviceId=dev"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Verifies that a created connection string can be parsed again.
     */
    @Test
    public void testCreateWithSharedAccessKey() {

        final String source = ConnectionString.createWithSharedAccessKey("hub", "dev", "a2V5");
        final ConnectionString cs = ConnectionString.parseDeviceConnectionString(source);
        assertThat(cs.getSharedAccessKey()).isEqualTo("a2V5");
    }
}
