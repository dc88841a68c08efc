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

/**
 * The kind of credentials an authentication provider supplies.
 *
 */
public enum AuthenticationType {
    /**
     * Time limited shared access signatures.
     */
    TOKEN,
    /**
     * An X.509 client certificate used during the TLS handshake.
     */
    X509
}
