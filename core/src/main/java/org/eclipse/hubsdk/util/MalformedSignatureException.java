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

/**
 * Indicates that a string does not represent a well formed shared access signature.
 */
public class MalformedSignatureException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for a detail message.
     *
     * @param msg The detail message.
     */
    public MalformedSignatureException(final String msg) {
        super(msg);
    }
}
