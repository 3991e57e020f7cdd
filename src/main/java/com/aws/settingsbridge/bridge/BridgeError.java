/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.bridge;

/**
 * Base of the errors reported back to the host by {@link ModuleRegistry#invoke}.
 */
public abstract class BridgeError extends RuntimeException {
    static final long serialVersionUID = -5419582311271393720L;

    protected BridgeError(String message) {
        super(message);
    }

    protected BridgeError(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable code the host can hand to its callers.
     *
     * @return error code
     */
    public abstract String getErrorCode();
}
