/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.bridge;

public class InvalidArgumentsError extends BridgeError {
    static final long serialVersionUID = -2760147331398571553L;

    public InvalidArgumentsError(String message) {
        super(message);
    }

    public InvalidArgumentsError(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_ARGUMENTS";
    }
}
