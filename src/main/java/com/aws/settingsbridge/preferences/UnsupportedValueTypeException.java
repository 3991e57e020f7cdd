/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.preferences;

public class UnsupportedValueTypeException extends Exception {
    static final long serialVersionUID = -3387516993124229949L;

    public UnsupportedValueTypeException(Class<?> clazz) {
        super("Unsupported value type " + clazz.getName());
    }

    public UnsupportedValueTypeException(String message) {
        super(message);
    }
}
