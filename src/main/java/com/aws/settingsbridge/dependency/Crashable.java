/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.dependency;

/**
 * Like Runnable, but exceptions pass through. Used where the caller is prepared to take corrective action.
 */
public interface Crashable {
    void run() throws Throwable;
}
