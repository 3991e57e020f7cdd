/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.bridge;

import javax.annotation.Nullable;

/**
 * Channel a module uses to push named events to the host.
 */
@FunctionalInterface
public interface EventEmitter {
    EventEmitter NO_OP = (eventName, body) -> { };

    void emit(String eventName, @Nullable Object body);
}
