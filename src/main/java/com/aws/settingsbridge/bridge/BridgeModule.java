/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.bridge;

import java.util.Collections;
import java.util.Map;

/**
 * A component the host can call by name. Operations are the public methods annotated with {@link BridgeMethod}.
 */
public interface BridgeModule {

    /**
     * Name under which the host registers and addresses this module.
     *
     * @return module name
     */
    String getName();

    /**
     * Values exported to the host once, when the module is installed.
     *
     * @return constants of this module
     */
    default Map<String, Object> getConstants() {
        return Collections.emptyMap();
    }

    /**
     * Called by the host when it tears down its module registry. The module must not be called afterwards.
     */
    default void invalidate() {
    }
}
