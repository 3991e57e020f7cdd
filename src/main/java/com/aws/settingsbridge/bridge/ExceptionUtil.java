/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

public final class ExceptionUtil {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExceptionUtil.class);

    private ExceptionUtil() {
    }

    /**
     * Run a method and then translate any runtime exceptions from it into ServiceErrors.
     *
     * @param sup method to run
     * @param <T> Return type
     * @return return if the supplier does not throw
     * @throws BridgeError as thrown by the supplier, or a ServiceError for any other runtime exception
     */
    @SuppressWarnings({
            "PMD.AvoidRethrowingException", "PMD.AvoidCatchingGenericException"
    })
    public static <T> T translateExceptions(Supplier<T> sup) {
        try {
            return sup.get();
        } catch (BridgeError e) {
            // Don't remap BridgeError into ServiceError
            throw e;
        } catch (RuntimeException e) {
            LOGGER.atError().setCause(e).log("Unhandled exception in bridge module");
            throw new ServiceError(e.getMessage(), e);
        }
    }
}
