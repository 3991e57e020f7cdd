/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.preferences;

import javax.annotation.Nullable;

/**
 * Told which preference changed. The listener must look in the preference (p.getOnce()) for the new value; there is no
 * "old value" provided. Writes that do not change the stored value are not published. Called with a null preference
 * and {@link WhatHappened#initialized} once when subscribing.
 */
@FunctionalInterface
public interface PreferenceListener {
    void preferenceChanged(WhatHappened what, @Nullable Preference preference);
}
