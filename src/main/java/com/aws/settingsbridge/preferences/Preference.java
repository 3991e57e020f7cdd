/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.preferences;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.io.IOException;
import java.util.Objects;

/**
 * One key of a {@link Preferences} store with its current value and the time it was last modified.
 */
public class Preference {
    private final Preferences owner;
    private final String key;
    private Object value;
    @SuppressFBWarnings(value = "IS2_INCONSISTENT_SYNC", justification = "No need for modtime to be sync")
    private long modtime;

    Preference(Preferences owner, String key) {
        this.owner = owner;
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * The value of the last completed write. Null while no value has been stored yet.
     */
    public Object getOnce() {
        return value;
    }

    public long getModtime() {
        return modtime;
    }

    /**
     * Set the value of this preference to a new value.
     *
     * @param proposedModtime          the last modified time of the value. If this is older than the current one, the
     *                                 value is not updated unless allowTimestampToDecrease is set
     * @param proposed                 new value, already frozen by {@link PreferenceValues#freeze(Object)}
     * @param allowTimestampToDecrease allow the timestamp to go back in time
     * @return true if the value changed
     */
    synchronized boolean withNewerValue(long proposedModtime, Object proposed, boolean allowTimestampToDecrease) {
        if (Objects.equals(proposed, value) || !allowTimestampToDecrease && proposedModtime < modtime) {
            return false;
        }
        value = proposed;
        modtime = proposedModtime;
        owner.publish(WhatHappened.changed, this);
        return true;
    }

    synchronized void markRemoved(long timestamp) {
        modtime = timestamp;
    }

    /**
     * Append a readable form of this preference.
     *
     * @param a appendable to write into
     * @throws IOException if the append fails
     */
    public void appendTo(Appendable a) throws IOException {
        a.append(key);
        a.append(':');
        a.append(String.valueOf(value));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        try {
            appendTo(sb);
        } catch (IOException ignore) {
            // StringBuilder does not throw
        }
        return sb.toString();
    }
}
