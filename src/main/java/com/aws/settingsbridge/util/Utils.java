/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.util;

import java.io.Closeable;
import java.io.Flushable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;

public final class Utils {
    public static final Path HOME_PATH = Paths.get(System.getProperty("user.home"));

    private Utils() {
    }

    /**
     * Tries to close an object if it can.
     *
     * @param closeable object to be closed.
     * @return error if any.
     */
    @SuppressWarnings({"PMD.UnnecessaryLocalBeforeReturn", "PMD.AvoidCatchingThrowable"})
    public static Throwable close(Object closeable) {
        if (closeable instanceof Closeable) {
            try {
                ((Closeable) closeable).close();
                return null;
            } catch (Throwable t) {
                return t;
            }
        } else {
            return null;
        }
    }

    /**
     * Tries to flush an object if it can.
     *
     * @param flushable object to be flushed.
     * @return error if any.
     */
    @SuppressWarnings({"PMD.UnnecessaryLocalBeforeReturn", "PMD.AvoidCatchingThrowable"})
    public static Throwable flush(Object flushable) {
        if (flushable instanceof Flushable) {
            try {
                ((Flushable) flushable).flush();
                return null;
            } catch (Throwable t) {
                return t;
            }
        } else {
            return null;
        }
    }

    /**
     * Returns true if the given string is null, empty, or only whitespace.
     *
     * @param s string to check.
     * @return true if it is null, empty, or only whitespace.
     */
    public static boolean isEmpty(String s) {
        return s == null || s.trim().isEmpty();
    }

    public static boolean isEmpty(Collection<?> s) {
        return s == null || s.isEmpty();
    }

    /**
     * Resolve a path, expanding a leading {@code ~} to the user's home directory.
     *
     * @param s path string from configuration
     * @return resolved path
     */
    public static Path homePath(String s) {
        if ("~".equals(s)) {
            return HOME_PATH;
        }
        if (s.startsWith("~/")) {
            return HOME_PATH.resolve(s.substring(2));
        }
        return Paths.get(s);
    }
}
