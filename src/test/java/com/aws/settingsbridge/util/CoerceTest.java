/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoerceTest {

    @Test
    void GIVEN_loose_values_WHEN_coerce_THEN_converted() {
        assertTrue(Coerce.toBoolean("yes"));
        assertTrue(Coerce.toBoolean(1));
        assertFalse(Coerce.toBoolean("nope"));
        assertFalse(Coerce.toBoolean(null));
        assertEquals(12, Coerce.toInt(" 12 "));
        assertEquals(3, Coerce.toInt(3.9));
        assertEquals(1L, Coerce.toLong(true));
        assertEquals(2.5, Coerce.toDouble("2.5"));
        assertEquals("42", Coerce.toString(42));
        assertNull(Coerce.toString(null));
    }

    @Test
    void GIVEN_non_numeric_text_WHEN_coerce_to_number_THEN_number_format_exception() {
        assertThrows(NumberFormatException.class, () -> Coerce.toInt("abc"));
        assertThrows(NumberFormatException.class, () -> Coerce.toDouble("1.2.3"));
    }

    @Test
    void GIVEN_value_beyond_int_range_WHEN_coerce_to_int_THEN_arithmetic_exception() {
        assertThrows(ArithmeticException.class, () -> Coerce.toInt(4_294_967_297L));
        assertThrows(ArithmeticException.class, () -> Coerce.toInt("-2147483649"));
        assertEquals(Integer.MIN_VALUE, Coerce.toInt("-2147483648"));
    }

    @Test
    void GIVEN_json_integers_WHEN_parsed_THEN_read_as_long() throws Exception {
        assertEquals(7L, Coerce.toObject("7"));
        assertEquals(Arrays.asList(1L, 2.5), Coerce.toObject("[1,2.5]"));
    }

    @Test
    void GIVEN_object_WHEN_appended_and_parsed_THEN_equal() throws Exception {
        StringBuilder sb = new StringBuilder();
        Map<String, Object> value = Collections.singletonMap("list", Arrays.asList(1L, "two", null));
        Coerce.appendParseableString(value, sb);

        assertTrue(sb.toString().endsWith("\n"));
        assertEquals(value, Coerce.toObject(sb.toString().trim()));
    }

    @Test
    void GIVEN_home_relative_path_WHEN_resolved_THEN_under_user_home() {
        assertEquals(Utils.HOME_PATH.resolve("a/b"), Utils.homePath("~/a/b"));
        assertEquals(Utils.HOME_PATH, Utils.homePath("~"));
        assertEquals(Paths.get("/tmp/x"), Utils.homePath("/tmp/x"));
        assertTrue(Utils.isEmpty(" "));
        assertFalse(Utils.isEmpty("x"));
    }
}
