/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.earthreader.commons;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class PropertiesUtilTest {

    @Test
    public void toBoolean() {
        assertTrue(PropertiesUtil.toBoolean(null, true));
        assertTrue(PropertiesUtil.toBoolean(Boolean.TRUE, false));
        assertTrue(PropertiesUtil.toBoolean("true", false));
        assertFalse(PropertiesUtil.toBoolean("no", true));
        assertTrue(PropertiesUtil.toBoolean(new String[] { "true", "false" }, false));
    }

    @Test
    public void toInteger() {
        assertEquals(5, PropertiesUtil.toInteger(5, 0));
        assertEquals(5, PropertiesUtil.toInteger(5L, 0));
        assertEquals(5, PropertiesUtil.toInteger(" 5 ", 0));
        assertEquals(7, PropertiesUtil.toInteger("five", 7));
        assertEquals(7, PropertiesUtil.toInteger(Collections.emptyList(), 7));
        assertEquals(3, PropertiesUtil.toInteger(ImmutableList.of("3", "4"), 7));
    }

    @Test
    public void toStringValue() {
        assertEquals("x", PropertiesUtil.toString("x", "y"));
        assertEquals("y", PropertiesUtil.toString(null, "y"));
        assertNull(PropertiesUtil.toObject(new Object[0]));
    }

    @Test
    public void requireString() {
        Map<String, ?> config = ImmutableMap.of("path", "/tmp/x", "empty", "");
        assertEquals("/tmp/x", PropertiesUtil.requireString(config, "path"));
        try {
            PropertiesUtil.requireString(config, "empty");
            fail();
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("empty"));
        }
    }
}
