/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.steady.driver.cdp;

import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;
import net.minidev.json.parser.ParseException;

import java.util.Map;

/**
 * JSON helpers for protocol payloads.
 */
final class Wire {

    // urls keep their forward slashes
    private static final JSONStyle STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private Wire() {
    }

    static String stringify(Object value) {
        return JSONValue.toJSONString(value, STYLE);
    }

    /**
     * @throws ParseException for anything that is not RFC 4627 JSON
     */
    static Object parse(String json) throws ParseException {
        return new JSONParser(JSONParser.MODE_RFC4627).parse(json);
    }

    /**
     * Dot paths such as {@code frame.id} walk nested maps. Anything with brackets or a leading
     * {@code $} is handed to JsonPath. A missing step yields null.
     */
    @SuppressWarnings("unchecked")
    static <T> T read(Map<String, Object> map, String path) {
        if (map == null) {
            return null;
        }
        if (path.startsWith("$") || path.indexOf('[') >= 0) {
            try {
                return JsonPath.read(map, path.charAt(0) == '$' ? path : "$." + path);
            } catch (PathNotFoundException e) {
                return null;
            }
        }
        Object current = map;
        int start = 0;
        while (current != null) {
            int dot = path.indexOf('.', start);
            String key = dot < 0 ? path.substring(start) : path.substring(start, dot);
            current = current instanceof Map ? ((Map<String, Object>) current).get(key) : null;
            if (dot < 0) {
                break;
            }
            start = dot + 1;
        }
        return (T) current;
    }

    static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    static Integer asInt(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof Number n ? n.intValue() : Integer.valueOf(value.toString());
    }

    static Boolean asBoolean(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof Boolean b ? b : Boolean.valueOf(value.toString());
    }

}
