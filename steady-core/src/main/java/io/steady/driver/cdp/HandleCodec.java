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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits call arguments that mix JSON data and handles into a JSON skeleton (handles replaced
 * by null), the path of every handle inside it, and the handles themselves. The reverse
 * direction puts remote references back into a parsed JSON value at their recorded paths.
 * <p>
 * A path is a list of map keys (String) and list indexes (Integer) from the root.
 */
public final class HandleCodec {

    private HandleCodec() {
    }

    public record Marshaled(List<Object> skeleton, List<List<Object>> paths, List<Handle> handles) {

        public boolean hasHandles() {
            return !handles.isEmpty();
        }

    }

    /**
     * @param owner handles from any other registry are rejected
     * @throws IllegalArgumentException for values that are neither JSON data nor handles
     */
    public static Marshaled marshal(List<?> args, HandleRegistry owner) {
        List<List<Object>> paths = new ArrayList<>();
        List<Handle> handles = new ArrayList<>();
        List<Object> skeleton = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            List<Object> path = new ArrayList<>();
            path.add(i);
            skeleton.add(marshal(args.get(i), path, owner, paths, handles));
        }
        return new Marshaled(skeleton, paths, handles);
    }

    private static Object marshal(Object value, List<Object> path, HandleRegistry owner,
                                  List<List<Object>> paths, List<Handle> handles) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Handle handle) {
            if (owner != null && handle.getRegistry() != owner) {
                throw new IllegalArgumentException("handle belongs to another connection: " + handle);
            }
            paths.add(List.copyOf(path));
            handles.add(handle);
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("object keys must be strings but got: " + entry.getKey());
                }
                path.add(key);
                copy.put(key, marshal(entry.getValue(), path, owner, paths, handles));
                path.remove(path.size() - 1);
            }
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            int index = 0;
            for (Object item : collection) {
                path.add(index++);
                copy.add(marshal(item, path, owner, paths, handles));
                path.remove(path.size() - 1);
            }
            return copy;
        }
        throw new IllegalArgumentException("only JSON values, maps, lists and handles are accepted as arguments but got: "
                + value.getClass().getName());
    }

    /**
     * Returns a mutable copy of {@code json} with {@code refs.get(i)} placed at {@code paths.get(i)}.
     * An empty path means the ref is the whole value.
     */
    public static Object unmarshal(Object json, List<? extends List<?>> paths, List<?> refs) {
        if (paths.size() != refs.size()) {
            throw new IllegalArgumentException("paths and refs differ in size: " + paths.size() + " != " + refs.size());
        }
        Object root = copy(json);
        for (int i = 0; i < paths.size(); i++) {
            List<?> path = paths.get(i);
            if (path.isEmpty()) {
                return refs.get(i);
            }
            Object parent = root;
            for (int j = 0; j < path.size() - 1; j++) {
                parent = child(parent, path.get(j));
            }
            put(parent, path.get(path.size() - 1), refs.get(i));
        }
        return root;
    }

    @SuppressWarnings("unchecked")
    private static Object child(Object parent, Object key) {
        if (parent instanceof Map) {
            return ((Map<String, Object>) parent).get(key.toString());
        }
        if (parent instanceof List) {
            return ((List<Object>) parent).get(((Number) key).intValue());
        }
        throw new IllegalArgumentException("path step " + key + " does not point into a map or list");
    }

    @SuppressWarnings("unchecked")
    private static void put(Object parent, Object key, Object value) {
        if (parent instanceof Map) {
            ((Map<String, Object>) parent).put(key.toString(), value);
        } else if (parent instanceof List) {
            ((List<Object>) parent).set(((Number) key).intValue(), value);
        } else {
            throw new IllegalArgumentException("path step " + key + " does not point into a map or list");
        }
    }

    private static Object copy(Object json) {
        if (json instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k.toString(), copy(v)));
            return copy;
        }
        if (json instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(copy(v)));
            return copy;
        }
        return json;
    }

}
