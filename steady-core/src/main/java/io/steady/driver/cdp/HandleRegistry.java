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

import io.steady.driver.ProtocolException;
import io.steady.driver.ScriptException;
import io.steady.driver.StaleHandleException;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates, validates, describes and releases {@link Handle}s for one connection.
 * <p>
 * Every remote object the registry creates lives in its own object group, which is released
 * as a whole on {@link #close()}. A handle is checked for liveness each time its id is needed,
 * so a node that left the document surfaces as {@link StaleHandleException} and never as a
 * generic protocol error.
 */
public class HandleRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HandleRegistry.class);

    static final int SERVER_ERROR = -32000;

    static final Set<String> STALE_NODE_MESSAGES = Set.of(
            "No node with given id found",
            "Node with given id does not belong to the document",
            "Could not find node with given id");

    static final Set<String> STALE_OBJECT_MESSAGES = Set.of(
            "Could not find object with given id",
            "Cannot find context with specified id");

    static final String FUNCTION_PLACEHOLDER = "__FUNCTION__";
    static final String ARGUMENTS_PLACEHOLDER = "__ARGUMENTS__";
    static final String PLAIN_ARGUMENTS = "Array.prototype.slice.call(arguments)";
    static final String RESTORED_ARGUMENTS = "restore(arguments)";
    private static final String CALL_JS = loadResource("call.js");

    private static final String NODE_ALIVE = "function() { return this === document || this.isConnected === true; }";
    private static final String OBJECT_ALIVE = "function() { return true; }";
    static final String IS_NODE = "function() { return typeof Node !== 'undefined' && this instanceof Node; }";
    private static final String OBJECT_TYPE = "function() { return Object.prototype.toString.call(this); }";

    private static final AtomicInteger GROUP_COUNTER = new AtomicInteger();

    private static String loadResource(String name) {
        try (InputStream is = HandleRegistry.class.getResourceAsStream("/io/steady/driver/cdp/" + name)) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load " + name, e);
        }
    }

    private final CdpClient cdp;
    private final String objectGroup;

    public HandleRegistry(CdpClient cdp) {
        this.cdp = cdp;
        this.objectGroup = "steady-" + GROUP_COUNTER.incrementAndGet();
    }

    public String getObjectGroup() {
        return objectGroup;
    }

    static boolean isStale(ProtocolException e) {
        if (e.getCode() != SERVER_ERROR) {
            return false;
        }
        String message = e.getMessage();
        for (String stale : STALE_NODE_MESSAGES) {
            if (message.contains(stale)) {
                return true;
            }
        }
        for (String stale : STALE_OBJECT_MESSAGES) {
            if (message.contains(stale)) {
                return true;
            }
        }
        return false;
    }

    private void checkOwner(Handle handle) {
        if (handle.getRegistry() != this) {
            throw new IllegalArgumentException("handle belongs to another connection: " + handle);
        }
    }

    // Creation

    public Handle wrap(Lookup lookup) {
        return wrap(lookup, null, null, null);
    }

    /**
     * Creates a handle. Node ids are resolved to an object id right away; an object id is asked
     * once whether it points at a DOM node, which decides how liveness is checked later.
     *
     * @param context   handle the lookup was made from, supplies the selector prefix
     * @param selector  appended to the context's selector, space separated
     * @throws StaleHandleException if the node or object is already gone
     */
    public Handle wrap(Lookup lookup, Handle context, String displayName, String selector) {
        if (context != null) {
            checkOwner(context);
        }
        String objectId;
        Handle.Kind kind;
        if (lookup.objectId() != null) {
            objectId = lookup.objectId();
            kind = kindOf(objectId);
        } else {
            objectId = resolveObjectId(lookup);
            kind = Handle.Kind.NODE;
        }
        return new Handle(this, objectId, kind, displayName, joinSelector(context, selector));
    }

    private Handle.Kind kindOf(String objectId) {
        try {
            Object node = cdp.method("Runtime.callFunctionOn")
                    .param("functionDeclaration", IS_NODE)
                    .param("objectId", objectId)
                    .param("returnByValue", true)
                    .send()
                    .getResult("result.value");
            return Boolean.TRUE.equals(node) ? Handle.Kind.NODE : Handle.Kind.OBJECT;
        } catch (ProtocolException e) {
            throw staleOr(e);
        }
    }

    Handle wrapObject(String objectId, Handle.Kind kind) {
        return new Handle(this, objectId, kind, null, null);
    }

    static String joinSelector(Handle context, String selector) {
        String parent = context == null ? null : context.getSelector();
        if (parent == null) {
            return selector;
        }
        return selector == null ? parent : parent + " " + selector;
    }

    private String resolveObjectId(Lookup lookup) {
        CdpMessage message = cdp.method("DOM.resolveNode").param("objectGroup", objectGroup);
        if (lookup.backendNodeId() != null) {
            message.param("backendNodeId", lookup.backendNodeId());
        } else {
            message.param("nodeId", lookup.nodeId());
        }
        try {
            String objectId = message.send().getResultAsString("object.objectId");
            if (objectId == null) {
                throw new StaleHandleException("node has no remote object: " + lookup);
            }
            return objectId;
        } catch (ProtocolException e) {
            throw staleOr(e);
        }
    }

    private RuntimeException staleOr(ProtocolException e) {
        if (isStale(e)) {
            return new StaleHandleException("stale handle: " + e.getMessage(), e);
        }
        return e;
    }

    // Validated access

    /**
     * @throws StaleHandleException if the remote object no longer exists or a node left the document
     */
    public String getObjectId(Handle handle) {
        checkOwner(handle);
        Object alive;
        try {
            alive = cdp.method("Runtime.callFunctionOn")
                    .param("functionDeclaration", handle.isNode() ? NODE_ALIVE : OBJECT_ALIVE)
                    .param("objectId", handle.objectId())
                    .param("returnByValue", true)
                    .send()
                    .getResult("result.value");
        } catch (ProtocolException e) {
            throw staleOr(e);
        }
        if (!Boolean.TRUE.equals(alive)) {
            throw new StaleHandleException("stale handle: " + handle);
        }
        return handle.objectId();
    }

    public int getNodeId(Handle handle) {
        if (!handle.isNode()) {
            throw new IllegalArgumentException("not a node handle: " + handle);
        }
        String objectId = getObjectId(handle);
        try {
            Integer nodeId = cdp.method("DOM.requestNode")
                    .param("objectId", objectId)
                    .send()
                    .getResultAsInt("nodeId");
            if (nodeId == null || nodeId == 0) {
                throw new StaleHandleException("stale handle: " + handle);
            }
            return nodeId;
        } catch (ProtocolException e) {
            throw staleOr(e);
        }
    }

    /**
     * Human readable form such as {@code button#save.primary.large}. Makes network calls and
     * never throws: a gone object yields {@code stale}, other failures {@code error: <message>}.
     */
    public String describe(Handle handle) {
        try {
            if (handle.isNode()) {
                return describeNode(handle);
            }
            getObjectId(handle);
            return cdp.method("Runtime.callFunctionOn")
                    .param("functionDeclaration", OBJECT_TYPE)
                    .param("objectId", handle.objectId())
                    .param("returnByValue", true)
                    .send()
                    .getResultAsString("result.value");
        } catch (StaleHandleException e) {
            return "stale";
        } catch (ProtocolException e) {
            return isStale(e) ? "stale" : "error: " + e.getMessage();
        } catch (Exception e) {
            return "error: " + e.getMessage();
        }
    }

    private String describeNode(Handle handle) {
        CdpResponse response = cdp.method("DOM.describeNode")
                .param("objectId", handle.objectId())
                .send();
        String nodeName = response.getResultAsString("node.nodeName");
        List<Object> attributes = response.getResult("node.attributes");
        return formatNode(nodeName, attributes);
    }

    static String formatNode(String nodeName, List<?> attributes) {
        StringBuilder sb = new StringBuilder(nodeName == null ? "" : nodeName.toLowerCase());
        Map<String, String> attrs = new HashMap<>();
        if (attributes != null) {
            for (int i = 0; i + 1 < attributes.size(); i += 2) {
                attrs.put(String.valueOf(attributes.get(i)), String.valueOf(attributes.get(i + 1)));
            }
        }
        String id = attrs.get("id");
        if (id != null && !id.isBlank()) {
            sb.append('#').append(id.trim());
        }
        String classes = attrs.get("class");
        if (classes != null) {
            for (String cls : classes.trim().split("\\s+")) {
                if (!cls.isEmpty()) {
                    sb.append('.').append(cls);
                }
            }
        }
        return sb.toString();
    }

    // Function calls

    /**
     * Calls {@code functionDeclaration} with {@code this} bound to the given handle. Arguments may
     * nest handles inside maps and lists; the result comes back with the same nesting, remote
     * objects turned into handles. Arguments without handles go over as one plain value each.
     *
     * @throws ScriptException if the function throws
     */
    public Object callFunction(Handle thisHandle, String functionDeclaration, List<?> args) {
        HandleCodec.Marshaled marshaled = HandleCodec.marshal(args, this);
        String thisId = getObjectId(thisHandle);
        List<Map<String, Object>> arguments = new ArrayList<>();
        String template;
        if (marshaled.hasHandles()) {
            template = CALL_JS.replace(ARGUMENTS_PLACEHOLDER, RESTORED_ARGUMENTS);
            arguments.add(Map.of("value", marshaled.skeleton()));
            arguments.add(Map.of("value", marshaled.paths()));
            for (Handle handle : marshaled.handles()) {
                arguments.add(Map.of("objectId", getObjectId(handle)));
            }
        } else {
            template = CALL_JS.replace(ARGUMENTS_PLACEHOLDER, PLAIN_ARGUMENTS);
            for (Object arg : marshaled.skeleton()) {
                arguments.add(Collections.singletonMap("value", arg));
            }
        }
        String declaration = template.replace(FUNCTION_PLACEHOLDER, functionDeclaration);
        CdpResponse response;
        try {
            response = cdp.method("Runtime.callFunctionOn")
                    .param("functionDeclaration", declaration)
                    .param("objectId", thisId)
                    .param("arguments", arguments)
                    .param("awaitPromise", true)
                    .param("returnByValue", false)
                    .param("objectGroup", objectGroup)
                    .send();
        } catch (ProtocolException e) {
            throw staleOr(e);
        }
        if (response.getResult("exceptionDetails") != null) {
            String description = response.getResultAsString("exceptionDetails.exception.description");
            if (description == null) {
                description = response.getResultAsString("exceptionDetails.text");
            }
            throw new ScriptException(description);
        }
        String type = response.getResultAsString("result.type");
        if ("string".equals(type)) {
            return parseJson(response.getResultAsString("result.value"));
        }
        String wrapperId = response.getResultAsString("result.objectId");
        if (wrapperId == null) {
            return null;
        }
        try {
            return unwrapResult(wrapperId);
        } finally {
            releaseObject(wrapperId);
        }
    }

    private Object unwrapResult(String wrapperId) {
        CdpResponse props = cdp.method("Runtime.getProperties")
                .param("objectId", wrapperId)
                .param("ownProperties", true)
                .send();
        List<Map<String, Object>> properties = props.getResult("result");
        Map<String, Map<String, Object>> byName = new HashMap<>();
        if (properties != null) {
            for (Map<String, Object> property : properties) {
                Object value = property.get("value");
                if (value instanceof Map) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> remote = (Map<String, Object>) value;
                    byName.put(String.valueOf(property.get("name")), remote);
                }
            }
        }
        Object json = parseJson(stringValue(byName.get("json")));
        @SuppressWarnings("unchecked")
        List<List<Object>> paths = (List<List<Object>>) parseJson(stringValue(byName.get("paths")));
        @SuppressWarnings("unchecked")
        List<Object> kinds = (List<Object>) parseJson(stringValue(byName.get("kinds")));
        List<Handle> refs = new ArrayList<>(paths.size());
        for (int i = 0; i < paths.size(); i++) {
            Map<String, Object> ref = byName.get("ref_" + i);
            Object objectId = ref == null ? null : ref.get("objectId");
            if (objectId == null) {
                throw new ProtocolException(0, "missing remote reference ref_" + i, "Runtime.getProperties");
            }
            Handle.Kind kind = "node".equals(kinds.get(i)) ? Handle.Kind.NODE : Handle.Kind.OBJECT;
            refs.add(wrapObject(objectId.toString(), kind));
        }
        return HandleCodec.unmarshal(json, paths, refs);
    }

    private static String stringValue(Map<String, Object> remote) {
        Object value = remote == null ? null : remote.get("value");
        return value == null ? "null" : value.toString();
    }

    private static Object parseJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return JSONValue.parseWithException(json);
        } catch (ParseException e) {
            throw new ProtocolException(0, "malformed call result: " + e.getMessage(), "Runtime.callFunctionOn");
        }
    }

    // Disposal

    public void release(Handle handle) {
        checkOwner(handle);
        releaseObject(handle.objectId());
    }

    private void releaseObject(String objectId) {
        if (!cdp.isOpen()) {
            return;
        }
        try {
            cdp.method("Runtime.releaseObject").param("objectId", objectId).send();
        } catch (ProtocolException e) {
            logger.debug("release of {} failed: {}", objectId, e.getMessage());
        }
    }

    /**
     * Releases every object created through this registry. Never throws.
     */
    @Override
    public void close() {
        if (!cdp.isOpen()) {
            return;
        }
        try {
            cdp.method("Runtime.releaseObjectGroup").param("objectGroup", objectGroup).send();
        } catch (Exception e) {
            logger.warn("release of object group {} failed: {}", objectGroup, e.getMessage());
        }
    }

}
