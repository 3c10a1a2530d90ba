package com.sandcastle.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The capability table handed to every worker: the only builtin names submitted code
 * can resolve. Anything not listed here is absent from the sandbox.
 *
 * <p>The table is built once from {@link SecurityProperties} and never changes afterwards.
 * Names in {@link #HOST_CAPABILITIES} are refused at startup because they reach the
 * host (files, imports, dynamic evaluation, interpreter internals).
 */
@Service
public class BuiltinAllowlist {

    private static final Logger log = LoggerFactory.getLogger(BuiltinAllowlist.class);

    public static final List<String> DEFAULT_NAMES = List.of(
            // types
            "int", "float", "str", "bool", "list", "dict", "set", "tuple", "frozenset",
            "bytes", "bytearray", "complex", "type", "object", "slice", "range",
            // collections and iteration
            "len", "enumerate", "zip", "map", "filter", "reversed", "sorted", "iter", "next",
            // math
            "abs", "min", "max", "sum", "pow", "round", "divmod",
            // logic
            "all", "any",
            // conversions
            "chr", "ord", "hex", "bin", "oct", "format", "repr", "hash",
            // introspection
            "isinstance", "issubclass", "hasattr", "getattr", "callable", "id",
            // exceptions usable in try/except
            "Exception", "ValueError", "TypeError", "KeyError", "IndexError", "AttributeError",
            "ZeroDivisionError", "StopIteration", "RuntimeError", "ArithmeticError",
            "LookupError", "NotImplementedError", "OverflowError", "AssertionError",
            // constants
            "None", "True", "False"
    );

    public static final Set<String> HOST_CAPABILITIES = Set.of(
            "open", "__import__", "eval", "exec", "compile", "input", "breakpoint",
            "globals", "locals", "vars", "dir", "help", "exit", "quit",
            "setattr", "delattr", "memoryview", "print"
    );

    private final Set<String> names;

    @Autowired
    public BuiltinAllowlist(SecurityProperties securityProperties) {
        this(securityProperties.getAllowedBuiltins());
    }

    public BuiltinAllowlist(List<String> configured) {
        var table = new LinkedHashSet<String>();
        for (String name : configured) {
            String trimmed = name.trim();
            if (trimmed.isEmpty()) continue;
            if (HOST_CAPABILITIES.contains(trimmed)) {
                throw new IllegalStateException("Builtin '" + trimmed + "' reaches the host and cannot be allowed");
            }
            table.add(trimmed);
        }
        this.names = Collections.unmodifiableSet(table);
        log.info("Sandbox builtin allowlist holds {} names", names.size());
    }

    public static BuiltinAllowlist defaults() {
        return new BuiltinAllowlist(DEFAULT_NAMES);
    }

    public boolean isAllowed(String name) {
        return names.contains(name);
    }

    /**
     * Allowed names in configuration order.
     */
    public List<String> names() {
        return List.copyOf(names);
    }
}
