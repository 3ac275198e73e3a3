package com.hearth.loader.module;

import com.hearth.loader.HostContext;

/**
 * A module function that needs the host it runs in. Callers never pass the
 * host themselves; {@link ComponentHandle} binds it.
 */
@FunctionalInterface
public interface HostBoundFunction {
    Object apply(HostContext host, Object... args);
}
