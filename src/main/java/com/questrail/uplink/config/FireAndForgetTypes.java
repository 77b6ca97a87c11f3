package com.questrail.uplink.config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Message types the backend ingests without acknowledging individually:
 * high-frequency editor and terminal telemetry, idle signals, coaching
 * dismissals. Sends of these types never create a correlation entry.
 *
 * <p>The set is startup configuration. {@link #defaults()} mirrors what the
 * backend currently treats as unacknowledged; deployments that change server
 * expectations override it through {@link UplinkClientConfig}.</p>
 */
public final class FireAndForgetTypes {

    private static final Set<String> DEFAULTS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            "buffer:update",
            "editor:cursor",
            "editor:scroll",
            "editor:selection",
            "terminal:input",
            "terminal:resize",
            "user:idle_start",
            "user:idle_end",
            "user:navigation",
            "coaching:dismiss",
            "coaching:feedback",
            "hints:level_change",
            "phase:expand_step"
    )));

    private FireAndForgetTypes() {}

    public static Set<String> defaults() {
        return DEFAULTS;
    }
}
