package io.github.nandaindex.interop.runtime.translate;

import java.util.Objects;

/**
 * Agent identity encoded as a single {@code name:version} string.
 */
public record AgentIdentifier(String name, String version) {

    public static final String DEFAULT_VERSION = "v0";

    public AgentIdentifier {
        Objects.requireNonNull(name, "name");
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
    }

    /**
     * Splits on the last colon, so {@code "org:agent:v2"} yields {@code ("org:agent", "v2")}. Without a colon, or
     * with nothing after it, the version is {@value #DEFAULT_VERSION}.
     */
    public static AgentIdentifier parse(String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        int colon = identifier.lastIndexOf(':');
        if (colon < 0) {
            return new AgentIdentifier(identifier, DEFAULT_VERSION);
        }
        return new AgentIdentifier(identifier.substring(0, colon), identifier.substring(colon + 1));
    }

    /** Registry key for this identity; slashes are not allowed in registry ids and become hyphens. */
    public String toAgentId() {
        return (name + ":" + version).replace('/', '-');
    }
}
