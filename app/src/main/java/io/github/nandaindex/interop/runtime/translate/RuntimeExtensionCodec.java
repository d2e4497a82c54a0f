package io.github.nandaindex.interop.runtime.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.nandaindex.interop.runtime.model.OasfRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the OASF MCP runtime extension to and from the registry's {@code api_url} field.
 * <p>
 * The registry has no place for a server definition, so the command is carried as
 * {@code cmd://<command>?args=<space separated args>}.
 */
public final class RuntimeExtensionCodec {

    public static final String EXTENSION_NAME = "schema.oasf.agntcy.org/features/runtime/mcp";
    public static final String EXTENSION_VERSION = "v1.0.0";
    public static final String SERVER_NAME = "nanda-export";

    static final String FEATURE_MARKER = "runtime/mcp";
    static final String COMMAND_SCHEME = "cmd://";
    static final String ARGS_MARKER = "?args=";

    private RuntimeExtensionCodec() {
    }

    public static boolean isCommandUrl(String url) {
        return url != null && url.startsWith(COMMAND_SCHEME);
    }

    /** Decodes a {@code cmd://} URL into a runtime extension with a single server entry. */
    public static Optional<OasfRecord.Extension> fromCommandUrl(String apiUrl) {
        if (!isCommandUrl(apiUrl)) {
            return Optional.empty();
        }
        String remainder = apiUrl.substring(COMMAND_SCHEME.length());
        String command = remainder;
        List<String> args = List.of();
        int marker = remainder.indexOf(ARGS_MARKER);
        if (marker >= 0) {
            command = remainder.substring(0, marker);
            String joined = remainder.substring(marker + ARGS_MARKER.length()).trim();
            args = joined.isEmpty() ? List.of() : Arrays.asList(joined.split("\\s+"));
        }
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode server = nodes.objectNode();
        server.put("command", command);
        ArrayNode argsNode = server.putArray("args");
        args.forEach(argsNode::add);
        server.putObject("env");
        ObjectNode data = nodes.objectNode();
        data.putObject("servers").set(SERVER_NAME, server);
        return Optional.of(new OasfRecord.Extension(EXTENSION_NAME, EXTENSION_VERSION, data));
    }

    /**
     * Encodes the first server with a command found in a runtime extension, extensions and servers taken in
     * declaration order.
     */
    public static Optional<String> toCommandUrl(List<OasfRecord.Extension> extensions) {
        for (OasfRecord.Extension extension : extensions) {
            if (!extension.name().contains(FEATURE_MARKER) || extension.data() == null) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> servers = extension.data().path("servers").fields();
            while (servers.hasNext()) {
                JsonNode server = servers.next().getValue();
                String command = JsonInputs.textOrNull(server, "command");
                if (command == null) {
                    continue;
                }
                List<String> args = new ArrayList<>();
                for (JsonNode arg : server.path("args")) {
                    if (arg.isValueNode()) {
                        args.add(arg.asText());
                    }
                }
                return Optional.of(COMMAND_SCHEME + command + ARGS_MARKER + String.join(" ", args));
            }
        }
        return Optional.empty();
    }
}
