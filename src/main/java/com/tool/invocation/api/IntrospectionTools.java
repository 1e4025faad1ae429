package com.tool.invocation.api;

import com.tool.invocation.schema.ToolArg;
import com.tool.invocation.tool.ToolDescriptor;
import com.tool.invocation.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Registers the introspection operations of a {@link ToolIntrospection} as ordinary tools so a
 * remote caller can reach them through the dispatcher.
 *
 * <p>All of them are read-only and never coalesced: a caller asking for recent events or the
 * write-gate state always gets the current value. {@code authorize_mutations} is registered as
 * non-mutating, so it is not itself subject to the write gate.</p>
 */
public final class IntrospectionTools {
    private static final Logger log = LoggerFactory.getLogger(IntrospectionTools.class);

    public static final String LIST_TOOLS = "list_tools";
    public static final String DESCRIBE_TOOL = "describe_tool";
    public static final String VALIDATE_ARGS = "validate_args";
    public static final String GET_RECENT_EVENTS = "get_recent_events";
    public static final String GET_RECENT_ERRORS = "get_recent_errors";
    public static final String GET_RECENT_LOGS = "get_recent_logs";
    public static final String GET_METRICS = "get_metrics";
    public static final String GET_SERVER_STATUS = "get_server_status";
    public static final String AUTHORIZE_MUTATIONS = "authorize_mutations";

    public static final List<String> NAMES = List.of(LIST_TOOLS, DESCRIBE_TOOL, VALIDATE_ARGS,
            GET_RECENT_EVENTS, GET_RECENT_ERRORS, GET_RECENT_LOGS, GET_METRICS, GET_SERVER_STATUS,
            AUTHORIZE_MUTATIONS);

    private IntrospectionTools() {
        // utility class
    }

    record ListToolsArgs(
            @ToolArg(description = "Only tools that mutate state", defaultValue = "false") boolean onlyWrite,
            @ToolArg(description = "Only read-only tools", defaultValue = "false") boolean onlyRead,
            @ToolArg(description = "Case-insensitive name prefix", optional = true) String namePrefix,
            @ToolArg(description = "Include hidden tools", defaultValue = "false") boolean includeHidden) {}

    record ToolNameArgs(
            @ToolArg(description = "Tool name; common spelling variants are accepted") String name) {}

    record ValidateArgsArgs(
            @ToolArg(description = "Tool name") String name,
            @ToolArg(description = "Arguments to check", defaultValue = "{}") Map<String, Object> args) {}

    record RecentEventsArgs(
            @ToolArg(description = "Maximum records, newest first", defaultValue = "50") int limit,
            @ToolArg(description = "Include successful calls", defaultValue = "true") boolean includeSuccess) {}

    record LimitArgs(
            @ToolArg(description = "Maximum records, newest first", defaultValue = "50") int limit) {}

    record RecentLogsArgs(
            @ToolArg(description = "Maximum records, newest first", defaultValue = "100") int limit,
            @ToolArg(description = "Lowest level returned: debug, info, warn or error",
                    defaultValue = "\"info\"") String minLevel) {}

    record AuthorizeArgs(
            @ToolArg(description = "True to allow mutations of the protected ref", defaultValue = "true")
            boolean approved) {}

    /**
     * Registers every introspection tool that is not already registered under the same name.
     *
     * @return number of tools registered
     */
    public static int registerAll(ToolRegistry registry, ToolIntrospection introspection) {
        List<ToolDescriptor> tools = List.of(
                tool(LIST_TOOLS, "List registered tools with their schema summary")
                        .arguments(ListToolsArgs.class)
                        .handler(args -> {
                            ListToolsArgs a = args.as(ListToolsArgs.class);
                            return introspection.listTools(a.onlyWrite(), a.onlyRead(), a.namePrefix(),
                                    a.includeHidden());
                        })
                        .build(),
                tool(DESCRIBE_TOOL, "Return the full input schema of a tool")
                        .arguments(ToolNameArgs.class)
                        .handler(args -> introspection.describeTool(args.as(ToolNameArgs.class).name()))
                        .build(),
                tool(VALIDATE_ARGS, "Check arguments against a tool's schema without running it")
                        .arguments(ValidateArgsArgs.class)
                        .handler(args -> {
                            ValidateArgsArgs a = args.as(ValidateArgsArgs.class);
                            return introspection.validateArgs(a.name(), a.args());
                        })
                        .build(),
                tool(GET_RECENT_EVENTS, "Recent tool-call events")
                        .arguments(RecentEventsArgs.class)
                        .handler(args -> {
                            RecentEventsArgs a = args.as(RecentEventsArgs.class);
                            return introspection.recentEvents(a.limit(), a.includeSuccess());
                        })
                        .build(),
                tool(GET_RECENT_ERRORS, "Recent classified failures")
                        .arguments(LimitArgs.class)
                        .handler(args -> introspection.recentErrors(args.as(LimitArgs.class).limit()))
                        .build(),
                tool(GET_RECENT_LOGS, "Recent log lines emitted for tool calls")
                        .arguments(RecentLogsArgs.class)
                        .handler(args -> {
                            RecentLogsArgs a = args.as(RecentLogsArgs.class);
                            return introspection.recentLogs(a.limit(), a.minLevel());
                        })
                        .build(),
                tool(GET_METRICS, "Per-tool and per-dependency counters, dedup and buffer statistics")
                        .handler(args -> introspection.metrics())
                        .build(),
                tool(GET_SERVER_STATUS, "Health, credential presence and write-gate state")
                        .handler(args -> introspection.serverStatus())
                        .build(),
                tool(AUTHORIZE_MUTATIONS, "Allow or revoke mutations of the protected ref")
                        .arguments(AuthorizeArgs.class)
                        .handler(args -> introspection.authorizeMutations(args.as(AuthorizeArgs.class).approved()))
                        .build());

        int registered = 0;
        for (ToolDescriptor descriptor : tools) {
            if (registry.find(descriptor.name()).filter(t -> t.name().equals(descriptor.name())).isPresent()) {
                log.warn("Introspection tool '{}' already registered, keeping the existing one", descriptor.name());
                continue;
            }
            registry.register(descriptor);
            registered++;
        }
        log.debug("Registered {} introspection tools", registered);
        return registered;
    }

    private static ToolDescriptor.Builder tool(String name, String description) {
        return ToolDescriptor.builder(name)
                .description(description)
                .mutating(false)
                .deduplicated(false)
                .tag("introspection");
    }
}
