package com.tool.invocation.error;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a classified failure into an ordered list of concrete next steps.
 *
 * <p>Remote-mutation tools may declare a local-workspace fallback; when such a tool
 * fails upstream (or is rejected by the platform) the fallback is recommended first.</p>
 */
public class RemediationAdvisor {

    static final String DESCRIBE_TOOL = "describe_tool";
    static final String VALIDATE_ARGS = "validate_args";
    static final String AUTHORIZE_MUTATIONS = "authorize_mutations";
    static final String RECENT_ERRORS = "get_recent_errors";

    private final Map<String, String> localFallbacks;

    public RemediationAdvisor() {
        this(Map.of());
    }

    /**
     * @param localFallbacks remote tool name to local-workspace alternate tool name
     */
    public RemediationAdvisor(Map<String, String> localFallbacks) {
        this.localFallbacks = localFallbacks != null ? Map.copyOf(localFallbacks) : Map.of();
    }

    public List<RemediationStep> advise(ErrorCategory category, ErrorOrigin origin, String toolName) {
        List<RemediationStep> steps = new ArrayList<>();
        String fallback = toolName != null ? localFallbacks.get(toolName) : null;

        if (origin == ErrorOrigin.EXTERNAL_PLATFORM) {
            if (fallback != null) {
                steps.add(new RemediationStep("use_local_fallback",
                        "The platform blocked '" + toolName + "' before it reached the server; "
                                + "perform the same change with '" + fallback + "' in the local workspace.",
                        fallback));
            }
            steps.add(RemediationStep.of("retry_unchanged",
                    "The request was rejected outside this server; retrying the identical call is safe."));
        }

        switch (category) {
            case VALIDATION -> {
                steps.add(new RemediationStep("fetch_schema",
                        "Fetch the tool schema and resend arguments that conform exactly; do not guess field names.",
                        DESCRIBE_TOOL));
                steps.add(new RemediationStep("validate_arguments",
                        "Dry-run the corrected arguments before calling the tool again.",
                        VALIDATE_ARGS));
            }
            case AUTHORIZATION -> {
                steps.add(RemediationStep.of("target_unprotected_ref",
                        "Run the mutation against a feature branch instead of the protected branch."));
                steps.add(new RemediationStep("authorize_mutations",
                        "Ask the operator to enable mutations, then retry the same call.",
                        AUTHORIZE_MUTATIONS));
            }
            case TIMEOUT -> {
                steps.add(RemediationStep.of("retry_with_longer_timeout",
                        "Retry with a longer timeout."));
                steps.add(RemediationStep.of("reduce_scope",
                        "Narrow the request (fewer paths, smaller ranges) so it finishes within the deadline."));
            }
            case UPSTREAM -> {
                if (fallback != null && origin != ErrorOrigin.EXTERNAL_PLATFORM) {
                    steps.add(new RemediationStep("use_local_fallback",
                            "Use '" + fallback + "' to make the same change in the local workspace.",
                            fallback));
                }
                steps.add(RemediationStep.of("retry_with_backoff",
                        "Wait briefly and retry; the upstream service reported a failure or rate limit."));
                steps.add(new RemediationStep("inspect_recent_errors",
                        "Check recent errors for a pattern before retrying repeatedly.",
                        RECENT_ERRORS));
            }
            case UNKNOWN -> {
                steps.add(new RemediationStep("inspect_recent_errors",
                        "Inspect recent errors and logs for this call id.",
                        RECENT_ERRORS));
                steps.add(RemediationStep.of("report_issue",
                        "If the failure repeats with valid arguments, report it with the call id."));
            }
        }
        return steps;
    }
}
