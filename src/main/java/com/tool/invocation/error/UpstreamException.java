package com.tool.invocation.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure reported by an external collaborator (remote API, workspace executor, ...).
 */
public class UpstreamException extends ToolInvocationException {

    private final String dependency;
    private final int statusCode;
    private final boolean rateLimited;

    public UpstreamException(String dependency, String message) {
        this(dependency, message, 0, false, null, null);
    }

    public UpstreamException(String dependency, String message, int statusCode) {
        this(dependency, message, statusCode, statusCode == 429, null, null);
    }

    /**
     * @param dependency  upstream bucket name, e.g. {@code github} or {@code workspace}
     * @param message     upstream error message
     * @param statusCode  HTTP-like status code, or 0 when not applicable
     * @param rateLimited whether the upstream reported rate limiting
     * @param originHint  explicit origin, or null to let the classifier infer it
     * @param cause       underlying exception, may be null
     */
    public UpstreamException(String dependency, String message, int statusCode, boolean rateLimited,
                             ErrorOrigin originHint, Throwable cause) {
        super(ErrorCategory.UPSTREAM, message, originHint,
                rateLimited || statusCode == 429 || statusCode >= 500,
                details(dependency, statusCode, rateLimited), cause);
        this.dependency = dependency;
        this.statusCode = statusCode;
        this.rateLimited = rateLimited || statusCode == 429;
    }

    public String getDependency() {
        return dependency;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }

    private static Map<String, Object> details(String dependency, int statusCode, boolean rateLimited) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dependency", dependency);
        if (statusCode > 0) {
            details.put("status_code", statusCode);
        }
        if (rateLimited || statusCode == 429) {
            details.put("rate_limited", true);
        }
        return details;
    }
}
