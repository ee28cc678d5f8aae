package io.validata.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.validata.core.model.ValidationReport;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the response body an HTTP integration writes when a request fails validation.
 *
 * <p>
 * Supports two modes:
 * <ul>
 * <li><b>Default</b>: {@code {"status": false, "errors": {...}}} with the report as
 * {@code errors}.</li>
 * <li><b>Custom template</b>: operator-defined JSON in which {@code {{errors}}} is replaced by
 * the report object.</li>
 * </ul>
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ReportResponseBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ReportResponseBuilder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_STATUS = 422;
    static final String ERRORS_PLACEHOLDER = "{{errors}}";

    private final int status;
    private final String customTemplate; // null for default mode

    /** Creates a builder with HTTP status 422 in default mode. */
    public ReportResponseBuilder() {
        this(DEFAULT_STATUS);
    }

    /**
     * Creates a builder with a custom HTTP status code in default mode.
     *
     * @param status the HTTP status code to use in responses
     */
    public ReportResponseBuilder(int status) {
        this.status = status;
        this.customTemplate = null;
    }

    private ReportResponseBuilder(String customTemplate, int status) {
        this.status = status;
        this.customTemplate = customTemplate;
    }

    /**
     * Creates a builder in custom template mode. {@code {{errors}}} must appear where a JSON value
     * is expected, e.g. {@code {"ok": false, "problems": {{errors}}}}.
     *
     * @param template the JSON template string
     * @param status   the HTTP status code to use in responses
     * @return a new builder in custom template mode
     */
    public static ReportResponseBuilder withCustomTemplate(String template, int status) {
        return new ReportResponseBuilder(Objects.requireNonNull(template, "template must not be null"), status);
    }

    /**
     * Builds the response body for {@code report}.
     *
     * @return a {@link JsonNode} response
     */
    public JsonNode buildResponse(ValidationReport report) {
        Objects.requireNonNull(report, "report must not be null");
        if (customTemplate != null) {
            return buildCustomResponse(report);
        }
        return buildDefaultResponse(report);
    }

    /** Returns the HTTP status code used by this builder. */
    public int status() {
        return status;
    }

    // --- Private helpers ---

    private static JsonNode buildDefaultResponse(ValidationReport report) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("status", false);
        response.set("errors", report.toJson());
        return response;
    }

    private JsonNode buildCustomResponse(ValidationReport report) {
        try {
            String errors = MAPPER.writeValueAsString(report.toJson());
            return MAPPER.readTree(customTemplate.replace(ERRORS_PLACEHOLDER, errors));
        } catch (JsonProcessingException e) {
            // The substituted template is not valid JSON: fall back to the default body.
            LOG.warn("response.template_invalid detail={}", e.getOriginalMessage());
            return buildDefaultResponse(report);
        }
    }
}
