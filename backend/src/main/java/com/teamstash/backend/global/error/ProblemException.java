package com.teamstash.backend.global.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:teamstash:";

    private final String code;
    private final String detail;
    private final String type;
    private Map<String, Object> rejectedInput = Map.of();

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    /**
     * Attaches the input the caller submitted so the client can re-render it. Null values are kept.
     */
    public ProblemException withRejectedInput(Map<String, ?> input) {
        if (input != null && !input.isEmpty()) {
            this.rejectedInput = Collections.unmodifiableMap(new LinkedHashMap<>(input));
        }
        return this;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    public Map<String, Object> getRejectedInput() {
        return rejectedInput;
    }
}
