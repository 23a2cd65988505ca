package org.iceforge.heimdall.execution.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.heimdall.execution.SubmissionValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the shell-like command text into a {@link MongoQuery}. Arguments must be strict JSON (or
 * extended JSON written as strict JSON, e.g. {@code {"$oid": "..."}}).
 */
public final class MongoQueryParser {

    private static final Pattern COMMAND = Pattern.compile(
            "^db(?:\\[[\"'](?<bracketName>[^\\]\"']+)[\"']\\]|\\.(?<dotName>[^.(]+))\\.(?<method>\\w+)\\((?<args>.*)\\)$",
            Pattern.DOTALL);

    static final String INVALID_FORMAT =
            "Invalid MongoDB query format. Expected: db.collection.method({...}) or db[\"collection\"].method({...})";
    static final String INVALID_ARGS = "Invalid query arguments. Must be valid JSON.";

    private final ObjectMapper mapper;

    public MongoQueryParser() {
        this(new ObjectMapper());
    }

    public MongoQueryParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public MongoQuery parse(String text) {
        if (text == null) {
            throw new SubmissionValidationException(INVALID_FORMAT);
        }
        Matcher m = COMMAND.matcher(text.trim());
        if (!m.matches()) {
            throw new SubmissionValidationException(INVALID_FORMAT);
        }
        String collection = m.group("bracketName") != null ? m.group("bracketName") : m.group("dotName");
        String methodName = m.group("method");
        List<JsonNode> args = parseArgs(m.group("args"));

        MongoMethod method = MongoMethod.fromMethodName(methodName)
                .orElseThrow(() -> new SubmissionValidationException("Unsupported MongoDB method: " + methodName));
        MongoQuery query = new MongoQuery(collection.trim(), method, args);
        checkArguments(query);
        return query;
    }

    private List<JsonNode> parseArgs(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            JsonNode wrapped = mapper.readTree("[" + raw + "]");
            List<JsonNode> out = new ArrayList<>();
            wrapped.forEach(out::add);
            return out;
        } catch (JsonProcessingException e) {
            try {
                JsonNode single = mapper.readTree(raw);
                if (single == null || single.isMissingNode()) {
                    throw new SubmissionValidationException(INVALID_ARGS);
                }
                return List.of(single);
            } catch (JsonProcessingException e2) {
                throw new SubmissionValidationException(INVALID_ARGS);
            }
        }
    }

    private static void checkArguments(MongoQuery query) {
        MongoMethod method = query.method();
        for (int i = 0; i < method.requiredArgs(); i++) {
            if (query.arg(i) == null) {
                throw new SubmissionValidationException(method.missingArgsMessage());
            }
        }
        JsonNode first = query.arg(0);
        switch (method) {
            case INSERT_MANY -> {
                if (!first.isArray()) throw new SubmissionValidationException(method.missingArgsMessage());
            }
            case AGGREGATE -> {
                if (first != null && !first.isArray()) {
                    throw new SubmissionValidationException("aggregate requires a pipeline array");
                }
            }
            default -> {
                if (first != null && !first.isObject()) {
                    throw new SubmissionValidationException(method.methodName() + " requires a JSON object as its first argument");
                }
            }
        }
    }
}
