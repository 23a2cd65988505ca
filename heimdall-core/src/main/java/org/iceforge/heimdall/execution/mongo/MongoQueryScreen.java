package org.iceforge.heimdall.execution.mongo;

import org.iceforge.heimdall.execution.SubmissionValidationException;

import java.util.List;
import java.util.Locale;

/**
 * Blocks operators that run server-side JavaScript or evaluate expressions. Checked against the raw
 * text before it is parsed or sent anywhere.
 */
public final class MongoQueryScreen {

    static final List<String> BLOCKED_OPERATORS = List.of("$where", "$function", "$accumulator", "mapReduce", "$expr");

    private MongoQueryScreen() {}

    public static void check(String queryText) {
        if (queryText == null) return;
        String upper = queryText.toUpperCase(Locale.ROOT);
        for (String operator : BLOCKED_OPERATORS) {
            if (upper.contains(operator.toUpperCase(Locale.ROOT))) {
                throw new SubmissionValidationException("Dangerous operator \"" + operator + "\" is not allowed in queries");
            }
        }
        if (queryText.contains("function(") || queryText.contains("function (")) {
            throw new SubmissionValidationException("JavaScript functions are not allowed in queries");
        }
    }
}
