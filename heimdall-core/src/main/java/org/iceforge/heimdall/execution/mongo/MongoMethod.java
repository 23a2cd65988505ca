package org.iceforge.heimdall.execution.mongo;

import java.util.Optional;

/**
 * Collection methods the mini-language accepts, with the arguments each one cannot run without.
 */
public enum MongoMethod {
    FIND("find", 0, null),
    FIND_ONE("findOne", 0, null),
    AGGREGATE("aggregate", 0, null),
    COUNT_DOCUMENTS("countDocuments", 0, null),
    INSERT_ONE("insertOne", 1, "insertOne requires a document"),
    INSERT_MANY("insertMany", 1, "insertMany requires documents array"),
    UPDATE_ONE("updateOne", 2, "updateOne requires filter and update"),
    UPDATE_MANY("updateMany", 2, "updateMany requires filter and update"),
    DELETE_ONE("deleteOne", 1, "deleteOne requires a filter"),
    DELETE_MANY("deleteMany", 1, "deleteMany requires a filter");

    private final String methodName;
    private final int requiredArgs;
    private final String missingArgsMessage;

    MongoMethod(String methodName, int requiredArgs, String missingArgsMessage) {
        this.methodName = methodName;
        this.requiredArgs = requiredArgs;
        this.missingArgsMessage = missingArgsMessage;
    }

    public String methodName() {
        return methodName;
    }

    public int requiredArgs() {
        return requiredArgs;
    }

    String missingArgsMessage() {
        return missingArgsMessage;
    }

    public boolean isRead() {
        return this == FIND || this == FIND_ONE || this == AGGREGATE || this == COUNT_DOCUMENTS;
    }

    /** Case-sensitive, like the shell. */
    public static Optional<MongoMethod> fromMethodName(String name) {
        for (MongoMethod m : values()) {
            if (m.methodName.equals(name)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
