package org.iceforge.heimdall.execution.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertManyResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;
import org.iceforge.heimdall.execution.ExecutionLimits;
import org.iceforge.heimdall.execution.QueryExecutor;
import org.iceforge.heimdall.execution.SubmissionValidationException;
import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.FailureCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs shell-like commands ({@code db.orders.find({...})}) against one MongoDB database through the
 * sync driver. Reads carry a server-side {@code maxTime}; writes rely on the driver's socket timeouts.
 */
public class DocumentQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(DocumentQueryExecutor.class);

    private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    private final MongoClient client;
    private final String databaseName;
    private final Duration operationTimeout;
    private final boolean ownsClient;
    private final MongoQueryParser parser;
    private final ObjectMapper mapper = new ObjectMapper();

    public DocumentQueryExecutor(MongoClient client, String databaseName, Duration operationTimeout, boolean ownsClient) {
        this.client = Objects.requireNonNull(client, "client");
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName");
        this.operationTimeout = operationTimeout == null ? Duration.ofSeconds(60) : operationTimeout;
        this.ownsClient = ownsClient;
        this.parser = new MongoQueryParser(mapper);
    }

    @Override
    public ExecutionOutcome execute(String queryText) {
        long start = System.nanoTime();
        try {
            MongoQueryScreen.check(queryText);
            MongoQuery query = parser.parse(queryText);
            MongoCollection<Document> collection = database().getCollection(query.collection());

            Object result = run(collection, query);
            long rowCount = result instanceof List<?> list ? list.size() : 1L;
            String output = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(result));
            log.info("Document query executed collection={} method={} rowCount={} durationMs={}",
                    query.collection(), query.method().methodName(), rowCount, elapsedMs(start));
            return ExecutionOutcome.success(output, rowCount);
        } catch (SubmissionValidationException e) {
            log.info("Document query rejected: {}", e.getMessage());
            return ExecutionOutcome.failure(FailureCategory.VALIDATION, e.getMessage());
        } catch (JsonParseException e) {
            return ExecutionOutcome.failure(FailureCategory.VALIDATION, MongoQueryParser.INVALID_ARGS);
        } catch (MongoExecutionTimeoutException e) {
            log.warn("Document query timed out durationMs={} timeoutMs={}", elapsedMs(start), operationTimeout.toMillis());
            return ExecutionOutcome.failure(FailureCategory.TIMEOUT, ExecutionLimits.timeoutMessage(operationTimeout));
        } catch (MongoException e) {
            log.error("Document query failed durationMs={} code={}: {}", elapsedMs(start), e.getCode(), e.getMessage());
            return ExecutionOutcome.failure(FailureCategory.EXECUTION, e.getMessage());
        } catch (JsonProcessingException e) {
            return ExecutionOutcome.failure(FailureCategory.EXECUTION, "Failed to render result: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("Document query failed durationMs={}: {}", elapsedMs(start), e.toString());
            return ExecutionOutcome.failure(FailureCategory.EXECUTION, e.getMessage() == null ? e.toString() : e.getMessage());
        }
    }

    private Object run(MongoCollection<Document> collection, MongoQuery q) {
        long maxTimeMs = operationTimeout.toMillis();
        return switch (q.method()) {
            case FIND -> collection.find(doc(q.arg(0)))
                    .maxTime(maxTimeMs, TimeUnit.MILLISECONDS)
                    .into(new ArrayList<>());
            case FIND_ONE -> collection.find(doc(q.arg(0)))
                    .maxTime(maxTimeMs, TimeUnit.MILLISECONDS)
                    .first();
            case AGGREGATE -> collection.aggregate(docs(q.arg(0)))
                    .maxTime(maxTimeMs, TimeUnit.MILLISECONDS)
                    .into(new ArrayList<>());
            case COUNT_DOCUMENTS -> collection.countDocuments(doc(q.arg(0)),
                    new CountOptions().maxTime(maxTimeMs, TimeUnit.MILLISECONDS));
            case INSERT_ONE -> collection.insertOne(doc(q.arg(0)));
            case INSERT_MANY -> collection.insertMany(docs(q.arg(0)));
            case UPDATE_ONE -> q.arg(1).isArray()
                    ? collection.updateOne(doc(q.arg(0)), docs(q.arg(1)))
                    : collection.updateOne(doc(q.arg(0)), doc(q.arg(1)));
            case UPDATE_MANY -> q.arg(1).isArray()
                    ? collection.updateMany(doc(q.arg(0)), docs(q.arg(1)))
                    : collection.updateMany(doc(q.arg(0)), doc(q.arg(1)));
            case DELETE_ONE -> collection.deleteOne(doc(q.arg(0)));
            case DELETE_MANY -> collection.deleteMany(doc(q.arg(0)));
        };
    }

    /** JSON text goes through {@link Document#parse} so extended JSON ({@code $oid}, {@code $date}) is honoured. */
    private static Document doc(JsonNode node) {
        return node == null ? new Document() : Document.parse(node.toString());
    }

    private static List<Document> docs(JsonNode node) {
        List<Document> out = new ArrayList<>();
        if (node == null) return out;
        for (JsonNode element : node) {
            out.add(doc(element));
        }
        return out;
    }

    private JsonNode toJson(Object result) throws JsonProcessingException {
        if (result == null) {
            return mapper.nullNode();
        }
        if (result instanceof Document d) {
            return mapper.readTree(d.toJson(RELAXED));
        }
        if (result instanceof List<?> list) {
            ArrayNode arr = mapper.createArrayNode();
            for (Object item : list) arr.add(toJson(item));
            return arr;
        }
        if (result instanceof Long n) {
            return mapper.getNodeFactory().numberNode(n);
        }
        ObjectNode node = mapper.createObjectNode();
        if (result instanceof InsertOneResult r) {
            node.put("acknowledged", r.wasAcknowledged());
            node.set("insertedId", bsonToJson(r.getInsertedId()));
        } else if (result instanceof InsertManyResult r) {
            node.put("acknowledged", r.wasAcknowledged());
            node.put("insertedCount", r.getInsertedIds().size());
            ObjectNode ids = node.putObject("insertedIds");
            for (Map.Entry<Integer, BsonValue> e : r.getInsertedIds().entrySet()) {
                ids.set(String.valueOf(e.getKey()), bsonToJson(e.getValue()));
            }
        } else if (result instanceof UpdateResult r) {
            node.put("acknowledged", r.wasAcknowledged());
            if (r.wasAcknowledged()) {
                node.put("matchedCount", r.getMatchedCount());
                node.put("modifiedCount", r.getModifiedCount());
            }
            node.set("upsertedId", bsonToJson(r.getUpsertedId()));
        } else if (result instanceof DeleteResult r) {
            node.put("acknowledged", r.wasAcknowledged());
            if (r.wasAcknowledged()) {
                node.put("deletedCount", r.getDeletedCount());
            }
        } else {
            return mapper.getNodeFactory().textNode(result.toString());
        }
        return node;
    }

    private JsonNode bsonToJson(BsonValue value) throws JsonProcessingException {
        if (value == null) return mapper.nullNode();
        return mapper.readTree(new BsonDocument("v", value).toJson(RELAXED)).get("v");
    }

    private MongoDatabase database() {
        return client.getDatabase(databaseName);
    }

    @Override
    public boolean ping() {
        try {
            database().runCommand(new Document("ping", 1));
            return true;
        } catch (MongoException e) {
            log.debug("Document ping failed db={}: {}", databaseName, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (ownsClient) {
            client.close();
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
