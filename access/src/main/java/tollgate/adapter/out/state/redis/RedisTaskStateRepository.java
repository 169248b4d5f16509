package tollgate.adapter.out.state.redis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import tollgate.adapter.out.redis.RedisTimeoutHelper;
import tollgate.core.model.state.Diff;
import tollgate.core.model.state.OptimizationState;
import tollgate.core.port.out.TaskStateRepository;

/**
 * Redis implementation of TaskStateRepository.
 *
 * <p>Each task is one Redis hash under {@code {keyPrefix}{taskId}}:
 * <ul>
 *   <li>{@code taskId} - the task identifier</li>
 *   <li>{@code dryRun} - "true" or "false"</li>
 *   <li>{@code diffs} - the diff list as a JSON array</li>
 *   <li>{@code check:<name>} - one field per safety check, "true" or "false"</li>
 * </ul>
 *
 * <p>Updates rewrite a single field inside a Lua script that first checks the hash
 * exists, so an update never recreates a deleted or expired task and concurrent
 * updates to different checks never overwrite each other. Every write refreshes the
 * key's expiry to the retention period.
 */
public class RedisTaskStateRepository implements TaskStateRepository {

    private static final Logger LOG = Logger.getLogger(RedisTaskStateRepository.class);

    static final String FIELD_TASK_ID = "taskId";
    static final String FIELD_DRY_RUN = "dryRun";
    static final String FIELD_DIFFS = "diffs";
    static final String CHECK_FIELD_PREFIX = "check:";

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<Diff>> DIFF_LIST = new TypeReference<>() {};

    /**
     * Lua script replacing a whole record.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the task key</li>
     *   <li>ARGV[1] - retention in seconds</li>
     *   <li>ARGV[2..] - field/value pairs</li>
     * </ol>
     */
    static final String SAVE_SCRIPT =
            """
            local key = KEYS[1]
            local ttl_seconds = tonumber(ARGV[1])

            redis.call('DEL', key)
            for i = 2, #ARGV, 2 do
                redis.call('HSET', key, ARGV[i], ARGV[i + 1])
            end
            redis.call('EXPIRE', key, ttl_seconds)
            return 1
            """;

    /**
     * Lua script setting one field of an existing record.
     *
     * <p>Arguments: KEYS[1] task key, ARGV[1] field, ARGV[2] value, ARGV[3] retention
     * in seconds. Returns 1 if written, 0 if the record does not exist.
     */
    static final String UPDATE_FIELD_SCRIPT =
            """
            local key = KEYS[1]
            if redis.call('EXISTS', key) == 0 then
                return 0
            end
            redis.call('HSET', key, ARGV[1], ARGV[2])
            redis.call('EXPIRE', key, tonumber(ARGV[3]))
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final String keyPrefix;
    private final Duration retention;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisTaskStateRepository(
            ReactiveRedisDataSource redisDataSource,
            String keyPrefix,
            Duration retention,
            RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class);
        this.keyPrefix = keyPrefix;
        this.retention = retention;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Boolean> save(OptimizationState state) {
        final var args = new ArrayList<String>();
        args.add("EVAL");
        args.add(SAVE_SCRIPT);
        args.add("1");
        args.add(keyPrefix + state.taskId());
        args.add(retentionSeconds());
        args.add(FIELD_TASK_ID);
        args.add(state.taskId());
        args.add(FIELD_DRY_RUN);
        args.add(String.valueOf(state.dryRun()));
        args.add(FIELD_DIFFS);
        args.add(serializeDiffs(state.diffs()));
        state.safetyChecks().forEach((name, passed) -> {
            args.add(CHECK_FIELD_PREFIX + name);
            args.add(String.valueOf(passed));
        });

        final var operation = redisDataSource
                .execute(args.get(0), args.subList(1, args.size()).toArray(new String[0]))
                .map(this::isWritten);
        return timeoutHelper.withTimeoutFallback(operation, "save", () -> false);
    }

    @Override
    public Uni<Optional<OptimizationState>> findById(String taskId) {
        final var operation = hashCommands.hgetall(keyPrefix + taskId);
        return timeoutHelper
                .withTimeoutGraceful(operation, "findById")
                .map(fields -> fields.flatMap(f -> decode(taskId, f)));
    }

    @Override
    public Uni<Boolean> replaceDiffs(String taskId, List<Diff> diffs) {
        return updateField(taskId, FIELD_DIFFS, serializeDiffs(diffs), "replaceDiffs");
    }

    @Override
    public Uni<Boolean> recordSafetyCheck(String taskId, String checkName, boolean passed) {
        return updateField(taskId, CHECK_FIELD_PREFIX + checkName, String.valueOf(passed), "recordSafetyCheck");
    }

    private Uni<Boolean> updateField(String taskId, String field, String value, String operationName) {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        UPDATE_FIELD_SCRIPT,
                        "1", // numkeys
                        keyPrefix + taskId, // KEYS[1]
                        field, // ARGV[1]
                        value, // ARGV[2]
                        retentionSeconds() // ARGV[3]
                        )
                .map(this::isWritten);
        return timeoutHelper.withTimeoutFallback(operation, operationName, () -> false);
    }

    private boolean isWritten(Response response) {
        return response != null && response.toLong() == 1L;
    }

    private String retentionSeconds() {
        return String.valueOf(Math.max(1, retention.toSeconds()));
    }

    private Optional<OptimizationState> decode(String taskId, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        try {
            final var storedId = fields.get(FIELD_TASK_ID);
            if (!taskId.equals(storedId)) {
                throw new IllegalArgumentException("missing or inconsistent taskId field");
            }
            final var dryRun = parseFlag(FIELD_DRY_RUN, fields.get(FIELD_DRY_RUN));

            final var diffsJson = fields.get(FIELD_DIFFS);
            final List<Diff> diffs = diffsJson == null ? List.of() : OBJECT_MAPPER.readValue(diffsJson, DIFF_LIST);

            // Field order as returned by HGETALL
            final var checks = new LinkedHashMap<String, Boolean>();
            fields.forEach((field, value) -> {
                if (field.startsWith(CHECK_FIELD_PREFIX)) {
                    checks.put(field.substring(CHECK_FIELD_PREFIX.length()), parseFlag(field, value));
                }
            });

            return Optional.of(new OptimizationState(taskId, dryRun, diffs, checks));
        } catch (IOException | RuntimeException e) {
            LOG.warnv("Discarding malformed state record for task {0}: {1}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean parseFlag(String field, String value) {
        if ("true".equals(value)) {
            return true;
        }
        if ("false".equals(value)) {
            return false;
        }
        throw new IllegalArgumentException("field " + field + " is not a boolean: " + value);
    }

    private String serializeDiffs(List<Diff> diffs) {
        try {
            return OBJECT_MAPPER.writeValueAsString(diffs);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize diffs", e);
        }
    }
}
