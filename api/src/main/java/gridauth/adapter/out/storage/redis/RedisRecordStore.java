package gridauth.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import gridauth.spi.StorageProviderException;

/**
 * JSON record storage with atomic compare-and-swap, shared by the Redis repositories.
 *
 * <p>Records are stored as JSON strings with a TTL matching their expiry. A swap
 * compares the stored JSON with the serialized expected record inside a Lua
 * script, so serialization must be deterministic: properties are written in
 * alphabetical order and callers must not serialize unordered collections.
 *
 * @param <T> the stored record type
 */
class RedisRecordStore<T> {

    static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .addModule(new Jdk8Module())
            .addModule(new JavaTimeModule())
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    // KEYS[1] record; ARGV[1] expected JSON; ARGV[2] replacement JSON
    private static final String COMPARE_AND_SET_SCRIPT = """
            local current = redis.call('GET', KEYS[1])
            if current ~= ARGV[1] then
              return 0
            end
            redis.call('SET', KEYS[1], ARGV[2], 'KEEPTTL')
            return 1
            """;

    // KEYS[1] record; ARGV[1] expected JSON
    private static final String COMPARE_AND_DELETE_SCRIPT = """
            if redis.call('GET', KEYS[1]) == ARGV[1] then
              return redis.call('DEL', KEYS[1])
            end
            return 0
            """;

    private final ReactiveRedisDataSource dataSource;
    private final String keyPrefix;
    private final Class<T> type;
    private final RedisTimeoutHelper timeoutHelper;

    RedisRecordStore(
            ReactiveRedisDataSource dataSource, String keyPrefix, Class<T> type, RedisTimeoutHelper timeoutHelper) {
        this.dataSource = dataSource;
        this.keyPrefix = keyPrefix;
        this.type = type;
        this.timeoutHelper = timeoutHelper;
    }

    String key(String id) {
        return keyPrefix + id;
    }

    /**
     * Store a record unless the id is taken. The key expires at {@code expiresAt}.
     */
    Uni<Boolean> insertIfAbsent(String id, T record, Instant expiresAt) {
        final var operation = dataSource
                .execute("SET", key(id), serialize(record), "PX", ttlMillis(expiresAt), "NX")
                .map(response -> response != null && "OK".equals(response.toString()));
        return timeoutHelper.withTimeout(operation, "insert");
    }

    Uni<Optional<T>> get(String id) {
        final var operation = dataSource
                .execute("GET", key(id))
                .map(response -> response == null ? Optional.<T>empty() : Optional.of(deserialize(response.toString())));
        return timeoutHelper.withTimeout(operation, "get");
    }

    /**
     * Load several records at once, skipping ids whose keys have expired.
     */
    Uni<List<T>> getAll(List<String> ids) {
        if (ids.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        final var args = ids.stream().map(this::key).toArray(String[]::new);
        final var operation = dataSource.execute("MGET", args).map(response -> {
            final var records = new ArrayList<T>();
            if (response != null) {
                for (var i = 0; i < response.size(); i++) {
                    final var item = response.get(i);
                    if (item != null) {
                        records.add(deserialize(item.toString()));
                    }
                }
            }
            return (List<T>) records;
        });
        return timeoutHelper.withTimeout(operation, "getAll");
    }

    Uni<Boolean> compareAndSet(String id, T expected, T replacement) {
        final var operation = dataSource
                .execute("EVAL", COMPARE_AND_SET_SCRIPT, "1", key(id), serialize(expected), serialize(replacement))
                .map(RedisRecordStore::isOne);
        return timeoutHelper.withTimeout(operation, "replace");
    }

    Uni<Boolean> compareAndDelete(String id, T expected) {
        final var operation = dataSource
                .execute("EVAL", COMPARE_AND_DELETE_SCRIPT, "1", key(id), serialize(expected))
                .map(RedisRecordStore::isOne);
        return timeoutHelper.withTimeout(operation, "remove");
    }

    /**
     * Run a raw command under the store's timeout.
     */
    Uni<Response> execute(String operationName, String command, String... args) {
        return timeoutHelper.withTimeout(dataSource.execute(command, args), operationName);
    }

    String serialize(T record) {
        try {
            return OBJECT_MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StorageProviderException("Failed to serialize " + type.getSimpleName(), e);
        }
    }

    T deserialize(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageProviderException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    static String ttlMillis(Instant expiresAt) {
        return String.valueOf(Math.max(1, Duration.between(Instant.now(), expiresAt).toMillis()));
    }

    static boolean isOne(Response response) {
        return response != null && response.toLong() == 1L;
    }
}
