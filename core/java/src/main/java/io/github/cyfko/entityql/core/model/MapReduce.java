package io.github.cyfko.entityql.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Map-reduce stage attached to a query.
 * <p>
 * The job definition is opaque to the engine: map, reduce and finalize functions are carried as
 * source text in whatever language the store executes, together with a context of shared
 * variables. The engine only guarantees the invocation contract: the predicate of the query
 * selects the input records, the store runs the job, and the raw output rows are returned
 * as-is, without ordering, skip or limit being reapplied.
 * </p>
 * <p>
 * An optional {@code resultProcessor} runs client-side on the raw output each time it is
 * returned, whether the output comes from the store or from the cache. The cache keeps the
 * raw output, so the processor is not part of the plan fingerprint.
 * </p>
 *
 * <pre>{@code
 * MapReduce perCategory = MapReduce.of(
 *     "function() { emit(this.category, this.price); }",
 *     "function(key, values) { return Array.sum(values); }");
 * query.setMapReduce(perCategory);
 * }</pre>
 *
 * @param mapFunction      source of the map function
 * @param reduceFunction   source of the reduce function
 * @param finalizeFunction source of the finalize function, may be {@code null}
 * @param context          variables made available to the job, unmodifiable
 * @param resultProcessor  client-side post-processing of the output, may be {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MapReduce(String mapFunction,
                        String reduceFunction,
                        String finalizeFunction,
                        Map<String, Object> context,
                        UnaryOperator<List<EntityRecord>> resultProcessor) {

    public MapReduce {
        Objects.requireNonNull(mapFunction, "Map function cannot be null");
        Objects.requireNonNull(reduceFunction, "Reduce function cannot be null");
        context = context == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static MapReduce of(String mapFunction, String reduceFunction) {
        return new MapReduce(mapFunction, reduceFunction, null, null, null);
    }

    public MapReduce withFinalizeFunction(String finalizeFunction) {
        return new MapReduce(mapFunction, reduceFunction, finalizeFunction, context, resultProcessor);
    }

    public MapReduce withContext(Map<String, Object> context) {
        return new MapReduce(mapFunction, reduceFunction, finalizeFunction, context, resultProcessor);
    }

    public MapReduce withResultProcessor(UnaryOperator<List<EntityRecord>> resultProcessor) {
        return new MapReduce(mapFunction, reduceFunction, finalizeFunction, context, resultProcessor);
    }

    /**
     * Applies the result processor, if any, to the raw job output.
     *
     * @param output the rows returned by the store
     * @return the processed rows
     */
    public List<EntityRecord> process(List<EntityRecord> output) {
        return resultProcessor == null ? output : resultProcessor.apply(output);
    }
}
