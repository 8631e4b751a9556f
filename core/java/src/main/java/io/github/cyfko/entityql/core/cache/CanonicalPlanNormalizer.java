package io.github.cyfko.entityql.core.cache;

import io.github.cyfko.entityql.core.api.Condition;
import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.api.Criterion;
import io.github.cyfko.entityql.core.api.Operand;
import io.github.cyfko.entityql.core.api.RegexOption;
import io.github.cyfko.entityql.core.model.MapReduce;
import io.github.cyfko.entityql.core.model.QueryPlan;
import io.github.cyfko.entityql.core.model.SortBy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizer producing an order-insensitive canonical text for the conditions of each group.
 *
 * <h2>Normalization Rules</h2>
 * <ul>
 *   <li>Inside every group, conditions are sorted by key, then operator, then the canonical
 *       encoding of their operand, and emitted first</li>
 *   <li>Nested groups follow in their declared order (OR branches and AND sub-groups are
 *       ordered sequences)</li>
 *   <li>Operands are type-tagged, so {@code 1}, {@code 1L} and {@code "1"} never collide</li>
 *   <li>Map-reduce context entries are sorted by key. The client-side result processor is
 *       not encoded: cached entries hold the unprocessed store output</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <p>Given:</p>
 * <pre>{@code
 * query.whereKeyEqualTo("status", "ACTIVE");
 * query.whereKeyGreaterThan("age", 18);
 * query.or().whereKeyEqualTo("tier", "GOLD");
 * query.or().whereKeyExists("sponsor");
 * query.orderDescendingByKey("age");
 * query.setLimit(10);
 * }</pre>
 * <p>the canonical text is:</p>
 * <pre>
 * entity="users";where=AND("age" GT n:Integer:18,"status" EQ s:"ACTIVE",OR(AND("tier" EQ s:"GOLD"),AND("sponsor" EXISTS -)));order="age":DESC;limit=10;skip=0;mr=-
 * </pre>
 * <p>
 * Inserting {@code age} before {@code status} yields the same text; declaring the two OR branches
 * in the opposite order does not.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CanonicalPlanNormalizer implements PlanNormalizer {

    /** Shared stateless instance. */
    public static final CanonicalPlanNormalizer INSTANCE = new CanonicalPlanNormalizer();

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private static final Comparator<Condition> CONDITION_ORDER = Comparator
            .comparing(Condition::key)
            .thenComparing(Condition::op)
            .thenComparing(condition -> encodeOperand(condition.operand()));

    private CanonicalPlanNormalizer() {
    }

    @Override
    public String normalize(QueryPlan plan) {
        StringBuilder out = new StringBuilder(128);
        out.append("entity=").append(quote(plan.entityName()));
        out.append(";where=");
        appendGroup(out, plan.predicate());
        out.append(";order=").append(encodeOrder(plan.order()));
        out.append(";limit=").append(plan.limit());
        out.append(";skip=").append(plan.skip());
        out.append(";mr=").append(encodeMapReduce(plan.mapReduce()));
        return out.toString();
    }

    /**
     * Computes the fingerprint of a plan: the lowercase hex SHA-256 of its canonical text.
     *
     * @param plan the plan
     * @return a 64-character fingerprint
     */
    public String fingerprint(QueryPlan plan) {
        return sha256(normalize(plan));
    }

    private void appendGroup(StringBuilder out, ConditionGroup group) {
        List<Condition> conditions = new ArrayList<>();
        List<ConditionGroup> groups = new ArrayList<>();
        for (Criterion member : group.members()) {
            if (member instanceof Condition condition) {
                conditions.add(condition);
            } else {
                groups.add((ConditionGroup) member);
            }
        }
        conditions.sort(CONDITION_ORDER);

        out.append(group.mode()).append('(');
        boolean first = true;
        for (Condition condition : conditions) {
            if (!first) out.append(',');
            first = false;
            out.append(quote(condition.key())).append(' ').append(condition.op().name())
                    .append(' ').append(encodeOperand(condition.operand()));
        }
        for (ConditionGroup nested : groups) {
            if (!first) out.append(',');
            first = false;
            appendGroup(out, nested);
        }
        out.append(')');
    }

    private static String encodeOrder(SortBy order) {
        return order == null ? "-" : quote(order.key()) + ":" + order.direction();
    }

    private static String encodeMapReduce(MapReduce mapReduce) {
        if (mapReduce == null) {
            return "-";
        }
        return "map=" + quote(mapReduce.mapFunction())
                + ",reduce=" + quote(mapReduce.reduceFunction())
                + ",finalize=" + (mapReduce.finalizeFunction() == null ? "-" : quote(mapReduce.finalizeFunction()))
                + ",context=" + encodeValue(mapReduce.context());
    }

    static String encodeOperand(Operand operand) {
        if (operand instanceof Operand.Scalar scalar) {
            return encodeValue(scalar.value());
        }
        if (operand instanceof Operand.Sequence sequence) {
            return encodeValue(sequence.values());
        }
        if (operand instanceof Operand.Pattern pattern) {
            StringBuilder flags = new StringBuilder();
            for (RegexOption option : pattern.options()) {
                flags.append(option.getFlag());
            }
            return "/" + pattern.regex().replace("\\", "\\\\").replace("/", "\\/") + "/" + flags;
        }
        return "-";
    }

    private static String encodeValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            return "s:" + quote(text);
        }
        if (value instanceof Number number) {
            return "n:" + number.getClass().getSimpleName() + ":" + number;
        }
        if (value instanceof Boolean bool) {
            return "b:" + bool;
        }
        if (value instanceof Enum<?> constant) {
            return "e:" + constant.getDeclaringClass().getName() + "." + constant.name();
        }
        if (value instanceof Collection<?> collection) {
            StringBuilder out = new StringBuilder("[");
            boolean first = true;
            for (Object element : collection) {
                if (!first) out.append(',');
                first = false;
                out.append(encodeValue(element));
            }
            return out.append(']').toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
            StringBuilder out = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<String, Object> entry : sorted.entrySet()) {
                if (!first) out.append(',');
                first = false;
                out.append(quote(entry.getKey())).append('=').append(encodeValue(entry.getValue()));
            }
            return out.append('}').toString();
        }
        return "o:" + value.getClass().getName() + ":" + quote(value.toString());
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private static String sha256(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            char[] hex = new char[digest.length * 2];
            for (int i = 0; i < digest.length; i++) {
                hex[i * 2] = HEX[(digest[i] >> 4) & 0xF];
                hex[i * 2 + 1] = HEX[digest[i] & 0xF];
            }
            return new String(hex);
        } catch (NoSuchAlgorithmException e) {
            // every JVM is required to provide SHA-256
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
