package io.github.cyfko.entityql.jpa;

import io.github.cyfko.entityql.core.api.Condition;
import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.api.Criterion;
import io.github.cyfko.entityql.core.api.Operand;
import io.github.cyfko.entityql.core.exception.StoreException;
import io.github.cyfko.entityql.jpa.utils.JpaValueConverter;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.PluralAttribute;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Translates a predicate tree into a JPA Criteria {@link Predicate} over one entity root.
 *
 * <h2>Translation Rules</h2>
 * <ul>
 *   <li>Keys are attribute names, with {@code .} navigating embedded attributes. The configured
 *       id key resolves to the {@code @Id} attribute.</li>
 *   <li>Operands are converted to the attribute's Java type with {@link JpaValueConverter}</li>
 *   <li>{@code EQ null} is {@code IS NULL}; {@code NE} and {@code NOT_IN} also match
 *       {@code NULL} columns, like an absent key in a schemaless store</li>
 *   <li>{@code EXISTS} / {@code NOT_EXISTS} are {@code IS NOT NULL} / {@code IS NULL}</li>
 *   <li>{@code CONTAINS_ALL} requires a plural attribute and becomes one {@code MEMBER OF} per value</li>
 *   <li>Text matches become {@code LIKE} with escaped wildcards</li>
 *   <li>{@code REGEX} has no portable Criteria form and fails with {@link StoreException}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
class JpaPredicateBuilder implements Criterion.Visitor<Predicate> {

    private static final char ESCAPE = '\\';

    private final CriteriaBuilder cb;
    private final Root<?> root;
    private final EntityType<?> entityType;
    private final String idKey;
    private final String idAttribute;

    JpaPredicateBuilder(CriteriaBuilder cb, Root<?> root, EntityType<?> entityType, String idKey, String idAttribute) {
        this.cb = cb;
        this.root = root;
        this.entityType = entityType;
        this.idKey = idKey;
        this.idAttribute = idAttribute;
    }

    @Override
    public Predicate visitGroup(ConditionGroup group) {
        List<Predicate> predicates = new ArrayList<>(group.members().size());
        for (Criterion member : group.members()) {
            predicates.add(member.accept(this));
        }
        if (group.mode() == ConditionGroup.Mode.AND) {
            return predicates.isEmpty() ? cb.conjunction() : cb.and(predicates.toArray(new Predicate[0]));
        }
        return predicates.isEmpty() ? cb.disjunction() : cb.or(predicates.toArray(new Predicate[0]));
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Predicate visitCondition(Condition condition) {
        Path<?> path = resolve(condition.key());
        Class<?> javaType = path.getJavaType();

        return switch (condition.op()) {
            case EQ -> {
                Object value = convert(javaType, condition.scalarValue());
                yield value == null ? cb.isNull(path) : cb.equal(path, value);
            }
            case NE -> {
                Object value = convert(javaType, condition.scalarValue());
                yield value == null ? cb.isNotNull(path) : cb.or(cb.notEqual(path, value), cb.isNull(path));
            }
            case LT -> cb.lessThan((Expression<Comparable>) path, (Comparable) convert(javaType, condition.scalarValue()));
            case LTE -> cb.lessThanOrEqualTo((Expression<Comparable>) path, (Comparable) convert(javaType, condition.scalarValue()));
            case GT -> cb.greaterThan((Expression<Comparable>) path, (Comparable) convert(javaType, condition.scalarValue()));
            case GTE -> cb.greaterThanOrEqualTo((Expression<Comparable>) path, (Comparable) convert(javaType, condition.scalarValue()));
            case IN -> in(path, ((Operand.Sequence) condition.operand()).values());
            case NOT_IN -> notIn(path, ((Operand.Sequence) condition.operand()).values());
            case CONTAINS_ALL -> containsAll(condition.key(), ((Operand.Sequence) condition.operand()).values());
            case CONTAINS -> like(path, "%" + escape((String) condition.scalarValue()) + "%");
            case HAS_PREFIX -> like(path, escape((String) condition.scalarValue()) + "%");
            case HAS_SUFFIX -> like(path, "%" + escape((String) condition.scalarValue()));
            case EXISTS -> cb.isNotNull(path);
            case NOT_EXISTS -> cb.isNull(path);
            case REGEX -> throw new StoreException(
                    "REGEX on '" + condition.key() + "' has no JPA Criteria translation");
        };
    }

    private Predicate in(Path<?> path, List<Object> values) {
        List<Object> nonNull = new ArrayList<>();
        boolean hasNull = false;
        for (Object value : values) {
            if (value == null) {
                hasNull = true;
            } else {
                nonNull.add(convert(path.getJavaType(), value));
            }
        }
        if (nonNull.isEmpty()) {
            return cb.isNull(path);
        }
        Predicate in = path.in(nonNull);
        return hasNull ? cb.or(in, cb.isNull(path)) : in;
    }

    private Predicate notIn(Path<?> path, List<Object> values) {
        boolean hasNull = values.contains(null);
        Predicate in = in(path, values);
        return hasNull ? cb.not(in) : cb.or(cb.not(in), cb.isNull(path));
    }

    @SuppressWarnings("unchecked")
    private Predicate containsAll(String key, List<Object> values) {
        Attribute<?, ?> attribute = attribute(key);
        if (!(attribute instanceof PluralAttribute<?, ?, ?> plural)) {
            throw new StoreException("CONTAINS_ALL requires a collection attribute, '" + key + "' is not one");
        }
        Expression<Collection<Object>> collection = root.get(plural.getName());
        Class<?> elementType = plural.getElementType().getJavaType();
        List<Predicate> members = new ArrayList<>(values.size());
        for (Object value : values) {
            members.add(cb.isMember(convert(elementType, value), collection));
        }
        return cb.and(members.toArray(new Predicate[0]));
    }

    @SuppressWarnings("unchecked")
    private Predicate like(Path<?> path, String pattern) {
        if (path.getJavaType() != String.class) {
            throw new StoreException("Text matching requires a string attribute, got " + path.getJavaType().getName());
        }
        return cb.like((Expression<String>) path, pattern, ESCAPE);
    }

    Path<?> resolve(String key) {
        String name = key.equals(idKey) ? idAttribute : key;
        try {
            Path<?> path = root;
            for (String segment : name.split("\\.")) {
                path = path.get(segment);
            }
            return path;
        } catch (IllegalArgumentException e) {
            throw new StoreException("Unknown attribute '" + key + "' on entity " + entityType.getName(), e);
        }
    }

    private Attribute<?, ?> attribute(String key) {
        try {
            return entityType.getAttribute(key.equals(idKey) ? idAttribute : key);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Unknown attribute '" + key + "' on entity " + entityType.getName(), e);
        }
    }

    private static Object convert(Class<?> type, Object value) {
        try {
            return JpaValueConverter.convert(type, value);
        } catch (IllegalArgumentException e) {
            throw new StoreException(e.getMessage(), e);
        }
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
