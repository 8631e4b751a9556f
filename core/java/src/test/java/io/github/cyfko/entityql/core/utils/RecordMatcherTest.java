package io.github.cyfko.entityql.core.utils;

import io.github.cyfko.entityql.core.api.Condition;
import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.api.Op;
import io.github.cyfko.entityql.core.api.RegexOption;
import io.github.cyfko.entityql.core.model.EntityRecord;
import io.github.cyfko.entityql.core.model.SortBy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordMatcher Tests")
class RecordMatcherTest {

    private static final EntityRecord ALICE = record("name", "Alice", "age", 30, "tags", List.of("java", "jpa"), "nickname", null);
    private static final EntityRecord BOB = record("name", "Bob", "age", 17L);

    private static EntityRecord record(Object... keyValues) {
        Map<String, Object> attributes = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            attributes.put((String) keyValues[i], keyValues[i + 1]);
        }
        return EntityRecord.of(attributes);
    }

    private static boolean matches(EntityRecord record, Op op, String key, Object value) {
        return RecordMatcher.matches(record, Condition.of(key, op, value));
    }

    @Nested
    @DisplayName("Comparison operators")
    class Comparisons {

        @Test
        @DisplayName("Numbers compare by value across types")
        void numericAcrossTypes() {
            assertTrue(matches(ALICE, Op.EQ, "age", 30L));
            assertTrue(matches(ALICE, Op.EQ, "age", new BigDecimal("30.0")));
            assertTrue(matches(BOB, Op.LT, "age", 18));
            assertTrue(matches(ALICE, Op.GTE, "age", 30.0));
            assertFalse(matches(ALICE, Op.GT, "age", 30));
        }

        @Test
        @DisplayName("EQ null matches missing keys and null values")
        void nullEquality() {
            assertTrue(matches(ALICE, Op.EQ, "nickname", null));
            assertTrue(matches(BOB, Op.EQ, "nickname", null));
            assertFalse(matches(ALICE, Op.EQ, "name", null));
            assertTrue(matches(ALICE, Op.NE, "name", null));
        }

        @Test
        @DisplayName("NE matches a missing key")
        void notEqualMissing() {
            assertTrue(matches(BOB, Op.NE, "tags", "java"));
            assertFalse(matches(ALICE, Op.NE, "name", "Alice"));
        }

        @Test
        @DisplayName("Range comparisons never match missing or incomparable values")
        void rangeMissing() {
            assertFalse(matches(BOB, Op.GT, "score", 1));
            assertFalse(matches(ALICE, Op.GT, "name", 1));
        }

        @Test
        @DisplayName("EQ on a collection value matches any element")
        void equalityOnCollection() {
            assertTrue(matches(ALICE, Op.EQ, "tags", "jpa"));
            assertFalse(matches(ALICE, Op.EQ, "tags", "go"));
        }
    }

    @Nested
    @DisplayName("Membership and text operators")
    class MembershipAndText {

        @Test
        @DisplayName("IN and NOT_IN")
        void inAndNotIn() {
            assertTrue(matches(ALICE, Op.IN, "name", List.of("Alice", "Carol")));
            assertFalse(matches(BOB, Op.IN, "name", List.of("Alice", "Carol")));
            assertTrue(matches(BOB, Op.NOT_IN, "name", List.of("Alice", "Carol")));
            assertTrue(matches(BOB, Op.NOT_IN, "missing", List.of("x")));
        }

        @Test
        @DisplayName("CONTAINS_ALL requires every value in a collection")
        void containsAll() {
            assertTrue(matches(ALICE, Op.CONTAINS_ALL, "tags", List.of("jpa", "java")));
            assertFalse(matches(ALICE, Op.CONTAINS_ALL, "tags", List.of("java", "go")));
            assertFalse(matches(ALICE, Op.CONTAINS_ALL, "name", List.of("Alice")));
            assertTrue(matches(record("ids", new int[]{1, 2, 3}), Op.CONTAINS_ALL, "ids", List.of(3L, 1)));
        }

        @Test
        @DisplayName("REGEX finds the pattern and honours options")
        void regex() {
            assertTrue(matches(ALICE, Op.REGEX, "name", "lic"));
            assertFalse(matches(ALICE, Op.REGEX, "name", "^lic"));
            assertTrue(RecordMatcher.matches(ALICE,
                    Condition.regex("name", "^ALICE$", Set.of(RegexOption.CASE_INSENSITIVE))));
            assertFalse(matches(ALICE, Op.REGEX, "age", "3"));
        }

        @Test
        @DisplayName("Substring, prefix and suffix")
        void textMatches() {
            assertTrue(matches(ALICE, Op.CONTAINS, "name", "lic"));
            assertTrue(matches(ALICE, Op.HAS_PREFIX, "name", "Al"));
            assertTrue(matches(ALICE, Op.HAS_SUFFIX, "name", "ce"));
            assertFalse(matches(ALICE, Op.HAS_PREFIX, "name", "al"));
            assertFalse(matches(BOB, Op.CONTAINS, "nickname", "x"));
        }

        @Test
        @DisplayName("EXISTS tests key presence even for null values")
        void existence() {
            assertTrue(RecordMatcher.matches(ALICE, Condition.exists("nickname")));
            assertFalse(RecordMatcher.matches(BOB, Condition.exists("nickname")));
            assertTrue(RecordMatcher.matches(BOB, Condition.notExists("nickname")));
        }
    }

    @Test
    @DisplayName("Empty AND matches everything, empty OR matches nothing")
    void emptyGroups() {
        assertTrue(RecordMatcher.matches(ALICE, ConditionGroup.matchAll()));
        assertFalse(RecordMatcher.matches(ALICE, ConditionGroup.or(List.of())));
    }

    @Test
    @DisplayName("Contradictory conditions are unsatisfiable, not invalid")
    void contradictoryConditions() {
        ConditionGroup group = ConditionGroup.and(List.of(
                Condition.of("age", Op.EQ, 30),
                Condition.of("age", Op.EQ, 31)));

        assertFalse(RecordMatcher.matches(ALICE, group));
    }

    @Test
    @DisplayName("Sorting is stable and puts missing keys first when ascending")
    void sorting() {
        EntityRecord first = record("id", 1, "score", 9);
        EntityRecord second = record("id", 2);
        EntityRecord third = record("id", 3, "score", 9);
        EntityRecord fourth = record("id", 4, "score", 5L);

        List<EntityRecord> ascending = RecordComparators.sort(List.of(first, second, third, fourth), SortBy.ascending("score"));
        List<EntityRecord> descending = RecordComparators.sort(List.of(first, second, third, fourth), SortBy.descending("score"));

        assertEquals(List.of(second, fourth, first, third), ascending);
        assertEquals(List.of(first, third, fourth, second), descending);
        assertEquals(List.of(fourth), RecordComparators.page(ascending, 1, 1));
        assertEquals(List.of(), RecordComparators.page(ascending, 10, 0));
    }
}
