package ai.regen.rewrite;

import static org.junit.jupiter.api.Assertions.*;

import ai.regen.api.ModelSnapshot;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ChangeSetTest {

    @Test
    void testBetweenReportsLeafChanges() throws Exception {
        var before = ModelSnapshot.fromJson(
                """
                {"schema": {"name": "User", "fields": ["a", "b"]}, "title": "x", "gone": 1}
                """);
        var after = ModelSnapshot.fromJson(
                """
                {"schema": {"name": "User", "fields": ["a", "b", "c"]}, "title": "x", "added": {"k": 1}}
                """);

        assertEquals(Set.of("schema.fields", "gone", "added"), ChangeSet.between(before, after).keys());
    }

    @Test
    void testBetweenTypeChangeIsReportedAtThatKey() throws Exception {
        var before = ModelSnapshot.fromJson("{\"a\": {\"b\": 1}}");
        var after = ModelSnapshot.fromJson("{\"a\": [1]}");
        assertEquals(Set.of("a"), ChangeSet.between(before, after).keys());
    }

    @Test
    void testBetweenIdenticalModelsIsEmpty() {
        var model = ModelSnapshot.of(Map.of("a", List.of(1, 2)));
        var changes = ChangeSet.between(model, ModelSnapshot.of(Map.of("a", List.of(1, 2))));
        assertTrue(changes.isEmpty());
        assertEquals(ChangeSet.none(), changes);
    }

    @Test
    void testAllAndOf() {
        assertTrue(ChangeSet.all().isAll());
        assertFalse(ChangeSet.all().isEmpty());
        assertTrue(ChangeSet.all().keys().isEmpty());
        assertEquals(ChangeSet.of("b", "a"), ChangeSet.of(List.of("a", "b")));
        assertTrue(ChangeSet.of().isEmpty());
        assertEquals("ChangeSet[a, b]", ChangeSet.of("b", "a").toString());
    }
}
