package ai.regen.generate;

import static org.junit.jupiter.api.Assertions.*;

import ai.regen.api.GenerationException;
import ai.regen.api.GenerationException.Reason;
import ai.regen.api.ModelSnapshot;
import ai.regen.marker.ContentSource;
import ai.regen.marker.MarkerDefinition;
import ai.regen.marker.MarkerType.Conditional;
import ai.regen.marker.MarkerType.ConditionalStrategy;
import ai.regen.marker.MarkerType.Generated;
import ai.regen.marker.MarkerType.GenerationStrategy;
import ai.regen.marker.MarkerType.Guard;
import ai.regen.marker.MarkerType.Import;
import ai.regen.marker.MarkerType.ImportMergeStrategy;
import ai.regen.marker.MarkerType.ImportType;
import ai.regen.marker.MarkerType.IterationSettings;
import ai.regen.marker.MarkerType.ParameterType;
import ai.regen.marker.MarkerType.Template;
import ai.regen.marker.MarkerType.TemplateParameter;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MarkerContentGeneratorTest {
    private final GeneratorRegistry functions = new GeneratorRegistry();
    private final MarkerContentGenerator generator = new MarkerContentGenerator(functions);

    private static MarkerDefinition generated(GenerationStrategy strategy, String template) {
        return MarkerDefinition.of(
                new Generated("body", strategy, List.of()), ContentSource.template(template));
    }

    private static Template template(
            Map<String, TemplateParameter> parameters, IterationSettings iteration) {
        return new Template("rows", parameters, iteration);
    }

    // ---------------------------------------------------------------- generated

    @Test
    void testGeneratedStrategies() throws GenerationException {
        var model = ModelSnapshot.of(Map.of("line", "b();"));

        assertEquals("b();", generator.generate(generated(GenerationStrategy.REPLACE, "{{line}}"), "a();", model));
        assertEquals("a();", generator.generate(generated(GenerationStrategy.IF_EMPTY, "{{line}}"), "a();", model));
        assertEquals("b();", generator.generate(generated(GenerationStrategy.IF_EMPTY, "{{line}}"), "  ", model));
        assertEquals(
                "a();\nb();", generator.generate(generated(GenerationStrategy.APPEND, "{{line}}"), "a();", model));
        assertEquals(
                "b();\na();", generator.generate(generated(GenerationStrategy.PREPEND, "{{line}}"), "a();", model));
    }

    @Test
    void testAppendAndPrependAreIdempotent() throws GenerationException {
        var model = ModelSnapshot.of(Map.of("line", "b();"));
        var append = generated(GenerationStrategy.APPEND, "{{line}}");
        var once = generator.generate(append, "a();", model);
        assertEquals(once, generator.generate(append, once, model));

        var prepend = generated(GenerationStrategy.PREPEND, "{{line}}");
        var first = generator.generate(prepend, "a();", model);
        assertEquals(first, generator.generate(prepend, first, model));
    }

    @Test
    void testMergeKeepsExistingLinesFirstWithoutDuplicates() throws GenerationException {
        var merge = MarkerDefinition.of(
                new Generated("derives", GenerationStrategy.MERGE, List.of()), ContentSource.text("Debug\nClone\n"));
        assertEquals("Serialize\nDebug\nClone", generator.generate(merge, "Serialize\n\nDebug", ModelSnapshot.empty()));
    }

    @Test
    void testStaticSourceIgnoresModel() throws GenerationException {
        var def = MarkerDefinition.of(
                new Generated("banner", GenerationStrategy.REPLACE, List.of()), ContentSource.text("{{not.rendered}}"));
        assertEquals("{{not.rendered}}", generator.generate(def, "", ModelSnapshot.empty()));
    }

    // ---------------------------------------------------------------- functions

    @Test
    void testFunctionSource() throws GenerationException {
        functions.register("upper", req -> req.model().lookup("name").orElseThrow().textValue().toUpperCase()
                + " in " + req.markerId());
        var def = MarkerDefinition.of(
                new Generated("title", GenerationStrategy.REPLACE, List.of()), ContentSource.function("upper", "name"));
        assertEquals("USER in title", generator.generate(def, "", ModelSnapshot.of(Map.of("name", "user"))));
        assertEquals(Set.of("name"), generator.dependencyKeys(def));
    }

    @Test
    void testUnknownAndFailingFunctions() {
        var unknown = MarkerDefinition.of(
                new Generated("a", GenerationStrategy.REPLACE, List.of()), ContentSource.function("nope"));
        var e = assertThrows(
                GenerationException.class, () -> generator.generate(unknown, "", ModelSnapshot.empty()));
        assertEquals(Reason.UNKNOWN_FUNCTION, e.reason());

        functions.register("boom", req -> {
            throw new IllegalStateException("kaboom");
        });
        var failing = MarkerDefinition.of(
                new Generated("a", GenerationStrategy.REPLACE, List.of()), ContentSource.function("boom"));
        e = assertThrows(GenerationException.class, () -> generator.generate(failing, "", ModelSnapshot.empty()));
        assertEquals(Reason.FUNCTION_FAILED, e.reason());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    // ---------------------------------------------------------------- conditionals

    @Test
    void testIncludeAndExclude() throws GenerationException {
        var model = ModelSnapshot.of(Map.of("features", Map.of("auth", true)));
        var include = MarkerDefinition.of(
                new Conditional("auth", "features.auth", ConditionalStrategy.INCLUDE), ContentSource.text("login();"));
        var exclude = MarkerDefinition.of(
                new Conditional("anon", "features.auth", ConditionalStrategy.EXCLUDE), ContentSource.text("guest();"));

        assertEquals("login();", generator.generate(include, "", model));
        assertEquals("", generator.generate(exclude, "", model));

        var off = ModelSnapshot.of(Map.of("features", Map.of("auth", false)));
        assertEquals("", generator.generate(include, "login();", off));
        assertEquals("guest();", generator.generate(exclude, "", off));
    }

    @Test
    void testSwitchSelectsAlternative() throws GenerationException {
        var def = new MarkerDefinition(
                new Conditional(
                        "storage",
                        "db.kind",
                        ConditionalStrategy.SWITCH,
                        Map.of("postgres", "PgPool::connect({{db.url}})", "default", "MemoryStore::new()")),
                null);

        var postgres = ModelSnapshot.of(Map.of("db", Map.of("kind", "postgres", "url", "pg://x")));
        assertEquals("PgPool::connect(pg://x)", generator.generate(def, "", postgres));
        assertEquals(
                "MemoryStore::new()",
                generator.generate(def, "", ModelSnapshot.of(Map.of("db", Map.of("kind", "sqlite")))));
        assertEquals(Set.of("db.kind", "db.url"), generator.dependencyKeys(def));
    }

    @Test
    void testSwitchWithoutMatchFails() {
        var def = new MarkerDefinition(
                new Conditional("s", "mode", ConditionalStrategy.SWITCH, Map.of("a", "A")), null);
        var e = assertThrows(
                GenerationException.class,
                () -> generator.generate(def, "", ModelSnapshot.of(Map.of("mode", "b"))));
        assertEquals(Reason.NO_MATCHING_ALTERNATIVE, e.reason());
    }

    @Test
    void testConditionOnMissingKeyFails() {
        var def = MarkerDefinition.of(
                new Conditional("c", "features.sso", ConditionalStrategy.INCLUDE), ContentSource.text("x"));
        var e = assertThrows(GenerationException.class, () -> generator.generate(def, "", ModelSnapshot.empty()));
        assertEquals(Reason.UNEVALUABLE_CONDITION, e.reason());
    }

    // ---------------------------------------------------------------- imports

    @Test
    void testImportKeepExistingPreservesManualImportFirst() throws GenerationException {
        // manual X present, model requires Y: X then Y
        var def = MarkerDefinition.of(
                new Import("module", ImportType.MODULE, ImportMergeStrategy.KEEP_EXISTING),
                ContentSource.template("{{imports}}"));
        var model = ModelSnapshot.of(Map.of("imports", List.of("use y::Y;")));

        assertEquals("use x::X;\nuse y::Y;", generator.generate(def, "use x::X;", model));
    }

    @Test
    void testImportStrategies() throws GenerationException {
        var model = ModelSnapshot.of(Map.of("imports", List.of("import b", "import a", "import b")));
        var existing = "import c\nimport a";

        assertEquals("import b\nimport a", generate(ImportMergeStrategy.REPLACE, existing, model));
        assertEquals("import a\nimport b\nimport c", generate(ImportMergeStrategy.MERGE, existing, model));
        assertEquals("import a\nimport b\nimport c", generate(ImportMergeStrategy.INTERACTIVE, existing, model));
        assertEquals("import c\nimport a\nimport b", generate(ImportMergeStrategy.KEEP_EXISTING, existing, model));
    }

    private String generate(ImportMergeStrategy strategy, String existing, ModelSnapshot model)
            throws GenerationException {
        var def = MarkerDefinition.of(
                new Import("module", ImportType.MODULE, strategy), ContentSource.template("{{imports}}"));
        return generator.generate(def, existing, model);
    }

    @Test
    void testImportFromMultiLineText() throws GenerationException {
        var def = MarkerDefinition.of(
                new Import("local", ImportType.LOCAL, ImportMergeStrategy.MERGE),
                ContentSource.text("mod b;\nmod a;\n"));
        assertEquals("mod a;\nmod b;", generator.generate(def, "", ModelSnapshot.empty()));
    }

    // ---------------------------------------------------------------- templates

    @Test
    void testIterationWithSeparator() throws GenerationException {
        // 3 items with ",\n" give exactly 2 separators, bodies in source order
        var def = MarkerDefinition.of(
                template(Map.of(), new IterationSettings("fields", "field", null, ",\n")),
                ContentSource.template("{{field.name}}: {{field.type}}"));
        var model = ModelSnapshot.of(Map.of(
                "fields",
                List.of(
                        Map.of("name", "id", "type", "u64"),
                        Map.of("name", "email", "type", "String"),
                        Map.of("name", "age", "type", "u8"))));

        var out = generator.generate(def, "", model);

        assertEquals("id: u64,\nemail: String,\nage: u8", out);
        assertEquals(2, out.split(",\n", -1).length - 1);
    }

    @Test
    void testIterationDefaultsAndIndex() throws GenerationException {
        var def = MarkerDefinition.of(
                template(Map.of(), new IterationSettings("names", null, "i", null)),
                ContentSource.template("{{i}}={{item}}"));
        var model = ModelSnapshot.of(Map.of("names", List.of("a", "b")));
        assertEquals("0=a\n1=b", generator.generate(def, "", model));

        var custom = new MarkerContentGenerator(new PlaceholderTemplateRenderer(), functions, "; ");
        assertEquals("0=a; 1=b", custom.generate(def, "", model));

        assertEquals("", generator.generate(def, "", ModelSnapshot.of(Map.of("names", List.of()))));
    }

    @Test
    void testIterationDataSourceErrors() {
        var def = MarkerDefinition.of(
                template(Map.of(), new IterationSettings("items", "item", null, null)),
                ContentSource.template("{{item}}"));

        var missing = assertThrows(GenerationException.class, () -> generator.generate(def, "", ModelSnapshot.empty()));
        assertEquals(Reason.MISSING_DATA_SOURCE, missing.reason());

        var notArray = assertThrows(
                GenerationException.class,
                () -> generator.generate(def, "", ModelSnapshot.of(Map.of("items", "x"))));
        assertEquals(Reason.INVALID_DATA_SOURCE, notArray.reason());
    }

    @Test
    void testTemplateParameters() throws GenerationException {
        var params = new LinkedHashMap<String, TemplateParameter>();
        params.put("name", TemplateParameter.required("name", ParameterType.STRING));
        params.put(
                "derive",
                new TemplateParameter("derive", ParameterType.STRING, TextNode.valueOf("Debug"), false, null, null));
        params.put("doc", new TemplateParameter("doc", ParameterType.STRING, null, false, "doc comment", null));
        params.put(
                "fieldCount",
                new TemplateParameter("fieldCount", ParameterType.INTEGER, null, true, null, "schema.count"));
        var def = MarkerDefinition.of(
                template(params, null),
                ContentSource.template("#[derive({{derive}})]{{doc}}\nstruct {{name}}; // {{fieldCount}} fields"));

        var model = ModelSnapshot.of(Map.of("name", "User", "schema", Map.of("count", 2)));
        assertEquals("#[derive(Debug)]\nstruct User; // 2 fields", generator.generate(def, "", model));
        assertEquals(Set.of("name", "derive", "doc", "schema.count"), generator.dependencyKeys(def));

        var missing = assertThrows(
                GenerationException.class,
                () -> generator.generate(def, "", ModelSnapshot.of(Map.of("schema", Map.of("count", 2)))));
        assertEquals(Reason.MISSING_PARAMETER, missing.reason());

        var invalid = assertThrows(
                GenerationException.class,
                () -> generator.generate(
                        def, "", ModelSnapshot.of(Map.of("name", "User", "schema", Map.of("count", "two")))));
        assertEquals(Reason.INVALID_PARAMETER, invalid.reason());
    }

    @Test
    void testParameterTypeMessageIgnoresDefaultLocale() {
        var params = new LinkedHashMap<String, TemplateParameter>();
        params.put("count", TemplateParameter.required("count", ParameterType.INTEGER));
        var def = MarkerDefinition.of(template(params, null), ContentSource.template("{{count}}"));
        var saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            var invalid = assertThrows(
                    GenerationException.class,
                    () -> generator.generate(def, "", ModelSnapshot.of(Map.of("count", "two"))));
            assertTrue(invalid.getMessage().endsWith("expects integer but got string"), invalid.getMessage());
        } finally {
            Locale.setDefault(saved);
        }
    }

    // ---------------------------------------------------------------- dependencies

    @Test
    void testDependencyKeys() {
        var props = MarkerDefinition.of(
                new Generated("props", GenerationStrategy.REPLACE, List.of("schema.fields")),
                ContentSource.template("{{schema.name}}"));
        assertEquals(Set.of("schema.fields", "schema.name"), generator.dependencyKeys(props));

        var rows = MarkerDefinition.of(
                template(Map.of(), new IterationSettings("rows", "row", "i", null)),
                ContentSource.template("{{row.id}} {{i}} {{title}}"));
        assertEquals(Set.of("rows", "title"), generator.dependencyKeys(rows));

        var cond = MarkerDefinition.of(
                new Conditional("c", "a.b && c == 'x'", ConditionalStrategy.INCLUDE), ContentSource.text("x"));
        assertEquals(Set.of("a.b", "c"), generator.dependencyKeys(cond));

        assertEquals(Set.of(), generator.dependencyKeys(MarkerDefinition.guard(Guard.of("g"))));
    }

    @Test
    void testGuardsAreNeverGenerated() {
        assertThrows(
                IllegalArgumentException.class,
                () -> generator.generate(MarkerDefinition.guard(Guard.of("g")), "", ModelSnapshot.empty()));
    }
}
