package io.github.jbellis.codegrapher.analyzer;

import io.github.jbellis.codegrapher.model.MethodInfo;
import io.github.jbellis.codegrapher.model.ParameterInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.jbellis.codegrapher.testutil.SwiftSnippets.entity;
import static io.github.jbellis.codegrapher.testutil.SwiftSnippets.extract;
import static io.github.jbellis.codegrapher.testutil.SwiftSnippets.method;
import static org.junit.jupiter.api.Assertions.*;

public class SignatureExtractorTest {

    private static MethodInfo only(String typeBody) {
        var holder = entity(extract("class Holder {\n" + typeBody + "\n}"), "Holder");
        assertEquals(1, holder.methods().size(), () -> "methods: " + holder.methods());
        return holder.methods().get(0);
    }

    @Test
    void testLabelsNamesTypesAndReturn() {
        var f = only("func f(x: Int, label y: String) -> Bool { return g(x) }");
        assertEquals("f", f.name());
        assertEquals(List.of(new ParameterInfo(null, "x", "Int"),
                             new ParameterInfo("label", "y", "String")),
                     f.parameters());
        assertEquals("Bool", f.returnType());
        assertEquals(List.of("g"), f.calls());
    }

    @Test
    void testNoReturnClauseIsAbsent() {
        var f = only("func reset() { }");
        assertNull(f.returnType());
        assertTrue(f.parameters().isEmpty());
    }

    @Test
    void testWildcardLabelIsKeptAsExternalName() {
        var f = only("func add(_ value: Int) {}");
        assertEquals(List.of(new ParameterInfo("_", "value", "Int")), f.parameters());
    }

    @Test
    void testComplexTypesAreRenderedAsWritten() {
        var f = only("func load(from url: URL?, completion: @escaping (Data) -> Void) throws -> [String: Int] { }");
        assertEquals(2, f.parameters().size());
        assertEquals(new ParameterInfo("from", "url", "URL?"), f.parameters().get(0));
        var completion = f.parameters().get(1);
        assertNull(completion.externalName());
        assertEquals("completion", completion.internalName());
        assertEquals("@escaping (Data) -> Void", completion.type());
        assertEquals("[String: Int]", f.returnType());
    }

    @Test
    void testInoutKeepsModifierAndDefaultValueIsDropped() {
        var f = only("func bump(_ counter: inout Int, by step: Int = 1) {}");
        assertEquals(new ParameterInfo("_", "counter", "inout Int"), f.parameters().get(0));
        assertEquals(new ParameterInfo("by", "step", "Int"), f.parameters().get(1));
    }

    @Test
    void testVariadicMarkerIsNotPartOfType() {
        var f = only("func sum(_ values: Int...) -> Int { return 0 }");
        assertEquals(new ParameterInfo("_", "values", "Int"), f.parameters().get(0));
        assertEquals("Int", f.returnType());
    }

    @Test
    void testProtocolRequirementSignature() {
        var extraction = extract("""
                protocol Repository {
                    func find(id: String) -> Item?
                    func removeAll()
                }
                """);
        var repo = entity(extraction, "Repository");
        var find = method(repo, "find");
        assertEquals(List.of(new ParameterInfo(null, "id", "String")), find.parameters());
        assertEquals("Item?", find.returnType());
        assertTrue(find.calls().isEmpty());
        assertNull(method(repo, "removeAll").returnType());
    }

    @Test
    void testGenericFunction() {
        var f = only("func decode<T: Decodable>(_ type: T.Type, from data: Data) throws -> T { fatalError() }");
        assertEquals("decode", f.name());
        assertEquals(new ParameterInfo("_", "type", "T.Type"), f.parameters().get(0));
        assertEquals(new ParameterInfo("from", "data", "Data"), f.parameters().get(1));
        assertEquals("T", f.returnType());
        assertEquals(List.of("fatalError"), f.calls());
    }
}
