package io.github.jbellis.codegrapher.analyzer;

import io.github.jbellis.codegrapher.model.EntityKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.jbellis.codegrapher.testutil.SwiftSnippets.entity;
import static io.github.jbellis.codegrapher.testutil.SwiftSnippets.extract;
import static org.junit.jupiter.api.Assertions.*;

public class EntityBuilderTest {

    @Test
    void testClassInheritanceSplitsFirstEntryFromTheRest() {
        var foo = entity(extract("class Foo: Bar, Baz {}"), "Foo");
        assertEquals(EntityKind.CLASS, foo.kind());
        assertEquals(List.of("Bar"), foo.inheritedTypes());
        assertEquals(List.of("Baz"), foo.conformedProtocols());
    }

    @Test
    void testExtensionIsNamedAfterExtendedType() {
        var ext = entity(extract("extension Foo: Codable {}"), "Extension_of_Foo");
        assertEquals(EntityKind.EXTENSION, ext.kind());
        assertEquals(List.of(), ext.inheritedTypes());
        assertEquals(List.of("Codable"), ext.conformedProtocols());
    }

    @Test
    void testExtensionOfQualifiedType() {
        var extraction = extract("extension Outer.Inner {\n    func f() {}\n}");
        var ext = entity(extraction, "Extension_of_Outer.Inner");
        assertEquals(1, ext.methods().size());
    }

    @Test
    void testProtocolOnlyListIsClassifiedByPosition() {
        // Positional heuristic: Equatable is a protocol but lands in inheritedTypes
        var point = entity(extract("struct Point: Equatable, Hashable {\n    var x: Int\n}"), "Point");
        assertEquals(EntityKind.STRUCT, point.kind());
        assertEquals(List.of("Equatable"), point.inheritedTypes());
        assertEquals(List.of("Hashable"), point.conformedProtocols());
    }

    @Test
    void testEnumAndProtocolKinds() {
        var extraction = extract("""
                enum Direction: String {
                    case north, south
                }
                protocol Drawable: AnyObject {
                    func draw()
                }
                """);
        var direction = entity(extraction, "Direction");
        assertEquals(EntityKind.ENUM, direction.kind());
        assertEquals(List.of("String"), direction.inheritedTypes());

        var drawable = entity(extraction, "Drawable");
        assertEquals(EntityKind.PROTOCOL, drawable.kind());
        assertEquals(List.of("AnyObject"), drawable.inheritedTypes());
        assertTrue(drawable.conformedProtocols().isEmpty());
    }

    @Test
    void testModifiersDoNotChangeKind() {
        var extraction = extract("public final class Service: NSObject {}");
        var service = entity(extraction, "Service");
        assertEquals(EntityKind.CLASS, service.kind());
        assertEquals(List.of("NSObject"), service.inheritedTypes());
    }

    @Test
    void testNoInheritanceClause() {
        var plain = entity(extract("struct Plain {}"), "Plain");
        assertTrue(plain.inheritedTypes().isEmpty());
        assertTrue(plain.conformedProtocols().isEmpty());
        assertTrue(plain.properties().isEmpty());
        assertTrue(plain.methods().isEmpty());
    }

    @Test
    void testGenericSuperclassKeepsArguments() {
        var cache = entity(extract("class Cache: Store<String>, Sendable {}"), "Cache");
        assertEquals(List.of("Store<String>"), cache.inheritedTypes());
        assertEquals(List.of("Sendable"), cache.conformedProtocols());
    }
}
