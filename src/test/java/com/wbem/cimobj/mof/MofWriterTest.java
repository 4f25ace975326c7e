package com.wbem.cimobj.mof;

import com.wbem.cimobj.model.CIMClass;
import com.wbem.cimobj.model.CIMInstance;
import com.wbem.cimobj.model.CIMInstanceName;
import com.wbem.cimobj.model.CIMMethod;
import com.wbem.cimobj.model.CIMParameter;
import com.wbem.cimobj.model.CIMProperty;
import com.wbem.cimobj.model.CIMQualifier;
import com.wbem.cimobj.model.CIMQualifierDeclaration;
import com.wbem.cimobj.types.CIMDateTime;
import com.wbem.cimobj.types.Real64;
import com.wbem.cimobj.types.Sint8;
import com.wbem.cimobj.types.Uint32;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MofWriter.
 */
class MofWriterTest {

    @Test
    void testInstanceWithArrayProperty() {
        CIMInstance instance = new CIMInstance("C1");
        instance.put("p1", new CIMProperty("p1", List.of(new Sint8(-1), new Sint8(5))));

        assertThat(instance.toMof()).isEqualTo("instance of C1 {\n   p1 = { -1, 5 };\n};\n");
    }

    @Test
    void testInstanceScalarValues() {
        CIMInstance instance = new CIMInstance("CIM_Foo");
        instance.put("Name", "a \"quoted\" name");
        instance.put("Flag", true);
        instance.put("Empty", new CIMProperty("Empty", null, "uint32"));
        instance.put("Ratio", new Real64(1.5));
        instance.put("Letter", 'x');
        instance.put("When", new CIMDateTime("20140924193040.654321+120"));

        assertThat(instance.toMof()).isEqualTo("""
            instance of CIM_Foo {
               Name = "a \\"quoted\\" name";
               Flag = true;
               Empty = NULL;
               Ratio = 1.5;
               Letter = 'x';
               When = "20140924193040.654321+120";
            };
            """);
    }

    @Test
    void testInstanceReferenceValue() {
        CIMInstance instance = new CIMInstance("CIM_Assoc");
        instance.put("Ref", new CIMInstanceName("CIM_Foo", Map.of("Id", "1"), null, "root/cimv2"));

        assertThat(instance.toMof()).contains("   Ref = \"/root/cimv2:CIM_Foo.Id=\\\"1\\\"\";\n");
    }

    @Test
    void testArrayWithNull() {
        CIMProperty property = new CIMProperty("Names", Arrays.asList("a", null));

        assertThat(property.toMof()).isEqualTo("   Names = { \"a\", NULL };\n");
    }

    @Test
    void testLongStringIsWrapped() {
        String words = "word ".repeat(30).trim();
        CIMInstance instance = new CIMInstance("C");
        instance.put("Text", words);

        String mof = instance.toMof();

        assertThat(mof.lines()).allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(80));
        assertThat(mof).contains("\n      \"word ");
        assertThat(mof.replaceAll("\"\\s*\"", "")).contains("\"" + words + "\"");
    }

    @Test
    void testInstanceQualifiers() {
        CIMInstance instance = CIMInstance.builder()
            .classname("C")
            .qualifiers(List.of(new CIMQualifier("Description", "d")))
            .build();

        assertThat(instance.toMof()).isEqualTo("[Description ( \"d\" )]\ninstance of C {\n};\n");
    }

    @Test
    void testClass() {
        CIMClass cls = CIMClass.builder()
            .classname("CIM_Foo")
            .superclass("CIM_Base")
            .qualifiers(List.of(new CIMQualifier("Description", "Foo")))
            .properties(List.of(
                CIMProperty.builder().name("Count").type("uint32").qualifiers(Map.of("Key", true)).build(),
                CIMProperty.builder().name("Tags").type("string").isArray(true).arraySize(4).build(),
                new CIMProperty("Max", new Uint32(10))))
            .methods(List.of(new CIMMethod("Reset", "uint32")))
            .build();

        assertThat(cls.toMof()).isEqualTo("""
            [Description ( "Foo" )]
            class CIM_Foo : CIM_Base {

                  [Key ( true )]
               uint32 Count;

               string Tags[4];

               uint32 Max = 10;

               uint32 Reset();

            };
            """);
    }

    @Test
    void testMethodWithParameters() {
        CIMMethod method = CIMMethod.builder()
            .name("Move")
            .returnType("uint32")
            .parameters(List.of(
                CIMParameter.builder().name("Target").type("reference").referenceClass("CIM_Foo").build(),
                CIMParameter.builder().name("Steps").type("sint32").isArray(true).build()))
            .build();

        assertThat(method.toMof()).isEqualTo("""
               uint32 Move(
                  CIM_Foo REF Target,
                  sint32 Steps[]);
            """);
    }

    @Test
    void testArrayQualifier() {
        CIMQualifier qualifier = new CIMQualifier("ValueMap", List.of("0", "1"));

        assertThat(qualifier.toMof()).isEqualTo("ValueMap { \"0\", \"1\" }");
    }

    @Test
    void testQualifierListWrapsWhenTooLong() {
        CIMInstance instance = CIMInstance.builder()
            .classname("C")
            .qualifiers(List.of(
                new CIMQualifier("Description", "x".repeat(40)),
                new CIMQualifier("Other", "y".repeat(30))))
            .build();

        String mof = instance.toMof();

        assertThat(mof).startsWith("[Description ( \"" + "x".repeat(40) + "\" ),\n Other ( \"");
    }

    @Test
    void testQualifierDeclarationFlavors() {
        CIMQualifierDeclaration declaration = CIMQualifierDeclaration.builder()
            .name("Abstract")
            .type("boolean")
            .value(false)
            .scopes(List.of(Map.entry("CLASS", true)))
            .overridable(false)
            .tosubclass(false)
            .toinstance(true)
            .build();

        String mof = declaration.toMof();

        assertThat(mof).isEqualTo("""
            Qualifier Abstract : boolean = false,
                Scope(class),
                Flavor(DisableOverride, Restricted);
            """);
        assertThat(mof).doesNotContain("ToInstance");
    }

    @Test
    void testQualifierDeclarationArrayAndScopes() {
        CIMQualifierDeclaration declaration = CIMQualifierDeclaration.builder()
            .name("ValueMap")
            .type("string")
            .value(List.of("a", "b"))
            .scopes(Map.of("PROPERTY", true, "METHOD", true, "PARAMETER", true))
            .translatable(true)
            .build();

        assertThat(declaration.toMof()).isEqualTo("""
            Qualifier ValueMap : string[] = { "a", "b" },
                Scope(property, method, parameter),
                Flavor(Translatable);
            """);
    }

    @Test
    void testEmbeddedInstanceIsEscapedStringLiteral() {
        CIMInstance embedded = new CIMInstance("E");
        embedded.put("s", "say \"hi\"");
        CIMInstance instance = new CIMInstance("C");
        instance.put("e", embedded);

        assertThat(instance.toMof()).isEqualTo(
            "instance of C {\n   e = \"instance of E {\\n   s = \\\"say \\\\\\\"hi\\\\\\\"\\\";\\n};\\n\";\n};\n");
    }

    @Test
    void testLongEmbeddedInstanceIsSplit() {
        CIMInstance embedded = new CIMInstance("E");
        embedded.put("s", "a \"quoted\" word " + "filler ".repeat(12).trim());
        CIMProperty property = new CIMProperty("e", embedded);

        String mof = property.toMof();

        String[] lines = mof.split("\n");
        assertThat(lines.length).isGreaterThan(1);
        assertThat(lines).allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(MofWriter.MAX_MOF_LINE));
        assertThat(lines[0]).startsWith("   e = \"instance of E {\\n");
        assertThat(mof).endsWith("\";\n");

        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String fragment = i == 0 ? lines[i].substring("   e = ".length()) : lines[i].trim();
            if (i == lines.length - 1) {
                fragment = fragment.substring(0, fragment.length() - 1);
            }
            assertThat(fragment).startsWith("\"").endsWith("\"");
            literal.append(fragment, 1, fragment.length() - 1);
        }
        assertThat(literal.toString()).isEqualTo(MofStrings.escape(embedded.toMof()));
    }

    @Test
    void testEmbeddedClassIsEscapedStringLiteral() {
        CIMClass embedded = CIMClass.builder()
            .classname("E2")
            .properties(List.of(new CIMProperty("Max", new Uint32(10))))
            .build();
        CIMInstance instance = new CIMInstance("C");
        instance.put("c", embedded);

        assertThat(instance.toMof())
            .contains("   c = \"class E2 {\\n\\n   uint32 Max = 10;\\n\\n};\\n\";\n");
    }

    @Test
    void testReferencePropertyWithoutReferenceClass() {
        CIMProperty withValue = new CIMProperty("r", new CIMInstanceName("CIM_Foo", Map.of("Id", "1")));
        CIMProperty withoutValue = CIMProperty.builder().name("r").type("reference").build();

        assertThat(withValue.toMof(false)).isEqualTo("   CIM_Foo REF r = \"/:CIM_Foo.Id=\\\"1\\\"\";\n");
        assertThat(withoutValue.toMof(false)).isEqualTo("   REF r;\n");
    }

    @Test
    void testEmptyArrayValues() {
        CIMQualifierDeclaration declaration = CIMQualifierDeclaration.builder()
            .name("Q1")
            .type("string")
            .value(List.of())
            .scopes(List.of(Map.entry("CLASS", true)))
            .build();
        CIMQualifier qualifier = new CIMQualifier("Q2", List.of(), "string");

        assertThat(declaration.toMof()).isEqualTo("""
            Qualifier Q1 : string[] = { },
                Scope(class);
            """);
        assertThat(qualifier.toMof()).isEqualTo("Q2 { }");
        assertThat(new CIMProperty("p", List.of(), "string").toMof()).isEqualTo("   p = { };\n");
    }
}
