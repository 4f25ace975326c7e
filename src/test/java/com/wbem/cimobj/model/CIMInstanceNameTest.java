package com.wbem.cimobj.model;

import com.wbem.cimobj.config.CimConfig;
import com.wbem.cimobj.diagnostics.CimWarning;
import com.wbem.cimobj.diagnostics.CimWarnings;
import com.wbem.cimobj.diagnostics.WarningCategory;
import com.wbem.cimobj.exception.CIMKeyException;
import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.types.Uint16;
import com.wbem.cimobj.types.Uint8;
import com.wbem.cimobj.uri.WbemUriFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CIMInstanceName and CIMClassName.
 */
class CIMInstanceNameTest {

    @AfterEach
    void resetConfig() {
        CimConfig.resetGlobal();
    }

    private static CIMInstanceName chickenPath() {
        Map<String, Object> keys = new LinkedHashMap<>();
        keys.put("Chicken", "Ham");
        keys.put("Beans", new Uint8(42));
        return new CIMInstanceName("CIM_Foo", keys);
    }

    @Test
    void testMapLikeAccess() {
        CIMInstanceName path = chickenPath();

        assertThat(path.get("chicken")).isEqualTo("Ham");
        assertThat(path.size()).isEqualTo(2);
        assertThat(path.containsKey("beans")).isTrue();
        assertThat(path.keys()).containsExactly("Chicken", "Beans");
        assertThat(path).containsExactly("Chicken", "Beans");
        assertThat(path.get("Missing", "dflt")).isEqualTo("dflt");
        assertThatThrownBy(() -> path.get("Missing"))
            .isInstanceOf(CIMKeyException.class)
            .hasMessageContaining("Missing");
    }

    @Test
    void testStandardUriRoundTrip() {
        CIMInstanceName path = chickenPath();

        String uri = path.toWbemUri(WbemUriFormat.STANDARD);

        assertThat(uri).isEqualTo("/:CIM_Foo.Chicken=\"Ham\",Beans=42");
        assertThat(CIMInstanceName.fromWbemUri(uri)).isEqualTo(path);
    }

    @Test
    void testToStringIsHistoricalUri() {
        CIMInstanceName path = CIMInstanceName.builder()
            .classname("CIM_Foo")
            .keybindings(Map.of("InstanceID", "1234"))
            .namespace("root/cimv2")
            .build();

        assertThat(path.toString()).isEqualTo("root/cimv2:CIM_Foo.InstanceID=\"1234\"");
    }

    @Test
    void testEqualityIgnoresCase() {
        CIMInstanceName a = new CIMInstanceName("CIM_Foo", Map.of("Key", "v"), "Host", "Root/CIMV2");
        CIMInstanceName b = new CIMInstanceName("cim_foo", Map.of("KEY", "v"), "host", "root/cimv2");

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(new CIMInstanceName("CIM_Foo", Map.of("Key", "V")));
    }

    @Test
    void testEqualityIsOrderIndependent() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("A", "1");
        first.put("B", new Uint16(2));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("B", new Uint16(2));
        second.put("A", "1");

        CIMInstanceName a = new CIMInstanceName("C", first);
        CIMInstanceName b = new CIMInstanceName("C", second);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void testNamespaceSlashesAreStripped() {
        CIMInstanceName path = new CIMInstanceName("C", null, null, "//root/cimv2/");

        assertThat(path.getNamespace()).isEqualTo("root/cimv2");
        assertThat(new CIMClassName("C", null, "/").getNamespace()).isNull();
    }

    @Test
    void testClassnameIsRequired() {
        assertThatThrownBy(() -> new CIMInstanceName(null)).isInstanceOf(CIMValueException.class);
        assertThatThrownBy(() -> new CIMClassName("")).isInstanceOf(CIMValueException.class);
    }

    @Test
    void testNullKeyValueRejectedByDefault() {
        Map<String, Object> keys = new LinkedHashMap<>();
        keys.put("K", null);

        assertThatThrownBy(() -> new CIMInstanceName("C", keys)).isInstanceOf(CIMValueException.class);
    }

    @Test
    void testNullKeyValueAcceptedWhenConfigured() {
        CimConfig.global().setIgnoreNullKeyValue(true);
        Map<String, Object> keys = new LinkedHashMap<>();
        keys.put("K", null);

        CIMInstanceName path = new CIMInstanceName("C", keys);

        assertThat(path.get("K")).isNull();
        assertThat(path.toWbemUri()).isEqualTo("/:C.K=\"\"");
    }

    @Test
    void testInvalidKeybindingValues() {
        assertThatThrownBy(() -> new CIMInstanceName("C", Map.of("K", List.of("a"))))
            .isInstanceOf(CIMTypeException.class);
        assertThatThrownBy(() -> new CIMInstanceName("C", Map.of("K", new CIMInstance("E"))))
            .isInstanceOf(CIMTypeException.class);
        assertThatThrownBy(() -> new CIMInstanceName("C", Map.of("K", new Object())))
            .isInstanceOf(CIMTypeException.class);
    }

    @Test
    void testPlainNumberKeyWarns() {
        List<CimWarning> warnings = CimWarnings.capture(() -> new CIMInstanceName("C", Map.of("K", 42)));

        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getCategory()).isEqualTo(WarningCategory.DEPRECATION);
    }

    @Test
    void testPropertyAsKeybinding() {
        CIMInstanceName path = new CIMInstanceName("C", List.of(new CIMProperty("Id", "abc")));

        assertThat(path.get("id")).isEqualTo("abc");
        assertThatThrownBy(() -> new CIMInstanceName("C", Map.of("Other", new CIMProperty("Id", "abc"))))
            .isInstanceOf(CIMValueException.class);
    }

    @Test
    void testPutRemoveAndUpdate() {
        CIMInstanceName path = chickenPath();

        path.put("Eggs", true);
        path.remove("CHICKEN");
        path.update(Map.of("beans", new Uint8(7)));

        assertThat(path.keys()).containsExactly("beans", "Eggs");
        assertThat(path.get("Beans")).isEqualTo(7);
        assertThatThrownBy(() -> path.remove("Chicken")).isInstanceOf(CIMKeyException.class);
    }

    @Test
    void testCopyIsIndependent() {
        CIMInstanceName nested = new CIMInstanceName("Inner", Map.of("Id", "1"));
        CIMInstanceName path = new CIMInstanceName("Outer", Map.of("Ref", nested));

        CIMInstanceName copy = path.copy();
        ((CIMInstanceName) copy.get("Ref")).put("Id", "2");
        copy.put("Other", "x");

        assertThat(path.size()).isEqualTo(1);
        assertThat(nested.get("Id")).isEqualTo("1");
        assertThat(copy).isNotEqualTo(path);
    }

    @Test
    void testFromInstance() {
        CIMClass cls = CIMClass.builder()
            .classname("CIM_Foo")
            .properties(List.of(
                CIMProperty.builder().name("Id").type("string").qualifiers(Map.of("Key", true)).build(),
                new CIMProperty("Data", null, "uint32")))
            .build();
        CIMInstance instance = new CIMInstance("CIM_Foo", Map.of("Id", "x1", "Data", new Uint16(3)));

        CIMInstanceName path = CIMInstanceName.fromInstance(cls, instance, "root/cimv2", null, true);

        assertThat(path.keys()).containsExactly("Id");
        assertThat(path.get("id")).isEqualTo("x1");
        assertThat(path.getNamespace()).isEqualTo("root/cimv2");
        assertThatThrownBy(() -> CIMInstanceName.fromInstance(cls, new CIMInstance("CIM_Foo")))
            .isInstanceOf(CIMValueException.class);
    }

    @Test
    void testClassNameUris() {
        CIMClassName path = CIMClassName.builder().classname("CIM_Foo").host("Acme.com").namespace("root/cimv2")
            .build();

        assertThat(path.toWbemUri()).isEqualTo("//Acme.com/root/cimv2:CIM_Foo");
        assertThat(path.toString()).isEqualTo("//Acme.com/root/cimv2:CIM_Foo");
        assertThat(CIMClassName.fromWbemUri("//acme.com/root/cimv2:cim_foo")).isEqualTo(path);
        assertThatThrownBy(() -> CIMClassName.fromWbemUri("/:CIM_Foo.K=1"))
            .isInstanceOf(CIMValueException.class);
    }
}
