package com.wbem.cimobj.util;

import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.types.Uint8;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NocaseDict.
 */
class NocaseDictTest {

    @Test
    void testLookupIgnoresCase() {
        NocaseDict<String> dict = new NocaseDict<>();
        dict.put("InstanceID", "1");

        assertThat(dict.get("instanceid")).isEqualTo("1");
        assertThat(dict.containsKey("INSTANCEID")).isTrue();
        assertThat(dict.getStoredKey("instanceID")).isEqualTo("InstanceID");
    }

    @Test
    void testReplaceKeepsPositionAndTakesNewCase() {
        NocaseDict<Integer> dict = new NocaseDict<>();
        dict.put("A", 1);
        dict.put("B", 2);
        dict.put("C", 3);

        dict.put("b", 20);

        assertThat(dict.keys()).containsExactly("A", "b", "C");
        assertThat(dict.get("B")).isEqualTo(20);
        assertThat(dict).hasSize(3);
    }

    @Test
    void testRemove() {
        NocaseDict<Integer> dict = new NocaseDict<>();
        dict.put("Key", 1);

        assertThat(dict.remove("KEY")).isEqualTo(1);
        assertThat(dict.remove("KEY")).isNull();
        assertThat(dict).isEmpty();
    }

    @Test
    void testUnnamedKeys() {
        NocaseDict<String> strict = new NocaseDict<>();
        NocaseDict<String> lenient = new NocaseDict<>(true);

        assertThatThrownBy(() -> strict.put(null, "x")).isInstanceOf(CIMTypeException.class);
        assertThat(strict.containsKey(null)).isFalse();
        lenient.put(null, "x");
        assertThat(lenient.get(null)).isEqualTo("x");
        assertThat(lenient.keys()).containsExactly((String) null);
    }

    @Test
    void testNonStringKeys() {
        NocaseDict<String> dict = new NocaseDict<>();

        assertThat(dict.containsKey(42)).isFalse();
        assertThatThrownBy(() -> dict.get(42)).isInstanceOf(CIMTypeException.class);
    }

    @Test
    void testEqualityIsOrderAndCaseIndependent() {
        NocaseDict<Object> a = new NocaseDict<>();
        a.put("One", new Uint8(1));
        a.put("Two", "2");
        NocaseDict<Object> b = new NocaseDict<>();
        b.put("TWO", "2");
        b.put("one", 1);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void testEqualityWithPlainMapIsOneSided() {
        NocaseDict<Object> dict = new NocaseDict<>();
        dict.put("One", new Uint8(1));
        Map<String, Object> plain = new HashMap<>();
        plain.put("One", 1);

        assertThat(dict.equals(plain)).isTrue();
        assertThat(plain.equals(dict)).isFalse();
    }

    @Test
    void testUnnamedKeyEquality() {
        NocaseDict<Object> lenient = new NocaseDict<>(true);
        lenient.put(null, "x");
        NocaseDict<Object> strict = new NocaseDict<>();
        strict.put("k", "x");
        NocaseDict<Object> otherLenient = new NocaseDict<>(true);
        otherLenient.put(null, "x");

        assertThat(lenient.equals(strict)).isFalse();
        assertThat(lenient).isEqualTo(otherLenient);
    }

    @Test
    void testCopyIsIndependent() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("x", List.of(1));
        NocaseDict<Object> dict = new NocaseDict<>(source);

        NocaseDict<Object> copy = dict.copy();
        copy.put("y", 2);

        assertThat(dict).hasSize(1);
        assertThat(copy.get("X")).isSameAs(dict.get("x"));
    }
}
