package com.wbem.cimobj.util;

import com.wbem.cimobj.types.Real32;
import com.wbem.cimobj.types.Real64;
import com.wbem.cimobj.types.Sint32;
import com.wbem.cimobj.types.Uint64;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CimEquality.
 */
class CimEqualityTest {

    @Test
    void testNames() {
        assertThat(CimEquality.namesEqual("CIM_Foo", "cim_foo")).isTrue();
        assertThat(CimEquality.namesEqual(null, null)).isTrue();
        assertThat(CimEquality.namesEqual("a", null)).isFalse();
        assertThat(CimEquality.nameHash("ABC")).isEqualTo(CimEquality.nameHash("abc"));
    }

    @Test
    void testIntegers() {
        BigInteger big = new BigInteger("18446744073709551615");

        assertThat(CimEquality.valuesEqual(new Uint64(big), big)).isTrue();
        assertThat(CimEquality.valuesEqual(new Sint32(-1), -1L)).isTrue();
        assertThat(CimEquality.valuesEqual(new Uint64(big), -1L)).isFalse();
    }

    @Test
    void testRealsCompareAtSinglePrecisionWhenEitherSideIsSingle() {
        assertThat(CimEquality.valuesEqual(new Real32(0.1f), 0.1)).isTrue();
        assertThat(CimEquality.valuesEqual(new Real64(0.1f), new Real64(0.1))).isFalse();
        assertThat(CimEquality.valuesEqual(Double.NaN, Double.NaN)).isFalse();
    }

    @Test
    void testCharacterEqualsSingleCharString() {
        assertThat(CimEquality.valuesEqual('a', "a")).isTrue();
        assertThat(CimEquality.valuesEqual("a", 'a')).isTrue();
        assertThat(CimEquality.valuesEqual('a', "ab")).isFalse();
        assertThat(CimEquality.valueHash('a')).isEqualTo(CimEquality.valueHash("a"));
    }

    @Test
    void testLists() {
        List<Object> a = Arrays.asList(new Sint32(1), null, "x");
        List<Object> b = Arrays.asList(1, null, 'x');

        assertThat(CimEquality.valuesEqual(a, b)).isTrue();
        assertThat(CimEquality.valueHash(a)).isEqualTo(CimEquality.valueHash(b));
        assertThat(CimEquality.valuesEqual(a, List.of(1))).isFalse();
    }
}
