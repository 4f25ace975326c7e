package com.wbem.cimobj.types;

import com.wbem.cimobj.config.CimConfig;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.exception.OutOfRangeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the CIM integer and real types.
 */
class CIMIntTest {

    @AfterEach
    void resetConfig() {
        CimConfig.resetGlobal();
    }

    @Test
    void testRangeLimits() {
        assertThat(new Uint8(255).intValue()).isEqualTo(255);
        assertThat(new Sint8(-128).intValue()).isEqualTo(-128);
        assertThat(new Uint64(new BigInteger("18446744073709551615")).bigIntegerValue())
            .isEqualTo(new BigInteger("18446744073709551615"));
        assertThat(new Sint64(Long.MIN_VALUE).longValue()).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    void testOutOfRange() {
        assertThatThrownBy(() -> new Uint8(256))
            .isInstanceOf(OutOfRangeException.class)
            .hasMessageContaining("uint8");
        assertThatThrownBy(() -> new Uint8(-1)).isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> new Sint16(32768)).isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> new Uint64(new BigInteger("18446744073709551616")))
            .isInstanceOf(CIMValueException.class);
    }

    @Test
    void testRangeCheckCanBeDisabled() {
        CimConfig.global().setEnforceIntegerRange(false);

        Uint8 value = new Uint8(300);

        assertThat(value.intValue()).isEqualTo(300);
    }

    @Test
    void testParseFromString() {
        assertThat(new Uint32(" 42 ")).isEqualTo(42);
        assertThatThrownBy(() -> new Uint32("4x2"))
            .isInstanceOf(CIMValueException.class)
            .hasMessageContaining("4x2");
    }

    @Test
    void testMinMaxValues() {
        Sint32 value = new Sint32(0);

        assertThat(value.getMinValue()).isEqualTo(BigInteger.valueOf(Integer.MIN_VALUE));
        assertThat(value.getMaxValue()).isEqualTo(BigInteger.valueOf(Integer.MAX_VALUE));
        assertThat(value.getCimType()).isEqualTo(CIMType.SINT32);
    }

    @Test
    void testEqualityAcrossWidths() {
        Uint8 a = new Uint8(42);
        Sint64 b = new Sint64(42);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isEqualTo(42);
        assertThat(a).isEqualTo(42L);
        assertThat(a).isEqualTo(42.0);
        assertThat(a).isNotEqualTo(42.5);
        assertThat(a).isNotEqualTo("42");
    }

    @Test
    void testToStringIsDecimal() {
        assertThat(new Sint16(-7).toString()).isEqualTo("-7");
        assertThat(new Uint64(new BigInteger("18446744073709551615")).toString())
            .isEqualTo("18446744073709551615");
    }

    @Test
    void testCompareTo() {
        assertThat(new Uint16(3).compareTo(new Sint8(5))).isNegative();
        assertThat(new Uint16(5).compareTo(new Sint8(5))).isZero();
    }

    @Test
    void testRealSpecialValues() {
        assertThat(new Real64("INF").toCimString()).isEqualTo("INF");
        assertThat(new Real64("-inf").toCimString()).isEqualTo("-INF");
        assertThat(new Real32("NaN").toCimString()).isEqualTo("NaN");
        assertThat(new Real64(Double.NaN)).isNotEqualTo(new Real64(Double.NaN));
        assertThatThrownBy(() -> new Real64("1.2.3")).isInstanceOf(CIMValueException.class);
    }

    @Test
    void testRealEquality() {
        assertThat(new Real32(0.1)).isEqualTo(new Real64(0.1f));
        assertThat(new Real64(0.1)).isNotEqualTo(new Real64(0.2));
        assertThat(new Real64(1.5)).isEqualTo(1.5);
        assertThat(new Real64(-0.0)).isEqualTo(new Real64(0.0));
        assertThat(new Real64(-0.0).hashCode()).isEqualTo(new Real64(0.0).hashCode());
        assertThat(new Real64(3.0)).isEqualTo(new Uint8(3));
    }

    @Test
    void testRealToCimString() {
        assertThat(new Real64(1.5).toCimString()).isEqualTo("1.5");
        assertThat(new Real32(0.1f).toCimString()).isEqualTo("0.1");
    }
}
