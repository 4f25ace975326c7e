package com.wbem.cimobj.types;

import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.exception.OutOfRangeException;
import com.wbem.cimobj.model.CIMClassName;
import com.wbem.cimobj.model.CIMInstance;
import com.wbem.cimobj.model.CIMInstanceName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CimTypes and CIMType.
 */
class CimTypesTest {

    @Test
    void testInferType() {
        assertThat(CimTypes.inferType(new Uint8(1))).isEqualTo(CIMType.UINT8);
        assertThat(CimTypes.inferType(new Real32(1.0f))).isEqualTo(CIMType.REAL32);
        assertThat(CimTypes.inferType(true)).isEqualTo(CIMType.BOOLEAN);
        assertThat(CimTypes.inferType("abc")).isEqualTo(CIMType.STRING);
        assertThat(CimTypes.inferType('a')).isEqualTo(CIMType.CHAR16);
        assertThat(CimTypes.inferType(new CIMDateTime("00000000000000.000000:000"))).isEqualTo(CIMType.DATETIME);
        assertThat(CimTypes.inferType(new CIMClassName("CIM_Foo"))).isEqualTo(CIMType.REFERENCE);
        assertThat(CimTypes.inferType(new CIMInstance("CIM_Foo"))).isEqualTo(CIMType.STRING);
    }

    @Test
    void testInferTypeOfArrayUsesFirstNonNullElement() {
        assertThat(CimTypes.inferType(Arrays.asList(null, new Sint16(3)))).isEqualTo(CIMType.SINT16);
        assertThatThrownBy(() -> CimTypes.inferType(Arrays.asList(null, null)))
            .isInstanceOf(CIMValueException.class);
    }

    @Test
    void testInferTypeRejectsPlainNumbers() {
        assertThatThrownBy(() -> CimTypes.inferType(42)).isInstanceOf(CIMTypeException.class);
        assertThatThrownBy(() -> CimTypes.inferType(new Object())).isInstanceOf(CIMTypeException.class);
        assertThatThrownBy(() -> CimTypes.inferType(null)).isInstanceOf(CIMValueException.class);
    }

    @Test
    void testCimValueConvertsIntegers() {
        Object value = CimTypes.cimValue(42, CIMType.UINT16);

        assertThat(value).isInstanceOf(Uint16.class).isEqualTo(42);
        assertThat(CimTypes.cimValue("-5", CIMType.SINT8)).isInstanceOf(Sint8.class).isEqualTo(-5);
        assertThatThrownBy(() -> CimTypes.cimValue(300, CIMType.UINT8)).isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> CimTypes.cimValue("x", CIMType.UINT8)).isInstanceOf(CIMValueException.class);
        assertThatThrownBy(() -> CimTypes.cimValue(1.5, CIMType.UINT8)).isInstanceOf(CIMTypeException.class);
    }

    @Test
    void testCimValueConvertsLists() {
        Object value = CimTypes.cimValue(Arrays.asList(1, null, 3), CIMType.SINT32);

        assertThat(value).isInstanceOf(List.class);
        List<?> list = (List<?>) value;
        assertThat(list).hasSize(3);
        assertThat(list.get(0)).isInstanceOf(Sint32.class);
        assertThat(list.get(1)).isNull();
    }

    @Test
    void testCimValueStringsAndChars() {
        assertThat(CimTypes.cimValue('x', CIMType.STRING)).isEqualTo("x");
        assertThat(CimTypes.cimValue('x', CIMType.CHAR16)).isEqualTo("x");
        assertThatThrownBy(() -> CimTypes.cimValue(5, CIMType.STRING)).isInstanceOf(CIMTypeException.class);
        assertThatThrownBy(() -> CimTypes.cimValue("true", CIMType.BOOLEAN)).isInstanceOf(CIMTypeException.class);
    }

    @Test
    void testCimValueReferenceFromUri() {
        Object classPath = CimTypes.cimValue("/root/cimv2:CIM_Foo", CIMType.REFERENCE);
        Object instancePath = CimTypes.cimValue("/root/cimv2:CIM_Foo.Id=\"1\"", CIMType.REFERENCE);

        assertThat(classPath).isEqualTo(new CIMClassName("CIM_Foo", null, "root/cimv2"));
        assertThat(instancePath).isInstanceOf(CIMInstanceName.class);
        assertThat(((CIMInstanceName) instancePath).get("id")).isEqualTo("1");
    }

    @Test
    void testCimValueReals() {
        assertThat(CimTypes.cimValue("INF", CIMType.REAL64)).isEqualTo(new Real64(Double.POSITIVE_INFINITY));
        assertThat(CimTypes.cimValue(1.5, CIMType.REAL32)).isInstanceOf(Real32.class);
    }

    @Test
    void testCimValueNullStaysNull() {
        assertThat(CimTypes.cimValue(null, CIMType.UINT8)).isNull();
    }

    @Test
    void testToCimString() {
        assertThat(CimTypes.toCimString(true)).isEqualTo("TRUE");
        assertThat(CimTypes.toCimString(false)).isEqualTo("FALSE");
        assertThat(CimTypes.toCimString(new Sint8(-3))).isEqualTo("-3");
        assertThat(CimTypes.toCimString(Double.NEGATIVE_INFINITY)).isEqualTo("-INF");
        assertThat(CimTypes.toCimString('c')).isEqualTo("c");
        assertThatThrownBy(() -> CimTypes.toCimString(new Object())).isInstanceOf(CIMTypeException.class);
    }

    @Test
    void testTypeNames() {
        assertThat(CIMType.fromName("UINT32")).isEqualTo(CIMType.UINT32);
        assertThat(CIMType.fromName("datetime").getCimName()).isEqualTo("datetime");
        assertThat(CIMType.SINT8.isSigned()).isTrue();
        assertThat(CIMType.REAL32.isReal()).isTrue();
        assertThat(CIMType.UINT16.getBits()).isEqualTo(16);
        assertThatThrownBy(() -> CIMType.fromName("int")).isInstanceOf(CIMValueException.class);
        assertThatThrownBy(() -> CIMType.fromName(null)).isInstanceOf(CIMValueException.class);
    }
}
