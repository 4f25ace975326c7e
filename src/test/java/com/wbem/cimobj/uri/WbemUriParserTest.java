package com.wbem.cimobj.uri;

import com.wbem.cimobj.diagnostics.CimWarning;
import com.wbem.cimobj.diagnostics.CimWarnings;
import com.wbem.cimobj.diagnostics.WarningCategory;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.model.CIMInstanceName;
import com.wbem.cimobj.types.CIMDateTime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for WbemUriParser.
 */
class WbemUriParserTest {

    @Test
    void testFullUri() {
        WbemUri uri = WbemUriParser.parse("https://acme.com:5989/root/cimv2:CIM_Foo.Id=\"1\"");

        assertThat(uri.getScheme()).isEqualTo("https");
        assertThat(uri.getHost()).isEqualTo("acme.com:5989");
        assertThat(uri.getNamespace()).isEqualTo("root/cimv2");
        assertThat(uri.getClassname()).isEqualTo("CIM_Foo");
        assertThat(uri.getKeybindings()).containsEntry("Id", "1");
        assertThat(uri.isInstancePath()).isTrue();
    }

    @Test
    void testClassPathForms() {
        WbemUri standard = WbemUriParser.parse("/root/cimv2:CIM_Foo");
        WbemUri noNamespace = WbemUriParser.parse("/:CIM_Foo");
        WbemUri historical = WbemUriParser.parse("interop:CIM_Foo");
        WbemUri bare = WbemUriParser.parse("CIM_Foo");
        WbemUri withHost = WbemUriParser.parse("//acme.com/root:CIM_Foo");

        assertThat(standard.getNamespace()).isEqualTo("root/cimv2");
        assertThat(standard.getKeybindings()).isNull();
        assertThat(standard.isInstancePath()).isFalse();
        assertThat(noNamespace.getNamespace()).isNull();
        assertThat(historical.getScheme()).isNull();
        assertThat(historical.getNamespace()).isEqualTo("interop");
        assertThat(bare.getClassname()).isEqualTo("CIM_Foo");
        assertThat(bare.getNamespace()).isNull();
        assertThat(withHost.getHost()).isEqualTo("acme.com");
        assertThat(withHost.getScheme()).isNull();
    }

    @Test
    void testUnknownSchemeWarns() {
        List<CimWarning> warnings = CimWarnings.capture(() -> WbemUriParser.parse("foo://h/root:CIM_Foo"));

        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getCategory()).isEqualTo(WarningCategory.USER);
        assertThat(warnings.get(0).getMessage()).contains("foo");
    }

    @Test
    void testKnownSchemeDoesNotWarn() {
        List<CimWarning> warnings = CimWarnings.capture(() -> WbemUriParser.parse("cimxml-wbem://h/root:CIM_Foo"));

        assertThat(warnings).isEmpty();
    }

    @Test
    void testIntegerBases() {
        WbemUri uri = WbemUriParser.parse("/:C.Dec=-42,Bin=101b,Neg=-11B,Oct=017,Hex=0x1F,Zero=0");

        assertThat(uri.getKeybindings().get("Dec")).isEqualTo(-42L);
        assertThat(uri.getKeybindings().get("Bin")).isEqualTo(5L);
        assertThat(uri.getKeybindings().get("Neg")).isEqualTo(-3L);
        assertThat(uri.getKeybindings().get("Oct")).isEqualTo(15L);
        assertThat(uri.getKeybindings().get("Hex")).isEqualTo(31L);
        assertThat(uri.getKeybindings().get("Zero")).isEqualTo(0L);
    }

    @Test
    void testLargeIntegerIsBigInteger() {
        WbemUri uri = WbemUriParser.parse("/:C.K=18446744073709551615");

        assertThat(uri.getKeybindings().get("K")).isEqualTo(new BigInteger("18446744073709551615"));
    }

    @Test
    void testBooleansAndReals() {
        WbemUri uri = WbemUriParser.parse("/:C.T=TRUE,F=false,R=1.5e3,I=-inf,N=NaN,D=.5");

        assertThat(uri.getKeybindings().get("T")).isEqualTo(Boolean.TRUE);
        assertThat(uri.getKeybindings().get("F")).isEqualTo(Boolean.FALSE);
        assertThat(uri.getKeybindings().get("R")).isEqualTo(1500.0);
        assertThat(uri.getKeybindings().get("I")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat((Double) uri.getKeybindings().get("N")).isNaN();
        assertThat(uri.getKeybindings().get("D")).isEqualTo(0.5);
    }

    @Test
    void testQuotedValues() {
        WbemUri uri = WbemUriParser.parse(
            "/:C.S=\"a\\\"b\\\\c\",Ch='x',Q='\\'',Dt=\"20140924193040.654321+120\",Ref=\"/:CIM_Inner.Id=\\\"1\\\"\"");

        assertThat(uri.getKeybindings().get("S")).isEqualTo("a\"b\\c");
        assertThat(uri.getKeybindings().get("Ch")).isEqualTo('x');
        assertThat(uri.getKeybindings().get("Q")).isEqualTo('\'');
        assertThat(uri.getKeybindings().get("Dt")).isEqualTo(new CIMDateTime("20140924193040.654321+120"));
        assertThat(uri.getKeybindings().get("Ref")).isInstanceOf(CIMInstanceName.class);
        assertThat(((CIMInstanceName) uri.getKeybindings().get("Ref")).get("Id")).isEqualTo("1");
    }

    @Test
    void testQuotedNonPathStaysString() {
        WbemUri uri = WbemUriParser.parse("/:C.S=\"a.b=c\",T=\"12345678901234.123456+1xx\"");

        assertThat(uri.getKeybindings().get("S")).isEqualTo("a.b=c");
        assertThat(uri.getKeybindings().get("T")).isEqualTo("12345678901234.123456+1xx");
    }

    @Test
    void testUnquotedDateTimeWarns() {
        List<CimWarning> warnings = CimWarnings.capture(() -> {
            WbemUri uri = WbemUriParser.parse("/:C.K=20140924193040.654321+120");
            assertThat(uri.getKeybindings().get("K")).isInstanceOf(CIMDateTime.class);
        });

        assertThat(warnings).extracting(CimWarning::getCategory).containsExactly(WarningCategory.USER);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "/:CIM_Foo.",
        "/:CIM_Foo.K",
        "/:CIM_Foo.K=",
        "/:CIM_Foo.K=1,",
        "/:CIM_Foo.K=1,,L=2",
        "/:CIM_Foo.K==1",
        "/:CIM_Foo.K=\"abc",
        "/:CIM_Foo.K='ab'",
        "/:CIM_Foo.K=xyz",
        "/:CIM Foo",
        "/root:",
        ""
    })
    void testInvalidUris(String uri) {
        assertThatThrownBy(() -> WbemUriParser.parse(uri)).isInstanceOf(CIMValueException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "/:C.k=\u0661\u0662",
        "/:C.k=\uFF11\uFF12",
        "/:C.k=-\u0664\u0662",
        "/:C.k=1\uFF12",
        "/:C.k=0x\uFF11F",
        "/:C.k=\u0661.5"
    })
    void testNonAsciiDigitsRejected(String uri) {
        assertThatThrownBy(() -> WbemUriParser.parse(uri))
            .isInstanceOf(CIMValueException.class)
            .hasMessageContaining("Invalid keybinding value");
    }

    @Test
    void testNullUri() {
        assertThatThrownBy(() -> WbemUriParser.parse(null)).isInstanceOf(CIMValueException.class);
    }
}
