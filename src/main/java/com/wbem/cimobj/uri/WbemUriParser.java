package com.wbem.cimobj.uri;

import com.wbem.cimobj.diagnostics.CimWarnings;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.model.CIMInstanceName;
import com.wbem.cimobj.types.CIMDateTime;
import com.wbem.cimobj.uri.KeybindingToken.TokenType;
import com.wbem.cimobj.util.NocaseDict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for WBEM URIs (DSP0207) denoting class or instance paths.
 *
 * <p>Accepted form: {@code [scheme:][//authority]/[namespace]:classname[.key=value,...]}.
 * The historical forms {@code namespace:classname...} and {@code classname...} without a
 * leading slash are accepted too.
 */
public class WbemUriParser {
    private static final Logger log = LoggerFactory.getLogger(WbemUriParser.class);

    private static final Set<String> KNOWN_SCHEMES = Set.of("http", "https", "cimxml-wbem", "cimxml-wbems");

    // A scheme is only recognized when a slash follows, so that "ns:Class" stays a namespace.
    private static final Pattern URI_PATTERN = Pattern.compile(
        "^(?:([\\w\\-]+):(?=/))?(?://([^/]*))?(?:/|^/?)(.*)$", Pattern.DOTALL);

    private static final Pattern PATH_PATTERN = Pattern.compile(
        "^(?:([\\w/\\-]*):)?([A-Za-z_0-9]+)(?:\\.(.*))?$", Pattern.DOTALL);

    private static final Pattern NESTED_PATH_PATTERN = Pattern.compile(
        "^(?:[^\"']*:)?[A-Za-z_0-9]+\\.[A-Za-z_0-9]+=.*$", Pattern.DOTALL);

    private static final Pattern DECIMAL_PATTERN = Pattern.compile("^[+-]?[0-9]+$");
    private static final Pattern OCTAL_PATTERN = Pattern.compile("^([+-]?)0([0-7]+)$");
    private static final Pattern BINARY_PATTERN = Pattern.compile("^([+-]?)([01]+)[bB]$");
    private static final Pattern HEX_PATTERN = Pattern.compile("^([+-]?)0[xX]([0-9a-fA-F]+)$");
    private static final Pattern REAL_PATTERN = Pattern.compile(
        "^[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?$");

    private WbemUriParser() {
        // Utility class
    }

    /**
     * Parse a WBEM URI.
     *
     * @throws CIMValueException if the URI is malformed
     */
    public static WbemUri parse(String uri) {
        if (uri == null) {
            throw new CIMValueException("WBEM URI must not be null");
        }
        Matcher m = URI_PATTERN.matcher(uri);
        if (!m.matches()) {
            throw new CIMValueException("Invalid format of WBEM URI: '" + uri + "'");
        }
        String scheme = m.group(1);
        if (scheme != null && !KNOWN_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
            CimWarnings.userWarning("Unsupported scheme '" + scheme + "' in WBEM URI: '" + uri + "'");
        }
        String host = m.group(2);
        if (host != null && host.isEmpty()) {
            host = null;
        }

        Matcher path = PATH_PATTERN.matcher(m.group(3));
        if (!path.matches()) {
            throw new CIMValueException("Invalid format of class or instance path in WBEM URI: '" + uri + "'");
        }
        String namespace = path.group(1);
        if (namespace != null && namespace.isEmpty()) {
            namespace = null;
        }
        String classname = path.group(2);
        NocaseDict<Object> keybindings = null;
        if (path.group(3) != null) {
            keybindings = parseKeybindings(path.group(3), uri);
        }
        log.debug("Parsed WBEM URI '{}': host={}, namespace={}, classname={}, keybindings={}",
            uri, host, namespace, classname, keybindings);
        return WbemUri.builder()
            .scheme(scheme)
            .host(host)
            .namespace(namespace)
            .classname(classname)
            .keybindings(keybindings)
            .build();
    }

    private static NocaseDict<Object> parseKeybindings(String text, String uri) {
        if (text.isEmpty()) {
            throw new CIMValueException("Missing keybindings after '.' in WBEM URI: '" + uri + "'");
        }
        NocaseDict<Object> keybindings = new NocaseDict<>();
        List<KeybindingToken> tokens = new KeybindingTokenizer(text).tokenize();
        int i = 0;
        while (tokens.get(i).getType() != TokenType.EOF) {
            KeybindingToken name = tokens.get(i);
            KeybindingToken value = tokens.get(i + 2);
            keybindings.put(name.getValue(), keybindingValue(value, uri));
            i += 3;
            if (tokens.get(i).getType() == TokenType.COMMA) {
                i++;
            }
        }
        return keybindings;
    }

    private static Object keybindingValue(KeybindingToken token, String uri) {
        return switch (token.getType()) {
            case DOUBLE_QUOTED -> doubleQuotedValue(unescape(token.getValue()));
            case SINGLE_QUOTED -> singleQuotedValue(unescape(token.getValue()), uri);
            case UNQUOTED -> unquotedValue(token.getValue(), uri);
            default -> throw new CIMValueException("Unexpected token " + token.getType() + " in WBEM URI: '"
                + uri + "'");
        };
    }

    private static String unescape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                i++;
                c = value.charAt(i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static Object doubleQuotedValue(String value) {
        if (looksLikeDateTime(value)) {
            try {
                return new CIMDateTime(value);
            } catch (CIMValueException e) {
                log.debug("Keybinding value '{}' is not a CIM datetime: {}", value, e.getMessage());
            }
        }
        if (NESTED_PATH_PATTERN.matcher(value).matches()) {
            try {
                return CIMInstanceName.fromWbemUri(value);
            } catch (CIMValueException e) {
                log.debug("Keybinding value '{}' is not an instance path: {}", value, e.getMessage());
            }
        }
        return value;
    }

    private static boolean looksLikeDateTime(String value) {
        if (value.length() != 25) {
            return false;
        }
        char sign = value.charAt(21);
        return value.charAt(14) == '.' && (sign == '+' || sign == '-' || sign == ':');
    }

    private static Character singleQuotedValue(String value, String uri) {
        if (value.length() != 1) {
            throw new CIMValueException("Single-quoted keybinding value must have exactly one character, but is '"
                + value + "' in WBEM URI: '" + uri + "'");
        }
        return value.charAt(0);
    }

    private static Object unquotedValue(String value, String uri) {
        String lower = value.toLowerCase(Locale.ROOT);
        if ("true".equals(lower)) {
            return Boolean.TRUE;
        }
        if ("false".equals(lower)) {
            return Boolean.FALSE;
        }
        Matcher m = BINARY_PATTERN.matcher(value);
        if (m.matches()) {
            return integer(m.group(1), m.group(2), 2);
        }
        m = HEX_PATTERN.matcher(value);
        if (m.matches()) {
            return integer(m.group(1), m.group(2), 16);
        }
        m = OCTAL_PATTERN.matcher(value);
        if (m.matches()) {
            return integer(m.group(1), m.group(2), 8);
        }
        if (DECIMAL_PATTERN.matcher(value).matches()) {
            return integer("", value, 10);
        }
        switch (lower) {
            case "inf", "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                break;
        }
        if (REAL_PATTERN.matcher(value).matches()) {
            return Double.valueOf(value);
        }
        if (looksLikeDateTime(value)) {
            CIMDateTime dateTime = new CIMDateTime(value);
            CimWarnings.userWarning("Tolerating datetime value without surrounding double quotes in WBEM URI"
                + " keybinding: " + value);
            return dateTime;
        }
        throw new CIMValueException("Invalid keybinding value '" + value + "' in WBEM URI: '" + uri + "'");
    }

    private static Number integer(String sign, String digits, int radix) {
        BigInteger value = new BigInteger(digits, radix);
        if ("-".equals(sign)) {
            value = value.negate();
        }
        if (value.bitLength() < Long.SIZE) {
            return value.longValue();
        }
        return value;
    }
}
