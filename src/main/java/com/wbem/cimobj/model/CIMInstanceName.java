package com.wbem.cimobj.model;

import com.wbem.cimobj.config.CimConfig;
import com.wbem.cimobj.diagnostics.CimWarnings;
import com.wbem.cimobj.exception.CIMKeyException;
import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.types.CIMDateTime;
import com.wbem.cimobj.types.CIMFloat;
import com.wbem.cimobj.types.CIMInt;
import com.wbem.cimobj.uri.WbemUri;
import com.wbem.cimobj.uri.WbemUriFormat;
import com.wbem.cimobj.uri.WbemUriParser;
import com.wbem.cimobj.uri.WbemUriWriter;
import com.wbem.cimobj.util.CimEquality;
import com.wbem.cimobj.util.NocaseDict;
import com.wbem.cimobj.xml.CimXmlWriter;
import lombok.Builder;
import lombok.Getter;
import org.w3c.dom.Element;

import java.util.AbstractMap.SimpleEntry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The path of a CIM instance: class name, keybindings, and optionally namespace and host.
 *
 * <p>Keybindings behave like a case-insensitive ordered map through {@link #get},
 * {@link #put}, {@link #remove} and iteration over the key names. Their values are
 * strings, characters, booleans, numbers, {@link CIMDateTime} or nested
 * {@code CIMInstanceName} references.
 *
 * <p>{@link #toString()} returns the WBEM URI in historical format, e.g.
 * {@code root/cimv2:CIM_Foo.InstanceID="1234"}.
 */
@Getter
public class CIMInstanceName extends CIMElement implements Iterable<String> {

    private String classname;
    private NocaseDict<Object> keybindings;
    private String host;
    private String namespace;

    public CIMInstanceName(String classname) {
        this(classname, null, null, null);
    }

    public CIMInstanceName(String classname, Object keybindings) {
        this(classname, keybindings, null, null);
    }

    /**
     * @param keybindings a Map, an Iterable of {@link CIMProperty} or of name/value entries
     */
    @Builder
    public CIMInstanceName(String classname, Object keybindings, String host, String namespace) {
        this(classname, keybindings, host, namespace, CimConfig.global(), true);
    }

    private CIMInstanceName(String classname, Object keybindings, String host, String namespace,
                            CimConfig config, boolean warnPlainNumbers) {
        this.classname = CIMClassName.checkClassname(classname);
        this.keybindings = normalizeKeybindings(keybindings, config, warnPlainNumbers);
        this.host = host;
        this.namespace = CIMClassName.normalizeNamespace(namespace);
    }

    /**
     * Validate keybindings against a configuration and build the keybinding map.
     */
    public static NocaseDict<Object> normalizeKeybindings(Object keybindings, CimConfig config,
                                                          boolean warnPlainNumbers) {
        NocaseDict<Object> result = new NocaseDict<>(true);
        for (Map.Entry<String, Object> entry : ElementMaps.entries(keybindings, "keybindings")) {
            String key = checkKeyName(entry.getKey(), config);
            result.put(key, keybindingValue(key, entry.getValue(), config, warnPlainNumbers));
        }
        return result;
    }

    private static String checkKeyName(String key, CimConfig config) {
        if (key == null && !config.isIgnoreNullKeyValue()) {
            throw new CIMValueException("Keybinding name must not be null");
        }
        return key;
    }

    /**
     * Validate a single keybinding value. A {@link CIMProperty} stands for its value.
     */
    static Object keybindingValue(String key, Object value, CimConfig config, boolean warnPlainNumbers) {
        if (value instanceof CIMProperty property) {
            if (!CimEquality.namesEqual(key, property.getName())) {
                throw new CIMValueException("Invalid keybinding name: CIMProperty name '" + property.getName()
                    + "' must match the keybinding name '" + key + "'");
            }
            value = ValueChecks.copyValue(property.getValue());
        }
        if (value == null) {
            if (!config.isIgnoreNullKeyValue()) {
                throw new CIMValueException("Keybinding '" + key + "' must not have a null value");
            }
            return null;
        }
        if (value instanceof String || value instanceof Character || value instanceof Boolean
            || value instanceof CIMInt || value instanceof CIMFloat || value instanceof CIMDateTime
            || value instanceof CIMInstanceName) {
            return value;
        }
        if (value instanceof Number) {
            if (warnPlainNumbers) {
                CimWarnings.deprecationWarning("Keybinding '" + key + "' has a value of plain Java type "
                    + value.getClass().getName() + "; use a CIM integer or real type");
            }
            return value;
        }
        if (value instanceof CIMInstance || value instanceof CIMClass) {
            throw new CIMTypeException("Value of keybinding '" + key + "' cannot be an embedded object: "
                + value.getClass().getName());
        }
        if (value instanceof List) {
            throw new CIMTypeException("Value of keybinding '" + key + "' cannot be a list");
        }
        throw new CIMTypeException("Value of keybinding '" + key + "' has an invalid type: "
            + value.getClass().getName());
    }

    /**
     * Parse a WBEM URI denoting an instance path.
     *
     * @throws CIMValueException if the URI is malformed
     */
    public static CIMInstanceName fromWbemUri(String wbemUri) {
        WbemUri uri = WbemUriParser.parse(wbemUri);
        return new CIMInstanceName(uri.getClassname(), uri.getKeybindings(), uri.getHost(), uri.getNamespace(),
            CimConfig.global(), false);
    }

    /**
     * Instance path of an instance, with the key properties declared by its class.
     */
    public static CIMInstanceName fromInstance(CIMClass cimClass, CIMInstance instance) {
        return fromInstance(cimClass, instance, null, null, true);
    }

    /**
     * Instance path of an instance, with the key properties declared by its class. Key
     * properties are the class properties with a {@code Key} qualifier of value true.
     *
     * @param strict if set, a key property missing in the instance (or having no value)
     *               is an error; otherwise it is left out of the path
     * @throws CIMValueException in strict mode, for a missing key property value
     */
    public static CIMInstanceName fromInstance(CIMClass cimClass, CIMInstance instance, String namespace,
                                               String host, boolean strict) {
        NocaseDict<Object> keys = new NocaseDict<>();
        for (CIMProperty classProperty : cimClass.getProperties().values()) {
            CIMQualifier key = classProperty.getQualifiers().get("Key");
            if (key == null || !Boolean.TRUE.equals(key.getValue())) {
                continue;
            }
            String name = classProperty.getName();
            CIMProperty instanceProperty = instance.getProperties().get(name);
            if (instanceProperty == null || instanceProperty.getValue() == null) {
                if (strict) {
                    throw new CIMValueException("Key property '" + name + "' of class '" + cimClass.getClassname()
                        + "' is missing or has no value in the instance");
                }
                continue;
            }
            keys.put(name, instanceProperty.getValue());
        }
        return new CIMInstanceName(cimClass.getClassname(), keys, host, namespace);
    }

    public void setClassname(String classname) {
        this.classname = CIMClassName.checkClassname(classname);
    }

    /**
     * @param keybindings a Map, an Iterable of {@link CIMProperty} or of name/value entries
     */
    public void setKeybindings(Object keybindings) {
        this.keybindings = normalizeKeybindings(keybindings, CimConfig.global(), true);
    }

    public void setHost(String host) {
        this.host = host;
    }

    public void setNamespace(String namespace) {
        this.namespace = CIMClassName.normalizeNamespace(namespace);
    }

    /**
     * Value of a keybinding.
     *
     * @throws CIMKeyException if there is no such keybinding
     */
    public Object get(String key) {
        if (!keybindings.containsKey(key)) {
            throw new CIMKeyException(key);
        }
        return keybindings.get(key);
    }

    public Object get(String key, Object defaultValue) {
        return keybindings.containsKey(key) ? keybindings.get(key) : defaultValue;
    }

    public boolean containsKey(String key) {
        return keybindings.containsKey(key);
    }

    /**
     * Add or replace a keybinding, validating its value.
     */
    public void put(String key, Object value) {
        CimConfig config = CimConfig.global();
        checkKeyName(key, config);
        keybindings.put(key, keybindingValue(key, value, config, true));
    }

    /**
     * Remove a keybinding.
     *
     * @throws CIMKeyException if there is no such keybinding
     */
    public void remove(String key) {
        if (!keybindings.containsKey(key)) {
            throw new CIMKeyException(key);
        }
        keybindings.remove(key);
    }

    /**
     * Add or replace the keybindings of a Map, or of an Iterable of {@link CIMProperty} or
     * name/value entries.
     */
    public void update(Object keybindings) {
        for (Map.Entry<String, Object> entry : ElementMaps.entries(keybindings, "keybindings")) {
            put(entry.getKey(), entry.getValue());
        }
    }

    public int size() {
        return keybindings.size();
    }

    public List<String> keys() {
        return keybindings.keys();
    }

    public List<Object> values() {
        return new ArrayList<>(keybindings.values());
    }

    public List<Map.Entry<String, Object>> items() {
        List<Map.Entry<String, Object>> items = new ArrayList<>();
        for (Map.Entry<String, Object> entry : keybindings.entrySet()) {
            items.add(new SimpleEntry<>(entry.getKey(), entry.getValue()));
        }
        return items;
    }

    @Override
    public Iterator<String> iterator() {
        return keys().iterator();
    }

    public CIMInstanceName copy() {
        NocaseDict<Object> copiedKeys = new NocaseDict<>(true);
        for (Map.Entry<String, Object> entry : keybindings.entrySet()) {
            copiedKeys.put(entry.getKey(), ValueChecks.copyValue(entry.getValue()));
        }
        CIMInstanceName copy = new CIMInstanceName(classname, null, host, namespace);
        copy.keybindings = copiedKeys;
        return copy;
    }

    public String toWbemUri(WbemUriFormat format) {
        return WbemUriWriter.toWbemUri(this, format);
    }

    public String toWbemUri() {
        return toWbemUri(WbemUriFormat.STANDARD);
    }

    @Override
    public Element toCimXml() {
        return toCimXml(false, false);
    }

    /**
     * {@code INSTANCENAME}, {@code LOCALINSTANCEPATH} or {@code INSTANCEPATH}, depending on
     * which of namespace and host are present and not ignored.
     *
     * @throws CIMTypeException if a keybinding value has a type that cannot be a key
     */
    public Element toCimXml(boolean ignoreHost, boolean ignoreNamespace) {
        return new CimXmlWriter().instanceName(this, ignoreHost, ignoreNamespace);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMInstanceName other)) {
            return false;
        }
        return CimEquality.namesEqual(classname, other.classname)
            && keybindings.equals(other.keybindings)
            && CimEquality.namesEqual(namespace, other.namespace)
            && CimEquality.namesEqual(host, other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CimEquality.nameHash(classname), keybindings.hashCode(),
            CimEquality.nameHash(namespace), CimEquality.nameHash(host));
    }

    @Override
    public String toString() {
        return toWbemUri(WbemUriFormat.HISTORICAL);
    }
}
