package com.wbem.cimobj.model;

import com.wbem.cimobj.diagnostics.CimWarnings;
import com.wbem.cimobj.exception.CIMKeyException;
import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.mof.MofWriter;
import com.wbem.cimobj.types.CimTypes;
import com.wbem.cimobj.util.CimEquality;
import com.wbem.cimobj.util.NocaseDict;
import com.wbem.cimobj.xml.CimXmlWriter;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.w3c.dom.Element;

import java.util.AbstractMap.SimpleEntry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A CIM instance: class name, properties, qualifiers and optionally its instance path.
 *
 * <p>The properties can be accessed like a case-insensitive ordered map through
 * {@link #get}, {@link #put}, {@link #remove} and iteration over the property names.
 * Setting a property whose name is a keybinding of the path also updates that keybinding,
 * without validating the new keybinding value.
 */
@Getter
@ToString
public class CIMInstance extends CIMElement implements Iterable<String> {

    private String classname;
    private NocaseDict<CIMProperty> properties;
    private NocaseDict<CIMQualifier> qualifiers;
    private CIMInstanceName path;
    private List<String> propertyList;

    public CIMInstance(String classname) {
        this(classname, null, null, null, null);
    }

    public CIMInstance(String classname, Object properties) {
        this(classname, properties, null, null, null);
    }

    /**
     * @param properties   a Map of names to {@link CIMProperty} objects or to values, or an
     *                     Iterable of {@link CIMProperty} or of name/value entries
     * @param qualifiers   a Map, or an Iterable of {@link CIMQualifier} or of name/value entries
     * @param path         the instance path, or null
     * @param propertyList deprecated: names of the properties this instance accepts
     */
    @Builder
    public CIMInstance(String classname, Object properties, Object qualifiers, CIMInstanceName path,
                       List<String> propertyList) {
        this.classname = CIMClassName.checkClassname(classname);
        setPropertyList(propertyList);
        this.path = path;
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
        this.properties = new NocaseDict<>();
        for (Map.Entry<String, Object> entry : ElementMaps.entries(properties, "properties")) {
            put(entry.getKey(), entry.getValue());
        }
    }

    private CIMInstance(CIMInstance other) {
        this.classname = other.classname;
        this.properties = new NocaseDict<>();
        for (Map.Entry<String, CIMProperty> entry : other.properties.entrySet()) {
            this.properties.put(entry.getKey(), entry.getValue().copy());
        }
        this.qualifiers = CIMProperty.copyQualifiers(other.qualifiers);
        this.path = other.path == null ? null : other.path.copy();
        this.propertyList = other.propertyList == null ? null : new ArrayList<>(other.propertyList);
    }

    /**
     * Build an instance of a class from property values.
     *
     * @param propertyValues           values by property name; each is converted to the type
     *                                 of the class property
     * @param namespace                namespace of the instance path
     * @param includePath              build the instance path from the key properties
     * @param includeClassOrigin       keep class origin and propagation of the class properties
     * @param includeMissingProperties include class properties without a supplied value, with
     *                                 their default value
     * @param strict                   require values for all key properties when building the path
     * @throws CIMValueException if a value does not fit its class property, a property is not
     *                           declared by the class, or (strict) a key value is missing
     */
    public static CIMInstance fromClass(CIMClass cimClass, Map<String, ?> propertyValues, String namespace,
                                        boolean includePath, boolean includeClassOrigin,
                                        boolean includeMissingProperties, boolean strict) {
        NocaseDict<Object> values = new NocaseDict<>();
        if (propertyValues != null) {
            values.putAll(propertyValues);
        }
        for (String name : values.keys()) {
            if (!cimClass.getProperties().containsKey(name)) {
                throw new CIMValueException("Property '" + name + "' is not declared by class '"
                    + cimClass.getClassname() + "'");
            }
        }
        CIMInstance instance = new CIMInstance(cimClass.getClassname());
        for (CIMProperty classProperty : cimClass.getProperties().values()) {
            String name = classProperty.getName();
            if (values.containsKey(name)) {
                Object value = checkClassValue(classProperty, values.get(name));
                instance.put(name, instanceProperty(classProperty, value, includeClassOrigin));
            } else if (includeMissingProperties) {
                instance.put(name, instanceProperty(classProperty, ValueChecks.copyValue(classProperty.getValue()),
                    includeClassOrigin));
            }
        }
        if (includePath) {
            instance.setPath(CIMInstanceName.fromInstance(cimClass, instance, namespace, null, strict));
        }
        return instance;
    }

    /**
     * Build an instance of a class from property values, with path and without the
     * properties that have no supplied value.
     */
    public static CIMInstance fromClass(CIMClass cimClass, Map<String, ?> propertyValues) {
        return fromClass(cimClass, propertyValues, null, true, false, false, false);
    }

    private static Object checkClassValue(CIMProperty classProperty, Object value) {
        String name = classProperty.getName();
        if (value != null && classProperty.isArray() != value instanceof List) {
            throw new CIMValueException("Value for property '" + name + "' must " + (classProperty.isArray()
                ? "be an array" : "not be an array") + ": " + value);
        }
        try {
            return CimTypes.cimValue(value, classProperty.getType());
        } catch (CIMTypeException e) {
            throw new CIMValueException("Value for property '" + name + "' does not match its CIM type "
                + classProperty.getType() + ": " + e.getMessage(), e);
        }
    }

    private static CIMProperty instanceProperty(CIMProperty classProperty, Object value,
                                                boolean includeClassOrigin) {
        return CIMProperty.builder()
            .name(classProperty.getName())
            .value(value)
            .type(classProperty.getType().getCimName())
            .isArray(classProperty.isArray())
            .arraySize(classProperty.getArraySize())
            .referenceClass(classProperty.getReferenceClass())
            .embeddedObject(classProperty.getEmbeddedObject())
            .classOrigin(includeClassOrigin ? classProperty.getClassOrigin() : null)
            .propagated(includeClassOrigin ? classProperty.getPropagated() : null)
            .build();
    }

    public void setClassname(String classname) {
        this.classname = CIMClassName.checkClassname(classname);
    }

    /**
     * Replace all properties. The property list filter and path synchronization apply.
     */
    public void setProperties(Object properties) {
        this.properties = new NocaseDict<>();
        for (Map.Entry<String, Object> entry : ElementMaps.entries(properties, "properties")) {
            put(entry.getKey(), entry.getValue());
        }
    }

    public void setQualifiers(Object qualifiers) {
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
    }

    public void setPath(CIMInstanceName path) {
        this.path = path;
    }

    /**
     * Deprecated filter of accepted property names; stored lower-cased.
     */
    public void setPropertyList(List<String> propertyList) {
        if (propertyList == null) {
            this.propertyList = null;
            return;
        }
        CimWarnings.deprecationWarning("The property_list attribute of CIMInstance is deprecated");
        List<String> lowered = new ArrayList<>(propertyList.size());
        for (String name : propertyList) {
            lowered.add(CimEquality.lower(name));
        }
        this.propertyList = lowered;
    }

    /**
     * Value of a property.
     *
     * @throws CIMKeyException if there is no such property
     */
    public Object get(String name) {
        CIMProperty property = properties.get(name);
        if (property == null) {
            throw new CIMKeyException(name);
        }
        return property.getValue();
    }

    public Object get(String name, Object defaultValue) {
        CIMProperty property = properties.get(name);
        return property == null ? defaultValue : property.getValue();
    }

    public boolean containsKey(String name) {
        return properties.containsKey(name);
    }

    /**
     * Set a property.
     *
     * <p>A {@link CIMProperty} replaces the property of that name. Any other value updates
     * the value of an existing property (converted to its type), or creates a new property
     * with a type inferred from the value. With a property list set, names outside the list
     * are ignored unless they are keybindings of the path.
     */
    public void put(String name, Object value) {
        if (propertyList != null && !propertyList.contains(CimEquality.lower(name))
            && !(path != null && path.containsKey(name))) {
            return;
        }
        if (value instanceof CIMProperty property) {
            if (!CimEquality.namesEqual(name, property.getName())) {
                throw new CIMValueException("Property name '" + property.getName() + "' does not match its key '"
                    + name + "'");
            }
            properties.put(name, property);
        } else if (properties.containsKey(name)) {
            properties.get(name).setValue(value);
        } else {
            properties.put(name, new CIMProperty(name, value));
        }
        // Unvalidated: a null or array key property value is mirrored as is.
        if (path != null && path.containsKey(name)) {
            path.getKeybindings().put(name, properties.get(name).getValue());
        }
    }

    /**
     * Remove a property.
     *
     * @throws CIMKeyException if there is no such property
     */
    public void remove(String name) {
        if (!properties.containsKey(name)) {
            throw new CIMKeyException(name);
        }
        properties.remove(name);
    }

    /**
     * Set the properties of a Map, a {@link CIMInstanceName} (its keybindings), or an
     * Iterable of {@link CIMProperty} or name/value entries, adding new ones.
     */
    public void update(Object mapping) {
        for (Map.Entry<String, Object> entry : updateEntries(mapping)) {
            put(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Like {@link #update}, but only for properties that already exist; other names are
     * ignored. Values are converted to the type of the existing property.
     */
    public void updateExisting(Object mapping) {
        for (Map.Entry<String, Object> entry : updateEntries(mapping)) {
            if (properties.containsKey(entry.getKey())) {
                put(entry.getKey(), entry.getValue());
            }
        }
    }

    private static List<Map.Entry<String, Object>> updateEntries(Object mapping) {
        if (mapping instanceof CIMInstanceName instanceName) {
            return instanceName.items();
        }
        return ElementMaps.entries(mapping, "properties");
    }

    public int size() {
        return properties.size();
    }

    public List<String> keys() {
        return properties.keys();
    }

    public List<Object> values() {
        List<Object> values = new ArrayList<>(properties.size());
        for (CIMProperty property : properties.values()) {
            values.add(property.getValue());
        }
        return values;
    }

    public List<Map.Entry<String, Object>> items() {
        List<Map.Entry<String, Object>> items = new ArrayList<>(properties.size());
        for (Map.Entry<String, CIMProperty> entry : properties.entrySet()) {
            items.add(new SimpleEntry<>(entry.getKey(), entry.getValue().getValue()));
        }
        return items;
    }

    @Override
    public Iterator<String> iterator() {
        return keys().iterator();
    }

    public CIMInstance copy() {
        return new CIMInstance(this);
    }

    @Override
    public Element toCimXml() {
        return toCimXml(false);
    }

    /**
     * {@code INSTANCE}, wrapped with its path unless {@code ignorePath} is set or there is no
     * path: {@code VALUE.NAMEDINSTANCE} (path without namespace),
     * {@code VALUE.OBJECTWITHLOCALPATH} (namespace, no host) or
     * {@code VALUE.INSTANCEWITHPATH} (namespace and host).
     */
    public Element toCimXml(boolean ignorePath) {
        return new CimXmlWriter().instance(this, ignorePath);
    }

    public String toMof() {
        return MofWriter.instance(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMInstance other)) {
            return false;
        }
        return CimEquality.namesEqual(classname, other.classname)
            && Objects.equals(path, other.path)
            && properties.equals(other.properties)
            && qualifiers.equals(other.qualifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CimEquality.nameHash(classname), path, properties, qualifiers);
    }
}
