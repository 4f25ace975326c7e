package com.wbem.cimobj.xml;

import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.model.CIMClass;
import com.wbem.cimobj.model.CIMClassName;
import com.wbem.cimobj.model.CIMElement;
import com.wbem.cimobj.model.CIMInstance;
import com.wbem.cimobj.model.CIMInstanceName;
import com.wbem.cimobj.model.CIMMethod;
import com.wbem.cimobj.model.CIMParameter;
import com.wbem.cimobj.model.CIMProperty;
import com.wbem.cimobj.model.CIMQualifier;
import com.wbem.cimobj.model.CIMQualifierDeclaration;
import com.wbem.cimobj.model.ElementMaps;
import com.wbem.cimobj.types.CIMDateTime;
import com.wbem.cimobj.types.CIMFloat;
import com.wbem.cimobj.types.CIMInt;
import com.wbem.cimobj.types.CIMType;
import com.wbem.cimobj.types.CimTypes;
import com.wbem.cimobj.util.NocaseDict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;

/**
 * Builds the DSP0201 CIM-XML element tree of CIM objects.
 *
 * <p>Each writer owns one DOM document that all elements it creates belong to. The
 * writer keeps no other state; a fresh writer is used for each top-level object.
 */
public class CimXmlWriter {

    private static final Logger log = LoggerFactory.getLogger(CimXmlWriter.class);

    private final Document document;

    public CimXmlWriter() {
        this.document = CimXmlDocuments.newDocument();
    }

    public Document getDocument() {
        return document;
    }

    /**
     * {@code CLASSNAME}, wrapped in {@code LOCALCLASSPATH} when a namespace is rendered and in
     * {@code CLASSPATH} when host and namespace are rendered.
     */
    public Element className(CIMClassName path, boolean ignoreHost, boolean ignoreNamespace) {
        log.debug("Rendering class path {}", path.getClassname());
        Element classname = element("CLASSNAME");
        classname.setAttribute("NAME", path.getClassname());
        return pathEnvelope(classname, path.getHost(), path.getNamespace(), ignoreHost, ignoreNamespace,
            "LOCALCLASSPATH", "CLASSPATH");
    }

    /**
     * {@code INSTANCENAME} with its {@code KEYBINDING} children, wrapped in
     * {@code LOCALINSTANCEPATH} or {@code INSTANCEPATH} like {@link #className}.
     *
     * @throws CIMTypeException if a keybinding value has a type that cannot be a key
     */
    public Element instanceName(CIMInstanceName path, boolean ignoreHost, boolean ignoreNamespace) {
        log.debug("Rendering instance path {}", path.getClassname());
        Element instanceName = element("INSTANCENAME");
        instanceName.setAttribute("CLASSNAME", path.getClassname());
        for (Map.Entry<String, Object> keybinding : path.getKeybindings().entrySet()) {
            Element kb = element("KEYBINDING");
            if (keybinding.getKey() != null) {
                kb.setAttribute("NAME", keybinding.getKey());
            }
            kb.appendChild(keyValue(keybinding.getKey(), keybinding.getValue()));
            instanceName.appendChild(kb);
        }
        return pathEnvelope(instanceName, path.getHost(), path.getNamespace(), ignoreHost, ignoreNamespace,
            "LOCALINSTANCEPATH", "INSTANCEPATH");
    }

    private Element keyValue(String key, Object value) {
        if (value instanceof CIMInstanceName reference) {
            Element valueReference = element("VALUE.REFERENCE");
            valueReference.appendChild(instanceName(reference, false, false));
            return valueReference;
        }
        Element keyValue = element("KEYVALUE");
        if (value == null) {
            keyValue.setAttribute("VALUETYPE", "string");
            return keyValue;
        }
        if (value instanceof Boolean b) {
            keyValue.setAttribute("VALUETYPE", "boolean");
            keyValue.setTextContent(b ? "TRUE" : "FALSE");
        } else if (value instanceof CIMInt cimInt) {
            keyValue.setAttribute("VALUETYPE", "numeric");
            keyValue.setAttribute("TYPE", cimInt.getCimType().getCimName());
            keyValue.setTextContent(cimInt.toString());
        } else if (value instanceof CIMFloat cimFloat) {
            keyValue.setAttribute("VALUETYPE", "numeric");
            keyValue.setAttribute("TYPE", cimFloat.getCimType().getCimName());
            keyValue.setTextContent(cimFloat.toCimString());
        } else if (value instanceof Number) {
            keyValue.setAttribute("VALUETYPE", "numeric");
            keyValue.setTextContent(CimTypes.toCimString(value));
        } else if (value instanceof String s) {
            keyValue.setAttribute("VALUETYPE", "string");
            keyValue.setTextContent(s);
        } else if (value instanceof Character c) {
            keyValue.setAttribute("VALUETYPE", "string");
            keyValue.setAttribute("TYPE", CIMType.CHAR16.getCimName());
            keyValue.setTextContent(String.valueOf(c));
        } else if (value instanceof CIMDateTime dateTime) {
            keyValue.setAttribute("VALUETYPE", "string");
            keyValue.setAttribute("TYPE", CIMType.DATETIME.getCimName());
            keyValue.setTextContent(dateTime.toString());
        } else {
            throw new CIMTypeException("Keybinding '" + key + "' has a value of a type that cannot be rendered"
                + " in CIM-XML: " + value.getClass().getName());
        }
        return keyValue;
    }

    private Element pathEnvelope(Element name, String host, String namespace, boolean ignoreHost,
                                 boolean ignoreNamespace, String localPathTag, String pathTag) {
        if (namespace == null || ignoreNamespace) {
            return name;
        }
        Element localNamespacePath = element("LOCALNAMESPACEPATH");
        for (String part : namespace.split("/")) {
            if (!part.isEmpty()) {
                Element ns = element("NAMESPACE");
                ns.setAttribute("NAME", part);
                localNamespacePath.appendChild(ns);
            }
        }
        if (host == null || ignoreHost) {
            Element localPath = element(localPathTag);
            localPath.appendChild(localNamespacePath);
            localPath.appendChild(name);
            return localPath;
        }
        Element hostElement = element("HOST");
        hostElement.setTextContent(host);
        Element namespacePath = element("NAMESPACEPATH");
        namespacePath.appendChild(hostElement);
        namespacePath.appendChild(localNamespacePath);
        Element path = element(pathTag);
        path.appendChild(namespacePath);
        path.appendChild(name);
        return path;
    }

    /**
     * {@code INSTANCE}, wrapped with its path as {@code VALUE.NAMEDINSTANCE},
     * {@code VALUE.OBJECTWITHLOCALPATH} or {@code VALUE.INSTANCEWITHPATH}.
     */
    public Element instance(CIMInstance instance, boolean ignorePath) {
        log.debug("Rendering instance of {}", instance.getClassname());
        Element element = element("INSTANCE");
        element.setAttribute("CLASSNAME", instance.getClassname());
        appendQualifiers(element, instance.getQualifiers());
        for (CIMProperty property : instance.getProperties().values()) {
            element.appendChild(property(property));
        }
        CIMInstanceName path = instance.getPath();
        if (path == null || ignorePath) {
            return element;
        }
        String wrapperTag;
        if (path.getNamespace() == null) {
            wrapperTag = "VALUE.NAMEDINSTANCE";
        } else if (path.getHost() == null) {
            wrapperTag = "VALUE.OBJECTWITHLOCALPATH";
        } else {
            wrapperTag = "VALUE.INSTANCEWITHPATH";
        }
        Element wrapper = element(wrapperTag);
        wrapper.appendChild(instanceName(path, false, false));
        wrapper.appendChild(element);
        return wrapper;
    }

    public Element cimClass(CIMClass cimClass) {
        log.debug("Rendering class {}", cimClass.getClassname());
        Element element = element("CLASS");
        element.setAttribute("NAME", cimClass.getClassname());
        if (cimClass.getSuperclass() != null) {
            element.setAttribute("SUPERCLASS", cimClass.getSuperclass());
        }
        appendQualifiers(element, cimClass.getQualifiers());
        for (CIMProperty property : cimClass.getProperties().values()) {
            element.appendChild(property(property));
        }
        for (CIMMethod method : cimClass.getMethods().values()) {
            element.appendChild(method(method));
        }
        return element;
    }

    /**
     * {@code PROPERTY}, {@code PROPERTY.ARRAY} or {@code PROPERTY.REFERENCE}. A null value
     * renders no value child.
     */
    public Element property(CIMProperty property) {
        Element element;
        if (property.getType() == CIMType.REFERENCE) {
            element = element("PROPERTY.REFERENCE");
            element.setAttribute("NAME", property.getName());
            setOptional(element, "REFERENCECLASS", property.getReferenceClass());
        } else {
            element = element(property.isArray() ? "PROPERTY.ARRAY" : "PROPERTY");
            element.setAttribute("NAME", property.getName());
            element.setAttribute("TYPE", property.getType().getCimName());
            if (property.isArray() && property.getArraySize() != null) {
                element.setAttribute("ARRAYSIZE", String.valueOf(property.getArraySize()));
            }
        }
        setOptional(element, "CLASSORIGIN", property.getClassOrigin());
        setOptional(element, "PROPAGATED", property.getPropagated());
        if (property.getEmbeddedObject() != null) {
            element.setAttribute("EmbeddedObject", property.getEmbeddedObject().getXmlValue());
        }
        appendQualifiers(element, property.getQualifiers());
        Object value = property.getValue();
        if (value != null) {
            element.appendChild(valueElement(value, property.getType()));
        }
        return element;
    }

    public Element method(CIMMethod method) {
        Element element = element("METHOD");
        element.setAttribute("NAME", method.getName());
        element.setAttribute("TYPE", method.getReturnType().getCimName());
        setOptional(element, "CLASSORIGIN", method.getClassOrigin());
        setOptional(element, "PROPAGATED", method.getPropagated());
        appendQualifiers(element, method.getQualifiers());
        for (CIMParameter parameter : method.getParameters().values()) {
            element.appendChild(parameter(parameter));
        }
        return element;
    }

    /**
     * The parameter declaration: {@code PARAMETER}, {@code PARAMETER.ARRAY},
     * {@code PARAMETER.REFERENCE} or {@code PARAMETER.REFARRAY}.
     */
    public Element parameter(CIMParameter parameter) {
        boolean reference = parameter.getType() == CIMType.REFERENCE;
        Element element;
        if (reference) {
            element = element(parameter.isArray() ? "PARAMETER.REFARRAY" : "PARAMETER.REFERENCE");
            element.setAttribute("NAME", parameter.getName());
            setOptional(element, "REFERENCECLASS", parameter.getReferenceClass());
        } else {
            element = element(parameter.isArray() ? "PARAMETER.ARRAY" : "PARAMETER");
            element.setAttribute("NAME", parameter.getName());
            element.setAttribute("TYPE", parameter.getType().getCimName());
        }
        if (parameter.isArray() && parameter.getArraySize() != null) {
            element.setAttribute("ARRAYSIZE", String.valueOf(parameter.getArraySize()));
        }
        appendQualifiers(element, parameter.getQualifiers());
        return element;
    }

    /**
     * The {@code PARAMVALUE} of a method invocation, carrying the parameter value.
     */
    public Element paramValue(CIMParameter parameter) {
        Element element = element("PARAMVALUE");
        element.setAttribute("NAME", parameter.getName());
        element.setAttribute("PARAMTYPE", parameter.getType().getCimName());
        if (parameter.getEmbeddedObject() != null) {
            element.setAttribute("EmbeddedObject", parameter.getEmbeddedObject().getXmlValue());
        }
        if (parameter.getValue() != null) {
            element.appendChild(valueElement(parameter.getValue(), parameter.getType()));
        }
        return element;
    }

    public Element qualifier(CIMQualifier qualifier) {
        Element element = element("QUALIFIER");
        element.setAttribute("NAME", qualifier.getName());
        element.setAttribute("TYPE", qualifier.getType().getCimName());
        setOptional(element, "PROPAGATED", qualifier.getPropagated());
        setFlavors(element, qualifier.getOverridable(), qualifier.getTosubclass(), qualifier.getToinstance(),
            qualifier.getTranslatable());
        if (qualifier.getValue() != null) {
            element.appendChild(valueElement(qualifier.getValue(), qualifier.getType()));
        }
        return element;
    }

    /**
     * {@code QUALIFIER.DECLARATION} with a {@code SCOPE} child listing every scope as
     * {@code true}/{@code false}. A granted {@code ANY} scope grants all of them.
     */
    public Element qualifierDeclaration(CIMQualifierDeclaration declaration) {
        log.debug("Rendering qualifier declaration {}", declaration.getName());
        Element element = element("QUALIFIER.DECLARATION");
        element.setAttribute("NAME", declaration.getName());
        element.setAttribute("TYPE", declaration.getType().getCimName());
        element.setAttribute("ISARRAY", String.valueOf(declaration.isArray()));
        if (declaration.getArraySize() != null) {
            element.setAttribute("ARRAYSIZE", String.valueOf(declaration.getArraySize()));
        }
        setFlavors(element, declaration.getOverridable(), declaration.getTosubclass(),
            declaration.getToinstance(), declaration.getTranslatable());
        NocaseDict<Boolean> scopes = declaration.getScopes();
        if (!scopes.isEmpty()) {
            Element scope = element("SCOPE");
            boolean any = Boolean.TRUE.equals(scopes.get("ANY"));
            for (String name : ElementMaps.SCOPES) {
                if ("ANY".equals(name)) {
                    continue;
                }
                if (any) {
                    scope.setAttribute(name, "true");
                } else if (scopes.containsKey(name)) {
                    scope.setAttribute(name, String.valueOf(scopes.get(name)));
                }
            }
            element.appendChild(scope);
        }
        if (declaration.getValue() != null) {
            element.appendChild(valueElement(declaration.getValue(), declaration.getType()));
        }
        return element;
    }

    private Element valueElement(Object value, CIMType type) {
        if (type == CIMType.REFERENCE) {
            if (value instanceof List<?> list) {
                Element refArray = element("VALUE.REFARRAY");
                for (Object item : list) {
                    refArray.appendChild(item == null ? element("VALUE.NULL") : valueReference(item));
                }
                return refArray;
            }
            return valueReference(value);
        }
        if (value instanceof List<?> list) {
            Element array = element("VALUE.ARRAY");
            for (Object item : list) {
                array.appendChild(item == null ? element("VALUE.NULL") : scalarValue(item));
            }
            return array;
        }
        return scalarValue(value);
    }

    private Element scalarValue(Object value) {
        Element element = element("VALUE");
        if (value instanceof CIMInstance || value instanceof CIMClass) {
            element.setTextContent(((CIMElement) value).toCimXmlStr());
        } else {
            element.setTextContent(CimTypes.toCimString(value));
        }
        return element;
    }

    private Element valueReference(Object value) {
        Element element = element("VALUE.REFERENCE");
        if (value instanceof CIMInstanceName instanceName) {
            element.appendChild(instanceName(instanceName, false, false));
        } else if (value instanceof CIMClassName className) {
            element.appendChild(className(className, false, false));
        } else {
            throw new CIMTypeException("Reference value must be a CIMInstanceName or CIMClassName, but is "
                + value.getClass().getName());
        }
        return element;
    }

    private void appendQualifiers(Element parent, NocaseDict<CIMQualifier> qualifiers) {
        for (CIMQualifier qualifier : qualifiers.values()) {
            parent.appendChild(qualifier(qualifier));
        }
    }

    private static void setFlavors(Element element, Boolean overridable, Boolean tosubclass, Boolean toinstance,
                                   Boolean translatable) {
        setOptional(element, "OVERRIDABLE", overridable);
        setOptional(element, "TOSUBCLASS", tosubclass);
        setOptional(element, "TOINSTANCE", toinstance);
        setOptional(element, "TRANSLATABLE", translatable);
    }

    private static void setOptional(Element element, String attribute, Object value) {
        if (value != null) {
            element.setAttribute(attribute, String.valueOf(value));
        }
    }

    private Element element(String tag) {
        return document.createElement(tag);
    }
}
