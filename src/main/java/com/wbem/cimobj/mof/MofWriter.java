package com.wbem.cimobj.mof;

import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.model.CIMClass;
import com.wbem.cimobj.model.CIMClassName;
import com.wbem.cimobj.model.CIMInstance;
import com.wbem.cimobj.model.CIMInstanceName;
import com.wbem.cimobj.model.CIMMethod;
import com.wbem.cimobj.model.CIMParameter;
import com.wbem.cimobj.model.CIMProperty;
import com.wbem.cimobj.model.CIMQualifier;
import com.wbem.cimobj.model.CIMQualifierDeclaration;
import com.wbem.cimobj.model.ElementMaps;
import com.wbem.cimobj.mof.MofStrings.MofText;
import com.wbem.cimobj.types.CIMFloat;
import com.wbem.cimobj.types.CIMType;
import com.wbem.cimobj.util.NocaseDict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders CIM objects as MOF (DSP0004) text.
 */
public class MofWriter {

    private static final Logger log = LoggerFactory.getLogger(MofWriter.class);

    /** Indentation step of nested MOF elements. */
    public static final int MOF_INDENT = 3;

    /** Maximum length of a MOF line, exceeded only by unsplittable tokens. */
    public static final int MAX_MOF_LINE = 80;

    private MofWriter() {
        // Utility class
    }

    /**
     * {@code instance of C {...};} with one {@code name = value;} line per property.
     */
    public static String instance(CIMInstance instance) {
        log.debug("Rendering MOF of instance of {}", instance.getClassname());
        StringBuilder mof = new StringBuilder();
        mof.append(qualifiers(instance.getQualifiers(), 0));
        mof.append("instance of ").append(instance.getClassname()).append(" {\n");
        for (CIMProperty property : instance.getProperties().values()) {
            mof.append(property(property, true, MOF_INDENT));
        }
        mof.append("};\n");
        return mof.toString();
    }

    public static String cimClass(CIMClass cimClass) {
        log.debug("Rendering MOF of class {}", cimClass.getClassname());
        StringBuilder mof = new StringBuilder();
        mof.append(qualifiers(cimClass.getQualifiers(), 0));
        mof.append("class ").append(cimClass.getClassname());
        if (cimClass.getSuperclass() != null) {
            mof.append(" : ").append(cimClass.getSuperclass());
        }
        mof.append(" {\n");
        for (CIMProperty property : cimClass.getProperties().values()) {
            mof.append('\n').append(property(property, false, MOF_INDENT));
        }
        for (CIMMethod method : cimClass.getMethods().values()) {
            mof.append('\n').append(method(method, MOF_INDENT));
        }
        mof.append("\n};\n");
        return mof.toString();
    }

    /**
     * A property value of an instance ({@code name = value;}) or a property declaration of
     * a class (qualifiers, {@code type name[size] = default;}), ending with a newline.
     */
    public static String property(CIMProperty property, boolean isInstance, int indent) {
        StringBuilder mof = new StringBuilder();
        if (isInstance) {
            mof.append(spaces(indent)).append(property.getName());
        } else {
            mof.append(qualifiers(property.getQualifiers(), indent + MOF_INDENT));
            mof.append(spaces(indent)).append(mofType(property.getType(), property.getReferenceClass(),
                property.getValue()));
            mof.append(' ').append(property.getName());
            if (property.isArray()) {
                appendArraySize(mof, property.getArraySize());
            }
        }
        Object value = property.getValue();
        if (value != null || isInstance) {
            mof.append(" =");
            if (value instanceof List) {
                mof.append(" {");
            }
            int linePos = linePos(mof);
            MofText text = value(value, property.getType(), indent + MOF_INDENT, linePos + 1, 3, false);
            if (!text.getText().isEmpty() && text.getText().charAt(0) != '\n') {
                mof.append(' ');
            }
            mof.append(text.getText());
            if (value instanceof List) {
                mof.append(" }");
            }
        }
        mof.append(";\n");
        return mof.toString();
    }

    /**
     * A method declaration: qualifiers, then {@code type Name(parameters);}.
     */
    public static String method(CIMMethod method, int indent) {
        StringBuilder mof = new StringBuilder();
        mof.append(qualifiers(method.getQualifiers(), indent));
        mof.append(spaces(indent)).append(method.getReturnType().getCimName()).append(' ').append(method.getName());
        if (method.getParameters().isEmpty()) {
            mof.append("();\n");
            return mof.toString();
        }
        List<String> parameters = new ArrayList<>();
        for (CIMParameter parameter : method.getParameters().values()) {
            parameters.add(parameter(parameter, indent + MOF_INDENT));
        }
        mof.append("(\n").append(String.join(",\n", parameters)).append(");\n");
        return mof.toString();
    }

    /**
     * A parameter declaration without trailing separator, e.g. {@code uint32 Count} or
     * {@code CIM_Foo REF Target}.
     */
    public static String parameter(CIMParameter parameter, int indent) {
        StringBuilder mof = new StringBuilder();
        mof.append(qualifiers(parameter.getQualifiers(), indent));
        mof.append(spaces(indent)).append(mofType(parameter.getType(), parameter.getReferenceClass(),
            parameter.getValue()));
        mof.append(' ').append(parameter.getName());
        if (parameter.isArray()) {
            appendArraySize(mof, parameter.getArraySize());
        }
        return mof.toString();
    }

    /**
     * A qualifier, {@code Name ( value )} or {@code Name { v1, v2 }} for arrays.
     *
     * @param indent indentation of continuation lines of its value
     */
    public static String qualifier(CIMQualifier qualifier, int indent) {
        return qualifier(qualifier, indent, 0);
    }

    private static String qualifier(CIMQualifier qualifier, int indent, int linePos) {
        boolean array = qualifier.getValue() instanceof List;
        StringBuilder mof = new StringBuilder();
        mof.append(qualifier.getName()).append(' ').append(array ? '{' : '(');
        linePos += mof.length();
        MofText text = value(qualifier.getValue(), qualifier.getType(), indent, linePos + 1, 3, true);
        if (!text.getText().isEmpty() && text.getText().charAt(0) != '\n') {
            mof.append(' ');
        }
        mof.append(text.getText());
        mof.append(array ? " }" : " )");
        return mof.toString();
    }

    /**
     * The bracketed qualifier list of an element, ending with a newline; empty if there are
     * no qualifiers. The list is put on one line if it fits, otherwise one qualifier per line.
     */
    public static String qualifiers(NocaseDict<CIMQualifier> qualifiers, int indent) {
        if (qualifiers.isEmpty()) {
            return "";
        }
        List<String> rendered = new ArrayList<>(qualifiers.size());
        boolean multiLine = false;
        for (CIMQualifier qualifier : qualifiers.values()) {
            String text = qualifier(qualifier, indent + 1 + MOF_INDENT, indent + 1);
            multiLine |= text.indexOf('\n') >= 0;
            rendered.add(text);
        }
        String oneLine = String.join(", ", rendered);
        if (!multiLine && indent + oneLine.length() + 2 <= MAX_MOF_LINE) {
            return spaces(indent) + "[" + oneLine + "]\n";
        }
        return spaces(indent) + "[" + String.join(",\n" + spaces(indent + 1), rendered) + "]\n";
    }

    /**
     * {@code Qualifier Name : type = default,} followed by its scopes and flavors. The
     * {@code toinstance} flavor is not part of MOF and is never rendered.
     */
    public static String qualifierDeclaration(CIMQualifierDeclaration declaration) {
        log.debug("Rendering MOF of qualifier declaration {}", declaration.getName());
        StringBuilder mof = new StringBuilder();
        mof.append("Qualifier ").append(declaration.getName()).append(" : ")
            .append(declaration.getType().getCimName());
        if (declaration.isArray()) {
            appendArraySize(mof, declaration.getArraySize());
        }
        Object value = declaration.getValue();
        if (value != null) {
            mof.append(" = ");
            if (value instanceof List<?> list && list.isEmpty()) {
                mof.append("{ }");
            } else if (value instanceof List) {
                mof.append("{ ");
                mof.append(value(value, declaration.getType(), MOF_INDENT, linePos(mof), 3, false).getText());
                mof.append(" }");
            } else {
                mof.append(value(value, declaration.getType(), MOF_INDENT, linePos(mof), 3, false).getText());
            }
        }
        mof.append(",\n").append(spaces(MOF_INDENT + 1)).append("Scope(");
        List<String> scopes = new ArrayList<>();
        for (String scope : ElementMaps.SCOPES) {
            if (Boolean.TRUE.equals(declaration.getScopes().get(scope))) {
                scopes.add(scope.toLowerCase(Locale.ROOT));
            }
        }
        mof.append(String.join(", ", scopes)).append(')');
        List<String> flavors = new ArrayList<>();
        if (declaration.getOverridable() != null) {
            flavors.add(declaration.getOverridable() ? "EnableOverride" : "DisableOverride");
        }
        if (declaration.getTosubclass() != null) {
            flavors.add(declaration.getTosubclass() ? "ToSubclass" : "Restricted");
        }
        if (Boolean.TRUE.equals(declaration.getTranslatable())) {
            flavors.add("Translatable");
        }
        if (!flavors.isEmpty()) {
            mof.append(",\n").append(spaces(MOF_INDENT + 1)).append("Flavor(")
                .append(String.join(", ", flavors)).append(')');
        }
        mof.append(";\n");
        return mof.toString();
    }

    // A scalar value, or the comma separated elements of an array value without braces.
    private static MofText value(Object value, CIMType type, int indent, int linePos, int endSpace,
                                 boolean avoidSplits) {
        if (!(value instanceof List<?> list)) {
            return scalarValue(value, type, indent, linePos, endSpace, avoidSplits);
        }
        StringBuilder mof = new StringBuilder();
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                linePos += 2;
            }
            MofText text = scalarValue(list.get(i), type, indent, linePos, endSpace + 2, avoidSplits);
            linePos = text.getLinePos();
            if (i > 0) {
                mof.append(',');
                if (text.getText().charAt(0) != '\n') {
                    mof.append(' ');
                } else {
                    linePos--;
                }
            }
            mof.append(text.getText());
        }
        return new MofText(mof.toString(), linePos);
    }

    private static MofText scalarValue(Object value, CIMType type, int indent, int linePos, int endSpace,
                                       boolean avoidSplits) {
        if (value == null) {
            return MofStrings.mofval("NULL", indent, MAX_MOF_LINE, linePos, endSpace);
        }
        return switch (type) {
            case STRING -> MofStrings.mofstr(stringValue(value), indent, MAX_MOF_LINE, linePos, endSpace,
                avoidSplits);
            case CHAR16 -> MofStrings.mofstr(String.valueOf(value), indent, MAX_MOF_LINE, linePos, endSpace,
                avoidSplits, '\'');
            case BOOLEAN -> MofStrings.mofval((Boolean) value ? "true" : "false", indent, MAX_MOF_LINE, linePos,
                endSpace);
            case DATETIME -> MofStrings.mofstr(value.toString(), indent, MAX_MOF_LINE, linePos, endSpace,
                avoidSplits);
            case REFERENCE -> MofStrings.mofstr(referenceValue(value), indent, MAX_MOF_LINE, linePos, endSpace,
                avoidSplits);
            case REAL32, REAL64 -> MofStrings.mofval(((CIMFloat) value).toCimString(), indent, MAX_MOF_LINE,
                linePos, endSpace);
            default -> MofStrings.mofval(value.toString(), indent, MAX_MOF_LINE, linePos, endSpace);
        };
    }

    private static String stringValue(Object value) {
        if (value instanceof CIMInstance instance) {
            return instance.toMof();
        }
        if (value instanceof CIMClass cimClass) {
            return cimClass.toMof();
        }
        if (value instanceof String s) {
            return s;
        }
        throw new CIMTypeException("Value of CIM type string has an invalid type: " + value.getClass().getName());
    }

    private static String referenceValue(Object value) {
        if (value instanceof CIMInstanceName instanceName) {
            return instanceName.toWbemUri();
        }
        if (value instanceof CIMClassName className) {
            return className.toWbemUri();
        }
        throw new CIMTypeException("Value of CIM type reference has an invalid type: "
            + value.getClass().getName());
    }

    // Without a reference class, the class name of the reference value is used, if any.
    private static String mofType(CIMType type, String referenceClass, Object value) {
        if (type != CIMType.REFERENCE) {
            return type.getCimName();
        }
        String className = referenceClass;
        if (className == null && value instanceof CIMInstanceName instanceName) {
            className = instanceName.getClassname();
        } else if (className == null && value instanceof CIMClassName classPath) {
            className = classPath.getClassname();
        }
        return className == null ? "REF" : className + " REF";
    }

    private static void appendArraySize(StringBuilder mof, Integer arraySize) {
        mof.append('[');
        if (arraySize != null) {
            mof.append(arraySize);
        }
        mof.append(']');
    }

    private static int linePos(StringBuilder mof) {
        return mof.length() - mof.lastIndexOf("\n") - 1;
    }

    private static String spaces(int count) {
        return " ".repeat(count);
    }
}
