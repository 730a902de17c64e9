package org.learningjava.settingscan.domain.model.uast;

/**
 * Node tags shared by the tree producers and the extraction rules (JDT internal type names).
 */
public final class UastTags {

    public static final String COMPILATION_UNIT = "CompilationUnit";
    public static final String FIELD_DECLARATION = "FieldDeclaration";
    public static final String VARIABLE_DECLARATION_FRAGMENT = "VariableDeclarationFragment";

    public static final String PARAMETERIZED_TYPE = "ParameterizedType";
    public static final String SIMPLE_TYPE = "SimpleType";
    public static final String PRIMITIVE_TYPE = "PrimitiveType";
    public static final String ARRAY_TYPE = "ArrayType";
    public static final String WILDCARD_TYPE = "WildcardType";

    public static final String SIMPLE_NAME = "SimpleName";
    public static final String QUALIFIED_NAME = "QualifiedName";
    public static final String FIELD_ACCESS = "FieldAccess";

    public static final String METHOD_INVOCATION = "MethodInvocation";
    public static final String CLASS_INSTANCE_CREATION = "ClassInstanceCreation";
    public static final String ANONYMOUS_CLASS_DECLARATION = "AnonymousClassDeclaration";

    public static final String NUMBER_LITERAL = "NumberLiteral";
    public static final String BOOLEAN_LITERAL = "BooleanLiteral";
    public static final String STRING_LITERAL = "StringLiteral";
    public static final String CHARACTER_LITERAL = "CharacterLiteral";
    public static final String NULL_LITERAL = "NullLiteral";
    public static final String TEXT_BLOCK = "TextBlock";

    public static final String MODIFIER = "Modifier";

    // attribute keys
    public static final String ATTR_TOKEN = "token";
    public static final String ATTR_BOOLEAN_VALUE = "booleanValue";
    public static final String ATTR_ESCAPED_VALUE = "escapedValue";
    public static final String ATTR_OPERATOR = "operator";

    private UastTags() {
    }
}
