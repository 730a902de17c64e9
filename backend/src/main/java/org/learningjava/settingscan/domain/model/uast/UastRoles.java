package org.learningjava.settingscan.domain.model.uast;

public final class UastRoles {

    public static final String TYPE = "type";
    public static final String TYPE_ARGUMENTS = "typeArguments";
    public static final String ARGUMENTS = "arguments";
    public static final String NAME = "name";
    public static final String QUALIFIER = "qualifier";
    public static final String EXPRESSION = "expression";
    public static final String INITIALIZER = "initializer";
    public static final String FRAGMENTS = "fragments";
    public static final String MODIFIERS = "modifiers";
    public static final String ANONYMOUS_CLASS = "anonymousClassDeclaration";
    public static final String ELEMENT_TYPE = "elementType";
    public static final String BOUND = "bound";

    private UastRoles() {
    }
}
