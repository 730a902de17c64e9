package org.learningjava.settingscan.infrastructure.adapter.out.uastParser;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VarType;
import com.github.javaparser.ast.type.VoidType;
import com.github.javaparser.ast.type.WildcardType;
import org.learningjava.settingscan.domain.model.uast.Position;
import org.learningjava.settingscan.domain.model.uast.UastNode;
import org.learningjava.settingscan.domain.model.uast.UastRoles;
import org.learningjava.settingscan.domain.model.uast.UastTags;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Renders a JavaParser AST in the node shape of the external tree service: JDT type names as
 * tags, JDT property names as roles. Only the constructs the setting rules look at get a precise
 * rendering; everything else becomes a generic node that keeps its children in source order.
 */
final class JavaParserUastRenderer {

    private static final Map<String, String> JDT_NAMES = Map.ofEntries(
            Map.entry("ClassOrInterfaceDeclaration", "TypeDeclaration"),
            Map.entry("AnnotationDeclaration", "AnnotationTypeDeclaration"),
            Map.entry("AnnotationMemberDeclaration", "AnnotationTypeMemberDeclaration"),
            Map.entry("ConstructorDeclaration", "MethodDeclaration"),
            Map.entry("CompactConstructorDeclaration", "MethodDeclaration"),
            Map.entry("InitializerDeclaration", "Initializer"),
            Map.entry("Parameter", "SingleVariableDeclaration"),
            Map.entry("BlockStmt", "Block"),
            Map.entry("LambdaExpr", "LambdaExpression"),
            Map.entry("MethodReferenceExpr", "ExpressionMethodReference"),
            Map.entry("BinaryExpr", "InfixExpression"),
            Map.entry("EnclosedExpr", "ParenthesizedExpression"),
            Map.entry("ArrayCreationExpr", "ArrayCreation"),
            Map.entry("ArrayInitializerExpr", "ArrayInitializer"),
            Map.entry("ArrayAccessExpr", "ArrayAccess"),
            Map.entry("AssignExpr", "Assignment"),
            Map.entry("ClassExpr", "TypeLiteral"),
            Map.entry("InstanceOfExpr", "InstanceofExpression"),
            Map.entry("MarkerAnnotationExpr", "MarkerAnnotation"),
            Map.entry("SingleMemberAnnotationExpr", "SingleMemberAnnotation"),
            Map.entry("NormalAnnotationExpr", "NormalAnnotation")
    );

    private static final Comparator<Node> SOURCE_ORDER = Comparator
            .comparingInt((Node n) -> n.getBegin().map(p -> p.line).orElse(Integer.MAX_VALUE))
            .thenComparingInt(n -> n.getBegin().map(p -> p.column).orElse(Integer.MAX_VALUE));

    UastNode render(Node node) {
        return render(node, null);
    }

    private UastNode render(Node n, String role) {
        if (n instanceof FieldDeclaration fd) return field(fd, role);
        if (n instanceof VariableDeclarator vd) return fragment(vd, role);
        if (n instanceof Type t) return type(t, role);
        if (n instanceof NameExpr ne) return simpleName(ne.getNameAsString(), role, ne);
        if (n instanceof SimpleName sn) return simpleName(sn.getIdentifier(), role, sn);
        if (n instanceof Name name) return name(name, role);
        if (n instanceof FieldAccessExpr fa) return fieldAccess(fa, role);
        if (n instanceof MethodCallExpr mc) return methodInvocation(mc, role);
        if (n instanceof ObjectCreationExpr oc) return classInstanceCreation(oc, role);
        if (n instanceof IntegerLiteralExpr || n instanceof LongLiteralExpr || n instanceof DoubleLiteralExpr) {
            String text = ((com.github.javaparser.ast.expr.LiteralStringValueExpr) n).getValue();
            return node(UastTags.NUMBER_LITERAL, n, role).token(text).attribute(UastTags.ATTR_TOKEN, text).build();
        }
        if (n instanceof BooleanLiteralExpr b) {
            String text = String.valueOf(b.getValue());
            return node(UastTags.BOOLEAN_LITERAL, n, role).token(text).attribute(UastTags.ATTR_BOOLEAN_VALUE, text).build();
        }
        if (n instanceof StringLiteralExpr s) {
            return node(UastTags.STRING_LITERAL, n, role).token(s.getValue())
                    .attribute(UastTags.ATTR_ESCAPED_VALUE, "\"" + s.getValue() + "\"").build();
        }
        if (n instanceof TextBlockLiteralExpr tb) {
            return node(UastTags.TEXT_BLOCK, n, role).token(tb.getValue()).build();
        }
        if (n instanceof CharLiteralExpr c) {
            return node(UastTags.CHARACTER_LITERAL, n, role).token(c.getValue())
                    .attribute(UastTags.ATTR_ESCAPED_VALUE, "'" + c.getValue() + "'").build();
        }
        if (n instanceof NullLiteralExpr) {
            return node(UastTags.NULL_LITERAL, n, role).token("null").build();
        }
        if (n instanceof Modifier m) {
            return node(UastTags.MODIFIER, n, role).token(m.getKeyword().asString()).build();
        }
        if (n instanceof UnaryExpr u) {
            String tag = u.getOperator().isPostfix() ? "PostfixExpression" : "PrefixExpression";
            return generic(u, tag, role).attribute(UastTags.ATTR_OPERATOR, u.getOperator().asString()).build();
        }
        if (n instanceof BinaryExpr b) {
            return generic(b, jdtName(b), role).attribute(UastTags.ATTR_OPERATOR, b.getOperator().asString()).build();
        }
        if (n instanceof AssignExpr a) {
            return generic(a, jdtName(a), role).attribute(UastTags.ATTR_OPERATOR, a.getOperator().asString()).build();
        }
        return generic(n, jdtName(n), role).build();
    }

    // -------------------- declarations --------------------

    private UastNode field(FieldDeclaration fd, String role) {
        UastNode.Builder b = node(UastTags.FIELD_DECLARATION, fd, role);
        // a field's Javadoc belongs to the declaration, so the node starts there
        fd.getJavadocComment()
                .flatMap(Node::getBegin)
                .ifPresent(p -> b.position(new Position(p.line, p.column)));
        List<Node> modifiers = new ArrayList<>(fd.getAnnotations());
        modifiers.addAll(fd.getModifiers());
        modifiers.sort(SOURCE_ORDER);
        for (Node m : modifiers) b.child(render(m, UastRoles.MODIFIERS));

        if (fd.getVariables().isNonEmpty()) {
            Type declared = fd.getMaximumCommonType().orElseGet(() -> fd.getVariable(0).getType());
            b.child(type(declared, UastRoles.TYPE));
        }
        for (VariableDeclarator vd : fd.getVariables()) {
            b.child(fragment(vd, UastRoles.FRAGMENTS));
        }
        return b.build();
    }

    private UastNode fragment(VariableDeclarator vd, String role) {
        UastNode.Builder b = node(UastTags.VARIABLE_DECLARATION_FRAGMENT, vd, role)
                .child(simpleName(vd.getNameAsString(), UastRoles.NAME, vd.getName()));
        vd.getInitializer().ifPresent(init -> b.child(render(init, UastRoles.INITIALIZER)));
        return b.build();
    }

    // -------------------- types --------------------

    private UastNode type(Type t, String role) {
        if (t instanceof ClassOrInterfaceType ct) {
            UastNode.Builder simple = node(UastTags.SIMPLE_TYPE, ct, ct.getTypeArguments().isPresent() ? UastRoles.TYPE : role);
            simple.child(typeName(ct));
            if (ct.getTypeArguments().isEmpty()) {
                return simple.build();
            }
            // Setting<Integer>, and the diamond of new Setting<>(...)
            UastNode.Builder parameterized = node(UastTags.PARAMETERIZED_TYPE, ct, role).child(simple.build());
            for (Type arg : ct.getTypeArguments().get()) {
                parameterized.child(type(arg, UastRoles.TYPE_ARGUMENTS));
            }
            return parameterized.build();
        }
        if (t instanceof PrimitiveType p) {
            return node(UastTags.PRIMITIVE_TYPE, p, role).token(p.asString()).build();
        }
        if (t instanceof VoidType v) {
            return node(UastTags.PRIMITIVE_TYPE, v, role).token("void").build();
        }
        if (t instanceof VarType v) {
            return node(UastTags.SIMPLE_TYPE, v, role).child(simpleName("var", UastRoles.NAME, v)).build();
        }
        if (t instanceof ArrayType a) {
            return node(UastTags.ARRAY_TYPE, a, role)
                    .attribute("dimensions", String.valueOf(a.getArrayLevel()))
                    .child(type(a.getElementType(), UastRoles.ELEMENT_TYPE))
                    .build();
        }
        if (t instanceof WildcardType w) {
            UastNode.Builder b = node(UastTags.WILDCARD_TYPE, w, role);
            w.getExtendedType().ifPresent(e -> b.attribute("upperBound", "true").child(type(e, UastRoles.BOUND)));
            w.getSuperType().ifPresent(s -> b.attribute("upperBound", "false").child(type(s, UastRoles.BOUND)));
            return b.build();
        }
        return generic(t, jdtName(t), role).build();
    }

    // java.util.List -> QualifiedName, List -> SimpleName
    private UastNode typeName(ClassOrInterfaceType ct) {
        if (ct.getScope().isEmpty()) {
            return simpleName(ct.getNameAsString(), UastRoles.NAME, ct.getName());
        }
        ClassOrInterfaceType scope = ct.getScope().get();
        UastNode qualifier = typeNameAsQualifier(scope);
        return qualified(qualifier, simpleName(ct.getNameAsString(), UastRoles.NAME, ct.getName()), UastRoles.NAME, ct);
    }

    private UastNode typeNameAsQualifier(ClassOrInterfaceType scope) {
        if (scope.getScope().isEmpty()) {
            return simpleName(scope.getNameAsString(), UastRoles.QUALIFIER, scope.getName());
        }
        UastNode outer = typeNameAsQualifier(scope.getScope().get());
        return qualified(outer, simpleName(scope.getNameAsString(), UastRoles.NAME, scope.getName()), UastRoles.QUALIFIER, scope);
    }

    // -------------------- names --------------------

    private UastNode simpleName(String identifier, String role, Node origin) {
        return node(UastTags.SIMPLE_NAME, origin, role).token(identifier).build();
    }

    private UastNode name(Name name, String role) {
        if (name.getQualifier().isEmpty()) {
            return simpleName(name.getIdentifier(), role, name);
        }
        UastNode qualifier = name(name.getQualifier().get(), UastRoles.QUALIFIER);
        return qualified(qualifier, simpleName(name.getIdentifier(), UastRoles.NAME, name), role, name);
    }

    /**
     * {@code Setting.Property.Dynamic} is a field access for JavaParser but a name for JDT:
     * a chain made only of identifiers becomes a {@code QualifiedName}.
     */
    private UastNode fieldAccess(FieldAccessExpr fa, String role) {
        UastNode member = simpleName(fa.getNameAsString(), UastRoles.NAME, fa.getName());
        if (isNameChain(fa)) {
            return qualified(render(fa.getScope(), UastRoles.QUALIFIER), member, role, fa);
        }
        return node(UastTags.FIELD_ACCESS, fa, role)
                .child(render(fa.getScope(), UastRoles.EXPRESSION))
                .child(member)
                .build();
    }

    private static boolean isNameChain(Expression e) {
        if (e instanceof NameExpr) return true;
        if (e instanceof FieldAccessExpr fa) return fa.getTypeArguments().isEmpty() && isNameChain(fa.getScope());
        return false;
    }

    private UastNode qualified(UastNode qualifier, UastNode member, String role, Node origin) {
        return node(UastTags.QUALIFIED_NAME, origin, role)
                .token(qualifier.token() + "." + member.token())
                .child(qualifier)
                .child(member)
                .build();
    }

    // -------------------- invocations --------------------

    private UastNode methodInvocation(MethodCallExpr mc, String role) {
        UastNode.Builder b = node(UastTags.METHOD_INVOCATION, mc, role);
        mc.getScope().ifPresent(s -> b.child(render(s, UastRoles.EXPRESSION)));
        mc.getTypeArguments().ifPresent(args -> args.forEach(t -> b.child(type(t, UastRoles.TYPE_ARGUMENTS))));
        b.child(simpleName(mc.getNameAsString(), UastRoles.NAME, mc.getName()));
        for (Expression arg : mc.getArguments()) {
            b.child(render(arg, UastRoles.ARGUMENTS));
        }
        return b.build();
    }

    private UastNode classInstanceCreation(ObjectCreationExpr oc, String role) {
        UastNode.Builder b = node(UastTags.CLASS_INSTANCE_CREATION, oc, role);
        oc.getScope().ifPresent(s -> b.child(render(s, UastRoles.EXPRESSION)));
        oc.getTypeArguments().ifPresent(args -> args.forEach(t -> b.child(type(t, UastRoles.TYPE_ARGUMENTS))));
        b.child(type(oc.getType(), UastRoles.TYPE));
        for (Expression arg : oc.getArguments()) {
            b.child(render(arg, UastRoles.ARGUMENTS));
        }
        oc.getAnonymousClassBody().ifPresent(body -> {
            UastNode.Builder anon = node(UastTags.ANONYMOUS_CLASS_DECLARATION, oc, UastRoles.ANONYMOUS_CLASS);
            for (BodyDeclaration<?> member : body) anon.child(render(member, null));
            b.child(anon.build());
        });
        return b.build();
    }

    // -------------------- generic --------------------

    private UastNode.Builder generic(Node n, String tag, String role) {
        UastNode.Builder b = node(tag, n, role);
        List<Node> children = new ArrayList<>();
        for (Node c : n.getChildNodes()) {
            if (!(c instanceof Comment)) children.add(c);
        }
        children.sort(SOURCE_ORDER);
        for (Node c : children) {
            b.child(c instanceof AnnotationExpr || c instanceof Modifier ? render(c, UastRoles.MODIFIERS) : render(c, null));
        }
        return b;
    }

    private static UastNode.Builder node(String tag, Node origin, String role) {
        Position position = origin.getBegin()
                .map(p -> new Position(p.line, p.column))
                .orElse(Position.UNKNOWN);
        return UastNode.builder(tag).role(role).position(position);
    }

    static String jdtName(Node n) {
        String simple = n.getClass().getSimpleName();
        String mapped = JDT_NAMES.get(simple);
        if (mapped != null) return mapped;
        if (simple.endsWith("Expr")) return simple.substring(0, simple.length() - 4) + "Expression";
        if (simple.endsWith("Stmt")) return simple.substring(0, simple.length() - 4) + "Statement";
        return simple;
    }
}
