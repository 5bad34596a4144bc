package com.vidnyan.codeguard.adapter.out.parser;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.ReceiverParameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.TypeParameter;
import com.vidnyan.codeguard.domain.model.Location;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a JavaParser compilation unit into a {@link SyntaxNode} tree.
 * <p>
 * Ids are handed out in pre-order: a node takes its id before any of its
 * children are converted. Names, types, modifiers, annotations and comments
 * become node names or attributes instead of nodes.
 * Not thread-safe; one builder per file.
 */
class JavaSyntaxTreeBuilder {

    private static final Position UNKNOWN = new Position(Integer.MAX_VALUE, Integer.MAX_VALUE);

    private final String path;
    private int nextId;

    JavaSyntaxTreeBuilder(String path) {
        this.path = path;
    }

    SyntaxNode build(CompilationUnit unit) {
        nextId = 0;
        return convert(unit);
    }

    private SyntaxNode convert(Node node) {
        int id = nextId++;
        Location location = locationOf(node);

        if (node instanceof CompilationUnit unit) {
            String pkg = unit.getPackageDeclaration().map(PackageDeclaration::getNameAsString).orElse("");
            return node(id, NodeKind.MODULE, pkg, location, Set.of(), "", children(node));
        }
        if (node instanceof ImportDeclaration imp) {
            String name = imp.getNameAsString() + (imp.isAsterisk() ? ".*" : "");
            return node(id, NodeKind.IMPORT, name, location, imp.isStatic() ? Set.of("static") : Set.of(), "", List.of());
        }
        if (node instanceof TypeDeclaration<?> type) {
            return node(id, NodeKind.CLASS_DEF, type.getNameAsString(), location,
                    attributesOf(node), commentOf(node), children(node));
        }
        if (node instanceof MethodDeclaration method) {
            return node(id, NodeKind.FUNCTION_DEF, method.getNameAsString(), location,
                    attributesOf(node), commentOf(node), children(node));
        }
        if (node instanceof ConstructorDeclaration constructor) {
            return node(id, NodeKind.CONSTRUCTOR_DEF, constructor.getNameAsString(), location,
                    attributesOf(node), commentOf(node), children(node));
        }
        if (node instanceof LambdaExpr) {
            return node(id, NodeKind.LAMBDA, "", location, Set.of(), "", children(node));
        }
        if (node instanceof Parameter parameter) {
            return node(id, NodeKind.PARAMETER, parameter.getNameAsString(), location,
                    attributesOf(node), "", List.of());
        }
        if (node instanceof VariableDeclarator variable) {
            return node(id, NodeKind.VARIABLE_DECL, variable.getNameAsString(), location, Set.of(), "", children(node));
        }
        if (node instanceof FieldDeclaration) {
            return node(id, NodeKind.OTHER, "", location, attributesOf(node), commentOf(node), children(node));
        }
        if (node instanceof TryStmt tryStmt) {
            return convertTry(id, location, tryStmt);
        }
        if (node instanceof CatchClause handler) {
            String caught = handler.getParameter().getType().asString().replace(" ", "");
            return node(id, NodeKind.EXCEPTION_HANDLER, caught, location, Set.of(), "",
                    convertAll(handler.getBody().getStatements()));
        }
        if (node instanceof SynchronizedStmt sync) {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(convert(sync.getExpression()));
            children.addAll(convertAll(sync.getBody().getStatements()));
            return node(id, NodeKind.LOCK_BLOCK, sync.getExpression().toString(), location, Set.of(), "", children);
        }
        if (node instanceof BlockStmt) {
            return node(id, NodeKind.BLOCK, "", location, Set.of(), "", children(node));
        }
        if (node instanceof EmptyStmt) {
            return node(id, NodeKind.NO_OP, "", location, Set.of(), "", List.of());
        }
        if (node instanceof IfStmt) {
            return node(id, NodeKind.IF, "", location, Set.of(), "", children(node));
        }
        if (node instanceof ReturnStmt) {
            return node(id, NodeKind.RETURN, "", location, Set.of(), "", children(node));
        }
        if (node instanceof ThrowStmt) {
            return node(id, NodeKind.THROW, "", location, Set.of(), "", children(node));
        }
        if (node instanceof MethodCallExpr call) {
            return convertCall(id, location, call);
        }
        if (node instanceof FieldAccessExpr access) {
            Location at = nameLocation(access.getName(), location);
            return node(id, NodeKind.ATTRIBUTE_ACCESS, access.getNameAsString(), at, Set.of(), "",
                    List.of(convert(access.getScope())));
        }
        if (node instanceof NameExpr name) {
            return node(id, NodeKind.NAME, name.getNameAsString(), location, Set.of(), "", List.of());
        }
        if (node instanceof ThisExpr) {
            return node(id, NodeKind.NAME, "this", location, Set.of(), "", List.of());
        }
        if (node instanceof SuperExpr) {
            return node(id, NodeKind.NAME, "super", location, Set.of(), "", List.of());
        }
        if (node instanceof ObjectCreationExpr creation) {
            return convertCreation(id, location, creation);
        }
        if (node instanceof AssignExpr assign) {
            boolean plain = assign.getOperator() == AssignExpr.Operator.ASSIGN;
            return node(id, plain ? NodeKind.ASSIGNMENT : NodeKind.AUGMENTED_ASSIGNMENT,
                    assign.getOperator().asString(), location, Set.of(), "",
                    List.of(convert(assign.getTarget()), convert(assign.getValue())));
        }
        if (node instanceof UnaryExpr unary) {
            String operator = unary.getOperator().asString();
            boolean step = operator.equals("++") || operator.equals("--");
            return node(id, step ? NodeKind.AUGMENTED_ASSIGNMENT : NodeKind.UNARY_OP, operator, location,
                    Set.of(), "", List.of(convert(unary.getExpression())));
        }
        if (node instanceof BinaryExpr binary) {
            return node(id, NodeKind.BINARY_OP, binary.getOperator().asString(), location, Set.of(), "",
                    List.of(convert(binary.getLeft()), convert(binary.getRight())));
        }
        if (node instanceof ArrayAccessExpr access) {
            return node(id, NodeKind.SUBSCRIPT, "", location, Set.of(), "",
                    List.of(convert(access.getName()), convert(access.getIndex())));
        }
        if (node instanceof StringLiteralExpr literal) {
            return node(id, NodeKind.STRING_LITERAL, literal.asString(), location, Set.of(), "", List.of());
        }
        if (node instanceof TextBlockLiteralExpr literal) {
            return node(id, NodeKind.STRING_LITERAL, literal.asString(), location, Set.of(), "", List.of());
        }
        if (node instanceof IntegerLiteralExpr || node instanceof LongLiteralExpr || node instanceof DoubleLiteralExpr) {
            return node(id, NodeKind.NUMBER_LITERAL, node.toString(), location, Set.of(), "", List.of());
        }
        if (node instanceof NullLiteralExpr || node instanceof BooleanLiteralExpr || node instanceof CharLiteralExpr) {
            return node(id, NodeKind.LITERAL, node.toString(), location, Set.of(), "", List.of());
        }
        return node(id, NodeKind.OTHER, "", location, Set.of(), "", children(node));
    }

    private SyntaxNode convertTry(int id, Location location, TryStmt tryStmt) {
        List<SyntaxNode> children = new ArrayList<>(convertAll(tryStmt.getResources()));

        BlockStmt body = tryStmt.getTryBlock();
        int bodyId = nextId++;
        children.add(node(bodyId, NodeKind.TRY_BODY, "", locationOf(body), Set.of(), "",
                convertAll(body.getStatements())));

        children.addAll(convertAll(tryStmt.getCatchClauses()));

        tryStmt.getFinallyBlock().ifPresent(fin -> {
            int finallyId = nextId++;
            children.add(node(finallyId, NodeKind.FINALLY_BODY, "", locationOf(fin), Set.of(), "",
                    convertAll(fin.getStatements())));
        });

        Set<String> attributes = tryStmt.getResources().isEmpty() ? Set.of() : Set.of("resources");
        return node(id, NodeKind.TRY, "", location, attributes, "", children);
    }

    private SyntaxNode convertCall(int id, Location location, MethodCallExpr call) {
        String method = call.getNameAsString();
        Location nameAt = nameLocation(call.getName(), location);

        int calleeId = nextId++;
        SyntaxNode callee = call.getScope()
                .map(scope -> node(calleeId, NodeKind.ATTRIBUTE_ACCESS, method, nameAt, Set.of(), "",
                        List.of(convert(scope))))
                .orElseGet(() -> node(calleeId, NodeKind.NAME, method, nameAt, Set.of(), "", List.of()));

        List<SyntaxNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(convertAll(call.getArguments()));
        return node(id, NodeKind.CALL, method, location, Set.of(), "", children);
    }

    private SyntaxNode convertCreation(int id, Location location, ObjectCreationExpr creation) {
        List<SyntaxNode> children = new ArrayList<>(convertAll(creation.getArguments()));
        creation.getAnonymousClassBody().ifPresent(members -> {
            int bodyId = nextId++;
            children.add(node(bodyId, NodeKind.CLASS_DEF, "<anonymous>", location, Set.of(), "",
                    convertAll(members)));
        });
        return node(id, NodeKind.NEW_INSTANCE, creation.getType().getNameAsString(), location, Set.of(), "", children);
    }

    private List<SyntaxNode> children(Node node) {
        return convertAll(node.getChildNodes());
    }

    private List<SyntaxNode> convertAll(List<? extends Node> nodes) {
        List<Node> kept = new ArrayList<>();
        for (Node n : nodes) {
            if (!isSkipped(n)) {
                kept.add(n);
            }
        }
        kept.sort(Comparator.comparing(JavaSyntaxTreeBuilder::beginOf));
        List<SyntaxNode> converted = new ArrayList<>(kept.size());
        for (Node n : kept) {
            converted.add(convert(n));
        }
        return converted;
    }

    private static boolean isSkipped(Node node) {
        return node instanceof SimpleName
                || node instanceof Name
                || node instanceof Type
                || node instanceof Modifier
                || node instanceof AnnotationExpr
                || node instanceof MemberValuePair
                || node instanceof Comment
                || node instanceof TypeParameter
                || node instanceof ReceiverParameter
                || node instanceof PackageDeclaration;
    }

    private static Set<String> attributesOf(Node node) {
        Set<String> attributes = new LinkedHashSet<>();
        if (node instanceof NodeWithModifiers<?> withModifiers) {
            for (Modifier modifier : withModifiers.getModifiers()) {
                attributes.add(modifier.getKeyword().asString());
            }
        }
        if (node instanceof NodeWithAnnotations<?> withAnnotations) {
            for (AnnotationExpr annotation : withAnnotations.getAnnotations()) {
                attributes.add("@" + annotation.getName().getIdentifier());
            }
        }
        if (node instanceof CallableDeclaration<?> callable) {
            callable.getThrownExceptions().forEach(t -> attributes.add("throws " + t.asString()));
        }
        return attributes;
    }

    private static String commentOf(Node node) {
        return node.getComment().map(Comment::getContent).orElse("");
    }

    private static Position beginOf(Node node) {
        return node.getRange().map(r -> r.begin).orElse(UNKNOWN);
    }

    private Location locationOf(Node node) {
        return node.getRange()
                .map(this::toLocation)
                .orElseGet(() -> Location.at(path, 1, 1));
    }

    private Location nameLocation(SimpleName name, Location fallback) {
        return name.getRange()
                .map(r -> new Location(path, r.begin.line, r.begin.column, fallback.endLine(), fallback.endColumn()))
                .orElse(fallback);
    }

    private Location toLocation(Range range) {
        return new Location(path, range.begin.line, range.begin.column, range.end.line, range.end.column);
    }

    private static SyntaxNode node(int id, NodeKind kind, String name, Location location,
                                   Set<String> attributes, String comment, List<SyntaxNode> children) {
        return new SyntaxNode(id, kind, name, location, attributes, comment, children);
    }
}
