package com.vidnyan.cga.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.vidnyan.cga.application.port.out.ExtractionStrategy;
import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationKind;
import com.vidnyan.cga.domain.extraction.ExportExtraction;
import com.vidnyan.cga.domain.extraction.ExtractionException;
import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.extraction.ExtractionQuality;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction.ImportedName;
import com.vidnyan.cga.domain.model.Language;
import com.vidnyan.cga.domain.model.Parameter;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Structural Java extraction on top of JavaParser.
 * <p>
 * Receiver types come from declarations visible at the call site (fields, parameters,
 * locals); no symbol solving is attempted. A receiver whose declared type is not a project
 * type is later classified as an external-library call.
 */
@Slf4j
@Component
public class JavaParserExtractionStrategy implements ExtractionStrategy {

    private static final String UNKNOWN_TYPE = "var";
    private static final Set<String> REFLECTIVE_CALLS = Set.of("invoke", "newInstance", "forName",
            "getMethod", "getDeclaredMethod");

    @Override
    public Language language() {
        return Language.JAVA;
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.STRUCTURAL;
    }

    @Override
    public FileExtraction extract(String source, String file) {
        long start = System.nanoTime();
        // JavaParser is not thread-safe: one instance per call
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problem = result.getProblems().stream()
                    .findFirst()
                    .map(Problem::getVerboseMessage)
                    .orElse("unknown parse error");
            throw new ExtractionException(file + ": " + problem);
        }

        CompilationUnit cu = result.getResult().get();
        SourceVisitor visitor = new SourceVisitor();
        cu.accept(visitor, null);

        List<ImportExtraction> imports = cu.getImports().stream()
                .map(JavaParserExtractionStrategy::toImport)
                .toList();
        List<ExportExtraction> exports = cu.getTypes().stream()
                .filter(TypeDeclaration::isPublic)
                .map(td -> new ExportExtraction(td.getNameAsString(), line(td), false))
                .toList();

        int items = visitor.functions.size() + visitor.calls.size() + imports.size() + exports.size()
                + visitor.declarations.size();
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        log.debug("{}: parsed {} types, {} methods, {} calls", file, visitor.declarations.size(),
                visitor.functions.size(), visitor.calls.size());

        return new FileExtraction(file, Language.JAVA, visitor.functions, visitor.calls, imports, exports,
                visitor.declarations, List.of(), List.of(),
                ExtractionQuality.of(ExtractionMethod.STRUCTURAL, items, elapsed));
    }

    private static ImportExtraction toImport(ImportDeclaration imp) {
        String name = imp.getNameAsString();
        if (imp.isAsterisk()) {
            return new ImportExtraction(name, List.of(ImportedName.namespaceOf("*")), line(imp), imp.isStatic());
        }
        int dot = name.lastIndexOf('.');
        String simple = dot >= 0 ? name.substring(dot + 1) : name;
        if (imp.isStatic() && dot > 0) {
            // static member import: the module is the declaring class
            return new ImportExtraction(name.substring(0, dot), List.of(ImportedName.of(simple)), line(imp), true);
        }
        return new ImportExtraction(name, List.of(ImportedName.of(simple)), line(imp), false);
    }

    private static int line(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }

    private static int endLine(Node node) {
        return node.getEnd().map(p -> p.line).orElse(line(node));
    }

    private static int column(Node node) {
        return node.getBegin().map(p -> p.column).orElse(0);
    }

    private static List<String> annotationNames(NodeList<AnnotationExpr> annotations) {
        return annotations.stream()
                .map(a -> a.getName().getIdentifier())
                .toList();
    }

    /**
     * Walks one compilation unit keeping a stack of enclosing types and a stack of
     * variable scopes (name to declared type).
     */
    private static final class SourceVisitor extends VoidVisitorAdapter<Void> {

        private final List<FunctionExtraction> functions = new ArrayList<>();
        private final List<CallExtraction> calls = new ArrayList<>();
        private final List<DeclarationExtraction> declarations = new ArrayList<>();

        private final List<String> typePath = new ArrayList<>();
        private final Deque<Boolean> interfaceStack = new ArrayDeque<>();
        private final Deque<Map<String, String>> scopes = new ArrayDeque<>();

        @Override
        public void visit(ClassOrInterfaceDeclaration n, Void arg) {
            List<String> bases = new ArrayList<>();
            n.getExtendedTypes().forEach(t -> bases.add(t.getNameAsString()));
            n.getImplementedTypes().forEach(t -> bases.add(t.getNameAsString()));
            enterType(n, n.isInterface() ? DeclarationKind.INTERFACE : DeclarationKind.CLASS, bases,
                    n.isInterface());
            super.visit(n, arg);
            exitType();
        }

        @Override
        public void visit(EnumDeclaration n, Void arg) {
            List<String> bases = n.getImplementedTypes().stream().map(ClassOrInterfaceType::getNameAsString).toList();
            enterType(n, DeclarationKind.ENUM, bases, false);
            super.visit(n, arg);
            exitType();
        }

        @Override
        public void visit(RecordDeclaration n, Void arg) {
            List<String> bases = n.getImplementedTypes().stream().map(ClassOrInterfaceType::getNameAsString).toList();
            enterType(n, DeclarationKind.RECORD, bases, false);
            n.getParameters().forEach(p -> scopes.peek().put(p.getNameAsString(), p.getTypeAsString()));
            super.visit(n, arg);
            exitType();
        }

        @Override
        public void visit(MethodDeclaration n, Void arg) {
            boolean member = n.getParentNode().filter(TypeDeclaration.class::isInstance).isPresent();
            if (member) {
                boolean inInterface = Boolean.TRUE.equals(interfaceStack.peek());
                functions.add(function(n)
                        .returnType(n.getTypeAsString())
                        .exported(n.isPublic() || (inInterface && !n.isPrivate()))
                        .async(n.isAnnotationPresent("Async"))
                        .build());
            }
            // methods of anonymous classes contribute their calls to the enclosing function
            enterCallable(n);
            super.visit(n, arg);
            scopes.pop();
        }

        @Override
        public void visit(ConstructorDeclaration n, Void arg) {
            functions.add(function(n)
                    .constructor(true)
                    .exported(n.isPublic())
                    .build());
            enterCallable(n);
            super.visit(n, arg);
            scopes.pop();
        }

        @Override
        public void visit(LambdaExpr n, Void arg) {
            Map<String, String> scope = new HashMap<>();
            n.getParameters().forEach(p -> scope.put(p.getNameAsString(),
                    p.getType().isUnknownType() ? UNKNOWN_TYPE : p.getTypeAsString()));
            scopes.push(scope);
            super.visit(n, arg);
            scopes.pop();
        }

        @Override
        public void visit(VariableDeclarationExpr n, Void arg) {
            Map<String, String> scope = scopes.peek();
            if (scope != null) {
                n.getVariables().forEach(v -> scope.put(v.getNameAsString(), v.getTypeAsString()));
            }
            super.visit(n, arg);
        }

        @Override
        public void visit(ForEachStmt n, Void arg) {
            Map<String, String> scope = scopes.peek();
            if (scope != null) {
                n.getVariable().getVariables().forEach(v -> scope.put(v.getNameAsString(), v.getTypeAsString()));
            }
            super.visit(n, arg);
        }

        @Override
        public void visit(CatchClause n, Void arg) {
            Map<String, String> scope = scopes.peek();
            if (scope != null) {
                scope.put(n.getParameter().getNameAsString(), n.getParameter().getTypeAsString());
            }
            super.visit(n, arg);
        }

        @Override
        public void visit(MethodCallExpr n, Void arg) {
            super.visit(n, arg);
            CallExtraction.Builder call = CallExtraction.builder()
                    .calleeName(n.getNameAsString())
                    .line(line(n))
                    .column(column(n))
                    .argumentCount(n.getArguments().size())
                    .methodCall(n.getScope().isPresent());

            n.getScope().ifPresent(scope -> {
                String receiver = receiverOf(scope);
                call.receiver(receiver).fullExpression(receiver + "." + n.getNameAsString());
                String type = receiverType(scope);
                if (type != null) {
                    call.receiverType(type);
                }
                if (REFLECTIVE_CALLS.contains(n.getNameAsString()) && reflective(type, receiver)) {
                    call.dynamicHint(UnresolvedReason.REFLECTION);
                }
            });
            calls.add(call.build());
        }

        @Override
        public void visit(ObjectCreationExpr n, Void arg) {
            super.visit(n, arg);
            String type = n.getType().getNameAsString();
            calls.add(CallExtraction.builder()
                    .calleeName(type)
                    .fullExpression("new " + type)
                    .line(line(n))
                    .column(column(n))
                    .argumentCount(n.getArguments().size())
                    .constructorCall(true)
                    .build());
        }

        private void enterType(TypeDeclaration<?> n, DeclarationKind kind, List<String> bases, boolean isInterface) {
            List<String> methods = n.getMethods().stream()
                    .map(MethodDeclaration::getNameAsString)
                    .distinct()
                    .toList();
            declarations.add(new DeclarationExtraction(n.getNameAsString(), kind, line(n), endLine(n), bases,
                    methods, n.isPublic()));
            typePath.add(n.getNameAsString());
            interfaceStack.push(isInterface);

            Map<String, String> fields = new HashMap<>();
            for (FieldDeclaration field : n.getFields()) {
                field.getVariables().forEach(v -> fields.put(v.getNameAsString(), v.getTypeAsString()));
            }
            scopes.push(fields);
        }

        private void exitType() {
            scopes.pop();
            interfaceStack.pop();
            typePath.remove(typePath.size() - 1);
        }

        private void enterCallable(CallableDeclaration<?> n) {
            Map<String, String> scope = new HashMap<>();
            n.getParameters().forEach(p -> scope.put(p.getNameAsString(), p.getTypeAsString()));
            scopes.push(scope);
        }

        private FunctionExtraction.Builder function(CallableDeclaration<?> n) {
            String className = typePath.isEmpty() ? null : typePath.get(typePath.size() - 1);
            String owner = String.join(".", typePath);
            List<Parameter> parameters = n.getParameters().stream()
                    .map(p -> new Parameter(p.getNameAsString(), p.getTypeAsString(), false, p.isVarArgs()))
                    .toList();
            return FunctionExtraction.builder()
                    .name(n.getNameAsString())
                    .qualifiedName(owner.isEmpty() ? n.getNameAsString() : owner + "." + n.getNameAsString())
                    .className(className)
                    .startLine(line(n))
                    .endLine(endLine(n))
                    .parameters(parameters)
                    .decorators(annotationNames(n.getAnnotations()));
        }

        /**
         * Declared type of a simple receiver, or the receiver itself when it names a class.
         */
        private String receiverType(Expression scope) {
            String name = null;
            if (scope.isNameExpr()) {
                name = scope.asNameExpr().getNameAsString();
            } else if (scope.isFieldAccessExpr() && scope.asFieldAccessExpr().getScope().isThisExpr()) {
                name = scope.asFieldAccessExpr().getNameAsString();
            }
            if (name == null) {
                return null;
            }
            for (Map<String, String> frame : scopes) {
                if (frame.containsKey(name)) {
                    String type = frame.get(name);
                    return UNKNOWN_TYPE.equals(type) ? null : type;
                }
            }
            if (scope.isNameExpr() && Character.isUpperCase(name.charAt(0))) {
                return name;
            }
            return null;
        }

        private static String receiverOf(Expression scope) {
            if (scope instanceof NameExpr nameExpr) {
                return nameExpr.getNameAsString();
            }
            if (scope instanceof FieldAccessExpr access && access.getScope().isThisExpr()) {
                return "this." + access.getNameAsString();
            }
            if (scope.isThisExpr()) {
                return "this";
            }
            if (scope.isSuperExpr()) {
                return "super";
            }
            return scope.toString().lines().map(String::trim).collect(Collectors.joining(" "));
        }

        private static boolean reflective(String type, String receiver) {
            if (type != null) {
                String simple = type.replaceAll("<.*>", "");
                return simple.equals("Method") || simple.equals("Class") || simple.equals("Constructor");
            }
            return "Class".equals(receiver);
        }
    }
}
