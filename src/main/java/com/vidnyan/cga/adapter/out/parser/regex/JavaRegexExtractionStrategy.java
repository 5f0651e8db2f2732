package com.vidnyan.cga.adapter.out.parser.regex;

import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationKind;
import com.vidnyan.cga.domain.extraction.ExportExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction.ImportedName;
import com.vidnyan.cga.domain.model.Language;
import com.vidnyan.cga.domain.model.Parameter;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Java fallback used when JavaParser rejects a file (syntax errors, newer language features)
 * or finds nothing in it.
 */
@Component
public class JavaRegexExtractionStrategy extends RegexExtractionStrategy {

    private static final String ANNOTATIONS = "((?:@[\\w.]+(?:\\s*\\([^)]*\\))?\\s+)*)";

    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "(?m)^[ \\t]*" + ANNOTATIONS
                    + "((?:(?:public|protected|private|static|final|abstract|sealed|non-sealed|strictfp)\\s+)*)"
                    + "(class|interface|enum|record|@interface)\\s+([\\w$]+)");
    private static final Pattern METHOD = Pattern.compile(
            "(?m)^[ \\t]*" + ANNOTATIONS
                    + "((?:(?:public|protected|private|static|final|abstract|synchronized|native|default|strictfp)\\s+)*)"
                    + "(?:<[^>{};]*>\\s+)?([\\w$][\\w$.<>\\[\\], ?]*?)\\s+([\\w$]+)\\s*\\(");
    private static final Pattern CONSTRUCTOR = Pattern.compile(
            "(?m)^[ \\t]*" + ANNOTATIONS + "((?:(?:public|protected|private)\\s+)?)([A-Z][\\w$]*)\\s*\\(");
    private static final Pattern BODY_START = Pattern.compile("\\G\\s*(?:throws\\s+[\\w$.,\\s<>]+?)?\\s*\\{");
    private static final Pattern SIGNATURE_END = Pattern.compile("\\G\\s*(?:throws\\s+[\\w$.,\\s<>]+?)?\\s*;");
    private static final Pattern IMPORT = Pattern.compile("(?m)^[ \\t]*import\\s+(static\\s+)?([\\w$.]+?)(\\.\\*)?\\s*;");
    private static final Pattern ANNOTATION_NAME = Pattern.compile("@([\\w.]+)");

    private static final Set<String> KEYWORDS = Set.of("if", "for", "while", "switch", "catch", "try", "return",
            "throw", "new", "class", "interface", "enum", "record", "synchronized", "assert", "super", "this",
            "else", "case", "yield", "do", "finally");
    private static final Set<String> NOT_A_TYPE = Set.of("return", "new", "else", "throw", "case", "yield",
            "record", "class", "interface", "enum", "package", "import", "public", "protected", "private",
            "static", "final", "abstract", "synchronized", "native", "default", "strictfp", "assert", "throws");

    @Override
    public Language language() {
        return Language.JAVA;
    }

    @Override
    protected SourceText prepare(String source) {
        return SourceText.cFamily(source);
    }

    @Override
    protected List<DeclarationExtraction> declarations(SourceText text) {
        List<DeclarationExtraction> declarations = new ArrayList<>();
        String clean = text.clean();
        Matcher m = TYPE_DECLARATION.matcher(clean);
        while (m.find()) {
            if (m.group(3).equals("@interface")) {
                continue;
            }
            int open = clean.indexOf('{', m.end());
            if (open < 0) {
                continue;
            }
            String header = clean.substring(m.end(), open);
            int end = text.blockEnd(open);
            String body = clean.substring(open, Math.min(end + 1, clean.length()));
            declarations.add(new DeclarationExtraction(m.group(4), kind(m.group(3)), text.lineAt(m.start(4)),
                    text.lineAt(end), baseTypes(header), methodNames(body), m.group(2).contains("public")));
        }
        return declarations;
    }

    @Override
    protected List<Definition> definitions(SourceText text, List<DeclarationExtraction> declarations) {
        String clean = text.clean();
        List<Span> types = spans(text, declarations);
        List<Definition> definitions = new ArrayList<>();

        Matcher m = METHOD.matcher(clean);
        while (m.find()) {
            String returnType = m.group(3).trim();
            String name = m.group(4);
            if (KEYWORDS.contains(name) || notAType(returnType)) {
                continue;
            }
            int open = m.end() - 1;
            int close = text.closingParen(open);
            if (close < 0 || !BODY_START.matcher(clean).region(close + 1, clean.length()).lookingAt()) {
                continue;
            }
            definitions.add(definition(text, m, types, name, open, close, returnType, false));
        }

        m = CONSTRUCTOR.matcher(clean);
        while (m.find()) {
            String name = m.group(3);
            int open = m.end() - 1;
            int close = text.closingParen(open);
            Span owner = innermost(types, text.lineAt(m.start(3)));
            if (owner == null || !owner.name().equals(name) || close < 0
                    || !BODY_START.matcher(clean).region(close + 1, clean.length()).lookingAt()) {
                continue;
            }
            definitions.add(definition(text, m, types, name, open, close, null, true));
        }

        definitions.sort(Comparator.comparingInt(Definition::nameOffset));
        return definitions;
    }

    private Definition definition(SourceText text, Matcher m, List<Span> types, String name, int open, int close,
                                  String returnType, boolean constructor) {
        String clean = text.clean();
        int nameOffset = m.start(constructor ? 3 : 4);
        int bodyEnd = text.blockEnd(close);
        Span owner = innermost(types, text.lineAt(nameOffset));
        String modifiers = m.group(2);
        List<String> decorators = annotationNames(m.group(1));
        int startOffset = m.group(1).isEmpty() ? firstNonSpace(clean, m.start()) : m.start(1);

        FunctionExtraction function = FunctionExtraction.builder()
                .name(name)
                .qualifiedName(owner != null ? owner.qualifiedName() + "." + name : name)
                .className(owner != null ? owner.name() : null)
                .startLine(text.lineAt(startOffset))
                .endLine(text.lineAt(bodyEnd))
                .parameters(parameters(clean.substring(open + 1, close)))
                .returnType(returnType)
                .exported(modifiers.contains("public"))
                .constructor(constructor)
                .async(decorators.contains("Async"))
                .decorators(decorators)
                .build();
        return new Definition(function, nameOffset);
    }

    @Override
    protected List<ImportExtraction> imports(SourceText text) {
        List<ImportExtraction> imports = new ArrayList<>();
        Matcher m = IMPORT.matcher(text.clean());
        while (m.find()) {
            boolean isStatic = m.group(1) != null;
            String name = m.group(2);
            int line = text.lineAt(m.start());
            if (m.group(3) != null) {
                imports.add(new ImportExtraction(name, List.of(ImportedName.namespaceOf("*")), line, isStatic));
                continue;
            }
            int dot = name.lastIndexOf('.');
            String simple = name.substring(dot + 1);
            String source = isStatic && dot > 0 ? name.substring(0, dot) : name;
            imports.add(new ImportExtraction(source, List.of(ImportedName.of(simple)), line, isStatic));
        }
        return imports;
    }

    @Override
    protected List<ExportExtraction> exports(SourceText text) {
        List<ExportExtraction> exports = new ArrayList<>();
        Matcher m = TYPE_DECLARATION.matcher(text.clean());
        while (m.find()) {
            boolean topLevel = SourceText.indentOf(text.cleanLine(text.lineAt(m.start(3)))) == 0;
            if (topLevel && m.group(2).contains("public")) {
                exports.add(new ExportExtraction(m.group(4), text.lineAt(m.start(4)), false));
            }
        }
        return exports;
    }

    @Override
    protected Set<String> keywords() {
        return KEYWORDS;
    }

    @Override
    protected UnresolvedReason hint(String calleeName, String receiver, boolean constructorCall) {
        if ("forName".equals(calleeName) && "Class".equals(receiver)) {
            return UnresolvedReason.REFLECTION;
        }
        if (receiver != null && (calleeName.equals("invoke") || calleeName.equals("newInstance"))) {
            return UnresolvedReason.REFLECTION;
        }
        return null;
    }

    /**
     * Abstract and interface method signatures have no body and are not definitions, but their
     * names must not be read back as calls.
     */
    @Override
    protected void extraCalls(SourceText text, String file, Set<Integer> claimed, List<CallExtraction> calls) {
        String clean = text.clean();
        Matcher m = METHOD.matcher(clean);
        while (m.find()) {
            int close = text.closingParen(m.end() - 1);
            if (close > 0 && !notAType(m.group(3))
                    && SIGNATURE_END.matcher(clean).region(close + 1, clean.length()).lookingAt()) {
                claimed.add(m.start(4));
            }
        }
    }

    private static boolean notAType(String type) {
        return NOT_A_TYPE.contains(type.trim().split("\\s+")[0]);
    }

    private static DeclarationKind kind(String keyword) {
        return switch (keyword) {
            case "interface" -> DeclarationKind.INTERFACE;
            case "enum" -> DeclarationKind.ENUM;
            case "record" -> DeclarationKind.RECORD;
            default -> DeclarationKind.CLASS;
        };
    }

    private static List<String> baseTypes(String header) {
        String withoutComponents = header.replaceAll("\\([^)]*\\)", " ");
        List<String> bases = new ArrayList<>();
        Matcher m = Pattern.compile("\\b(extends|implements)\\s+(.+?)(?=\\b(?:extends|implements|permits)\\b|$)",
                Pattern.DOTALL).matcher(withoutComponents);
        while (m.find()) {
            for (String part : SourceText.splitTopLevel(m.group(2))) {
                String type = part.replaceAll("<.*", "").trim();
                if (!type.isEmpty()) {
                    bases.add(type.substring(type.lastIndexOf('.') + 1));
                }
            }
        }
        return bases;
    }

    private static List<String> methodNames(String body) {
        List<String> names = new ArrayList<>();
        Matcher m = METHOD.matcher(body);
        while (m.find()) {
            String name = m.group(4);
            if (!KEYWORDS.contains(name) && !notAType(m.group(3)) && !names.contains(name)) {
                names.add(name);
            }
        }
        return names;
    }

    private static List<Parameter> parameters(String list) {
        List<Parameter> parameters = new ArrayList<>();
        for (String part : SourceText.splitTopLevel(list)) {
            String cleaned = part.replaceAll("@[\\w.]+(\\([^)]*\\))?", "").replace("final ", "").trim();
            int split = cleaned.lastIndexOf(' ');
            if (split < 0) {
                continue;
            }
            String type = cleaned.substring(0, split).trim();
            boolean varargs = type.endsWith("...");
            parameters.add(new Parameter(cleaned.substring(split + 1), varargs ? type.substring(0, type.length() - 3)
                    : type, false, varargs));
        }
        return parameters;
    }

    private static List<String> annotationNames(String annotations) {
        List<String> names = new ArrayList<>();
        Matcher m = ANNOTATION_NAME.matcher(annotations);
        while (m.find()) {
            String name = m.group(1);
            names.add(name.substring(name.lastIndexOf('.') + 1));
        }
        return names;
    }

    private static int firstNonSpace(String clean, int from) {
        int i = from;
        while (i < clean.length() && Character.isWhitespace(clean.charAt(i))) {
            i++;
        }
        return i;
    }

    private static List<Span> spans(SourceText text, List<DeclarationExtraction> declarations) {
        List<Span> spans = new ArrayList<>();
        for (DeclarationExtraction declaration : declarations) {
            Span outer = spans.stream()
                    .filter(s -> s.startLine() <= declaration.startLine() && declaration.endLine() <= s.endLine())
                    .reduce((a, b) -> b)
                    .orElse(null);
            String qualified = outer != null ? outer.qualifiedName() + "." + declaration.name() : declaration.name();
            spans.add(new Span(declaration.name(), qualified, declaration.startLine(), declaration.endLine()));
        }
        return spans;
    }

    private static Span innermost(List<Span> spans, int line) {
        Span found = null;
        for (Span span : spans) {
            if (span.startLine() <= line && line <= span.endLine()) {
                found = span;
            }
        }
        return found;
    }

    private record Span(String name, String qualifiedName, int startLine, int endLine) {}
}
