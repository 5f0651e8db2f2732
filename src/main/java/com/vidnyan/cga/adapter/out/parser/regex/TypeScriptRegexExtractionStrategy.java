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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TypeScript and JavaScript extraction. One instance serves each language; the patterns are
 * shared because plain JavaScript is read as TypeScript without type annotations.
 * <p>
 * Functions are {@code function} declarations, arrow functions and function expressions bound
 * to a name, and class members found at the first brace level of a class body.
 */
public class TypeScriptRegexExtractionStrategy extends RegexExtractionStrategy {

    private static final String MEMBER_MODIFIERS =
            "((?:(?:public|private|protected|static|async|readonly|abstract|override|declare|get|set)\\s+)*)";

    private static final Pattern FUNCTION_DECLARATION = Pattern.compile(
            "(?m)^[ \\t]*(export\\s+)?(default\\s+)?(declare\\s+)?(async\\s+)?function\\s*(\\*)?\\s*([\\w$]+)\\s*(?:<[^>{}]*>)?\\s*\\(");
    private static final Pattern BINDING = Pattern.compile(
            "(?m)^[ \\t]*(export\\s+)?(?:(?:const|let|var)\\s+([\\w$]+)\\s*(?::[^=;\\n]+)?|(?:module\\.)?exports\\.([\\w$]+)\\s*)=\\s*");
    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "(?m)^[ \\t]*(export\\s+)?(default\\s+)?(declare\\s+)?(abstract\\s+)?(class|interface|enum)\\s+([\\w$]+)");
    private static final Pattern MEMBER = Pattern.compile(
            "^[ \\t]*((?:@[\\w.]++(?:\\([^)]*\\))?\\s*)*)" + MEMBER_MODIFIERS + "(\\*\\s*)?([#\\w$]+)\\s*[?!]?\\s*(?:<[^>{}]*>)?\\s*\\(");
    private static final Pattern PROPERTY = Pattern.compile(
            "^[ \\t]*((?:@[\\w.]++(?:\\([^)]*\\))?\\s*)*)" + MEMBER_MODIFIERS + "([#\\w$]+)\\s*[?!]?\\s*(?::[^=;]+)?=\\s*");

    private static final Pattern FUNCTION_VALUE = Pattern.compile(
            "\\G(async\\s+)?function\\b\\s*\\*?\\s*[\\w$]*\\s*(?:<[^>{}]*>)?\\s*\\(");
    private static final Pattern ARROW_PARAMS = Pattern.compile("\\G(async\\s+)?(?:<[^>{}]*>\\s*)?\\(");
    private static final Pattern ARROW_SINGLE = Pattern.compile("\\G(async\\s+)?([\\w$]+)\\s*=>");
    private static final Pattern ARROW = Pattern.compile("\\G\\s*(?::[^=;{]+?)?\\s*=>\\s*");
    private static final Pattern BODY_START = Pattern.compile("\\G\\s*(?::[^{;=]+)?\\{");

    private static final Pattern IMPORT_FROM = Pattern.compile(
            "(?m)^[ \\t]*import\\s+(?:type\\s+)?([^'\";]*?)\\s*from\\s*(['\"])");
    private static final Pattern IMPORT_SIDE_EFFECT = Pattern.compile("(?m)^[ \\t]*import\\s*(['\"])");
    private static final Pattern REQUIRE = Pattern.compile(
            "(?:const|let|var)\\s+([\\w$]+|\\{[^}]*\\})\\s*=\\s*require\\s*\\(\\s*(['\"])");
    private static final Pattern EXPORT_DECLARED = Pattern.compile(
            "(?m)^[ \\t]*export\\s+(default\\s+)?(?:declare\\s+)?(?:abstract\\s+)?(?:async\\s+)?(?:function\\s*\\*?|class|const|let|var)\\s+([\\w$]+)");
    private static final Pattern EXPORT_DEFAULT_NAME = Pattern.compile("(?m)^[ \\t]*export\\s+default\\s+([\\w$]+)\\s*;?\\s*$");
    private static final Pattern EXPORT_LIST = Pattern.compile("(?m)^[ \\t]*export\\s+(?:type\\s+)?\\{([^}]*)\\}");
    private static final Pattern MODULE_EXPORTS = Pattern.compile("\\bmodule\\.exports\\s*=\\s*");
    private static final Pattern NAMED_EXPORT = Pattern.compile("(?m)^[ \\t]*(?:module\\.)?exports\\.([\\w$]+)\\s*=");

    private static final Pattern OPTIONAL_CALL = Pattern.compile("([\\w$.]+)\\?\\.\\s*([\\w$]+)\\s*\\(");
    private static final Pattern JSX_ELEMENT = Pattern.compile("(?:^|[(\\s=?:>{&|,])<([A-Z][\\w$]*(?:\\.[\\w$]+)*)(?=[\\s/>])",
            Pattern.MULTILINE);
    private static final Pattern DECORATOR = Pattern.compile("^[ \\t]*@([\\w.]+)");
    private static final Pattern DECORATOR_NAME = Pattern.compile("@([\\w.]+)");

    private static final Set<String> KEYWORDS = Set.of("if", "for", "while", "switch", "catch", "return",
            "typeof", "function", "class", "new", "await", "yield", "super", "constructor", "delete", "void",
            "in", "of", "as", "export", "else", "do", "with", "instanceof", "throw", "case", "satisfies", "async");
    private static final Set<String> DYNAMIC_INVOKERS = Set.of("call", "apply", "bind");

    private final Language language;

    public TypeScriptRegexExtractionStrategy(Language language) {
        this.language = language;
    }

    @Override
    public Language language() {
        return language;
    }

    @Override
    protected SourceText prepare(String source) {
        return SourceText.script(source);
    }

    @Override
    protected List<DeclarationExtraction> declarations(SourceText text) {
        Set<String> exported = exportedNames(text);
        int[] depths = text.lineDepths();
        String clean = text.clean();
        List<DeclarationExtraction> declarations = new ArrayList<>();
        Matcher m = TYPE_DECLARATION.matcher(clean);
        while (m.find()) {
            int open = clean.indexOf('{', m.end());
            if (open < 0) {
                continue;
            }
            String kind = m.group(5);
            String name = m.group(6);
            int end = text.blockEnd(open);
            List<String> members = new ArrayList<>();
            for (Member member : members(text, depths, open, end)) {
                if (!members.contains(member.name())) {
                    members.add(member.name());
                }
            }
            declarations.add(new DeclarationExtraction(name, kind(kind), text.lineAt(m.start(6)), text.lineAt(end),
                    baseTypes(clean.substring(m.end(), open)), members,
                    m.group(1) != null || exported.contains(name)));
        }
        return declarations;
    }

    @Override
    protected List<Definition> definitions(SourceText text, List<DeclarationExtraction> declarations) {
        String clean = text.clean();
        Set<String> exported = exportedNames(text);
        List<Definition> definitions = new ArrayList<>();

        Matcher m = FUNCTION_DECLARATION.matcher(clean);
        while (m.find()) {
            int open = m.end() - 1;
            int close = text.closingParen(open);
            if (close < 0 || !BODY_START.matcher(clean).region(close + 1, clean.length()).lookingAt()) {
                continue;
            }
            String name = m.group(6);
            definitions.add(new Definition(FunctionExtraction.builder()
                    .name(name)
                    .startLine(text.lineAt(m.start(6)))
                    .endLine(text.lineAt(text.blockEnd(close)))
                    .parameters(parameters(clean.substring(open + 1, close)))
                    .returnType(returnType(clean, close))
                    .exported(m.group(1) != null || exported.contains(name))
                    .async(m.group(4) != null)
                    .build(), m.start(6)));
        }

        m = BINDING.matcher(clean);
        while (m.find()) {
            Shape shape = functionValue(text, m.end());
            if (shape == null) {
                continue;
            }
            boolean viaExports = m.group(3) != null;
            String name = viaExports ? m.group(3) : m.group(2);
            int nameOffset = viaExports ? m.start(3) : m.start(2);
            definitions.add(new Definition(FunctionExtraction.builder()
                    .name(name)
                    .startLine(text.lineAt(nameOffset))
                    .endLine(text.lineAt(shape.end()))
                    .parameters(shape.parameters())
                    .exported(viaExports || m.group(1) != null || exported.contains(name))
                    .async(shape.async())
                    .build(), nameOffset));
        }

        int[] depths = text.lineDepths();
        for (DeclarationExtraction declaration : declarations) {
            if (declaration.kind() != DeclarationKind.CLASS) {
                continue;
            }
            int open = clean.indexOf('{', text.lineStart(declaration.startLine()));
            int end = text.blockEnd(open);
            for (Member member : members(text, depths, open, end)) {
                if (member.shape() == null) {
                    continue;
                }
                boolean hidden = member.modifiers().contains("private") || member.name().startsWith("#");
                boolean constructor = member.name().equals("constructor");
                definitions.add(new Definition(FunctionExtraction.builder()
                        .name(member.name())
                        .className(declaration.name())
                        .startLine(text.lineAt(member.nameOffset()))
                        .endLine(text.lineAt(member.shape().end()))
                        .parameters(member.shape().parameters())
                        .returnType(member.shape().close() > 0 ? returnType(clean, member.shape().close()) : null)
                        .exported(declaration.exported() && !hidden && !constructor)
                        .constructor(constructor)
                        .async(member.shape().async() || member.modifiers().contains("async"))
                        .decorators(member.decorators())
                        .build(), member.nameOffset()));
            }
        }

        definitions.sort(Comparator.comparingInt(Definition::nameOffset));
        return qualify(definitions);
    }

    @Override
    protected List<ImportExtraction> imports(SourceText text) {
        String clean = text.clean();
        List<ImportExtraction> imports = new ArrayList<>();

        Matcher m = IMPORT_FROM.matcher(clean);
        while (m.find()) {
            String source = text.literalAt(m.start(2));
            imports.add(new ImportExtraction(source, importClause(m.group(1)), text.lineAt(m.start()), false));
        }

        m = IMPORT_SIDE_EFFECT.matcher(clean);
        while (m.find()) {
            imports.add(new ImportExtraction(text.literalAt(m.start(1)), List.of(), text.lineAt(m.start()), false));
        }

        m = REQUIRE.matcher(clean);
        while (m.find()) {
            String binding = m.group(1);
            List<ImportedName> names = new ArrayList<>();
            if (binding.startsWith("{")) {
                for (String part : SourceText.splitTopLevel(binding.substring(1, binding.length() - 1))) {
                    String[] alias = part.split("\\s*:\\s*");
                    names.add(alias.length == 2 ? ImportedName.aliased(alias[0].trim(), alias[1].trim())
                            : ImportedName.of(part.trim()));
                }
            } else {
                names.add(ImportedName.namespaceOf(binding));
            }
            imports.add(new ImportExtraction(text.literalAt(m.start(2)), names, text.lineAt(m.start()), false));
        }

        imports.sort(Comparator.comparingInt(ImportExtraction::line));
        return imports;
    }

    @Override
    protected List<ExportExtraction> exports(SourceText text) {
        String clean = text.clean();
        List<ExportExtraction> exports = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        Matcher m = EXPORT_DECLARED.matcher(clean);
        while (m.find()) {
            addExport(exports, seen, m.group(2), text.lineAt(m.start(2)), m.group(1) != null);
        }
        m = EXPORT_DEFAULT_NAME.matcher(clean);
        while (m.find()) {
            addExport(exports, seen, m.group(1), text.lineAt(m.start(1)), true);
        }
        m = EXPORT_LIST.matcher(clean);
        while (m.find()) {
            int line = text.lineAt(m.start());
            for (String part : SourceText.splitTopLevel(m.group(1))) {
                String[] alias = part.split("\\s+as\\s+");
                boolean isDefault = alias.length == 2 && alias[1].trim().equals("default");
                addExport(exports, seen, alias[0].trim(), line, isDefault);
            }
        }
        m = MODULE_EXPORTS.matcher(clean);
        while (m.find()) {
            int line = text.lineAt(m.start());
            if (m.end() < clean.length() && clean.charAt(m.end()) == '{') {
                int close = text.blockEnd(m.end());
                for (String part : SourceText.splitTopLevel(clean.substring(m.end() + 1, close))) {
                    String key = part.split("[:(]")[0].trim();
                    if (key.matches("[\\w$]+")) {
                        addExport(exports, seen, key, line, false);
                    }
                }
            } else {
                Matcher name = Pattern.compile("\\G([\\w$]+)\\s*;?").matcher(clean).region(m.end(), clean.length());
                if (name.lookingAt() && !name.group(1).equals("function") && !name.group(1).equals("class")) {
                    addExport(exports, seen, name.group(1), line, true);
                }
            }
        }
        m = NAMED_EXPORT.matcher(clean);
        while (m.find()) {
            addExport(exports, seen, m.group(1), text.lineAt(m.start(1)), false);
        }

        exports.sort(Comparator.comparingInt(ExportExtraction::line));
        return exports;
    }

    @Override
    protected Set<String> keywords() {
        return KEYWORDS;
    }

    @Override
    protected UnresolvedReason hint(String calleeName, String receiver, boolean constructorCall) {
        if (constructorCall) {
            return calleeName.equals("Function") ? UnresolvedReason.EVAL : null;
        }
        if (receiver == null) {
            return switch (calleeName) {
                case "eval" -> UnresolvedReason.EVAL;
                case "import" -> UnresolvedReason.PLUGIN_SYSTEM;
                default -> null;
            };
        }
        if (receiver.equals("Reflect")) {
            return UnresolvedReason.REFLECTION;
        }
        if (DYNAMIC_INVOKERS.contains(calleeName)) {
            return UnresolvedReason.DYNAMIC_DISPATCH;
        }
        return null;
    }

    /**
     * Member signatures without a body are claimed so they are not read as calls, then optional
     * chaining calls and, in JSX files, component elements are added.
     */
    @Override
    protected void extraCalls(SourceText text, String file, Set<Integer> claimed, List<CallExtraction> calls) {
        String clean = text.clean();
        int[] depths = text.lineDepths();
        Matcher type = TYPE_DECLARATION.matcher(clean);
        while (type.find()) {
            int open = clean.indexOf('{', type.end());
            if (open >= 0) {
                members(text, depths, open, text.blockEnd(open)).forEach(member -> claimed.add(member.nameOffset()));
            }
        }

        Matcher m = OPTIONAL_CALL.matcher(clean);
        while (m.find()) {
            if (!claimed.add(m.start(2))) {
                continue;
            }
            String name = m.group(2);
            calls.add(call(text, m.start(2), m.end() - 1, name, m.group(1))
                    .fullExpression(m.group(1) + "?." + name)
                    .dynamicHint(hint(name, m.group(1), false))
                    .build());
        }

        String lower = file.toLowerCase();
        if (!lower.endsWith(".tsx") && !lower.endsWith(".jsx")) {
            return;
        }
        m = JSX_ELEMENT.matcher(clean);
        while (m.find()) {
            if (!claimed.add(m.start(1))) {
                continue;
            }
            String element = m.group(1);
            int dot = element.lastIndexOf('.');
            calls.add(CallExtraction.builder()
                    .calleeName(element.substring(dot + 1))
                    .receiver(dot > 0 ? element.substring(0, dot) : null)
                    .fullExpression("<" + element + ">")
                    .line(text.lineAt(m.start(1)))
                    .column(text.columnAt(m.start(1)))
                    .argumentCount(1)
                    .build());
        }
    }

    private List<Member> members(SourceText text, int[] depths, int open, int end) {
        String clean = text.clean();
        int bodyDepth = depthAt(clean, open) + 1;
        int firstLine = text.lineAt(open) + 1;
        int lastLine = text.lineAt(end);
        List<Member> members = new ArrayList<>();
        for (int line = firstLine; line <= lastLine; line++) {
            if (depths[line] != bodyDepth) {
                continue;
            }
            String content = text.cleanLine(line);
            int lineStart = text.lineStart(line);
            Matcher m = MEMBER.matcher(content);
            if (m.lookingAt() && (m.group(4).equals("constructor") || !KEYWORDS.contains(m.group(4)))) {
                int nameOffset = lineStart + m.start(4);
                int parenOpen = lineStart + m.end() - 1;
                int close = text.closingParen(parenOpen);
                Shape shape = null;
                if (close > 0 && BODY_START.matcher(clean).region(close + 1, clean.length()).lookingAt()) {
                    shape = new Shape(parameters(clean.substring(parenOpen + 1, close)), close,
                            text.blockEnd(close), false);
                }
                members.add(new Member(m.group(4), nameOffset, m.group(2), decorators(text, line, m.group(1)), shape));
                continue;
            }
            Matcher p = PROPERTY.matcher(content);
            if (p.lookingAt()) {
                Shape shape = functionValue(text, lineStart + p.end());
                if (shape != null) {
                    members.add(new Member(p.group(3), lineStart + p.start(3), p.group(2),
                            decorators(text, line, p.group(1)), shape));
                }
            }
        }
        return members;
    }

    /**
     * Arrow function or function expression starting at {@code from}, or null when the value is
     * something else.
     */
    private Shape functionValue(SourceText text, int from) {
        String clean = text.clean();
        Matcher m = FUNCTION_VALUE.matcher(clean).region(from, clean.length());
        if (m.lookingAt()) {
            int open = m.end() - 1;
            int close = text.closingParen(open);
            if (close < 0) {
                return null;
            }
            return new Shape(parameters(clean.substring(open + 1, close)), close, text.blockEnd(close),
                    m.group(1) != null);
        }
        m = ARROW_PARAMS.matcher(clean).region(from, clean.length());
        if (m.lookingAt()) {
            int open = m.end() - 1;
            int close = text.closingParen(open);
            if (close < 0) {
                return null;
            }
            Matcher arrow = ARROW.matcher(clean).region(close + 1, clean.length());
            if (!arrow.lookingAt()) {
                return null;
            }
            return new Shape(parameters(clean.substring(open + 1, close)), close, arrowEnd(text, arrow.end()),
                    m.group(1) != null);
        }
        m = ARROW_SINGLE.matcher(clean).region(from, clean.length());
        if (m.lookingAt()) {
            int body = m.end();
            while (body < clean.length() && Character.isWhitespace(clean.charAt(body))) {
                body++;
            }
            return new Shape(List.of(Parameter.of(m.group(2), null)), -1, arrowEnd(text, body), m.group(1) != null);
        }
        return null;
    }

    private static int arrowEnd(SourceText text, int body) {
        String clean = text.clean();
        if (body < clean.length() && clean.charAt(body) == '{') {
            return text.blockEnd(body);
        }
        int depth = 0;
        for (int i = body; i < clean.length(); i++) {
            char c = clean.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    return Math.max(body, i - 1);
                }
                depth--;
            } else if ((c == ';' || c == ',' || c == '\n') && depth == 0) {
                return i;
            }
        }
        return clean.length();
    }

    /**
     * Fill in qualified names: class members as {@code Class.member}, nested functions under their
     * innermost enclosing function.
     */
    private static List<Definition> qualify(List<Definition> definitions) {
        List<Definition> qualified = new ArrayList<>();
        for (Definition definition : definitions) {
            FunctionExtraction function = definition.function();
            String qualifiedName;
            if (function.className() != null) {
                qualifiedName = function.className() + "." + function.name();
            } else {
                FunctionExtraction outer = null;
                for (Definition candidate : qualified) {
                    FunctionExtraction f = candidate.function();
                    if (f != function && f.startLine() <= function.startLine() && function.endLine() <= f.endLine()
                            && candidate.nameOffset() < definition.nameOffset()) {
                        outer = f;
                    }
                }
                qualifiedName = outer != null ? outer.qualifiedName() + "." + function.name() : function.name();
            }
            qualified.add(new Definition(FunctionExtraction.builder()
                    .name(function.name())
                    .qualifiedName(qualifiedName)
                    .className(function.className())
                    .startLine(function.startLine())
                    .endLine(function.endLine())
                    .parameters(function.parameters())
                    .returnType(function.returnType())
                    .exported(function.exported())
                    .constructor(function.constructor())
                    .async(function.async())
                    .decorators(function.decorators())
                    .build(), definition.nameOffset()));
        }
        return qualified;
    }

    private Set<String> exportedNames(SourceText text) {
        Set<String> names = new HashSet<>();
        exports(text).forEach(e -> names.add(e.name()));
        return names;
    }

    private static void addExport(List<ExportExtraction> exports, Set<String> seen, String name, int line,
                                  boolean isDefault) {
        if (!name.isEmpty() && seen.add(name)) {
            exports.add(new ExportExtraction(name, line, isDefault));
        }
    }

    /**
     * Default, named and namespace bindings of an {@code import ... from} clause. A default import
     * is bound under its local name, which is assumed to match the exported function's name.
     */
    private static List<ImportedName> importClause(String clause) {
        List<ImportedName> names = new ArrayList<>();
        String rest = clause.trim();
        int brace = rest.indexOf('{');
        if (brace >= 0) {
            int close = rest.indexOf('}', brace);
            String named = rest.substring(brace + 1, close < 0 ? rest.length() : close);
            for (String part : named.split(",")) {
                String item = part.trim().replaceFirst("^type\\s+", "");
                if (item.isEmpty()) {
                    continue;
                }
                String[] alias = item.split("\\s+as\\s+");
                names.add(alias.length == 2 ? ImportedName.aliased(alias[0].trim(), alias[1].trim())
                        : ImportedName.of(item));
            }
            rest = rest.substring(0, brace) + (close < 0 ? "" : rest.substring(close + 1));
        }
        for (String part : rest.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            Matcher namespace = Pattern.compile("^\\*\\s*as\\s+([\\w$]+)$").matcher(item);
            if (namespace.find()) {
                names.add(ImportedName.namespaceOf(namespace.group(1)));
            } else if (item.matches("[\\w$]+")) {
                names.add(0, ImportedName.of(item));
            }
        }
        return names;
    }

    private static List<Parameter> parameters(String list) {
        List<Parameter> parameters = new ArrayList<>();
        for (String part : SourceText.splitTopLevel(list.replace('\n', ' '))) {
            String item = part.replaceAll("@[\\w.]+(\\([^)]*\\))?", "")
                    .replaceAll("^\\s*((public|private|protected|readonly|override)\\s+)+", "")
                    .trim();
            if (item.isEmpty() || item.startsWith("this:") || item.startsWith("this :")) {
                continue;
            }
            boolean rest = item.startsWith("...");
            if (rest) {
                item = item.substring(3);
            }
            int equals = topLevelIndex(item, '=');
            boolean hasDefault = equals >= 0;
            String declaration = hasDefault ? item.substring(0, equals).trim() : item;
            int colon = topLevelIndex(declaration, ':');
            String name = colon >= 0 ? declaration.substring(0, colon).trim() : declaration;
            String type = colon >= 0 ? declaration.substring(colon + 1).trim() : null;
            boolean optional = name.endsWith("?");
            if (optional) {
                name = name.substring(0, name.length() - 1);
            }
            parameters.add(new Parameter(name, type, hasDefault || optional, rest));
        }
        return parameters;
    }

    private static int topLevelIndex(String text, char wanted) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}' || c == '>') {
                depth = Math.max(0, depth - 1);
            } else if (c == wanted && depth == 0 && !(c == '=' && i + 1 < text.length() && text.charAt(i + 1) == '>')) {
                return i;
            }
        }
        return -1;
    }

    private static String returnType(String clean, int close) {
        int i = close + 1;
        while (i < clean.length() && Character.isWhitespace(clean.charAt(i))) {
            i++;
        }
        if (i >= clean.length() || clean.charAt(i) != ':') {
            return null;
        }
        int brace = clean.indexOf('{', i);
        String type = clean.substring(i + 1, brace < 0 ? clean.length() : brace).trim();
        return type.isEmpty() ? null : type;
    }

    private static List<String> baseTypes(String header) {
        List<String> bases = new ArrayList<>();
        Matcher m = Pattern.compile("\\b(extends|implements)\\s+(.+?)(?=\\b(?:extends|implements)\\b|$)",
                Pattern.DOTALL).matcher(header);
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

    private static List<String> decorators(SourceText text, int line, String inline) {
        List<String> decorators = new ArrayList<>();
        for (int previous = line - 1; previous >= 1; previous--) {
            Matcher m = DECORATOR.matcher(text.cleanLine(previous));
            if (!m.find()) {
                break;
            }
            decorators.add(0, simpleName(m.group(1)));
        }
        Matcher m = DECORATOR_NAME.matcher(inline);
        while (m.find()) {
            decorators.add(simpleName(m.group(1)));
        }
        return decorators;
    }

    private static String simpleName(String name) {
        return name.substring(name.lastIndexOf('.') + 1);
    }

    private static int depthAt(String clean, int offset) {
        int depth = 0;
        for (int i = 0; i < offset; i++) {
            char c = clean.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            }
        }
        return depth;
    }

    private static DeclarationKind kind(String keyword) {
        return switch (keyword) {
            case "interface" -> DeclarationKind.INTERFACE;
            case "enum" -> DeclarationKind.ENUM;
            default -> DeclarationKind.CLASS;
        };
    }

    private record Shape(List<Parameter> parameters, int close, int end, boolean async) {}

    private record Member(String name, int nameOffset, String modifiers, List<String> decorators, Shape shape) {}
}
