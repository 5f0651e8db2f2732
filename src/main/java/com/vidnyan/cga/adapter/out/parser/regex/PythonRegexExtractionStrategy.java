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
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python extraction. Blocks are delimited by indentation; methods are {@code def}s directly
 * inside a class body, {@code __init__} is the constructor, and {@code self}/{@code cls}
 * are not reported as parameters.
 */
@Component
public class PythonRegexExtractionStrategy extends RegexExtractionStrategy {

    private static final Pattern DEF = Pattern.compile("(?m)^([ \\t]*)(async[ \\t]+)?def[ \\t]+(\\w+)[ \\t]*\\(");
    private static final Pattern CLASS = Pattern.compile("(?m)^([ \\t]*)class[ \\t]+(\\w+)[ \\t]*(\\()?");
    private static final Pattern FROM_IMPORT = Pattern.compile("(?m)^[ \\t]*from[ \\t]+([\\w.]+)[ \\t]+import[ \\t]+");
    private static final Pattern IMPORT = Pattern.compile("(?m)^[ \\t]*import[ \\t]+([^\\n]+)");
    private static final Pattern ALL = Pattern.compile("(?m)^__all__\\s*=\\s*[\\[(]([^\\])]*)[\\])]");
    private static final Pattern GETATTR_CALL = Pattern.compile("\\bgetattr\\s*(\\()");
    private static final Pattern DECORATOR = Pattern.compile("^[ \\t]*@([\\w.]+)");

    private static final Set<String> KEYWORDS = Set.of("if", "elif", "while", "for", "with", "return", "not",
            "and", "or", "in", "is", "lambda", "assert", "del", "yield", "except", "raise", "def", "class",
            "await", "print", "import", "from", "else", "try", "finally", "pass", "async", "global", "nonlocal");
    private static final Set<String> EVAL_CALLS = Set.of("eval", "exec", "compile");
    private static final Set<String> PLUGIN_CALLS = Set.of("import_module", "__import__", "load_entry_point",
            "iter_entry_points");

    @Override
    public Language language() {
        return Language.PYTHON;
    }

    @Override
    protected SourceText prepare(String source) {
        return SourceText.python(source);
    }

    @Override
    protected List<DeclarationExtraction> declarations(SourceText text) {
        List<DeclarationExtraction> declarations = new ArrayList<>();
        String clean = text.clean();
        Matcher m = CLASS.matcher(clean);
        while (m.find()) {
            int indent = m.group(1).length();
            List<String> bases = new ArrayList<>();
            int headerEnd = m.end();
            if (m.group(3) != null) {
                int close = text.closingParen(m.end() - 1);
                if (close > 0) {
                    for (String base : SourceText.splitTopLevel(clean.substring(m.end(), close))) {
                        if (!base.contains("=") && !base.isBlank()) {
                            bases.add(base.substring(base.lastIndexOf('.') + 1).trim());
                        }
                    }
                    headerEnd = close;
                }
            }
            int headerLine = text.lineAt(headerEnd);
            int endLine = text.indentedBlockEnd(headerLine, indent);
            String name = m.group(2);
            declarations.add(new DeclarationExtraction(name, DeclarationKind.CLASS, text.lineAt(m.start(2)), endLine,
                    bases, memberNames(text, headerLine, endLine, indent), indent == 0 && !name.startsWith("_")));
        }
        return declarations;
    }

    @Override
    protected List<Definition> definitions(SourceText text, List<DeclarationExtraction> declarations) {
        String clean = text.clean();
        List<Block> blocks = new ArrayList<>();
        declarations.forEach(d -> blocks.add(new Block(d.name(), d.name(), d.startLine(), d.endLine(),
                indentOfLine(text, d.startLine()), true, d.exported())));

        Set<String> publicNames = exportedNames(text);
        List<Definition> definitions = new ArrayList<>();
        Matcher m = DEF.matcher(clean);
        while (m.find()) {
            int indent = m.group(1).length();
            String name = m.group(3);
            int open = m.end() - 1;
            int close = text.closingParen(open);
            if (close < 0) {
                continue;
            }
            int colon = clean.indexOf(':', close);
            int headerLine = text.lineAt(colon < 0 ? close : colon);
            int startLine = text.lineAt(m.start(3));
            int endLine = text.indentedBlockEnd(headerLine, indent);

            Block owner = enclosing(blocks, startLine, indent);
            boolean member = owner != null && owner.type();
            String returnType = null;
            if (colon > close) {
                String between = clean.substring(close + 1, colon).trim();
                if (between.startsWith("->")) {
                    returnType = between.substring(2).trim();
                }
            }
            boolean exported = member
                    ? owner.exported() && !name.startsWith("_")
                    : indent == 0 && (publicNames.isEmpty() ? !name.startsWith("_") : publicNames.contains(name));
            String qualifiedName = owner != null ? owner.qualifiedName() + "." + name : name;

            FunctionExtraction function = FunctionExtraction.builder()
                    .name(name)
                    .qualifiedName(qualifiedName)
                    .className(member ? owner.name() : null)
                    .startLine(startLine)
                    .endLine(endLine)
                    .parameters(parameters(clean.substring(open + 1, close), member))
                    .returnType(returnType)
                    .exported(exported)
                    .constructor(member && name.equals("__init__"))
                    .async(m.group(2) != null)
                    .decorators(decorators(text, startLine))
                    .build();
            definitions.add(new Definition(function, m.start(3)));
            blocks.add(new Block(name, qualifiedName, startLine, endLine, indent, false, exported));
        }
        return definitions;
    }

    @Override
    protected List<ImportExtraction> imports(SourceText text) {
        List<ImportExtraction> imports = new ArrayList<>();
        String clean = text.clean();
        Matcher m = FROM_IMPORT.matcher(clean);
        while (m.find()) {
            String names;
            if (m.end() < clean.length() && clean.charAt(m.end()) == '(') {
                int close = text.closingParen(m.end());
                names = clean.substring(m.end() + 1, close < 0 ? clean.length() : close);
            } else {
                int lineEnd = clean.indexOf('\n', m.end());
                names = clean.substring(m.end(), lineEnd < 0 ? clean.length() : lineEnd);
            }
            List<ImportedName> bound = new ArrayList<>();
            for (String part : names.replace("\\", " ").split(",")) {
                String item = part.trim();
                if (item.isEmpty()) {
                    continue;
                }
                if (item.equals("*")) {
                    bound.add(ImportedName.namespaceOf("*"));
                    continue;
                }
                String[] alias = item.split("\\s+as\\s+");
                bound.add(alias.length == 2 ? ImportedName.aliased(alias[0].trim(), alias[1].trim())
                        : ImportedName.of(item));
            }
            imports.add(new ImportExtraction(m.group(1), bound, text.lineAt(m.start(1)), false));
        }

        m = IMPORT.matcher(clean);
        while (m.find()) {
            for (String part : m.group(1).split(",")) {
                String item = part.trim();
                if (item.isEmpty()) {
                    continue;
                }
                String[] alias = item.split("\\s+as\\s+");
                String module = alias[0].trim();
                String local = alias.length == 2 ? alias[1].trim() : module;
                imports.add(new ImportExtraction(module, List.of(ImportedName.namespaceOf(local)),
                        text.lineAt(m.start(1)), false));
            }
        }
        imports.sort((a, b) -> Integer.compare(a.line(), b.line()));
        return imports;
    }

    @Override
    protected List<ExportExtraction> exports(SourceText text) {
        Matcher m = ALL.matcher(text.original());
        if (!m.find()) {
            return List.of();
        }
        int line = text.lineAt(m.start());
        List<ExportExtraction> exports = new ArrayList<>();
        for (String name : names(m.group(1))) {
            exports.add(new ExportExtraction(name, line, false));
        }
        return exports;
    }

    @Override
    protected Set<String> keywords() {
        return KEYWORDS;
    }

    @Override
    protected UnresolvedReason hint(String calleeName, String receiver, boolean constructorCall) {
        if (EVAL_CALLS.contains(calleeName) && receiver == null) {
            return UnresolvedReason.EVAL;
        }
        if (PLUGIN_CALLS.contains(calleeName)) {
            return UnresolvedReason.PLUGIN_SYSTEM;
        }
        return null;
    }

    /**
     * {@code getattr(obj, name)(...)} invokes whatever the lookup returns.
     */
    @Override
    protected void extraCalls(SourceText text, String file, Set<Integer> claimed, List<CallExtraction> calls) {
        String clean = text.clean();
        Matcher m = GETATTR_CALL.matcher(clean);
        while (m.find()) {
            int close = text.closingParen(m.start(1));
            if (close < 0) {
                continue;
            }
            int next = close + 1;
            while (next < clean.length() && (clean.charAt(next) == ' ' || clean.charAt(next) == '\t')) {
                next++;
            }
            if (next < clean.length() && clean.charAt(next) == '(' && claimed.add(next)) {
                List<String> args = SourceText.splitTopLevel(text.original().substring(m.start(1) + 1, close));
                String target = args.size() > 1 ? args.get(1).replaceAll("['\"]", "") : "getattr";
                calls.add(call(text, m.start(), next, target, args.isEmpty() ? null : args.get(0))
                        .fullExpression(text.original().substring(m.start(), close + 1))
                        .dynamicHint(UnresolvedReason.REFLECTION)
                        .build());
            }
        }
    }

    private static List<String> memberNames(SourceText text, int headerLine, int endLine, int classIndent) {
        List<String> names = new ArrayList<>();
        Integer bodyIndent = null;
        for (int line = headerLine + 1; line <= endLine; line++) {
            String content = text.cleanLine(line);
            if (content.isBlank()) {
                continue;
            }
            int indent = SourceText.indentOf(content);
            if (bodyIndent == null && indent > classIndent) {
                bodyIndent = indent;
            }
            Matcher m = DEF.matcher(content);
            if (bodyIndent != null && indent == bodyIndent && m.find()) {
                names.add(m.group(3));
            }
        }
        return names;
    }

    private static List<Parameter> parameters(String list, boolean member) {
        List<Parameter> parameters = new ArrayList<>();
        List<String> parts = SourceText.splitTopLevel(list.replace('\n', ' '));
        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i).trim();
            if (part.isEmpty() || part.equals("*") || part.equals("/")) {
                continue;
            }
            boolean rest = part.startsWith("*");
            String withoutStars = part.replaceFirst("^\\*{1,2}", "");
            boolean hasDefault = withoutStars.contains("=");
            String declaration = hasDefault ? withoutStars.substring(0, withoutStars.indexOf('=')) : withoutStars;
            String name = declaration;
            String type = null;
            int colon = declaration.indexOf(':');
            if (colon > 0) {
                name = declaration.substring(0, colon);
                type = declaration.substring(colon + 1).trim();
            }
            name = name.trim();
            if (i == 0 && member && (name.equals("self") || name.equals("cls"))) {
                continue;
            }
            parameters.add(new Parameter(name, type, hasDefault, rest));
        }
        return parameters;
    }

    private static List<String> decorators(SourceText text, int defLine) {
        List<String> decorators = new ArrayList<>();
        for (int line = defLine - 1; line >= 1; line--) {
            String content = text.cleanLine(line);
            if (content.isBlank()) {
                continue;
            }
            Matcher m = DECORATOR.matcher(content);
            if (!m.find()) {
                break;
            }
            String name = m.group(1);
            decorators.add(0, name.substring(name.lastIndexOf('.') + 1));
        }
        return decorators;
    }

    private static Set<String> exportedNames(SourceText text) {
        Matcher m = ALL.matcher(text.original());
        return m.find() ? Set.copyOf(names(m.group(1))) : Set.of();
    }

    private static List<String> names(String list) {
        List<String> names = new ArrayList<>();
        for (String part : list.split(",")) {
            String name = part.trim().replaceAll("['\"]", "");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private static int indentOfLine(SourceText text, int line) {
        return SourceText.indentOf(text.cleanLine(line));
    }

    private static Block enclosing(List<Block> blocks, int line, int indent) {
        Block found = null;
        for (Block block : blocks) {
            if (block.startLine() < line && line <= block.endLine() && block.indent() < indent
                    && (found == null || block.indent() > found.indent())) {
                found = block;
            }
        }
        return found;
    }

    private record Block(String name, String qualifiedName, int startLine, int endLine, int indent, boolean type,
                         boolean exported) {}
}
