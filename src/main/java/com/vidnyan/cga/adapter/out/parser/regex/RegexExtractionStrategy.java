package com.vidnyan.cga.adapter.out.parser.regex;

import com.vidnyan.cga.application.port.out.ExtractionStrategy;
import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationExtraction;
import com.vidnyan.cga.domain.extraction.ExportExtraction;
import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.extraction.ExtractionQuality;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based extraction shared by every language without (or as fallback to) a structural parser.
 * Subclasses find definitions, imports and exports; call sites are found here with a fixed
 * sequence of patterns, each call name offset claimed by the first pattern that matches it.
 */
@Slf4j
public abstract class RegexExtractionStrategy implements ExtractionStrategy {

    private static final Pattern CONSTRUCTOR_CALL = Pattern.compile("\\bnew\\s+([\\w$.]+)\\s*(?:<[^<>()]*>)?\\s*\\(");
    private static final Pattern SUPER_CALL = Pattern.compile("\\bsuper\\s*\\(\\s*\\)\\s*\\.\\s*([\\w$]+)\\s*\\(");
    private static final Pattern COMPUTED_CALL = Pattern.compile("([\\w$.]+)\\s*\\[([^\\[\\]\\n]*)\\]\\s*\\(");
    private static final Pattern RECEIVER_CALL = Pattern.compile(
            "(?<![\\w$.@#])((?:[A-Za-z_$][\\w$]*\\s*\\.\\s*)*[A-Za-z_$][\\w$]*)\\s*\\.\\s*([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern CHAINED_CALL = Pattern.compile("[)\\]]\\s*\\.\\s*([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern BARE_CALL = Pattern.compile("(?<![\\w$.@#])([A-Za-z_$][\\w$]*)\\s*\\(");

    private static final Pattern DECLARING_WORD = Pattern.compile(
            "\\b(?:class|def|function|interface|record|enum)\\s*\\*?\\s*$");
    private static final Pattern CLASS_LIKE = Pattern.compile("[A-Z][\\w$]*");

    static final String CHAINED_RECEIVER = "(...)";

    /**
     * A function definition and the offset of its name, so the name is not read back as a call.
     */
    protected record Definition(FunctionExtraction function, int nameOffset) {}

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.REGEX;
    }

    @Override
    public final FileExtraction extract(String source, String file) {
        long start = System.nanoTime();
        SourceText text = prepare(source);

        List<DeclarationExtraction> declarations = declarations(text);
        List<Definition> definitions = definitions(text, declarations);
        List<ImportExtraction> imports = imports(text);
        List<ExportExtraction> exports = exports(text);
        List<CallExtraction> calls = calls(text, file, definitions);

        List<FunctionExtraction> functions = definitions.stream().map(Definition::function).toList();
        int items = functions.size() + calls.size() + imports.size() + exports.size() + declarations.size();
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        ExtractionQuality quality = new ExtractionQuality(ExtractionMethod.REGEX,
                ExtractionQuality.REGEX_CONFIDENCE, coverage(text, functions, declarations, imports, exports),
                items, 0, List.of(), false, elapsed);
        log.debug("{}: {} functions, {} calls (regex)", file, functions.size(), calls.size());

        return new FileExtraction(file, language(), functions, calls, imports, exports, declarations,
                List.of(), List.of(), quality);
    }

    protected abstract SourceText prepare(String source);

    protected abstract List<DeclarationExtraction> declarations(SourceText text);

    protected abstract List<Definition> definitions(SourceText text, List<DeclarationExtraction> declarations);

    protected abstract List<ImportExtraction> imports(SourceText text);

    protected abstract List<ExportExtraction> exports(SourceText text);

    /**
     * Words that look like calls but are statements or declarations.
     */
    protected abstract Set<String> keywords();

    /**
     * Dynamic-shape hint for a call, or null. Computed-name calls are tagged before this is asked.
     */
    protected UnresolvedReason hint(String calleeName, String receiver, boolean constructorCall) {
        return null;
    }

    /**
     * Extra language-specific call sites, added after the shared patterns.
     */
    protected void extraCalls(SourceText text, String file, Set<Integer> claimed, List<CallExtraction> calls) {
    }

    private List<CallExtraction> calls(SourceText text, String file, List<Definition> definitions) {
        String clean = text.clean();
        Set<Integer> claimed = new HashSet<>();
        definitions.forEach(d -> claimed.add(d.nameOffset()));
        List<CallExtraction> calls = new ArrayList<>();

        Matcher m = CONSTRUCTOR_CALL.matcher(clean);
        while (m.find()) {
            if (!claimed.add(m.start(1))) {
                continue;
            }
            String type = m.group(1);
            String simple = type.substring(type.lastIndexOf('.') + 1);
            calls.add(call(text, m.start(1), m.end() - 1, simple, null)
                    .constructorCall(true)
                    .fullExpression("new " + type)
                    .dynamicHint(hint(simple, null, true))
                    .build());
            // the type name may also match the bare pattern at its last segment
            claimed.add(m.start(1) + type.length() - simple.length());
        }

        m = SUPER_CALL.matcher(clean);
        while (m.find()) {
            if (claimed.add(m.start(1))) {
                calls.add(call(text, m.start(1), m.end() - 1, m.group(1), "super()").build());
            }
        }

        m = COMPUTED_CALL.matcher(clean);
        while (m.find()) {
            if (keywords().contains(m.group(1)) || !claimed.add(m.end(1))) {
                continue;
            }
            String key = m.group(2).trim();
            calls.add(call(text, m.end(1), m.end() - 1, "[" + key + "]", m.group(1))
                    .fullExpression(m.group(1) + "[" + key + "]")
                    .dynamicHint(UnresolvedReason.COMPUTED_NAME)
                    .build());
        }

        m = RECEIVER_CALL.matcher(clean);
        while (m.find()) {
            if (!claimed.add(m.start(2))) {
                continue;
            }
            String receiver = m.group(1).replaceAll("\\s+", "");
            String name = m.group(2);
            calls.add(call(text, m.start(2), m.end() - 1, name, receiver)
                    .receiverType(CLASS_LIKE.matcher(receiver).matches() ? receiver : null)
                    .dynamicHint(hint(name, receiver, false))
                    .build());
        }

        m = CHAINED_CALL.matcher(clean);
        while (m.find()) {
            if (claimed.add(m.start(1))) {
                String name = m.group(1);
                calls.add(call(text, m.start(1), m.end() - 1, name, CHAINED_RECEIVER)
                        .dynamicHint(hint(name, CHAINED_RECEIVER, false))
                        .build());
            }
        }

        extraCalls(text, file, claimed, calls);

        m = BARE_CALL.matcher(clean);
        while (m.find()) {
            String name = m.group(1);
            if (keywords().contains(name) || declaredAt(clean, m.start(1)) || !claimed.add(m.start(1))) {
                continue;
            }
            calls.add(call(text, m.start(1), m.end() - 1, name, null)
                    .dynamicHint(hint(name, null, false))
                    .build());
        }

        calls.sort((a, b) -> a.line() != b.line() ? Integer.compare(a.line(), b.line())
                : Integer.compare(a.column(), b.column()));
        return calls;
    }

    /**
     * Builder pre-filled with position and argument count of a call whose
     * opening parenthesis is at {@code openParen}.
     */
    protected static CallExtraction.Builder call(SourceText text, int nameOffset, int openParen, String name,
                                                 String receiver) {
        return CallExtraction.builder()
                .calleeName(name)
                .receiver(receiver)
                .line(text.lineAt(nameOffset))
                .column(text.columnAt(nameOffset))
                .argumentCount(text.argumentCount(openParen));
    }

    private static boolean declaredAt(String clean, int nameOffset) {
        int from = Math.max(0, nameOffset - 24);
        return DECLARING_WORD.matcher(clean.substring(from, nameOffset)).find();
    }

    private static double coverage(SourceText text, List<FunctionExtraction> functions,
                                   List<DeclarationExtraction> declarations, List<ImportExtraction> imports,
                                   List<ExportExtraction> exports) {
        if (functions.isEmpty() && declarations.isEmpty()) {
            return imports.isEmpty() && exports.isEmpty() ? 25.0 : 50.0;
        }
        BitSet covered = new BitSet();
        functions.forEach(f -> covered.set(f.startLine(), f.endLine() + 1));
        declarations.forEach(d -> covered.set(d.startLine(), d.endLine() + 1));
        return Math.min(100.0, covered.cardinality() * 100.0 / Math.max(1, text.lineCount()) + 20.0);
    }
}
