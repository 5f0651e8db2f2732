package com.vidnyan.cga.application.service;

import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction;
import com.vidnyan.cga.domain.model.CallGraph;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.EntryPointKind;
import com.vidnyan.cga.domain.model.FunctionRecord;
import com.vidnyan.cga.domain.model.GraphStats;
import com.vidnyan.cga.domain.model.Language;
import com.vidnyan.cga.domain.model.Parameter;
import com.vidnyan.cga.domain.model.ResolutionReason;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Matches call references to target functions using fixed confidence tiers:
 * same scope, then imports, then class scope, then a global simple-name match.
 * Dynamic call shapes are never guessed at.
 * <p>
 * The symbol index is only read here, so references are resolved in parallel;
 * back-references are merged once after every reference is done.
 */
@Slf4j
@Component
public class CallResolver {

    static final double SAME_SCOPE = 0.95;
    static final double IMPORTED = 0.9;
    static final double DECLARED_TYPE = 0.85;
    static final double INFERRED = 0.8;
    static final double OVERLOAD_TIE = 0.75;
    static final double GLOBAL_UNIQUE = 0.7;

    private static final Set<String> SELF_RECEIVERS = Set.of("this", "self", "cls");
    private static final Set<String> SUPER_RECEIVERS = Set.of("super", "super()");
    private static final int MAX_INHERITANCE_DEPTH = 10;

    public CallGraph resolve(AssembledGraph assembled, Instant generatedAt) {
        SymbolIndex index = assembled.index();
        List<PendingCall> pending = assembled.pendingCalls();

        List<CallReference> results = pending.parallelStream()
                .map(p -> resolveOne(p, index))
                .toList();

        Map<String, CallReference[]> outgoing = new HashMap<>();
        Map<String, List<CallReference>> incoming = new HashMap<>();
        for (int i = 0; i < pending.size(); i++) {
            PendingCall call = pending.get(i);
            CallReference result = results.get(i);
            outgoing.computeIfAbsent(call.caller().id(), k -> new CallReference[call.caller().calls().size()])
                    [call.index()] = result;
            if (result.resolved()) {
                incoming.computeIfAbsent(result.calleeId(), k -> new ArrayList<>()).add(result);
            } else {
                log.trace("Unresolved call {} at {}:{} ({})", result.calleeName(), result.file(), result.line(),
                        result.unresolvedReason() != null ? result.unresolvedReason().tag() : "ambiguous");
            }
        }

        Comparator<CallReference> incomingOrder = Comparator.comparing(CallReference::callerId)
                .thenComparingInt(CallReference::line)
                .thenComparingInt(CallReference::column);

        SortedMap<String, FunctionRecord> functions = new TreeMap<>();
        for (FunctionRecord function : assembled.functions().values()) {
            CallReference[] calls = outgoing.get(function.id());
            List<CallReference> calledBy = incoming.getOrDefault(function.id(), List.of()).stream()
                    .sorted(incomingOrder)
                    .toList();
            FunctionRecord resolved = function
                    .withCalls(calls != null ? List.of(calls) : function.calls())
                    .withCalledBy(calledBy);
            if (resolved.entryPointKind() == null && resolved.exported() && onlySelfCalls(resolved)) {
                resolved = resolved.withEntryPointKind(EntryPointKind.EXPORTED);
            }
            functions.put(resolved.id(), resolved);
        }

        List<String> entryPoints = functions.values().stream()
                .filter(FunctionRecord::entryPoint)
                .map(FunctionRecord::id)
                .toList();
        List<String> dataAccessors = functions.values().stream()
                .filter(FunctionRecord::dataAccessor)
                .map(FunctionRecord::id)
                .toList();

        GraphStats stats = statistics(functions, results, entryPoints.size(), dataAccessors.size(),
                assembled.extraction());
        log.info("Resolved {}/{} call sites ({} ambiguous)", stats.resolvedCallSites(), stats.totalCallSites(),
                stats.ambiguousCallSites());

        return new CallGraph(CallGraph.SCHEMA_VERSION, generatedAt, assembled.projectRoot(), functions,
                entryPoints, dataAccessors, stats);
    }

    private static boolean onlySelfCalls(FunctionRecord function) {
        return function.calledBy().stream().allMatch(c -> c.callerId().equals(function.id()));
    }

    CallReference resolveOne(PendingCall pending, SymbolIndex index) {
        CallReference reference = pending.reference();
        CallExtraction call = pending.call();
        FunctionRecord caller = pending.caller();

        if (call.dynamicHint() != null) {
            return reference.unresolved(call.dynamicHint(), ResolutionReason.DYNAMIC_SHAPE);
        }
        if (call.receiver() == null && isParameter(caller, call.calleeName())) {
            return reference.unresolved(UnresolvedReason.HIGHER_ORDER, ResolutionReason.DYNAMIC_SHAPE);
        }

        if (isConstructorCall(call, caller, index)) {
            return resolveConstructor(reference, call, caller, index);
        }

        Outcome outcome = scopedMatch(call, caller, index);
        if (outcome.external()) {
            return reference.unresolved(UnresolvedReason.EXTERNAL_LIBRARY, ResolutionReason.NO_CANDIDATE);
        }
        if (outcome.match() != null) {
            return accept(reference, call, outcome.match());
        }
        return globalMatch(reference, call, index);
    }

    private Outcome scopedMatch(CallExtraction call, FunctionRecord caller, SymbolIndex index) {
        String name = call.calleeName();
        String receiver = call.receiver();

        boolean implicitThis = receiver == null && caller.language() == Language.JAVA;
        if ((receiver != null && SELF_RECEIVERS.contains(receiver)) || implicitThis) {
            if (caller.className() != null) {
                List<FunctionRecord> sameClass = methods(index.inClass(caller.className()), name).stream()
                        .filter(f -> f.file().equals(caller.file()))
                        .toList();
                if (!sameClass.isEmpty()) {
                    return Outcome.of(new Match(sameClass, SAME_SCOPE, ResolutionReason.SAME_CLASS));
                }
                List<FunctionRecord> inherited = inherited(caller.className(), name, index);
                if (!inherited.isEmpty()) {
                    return Outcome.of(new Match(inherited, INFERRED, ResolutionReason.INHERITED));
                }
            }
            if (receiver != null) {
                return Outcome.NONE;
            }
        }

        if (receiver != null && SUPER_RECEIVERS.contains(receiver)) {
            if (caller.className() != null) {
                List<FunctionRecord> inherited = inherited(caller.className(), name, index);
                if (!inherited.isEmpty()) {
                    return Outcome.of(new Match(inherited, INFERRED, ResolutionReason.INHERITED));
                }
            }
            return Outcome.NONE;
        }

        if (receiver == null) {
            List<FunctionRecord> sameFile = index.inFile(caller.file()).stream()
                    .filter(f -> f.name().equals(name) && !f.constructor())
                    .filter(f -> caller.language() == Language.JAVA || f.className() == null)
                    .toList();
            if (!sameFile.isEmpty()) {
                return Outcome.of(new Match(sameFile, SAME_SCOPE, ResolutionReason.SAME_FILE));
            }
            return importedName(caller.file(), name, index);
        }

        return receiverMatch(call, caller, index);
    }

    private Outcome receiverMatch(CallExtraction call, FunctionRecord caller, SymbolIndex index) {
        String name = call.calleeName();
        String base = baseReceiver(call.receiver());

        Outcome namespace = namespaceImport(caller.file(), base, name, index);
        if (namespace != Outcome.NONE) {
            return namespace;
        }
        Outcome submodule = submoduleImport(caller, base, name, index);
        if (submodule != Outcome.NONE) {
            return submodule;
        }
        int dot = base.indexOf('.');
        if (dot > 0 && namespaceImport(caller.file(), base.substring(0, dot), name, index).external()) {
            // os.path.join with "import os"
            return Outcome.EXTERNAL;
        }

        if (index.declares(base)) {
            List<FunctionRecord> members = classMethods(base, name, caller.file(), index);
            if (!members.isEmpty()) {
                if (members.stream().anyMatch(f -> f.file().equals(caller.file()))) {
                    return Outcome.of(new Match(members, SAME_SCOPE, ResolutionReason.SAME_FILE));
                }
                boolean imported = importedFile(caller.file(), base, index).isPresent();
                return Outcome.of(imported
                        ? new Match(members, IMPORTED, ResolutionReason.IMPORT)
                        : new Match(members, DECLARED_TYPE, ResolutionReason.DECLARED_TYPE));
            }
        }

        if (call.receiverType() != null) {
            String type = simpleTypeName(call.receiverType());
            if (!index.declares(type)) {
                return Outcome.EXTERNAL;
            }
            List<FunctionRecord> members = classMethods(type, name, caller.file(), index);
            if (!members.isEmpty()) {
                return Outcome.of(new Match(members, DECLARED_TYPE, ResolutionReason.DECLARED_TYPE));
            }
            List<FunctionRecord> inherited = inherited(type, name, index);
            if (!inherited.isEmpty()) {
                return Outcome.of(new Match(inherited, INFERRED, ResolutionReason.INHERITED));
            }
            return Outcome.NONE;
        }

        String inferred = inferClassName(base);
        if (inferred != null && index.declares(inferred)) {
            List<FunctionRecord> members = classMethods(inferred, name, caller.file(), index);
            if (!members.isEmpty()) {
                return Outcome.of(new Match(members, INFERRED, ResolutionReason.INFERRED_TYPE));
            }
            List<FunctionRecord> inherited = inherited(inferred, name, index);
            if (!inherited.isEmpty()) {
                return Outcome.of(new Match(inherited, INFERRED, ResolutionReason.INHERITED));
            }
        }
        return Outcome.NONE;
    }

    private Outcome importedName(String file, String name, SymbolIndex index) {
        for (ImportExtraction imported : index.importsOf(file)) {
            for (ImportExtraction.ImportedName binding : imported.names()) {
                boolean wildcard = binding.namespace() && "*".equals(binding.local());
                if (!wildcard && (binding.namespace() || !binding.local().equals(name))) {
                    continue;
                }
                Optional<String> target = index.resolveModule(file, imported.source());
                if (target.isEmpty()) {
                    if (wildcard) {
                        continue;
                    }
                    return Outcome.EXTERNAL;
                }
                String wanted = wildcard ? name : binding.imported();
                List<FunctionRecord> candidates = topLevelFirst(index.inFile(target.get()).stream()
                        .filter(f -> f.name().equals(wanted) && !f.constructor())
                        .toList());
                if (!candidates.isEmpty()) {
                    return Outcome.of(new Match(candidates, IMPORTED, ResolutionReason.IMPORT));
                }
            }
        }
        return Outcome.NONE;
    }

    private Outcome namespaceImport(String file, String receiver, String name, SymbolIndex index) {
        for (ImportExtraction imported : index.importsOf(file)) {
            boolean bound = imported.names().stream()
                    .anyMatch(n -> n.namespace() && n.local().equals(receiver));
            if (!bound) {
                continue;
            }
            Optional<String> target = index.resolveModule(file, imported.source());
            if (target.isEmpty()) {
                return Outcome.EXTERNAL;
            }
            List<FunctionRecord> candidates = topLevelFirst(index.inFile(target.get()).stream()
                    .filter(f -> f.name().equals(name) && !f.constructor())
                    .toList());
            return candidates.isEmpty()
                    ? Outcome.NONE
                    : Outcome.of(new Match(candidates, IMPORTED, ResolutionReason.IMPORT));
        }
        return Outcome.NONE;
    }

    /**
     * {@code from pkg import mod [as alias]} followed by {@code alias.fn()}: the bound name is a module.
     */
    private Outcome submoduleImport(FunctionRecord caller, String receiver, String name, SymbolIndex index) {
        if (caller.language() != Language.PYTHON) {
            return Outcome.NONE;
        }
        for (ImportExtraction imported : index.importsOf(caller.file())) {
            for (ImportExtraction.ImportedName binding : imported.names()) {
                if (binding.namespace() || !binding.local().equals(receiver)) {
                    continue;
                }
                String source = imported.source();
                String module = source.endsWith(".") ? source + binding.imported() : source + "." + binding.imported();
                Optional<String> target = index.resolveModule(caller.file(), module);
                if (target.isEmpty()) {
                    continue;
                }
                List<FunctionRecord> candidates = topLevelFirst(index.inFile(target.get()).stream()
                        .filter(f -> f.name().equals(name) && !f.constructor())
                        .toList());
                return candidates.isEmpty()
                        ? Outcome.NONE
                        : Outcome.of(new Match(candidates, IMPORTED, ResolutionReason.IMPORT));
            }
        }
        return Outcome.NONE;
    }

    private Optional<String> importedFile(String file, String localName, SymbolIndex index) {
        for (ImportExtraction imported : index.importsOf(file)) {
            boolean bound = imported.names().stream()
                    .anyMatch(n -> !n.namespace() && n.local().equals(localName));
            if (bound) {
                Optional<String> target = index.resolveModule(file, imported.source());
                if (target.isPresent()) {
                    return target;
                }
            }
        }
        return Optional.empty();
    }

    private boolean isConstructorCall(CallExtraction call, FunctionRecord caller, SymbolIndex index) {
        if (call.constructorCall()) {
            return true;
        }
        return caller.language() == Language.PYTHON
                && call.receiver() == null
                && !index.declarationsNamed(call.calleeName()).isEmpty();
    }

    private CallReference resolveConstructor(CallReference reference, CallExtraction call, FunctionRecord caller,
                                             SymbolIndex index) {
        String type = simpleTypeName(call.calleeName());
        List<FunctionRecord> constructors = index.inClass(type).stream()
                .filter(FunctionRecord::constructor)
                .toList();
        if (!constructors.isEmpty()) {
            return accept(reference, call,
                    new Match(preferFile(constructors, caller.file(), type, index), DECLARED_TYPE,
                            ResolutionReason.CONSTRUCTOR));
        }
        if (index.declares(type)) {
            // project type with an implicit constructor
            return reference.unresolved(null, ResolutionReason.CONSTRUCTOR);
        }
        return reference.unresolved(UnresolvedReason.EXTERNAL_LIBRARY, ResolutionReason.NO_CANDIDATE);
    }

    private CallReference globalMatch(CallReference reference, CallExtraction call, SymbolIndex index) {
        List<FunctionRecord> candidates = index.withSimpleName(call.calleeName()).stream()
                .filter(f -> !f.constructor())
                .toList();
        if (candidates.isEmpty()) {
            return reference.unresolved(UnresolvedReason.EXTERNAL_LIBRARY, ResolutionReason.NO_CANDIDATE);
        }
        if (candidates.size() == 1) {
            return reference.resolvedTo(candidates.get(0).id(), GLOBAL_UNIQUE, ResolutionReason.GLOBAL_UNIQUE);
        }
        return reference.ambiguous(candidates.stream().map(FunctionRecord::id).toList(),
                ambiguityConfidence(candidates.size()), ResolutionReason.GLOBAL_AMBIGUOUS);
    }

    /**
     * Confidence for a global match among {@code n} equally named candidates (n >= 2).
     */
    static double ambiguityConfidence(int n) {
        return Math.max(0.1, 0.5 - 0.1 * (n - 2));
    }

    /**
     * Single candidate resolves at the tier's confidence. Several are narrowed by argument count;
     * if that still leaves more than one, the first by file and line wins. That choice is a heuristic.
     */
    private CallReference accept(CallReference reference, CallExtraction call, Match match) {
        List<FunctionRecord> candidates = match.candidates();
        if (candidates.size() > 1) {
            List<FunctionRecord> byArity = candidates.stream()
                    .filter(f -> acceptsArguments(f, call.argumentCount()))
                    .toList();
            if (!byArity.isEmpty()) {
                candidates = byArity;
            }
        }
        if (candidates.size() == 1) {
            return reference.resolvedTo(candidates.get(0).id(), match.confidence(), match.reason());
        }
        FunctionRecord first = candidates.stream()
                .min(Comparator.comparing(FunctionRecord::file).thenComparingInt(FunctionRecord::startLine))
                .orElseThrow();
        return reference.resolvedTo(first.id(), OVERLOAD_TIE, ResolutionReason.OVERLOAD_TIE);
    }

    private List<FunctionRecord> classMethods(String className, String name, String callerFile, SymbolIndex index) {
        List<FunctionRecord> members = methods(index.inClass(className), name);
        return preferFile(members, callerFile, className, index);
    }

    private List<FunctionRecord> preferFile(List<FunctionRecord> members, String callerFile, String className,
                                            SymbolIndex index) {
        Set<String> files = new HashSet<>();
        members.forEach(f -> files.add(f.file()));
        if (files.size() <= 1) {
            return members;
        }
        List<FunctionRecord> local = members.stream().filter(f -> f.file().equals(callerFile)).toList();
        if (!local.isEmpty()) {
            return local;
        }
        Optional<String> imported = importedFile(callerFile, className, index);
        if (imported.isPresent()) {
            List<FunctionRecord> fromImport = members.stream().filter(f -> f.file().equals(imported.get())).toList();
            if (!fromImport.isEmpty()) {
                return fromImport;
            }
        }
        return members;
    }

    private List<FunctionRecord> inherited(String className, String name, SymbolIndex index) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(baseTypesOf(className, index));
        seen.add(className);
        int steps = 0;
        while (!queue.isEmpty() && steps++ < MAX_INHERITANCE_DEPTH * 4) {
            String type = queue.poll();
            if (!seen.add(type)) {
                continue;
            }
            List<FunctionRecord> found = methods(index.inClass(type), name);
            if (!found.isEmpty()) {
                return found;
            }
            queue.addAll(baseTypesOf(type, index));
        }
        return List.of();
    }

    private static List<String> baseTypesOf(String className, SymbolIndex index) {
        return index.declarationsNamed(className).stream()
                .flatMap(d -> d.declaration().baseTypes().stream())
                .map(CallResolver::simpleTypeName)
                .distinct()
                .toList();
    }

    private static List<FunctionRecord> methods(List<FunctionRecord> members, String name) {
        return members.stream()
                .filter(f -> f.name().equals(name) && !f.constructor())
                .toList();
    }

    private static List<FunctionRecord> topLevelFirst(List<FunctionRecord> candidates) {
        List<FunctionRecord> topLevel = candidates.stream().filter(f -> f.className() == null).toList();
        return topLevel.isEmpty() ? candidates : topLevel;
    }

    private static boolean isParameter(FunctionRecord caller, String name) {
        return caller.parameters().stream().map(Parameter::name).anyMatch(name::equals);
    }

    private static boolean acceptsArguments(FunctionRecord function, int arguments) {
        int required = (int) function.parameters().stream().filter(p -> !p.hasDefault() && !p.rest()).count();
        boolean variadic = function.parameters().stream().anyMatch(Parameter::rest);
        return arguments >= required && (variadic || arguments <= function.parameters().size());
    }

    static String baseReceiver(String receiver) {
        String base = receiver;
        for (String prefix : List.of("this.", "self.", "cls.")) {
            if (base.startsWith(prefix)) {
                base = base.substring(prefix.length());
            }
        }
        return base;
    }

    /**
     * {@code userService} and {@code _userService} both suggest class {@code UserService}.
     */
    static String inferClassName(String receiver) {
        String name = receiver;
        while (name.startsWith("_")) {
            name = name.substring(1);
        }
        if (name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0)) || name.contains(".")
                || name.contains("(")) {
            return null;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    static String simpleTypeName(String type) {
        String simple = type;
        int generic = simple.indexOf('<');
        if (generic >= 0) {
            simple = simple.substring(0, generic);
        }
        int bracket = simple.indexOf('[');
        if (bracket >= 0) {
            simple = simple.substring(0, bracket);
        }
        int dot = simple.lastIndexOf('.');
        return (dot >= 0 ? simple.substring(dot + 1) : simple).trim();
    }

    private static GraphStats statistics(Map<String, FunctionRecord> functions, List<CallReference> calls,
                                         int entryPoints, int dataAccessors,
                                         AssembledGraph.ExtractionSummary extraction) {
        int resolved = (int) calls.stream().filter(CallReference::resolved).count();
        int ambiguous = (int) calls.stream().filter(CallReference::ambiguousMatch).count();
        Map<String, Integer> byLanguage = new LinkedHashMap<>();
        functions.values().forEach(f -> byLanguage.merge(f.language().tag(), 1, Integer::sum));
        double rate = calls.isEmpty() ? 0.0 : (double) resolved / calls.size();
        return new GraphStats(functions.size(), calls.size(), resolved, calls.size() - resolved, ambiguous,
                dataAccessors, entryPoints, byLanguage, rate,
                extraction.filesScanned(), extraction.filesUsingFallback(), extraction.filesWithErrors(),
                extraction.averageConfidence());
    }

    private record Match(List<FunctionRecord> candidates, double confidence, ResolutionReason reason) {}

    private record Outcome(Match match, boolean external) {
        static final Outcome NONE = new Outcome(null, false);
        static final Outcome EXTERNAL = new Outcome(null, true);

        static Outcome of(Match match) {
            return new Outcome(match, false);
        }
    }
}
