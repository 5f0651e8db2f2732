package com.vidnyan.cga.adapter.out.registry;

import com.vidnyan.cga.application.port.out.EntryPointRegistry;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.model.EntryPointKind;
import com.vidnyan.cga.domain.model.Language;
import com.vidnyan.cga.domain.model.Parameter;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recognizes entry points by decorator or annotation name first, then by shape:
 * {@code main} methods, test naming conventions inside test files and public members of
 * controller-like classes.
 */
public class DefaultEntryPointRegistry implements EntryPointRegistry {

    private static final Set<String> HTTP_DECORATORS = Set.of("GetMapping", "PostMapping", "PutMapping",
            "DeleteMapping", "PatchMapping", "RequestMapping", "Get", "Post", "Put", "Delete", "Patch", "Options",
            "Head", "All", "GET", "POST", "PUT", "DELETE", "PATCH", "Path", "route", "get", "post", "put", "delete",
            "patch", "api_view", "action");
    private static final Set<String> CLI_DECORATORS = Set.of("command", "Command", "group", "ShellMethod",
            "ShellComponent", "callback");
    private static final Set<String> EVENT_DECORATORS = Set.of("KafkaListener", "RabbitListener", "JmsListener",
            "SqsListener", "StreamListener", "EventListener", "TransactionalEventListener", "OnEvent",
            "EventPattern", "MessagePattern", "Subscribe", "SubscribeMessage", "receiver", "task", "shared_task",
            "on_event", "Process", "Processor");
    private static final Set<String> TEST_DECORATORS = Set.of("Test", "ParameterizedTest", "RepeatedTest",
            "TestFactory", "TestTemplate", "BeforeEach", "AfterEach", "BeforeAll", "AfterAll", "fixture");
    private static final Set<String> SCHEDULED_DECORATORS = Set.of("Scheduled", "Schedules", "Cron", "Interval",
            "Timeout", "periodic_task", "scheduled_job", "scheduled");

    private static final Pattern TEST_FILE = Pattern.compile(
            "(^|/)(test|tests|__tests__|spec)/|(Test|Tests|IT)\\.java$|(^|/)test_[^/]*\\.py$|_test\\.py$"
                    + "|\\.(test|spec)\\.[cm]?[jt]sx?$");
    private static final Pattern CONTROLLER_CLASS = Pattern.compile("\\w*(Controller|Handler|Resource|Endpoint)$");

    @Override
    public Optional<EntryPointKind> classify(FunctionExtraction function, FileExtraction file) {
        Optional<EntryPointKind> byDecorator = byDecorator(function.decorators());
        if (byDecorator.isPresent()) {
            return byDecorator;
        }
        if (isMain(function, file.language())) {
            return Optional.of(EntryPointKind.MAIN);
        }
        if (isTestFile(file.file()) && testNamed(function)) {
            return Optional.of(EntryPointKind.TEST);
        }
        if (function.className() != null && !function.constructor() && function.exported()
                && CONTROLLER_CLASS.matcher(function.className()).matches()) {
            return Optional.of(EntryPointKind.HTTP_HANDLER);
        }
        return Optional.empty();
    }

    static boolean isTestFile(String file) {
        return TEST_FILE.matcher(file.replace('\\', '/')).find();
    }

    private static Optional<EntryPointKind> byDecorator(List<String> decorators) {
        for (String decorator : decorators) {
            if (TEST_DECORATORS.contains(decorator)) {
                return Optional.of(EntryPointKind.TEST);
            }
            if (HTTP_DECORATORS.contains(decorator)) {
                return Optional.of(EntryPointKind.HTTP_HANDLER);
            }
            if (SCHEDULED_DECORATORS.contains(decorator)) {
                return Optional.of(EntryPointKind.SCHEDULED_JOB);
            }
            if (EVENT_DECORATORS.contains(decorator)) {
                return Optional.of(EntryPointKind.EVENT_HANDLER);
            }
            if (CLI_DECORATORS.contains(decorator)) {
                return Optional.of(EntryPointKind.CLI_COMMAND);
            }
        }
        return Optional.empty();
    }

    private static boolean isMain(FunctionExtraction function, Language language) {
        if (!function.name().equals("main")) {
            return false;
        }
        if (language != Language.JAVA) {
            return function.className() == null;
        }
        List<Parameter> parameters = function.parameters();
        if (parameters.size() != 1) {
            return false;
        }
        String type = parameters.get(0).type();
        return type != null
                && (type.equals("String[]") || type.equals("String") && parameters.get(0).rest());
    }

    private static boolean testNamed(FunctionExtraction function) {
        String name = function.name();
        return name.startsWith("test") || name.startsWith("should") || name.endsWith("Test");
    }
}
