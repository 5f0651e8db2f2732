package com.vidnyan.cga.adapter.out.parser;

import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationKind;
import com.vidnyan.cga.domain.extraction.ExtractionException;
import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.model.Parameter;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaParserExtractionStrategyTest {

    private static final String CONTROLLER = """
            package com.example.web;

            import java.lang.reflect.Method;

            public class UserController {

                private UserRepository repository;
                private AuditLog audit = new AuditLog();

                public UserController(UserRepository repository) {
                    this.repository = repository;
                }

                @GetMapping("/users")
                public User get(String id) {
                    User user = repository.findById(id);
                    audit.record(user);
                    helper();
                    return user;
                }

                private void helper() {
                    Runnable r = () -> System.out.println("run");
                    r.run();
                }

                public static void main(String[] args) throws Exception {
                    Method m = UserController.class.getMethod("get", String.class);
                    m.invoke(null, "1");
                }
            }
            """;

    private final JavaParserExtractionStrategy strategy = new JavaParserExtractionStrategy();

    private static FunctionExtraction function(FileExtraction extraction, String name) {
        return extraction.functions().stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no function " + name));
    }

    private static CallExtraction call(FileExtraction extraction, String name) {
        return extraction.calls().stream()
                .filter(c -> c.calleeName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no call " + name));
    }

    @Test
    void extract_ShouldFindMethodsConstructorsAndTypes() {
        // Act
        FileExtraction result = strategy.extract(CONTROLLER, "src/main/java/com/example/web/UserController.java");

        // Assert
        assertEquals(ExtractionMethod.STRUCTURAL, result.quality().method());
        assertTrue(result.errors().isEmpty());
        assertEquals(4, result.functions().size());

        FunctionExtraction constructor = function(result, "UserController");
        assertTrue(constructor.constructor());
        assertEquals("UserController.UserController", constructor.qualifiedName());

        FunctionExtraction get = function(result, "get");
        assertEquals("UserController.get", get.qualifiedName());
        assertEquals("UserController", get.className());
        assertEquals(List.of("GetMapping"), get.decorators());
        assertEquals(List.of(Parameter.of("id", "String")), get.parameters());
        assertEquals("User", get.returnType());
        assertTrue(get.exported());

        FunctionExtraction helper = function(result, "helper");
        assertFalse(helper.exported());
        assertEquals(22, helper.startLine());
        assertEquals(25, helper.endLine());

        assertEquals("String[]", function(result, "main").parameters().get(0).type());

        DeclarationExtraction type = result.declarations().get(0);
        assertEquals("UserController", type.name());
        assertEquals(DeclarationKind.CLASS, type.kind());
        assertEquals(List.of("get", "helper", "main"), type.methods());
        assertEquals("UserController", result.exports().get(0).name());
        assertEquals("java.lang.reflect.Method", result.imports().get(0).source());
    }

    @Test
    void extract_ShouldTypeReceiversFromVisibleDeclarations() {
        // Act
        FileExtraction result = strategy.extract(CONTROLLER, "UserController.java");

        // Assert
        CallExtraction findById = call(result, "findById");
        assertEquals("repository", findById.receiver());
        assertEquals("UserRepository", findById.receiverType());
        assertEquals(16, findById.line());
        assertEquals(1, findById.argumentCount());

        assertEquals("AuditLog", call(result, "record").receiverType());
        assertEquals("Runnable", call(result, "run").receiverType());

        CallExtraction helper = call(result, "helper");
        assertNull(helper.receiver());
        assertFalse(helper.methodCall());

        CallExtraction audit = call(result, "AuditLog");
        assertTrue(audit.constructorCall());
        assertEquals(8, audit.line());
    }

    @Test
    void extract_ShouldFlagReflectiveInvocation() {
        // Act
        FileExtraction result = strategy.extract(CONTROLLER, "UserController.java");

        // Assert
        CallExtraction invoke = call(result, "invoke");
        assertEquals(UnresolvedReason.REFLECTION, invoke.dynamicHint());
        assertEquals("Method", invoke.receiverType());
        assertNull(call(result, "findById").dynamicHint());
    }

    @Test
    void extract_ShouldRejectSyntaxErrors() {
        assertThrows(ExtractionException.class,
                () -> strategy.extract("class Broken { void x( }", "Broken.java"));
    }
}
