package com.vidnyan.cga.adapter.out.parser.regex;

import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationExtraction;
import com.vidnyan.cga.domain.extraction.ExportExtraction;
import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction.ImportedName;
import com.vidnyan.cga.domain.model.Parameter;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonRegexExtractionStrategyTest {

    private static final String SERVICE = """
            import os
            from .repository import UserRepository, find_user as lookup
            from app.models import *

            __all__ = ["create_user"]

            class UserService(BaseService):
                def __init__(self, repo):
                    self.repo = repo

                @cached
                def get(self, user_id: int = 0) -> dict:
                    return self.repo.load(user_id)

                def _hidden(self):
                    handler = getattr(self, 'name')(1)
                    return eval("1 + 1")

            def create_user(name, *args, **kwargs):
                service = UserService(None)
                return lookup(name)

            def helper():
                module = importlib.import_module("plugins")
                return os.path.join("a", "b")
            """;

    private final PythonRegexExtractionStrategy strategy = new PythonRegexExtractionStrategy();

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
    void extract_ShouldFindClassesAndMethodsByIndentation() {
        // Act
        FileExtraction result = strategy.extract(SERVICE, "app/service.py");

        // Assert
        assertEquals(ExtractionMethod.REGEX, result.quality().method());
        assertEquals(1, result.declarations().size());
        DeclarationExtraction type = result.declarations().get(0);
        assertEquals("UserService", type.name());
        assertEquals(List.of("BaseService"), type.baseTypes());
        assertEquals(List.of("__init__", "get", "_hidden"), type.methods());
        assertEquals(7, type.startLine());
        assertEquals(17, type.endLine());
        assertTrue(type.exported());

        FunctionExtraction init = function(result, "__init__");
        assertTrue(init.constructor());
        assertFalse(init.exported());
        assertEquals(List.of(Parameter.of("repo", null)), init.parameters());

        FunctionExtraction get = function(result, "get");
        assertEquals("UserService.get", get.qualifiedName());
        assertEquals("UserService", get.className());
        assertEquals(12, get.startLine());
        assertEquals(13, get.endLine());
        assertEquals(List.of("cached"), get.decorators());
        assertEquals(List.of(new Parameter("user_id", "int", true, false)), get.parameters());
        assertEquals("dict", get.returnType());
        assertTrue(get.exported());

        assertFalse(function(result, "_hidden").exported());
    }

    @Test
    void extract_ShouldHonorDunderAllForModuleFunctions() {
        // Act
        FileExtraction result = strategy.extract(SERVICE, "app/service.py");

        // Assert
        FunctionExtraction create = function(result, "create_user");
        assertTrue(create.exported());
        assertNull(create.className());
        assertEquals(List.of(Parameter.of("name", null), new Parameter("args", null, false, true),
                new Parameter("kwargs", null, false, true)), create.parameters());
        assertFalse(function(result, "helper").exported());
        assertEquals(List.of("create_user"), result.exports().stream().map(ExportExtraction::name).toList());
    }

    @Test
    void extract_ShouldReadPlainRelativeAndStarImports() {
        // Act
        List<ImportExtraction> imports = strategy.extract(SERVICE, "app/service.py").imports();

        // Assert
        assertEquals(List.of("os", ".repository", "app.models"),
                imports.stream().map(ImportExtraction::source).toList());
        assertEquals(List.of(ImportedName.namespaceOf("os")), imports.get(0).names());
        assertEquals(List.of(ImportedName.of("UserRepository"), ImportedName.aliased("find_user", "lookup")),
                imports.get(1).names());
        assertEquals(List.of(ImportedName.namespaceOf("*")), imports.get(2).names());
    }

    @Test
    void extract_ShouldTagDynamicCallShapes() {
        // Act
        FileExtraction result = strategy.extract(SERVICE, "app/service.py");

        // Assert
        CallExtraction load = call(result, "load");
        assertEquals("self.repo", load.receiver());
        assertEquals(13, load.line());

        CallExtraction getattr = call(result, "name");
        assertEquals(UnresolvedReason.REFLECTION, getattr.dynamicHint());
        assertEquals("self", getattr.receiver());
        assertEquals(16, getattr.line());

        assertEquals(UnresolvedReason.EVAL, call(result, "eval").dynamicHint());
        assertEquals(UnresolvedReason.PLUGIN_SYSTEM, call(result, "import_module").dynamicHint());
        assertEquals("os.path", call(result, "join").receiver());

        CallExtraction construct = call(result, "UserService");
        assertNull(construct.receiver());
        assertEquals(20, construct.line());
        assertEquals(21, call(result, "lookup").line());
    }

    @Test
    void extract_ShouldNotReadDefinitionsAsCalls() {
        // Act
        FileExtraction result = strategy.extract(SERVICE, "app/service.py");

        // Assert
        assertTrue(result.calls().stream().noneMatch(c -> c.calleeName().equals("create_user")));
        assertTrue(result.calls().stream().noneMatch(c -> c.calleeName().equals("__init__")));
        assertTrue(result.calls().stream().noneMatch(c -> c.line() == 7));
    }

    @Test
    void extract_ShouldKeepUnindentedStringLinesInsideFunction() {
        // Arrange
        String source = String.join("\n",
                "def report(cursor):",
                "    cursor.execute(\"\"\"",
                "SELECT id FROM users",
                "\"\"\")",
                "    return summarize(cursor)",
                "",
                "",
                "def query():",
                "    sql = \"\"\"",
                "SELECT 1",
                "\"\"\"",
                "    return sql",
                "");

        // Act
        FileExtraction result = strategy.extract(source, "app/reports.py");

        // Assert
        FunctionExtraction report = function(result, "report");
        assertEquals(1, report.startLine());
        assertEquals(5, report.endLine());
        assertEquals(5, call(result, "summarize").line());
        FunctionExtraction query = function(result, "query");
        assertEquals(8, query.startLine());
        assertEquals(12, query.endLine());
    }
}
