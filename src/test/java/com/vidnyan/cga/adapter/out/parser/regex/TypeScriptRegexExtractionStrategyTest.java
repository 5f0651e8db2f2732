package com.vidnyan.cga.adapter.out.parser.regex;

import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.extraction.ExportExtraction;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction.ImportedName;
import com.vidnyan.cga.domain.model.Language;
import com.vidnyan.cga.domain.model.Parameter;
import com.vidnyan.cga.domain.model.UnresolvedReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeScriptRegexExtractionStrategyTest {

    private static final String USERS = """
            import { findUser } from './repo';
            import * as utils from '../lib/utils';

            export class UserController {
              constructor(private service: UserService) {}

              @Get(':id')
              async getUser(id: string): Promise<User> {
                const user = this.service.load(id);
                return utils.format(user);
              }

              private helper() {
                return findUser('x');
              }
            }

            export const handler = async (event) => {
              return compute(event);
            };

            function compute(e) {
              obj[name]();
              return e;
            }
            """;

    private final TypeScriptRegexExtractionStrategy strategy =
            new TypeScriptRegexExtractionStrategy(Language.TYPESCRIPT);

    private static FunctionExtraction function(FileExtraction extraction, String name) {
        return extraction.functions().stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no function " + name));
    }

    @Test
    void extract_ShouldFindClassMembersAndBoundFunctions() {
        // Act
        FileExtraction result = strategy.extract(USERS, "src/users.ts");

        // Assert
        assertEquals(List.of("UserController.constructor", "UserController.getUser", "UserController.helper",
                        "handler", "compute"),
                result.functions().stream().map(FunctionExtraction::qualifiedName).toList());

        FunctionExtraction constructor = function(result, "constructor");
        assertTrue(constructor.constructor());
        assertFalse(constructor.exported());
        assertEquals(List.of(Parameter.of("service", "UserService")), constructor.parameters());

        FunctionExtraction getUser = function(result, "getUser");
        assertEquals(List.of("Get"), getUser.decorators());
        assertTrue(getUser.async());
        assertTrue(getUser.exported());
        assertEquals("Promise<User>", getUser.returnType());
        assertEquals(8, getUser.startLine());
        assertEquals(11, getUser.endLine());

        assertFalse(function(result, "helper").exported());

        FunctionExtraction handler = function(result, "handler");
        assertTrue(handler.exported());
        assertTrue(handler.async());
        assertEquals(18, handler.startLine());
        assertEquals(20, handler.endLine());

        assertFalse(function(result, "compute").exported());
    }

    @Test
    void extract_ShouldReadImportsAndExports() {
        // Act
        FileExtraction result = strategy.extract(USERS, "src/users.ts");

        // Assert
        List<ImportExtraction> imports = result.imports();
        assertEquals(2, imports.size());
        assertEquals("./repo", imports.get(0).source());
        assertEquals(List.of(ImportedName.of("findUser")), imports.get(0).names());
        assertEquals("../lib/utils", imports.get(1).source());
        assertEquals(List.of(ImportedName.namespaceOf("utils")), imports.get(1).names());
        assertEquals(List.of("UserController", "handler"),
                result.exports().stream().map(ExportExtraction::name).toList());
    }

    @Test
    void extract_ShouldFindCallsAndTagComputedNames() {
        // Act
        FileExtraction result = strategy.extract(USERS, "src/users.ts");

        // Assert
        assertEquals(List.of("load", "format", "findUser", "compute", "[name]"),
                result.calls().stream().map(CallExtraction::calleeName).toList());

        CallExtraction computed = result.calls().get(4);
        assertEquals("obj", computed.receiver());
        assertEquals(UnresolvedReason.COMPUTED_NAME, computed.dynamicHint());
        assertEquals(23, computed.line());

        CallExtraction load = result.calls().get(0);
        assertEquals("this.service", load.receiver());
        assertEquals(1, load.argumentCount());
    }

    @Test
    void extract_ShouldTreatJsxElementsAsCallsOnlyInJsxFiles() {
        // Arrange
        String source = """
                export function App() {
                  return <UserList items={items} />;
                }
                """;

        // Act
        FileExtraction tsx = new TypeScriptRegexExtractionStrategy(Language.TYPESCRIPT).extract(source, "src/App.tsx");
        FileExtraction ts = new TypeScriptRegexExtractionStrategy(Language.TYPESCRIPT).extract(source, "src/App.ts");

        // Assert
        CallExtraction element = tsx.calls().stream()
                .filter(c -> c.calleeName().equals("UserList"))
                .findFirst()
                .orElseThrow();
        assertEquals(2, element.line());
        assertEquals(1, element.argumentCount());
        assertTrue(ts.calls().stream().noneMatch(c -> c.calleeName().equals("UserList")));
        assertTrue(function(tsx, "App").exported());
    }

    @Test
    void extract_ShouldReadCommonJsModules() {
        // Arrange
        String source = """
                const { parse } = require('./parser');
                const fs = require('fs');

                function load(path) {
                  return parse(fs.readFileSync(path));
                }

                module.exports = { load };
                """;

        // Act
        FileExtraction result = new TypeScriptRegexExtractionStrategy(Language.JAVASCRIPT)
                .extract(source, "lib/loader.js");

        // Assert
        assertEquals(Language.JAVASCRIPT, result.language());
        assertEquals(List.of(ImportedName.of("parse")), result.imports().get(0).names());
        assertEquals(List.of(ImportedName.namespaceOf("fs")), result.imports().get(1).names());
        assertTrue(function(result, "load").exported());
        assertEquals(List.of("load"), result.exports().stream().map(ExportExtraction::name).toList());
    }

    @Test
    void extract_ShouldNotLetBracesInRegexLiteralsShiftBlocks() {
        // Arrange
        String source = """
                function a(count) {
                  const re = /[{]/g;
                  const half = count / 2;
                  return re.test('x') ? half : 0;
                }

                function b() {
                  return a(4);
                }
                """;

        // Act
        FileExtraction result = strategy.extract(source, "src/match.ts");

        // Assert
        assertEquals(List.of("a", "b"), result.functions().stream().map(FunctionExtraction::qualifiedName).toList());
        assertEquals(5, function(result, "a").endLine());
        FunctionExtraction b = function(result, "b");
        assertEquals(7, b.startLine());
        assertEquals(9, b.endLine());
        CallExtraction call = result.calls().stream()
                .filter(c -> c.calleeName().equals("a"))
                .findFirst()
                .orElseThrow();
        assertEquals(8, call.line());
    }

    @Test
    void extract_ShouldKeepCallsInsideTemplateInterpolations() {
        // Arrange
        String source = """
                function label(id) {
                  return `{ id=${format(id)} and ${`nested ${inner()}`} }`;
                }

                function after() {
                  return label(1);
                }
                """;

        // Act
        FileExtraction result = strategy.extract(source, "src/label.ts");

        // Assert
        List<String> names = result.calls().stream().map(CallExtraction::calleeName).toList();
        assertTrue(names.containsAll(List.of("format", "inner", "label")), names.toString());
        assertTrue(result.calls().stream()
                .filter(c -> !c.calleeName().equals("label"))
                .allMatch(c -> c.line() == 2));
        assertEquals(3, function(result, "label").endLine());
        assertEquals("after", function(result, "after").qualifiedName());
    }
}
