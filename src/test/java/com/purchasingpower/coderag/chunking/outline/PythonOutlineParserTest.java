package com.purchasingpower.coderag.chunking.outline;

import com.purchasingpower.coderag.exception.SourceParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Python Outline Parser Tests")
class PythonOutlineParserTest {

    private final PythonOutlineParser parser = new PythonOutlineParser();

    @Test
    @DisplayName("Should separate imports, globals and declarations")
    void testTopLevelStatements_ShouldBeClassified() {
        String source = String.join("\n",
                "import os",
                "from typing import (",
                "    Dict,",
                "    List,",
                ")",
                "",
                "CACHE = {}",
                "",
                "def load(path):",
                "    return open(path).read()",
                "");

        SourceOutline outline = parser.parse(source, "mod.py");

        assertEquals(2, outline.getImports().size());
        assertEquals("from typing import (\n    Dict,\n    List,\n)", outline.getImports().get(1).getText());
        assertEquals(1, outline.getGlobals().size());
        assertEquals("CACHE = {}", outline.getGlobals().get(0).getText());
        assertEquals(7, outline.getGlobals().get(0).getLine());

        assertEquals(1, outline.getDeclarations().size());
        OutlineMember load = (OutlineMember) outline.getDeclarations().get(0);
        assertEquals("load", load.getName());
        assertEquals(9, load.getLine());
        assertEquals("#", outline.getCommentPrefix());
    }

    @Test
    @DisplayName("Should attach decorators and leading comments to the definition")
    void testDecoratorsAndComments_ShouldBelongToDefinition() {
        String source = String.join("\n",
                "# Cached lookup",
                "@cache",
                "@trace(level=2)",
                "async def lookup(key):",
                "    return key",
                "");

        SourceOutline outline = parser.parse(source, "lookup.py");

        OutlineMember lookup = (OutlineMember) outline.getDeclarations().get(0);
        assertEquals("lookup", lookup.getName());
        assertEquals(4, lookup.getLine());
        assertEquals(1, lookup.getFirstLine());
        assertTrue(lookup.getText().startsWith("# Cached lookup\n@cache"));
    }

    @Test
    @DisplayName("Should break a class into header, docstring, fields and members")
    void testClass_ShouldExposeStubParts() {
        String source = String.join("\n",
                "class Repository(Base,",
                "                 metaclass=Meta):",
                "    '''Stores rows.'''",
                "    table = 'rows'",
                "",
                "    def get(self, key):",
                "        \"\"\"Fetch one row.",
                "",
                "        def not_a_member(): pass",
                "        \"\"\"",
                "        return self.rows[key]",
                "",
                "    class Meta:",
                "        ordering = ['id']",
                "");

        SourceOutline outline = parser.parse(source, "repo.py");

        OutlineType type = (OutlineType) outline.getDeclarations().get(0);
        assertEquals("Repository", type.getName());
        assertEquals("class Repository(Base,\n                 metaclass=Meta):", type.getHeader());
        assertEquals("    '''Stores rows.'''", type.getDocstring());
        assertEquals(1, type.getFields().size());
        assertEquals("    table = 'rows'", type.getFields().get(0));

        assertEquals(2, type.getDeclarations().size());
        OutlineMember get = (OutlineMember) type.getDeclarations().get(0);
        assertEquals("get", get.getName());
        assertTrue(get.getText().endsWith("return self.rows[key]"), "string contents do not end the method");

        OutlineType meta = (OutlineType) type.getDeclarations().get(1);
        assertEquals("Meta", meta.getName());
        assertEquals(13, meta.getLine());
    }

    @Test
    @DisplayName("Should keep else/except clauses with their statement")
    void testCompoundStatement_ShouldStayTogether() {
        String source = String.join("\n",
                "try:",
                "    import ujson as json",
                "except ImportError:",
                "    import json",
                "");

        SourceOutline outline = parser.parse(source, "compat.py");

        assertEquals(1, outline.getGlobals().size());
        assertTrue(outline.getImports().isEmpty());
        assertTrue(outline.getDeclarations().isEmpty());
    }

    @Test
    @DisplayName("Should reject malformed modules")
    void testMalformedInput_ShouldThrow() {
        assertThrows(SourceParseException.class, () -> parser.parse("  x = 1\n", "indent.py"));
        assertThrows(SourceParseException.class,
                () -> parser.parse("class A:\n        x = 1\n    y = 2\n", "dedent.py"));
        assertThrows(SourceParseException.class, () -> parser.parse("def f()\n    return 1\n", "colon.py"));
        assertThrows(SourceParseException.class, () -> parser.parse("s = 'abc\n", "string.py"));
        assertThrows(SourceParseException.class, () -> parser.parse("x = (1, 2\n", "bracket.py"));
        assertThrows(SourceParseException.class, () -> parser.parse("x = 1)\n", "stray.py"));
        assertThrows(SourceParseException.class, () -> parser.parse("@decorator\n", "dangling.py"));
    }
}
