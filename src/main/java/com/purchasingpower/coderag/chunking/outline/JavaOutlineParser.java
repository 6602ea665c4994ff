package com.purchasingpower.coderag.chunking.outline;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.purchasingpower.coderag.exception.SourceParseException;

import java.util.List;

/**
 * Outline of a Java compilation unit built with JavaParser.
 *
 * <p>The package declaration and imports form the import section. Methods,
 * constructors and initializer blocks are members; fields, enum constants and
 * annotation elements are stub fields. Javadoc and annotations stay with the
 * declaration they precede.
 */
public class JavaOutlineParser implements OutlineParser {

    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
            .setAttributeComments(true));

    @Override
    public SourceOutline parse(String content, String filePath) {
        ParseResult<CompilationUnit> result = parser.parse(content);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            int line = result.getProblems().stream()
                    .flatMap(problem -> problem.getLocation().stream())
                    .flatMap(location -> location.getBegin().getRange().stream())
                    .map(range -> range.begin.line)
                    .findFirst()
                    .orElse(0);
            String message = result.getProblems().isEmpty()
                    ? "unparseable compilation unit"
                    : result.getProblems().get(0).getMessage();
            throw new SourceParseException(filePath, line, message);
        }

        CompilationUnit unit = result.getResult().get();
        SourceText source = new SourceText(content);
        SourceOutline.SourceOutlineBuilder outline = SourceOutline.builder().commentPrefix("//");

        unit.getPackageDeclaration().ifPresent(pkg ->
                outline.importStatement(statement(pkg, source)));
        for (ImportDeclaration importDeclaration : unit.getImports()) {
            outline.importStatement(statement(importDeclaration, source));
        }
        for (TypeDeclaration<?> type : unit.getTypes()) {
            outline.declaration(type(type, source, filePath));
        }
        return outline.build();
    }

    private OutlineType type(TypeDeclaration<?> type, SourceText source, String filePath) {
        String text = text(type, source);
        OutlineType.OutlineTypeBuilder builder = OutlineType.builder()
                .name(type.getNameAsString())
                .line(nameLine(type.getName()))
                .firstLine(firstLine(type))
                .text(text)
                .header(header(text, filePath, nameLine(type.getName())));

        if (type instanceof EnumDeclaration enumDeclaration && !enumDeclaration.getEntries().isEmpty()) {
            List<EnumConstantDeclaration> entries = enumDeclaration.getEntries();
            Range first = range(entries.get(0));
            Range last = range(entries.get(entries.size() - 1));
            builder.field(source.slice(first.begin.line, first.begin.column,
                    last.end.line, last.end.column) + ";");
        }

        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                builder.declaration(type(nested, source, filePath));
            } else if (member instanceof CallableDeclaration<?> callable) {
                builder.declaration(new OutlineMember(callable.getNameAsString(),
                        nameLine(callable.getName()), firstLine(member), text(member, source)));
            } else if (member instanceof CompactConstructorDeclaration compact) {
                builder.declaration(new OutlineMember(compact.getNameAsString(),
                        nameLine(compact.getName()), firstLine(member), text(member, source)));
            } else if (member instanceof InitializerDeclaration initializer) {
                String name = initializer.isStatic() ? "static" : "init";
                builder.declaration(new OutlineMember(name, range(initializer).begin.line,
                        firstLine(member), text(member, source)));
            } else {
                builder.field(text(member, source));
            }
        }
        return builder.build();
    }

    private static OutlineStatement statement(Node node, SourceText source) {
        Range range = range(node);
        return new OutlineStatement(
                source.slice(range.begin.line, range.begin.column, range.end.line, range.end.column),
                range.begin.line);
    }

    /**
     * Source of a declaration, starting at its Javadoc or leading comment when it has one.
     */
    private static String text(Node node, SourceText source) {
        Range range = range(node);
        Position begin = begin(node);
        return source.slice(begin.line, begin.column, range.end.line, range.end.column);
    }

    private static int firstLine(Node node) {
        return begin(node).line;
    }

    private static Position begin(Node node) {
        Range range = range(node);
        return node.getComment()
                .flatMap(Node::getRange)
                .map(comment -> comment.begin.isBefore(range.begin) ? comment.begin : range.begin)
                .orElse(range.begin);
    }

    private static Range range(Node node) {
        return node.getRange().orElseThrow(() ->
                new IllegalStateException("Parsed node without a source range: " + node.getClass().getSimpleName()));
    }

    private static int nameLine(Node name) {
        return range(name).begin.line;
    }

    /**
     * Declaration text up to and including the opening brace of the body.
     */
    static String header(String text, String filePath, int line) {
        int depth = 0;
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (c == '/' && i + 1 < length && text.charAt(i + 1) == '/') {
                int end = text.indexOf('\n', i);
                i = end < 0 ? length : end;
            } else if (c == '/' && i + 1 < length && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
            } else if (c == '"' || c == '\'') {
                i = skipLiteral(text, i, c);
            } else {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                } else if (c == '{' && depth == 0) {
                    return text.substring(0, i + 1);
                }
                i++;
            }
        }
        throw new SourceParseException(filePath, line, "type declaration without a body");
    }

    private static int skipLiteral(String text, int start, char quote) {
        if (quote == '"' && text.startsWith("\"\"\"", start)) {
            int end = text.indexOf("\"\"\"", start + 3);
            return end < 0 ? text.length() : end + 3;
        }
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote || c == '\n') {
                return i + 1;
            } else {
                i++;
            }
        }
        return i;
    }
}
