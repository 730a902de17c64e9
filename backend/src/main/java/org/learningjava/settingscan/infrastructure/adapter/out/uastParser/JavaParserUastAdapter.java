package org.learningjava.settingscan.infrastructure.adapter.out.uastParser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.learningjava.settingscan.application.port.UastParseException;
import org.learningjava.settingscan.application.port.UastParserPort;
import org.learningjava.settingscan.domain.model.uast.UastNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * In-process tree producer: parses Java with JavaParser and renders the result with
 * {@link JavaParserUastRenderer}. A field declaration starts at its Javadoc when it has one,
 * as JDT positions it.
 */
public class JavaParserUastAdapter implements UastParserPort {

    private static final Logger log = LoggerFactory.getLogger(JavaParserUastAdapter.class);

    private final ParserConfiguration configuration;
    private final JavaParserUastRenderer renderer = new JavaParserUastRenderer();

    public JavaParserUastAdapter() {
        this(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    public JavaParserUastAdapter(ParserConfiguration.LanguageLevel languageLevel) {
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(languageLevel)
                .setAttributeComments(true);
    }

    @Override
    public UastNode parse(Path sourceFile) throws UastParseException {
        String content;
        try {
            content = Files.readString(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UastParseException(sourceFile, "Cannot read " + sourceFile + ": " + e.getMessage(), e);
        }
        return parse(content, sourceFile);
    }

    public UastNode parse(String content, Path origin) throws UastParseException {
        log.debug("Parsing {} ({} chars)", origin, content.length());
        // JavaParser instances keep state between calls; one per parse.
        try {
            ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(content);
            if (!result.isSuccessful() || result.getResult().isEmpty()) {
                String problems = result.getProblems().stream()
                        .map(Problem::getVerboseMessage)
                        .collect(Collectors.joining("; "));
                throw new UastParseException(origin, "Syntax errors in " + origin + ": " + problems);
            }
            return renderer.render(result.getResult().get());
        } catch (StackOverflowError e) {
            // both the parser and the renderer recurse on expression depth
            log.warn("Gave up on {}: expression nesting exceeds the stack", origin);
            throw new UastParseException(origin, "Source too deeply nested: " + origin, e);
        }
    }
}
