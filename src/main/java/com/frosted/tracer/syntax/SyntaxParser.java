package com.frosted.tracer.syntax;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.model.StaticError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for parsing: lexes, picks the parser for the language and returns the
 * best-effort tree with its errors. Never throws for any input.
 */
public final class SyntaxParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(SyntaxParser.class);

    public ParseResult parse(String text, Language language) {
        return parse(SourceText.of(text), language);
    }

    public ParseResult parse(SourceText source, Language language) {
        ErrorSink errors = new ErrorSink();
        try {
            List<Token> tokens = new Lexer(source, language, errors).tokenize();
            SyntaxTree tree = parserFor(source, language, tokens, errors).parseProgram();
            LOGGER.debug("Parsed {} lines of {} into {} nodes with {} errors",
                    source.lineCount(), language, tree.size(), errors.sorted().size());
            return new ParseResult(tree, errors.sorted());
        } catch (RuntimeException | StackOverflowError e) {
            LOGGER.warn("Parser gave up on {} input of {} lines", language, source.lineCount(), e);
            errors.report(StaticError.error(1, 1, ErrorKind.UNEXPECTED_TOKEN,
                    "This code could not be read", "Check the code for typos and try again"));
            return new ParseResult(SyntaxTree.empty(source, language), errors.sorted());
        }
    }

    private static Parser parserFor(SourceText source, Language language, List<Token> tokens, ErrorSink errors) {
        switch (language) {
            case JAVASCRIPT_LIKE:
                return new JavaScriptLikeParser(source, tokens, errors);
            case JAVA_LIKE:
                return new JavaLikeParser(source, tokens, errors);
            default:
                return new PythonLikeParser(source, tokens, errors);
        }
    }
}
