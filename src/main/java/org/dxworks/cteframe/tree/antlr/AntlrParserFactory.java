package org.dxworks.cteframe.tree.antlr;

import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.dxworks.cteframe.tree.antlr.generated.CteSqlLexer;
import org.dxworks.cteframe.tree.antlr.generated.CteSqlParser;

/**
 * Factory for the CTE grammar lexer and parser. Syntax errors go to the given listener, never to the console.
 */
public final class AntlrParserFactory {

    private AntlrParserFactory() {
        // utility class
    }

    /**
     * Creates a parser whose syntax errors (lexer and parser) go to {@code listener} only.
     */
    public static CteSqlParser createParser(String source, ANTLRErrorListener listener) {
        CteSqlLexer lexer = new CteSqlLexer(CharStreams.fromString(source));
        configureLexer(lexer, listener);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        CteSqlParser parser = new CteSqlParser(tokens);
        configureParser(parser, listener);
        return parser;
    }

    private static void configureLexer(Lexer lexer, ANTLRErrorListener listener) {
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
    }

    private static void configureParser(Parser parser, ANTLRErrorListener listener) {
        parser.removeErrorListeners();
        parser.addErrorListener(listener);
        parser.setErrorHandler(new DefaultErrorStrategy());
    }

    /**
     * Counts syntax errors instead of printing them.
     */
    public static class SyntaxErrorCounter extends BaseErrorListener {
        private int count;

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            count++;
        }

        public int getCount() {
            return count;
        }
    }
}
