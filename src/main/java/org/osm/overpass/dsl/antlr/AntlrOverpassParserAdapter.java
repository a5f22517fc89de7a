package org.osm.overpass.dsl.antlr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.osm.overpass.dsl.OverpassParseException;
import org.osm.overpass.dsl.OverpassRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR-based Overpass QL parser using the OverpassQL grammar.
 */
public final class AntlrOverpassParserAdapter {

    private static final Logger logger = LoggerFactory.getLogger(AntlrOverpassParserAdapter.class);

    private AntlrOverpassParserAdapter() {
        // Static utility class
    }

    /**
     * Parses an Overpass request.
     *
     * @param query The query text
     * @return The request AST
     * @throws OverpassParseException if the query is not valid Overpass QL
     */
    public static OverpassRequest parse(String query) {
        OverpassQLParser.RequestContext tree = parseTree(query);
        OverpassRequest request = new OverpassAstBuilder().visitRequest(tree);
        logger.debug("Parsed request with {} statements", request.statements().size());
        return request;
    }

    /**
     * Parses an Overpass request into the raw ANTLR tree.
     *
     * @throws OverpassParseException if the query is not valid Overpass QL
     */
    public static OverpassQLParser.RequestContext parseTree(String query) {
        OverpassQLLexer lexer = new OverpassQLLexer(CharStreams.fromString(query));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        OverpassQLParser parser = new OverpassQLParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());

        return parser.request();
    }

    /**
     * Error listener that converts ANTLR errors to OverpassParseException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            int offset = -1;
            List<String> expected = List.of();
            if (offendingSymbol instanceof Token token) {
                offset = token.getStartIndex();
            } else if (recognizer instanceof Lexer lexer) {
                offset = lexer._tokenStartCharIndex;
            }
            if (recognizer instanceof Parser parser) {
                expected = expectedTokens(parser.getExpectedTokens(), parser.getVocabulary());
            }
            logger.debug("Syntax error at {}:{} - {}", line, charPositionInLine, msg);
            throw new OverpassParseException(msg, line, charPositionInLine, offset, expected);
        }

        private static List<String> expectedTokens(IntervalSet set, Vocabulary vocabulary) {
            List<String> names = new ArrayList<>();
            for (int type : set.toList()) {
                names.add(vocabulary.getDisplayName(type));
            }
            return names;
        }
    }
}
