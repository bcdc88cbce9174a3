package com.nsqlexec.program;

import com.nsqlexec.exec.FailureKind;
import com.nsqlexec.exec.QueryExecutionException;
import com.nsqlexec.program.SqlTokenizer.Token;
import com.nsqlexec.program.SqlTokenizer.Type;
import com.nsqlexec.program.ast.HybridQuery;
import com.nsqlexec.program.ast.NeuralLeaf;
import com.nsqlexec.program.ast.ProgramNode;
import com.nsqlexec.program.ast.WholeQueryFallback;
import org.apache.calcite.avatica.util.Casing;
import org.apache.calcite.avatica.util.Quoting;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.parser.babel.SqlBabelParserImpl;
import org.apache.calcite.sql.validate.SqlConformanceEnum;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a normalized hybrid program into a {@link ProgramNode} tree.
 *
 * <p>{@code QA(...)} calls are lifted out of the text first and replaced by back-quoted
 * placeholders ({@code `__qa_0`}, ...); the remaining relational text is parsed with Calcite's
 * Babel parser and turned into a plan by {@link PlanBuilder}. A program that is nothing but a
 * single {@code QA("ans@...")} call is the whole-query fallback.
 */
public class ProgramParser {

    public static final String PLACEHOLDER_PREFIX = "__qa_";

    private static final SqlParser.Config PARSER_CONFIG = SqlParser.config()
            .withParserFactory(SqlBabelParserImpl.FACTORY)
            .withConformance(SqlConformanceEnum.BABEL)
            .withQuoting(Quoting.BACK_TICK)
            .withCaseSensitive(false)
            .withUnquotedCasing(Casing.UNCHANGED)
            .withQuotedCasing(Casing.UNCHANGED)
            .withIdentifierMaxLength(1024);

    private final PlanBuilder planBuilder;

    public ProgramParser() {
        this(new PlanBuilder());
    }

    public ProgramParser(PlanBuilder planBuilder) {
        this.planBuilder = planBuilder;
    }

    public ProgramNode parse(String program) throws QueryExecutionException {
        if (program == null || program.trim().isEmpty()) {
            throw QueryExecutionException.parse("empty program");
        }
        String text = program.trim();
        while (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }

        List<Token> tokens = SqlTokenizer.tokenize(text);
        WholeQueryFallback fallback = wholeQueryFallback(tokens);
        if (fallback != null) {
            return fallback;
        }

        List<NeuralLeaf> leaves = new ArrayList<>();
        String relational = liftLeaves(tokens, leaves);
        return new HybridQuery(leaves, planBuilder.build(parseSql(relational)));
    }

    static SqlNode parseSql(String sql) throws QueryExecutionException {
        try {
            return SqlParser.create(sql, PARSER_CONFIG).parseQuery();
        } catch (SqlParseException | RuntimeException e) {
            throw new QueryExecutionException(FailureKind.PARSE_ERROR, firstLine(e.getMessage()), e);
        }
    }

    private WholeQueryFallback wholeQueryFallback(List<Token> tokens) throws QueryExecutionException {
        int first = SqlTokenizer.skipWhitespace(tokens, 0);
        if (first < 0 || !isQaCall(tokens, first)) {
            return null;
        }
        QaCall call = readQaCall(tokens, first);
        if (SqlTokenizer.skipWhitespace(tokens, call.end) >= 0) {
            return null;
        }
        if (NeuralLeaf.kindOf(call.question) != NeuralLeaf.Kind.ANSWER) {
            return null;
        }
        return new WholeQueryFallback(NeuralLeaf.stripMarker(call.question), call.columns);
    }

    /**
     * Replaces every QA call by a placeholder identifier, collecting one leaf per distinct call.
     */
    private String liftLeaves(List<Token> tokens, List<NeuralLeaf> leaves) throws QueryExecutionException {
        Map<String, NeuralLeaf> distinct = new LinkedHashMap<>();
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (isQaCall(tokens, i)) {
                QaCall call = readQaCall(tokens, i);
                String key = call.question + "\u0000" + call.columns;
                NeuralLeaf leaf = distinct.get(key);
                if (leaf == null) {
                    leaf = new NeuralLeaf(PLACEHOLDER_PREFIX + distinct.size(), call.question, call.columns);
                    distinct.put(key, leaf);
                }
                out.append(SqlTokenizer.quoteIdentifier(leaf.getPlaceholder()));
                i = call.end;
            } else if (token.isSymbol("==")) {
                out.append('=');
                i++;
            } else {
                out.append(token.getText());
                i++;
            }
        }
        leaves.addAll(distinct.values());
        return out.toString();
    }

    private static boolean isQaCall(List<Token> tokens, int index) {
        if (!tokens.get(index).isWord("QA")) {
            return false;
        }
        int next = SqlTokenizer.skipWhitespace(tokens, index + 1);
        return next >= 0 && tokens.get(next).isSymbol("(");
    }

    private static QaCall readQaCall(List<Token> tokens, int start) throws QueryExecutionException {
        int open = SqlTokenizer.skipWhitespace(tokens, start + 1);
        List<List<Token>> arguments = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (int i = open + 1; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                if (depth == 0) {
                    arguments.add(current);
                    return toCall(arguments, i + 1);
                }
                depth--;
            } else if (depth == 0 && (token.isSymbol(";") || token.isSymbol(","))) {
                arguments.add(current);
                current = new ArrayList<>();
                continue;
            }
            if (!token.is(Type.WHITESPACE)) {
                current.add(token);
            }
        }
        throw QueryExecutionException.parse("unterminated QA call");
    }

    private static QaCall toCall(List<List<Token>> arguments, int end) throws QueryExecutionException {
        List<Token> question = arguments.get(0);
        if (question.size() != 1 || !(question.get(0).is(Type.STRING) || question.get(0).is(Type.DQ_STRING))) {
            throw QueryExecutionException.parse("QA call must start with a quoted question");
        }
        List<String> columns = new ArrayList<>();
        for (int a = 1; a < arguments.size(); a++) {
            List<Token> argument = arguments.get(a);
            if (argument.isEmpty()) {
                continue;
            }
            Token column = argument.get(0);
            if (argument.size() != 1 || column.is(Type.SYMBOL) || column.is(Type.NUMBER)) {
                throw QueryExecutionException.parse("unsupported QA argument: " + SqlTokenizer.join(argument));
            }
            columns.add(column.getValue());
        }
        return new QaCall(question.get(0).getValue(), columns, end);
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "parse error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static class QaCall {
        final String question;
        final List<String> columns;
        /** Index of the first token after the closing parenthesis. */
        final int end;

        QaCall(String question, List<String> columns, int end) {
            this.question = question;
            this.columns = columns;
            this.end = end;
        }
    }
}
