package com.nsqlexec.program;

import com.nsqlexec.program.SqlTokenizer.Token;
import com.nsqlexec.program.SqlTokenizer.Type;
import com.nsqlexec.table.FuzzyMatcher;
import com.nsqlexec.table.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rewrites the table and column references of a raw generated program against the actual
 * schema of the example table. Syntax is not validated here.
 *
 * <p>Normalization never fails: if rewriting throws, the raw text is returned, and if the
 * secondary {@link ProgramRepairer} pass throws, its input is returned unchanged.
 */
public class QueryNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(QueryNormalizer.class);

    static final double COLUMN_SIMILARITY = 0.6;

    private final ProgramRepairer repairer;

    public QueryNormalizer() {
        this(new ProgramRepairer());
    }

    /**
     * @param repairer secondary repair pass, or null to skip it
     */
    public QueryNormalizer(ProgramRepairer repairer) {
        this.repairer = repairer;
    }

    public String normalize(String rawText, TableStore table) {
        if (rawText == null) {
            return "";
        }

        String normalized;
        try {
            normalized = rewrite(rawText, table);
        } catch (RuntimeException e) {
            logger.debug("Normalization failed, keeping raw program text: {}", e.toString());
            return rawText;
        }

        if (repairer != null) {
            try {
                normalized = repairer.repair(normalized, table);
            } catch (RuntimeException e) {
                logger.debug("Repair pass skipped: {}", e.toString());
            }
        }
        return normalized;
    }

    String rewrite(String rawText, TableStore table) {
        List<Token> tokens = quoteMultiWordColumns(SqlTokenizer.tokenize(rawText), table);
        Set<String> aliases = collectAliases(tokens);
        List<Token> out = new ArrayList<>(tokens.size());

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            int prev = SqlTokenizer.previousNonWhitespace(tokens, i - 1);
            Token previous = prev >= 0 ? tokens.get(prev) : null;

            if (previous != null && previous.isWord("FROM") && isNameToken(token)) {
                out.add(rewriteTableReference(token, table));
            } else if (previous != null && previous.isWord("AS")) {
                out.add(token);
            } else if (token.is(Type.BACKTICK)) {
                out.add(rewriteQuotedColumn(token, table, aliases));
            } else if (token.is(Type.WORD) && !token.isKeyword() && !isFunctionName(tokens, i)) {
                out.add(rewriteBareWord(token, table, aliases));
            } else {
                out.add(token);
            }
        }
        return SqlTokenizer.join(out);
    }

    private Token rewriteTableReference(Token token, TableStore table) {
        String name = token.getValue();
        if (table.isReferencedBy(name)
                || FuzzyMatcher.similarity(name, table.getTitle()) >= COLUMN_SIMILARITY) {
            return SqlTokenizer.backtick(table.getTitle(), token.getStart());
        }
        return token;
    }

    private Token rewriteQuotedColumn(Token token, TableStore table, Set<String> aliases) {
        String name = token.getValue();
        if (table.indexOf(name) >= 0) {
            return token;
        }
        int index = table.resolveColumn(name);
        if (index < 0) {
            if (aliases.contains(name.toLowerCase(Locale.ROOT))) {
                return token;
            }
            String closest = FuzzyMatcher.closest(name, table.getColumns(), COLUMN_SIMILARITY);
            index = closest == null ? -1 : table.indexOf(closest);
        }
        if (index < 0) {
            return token;
        }
        return SqlTokenizer.backtick(table.getColumns().get(index), token.getStart());
    }

    private Token rewriteBareWord(Token token, TableStore table, Set<String> aliases) {
        String word = token.getText();
        if (aliases.contains(word.toLowerCase(Locale.ROOT)) && table.indexOf(word) < 0) {
            return token;
        }
        int index = table.resolveColumn(word);
        if (index < 0) {
            return token;
        }
        return SqlTokenizer.backtick(table.getColumns().get(index), token.getStart());
    }

    /**
     * Back-quote unquoted occurrences of column names that span several tokens
     * ({@code home team}, {@code no. of titles}). Longest names are matched first.
     */
    private List<Token> quoteMultiWordColumns(List<Token> tokens, TableStore table) {
        List<String> candidates = new ArrayList<>();
        for (String column : table.getColumns()) {
            if (significant(SqlTokenizer.tokenize(column)).size() >= 2) {
                candidates.add(column);
            }
        }
        if (candidates.isEmpty()) {
            return tokens;
        }
        candidates.sort(Comparator.comparingInt((String c) -> significant(SqlTokenizer.tokenize(c)).size()).reversed());

        List<Token> out = new ArrayList<>(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            int matchedEnd = -1;
            String matchedColumn = null;
            if (tokens.get(i).is(Type.WORD) || tokens.get(i).is(Type.NUMBER)) {
                for (String column : candidates) {
                    int end = matchSequence(tokens, i, significant(SqlTokenizer.tokenize(column)));
                    if (end > 0) {
                        matchedEnd = end;
                        matchedColumn = column;
                        break;
                    }
                }
            }
            if (matchedColumn != null) {
                out.add(SqlTokenizer.backtick(matchedColumn, tokens.get(i).getStart()));
                i = matchedEnd;
            } else {
                out.add(tokens.get(i));
                i++;
            }
        }
        return out;
    }

    /** End index (exclusive) of a whitespace-insensitive match of {@code parts} at {@code start}, or -1. */
    private int matchSequence(List<Token> tokens, int start, List<Token> parts) {
        int i = start;
        boolean allKeywords = true;
        for (int p = 0; p < parts.size(); p++) {
            if (p > 0) {
                int next = SqlTokenizer.skipWhitespace(tokens, i);
                if (next < 0) {
                    return -1;
                }
                i = next;
            }
            if (i >= tokens.size()) {
                return -1;
            }
            Token token = tokens.get(i);
            Token part = parts.get(p);
            if (token.getType() != part.getType() || !token.getText().equalsIgnoreCase(part.getText())) {
                return -1;
            }
            if (!token.isKeyword() && !token.is(Type.SYMBOL)) {
                allKeywords = false;
            }
            i++;
        }
        return allKeywords ? -1 : i;
    }

    private static List<Token> significant(List<Token> tokens) {
        List<Token> result = new ArrayList<>();
        for (Token token : tokens) {
            if (!token.is(Type.WHITESPACE)) {
                result.add(token);
            }
        }
        // quoted parts cannot be matched against unquoted program text
        for (Token token : result) {
            if (!token.is(Type.WORD) && !token.is(Type.NUMBER) && !token.is(Type.SYMBOL)) {
                return new ArrayList<>();
            }
        }
        return result;
    }

    private static Set<String> collectAliases(List<Token> tokens) {
        Set<String> aliases = new HashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isWord("AS")) {
                int next = SqlTokenizer.skipWhitespace(tokens, i + 1);
                if (next >= 0 && isNameToken(tokens.get(next))) {
                    aliases.add(tokens.get(next).getValue().toLowerCase(Locale.ROOT));
                }
            }
        }
        return aliases;
    }

    private static boolean isNameToken(Token token) {
        return token.is(Type.WORD) || token.is(Type.BACKTICK) || token.is(Type.DQ_STRING);
    }

    private static boolean isFunctionName(List<Token> tokens, int index) {
        int next = SqlTokenizer.skipWhitespace(tokens, index + 1);
        return next >= 0 && tokens.get(next).isSymbol("(");
    }
}
