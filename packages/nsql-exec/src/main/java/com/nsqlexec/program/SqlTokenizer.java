package com.nsqlexec.program;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lossless lexer for generated program text. Concatenating the raw text of all tokens gives the
 * input back, so rewriting passes can replace single tokens and re-join. Never fails: an
 * unterminated quote simply runs to the end of the input.
 */
public final class SqlTokenizer {

    public enum Type {
        WHITESPACE,
        WORD,
        NUMBER,
        /** `identifier` */
        BACKTICK,
        /** 'string' */
        STRING,
        /** "double quoted", either a string or an identifier depending on context */
        DQ_STRING,
        SYMBOL
    }

    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "SELECT", "FROM", "WHERE", "AND", "OR", "NOT", "IN", "IS", "NULL", "LIKE", "ILIKE",
            "BETWEEN", "GROUP", "BY", "ORDER", "HAVING", "LIMIT", "OFFSET", "AS", "ASC", "DESC",
            "DISTINCT", "ALL", "COUNT", "SUM", "AVG", "MIN", "MAX", "CASE", "WHEN", "THEN", "ELSE",
            "END", "CAST", "EXISTS", "UNION", "JOIN", "ON", "INNER", "LEFT", "RIGHT", "OUTER",
            "TRUE", "FALSE", "INT", "INTEGER", "REAL", "TEXT", "FLOAT", "DOUBLE", "DECIMAL",
            "NUMERIC", "VARCHAR", "CHAR", "ABS", "LOWER", "UPPER", "LENGTH", "ROUND", "COALESCE",
            "IFNULL", "SUBSTR", "SUBSTRING", "TRIM", "NULLS", "FIRST", "LAST", "QA"));

    private static final String[] MULTI_CHAR_SYMBOLS = {"<=", ">=", "<>", "!=", "==", "||"};

    public static final class Token {
        private final Type type;
        private final String text;
        private final int start;

        Token(Type type, String text, int start) {
            this.type = type;
            this.text = text;
            this.start = start;
        }

        public Type getType() { return type; }
        /** Raw text including quotes. */
        public String getText() { return text; }
        public int getStart() { return start; }
        public int getEnd() { return start + text.length(); }

        /** Content without quotes, with doubled quote characters collapsed. */
        public String getValue() {
            switch (type) {
                case BACKTICK:
                    return unquote('`');
                case STRING:
                    return unquote('\'');
                case DQ_STRING:
                    return unquote('"');
                default:
                    return text;
            }
        }

        public boolean is(Type expected) {
            return type == expected;
        }

        public boolean isWord(String word) {
            return type == Type.WORD && text.equalsIgnoreCase(word);
        }

        public boolean isSymbol(String symbol) {
            return type == Type.SYMBOL && text.equals(symbol);
        }

        public boolean isKeyword() {
            return type == Type.WORD && KEYWORDS.contains(text.toUpperCase(Locale.ROOT));
        }

        private String unquote(char quote) {
            String body = text.substring(1);
            if (body.endsWith(String.valueOf(quote))) {
                body = body.substring(0, body.length() - 1);
            }
            String doubled = String.valueOf(quote) + quote;
            return body.replace(doubled, String.valueOf(quote));
        }

        @Override
        public String toString() {
            return type + "(" + text + ")";
        }
    }

    private SqlTokenizer() {
    }

    public static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        if (input == null) {
            return tokens;
        }
        int i = 0;
        int n = input.length();
        while (i < n) {
            char c = input.charAt(i);
            int start = i;
            if (Character.isWhitespace(c)) {
                while (i < n && Character.isWhitespace(input.charAt(i))) i++;
                tokens.add(new Token(Type.WHITESPACE, input.substring(start, i), start));
            } else if (c == '`' || c == '\'' || c == '"') {
                i = scanQuoted(input, i, c);
                Type type = c == '`' ? Type.BACKTICK : c == '\'' ? Type.STRING : Type.DQ_STRING;
                tokens.add(new Token(type, input.substring(start, i), start));
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(input.charAt(i + 1)))) {
                while (i < n && (Character.isDigit(input.charAt(i)) || input.charAt(i) == '.')) i++;
                if (i < n && (input.charAt(i) == 'e' || input.charAt(i) == 'E')) {
                    int j = i + 1;
                    if (j < n && (input.charAt(j) == '+' || input.charAt(j) == '-')) j++;
                    if (j < n && Character.isDigit(input.charAt(j))) {
                        i = j;
                        while (i < n && Character.isDigit(input.charAt(i))) i++;
                    }
                }
                // 2nd, 10th ... are words, not numbers
                if (i < n && (Character.isLetter(input.charAt(i)) || input.charAt(i) == '_')) {
                    while (i < n && isWordChar(input.charAt(i))) i++;
                    tokens.add(new Token(Type.WORD, input.substring(start, i), start));
                } else {
                    tokens.add(new Token(Type.NUMBER, input.substring(start, i), start));
                }
            } else if (Character.isLetter(c) || c == '_') {
                while (i < n && isWordChar(input.charAt(i))) i++;
                tokens.add(new Token(Type.WORD, input.substring(start, i), start));
            } else {
                String symbol = String.valueOf(c);
                for (String multi : MULTI_CHAR_SYMBOLS) {
                    if (input.startsWith(multi, i)) {
                        symbol = multi;
                        break;
                    }
                }
                i += symbol.length();
                tokens.add(new Token(Type.SYMBOL, symbol, start));
            }
        }
        return tokens;
    }

    private static int scanQuoted(String input, int start, char quote) {
        int i = start + 1;
        int n = input.length();
        while (i < n) {
            if (input.charAt(i) == quote) {
                if (i + 1 < n && input.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return n;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    public static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.getText());
        }
        return sb.toString();
    }

    /** Index of the next non-whitespace token at or after {@code from}, or -1. */
    public static int skipWhitespace(List<Token> tokens, int from) {
        for (int i = from; i < tokens.size(); i++) {
            if (!tokens.get(i).is(Type.WHITESPACE)) {
                return i;
            }
        }
        return -1;
    }

    /** Index of the previous non-whitespace token at or before {@code from}, or -1. */
    public static int previousNonWhitespace(List<Token> tokens, int from) {
        for (int i = from; i >= 0; i--) {
            if (!tokens.get(i).is(Type.WHITESPACE)) {
                return i;
            }
        }
        return -1;
    }

    public static Token backtick(String identifier, int start) {
        return new Token(Type.BACKTICK, quoteIdentifier(identifier), start);
    }

    public static Token string(String value, int start) {
        return new Token(Type.STRING, "'" + value.replace("'", "''") + "'", start);
    }

    public static String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
