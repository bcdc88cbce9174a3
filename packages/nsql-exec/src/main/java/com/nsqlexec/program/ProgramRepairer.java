package com.nsqlexec.program;

import com.nsqlexec.exec.SqlValues;
import com.nsqlexec.program.SqlTokenizer.Token;
import com.nsqlexec.program.SqlTokenizer.Type;
import com.nsqlexec.table.FuzzyMatcher;
import com.nsqlexec.table.TableStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Best-effort syntax and literal repair applied after normalization.
 * <ul>
 *   <li>Double-quoted tokens outside QA calls become back-quoted identifiers when they name a
 *       column, single-quoted strings otherwise.</li>
 *   <li>A string literal compared with {@code =}, {@code !=} or {@code <>} to a column but
 *       absent from that column is replaced with the matching cell value.</li>
 * </ul>
 * Callers must tolerate this pass throwing; its output is only an improvement.
 */
public class ProgramRepairer {

    static final double VALUE_SIMILARITY = 0.8;

    public String repair(String program, TableStore table) {
        List<Token> tokens = fixDoubleQuotes(SqlTokenizer.tokenize(program), table);
        tokens = fixComparedLiterals(tokens, table);
        return SqlTokenizer.join(tokens);
    }

    private List<Token> fixDoubleQuotes(List<Token> tokens, TableStore table) {
        List<Token> out = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.is(Type.DQ_STRING) || isQaArgument(tokens, i)) {
                out.add(token);
                continue;
            }
            int column = table.resolveColumn(token.getValue());
            if (column >= 0) {
                out.add(SqlTokenizer.backtick(table.getColumns().get(column), token.getStart()));
            } else {
                out.add(SqlTokenizer.string(token.getValue(), token.getStart()));
            }
        }
        return out;
    }

    private List<Token> fixComparedLiterals(List<Token> tokens, TableStore table) {
        List<Token> out = new ArrayList<>(tokens);
        for (int i = 0; i < out.size(); i++) {
            if (!out.get(i).is(Type.STRING)) {
                continue;
            }
            int op = SqlTokenizer.previousNonWhitespace(out, i - 1);
            if (op < 0 || !isEqualityOperator(out.get(op))) {
                continue;
            }
            int col = SqlTokenizer.previousNonWhitespace(out, op - 1);
            if (col < 0 || !out.get(col).is(Type.BACKTICK)) {
                continue;
            }
            int column = table.indexOf(out.get(col).getValue());
            if (column < 0) {
                continue;
            }
            String replacement = matchCellValue(out.get(i).getValue(), table.getColumnValues(column));
            if (replacement != null) {
                out.set(i, SqlTokenizer.string(replacement, out.get(i).getStart()));
            }
        }
        return out;
    }

    /**
     * Returns the cell value the literal was meant to denote, or null if the literal is already
     * present, numeric, or has no close counterpart.
     */
    String matchCellValue(String literal, List<Object> cells) {
        if (SqlValues.toNumber(literal) != null) {
            return null;
        }
        Set<String> values = new LinkedHashSet<>();
        for (Object cell : cells) {
            if (cell != null) {
                values.add(cell.toString());
            }
        }
        if (values.contains(literal)) {
            return null;
        }
        String closest = FuzzyMatcher.closest(literal, values, VALUE_SIMILARITY);
        return closest == null || closest.equals(literal) ? null : closest;
    }

    private static boolean isEqualityOperator(Token token) {
        return token.isSymbol("=") || token.isSymbol("==") || token.isSymbol("!=") || token.isSymbol("<>");
    }

    private static boolean isQaArgument(List<Token> tokens, int index) {
        int paren = SqlTokenizer.previousNonWhitespace(tokens, index - 1);
        if (paren < 0 || !tokens.get(paren).isSymbol("(")) {
            return false;
        }
        int name = SqlTokenizer.previousNonWhitespace(tokens, paren - 1);
        return name >= 0 && tokens.get(name).isWord("QA");
    }
}
