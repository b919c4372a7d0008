package com.cubloc.playground.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits one source line into upper-cased keyword/identifier tokens.
 * String literals, numbers and operators are skipped; a {@code '} or the word {@code REM}
 * outside a string ends the line. Unterminated strings run to the end of the line.
 */
public final class BasicTokenizer {

    private BasicTokenizer() {
    }

    public static List<Token> tokenize(String line) {
        List<Token> tokens = new ArrayList<>();
        boolean inString = false;

        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);

            if (inString) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }

            if (ch == '"') {
                inString = true;
                continue;
            }

            if (ch == '\'') {
                break;
            }

            if (LineScanner.isIdentifierStart(ch)) {
                int start = i;
                int end = LineScanner.identifierEnd(line, start);
                String word = line.substring(start, end).toUpperCase(Locale.ROOT);
                if (word.equals("REM")) {
                    break;
                }
                tokens.add(new Token(word, start, end - start));
                i = end - 1;
            }
        }

        return tokens;
    }
}
