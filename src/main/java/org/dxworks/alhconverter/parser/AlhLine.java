package org.dxworks.alhconverter.parser;

import java.util.Locale;

/**
 * One non-blank, non-comment line split into keyword and arguments.
 *
 * <p>All {@code $FORCEPV_CALC...} keywords are treated as {@link AlhKeyword#FORCEPV_CALC}, with the
 * part after {@code $FORCEPV_} moved in front of the arguments: {@code $FORCEPV_CALC_A pv}
 * becomes keyword {@code FORCEPV_CALC} with arguments {@code CALC_A pv}.
 */
final class AlhLine {
    private static final String CALC_PREFIX = "$FORCEPV_CALC";

    final String token;
    final AlhKeyword keyword;
    final String args;

    private AlhLine(String token, AlhKeyword keyword, String args) {
        this.token = token;
        this.keyword = keyword;
        this.args = args;
    }

    static AlhLine split(String line) {
        String[] parts = line.strip().split("\\s+", 2);
        String token = parts[0];
        String args = parts.length > 1 ? parts[1].strip() : "";

        if (token.toUpperCase(Locale.ROOT).startsWith(CALC_PREFIX)) {
            String fragment = token.substring("$FORCEPV_".length()).toUpperCase(Locale.ROOT);
            return new AlhLine(token, AlhKeyword.FORCEPV_CALC, (fragment + " " + args).strip());
        }
        return new AlhLine(token, AlhKeyword.fromToken(token), args);
    }
}
