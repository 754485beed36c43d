package org.dxworks.alhconverter.parser;

import java.util.Locale;

/**
 * Keywords of the alarm handler configuration format. {@link #UNKNOWN} covers everything else.
 */
public enum AlhKeyword {
    GROUP("GROUP"),
    INCLUDE("INCLUDE"),
    CHANNEL("CHANNEL"),
    ALIAS("$ALIAS"),
    SEVRPV("$SEVRPV"),
    GUIDANCE("$GUIDANCE"),
    COMMAND("$COMMAND"),
    SEVRCOMMAND("$SEVRCOMMAND"),
    ALARMCOUNTFILTER("$ALARMCOUNTFILTER"),
    FORCEPV("$FORCEPV"),
    FORCEPV_CALC("$FORCEPV_CALC"),
    STATCOMMAND("$STATCOMMAND"),
    HEARTBEATPV("$HEARTBEATPV"),
    ACKPV("$ACKPV"),
    BEEPSEVERITY("$BEEPSEVERITY"),
    BEEPSEVR("$BEEPSEVR"),
    UNKNOWN(null);

    private final String token;

    AlhKeyword(String token) {
        this.token = token;
    }

    public static AlhKeyword fromToken(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        for (AlhKeyword keyword : values()) {
            if (upper.equals(keyword.token)) {
                return keyword;
            }
        }
        return UNKNOWN;
    }
}
