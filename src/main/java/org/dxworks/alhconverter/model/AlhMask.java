package org.dxworks.alhconverter.model;

/**
 * The five letter channel and force masks of alarm handler files.
 *
 * <p>Positions: 0 cancel, 1 disable, 2 no-ack, 3 no-ack transient, 4 no-log. Phoebus always
 * requires acknowledgement and always logs, so positions 2 and 4 stay unset on export.
 */
public final class AlhMask {

    private AlhMask() {
        // utility class
    }

    public static String of(boolean enabled, boolean latching) {
        char[] mask = {'-', '-', '-', '-', '-'};
        if (!enabled) {
            mask[0] = 'C';
            mask[1] = 'D';
        }
        if (!latching) {
            mask[3] = 'T';
        }
        return new String(mask);
    }

    public static boolean disables(String mask) {
        return mask.indexOf('C') >= 0 || mask.indexOf('D') >= 0;
    }

    public static boolean isTransient(String mask) {
        return mask.indexOf('T') >= 0;
    }
}
