package org.dxworks.alhconverter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A condition that enables or disables an alarm, in both of its notations: the FORCEPV lines
 * of alarm handler files and the filter expression of Phoebus.
 *
 * <p>A single-PV filter compares one PV against the value. A CALC filter compares an
 * expression over the slots A to F, each of which names a PV.
 *
 * <p>{@code enabling == true} means the alarm is enabled while the expression holds; this is
 * what Phoebus does by default and corresponds to a {@code -----} force mask. Otherwise the
 * comparison is negated and the force mask is {@code CD---}.
 */
public final class FilterExpression {

    private static final String SLOT_LETTERS = "ABCDEF";
    private static final Pattern SLOT_PATTERN =
            Pattern.compile("(?<![A-Za-z0-9_:.$])([A-F])(?![A-Za-z0-9_:.$])");
    private static final Pattern SINGLE_EQUALS = Pattern.compile("(?<![=!<>])=(?!=)");

    private final boolean calc;
    private String expr;
    private FilterValue value;
    private boolean enabling;
    private final SortedMap<Character, String> replacements = new TreeMap<>();

    private FilterExpression(boolean calc, String expr, FilterValue value, boolean enabling) {
        this.calc = calc;
        this.expr = expr == null ? "" : expr;
        this.value = Objects.requireNonNull(value, "value");
        this.enabling = enabling;
    }

    public static FilterExpression forPv(String pv, FilterValue value, boolean enabling) {
        return new FilterExpression(false, pv, value, enabling);
    }

    public static FilterExpression forCalc(String expr, FilterValue value, boolean enabling) {
        return new FilterExpression(true, expr, value, enabling);
    }

    public static FilterExpression forCalc(String expr, FilterValue value, boolean enabling,
                                           Map<Character, String> replacements) {
        FilterExpression filter = forCalc(expr, value, enabling);
        replacements.forEach(filter::setSlot);
        return filter;
    }

    public FilterExpression copy() {
        FilterExpression copy = new FilterExpression(calc, expr, value, enabling);
        copy.replacements.putAll(replacements);
        return copy;
    }

    public boolean isCalc() {
        return calc;
    }

    public String getExpr() {
        return expr;
    }

    public void setExpr(String expr) {
        this.expr = expr == null ? "" : expr.trim();
    }

    public FilterValue getValue() {
        return value;
    }

    public boolean isEnabling() {
        return enabling;
    }

    public void setEnabling(boolean enabling) {
        this.enabling = enabling;
    }

    /**
     * @throws IllegalArgumentException for slots other than A to F
     */
    public void setSlot(char slot, String pv) {
        if (SLOT_LETTERS.indexOf(slot) < 0) {
            throw new IllegalArgumentException("unknown CALC slot " + slot);
        }
        replacements.put(slot, pv.trim());
    }

    /** All slot assignments, including ones the expression does not use. */
    public Map<Character, String> getReplacements() {
        return Collections.unmodifiableMap(replacements);
    }

    /** Slot assignments the expression refers to, sorted by letter. */
    public SortedMap<Character, String> usedReplacements() {
        TreeSet<Character> referenced = new TreeSet<>();
        Matcher matcher = SLOT_PATTERN.matcher(expr);
        while (matcher.find()) {
            referenced.add(matcher.group(1).charAt(0));
        }
        SortedMap<Character, String> used = new TreeMap<>();
        for (Character slot : referenced) {
            String pv = replacements.get(slot);
            if (pv != null && !pv.isEmpty()) {
                used.put(slot, pv);
            }
        }
        return used;
    }

    /**
     * The FORCEPV lines of this filter for a channel with the given latching flag.
     */
    public List<String> toLegacyLines(boolean latching) {
        String mask = AlhMask.of(enabling, latching);
        List<String> lines = new ArrayList<>();

        if (!calc) {
            lines.add("$FORCEPV " + expr + " " + mask + " " + value.legacyText() + " NE");
            return lines;
        }

        lines.add("$FORCEPV CALC " + mask + " " + value.legacyText() + " NE");
        lines.add("$FORCEPV_CALC " + expr);
        for (Map.Entry<Character, String> slot : usedReplacements().entrySet()) {
            lines.add("$FORCEPV_CALC_" + slot.getKey() + " " + slot.getValue());
        }
        return lines;
    }

    public List<String> toLegacyLines() {
        return toLegacyLines(true);
    }

    /**
     * The filter expression as Phoebus expects it.
     */
    public String toTargetString() {
        String text = SINGLE_EQUALS.matcher(expr).replaceAll(" == ");
        text = text.replace("#", " != ");
        text = substituteSlots(text);

        if (value.isBooleanShortcut()) {
            return enabling ? text : "!(" + text + ")";
        }
        return "(" + text + ")" + (enabling ? " == " : " != ") + value;
    }

    private String substituteSlots(String text) {
        Map<Character, String> used = usedReplacements();
        if (used.isEmpty()) {
            return text;
        }
        Matcher matcher = SLOT_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            char slot = matcher.group(1).charAt(0);
            String pv = used.getOrDefault(slot, matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(pv));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return toTargetString();
    }
}
