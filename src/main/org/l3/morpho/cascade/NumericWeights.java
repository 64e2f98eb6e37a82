package org.l3.morpho.cascade;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared parsing for numeric weights, written {@code [0.5]} or {@code [0.5;0.25]} for alternatives. {@code []} stands
 * for the weighting's identity.
 */
final class NumericWeights {

    private NumericWeights() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static List<String> split(final String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        List<String> numbers = new ArrayList<>();
        for (String part : trimmed.split(";")) {
            if (!part.trim().isEmpty()) {
                numbers.add(part.trim());
            }
        }
        return numbers;
    }

    static double parseNumber(final String text, final String number) {
        try {
            double value = Double.parseDouble(number);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Weight " + number + " is not finite in " + text);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Weight " + number + " is not a number in " + text, e);
        }
    }
}
