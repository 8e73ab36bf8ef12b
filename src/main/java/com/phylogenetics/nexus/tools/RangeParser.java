package com.phylogenetics.nexus.tools;

import java.util.ArrayList;
import java.util.List;

import com.phylogenetics.nexus.exception.ValueParseException;

import lombok.experimental.UtilityClass;

/**
 * Parses index range expressions such as {@code 1,3,4-6,8,9:10}.
 *
 * Items are separated by commas; a range uses '-' or ':' and includes both ends.
 */
@UtilityClass
public class RangeParser {

    public static List<Integer> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValueParseException("Empty range expression");
        }

        List<Integer> values = new ArrayList<>();
        for (String chunk : expression.split(",", -1)) {
            String item = chunk.strip();
            String[] bounds = item.split("[-:]", -1);

            if (bounds.length == 1) {
                values.add(parseNumber(item, expression));
            } else if (bounds.length == 2) {
                int first = parseNumber(bounds[0], expression);
                int last = parseNumber(bounds[1], expression);
                if (first > last) {
                    throw new ValueParseException("Reversed range '" + item + "' in '" + expression + "'");
                }
                for (int i = first; i <= last; i++) {
                    values.add(i);
                }
            } else {
                throw new ValueParseException("Invalid range '" + item + "' in '" + expression + "'");
            }
        }
        return values;
    }

    private static int parseNumber(String token, String expression) {
        try {
            return Integer.parseInt(token.strip());
        } catch (NumberFormatException e) {
            throw new ValueParseException("Not a number: '" + token.strip() + "' in '" + expression + "'", e);
        }
    }
}
