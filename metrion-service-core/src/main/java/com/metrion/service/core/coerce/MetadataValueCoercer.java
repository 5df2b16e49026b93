package com.metrion.service.core.coerce;

import com.metrion.query.model.FilterExpression;
import com.metrion.service.core.error.InvalidValueException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts the textual value of a metadata filter into the type the caller declared, or infers one
 * when no type was given.
 */
@Component
@Slf4j
public class MetadataValueCoercer {

    private static final Set<String> TRUE_TOKENS = Set.of("1", "t", "true", "on", "y", "yes");
    private static final Set<String> FALSE_TOKENS = Set.of("0", "f", "false", "off", "n", "no");
    // Double.parseDouble also takes hex floats and d/f suffixes; those are not valid here
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?((\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|inf(inity)?|nan)", Pattern.CASE_INSENSITIVE);

    public Object coerce(FilterExpression expression) {
        String raw = expression.value();
        if (!expression.hasDeclaredType()) {
            Optional<Object> literal = LiteralValueParser.parse(raw);
            if (literal.isEmpty()) {
                log.debug("Failed to convert the metadata value {} automatically, keeping it as a string", raw);
                return raw;
            }
            return literal.get();
        }

        ValueType type = ValueType.fromDeclared(expression.type());
        switch (type) {
            case INTEGER:
                return parseInteger(raw);
            case FLOAT:
                return parseFloat(raw);
            case BOOLEAN:
                return parseBoolean(raw);
            default:
                return raw;
        }
    }

    private long parseInteger(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidValueException(raw, ValueType.INTEGER.wireValue(), e);
        }
    }

    private double parseFloat(String raw) {
        String s = raw.trim();
        if (!DECIMAL.matcher(s).matches()) {
            throw new InvalidValueException(raw, ValueType.FLOAT.wireValue());
        }
        String lower = s.toLowerCase(Locale.ROOT);
        boolean negative = lower.startsWith("-");
        String unsigned = lower.replaceFirst("^[+-]", "");
        if (unsigned.startsWith("inf")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (unsigned.equals("nan")) {
            return Double.NaN;
        }
        return Double.parseDouble(s);
    }

    private boolean parseBoolean(String raw) {
        String token = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) return true;
        if (FALSE_TOKENS.contains(token)) return false;
        throw new InvalidValueException(raw, ValueType.BOOLEAN.wireValue());
    }
}
