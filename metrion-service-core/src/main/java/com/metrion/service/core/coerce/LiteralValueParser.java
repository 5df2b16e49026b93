package com.metrion.service.core.coerce;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Safe literal evaluation for untyped metadata values: integers, floats, {@code True}/{@code False},
 * quoted strings, and list or map literals. Integers are always {@code Long} (or {@code BigInteger}
 * past its range), nested ones included. Lowercase {@code true} is not a literal. Nothing is ever
 * executed; anything that is not a literal yields empty.
 */
public final class LiteralValueParser {

    private static final ObjectMapper LITERALS = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.USE_LONG_FOR_INTS)
            .build();

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT =
            Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");

    private LiteralValueParser() {}

    public static Optional<Object> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String s = text.trim();
        if (s.isEmpty()) {
            return Optional.empty();
        }
        if (INTEGER.matcher(s).matches()) {
            try {
                return Optional.of(Long.valueOf(s));
            } catch (NumberFormatException overflow) {
                return Optional.of(new BigInteger(s));
            }
        }
        if (FLOAT.matcher(s).matches()) {
            return Optional.of(Double.valueOf(s));
        }
        if ("True".equals(s)) return Optional.of(Boolean.TRUE);
        if ("False".equals(s)) return Optional.of(Boolean.FALSE);

        char first = s.charAt(0);
        if (first == '[' || first == '{' || first == '"' || first == '\'') {
            try {
                return Optional.of(LITERALS.readValue(s, Object.class));
            } catch (JsonProcessingException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
