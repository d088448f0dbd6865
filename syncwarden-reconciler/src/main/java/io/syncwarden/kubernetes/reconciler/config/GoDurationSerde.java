/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.config;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;

/**
 * Jackson support for durations written the way the sync pipeline settings have always been written:
 * a sequence of decimal numbers each followed by a unit, such as {@code 15s}, {@code 1h30m} or {@code 1.5h}.
 * Supported units are h, m, s, ms, us (or µs) and ns.
 */
public class GoDurationSerde {

    private GoDurationSerde() {
    }

    private record Unit(String symbol, ChronoUnit chronoUnit) {
        long nanos() {
            return chronoUnit.getDuration().toNanos();
        }
    }

    private static final List<Unit> UNITS = List.of(
            new Unit("ns", ChronoUnit.NANOS),
            new Unit("us", ChronoUnit.MICROS),
            new Unit("µs", ChronoUnit.MICROS),
            new Unit("ms", ChronoUnit.MILLIS),
            new Unit("h", ChronoUnit.HOURS),
            new Unit("m", ChronoUnit.MINUTES),
            new Unit("s", ChronoUnit.SECONDS));

    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|h|m|s)");
    private static final Pattern WHOLE = Pattern.compile("(?:\\d+(?:\\.\\d+)?(?:ns|us|µs|ms|h|m|s))+");

    /**
     * @param text a duration such as {@code 1h30m}
     * @return the duration
     * @throws IllegalArgumentException if the text is not a duration
     */
    public static Duration parse(String text) {
        if ("0".equals(text)) {
            return Duration.ZERO;
        }
        boolean negative = text.startsWith("-");
        String unsigned = negative || text.startsWith("+") ? text.substring(1) : text;
        if (!WHOLE.matcher(unsigned).matches()) {
            throw new IllegalArgumentException("Invalid duration '" + text + "'. Expected a duration such as \"15s\", \"1h30m\" or \"1.5h\"");
        }
        Matcher matcher = COMPONENT.matcher(unsigned);
        BigDecimal nanos = BigDecimal.ZERO;
        while (matcher.find()) {
            BigDecimal amount = new BigDecimal(matcher.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(unitNamed(matcher.group(2)).nanos())));
        }
        try {
            Duration duration = Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
            return negative ? duration.negated() : duration;
        }
        catch (ArithmeticException e) {
            throw new IllegalArgumentException("Invalid duration '" + text + "'. It is too large", e);
        }
    }

    /**
     * @param duration a duration
     * @return the shortest text that {@link #parse(String)} reads back as the same duration
     */
    public static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        StringBuilder result = new StringBuilder();
        Duration remaining = duration;
        if (remaining.isNegative()) {
            result.append('-');
            remaining = remaining.negated();
        }
        for (ChronoUnit unit : List.of(ChronoUnit.HOURS, ChronoUnit.MINUTES, ChronoUnit.SECONDS, ChronoUnit.MILLIS, ChronoUnit.MICROS, ChronoUnit.NANOS)) {
            long whole = remaining.dividedBy(unit.getDuration());
            if (whole != 0) {
                result.append(whole).append(symbolOf(unit));
                remaining = remaining.minus(unit.getDuration().multipliedBy(whole));
            }
        }
        return result.toString();
    }

    private static Unit unitNamed(String symbol) {
        return UNITS.stream().filter(u -> u.symbol().equals(symbol)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown unit " + symbol));
    }

    private static String symbolOf(ChronoUnit unit) {
        return UNITS.stream().filter(u -> u.chronoUnit() == unit).findFirst().map(Unit::symbol)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported unit " + unit));
    }

    public static class Deserializer extends StdScalarDeserializer<Duration> {

        public Deserializer() {
            super(Duration.class);
        }

        @Override
        public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_STRING)) {
                throw new JsonParseException(p, "Invalid duration. Expected a string value, but was " + p.currentToken());
            }
            try {
                return parse(p.getText());
            }
            catch (IllegalArgumentException e) {
                throw new JsonParseException(p, e.getMessage(), e);
            }
        }
    }

    public static class Serializer extends StdScalarSerializer<Duration> {

        public Serializer() {
            super(Duration.class);
        }

        @Override
        public void serialize(Duration value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(format(value));
        }
    }
}
