/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.config;

import java.io.IOException;
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
 * Jackson support for durations written as {@code 1h30m}, {@code 45s} or {@code 500ms}.
 */
public class DurationSerde {

    private DurationSerde() {
        // prevent construction
    }

    private record Unit(ChronoUnit unit, String groupName, String serializedUnit) {}

    private static final List<Unit> UNITS = List.of(new Unit(ChronoUnit.HOURS, "hours", "h"),
            new Unit(ChronoUnit.MINUTES, "minutes", "m"),
            new Unit(ChronoUnit.SECONDS, "seconds", "s"),
            new Unit(ChronoUnit.MILLIS, "millis", "ms"));

    public static class Deserializer extends StdScalarDeserializer<Duration> {

        private static final Pattern PATTERN = Pattern.compile("(?:(?<hours>\\d+)h)?(?:(?<minutes>\\d+)m)?(?:(?<seconds>\\d+)s)?(?:(?<millis>\\d+)ms)?");

        private static final String USAGE = "Expected a string time duration such as \"1h30m\", or \"120s\"; supported units are h, m, s and ms.";

        public Deserializer() {
            super(Duration.class);
        }

        @Override
        public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_STRING)) {
                throw new JsonParseException(p, "Invalid serialized duration. Expected a string value, but was " + p.currentToken());
            }
            String text = p.getText();
            Matcher matcher = PATTERN.matcher(text);
            if (text.isBlank() || !matcher.matches()) {
                throw new JsonParseException(p, "Invalid duration string: '" + text + "'. " + USAGE);
            }
            Duration result = Duration.ZERO;
            try {
                for (Unit unit : UNITS) {
                    String amount = matcher.group(unit.groupName());
                    if (amount != null) {
                        result = result.plus(Duration.of(Long.parseLong(amount), unit.unit()));
                    }
                }
            }
            catch (ArithmeticException | NumberFormatException e) {
                throw new JsonParseException(p, "Invalid duration string: '" + text + "'. Likely it is too large to be converted to Duration: " + e.getMessage(), e);
            }
            return result;
        }
    }

    public static class Serializer extends StdScalarSerializer<Duration> {

        public Serializer() {
            super(Duration.class);
        }

        @Override
        public void serialize(Duration value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value.isZero()) {
                gen.writeString("0ms");
                return;
            }
            StringBuilder result = new StringBuilder();
            Duration remaining = value.abs();
            for (Unit unit : UNITS) {
                long wholeUnits = remaining.dividedBy(Duration.of(1, unit.unit()));
                remaining = remaining.minus(wholeUnits, unit.unit());
                if (wholeUnits != 0) {
                    result.append(wholeUnits).append(unit.serializedUnit());
                }
            }
            gen.writeString(result.toString());
        }
    }
}
