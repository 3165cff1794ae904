package com.sandy.aiot.rack.control.tools;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Parsing of the small scalar payloads racks publish: "0"/"1" flags, integer actuator
 * values and decimal readings. Anything unparseable comes back empty.
 */
public final class PayloadParser {

    private PayloadParser() {
    }

    public static OptionalDouble parseDecimal(String payload) {
        if (payload == null) return OptionalDouble.empty();
        String s = payload.trim();
        if (s.isEmpty()) return OptionalDouble.empty();
        try {
            double v = Double.parseDouble(s);
            if (Double.isNaN(v) || Double.isInfinite(v)) return OptionalDouble.empty();
            return OptionalDouble.of(v);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /** Integer payload; "1.0" style decimals with no fraction are accepted. */
    public static OptionalInt parseInteger(String payload) {
        OptionalDouble d = parseDecimal(payload);
        if (d.isEmpty()) return OptionalInt.empty();
        double v = d.getAsDouble();
        if (v != Math.rint(v) || v > Integer.MAX_VALUE || v < Integer.MIN_VALUE) return OptionalInt.empty();
        return OptionalInt.of((int) v);
    }

    public static Optional<Boolean> parseFlag(String payload) {
        if (payload == null) return Optional.empty();
        String s = payload.trim().toLowerCase();
        switch (s) {
            case "1":
            case "true":
            case "on":
            case "open":
                return Optional.of(Boolean.TRUE);
            case "0":
            case "false":
            case "off":
            case "closed":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }

    public static String encode(int value) {
        return Integer.toString(value);
    }

    public static String encode(boolean flag) {
        return flag ? "1" : "0";
    }
}
