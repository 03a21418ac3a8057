package com.viewstate.drg.dsl;

/**
 * Value type of a field, with conversion to and from the string form used when
 * a field is hydrated from URL or connect params.
 */
public enum FieldType {
    STRING {
        @Override
        public Object parse(String raw) {
            return raw;
        }
    },
    INTEGER {
        @Override
        public Object parse(String raw) {
            try {
                return Long.valueOf(leadingNumber(raw, false));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("cannot parse \"" + raw + "\" as integer", e);
            }
        }
    },
    FLOAT {
        @Override
        public Object parse(String raw) {
            try {
                return Double.valueOf(leadingNumber(raw, true));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("cannot parse \"" + raw + "\" as float", e);
            }
        }
    },
    BOOLEAN {
        @Override
        public Object parse(String raw) {
            switch (raw) {
                case "true":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "0":
                    return Boolean.FALSE;
                default:
                    throw new IllegalArgumentException("cannot parse \"" + raw + "\" as boolean");
            }
        }
    },
    /** Opaque value; parsing keeps the raw string. */
    OBJECT {
        @Override
        public Object parse(String raw) {
            return raw;
        }
    };

    /**
     * Converts a raw string to this type.
     *
     * @throws IllegalArgumentException if the string is not a valid value
     */
    public abstract Object parse(String raw);

    /** Null-safe inverse of {@link #parse}. */
    public String dump(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    // Accepts trailing garbage after a valid numeric prefix ("42px" -> 42).
    private static String leadingNumber(String raw, boolean decimal) {
        String s = raw.trim();
        int end = 0;
        if (end < s.length() && (s.charAt(end) == '-' || s.charAt(end) == '+'))
            end++;
        boolean seenDot = false;
        while (end < s.length()) {
            char c = s.charAt(end);
            if (Character.isDigit(c)) {
                end++;
            } else if (decimal && c == '.' && !seenDot) {
                seenDot = true;
                end++;
            } else {
                break;
            }
        }
        return s.substring(0, end);
    }
}
