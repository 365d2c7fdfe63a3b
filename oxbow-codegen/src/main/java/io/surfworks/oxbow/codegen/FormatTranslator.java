package io.surfworks.oxbow.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates printf format strings into Rust {@code format_args!} syntax.
 *
 * Supported conversions: d i u ld lu c s f x X o %%, with the flags '-' and '0',
 * a field width and a precision. A bare {@code %f} keeps C's six decimals, and
 * {@code %u} reinterprets its int argument as unsigned.
 */
final class FormatTranslator {

    /**
     * What an argument must be converted to before it is formatted.
     */
    enum Conversion {
        INTEGER, UNSIGNED, CHARACTER, STRING, FLOAT
    }

    /**
     * A translated format string and the conversions of its arguments, in order.
     */
    record Translation(String format, List<Conversion> conversions) {
        Translation {
            conversions = List.copyOf(conversions);
        }
    }

    private FormatTranslator() {}

    static Translation translate(String format) throws CodegenException {
        StringBuilder out = new StringBuilder();
        List<Conversion> conversions = new ArrayList<>();
        int i = 0;

        while (i < format.length()) {
            char c = format.charAt(i);
            if (c != '%') {
                appendText(out, c);
                i++;
                continue;
            }
            if (i + 1 < format.length() && format.charAt(i + 1) == '%') {
                out.append('%');
                i += 2;
                continue;
            }

            int start = i++;
            boolean leftAlign = false;
            boolean zeroPad = false;
            while (i < format.length() && (format.charAt(i) == '-' || format.charAt(i) == '0')) {
                if (format.charAt(i) == '-') {
                    leftAlign = true;
                } else {
                    zeroPad = true;
                }
                i++;
            }
            String width = digits(format, i);
            i += width.length();
            String precision = null;
            if (i < format.length() && format.charAt(i) == '.') {
                i++;
                precision = digits(format, i);
                i += precision.length();
            }
            while (i < format.length() && (format.charAt(i) == 'l' || format.charAt(i) == 'h')) {
                i++;
            }
            if (i >= format.length()) {
                throw new CodegenException("Incomplete printf conversion: \"" + format.substring(start) + "\"");
            }

            char conv = format.charAt(i++);
            String spec = spec(leftAlign, zeroPad, width, precision);
            switch (conv) {
                case 'd', 'i' -> {
                    out.append('{').append(spec).append('}');
                    conversions.add(Conversion.INTEGER);
                }
                case 'u' -> {
                    out.append('{').append(spec).append('}');
                    conversions.add(Conversion.UNSIGNED);
                }
                case 'x', 'X', 'o' -> {
                    out.append('{').append(spec.isEmpty() ? ":" : spec).append(conv).append('}');
                    conversions.add(Conversion.INTEGER);
                }
                case 'c' -> {
                    out.append('{').append(spec).append('}');
                    conversions.add(Conversion.CHARACTER);
                }
                case 's' -> {
                    out.append('{').append(spec(leftAlign, false, width, precision)).append('}');
                    conversions.add(Conversion.STRING);
                }
                case 'f' -> {
                    String fixed = precision == null ? spec(leftAlign, zeroPad, width, "6") : spec;
                    out.append('{').append(fixed).append('}');
                    conversions.add(Conversion.FLOAT);
                }
                default -> throw new CodegenException(
                        "Unsupported printf conversion: \"" + format.substring(start, i) + "\"");
            }
        }
        return new Translation(out.toString(), conversions);
    }

    private static String spec(boolean leftAlign, boolean zeroPad, String width, String precision) {
        if (width.isEmpty() && precision == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(":");
        if (!width.isEmpty()) {
            if (leftAlign) {
                sb.append('<');
            } else if (zeroPad) {
                sb.append('0');
            } else {
                sb.append('>');
            }
            sb.append(width);
        }
        if (precision != null) {
            sb.append('.').append(precision.isEmpty() ? "0" : precision);
        }
        return sb.toString();
    }

    private static String digits(String format, int from) {
        int end = from;
        while (end < format.length() && Character.isDigit(format.charAt(end))) {
            end++;
        }
        return format.substring(from, end);
    }

    private static void appendText(StringBuilder out, char c) {
        if (c == '{') {
            out.append("{{");
        } else if (c == '}') {
            out.append("}}");
        } else {
            out.append(RustSyntax.escapeString(String.valueOf(c)));
        }
    }
}
