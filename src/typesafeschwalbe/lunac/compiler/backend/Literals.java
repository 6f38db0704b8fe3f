package typesafeschwalbe.lunac.compiler.backend;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.lunac.compiler.TargetVersion;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

/**
 * Parses numeric and string literals and renders them in their canonical
 * form for a target version.
 */
public final class Literals {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        Literals.class
    );

    private static final BigDecimal INT64_MIN = new BigDecimal(
        BigInteger.ONE.shiftLeft(63).negate()
    );
    private static final BigDecimal INT64_MAX = new BigDecimal(
        BigInteger.ONE.shiftLeft(63).subtract(BigInteger.ONE)
    );
    private static final BigDecimal DOUBLE_INT_LIMIT = new BigDecimal(
        BigInteger.ONE.shiftLeft(53)
    );

    private Literals() {}

    // numbers

    public static AstNode.NumberLiteral parseNumber(String text) {
        String rest = text.trim();
        boolean negative = false;
        if(rest.startsWith("-")) {
            negative = true;
            rest = rest.substring(1);
        }
        int base = 10;
        String lower = rest.toLowerCase();
        if(lower.startsWith("0x")) {
            base = 16;
            rest = rest.substring(2);
        } else if(lower.startsWith("0b")) {
            base = 2;
            rest = rest.substring(2);
        }
        char exponentMarker = base == 10? 'e' : 'p';
        int exponentStart = rest.toLowerCase().indexOf(exponentMarker);
        Optional<Integer> exponent = Optional.empty();
        String mantissa = rest;
        if(exponentStart != -1) {
            String exponentText = rest.substring(exponentStart + 1);
            if(exponentText.startsWith("+")) {
                exponentText = exponentText.substring(1);
            }
            try {
                exponent = Optional.of(Integer.parseInt(exponentText));
            } catch(NumberFormatException e) {
                throw new IllegalArgumentException(
                    "'" + text + "' has an invalid exponent", e
                );
            }
            mantissa = rest.substring(0, exponentStart);
        }
        int dot = mantissa.indexOf('.');
        String integerDigits = dot == -1? mantissa : mantissa.substring(0, dot);
        String fractionalDigits = dot == -1? "" : mantissa.substring(dot + 1);
        if(integerDigits.isEmpty() && fractionalDigits.isEmpty()) {
            throw new IllegalArgumentException(
                "'" + text + "' is not a numeric literal"
            );
        }
        for(char c: (integerDigits + fractionalDigits).toCharArray()) {
            if(Character.digit(c, base) == -1) {
                throw new IllegalArgumentException(
                    "'" + text + "' contains the invalid digit '" + c + "'"
                );
            }
        }
        return new AstNode.NumberLiteral(
            negative, base, integerDigits.toLowerCase(),
            fractionalDigits.toLowerCase(), exponent
        );
    }

    /**
     * The exact value of a literal. Fractions of hexadecimal and binary
     * literals have power-of-two denominators and so always have a finite
     * decimal expansion.
     */
    public static BigDecimal exactValue(AstNode.NumberLiteral literal) {
        int base = literal.base();
        BigInteger digits = new BigInteger(
            (literal.integerDigits() + literal.fractionalDigits()).isEmpty()
                ? "0"
                : literal.integerDigits() + literal.fractionalDigits(),
            base
        );
        int fractionLength = literal.fractionalDigits().length();
        BigDecimal value;
        if(base == 10) {
            value = new BigDecimal(digits, fractionLength);
            if(literal.exponent().isPresent()) {
                value = value.scaleByPowerOfTen(literal.exponent().get());
            }
        } else {
            int bitsPerDigit = base == 16? 4 : 1;
            int binaryExponent = literal.exponent().orElse(0)
                - fractionLength * bitsPerDigit;
            value = new BigDecimal(digits);
            if(binaryExponent >= 0) {
                value = value.multiply(new BigDecimal(
                    BigInteger.ONE.shiftLeft(binaryExponent)
                ));
            } else {
                value = value.divide(new BigDecimal(
                    BigInteger.ONE.shiftLeft(-binaryExponent)
                ));
            }
        }
        return literal.negative()? value.negate() : value;
    }

    public static boolean isIntegral(BigDecimal value) {
        return value.signum() == 0
            || value.stripTrailingZeros().scale() <= 0;
    }

    public static boolean fitsNativeInteger(
        BigDecimal value, TargetVersion version
    ) {
        if(!Literals.isIntegral(value)) { return false; }
        if(version.isAtLeast(TargetVersion.LUA_53)) {
            return value.compareTo(INT64_MIN) >= 0
                && value.compareTo(INT64_MAX) <= 0;
        }
        return value.abs().compareTo(DOUBLE_INT_LIMIT) <= 0;
    }

    public static String renderNumber(
        AstNode.NumberLiteral literal, TargetVersion version
    ) {
        BigDecimal value = Literals.exactValue(literal);
        if(literal.base() == 10 && literal.hasFloatForm()) {
            return Literals.renderDecimalComponents(literal);
        }
        if(Literals.fitsNativeInteger(value, version)) {
            BigInteger integer = value.toBigIntegerExact();
            // the decimal digits of the minimum would lex as a float
            if(integer.equals(BigInteger.valueOf(Long.MIN_VALUE))
                && version.isAtLeast(TargetVersion.LUA_53)) {
                return "0x8000000000000000";
            }
            if(literal.base() == 10) {
                return integer.toString();
            }
            String sign = integer.signum() < 0? "-" : "";
            return sign + "0x" + integer.abs().toString(16);
        }
        LOGGER.debug(
            "Literal {} is not a native integer for Lua {}, rendering it as"
                + " a float",
            value, version
        );
        String rendered = Literals.renderDouble(value.doubleValue());
        if(version.isAtLeast(TargetVersion.LUA_53)
            && Literals.isIntegerText(rendered)) {
            rendered += ".0";
        }
        return rendered;
    }

    private static String renderDecimalComponents(
        AstNode.NumberLiteral literal
    ) {
        StringBuilder out = new StringBuilder();
        if(literal.negative()) {
            out.append("-");
        }
        out.append(
            literal.integerDigits().isEmpty()? "0" : literal.integerDigits()
        );
        if(!literal.fractionalDigits().isEmpty()) {
            out.append(".");
            out.append(literal.fractionalDigits());
        }
        if(literal.exponent().isPresent()) {
            out.append("e");
            out.append(literal.exponent().get());
        }
        return out.toString();
    }

    private static boolean isIntegerText(String text) {
        for(char c: text.toCharArray()) {
            if(c != '-' && !Character.isDigit(c)) { return false; }
        }
        return true;
    }

    /**
     * Renders the shortest decimal text that reads back as the given
     * double, in the style of C's {@code %.<n>g}.
     */
    public static String renderDouble(double value) {
        if(Double.isNaN(value)) {
            return "(0/0)";
        }
        if(Double.isInfinite(value)) {
            return value > 0? "1e999" : "-1e999";
        }
        if(value == 0) {
            return (1 / value) < 0? "-0.0" : "0.0";
        }
        BigDecimal exact = new BigDecimal(value);
        BigDecimal shortest = exact;
        for(int precision = 1; precision <= 17; precision += 1) {
            BigDecimal rounded = exact.round(
                new MathContext(precision, RoundingMode.HALF_EVEN)
            );
            if(rounded.doubleValue() == value) {
                shortest = rounded;
                break;
            }
        }
        shortest = shortest.stripTrailingZeros();
        int precision = shortest.precision();
        int decimalExponent = precision - shortest.scale() - 1;
        String sign = shortest.signum() < 0? "-" : "";
        String digits = shortest.unscaledValue().abs().toString();
        if(decimalExponent < -4 || decimalExponent >= precision) {
            StringBuilder out = new StringBuilder(sign);
            out.append(digits.charAt(0));
            if(digits.length() > 1) {
                out.append(".");
                out.append(digits, 1, digits.length());
            }
            out.append(decimalExponent < 0? "e-" : "e+");
            int magnitude = Math.abs(decimalExponent);
            if(magnitude < 10) {
                out.append("0");
            }
            out.append(magnitude);
            return out.toString();
        }
        return sign + shortest.abs().toPlainString();
    }

    // strings

    /**
     * Decodes a string literal written with single quotes, double quotes
     * or long brackets into its bytes.
     */
    public static AstNode.StringLiteral parseString(String text) {
        if(text.startsWith("[")) {
            return Literals.parseLongString(text);
        }
        char quote = text.charAt(0);
        if((quote != '"' && quote != '\'') || text.length() < 2
            || text.charAt(text.length() - 1) != quote) {
            throw new IllegalArgumentException(
                "'" + text + "' is not a quoted string literal"
            );
        }
        byte[] raw = text.substring(1, text.length() - 1)
            .getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int i = 0;
        while(i < raw.length) {
            byte b = raw[i];
            if(b != '\\') {
                out.write(b);
                i += 1;
                continue;
            }
            if(i + 1 >= raw.length) {
                throw new IllegalArgumentException(
                    "'" + text + "' ends with an incomplete escape"
                );
            }
            char e = (char) raw[i + 1];
            i += 2;
            switch(e) {
                case 'a': out.write(7); break;
                case 'b': out.write(8); break;
                case 'f': out.write(12); break;
                case 'n': out.write(10); break;
                case 'r': out.write(13); break;
                case 't': out.write(9); break;
                case 'v': out.write(11); break;
                case '\\': out.write('\\'); break;
                case '"': out.write('"'); break;
                case '\'': out.write('\''); break;
                case '\n': out.write('\n'); break;
                case 'x': {
                    int value = Integer.parseInt(
                        new String(raw, i, 2, StandardCharsets.US_ASCII), 16
                    );
                    out.write(value);
                    i += 2;
                } break;
                case 'z': {
                    while(i < raw.length && Character.isWhitespace(raw[i])) {
                        i += 1;
                    }
                } break;
                case 'u': {
                    int close = i;
                    while(raw[close] != '}') {
                        close += 1;
                    }
                    int codePoint = Integer.parseInt(
                        new String(
                            raw, i + 1, close - i - 1,
                            StandardCharsets.US_ASCII
                        ),
                        16
                    );
                    byte[] encoded = new String(
                        Character.toChars(codePoint)
                    ).getBytes(StandardCharsets.UTF_8);
                    out.write(encoded, 0, encoded.length);
                    i = close + 1;
                } break;
                default: {
                    if(!Character.isDigit(e)) {
                        throw new IllegalArgumentException(
                            "'" + text + "' contains the invalid escape '\\"
                                + e + "'"
                        );
                    }
                    int value = e - '0';
                    int digitC = 1;
                    while(digitC < 3 && i < raw.length
                        && Character.isDigit(raw[i])) {
                        value = value * 10 + (raw[i] - '0');
                        digitC += 1;
                        i += 1;
                    }
                    if(value > 255) {
                        throw new IllegalArgumentException(
                            "'" + text + "' contains the out of range escape"
                                + " '\\" + value + "'"
                        );
                    }
                    out.write(value);
                }
            }
        }
        return new AstNode.StringLiteral(out.toByteArray());
    }

    private static AstNode.StringLiteral parseLongString(String text) {
        int level = 0;
        while(text.charAt(level + 1) == '=') {
            level += 1;
        }
        String closing = "]" + "=".repeat(level) + "]";
        if(text.charAt(level + 1) != '[' || !text.endsWith(closing)) {
            throw new IllegalArgumentException(
                "'" + text + "' is not a long bracket string"
            );
        }
        String content = text.substring(
            level + 2, text.length() - closing.length()
        );
        if(content.startsWith("\r\n")) {
            content = content.substring(2);
        } else if(content.startsWith("\n")) {
            content = content.substring(1);
        }
        return AstNode.StringLiteral.of(content);
    }

    public static String renderString(byte[] bytes) {
        StringBuilder out = new StringBuilder();
        out.append('"');
        int i = 0;
        while(i < bytes.length) {
            int b = bytes[i] & 0xFF;
            if(b >= 0x80) {
                int length = Literals.utf8SequenceLength(bytes, i);
                if(length == 0) {
                    Literals.appendDecimalEscape(b, out);
                    i += 1;
                } else {
                    out.append(new String(
                        bytes, i, length, StandardCharsets.UTF_8
                    ));
                    i += length;
                }
                continue;
            }
            switch(b) {
                case '"': out.append("\\\""); break;
                case '\\': out.append("\\\\"); break;
                case 7: out.append("\\a"); break;
                case 8: out.append("\\b"); break;
                case 12: out.append("\\f"); break;
                case 10: out.append("\\n"); break;
                case 13: out.append("\\r"); break;
                case 9: out.append("\\t"); break;
                case 11: out.append("\\v"); break;
                default: {
                    if(b < 32 || b == 127) {
                        Literals.appendDecimalEscape(b, out);
                    } else {
                        out.append((char) b);
                    }
                }
            }
            i += 1;
        }
        out.append('"');
        return out.toString();
    }

    private static void appendDecimalEscape(int b, StringBuilder out) {
        out.append('\\');
        String digits = String.valueOf(b);
        out.append("0".repeat(3 - digits.length()));
        out.append(digits);
    }

    /**
     * The length of the well-formed UTF-8 sequence starting at the given
     * offset, or 0 if there is none.
     */
    private static int utf8SequenceLength(byte[] bytes, int offset) {
        int lead = bytes[offset] & 0xFF;
        int length;
        int minimum;
        if(lead >= 0xC2 && lead <= 0xDF) {
            length = 2;
            minimum = 0x80;
        } else if(lead >= 0xE0 && lead <= 0xEF) {
            length = 3;
            minimum = 0x800;
        } else if(lead >= 0xF0 && lead <= 0xF4) {
            length = 4;
            minimum = 0x10000;
        } else {
            return 0;
        }
        if(offset + length > bytes.length) { return 0; }
        int codePoint = lead & (0xFF >> (length + 1));
        for(int i = 1; i < length; i += 1) {
            int continuation = bytes[offset + i] & 0xFF;
            if((continuation & 0xC0) != 0x80) { return 0; }
            codePoint = (codePoint << 6) | (continuation & 0x3F);
        }
        if(codePoint < minimum || codePoint > 0x10FFFF) { return 0; }
        if(codePoint >= 0xD800 && codePoint <= 0xDFFF) { return 0; }
        return length;
    }

}
