package info.isaksson.erland.typeinspect.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Turns {@code @Default} text into a value of the parameter's declared type.
 *
 * <p>The text is a Java literal: {@code null}, a boolean, an int/long/float/double literal
 * (optionally negated), a char, a string or a text block. Enum-typed parameters take a constant
 * name ({@code RED} or {@code Color.RED}). {@code String} parameters also accept unquoted text,
 * which is taken verbatim.</p>
 */
public final class DefaultValueParser {

    private static final ParserConfiguration CONFIG = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    private DefaultValueParser() {}

    /**
     * @param text       the annotation text
     * @param targetType declared parameter type; {@code null} or {@code Object} keeps the literal's own type
     * @throws IllegalArgumentException if the text is not a supported literal or does not fit the type
     */
    public static Object parse(String text, Class<?> targetType) {
        if (text == null) throw new IllegalArgumentException("default text is null");
        String t = text.trim();

        if (targetType != null && targetType.isEnum()) {
            return t.equals("null") ? nullFor(targetType, text) : enumConstant(targetType, t);
        }
        if (targetType == String.class && !t.startsWith("\"") && !t.equals("null")) {
            return text;
        }
        return coerce(literal(t), targetType, text);
    }

    static Object literal(String text) {
        ParseResult<Expression> result = new JavaParser(CONFIG).parseExpression(text);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new IllegalArgumentException("Not a Java literal: '" + text + "' " + result.getProblems());
        }
        return evaluate(result.getResult().get(), text);
    }

    private static Object evaluate(Expression expr, String text) {
        if (expr instanceof EnclosedExpr) return evaluate(((EnclosedExpr) expr).getInner(), text);
        if (expr instanceof NullLiteralExpr) return null;
        if (expr instanceof BooleanLiteralExpr) return ((BooleanLiteralExpr) expr).getValue();
        if (expr instanceof IntegerLiteralExpr) return integral(((IntegerLiteralExpr) expr).getValue(), false);
        if (expr instanceof LongLiteralExpr) return integral(((LongLiteralExpr) expr).getValue(), true);
        if (expr instanceof DoubleLiteralExpr) return floating(((DoubleLiteralExpr) expr).getValue());
        if (expr instanceof CharLiteralExpr) return ((CharLiteralExpr) expr).asChar();
        if (expr instanceof TextBlockLiteralExpr) return ((TextBlockLiteralExpr) expr).asString();
        if (expr instanceof StringLiteralExpr) return ((StringLiteralExpr) expr).asString();
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            if (unary.getOperator() == UnaryExpr.Operator.PLUS || unary.getOperator() == UnaryExpr.Operator.MINUS) {
                boolean negate = unary.getOperator() == UnaryExpr.Operator.MINUS;
                return signed(unary.getExpression(), negate, text);
            }
        }
        throw new IllegalArgumentException("Unsupported default expression: '" + text + "'");
    }

    private static Object signed(Expression operand, boolean negate, String text) {
        if (operand instanceof IntegerLiteralExpr || operand instanceof LongLiteralExpr) {
            boolean isLong = operand instanceof LongLiteralExpr;
            String digits = isLong ? ((LongLiteralExpr) operand).getValue() : ((IntegerLiteralExpr) operand).getValue();
            BigInteger v = bigInteger(digits);
            if (negate) v = v.negate();
            return narrow(v, isLong, text);
        }
        if (operand instanceof DoubleLiteralExpr) {
            Number n = floating(((DoubleLiteralExpr) operand).getValue());
            if (!negate) return n;
            return n instanceof Float ? (Object) (-n.floatValue()) : (Object) (-n.doubleValue());
        }
        throw new IllegalArgumentException("Unsupported default expression: '" + text + "'");
    }

    private static Object integral(String literal, boolean isLong) {
        return narrow(bigInteger(literal), isLong, literal);
    }

    private static Object narrow(BigInteger v, boolean isLong, String text) {
        if (!isLong && v.bitLength() < 32) return v.intValue();
        if (v.bitLength() < 64) return v.longValue();
        throw new IllegalArgumentException("Integer literal out of range: '" + text + "'");
    }

    private static BigInteger bigInteger(String literal) {
        String s = literal.replace("_", "");
        if (s.endsWith("L") || s.endsWith("l")) s = s.substring(0, s.length() - 1);
        int radix = 10;
        if (s.startsWith("0x") || s.startsWith("0X")) {
            radix = 16;
            s = s.substring(2);
        } else if (s.startsWith("0b") || s.startsWith("0B")) {
            radix = 2;
            s = s.substring(2);
        } else if (s.length() > 1 && s.startsWith("0")) {
            radix = 8;
            s = s.substring(1);
        }
        return new BigInteger(s, radix);
    }

    private static Number floating(String literal) {
        String s = literal.replace("_", "");
        if (s.endsWith("f") || s.endsWith("F")) return Float.valueOf(s);
        return Double.valueOf(s);
    }

    static Object coerce(Object value, Class<?> target, String text) {
        if (target == null || target == Object.class) return value;
        if (value == null) return nullFor(target, text);

        Class<?> boxed = box(target);
        if (value instanceof Number && Number.class.isAssignableFrom(boxed)) {
            return coerceNumber((Number) value, boxed, text);
        }
        if (boxed.isInstance(value)) return value;
        throw mismatch(text, target);
    }

    private static Object coerceNumber(Number n, Class<?> boxed, String text) {
        boolean integral = n instanceof Integer || n instanceof Long;
        if (boxed == Double.class) return n.doubleValue();
        if (boxed == Float.class) return n.floatValue();
        if (!integral) {
            if (boxed.isInstance(n)) return n;
            throw mismatch(text, boxed);
        }
        long v = n.longValue();
        if (boxed == Long.class) return v;
        if (boxed == Integer.class && v == (int) v) return (int) v;
        if (boxed == Short.class && v == (short) v) return (short) v;
        if (boxed == Byte.class && v == (byte) v) return (byte) v;
        if (boxed == BigInteger.class) return BigInteger.valueOf(v);
        if (boxed == BigDecimal.class) return BigDecimal.valueOf(v);
        if (boxed == Number.class) return n;
        throw mismatch(text, boxed);
    }

    private static Object nullFor(Class<?> target, String text) {
        if (target.isPrimitive()) {
            throw new IllegalArgumentException("null default for primitive " + target.getName() + ": '" + text + "'");
        }
        return null;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object enumConstant(Class<?> enumType, String text) {
        String name = text.substring(text.lastIndexOf('.') + 1);
        try {
            return Enum.valueOf((Class<? extends Enum>) enumType, name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("'" + text + "' is not a constant of " + enumType.getSimpleName(), e);
        }
    }

    private static IllegalArgumentException mismatch(String text, Class<?> target) {
        return new IllegalArgumentException("Default '" + text + "' does not fit type " + target.getSimpleName());
    }

    static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        return Void.class;
    }
}
