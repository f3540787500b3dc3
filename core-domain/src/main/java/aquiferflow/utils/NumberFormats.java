package aquiferflow.utils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Formateo y lectura de números en el estilo que esperan los archivos de MODFLOW.
 */
public final class NumberFormats {

    private NumberFormats() {
    }

    /**
     * Formato general con {@code precision} cifras significativas: notación fija cuando el
     * exponente está en {@code [-4, precision)}, científica en otro caso, sin ceros
     * finales. El exponente lleva signo y al menos dos dígitos ({@code -1E+30}).
     */
    public static String general(double value, int precision, boolean upperCase) {
        if (Double.isNaN(value)) {
            return upperCase ? "NAN" : "nan";
        }
        if (Double.isInfinite(value)) {
            String inf = upperCase ? "INF" : "inf";
            return value > 0 ? inf : "-" + inf;
        }
        if (value == 0.0) {
            return 1.0 / value < 0 ? "-0" : "0";
        }
        BigDecimal rounded = new BigDecimal(value).round(new MathContext(precision, RoundingMode.HALF_EVEN));
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent >= -4 && exponent < precision) {
            int decimals = Math.max(precision - 1 - exponent, 0);
            return stripZeros(rounded.setScale(decimals, RoundingMode.HALF_EVEN).toPlainString());
        }
        BigDecimal mantissa = rounded.movePointLeft(exponent).setScale(precision - 1, RoundingMode.HALF_EVEN);
        int absExponent = Math.abs(exponent);
        return stripZeros(mantissa.toPlainString())
                + (upperCase ? "E" : "e")
                + (exponent < 0 ? "-" : "+")
                + (absExponent < 10 ? "0" : "")
                + absExponent;
    }

    /**
     * Formato general justificado a la derecha en {@code width} columnas.
     */
    public static String general(double value, int width, int precision, boolean upperCase) {
        return padLeft(general(value, precision, upperCase), width);
    }

    /**
     * Notación E más corta que reproduce exactamente el valor de 32 bits al leerlo
     * ({@code 1.0E+00}, {@code 3.3333334E-01}).
     */
    public static String exactFloat(float value) {
        if (!Float.isFinite(value)) {
            return Float.toString(value);
        }
        BigDecimal decimal = new BigDecimal(Float.toString(value)).stripTrailingZeros();
        int decimals = Math.max(decimal.precision() - 1, 1);
        return String.format(Locale.ROOT, "%." + decimals + "E", decimal);
    }

    public static String padLeft(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        StringBuilder sb = new StringBuilder(width);
        for (int i = text.length(); i < width; i++) {
            sb.append(' ');
        }
        return sb.append(text).toString();
    }

    /**
     * Lee un real en notación Fortran, aceptando el exponente de doble precisión {@code D}.
     *
     * @throws NumberFormatException si el texto no es un número.
     */
    public static float parseReal(String token) {
        String normalized = token.trim().replace('D', 'E').replace('d', 'e');
        if (normalized.endsWith(".")) {
            normalized = normalized + "0";
        }
        return Float.parseFloat(normalized);
    }

    /**
     * Lee un entero. Se toleran enteros escritos como reales sin parte fraccionaria ({@code 1.}).
     *
     * @throws NumberFormatException si el texto no es un entero.
     */
    public static int parseInteger(String token) {
        String trimmed = token.trim();
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            float asReal = parseReal(trimmed);
            if (asReal != Math.rint(asReal)) {
                throw e;
            }
            return (int) asReal;
        }
    }

    private static String stripZeros(String text) {
        if (text.indexOf('.') < 0) {
            return text;
        }
        int end = text.length();
        while (text.charAt(end - 1) == '0') {
            end--;
        }
        if (text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(0, end);
    }
}
