package io.cleaned.core.spi;

/**
 * Implemented by enums whose constants stand for an underlying primitive value, e.g. a
 * one-letter code or a numeric id. Enum validators accept that value in addition to the
 * constant name, and cleaned records serialize the constant back to it.
 *
 * <pre>{@code
 * enum Size implements EnumValue {
 *     SMALL("S"), LARGE("L");
 *
 *     private final String code;
 *
 *     Size(String code) {
 *         this.code = code;
 *     }
 *
 *     public Object value() {
 *         return code;
 *     }
 * }
 * }</pre>
 */
public interface EnumValue {

    /** The primitive value this constant stands for. Must be unique within the enum. */
    Object value();
}
