package io.stpp.parser.impl;

/**
 * A token of a condition expression.
 *
 * @param type the token type
 * @param tag the tag name for {@link Type#TAG}, empty otherwise
 */
public record ExprToken(Type type, String tag) {

    public enum Type {
        TAG("Tag"),
        PAREN_OPEN("("),
        PAREN_CLOSE(")"),
        AND("&&"),
        OR("||"),
        XOR("^"),
        NOT("!"),
        EOS("EOS");

        private final String display;

        Type(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static final ExprToken EOS = new ExprToken(Type.EOS, "");

    public static ExprToken tag(String name) {
        return new ExprToken(Type.TAG, name);
    }

    public static ExprToken of(Type type) {
        return new ExprToken(type, "");
    }

    @Override
    public String toString() {
        return type == Type.TAG ? "Tag(" + tag + ")" : type.display();
    }
}
