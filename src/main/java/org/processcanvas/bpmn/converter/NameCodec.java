package org.processcanvas.bpmn.converter;

/**
 * Line breaks in name attributes travel as the two-character escape {@code \n}.
 */
public final class NameCodec {
    private static final String ESCAPE = "\\n";

    private NameCodec() {
    }

    public static String decode(String name) {
        return name == null ? null : name.replace(ESCAPE, "\n");
    }

    public static String encode(String name) {
        return name == null ? null : name.replace("\r\n", "\n").replace("\n", ESCAPE);
    }
}
