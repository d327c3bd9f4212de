package io.dapprunner.gaom;

/**
 * One named field of a {@link GaomObject}. Runtime-only fields are hidden from static lookups.
 */
public record GaomField(String name, Object value, boolean runtimeOnly) {
    public static GaomField of(String name, Object value) {
        return new GaomField(name, value, false);
    }

    public static GaomField runtime(String name, Object value) {
        return new GaomField(name, value, true);
    }
}
