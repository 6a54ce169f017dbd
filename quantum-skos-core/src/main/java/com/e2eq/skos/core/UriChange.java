package com.e2eq.skos.core;

/**
 * Classification of the difference between a raw identifier token and its canonical form.
 */
public record UriChange(Kind kind, String message) {

    public enum Kind {
        /** The source identifier was malformed and had to be repaired. */
        FIX,
        /** Cosmetic difference only; logged but not counted as a defect. */
        NORMALIZATION,
        /** No effective change for the cleaned document. */
        NONE
    }

    public static UriChange none() {
        return new UriChange(Kind.NONE, "");
    }

    public static UriChange fix(String message) {
        return new UriChange(Kind.FIX, message);
    }

    public static UriChange normalization(String message) {
        return new UriChange(Kind.NORMALIZATION, message);
    }

    public boolean isFix() {
        return kind == Kind.FIX;
    }

    public boolean isLogged() {
        return kind != Kind.NONE;
    }
}
