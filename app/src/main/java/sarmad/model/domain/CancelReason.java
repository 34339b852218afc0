package sarmad.model.domain;

import java.util.Locale;

public enum CancelReason {
    NOT_VIOLATION, DELETED, NOT_FOUND;

    public String wire() { return name().toLowerCase(Locale.ROOT); }

    public static CancelReason fromWire(String s) { return valueOf(s.trim().toUpperCase(Locale.ROOT)); }
}
