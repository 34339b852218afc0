package sarmad.model.domain;

import java.util.Locale;

public enum ReportStatus {
    PENDING, ACTIVE, RESOLVED, CANCELLED;

    public String wire() { return name().toLowerCase(Locale.ROOT); }

    public static ReportStatus fromWire(String s) { return valueOf(s.trim().toUpperCase(Locale.ROOT)); }
}
