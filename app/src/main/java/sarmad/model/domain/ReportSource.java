package sarmad.model.domain;

import java.util.Locale;

/** Who filed the report: the public, or the automated keyword monitor. */
public enum ReportSource {
    PUBLIC, AUTO_MONITOR;

    public String wire() { return name().toLowerCase(Locale.ROOT); }

    public static ReportSource fromWire(String s) { return valueOf(s.trim().toUpperCase(Locale.ROOT)); }
}
