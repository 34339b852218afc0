package sarmad.model.domain;

public record ReportStatistics(int total, int pending, int active, int resolved, int cancelled,
                               int fromPublic, int fromAuto) {}
