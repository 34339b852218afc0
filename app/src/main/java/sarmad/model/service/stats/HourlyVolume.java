package sarmad.model.service.stats;

/** Posts created during one UTC hour of the day, 0 to 23. */
public record HourlyVolume(int hour, int count) {}
