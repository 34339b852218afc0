package sarmad.model.service.search;

import sarmad.model.domain.Decision;
import sarmad.model.domain.SearchProgress;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public final class SearchLogFormatter {
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);

    private SearchLogFormatter() {}

    public static String format(SearchProgress p) {
        if (p.decision() == Decision.TRACE_CONVERSATION) {
            return "[iteration " + p.iteration() + "] traced conversation root at " + HH_MM.format(p.low())
                    + " | thread posts: " + p.countInRange();
        }
        String direction = p.decision() == Decision.LEFT ? "<- narrowing left" : "-> narrowing right";
        return "[iteration " + p.iteration() + "] "
                + "window: " + HH_MM.format(p.low()) + " - " + HH_MM.format(p.high())
                + " | mid: " + HH_MM.format(p.mid())
                + " | posts: " + p.countInRange()
                + " | " + direction;
    }
}
