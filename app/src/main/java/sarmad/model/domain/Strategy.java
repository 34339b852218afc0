package sarmad.model.domain;

/** Which evidence produced a {@link SearchResult}. */
public enum Strategy {
    TRACE_CONVERSATION,
    TEMPORAL_BISECTION,
    NONE
}
