package sarmad.model.domain;

public enum Decision {
    LEFT("left"),
    RIGHT("right"),
    TRACE_CONVERSATION("trace_conversation");

    private final String label;

    Decision(String label) { this.label = label; }

    public String label() { return label; }
}
