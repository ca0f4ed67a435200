package com.warpmap.models;

public enum TransitionKind {
    WARP("warp"),
    OVERWORLD("overworld");

    private final String label;

    TransitionKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static TransitionKind fromLabel(String label) {
        for (TransitionKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        return null;
    }
}
