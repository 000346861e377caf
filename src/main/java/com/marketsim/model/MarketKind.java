package com.marketsim.model;

public enum MarketKind {
    POSTAL_CODE("postal_code"),
    LOCATION("location");

    private final String label;

    MarketKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MarketKind fromLabel(String label) {
        for (var kind : values()) {
            if (kind.label.equalsIgnoreCase(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown market type: " + label);
    }
}
