package tw.gc.icscore.enums;

public enum ConfidenceLevel {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low"),
    /** Terminal state: the record carries no displayable overall score. */
    INSUFFICIENT("Insufficient");

    private final String displayName;

    ConfidenceLevel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isDisplayable() {
        return this != INSUFFICIENT;
    }

    /**
     * One step down, never below LOW. Used when inputs were ranked against thin sector samples.
     */
    public ConfidenceLevel downgrade() {
        return switch (this) {
            case HIGH -> MEDIUM;
            case MEDIUM, LOW -> LOW;
            case INSUFFICIENT -> INSUFFICIENT;
        };
    }
}
