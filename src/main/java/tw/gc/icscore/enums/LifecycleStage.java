package tw.gc.icscore.enums;

/**
 * Business-lifecycle stage used to reweight scoring factors.
 *
 * <p>Declining businesses are classified as {@link #TURNAROUND}: both share one
 * weight table (financial health and recovery signals up, growth down).
 */
public enum LifecycleStage {
    /** Revenue growth above 50% YoY, often pre-profit */
    HYPERGROWTH("Hypergrowth", "Focus on growth trajectory over current profitability"),
    /** Revenue growth between 20% and 50% YoY */
    GROWTH("Growth", "Balancing expansion with emerging profitability"),
    /** Stable operations and consistent profitability */
    MATURE("Mature", "Focus on profitability, cash flow and capital efficiency"),
    /** Low P/E with solid margins: the mature-value profile */
    VALUE("Value", "Focus on intrinsic value and dividend potential"),
    /** Revenue shrinking more than 5% YoY, including structurally declining companies */
    TURNAROUND("Turnaround", "Focus on financial health and recovery signals");

    private final String displayName;
    private final String description;

    LifecycleStage(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
