package tw.gc.icscore.enums;

public enum PortfolioWeighting {
    EQUAL,
    MARKET_CAP
}
