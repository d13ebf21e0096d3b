package xyz.vvrf.reactor.exec.compute;

public enum SortOrder {
    ASCENDING("ASC"),
    DESCENDING("DESC");

    private final String shortName;

    SortOrder(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }
}
