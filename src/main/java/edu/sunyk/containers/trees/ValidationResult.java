package edu.sunyk.containers.trees;

/**
 * Outcome of {@link RedBlackTree#validate()}: either valid with the black height
 * of the root, or the first violation found and where it was found.
 */
public final class ValidationResult {
    private final Violation violation;
    private final String location;
    private final int blackHeight;

    private ValidationResult(Violation violation, String location, int blackHeight) {
        this.violation = violation;
        this.location = location;
        this.blackHeight = blackHeight;
    }

    static ValidationResult valid(int blackHeight) {
        return new ValidationResult(null, null, blackHeight);
    }

    static ValidationResult invalid(Violation violation, String location) {
        return new ValidationResult(violation, location, -1);
    }

    public boolean isValid()        { return violation == null; }
    /** The first violation found, or {@code null} when the tree is valid. */
    public Violation violation()    { return violation; }
    /** Black nodes from the root down to a sentinel, root excluded; -1 when invalid. */
    public int blackHeight()        { return blackHeight; }

    @Override
    public String toString() {
        if(isValid())
            return "valid (black height " + blackHeight + ")";
        return violation + " at " + location;
    }
}
