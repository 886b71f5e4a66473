package in.perpscan.domain.signal;

/**
 * How many horizons agree with the chosen side.
 */
public enum AgreementType {
    NONE(0),
    SINGLE(1),
    DOUBLE(2),
    TRIPLE(3);

    private final int count;

    AgreementType(int count) {
        this.count = count;
    }

    public int getCount() {
        return count;
    }

    public boolean isUnanimous() {
        return this == TRIPLE;
    }

    public static AgreementType fromCount(int count) {
        return switch (count) {
            case 0 -> NONE;
            case 1 -> SINGLE;
            case 2 -> DOUBLE;
            case 3 -> TRIPLE;
            default -> count > 3 ? TRIPLE : NONE;
        };
    }
}
