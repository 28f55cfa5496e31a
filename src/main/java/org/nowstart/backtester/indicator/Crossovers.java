package org.nowstart.backtester.indicator;

/**
 * Two-bar crossover tests. Any undefined operand means no crossover.
 */
public final class Crossovers {

    private Crossovers() {
    }

    /**
     * True when {@code a} was strictly below {@code b} on the previous bar and is strictly above it now.
     */
    public static boolean crossedAbove(double previousA, double previousB, double currentA, double currentB) {
        if (!allFinite(previousA, previousB, currentA, currentB)) {
            return false;
        }
        return previousA < previousB && currentA > currentB;
    }

    /**
     * True when {@code a} was strictly above {@code b} on the previous bar and is strictly below it now.
     */
    public static boolean crossedBelow(double previousA, double previousB, double currentA, double currentB) {
        if (!allFinite(previousA, previousB, currentA, currentB)) {
            return false;
        }
        return previousA > previousB && currentA < currentB;
    }

    private static boolean allFinite(double... values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
