package tw.gc.icscore.services;

/**
 * @param contribution factor delta scaled by the factor's current weight, i.e. its approximate pull on the overall score
 */
public record FactorChange(String factor, double previousScore, double currentScore, double delta,
                           double weight, double contribution) {

    public String describe() {
        String label = factor.replace('_', ' ');
        return String.format("%s %s (%+.1f)", label, delta > 0 ? "improved" : "declined", delta);
    }
}
