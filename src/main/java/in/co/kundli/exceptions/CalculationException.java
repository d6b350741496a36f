package in.co.kundli.exceptions;

/**
 * A body/time computation failed inside the numerical provider.
 * Never converted into a placeholder position by this core.
 */
public class CalculationException extends KundliException {

    private final String body;
    private final double julianDay;
    private final String providerMessage;

    public CalculationException(String body, double julianDay, String providerMessage) {
        super("Failed to calculate " + body + " at JD " + julianDay + ": " + providerMessage);
        this.body = body;
        this.julianDay = julianDay;
        this.providerMessage = providerMessage;
    }

    public String getBody() {
        return body;
    }

    public double getJulianDay() {
        return julianDay;
    }

    public String getProviderMessage() {
        return providerMessage;
    }
}
