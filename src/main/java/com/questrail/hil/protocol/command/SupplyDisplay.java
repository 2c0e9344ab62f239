package com.questrail.hil.protocol.command;

import com.questrail.hil.protocol.ProtocolViolationException;

/**
 * Front-panel reading of the supply.
 *
 * <p>Wire form is {@code VVVVCCCCS}: voltage in hundredths of a volt, current in
 * hundredths of an amp and a status digit ({@code 0} constant voltage,
 * {@code 1} constant current). Characters past the ninth are ignored.</p>
 */
public record SupplyDisplay(double voltage, double current, int status)
{
    public static final int STATUS_CV = 0;
    public static final int STATUS_CC = 1;

    static final int PAYLOAD_LENGTH = 9;

    public enum Mode { CV, CC }

    public Mode mode()
    {
        return status == STATUS_CV ? Mode.CV : Mode.CC;
    }

    /**
     * {@code "V,I,CV"} or {@code "V,I,CC"}.
     */
    public String displayText()
    {
        return voltage + "," + current + "," + mode();
    }

    public static SupplyDisplay parse(String payload)
    {
        if (payload == null || payload.length() < PAYLOAD_LENGTH) {
            throw new ProtocolViolationException("Failed to obtain a voltage. Display payload was: " + payload);
        }
        try {
            int centivolts = Integer.parseInt(payload.substring(0, 4));
            int centiamps = Integer.parseInt(payload.substring(4, 8));
            int status = Integer.parseInt(payload.substring(8, 9));
            return new SupplyDisplay(centivolts / 100.0, centiamps / 100.0, status);
        } catch (NumberFormatException e) {
            throw new ProtocolViolationException("Display payload is not numeric: " + payload, e);
        }
    }
}
