package com.questrail.hil.protocol.command;

import com.questrail.hil.protocol.UnknownCommandException;

/**
 * Single-character command tokens accepted by {@link Series1900BPowerSupply}.
 */
public enum PowerSupplyCommand
{
    TURN_ON("1", Series1900BPowerSupply.COMMAND_TURN_ON),
    TURN_OFF("0", Series1900BPowerSupply.COMMAND_TURN_OFF),
    /** A burst of carriage returns; the supply does not acknowledge it. */
    RESET("r", Series1900BPowerSupply.RESET_PULSE),
    READ_DISPLAY("?", Series1900BPowerSupply.COMMAND_GET_DISPLAY);

    private final String token;
    private final String wireText;

    PowerSupplyCommand(String token, String wireText)
    {
        this.token = token;
        this.wireText = wireText;
    }

    public String token()
    {
        return token;
    }

    /**
     * What is written to the supply, before the line terminator.
     */
    public String wireText()
    {
        return wireText;
    }

    public static PowerSupplyCommand fromToken(String token)
    {
        for (PowerSupplyCommand command : values()) {
            if (command.token.equals(token)) {
                return command;
            }
        }
        throw new UnknownCommandException("command " + token + " is not a valid Series1900B command.");
    }
}
