package com.questrail.refraction.protocol;

/**
 * Indicates that a protocol step table is malformed and the engine must not
 * start.
 *
 * This typically reflects:
 * <ul>
 *   <li>A cycle in the successor graph</li>
 *   <li>A non-terminal step without a successor</li>
 *   <li>A successor that names an unknown step</li>
 *   <li>A duplicate step identifier</li>
 * </ul>
 */
public final class ProtocolConfigurationException extends RuntimeException
{
    public ProtocolConfigurationException(String message) {
        super(message);
    }
}
