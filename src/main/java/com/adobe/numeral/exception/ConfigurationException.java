package com.adobe.numeral.exception;

/**
 * Thrown when the requested options cannot express the given input.
 *
 * <p>Typical causes:</p>
 * <ul>
 *   <li>Negative number without the {@code signed} option</li>
 *   <li>Zero or a large magnitude without the {@code extended} option</li>
 *   <li>Apostrophus rendering for a magnitude that has no dedicated symbol</li>
 *   <li>A sign symbol that collides with the token alphabet</li>
 * </ul>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
public class ConfigurationException extends NumeralException {

    public ConfigurationException(String message) {
        super(message);
    }
}
