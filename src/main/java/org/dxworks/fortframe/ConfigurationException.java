package org.dxworks.fortframe;

public class ConfigurationException extends FortframeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
