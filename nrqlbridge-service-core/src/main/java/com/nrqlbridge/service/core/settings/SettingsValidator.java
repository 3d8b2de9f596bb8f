package com.nrqlbridge.service.core.settings;

public final class SettingsValidator {

    private SettingsValidator() {}

    public static ConnectionSettings validate(ConnectionSettings settings) {
        if (settings == null) {
            throw new InvalidSettingsException("Connection settings are missing");
        }
        if (!settings.hasApiKey()) {
            throw new InvalidSettingsException("API key is required");
        }
        if (settings.accountId() <= 0) {
            throw new InvalidSettingsException("Account ID must be a positive number, got " + settings.accountId());
        }
        return settings;
    }
}
