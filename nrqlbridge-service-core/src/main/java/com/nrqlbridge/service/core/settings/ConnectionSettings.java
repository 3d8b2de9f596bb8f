package com.nrqlbridge.service.core.settings;

import java.util.Map;

/** Credentials used to reach NRDB. The API key is never included in {@link #toString()}. */
public record ConnectionSettings(String apiKey, long accountId) {

    public static final String API_KEY_SECRET = "apiKey";
    public static final String ACCOUNT_ID_SECRET = "accountID";

    /**
     * Reads the datasource secret map. Missing entries become blank/zero and are left for {@link
     * SettingsValidator} to reject; a non-numeric account id is rejected here.
     */
    public static ConnectionSettings fromSecrets(Map<String, String> secrets) {
        if (secrets == null) {
            throw new InvalidSettingsException("Secure settings are missing");
        }
        String apiKey = secrets.getOrDefault(API_KEY_SECRET, "");
        String rawAccount = secrets.get(ACCOUNT_ID_SECRET);
        long accountId = 0L;
        if (rawAccount != null && !rawAccount.isBlank()) {
            try {
                accountId = Long.parseLong(rawAccount.trim());
            } catch (NumberFormatException ex) {
                throw new InvalidSettingsException("Account ID is not a number: " + rawAccount, ex);
            }
        }
        return new ConnectionSettings(apiKey, accountId);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ConnectionSettings[apiKey=" + (hasApiKey() ? "****" : "<none>") + ", accountId=" + accountId + "]";
    }
}
