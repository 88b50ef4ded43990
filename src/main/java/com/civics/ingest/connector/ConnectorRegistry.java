package com.civics.ingest.connector;

import com.civics.ingest.config.ConfigurationException;
import com.civics.ingest.core.model.Provider;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Connectors available to the engine, one per provider.
 */
public class ConnectorRegistry {

    private final Map<Provider, SourceConnector> connectors = new EnumMap<>(Provider.class);
    private final Map<Provider, ProviderSettings> settings = new EnumMap<>(Provider.class);

    public ConnectorRegistry register(SourceConnector connector) {
        connectors.put(connector.provider(), connector);
        return this;
    }

    public ConnectorRegistry register(SourceConnector connector, ProviderSettings providerSettings) {
        if (providerSettings.provider() != connector.provider()) {
            throw new IllegalArgumentException("Settings for " + providerSettings.provider()
                    + " do not match connector " + connector.provider());
        }
        settings.put(connector.provider(), providerSettings);
        return register(connector);
    }

    /**
     * Builds the HTTP connector for each settings entry.
     */
    public static ConnectorRegistry fromSettings(Collection<ProviderSettings> providerSettings) {
        ConnectorRegistry registry = new ConnectorRegistry();
        for (ProviderSettings s : providerSettings) {
            SourceConnector connector = switch (s.provider()) {
                case FEDERAL_ROSTER -> new FederalRosterConnector(s);
                case STATE_LEGISLATURE -> new StateLegislatureConnector(s);
                case CAMPAIGN_FINANCE -> new CampaignFinanceConnector(s);
                case CIVIC_LOOKUP -> new CivicLookupConnector(s);
            };
            registry.register(connector, s);
        }
        return registry;
    }

    public Optional<SourceConnector> find(Provider provider) {
        return Optional.ofNullable(connectors.get(provider));
    }

    public Map<Provider, SourceConnector> all() {
        return Collections.unmodifiableMap(connectors);
    }

    /**
     * Verifies that {@code provider} can be used in a run.
     *
     * @throws ConfigurationException when no connector is registered, the provider is
     *                                disabled, or its settings carry no API key
     */
    public SourceConnector require(Provider provider) {
        SourceConnector connector = connectors.get(provider);
        if (connector == null) {
            throw new ConfigurationException("No connector configured for provider '" + provider.key() + "'");
        }
        ProviderSettings s = settings.get(provider);
        if (s != null) {
            if (!s.enabled()) {
                throw new ConfigurationException("Provider '" + provider.key() + "' is disabled");
            }
            if (!s.hasApiKey()) {
                throw new ConfigurationException("Missing API key for provider '" + provider.key()
                        + "' (civics-ingest.providers." + provider.key() + ".api-key)");
            }
        }
        return connector;
    }
}
