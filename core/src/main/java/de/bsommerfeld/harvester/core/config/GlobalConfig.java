package de.bsommerfeld.harvester.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to one table in the file.
 */
public class GlobalConfig {

    @JsonProperty("client")
    private ClientConfig client = new ClientConfig();

    @JsonProperty("harvest")
    private HarvestConfig harvest = new HarvestConfig();

    @JsonProperty("endpoints")
    private EndpointConfig endpoints = new EndpointConfig();

    public ClientConfig getClient() {
        return client;
    }

    public HarvestConfig getHarvest() {
        return harvest;
    }

    public EndpointConfig getEndpoints() {
        return endpoints;
    }
}
