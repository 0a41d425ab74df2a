/* (C)2026 */
package com.ammann.interaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One-time registration payload announcing a binary sensor for an interaction identity.
 *
 * @param name         display name
 * @param friendlyName display name, duplicated for hubs that read this field
 * @param uniqueId     stable entity id
 * @param stateTopic   topic carrying {@code ON}/{@code OFF} states
 */
public record DiscoveryConfigDTO(
        @JsonProperty("name") String name,
        @JsonProperty("friendly_name") String friendlyName,
        @JsonProperty("unique_id") String uniqueId,
        @JsonProperty("state_topic") String stateTopic) {}
