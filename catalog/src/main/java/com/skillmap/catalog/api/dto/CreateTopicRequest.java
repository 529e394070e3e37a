package com.skillmap.catalog.api.dto;

/**
 * Request body for POST /topics.
 *
 * Required: name
 * Optional: description, parentTopicID (id of an existing topic)
 */
public record CreateTopicRequest(String name, String description, String parentTopicID) {}
