package com.acme.grc.model;

/** An evidence data source. Its {@code name} doubles as the SQL table name. */
public record EvidenceConfig(String id, String name) {}
