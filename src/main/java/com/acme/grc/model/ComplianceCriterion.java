package com.acme.grc.model;

/** A row is compliant when {@code field} equals {@code expected}. */
public record ComplianceCriterion(String field, String expected) {}
