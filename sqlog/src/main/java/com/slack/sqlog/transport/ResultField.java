package com.slack.sqlog.transport;

/** One column of one result row, as reported by the analytics backend. */
public record ResultField(String field, String value) {}
