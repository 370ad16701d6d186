package com.openforge.gazetranslate.retention;

/** Predicted retention {@code day} days from now, assuming no reinforcement in between. */
public record RetentionForecast(int day, double retention) {}
