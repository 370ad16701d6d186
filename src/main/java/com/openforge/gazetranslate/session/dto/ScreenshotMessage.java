package com.openforge.gazetranslate.session.dto;

/**
 * Inbound STOMP body for {@code /app/sessions/{id}/screenshot}.
 *
 * @param image      base64 image, optionally as a {@code data:} URL
 * @param sourceLang optional override of the session's source language
 * @param targetLang optional override of the session's target language
 */
public record ScreenshotMessage(String image, String sourceLang, String targetLang) {}
