package com.knotcore.model.enums;

/**
 * How a hint was captured.
 */
public enum HintSource {
    TEXT_INPUT, VOICE_TRANSCRIPTION
}
