package io.feydor.inspo.midi;

/**
 * How the track scanner steps over system-exclusive (0xF0, 0xF7) and system common/real-time (0xF1-0xFE) events
 */
public enum SysexHandling {
    /**
     * Skip SysEx payloads using their VarLen length, and give system common messages their standard data length.
     * Keeps the scanner aligned on files that contain such messages.
     */
    SKIP_PAYLOAD,

    /**
     * Treat every such status as having no data bytes. The bytes that follow are then read as the next delta-time,
     * which misaligns the rest of the track. Only useful to compare against output of older tooling.
     */
    LEGACY
}
