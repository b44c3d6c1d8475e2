package com.ethixai.drift.model;

/**
 * Operating mode of a drift cycle. Streaming cycles look at a short, small window;
 * batch cycles look at a long window with a larger sample cap.
 */
public enum WindowMode {
    STREAMING,
    BATCH
}
