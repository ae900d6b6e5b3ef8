package org.carball.qengine.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
