package com.example.siteengine.config;

/**
 * Network binding the serving layer listens on.
 */
public record Server(
        String bind,
        int port
) {
    public static final String DEFAULT_BIND = "0.0.0.0";
    public static final int DEFAULT_PORT = 9090;

    public Server {
        if (bind == null) {
            throw new IllegalArgumentException("Server requires a bind address.");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Server port must be between 0 and 65535, got " + port);
        }
    }

    public static Server defaults() {
        return new Server(DEFAULT_BIND, DEFAULT_PORT);
    }

    /**
     * Returns the {@code bind:port} address string.
     */
    public String address() {
        return bind + ":" + port;
    }
}
