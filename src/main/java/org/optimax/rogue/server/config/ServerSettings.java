package org.optimax.rogue.server.config;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Network and pacing settings of the duel server.
 *
 * @param host         interface to listen on
 * @param port         TCP port to listen on
 * @param tickInterval minimum time between two ticks
 * @param pollInterval pause between two rounds of lobby or match work
 * @param seed         seed of the match's random stream
 */
public record ServerSettings(String host, int port, Duration tickInterval, Duration pollInterval, long seed) {

    public ServerSettings {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be within 0..65535, got " + port);
        }
        if (tickInterval.isNegative() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("intervals must not be negative");
        }
    }

    /**
     * Reads the {@code server} block of an {@code optimax-rogue} config. Without a configured
     * seed the current time is used.
     *
     * @param config the {@code optimax-rogue} block
     */
    public static ServerSettings fromConfig(Config config) {
        Config server = config.getConfig("server");
        return new ServerSettings(
                server.getString("host"),
                server.getInt("port"),
                server.getDuration("tick-interval"),
                server.getDuration("poll-interval"),
                server.hasPath("seed") ? server.getLong("seed") : System.currentTimeMillis());
    }

    public ServerSettings withHost(String newHost) {
        return new ServerSettings(newHost, port, tickInterval, pollInterval, seed);
    }

    public ServerSettings withPort(int newPort) {
        return new ServerSettings(host, newPort, tickInterval, pollInterval, seed);
    }
}
