package org.disasterops.network;

import lombok.Value;

/**
 * Bulk-initialization record for one directed road.
 *
 * <p>When no travel time is given it defaults to the distance driven at
 * {@link #DEFAULT_SPEED_KMH}.</p>
 */
@Value
public class Connection {
    public static final double DEFAULT_SPEED_KMH = 50.0d;

    String from;
    String to;
    double distance;
    Double time;

    public static Connection of(String from, String to, double distance) {
        return new Connection(from, to, distance, null);
    }

    public static Connection of(String from, String to, double distance, double time) {
        return new Connection(from, to, distance, time);
    }

    public double travelTime() {
        return time != null ? time : distance / DEFAULT_SPEED_KMH;
    }
}
