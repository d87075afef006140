package org.disasterops.routing.engine;

public enum RouteState {
    ACTIVE,
    BLOCKED
}
