package org.disasterops.network;

/**
 * Role a location plays in the relief network.
 */
public enum LocationType {
    SUPPLY_CENTER,
    DEMAND_ZONE,
    TRANSIT_NODE
}
