package com.chatmesh.ice;

import java.util.List;

/**
 * Supplies the traversal endpoints handed to every new transport.
 */
@FunctionalInterface
public interface IceConfigurationProvider {

    List<IceServer> getIceServers();
}
