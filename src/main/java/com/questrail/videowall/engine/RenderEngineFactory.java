package com.questrail.videowall.engine;

import com.questrail.videowall.layout.TileGeometry;

/**
 * Creates one {@link RenderEngine} per worker.
 *
 * <p>Implementations carry their own tuning (see {@link EngineOptions}); the
 * scheduler supplies only what differs per tile.</p>
 */
@FunctionalInterface
public interface RenderEngineFactory
{
    /**
     * @param name     diagnostic name of the owning worker, e.g. {@code slot-3}
     * @param geometry placement of the tile on screen
     * @param url      media source to play
     */
    RenderEngine create(String name, TileGeometry geometry, String url);
}
