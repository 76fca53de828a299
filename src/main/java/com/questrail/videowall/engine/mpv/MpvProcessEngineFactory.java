package com.questrail.videowall.engine.mpv;

import com.questrail.videowall.engine.EngineOptions;
import com.questrail.videowall.engine.RenderEngine;
import com.questrail.videowall.engine.RenderEngineFactory;
import com.questrail.videowall.layout.TileGeometry;

import java.util.Objects;

/**
 * Creates {@link MpvProcessEngine}s sharing one executable and one set of
 * {@link EngineOptions}.
 */
public final class MpvProcessEngineFactory implements RenderEngineFactory
{
    public static final String DEFAULT_EXECUTABLE = "mpv";

    private final String executable;
    private final EngineOptions options;

    public MpvProcessEngineFactory(EngineOptions options)
    {
        this(DEFAULT_EXECUTABLE, options);
    }

    public MpvProcessEngineFactory(String executable, EngineOptions options)
    {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public RenderEngine create(String name, TileGeometry geometry, String url)
    {
        return new MpvProcessEngine(executable, name, geometry, url, options);
    }
}
