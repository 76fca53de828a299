package com.questrail.videowall.power;

/**
 * {@link DisplayPower} for displays without power management. Every call is a
 * no-op.
 */
public enum UnsupportedDisplayPower implements DisplayPower {
    INSTANCE;

    @Override
    public boolean isSupported() {
        return false;
    }

    @Override
    public void configure() {}

    @Override
    public void forceOn() {}

    @Override
    public void forceOff() {}
}
