package org.hexabets.controller;

/** Identification de session minimale : un en-tête, "guest" par défaut. */
public final class Sessions {
    private Sessions() {}

    public static final String HEADER = "X-Session-Id";
    public static final String GUEST = "guest";
}
