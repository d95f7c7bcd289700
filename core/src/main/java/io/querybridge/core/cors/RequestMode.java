package io.querybridge.core.cors;

/** How a request reaches a remote API. */
public enum RequestMode {
    /** Plain request; the remote allows cross-origin calls or CORS handling is off. */
    DIRECT,
    /** GET rewritten with a callback parameter; the body comes back wrapped in that callback. */
    JSONP,
    /** Relayed through a proxy endpoint that performs the call on our behalf. */
    PROXY
}
