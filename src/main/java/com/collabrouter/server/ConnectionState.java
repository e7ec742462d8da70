package com.collabrouter.server;

public enum ConnectionState {
    CONNECTING,     // socket accepted, handshake not yet verified
    REGISTERED,     // Register submitted to the router, both loops running
    DRAINING,       // one side has stopped; waiting for the other loop to exit
    CLOSED          // both loops exited and the socket is closed
}
