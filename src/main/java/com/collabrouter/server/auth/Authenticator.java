package com.collabrouter.server.auth;

/**
 * Resolves the credential presented in a connection's handshake to a participant name.
 * Called once per connection attempt, before the router ever sees the connection.
 */
public interface Authenticator {

    String authenticate(String credentialToken) throws AuthenticationException;
}
