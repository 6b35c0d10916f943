package com.franchiseplatform.negotiation.team;

/**
 * A team or player id that the registry does not know.
 */
public class RosterLookupException extends RuntimeException {

    public RosterLookupException(String kind, String id) {
        super("[" + kind + " " + id + "] not found in team registry");
    }
}
