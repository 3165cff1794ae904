package com.sandy.aiot.rack.control.service;

public class RackNotFoundException extends RuntimeException {

    public RackNotFoundException(String rackId) {
        super("Rack not found: " + rackId);
    }
}
