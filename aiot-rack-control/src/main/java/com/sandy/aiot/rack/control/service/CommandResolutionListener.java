package com.sandy.aiot.rack.control.service;

import com.sandy.aiot.rack.control.model.CommandResult;

/**
 * Observer of every terminal command resolution, called after the result sink and outside
 * the dispatcher lock.
 */
public interface CommandResolutionListener {
    void onResolved(CommandResult result);
}
