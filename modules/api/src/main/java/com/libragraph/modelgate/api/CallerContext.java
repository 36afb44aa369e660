package com.libragraph.modelgate.api;

import com.libragraph.modelgate.core.auth.Caller;
import jakarta.enterprise.context.RequestScoped;

/** Caller resolved by {@link PermissionFilter} for the current request. */
@RequestScoped
public class CallerContext {

    private Caller caller = Caller.ANONYMOUS;

    public Caller caller() {
        return caller;
    }

    void set(Caller caller) {
        this.caller = caller;
    }
}
