package com.libragraph.datasink.api;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/** Liveness probe kept for clients of the original service. */
@Path("/heartbeat")
public class HeartbeatResource {

    @GET
    @Produces(MediaType.TEXT_PLAIN)
    public String heartbeat() {
        return "Datasink app up and running";
    }
}
