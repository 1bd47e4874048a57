package io.kneo.programmer.resource;

import io.kneo.programmer.service.horizon.ExecutionWindowStore;
import io.kneo.programmer.service.horizon.HorizonManager;
import io.kneo.programmer.service.horizon.HorizonRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Map;
import java.util.Optional;

@Path("/api/horizon")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class HorizonResource {

    @Inject
    HorizonRegistry horizonRegistry;

    @GET
    @Path("/{channel}/health")
    public Response getHealth(@PathParam("channel") String channel) {
        Optional<HorizonManager> manager = horizonRegistry.getManager(channel);
        if (manager.isEmpty()) {
            return notFound(channel);
        }
        return Response.ok(manager.get().getHealthReport()).build();
    }

    @GET
    @Path("/{channel}/attempts")
    public Response getAttempts(@PathParam("channel") String channel) {
        Optional<HorizonManager> manager = horizonRegistry.getManager(channel);
        if (manager.isEmpty()) {
            return notFound(channel);
        }
        return Response.ok(manager.get().getAttempts()).build();
    }

    @GET
    @Path("/{channel}/entries")
    public Response getEntries(@PathParam("channel") String channel, @QueryParam("from") Long fromUtcMs) {
        Optional<ExecutionWindowStore> store = horizonRegistry.getStore(channel);
        if (store.isEmpty()) {
            return notFound(channel);
        }
        if (fromUtcMs == null) {
            return Response.ok(store.get().entries()).build();
        }
        return store.get().nextEntry(fromUtcMs)
                .map(entry -> Response.ok(entry).build())
                .orElseGet(() -> Response.noContent().build());
    }

    private static Response notFound(String channel) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(Map.of("error", "No horizon for channel " + channel))
                .build();
    }
}
