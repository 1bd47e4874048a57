package io.kneo.programmer.resource;

import io.kneo.programmer.service.catalog.CatalogService;
import io.kneo.programmer.service.exceptions.AssetNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.LinkedHashMap;
import java.util.Map;

@Path("/api/catalog")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CatalogResource {

    @Inject
    CatalogService catalogService;

    @GET
    @Path("/stats")
    public Response getStats() {
        return Response.ok(catalogService.getResolver().stats()).build();
    }

    @PUT
    @Path("/assets/{id}/loudness")
    public Response updateLoudness(@PathParam("id") String id, @QueryParam("gainDb") Double gainDb) {
        if (gainDb == null || gainDb.isNaN() || gainDb.isInfinite()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "gainDb query parameter is required"))
                    .build();
        }
        try {
            catalogService.updateLoudness(id, gainDb);
            return Response.noContent().build();
        } catch (AssetNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", e.getMessage()))
                    .build();
        }
    }

    @GET
    @Path("/assets/{id}/loudness")
    public Response getLoudness(@PathParam("id") String id) {
        try {
            double gain = catalogService.getResolver().lookup(id).loudnessGainDb();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("asset_id", id);
            body.put("loudness_gain_db", gain);
            body.put("needs_measurement", catalogService.needsLoudnessMeasurement(id));
            return Response.ok(body).build();
        } catch (AssetNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", e.getMessage()))
                    .build();
        }
    }
}
