package io.kneo.programmer.resource;

import io.kneo.programmer.model.schedule.ScheduleOutput;
import io.kneo.programmer.service.ProgrammingService;
import io.kneo.programmer.service.exceptions.ChannelNotFoundException;
import io.kneo.programmer.service.exceptions.CompileError;
import io.kneo.programmer.service.exceptions.ValidationError;
import io.kneo.programmer.service.horizon.EpgStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

@Path("/api/schedule")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ScheduleResource {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleResource.class);

    @Inject
    ProgrammingService programmingService;

    @Inject
    EpgStore epgStore;

    @GET
    @Path("/{channel}/{date}")
    public Response getDay(@PathParam("channel") String channel, @PathParam("date") String date) {
        LocalDate day;
        try {
            day = LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Not an ISO date: " + date))
                    .build();
        }
        try {
            ScheduleOutput schedule = epgStore.get(channel, day)
                    .orElseGet(() -> programmingService.compileDay(channel, day));
            return Response.ok(schedule.toMap()).build();
        } catch (ChannelNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", e.getMessage()))
                    .build();
        } catch (ValidationError e) {
            return Response.status(422)
                    .entity(Map.of("error", "validation", "errors", e.getErrors()))
                    .build();
        } catch (CompileError e) {
            LOGGER.warn("Compiling {} for {} failed: {}", channel, day, e.getDeveloperMessage());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("error", e.getMessage()))
                    .build();
        }
    }

    @POST
    @Path("/compile")
    @Consumes({"application/yaml", "application/x-yaml", MediaType.TEXT_PLAIN})
    public Response compile(String definition) {
        if (definition == null || definition.isBlank()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Empty schedule definition"))
                    .build();
        }
        try {
            return Response.ok(programmingService.compileDefinition(definition).toMap()).build();
        } catch (ValidationError e) {
            return Response.status(422)
                    .entity(Map.of("error", "validation", "errors", e.getErrors()))
                    .build();
        } catch (CompileError e) {
            return Response.status(422)
                    .entity(Map.of("error", e.getMessage()))
                    .build();
        } catch (Exception e) {
            LOGGER.error("Unexpected failure compiling posted definition", e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("error", "Internal error"))
                    .build();
        }
    }
}
