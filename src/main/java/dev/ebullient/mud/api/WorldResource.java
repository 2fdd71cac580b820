package dev.ebullient.mud.api;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.jboss.resteasy.reactive.RestPath;

import dev.ebullient.mud.WorldModel;
import dev.ebullient.mud.model.RoomView;

/**
 * Read-only view of the running world: who is online and what each room holds.
 */
@ApplicationScoped
@Path("/api/world")
@Produces(MediaType.APPLICATION_JSON)
public class WorldResource {

    @Inject
    WorldModel world;

    @GET
    @Path("/who")
    public List<String> who() {
        return world.who();
    }

    @GET
    @Path("/rooms")
    public List<RoomView> rooms() {
        return world.describeRooms();
    }

    @GET
    @Path("/rooms/{roomId}")
    public RoomView room(@RestPath String roomId) {
        RoomView view = world.describeRoom(roomId);
        if (view == null) {
            throw new NotFoundException("No such room: " + roomId);
        }
        return view;
    }
}
