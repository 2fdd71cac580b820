package dev.ebullient.mud;

import java.io.IOException;
import java.io.InputStream;

import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.mud.model.WorldDefinition;

/**
 * Reads the world definition from a classpath YAML resource and provides the
 * single {@link WorldModel} built from it.
 */
@Singleton
public class WorldLoader {
    private static final Logger log = Logger.getLogger(WorldLoader.class);

    @ConfigProperty(name = "mud.world.resource", defaultValue = "world/san-antonio.yaml")
    String worldResource;

    private final ObjectMapper jsonMapper;
    private final Yaml yaml;

    public WorldLoader() {
        jsonMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        yaml = new Yaml(new LoaderOptions());
    }

    @Produces
    @Singleton
    WorldModel worldModel() {
        WorldModel world = new WorldModel(loadWorld());
        log.infof("World loaded from %s (start room: %s)", worldResource, world.startRoomId());
        return world;
    }

    public WorldDefinition loadWorld() {
        return loadWorld(worldResource);
    }

    /**
     * @throws IllegalStateException if the resource is missing or cannot be parsed;
     *         the server cannot run without a world
     */
    public WorldDefinition loadWorld(String resource) {
        try (InputStream is = Thread.currentThread().getContextClassLoader()
                .getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found on classpath");
            }
            WorldDefinition definition = loadYaml(is, WorldDefinition.class);
            if (definition == null) {
                throw new IllegalStateException(resource + " is empty");
            }
            log.debugf("Read %d rooms, %d NPCs and %d items from %s",
                    definition.rooms().size(), definition.npcs().size(), definition.items().size(), resource);
            return definition;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        } catch (YAMLException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid world definition in " + resource + ": " + e.getMessage(), e);
        }
    }

    private <T> T loadYaml(InputStream is, Class<T> type) {
        Object raw = yaml.load(is);
        return raw == null ? null : jsonMapper.convertValue(raw, type);
    }
}
