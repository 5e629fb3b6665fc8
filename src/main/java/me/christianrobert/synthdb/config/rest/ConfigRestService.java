package me.christianrobert.synthdb.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.synthdb.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads and edits the generator configuration. Values are validated before anything is
 * stored; the source password is never returned.
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    private static final String MASK = "***";

    private static final Set<String> POSITIVE_INTEGER_KEYS = Set.of(
            ConfigService.ROWS_PER_TABLE, ConfigService.SOURCE_SAMPLE_LIMIT);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        Map<String, Object> config = configService.getAllConfiguration();
        config.computeIfPresent(ConfigService.SOURCE_PASSWORD, (key, value) -> MASK);
        return Response.ok(config).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        Optional<String> problem = config.entrySet().stream()
                .map(entry -> validate(entry.getKey(), entry.getValue()))
                .filter(Objects::nonNull)
                .findFirst();
        if (problem.isPresent()) {
            log.warn("Rejected configuration: {}", problem.get());
            return reply(Response.Status.BAD_REQUEST, "error", problem.get());
        }

        configService.updateConfiguration(config);
        return reply(Response.Status.OK, "success", "Configuration saved");
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        Object value = configService.getConfigValue(key);
        if (value == null) {
            return reply(Response.Status.NOT_FOUND, "error", "Configuration key not found: " + key);
        }
        return Response.ok(Map.of("key", key, "value", ConfigService.SOURCE_PASSWORD.equals(key) ? MASK : value))
                .build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        if (body == null || !body.containsKey("value")) {
            return reply(Response.Status.BAD_REQUEST, "error", "Request body must contain 'value' field");
        }
        Object value = body.get("value");
        String problem = validate(key, value);
        if (problem != null) {
            return reply(Response.Status.BAD_REQUEST, "error", problem);
        }

        configService.setConfigValue(key, value);
        return reply(Response.Status.OK, "success", key + " updated");
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        configService.resetToDefaults();
        return reply(Response.Status.OK, "success", "Configuration reset to defaults");
    }

    /**
     * @return a message describing why the value is not acceptable for the key, or null
     */
    static String validate(String key, Object value) {
        if (value == null) {
            return "Configuration value for " + key + " must not be null";
        }
        String text = value.toString().trim();
        if (POSITIVE_INTEGER_KEYS.contains(key)) {
            Long number = value instanceof Number ? Long.valueOf(((Number) value).longValue()) : parseLong(text);
            if (number == null) {
                return key + " must be a positive integer, got '" + value + "'";
            }
            if (number < 1 || number > Integer.MAX_VALUE) {
                return key + " must be a positive integer";
            }
        }
        if (ConfigService.SEED.equals(key) && !text.isEmpty() && parseLong(text) == null) {
            return key + " must be a number or empty, got '" + value + "'";
        }
        return null;
    }

    private static Long parseLong(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Response reply(Response.Status status, String outcome, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", outcome);
        body.put("message", message);
        return Response.status(status).entity(body).build();
    }
}
