package com.fun.compute.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fun.compute.api.config.ComputeProperties;
import com.fun.compute.api.model.CreateCommand;
import com.fun.compute.api.model.InjectedFile;
import com.fun.compute.api.model.RequestContext;
import com.fun.compute.api.model.RequestedNetwork;
import com.fun.compute.api.model.SearchOptions;
import com.fun.compute.api.model.UpdateCommand;
import com.fun.compute.api.model.VmState;
import org.apache.commons.validator.routines.InetAddressValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field and cross-field checks on normalized request bodies.
 * <p>
 * Checks run in a fixed order and the first violation is thrown as a 400; errors are never
 * accumulated. Quota limits (metadata items, personality file count and size) are left to the
 * compute service.
 */
@Component
public class ServerRequestValidator {

    private static final Logger log = LoggerFactory.getLogger(ServerRequestValidator.class);

    public static final Set<String> USER_SEARCH_OPTIONS = Set.of(
            "reservation_id", "name", "local_zone_only", "status", "image", "flavor", "changes-since");
    public static final String DEFAULT_SECURITY_GROUP = "default";

    private static final Pattern UUID_LIKE =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // Time and offset are optional; a missing offset means UTC.
    private static final DateTimeFormatter ISO_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private final ComputeProperties computeProperties;
    private final PasswordGenerator passwordGenerator;

    public ServerRequestValidator(ComputeProperties computeProperties, PasswordGenerator passwordGenerator) {
        this.computeProperties = computeProperties;
        this.passwordGenerator = passwordGenerator;
    }

    public CreateCommand validateCreate(RequestContext context, ObjectNode body) {
        JsonNode server = requireServerEntity(body);
        String keyName = scalarText(server.get("key_name"));
        String password = createPassword(server.get("adminPass"));

        if (!server.has("name")) {
            throw badRequest("Server name is not defined");
        }
        String name = validateName(server.get("name"));

        String imageRef = scalarText(server.get("imageRef"));
        if (imageRef == null) {
            throw badRequest("Missing imageRef attribute");
        }
        if (StringUtils.hasText(context.applicationUrl()) && imageRef.startsWith(context.applicationUrl())) {
            imageRef = imageRef.substring(imageRef.lastIndexOf('/') + 1);
        }

        List<InjectedFile> injectedFiles = injectedFiles(server.get("personality"));
        Set<String> securityGroups = securityGroupNames(server.get("security_groups"));
        List<RequestedNetwork> networks = requestedNetworks(server.get("networks"));

        String flavorRef = scalarText(server.get("flavorRef"));
        if (flavorRef == null) {
            throw badRequest("Missing flavorRef attribute");
        }
        String flavorId = flavorIdFromHref(flavorRef);
        if (flavorId == null) {
            throw badRequest("Invalid flavorRef provided.");
        }

        String userData = scalarText(server.get("user_data"));
        if (StringUtils.hasLength(userData) && !isBase64(userData)) {
            throw badRequest("Userdata content cannot be decoded");
        }

        String reservationId = scalarText(server.get("reservation_id"));
        if (!StringUtils.hasLength(reservationId) || !context.admin()) {
            reservationId = null;
        }

        int minCount = parseCount(server.get("min_count"), "min_count", 1);
        int maxCount = parseCount(server.get("max_count"), "max_count", minCount);
        if (minCount > maxCount) {
            minCount = maxCount;
        }

        return new CreateCommand(
                name,
                imageRef,
                flavorId,
                password,
                keyName,
                metadata(server.get("metadata")),
                scalarText(server.get("accessIPv4")),
                scalarText(server.get("accessIPv6")),
                injectedFiles,
                securityGroups,
                networks,
                userData,
                scalarText(server.get("availability_zone")),
                present(server.get("config_drive")) ? server.get("config_drive") : null,
                blockDeviceMapping(server),
                scalarText(server.get("blob")),
                reservationId,
                Boolean.TRUE.equals(booleanFlag(server.get("return_reservation_id"))),
                minCount,
                maxCount,
                booleanFlag(server.get("auto_disk_config"))
        );
    }

    public UpdateCommand validateUpdate(ObjectNode body) {
        JsonNode server = requireServerEntity(body);
        String displayName = server.has("name") ? validateName(server.get("name")) : null;
        String accessIpV4 = server.has("accessIPv4") ? trimmedAddress(server.get("accessIPv4"), "accessIPv4") : null;
        String accessIpV6 = server.has("accessIPv6") ? trimmedAddress(server.get("accessIPv6"), "accessIPv6") : null;
        Boolean autoDiskConfig = booleanFlag(server.get("auto_disk_config"));
        return new UpdateCommand(displayName, accessIpV4, accessIpV6, autoDiskConfig);
    }

    public SearchOptions validateSearchOptions(RequestContext context, Map<String, String> query) {
        Map<String, Object> options = new LinkedHashMap<>(query);
        if (!(computeProperties.isAllowAdminApi() && context.admin())) {
            List<String> unknown = new ArrayList<>();
            for (Iterator<String> keys = options.keySet().iterator(); keys.hasNext(); ) {
                String key = keys.next();
                if (!USER_SEARCH_OPTIONS.contains(key)) {
                    unknown.add(key);
                    keys.remove();
                }
            }
            if (!unknown.isEmpty()) {
                log.debug("Removing options '{}' from query", String.join(", ", unknown));
            }
        }

        Object localZoneOnly = options.get("local_zone_only");
        options.put("local_zone_only", localZoneOnly != null && boolFromString(localZoneOnly.toString()));

        if (options.containsKey("status")) {
            String status = String.valueOf(options.get("status"));
            VmState state = VmState.fromStatus(status)
                    .orElseThrow(() -> badRequest("Invalid server status: " + status));
            options.put("vm_state", state);
        }

        if (options.containsKey("changes-since")) {
            try {
                options.put("changes-since", parseIsoTime(String.valueOf(options.get("changes-since"))));
            } catch (DateTimeParseException ex) {
                throw badRequest("Invalid changes-since value");
            }
        }

        if (!options.containsKey("deleted") && !options.containsKey("changes-since")) {
            options.put("deleted", false);
        }
        return new SearchOptions(options);
    }

    public String validateName(JsonNode value) {
        if (value == null || !value.isTextual()) {
            throw badRequest("Server name is not a string or unicode");
        }
        String name = value.asText().trim();
        if (name.isEmpty()) {
            throw badRequest("Server name is an empty string");
        }
        return name;
    }

    /**
     * Decodes personality entries into files, keeping request order.
     */
    public List<InjectedFile> injectedFiles(JsonNode personality) {
        if (!present(personality) || (personality.isArray() && personality.isEmpty())) {
            return List.of();
        }
        if (!personality.isArray()) {
            throw badRequest("Bad personality format");
        }
        List<InjectedFile> files = new ArrayList<>();
        for (JsonNode item : personality) {
            if (!item.isObject()) {
                throw badRequest("Bad personality format");
            }
            for (String field : List.of("path", "contents")) {
                if (!item.has(field)) {
                    throw badRequest("Bad personality format: missing '" + field + "'");
                }
            }
            String path = item.get("path").asText();
            JsonNode contents = item.get("contents");
            byte[] decoded = contents.isTextual() ? decodeBase64(contents.asText()) : null;
            if (decoded == null) {
                throw badRequest("Personality content for " + path + " cannot be decoded");
            }
            files.add(new InjectedFile(path, decoded));
        }
        return files;
    }

    public Map<String, String> metadata(JsonNode metadata) {
        return keyValuePairs(metadata, "Unable to parse metadata key/value pairs.");
    }

    /**
     * Caller metadata for snapshot and backup images.
     */
    public Map<String, String> imageMetadata(JsonNode metadata) {
        return keyValuePairs(metadata, "Invalid metadata");
    }

    /**
     * Last path segment of a flavor href, or the value itself when it is already a bare id.
     *
     * @return the flavor id, or {@code null} when nothing usable is left
     */
    public String flavorIdFromHref(String flavorRef) {
        try {
            List<String> segments = UriComponentsBuilder.fromUriString(flavorRef.trim()).build().getPathSegments();
            if (segments.isEmpty()) {
                return null;
            }
            String id = segments.get(segments.size() - 1);
            return StringUtils.hasText(id) ? id : null;
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    /**
     * Lenient boolean parsing: integers are true when non-zero, anything else only when it
     * reads {@code true}.
     */
    public static boolean boolFromString(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        try {
            return Integer.parseInt(trimmed) != 0;
        } catch (NumberFormatException ex) {
            return "true".equalsIgnoreCase(trimmed);
        }
    }

    static Instant parseIsoTime(String value) {
        TemporalAccessor parsed = ISO_TIME.parseBest(value.trim(),
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (parsed instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * Hook for deployments that accept block device mappings on create.
     */
    protected JsonNode blockDeviceMapping(JsonNode server) {
        return null;
    }

    private Map<String, String> keyValuePairs(JsonNode metadata, String failure) {
        if (!present(metadata)) {
            return Map.of();
        }
        if (!metadata.isObject()) {
            log.debug(failure);
            throw badRequest(failure);
        }
        Map<String, String> items = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> fields = metadata.fields(); fields.hasNext(); ) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isValueNode() || field.getValue().isNull()) {
                log.debug(failure);
                throw badRequest(failure);
            }
            items.put(field.getKey(), field.getValue().asText());
        }
        return items;
    }

    private JsonNode requireServerEntity(ObjectNode body) {
        if (body == null || body.isEmpty() || !body.has("server")) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "Unable to process the contained instructions");
        }
        JsonNode server = body.get("server");
        if (!server.isObject()) {
            throw badRequest("Malformed server entity");
        }
        return server;
    }

    private String createPassword(JsonNode adminPass) {
        if (!present(adminPass)) {
            return passwordGenerator.generate();
        }
        if (!adminPass.isTextual() || adminPass.asText().isEmpty()) {
            throw badRequest("Invalid adminPass");
        }
        return adminPass.asText();
    }

    private Set<String> securityGroupNames(JsonNode securityGroups) {
        Set<String> names = new LinkedHashSet<>();
        if (present(securityGroups)) {
            if (!securityGroups.isArray()) {
                throw badRequest("Bad security_groups format");
            }
            for (JsonNode group : securityGroups) {
                if (!group.isObject()) {
                    throw badRequest("Bad security_groups format");
                }
                String name = scalarText(group.get("name"));
                if (StringUtils.hasLength(name)) {
                    names.add(name);
                }
            }
        }
        if (names.isEmpty()) {
            names.add(DEFAULT_SECURITY_GROUP);
        }
        return names;
    }

    private List<RequestedNetwork> requestedNetworks(JsonNode requested) {
        if (!present(requested)) {
            return List.of();
        }
        if (!requested.isArray()) {
            throw badRequest("Bad networks format");
        }
        List<RequestedNetwork> networks = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode network : requested) {
            if (!network.isObject()) {
                throw badRequest("Bad networks format");
            }
            if (!network.has("uuid")) {
                throw badRequest("Bad network format: missing 'uuid'");
            }
            JsonNode uuidNode = network.get("uuid");
            String uuid = uuidNode.asText();
            if (!uuidNode.isTextual() || !UUID_LIKE.matcher(uuid).matches()) {
                throw badRequest("Bad networks format: network uuid is not in proper format (" + uuid + ")");
            }

            JsonNode fixedIpNode = network.get("fixed_ip");
            String fixedIp = null;
            if (present(fixedIpNode)) {
                fixedIp = fixedIpNode.asText();
                if (!fixedIpNode.isTextual() || !InetAddressValidator.getInstance().isValidInet4Address(fixedIp)) {
                    throw badRequest("Invalid fixed IP address (" + fixedIp + ")");
                }
            }

            if (!seen.add(uuid)) {
                throw badRequest("Duplicate networks (" + uuid + ") are not allowed");
            }
            networks.add(new RequestedNetwork(uuid, fixedIp));
        }
        return networks;
    }

    private int parseCount(JsonNode value, String field, int defaultValue) {
        if (!present(value) || (value.isTextual() && !StringUtils.hasText(value.asText()))) {
            return defaultValue;
        }
        int count;
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            count = value.asInt();
        } else if (value.isTextual()) {
            try {
                count = Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException ex) {
                throw badRequest(field + " must be an integer");
            }
        } else {
            throw badRequest(field + " must be an integer");
        }
        if (count < 1) {
            throw badRequest(field + " must be greater than zero");
        }
        return count;
    }

    private Boolean booleanFlag(JsonNode value) {
        if (!present(value)) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return boolFromString(value.asText());
    }

    private String trimmedAddress(JsonNode value, String field) {
        if (value == null || !value.isTextual()) {
            throw badRequest("Invalid " + field);
        }
        return value.asText().trim();
    }

    private boolean isBase64(String value) {
        return decodeBase64(value) != null;
    }

    private byte[] decodeBase64(String value) {
        try {
            return Base64.getDecoder().decode(WHITESPACE.matcher(value).replaceAll(""));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    static boolean present(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    static String scalarText(JsonNode node) {
        if (!present(node) || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }

    static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }
}
