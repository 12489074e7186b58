package com.fun.compute.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import com.fun.compute.api.model.ServerActionType;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a JSON or XML request body into one JSON-shaped tree, so that validation never has to know
 * which encoding the client used.
 * <p>
 * The XML decoder only extracts what it recognizes and omits absent attributes; it does not
 * default or check anything. A document whose root is not the expected element yields an empty
 * tree and the missing entity is reported when the validator reads it.
 */
@Component
public class ServerRequestNormalizer {

    private static final List<String> SERVER_ATTRIBUTES = List.of(
            "name", "imageRef", "flavorRef", "adminPass", "accessIPv4", "accessIPv6",
            "key_name", "user_data", "availability_zone", "config_drive", "blob",
            "reservation_id", "return_reservation_id", "min_count", "max_count"
    );
    private static final List<String> UPDATE_ATTRIBUTES = List.of("name", "accessIPv4", "accessIPv6");

    private final ObjectMapper objectMapper;
    private final XMLInputFactory xmlInputFactory;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ServerRequestNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.xmlInputFactory = new XmlFactory().getXMLInputFactory();
        this.xmlInputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        this.xmlInputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    public ObjectNode normalizeCreate(String body, MediaType contentType) {
        if (!isXml(contentType)) {
            return readJson(body);
        }
        ObjectNode result = nodes.objectNode();
        XmlElement root = readXml(body);
        if (root != null && "server".equals(root.name)) {
            result.set("server", extractServer(root));
        }
        return result;
    }

    public ObjectNode normalizeUpdate(String body, MediaType contentType) {
        if (!isXml(contentType)) {
            return readJson(body);
        }
        ObjectNode result = nodes.objectNode();
        XmlElement root = readXml(body);
        if (root != null && "server".equals(root.name)) {
            ObjectNode server = nodes.objectNode();
            for (String attribute : UPDATE_ATTRIBUTES) {
                if (root.hasAttribute(attribute)) {
                    server.put(attribute, root.attribute(attribute));
                }
            }
            putAutoDiskConfig(root, server);
            result.set("server", server);
        }
        return result;
    }

    public ObjectNode normalizeAction(String body, MediaType contentType) {
        if (!isXml(contentType)) {
            return readJson(body);
        }
        ObjectNode result = nodes.objectNode();
        XmlElement root = readXml(body);
        if (root == null) {
            return result;
        }
        JsonNode entity = ServerActionType.fromKey(root.name)
                .map(type -> extractAction(type, root))
                .orElseGet(() -> toGenericNode(root));
        result.set(root.name, entity);
        return result;
    }

    public boolean isXml(MediaType contentType) {
        if (contentType == null) {
            return false;
        }
        return MediaType.APPLICATION_XML.isCompatibleWith(contentType)
                || MediaType.TEXT_XML.isCompatibleWith(contentType)
                || (contentType.getSubtype() != null && contentType.getSubtype().endsWith("+xml"));
    }

    private ObjectNode readJson(String body) {
        if (!StringUtils.hasText(body)) {
            return nodes.objectNode();
        }
        JsonNode tree;
        try {
            tree = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw malformedBody();
        }
        if (tree == null || tree.isMissingNode()) {
            return nodes.objectNode();
        }
        if (!tree.isObject()) {
            throw malformedBody();
        }
        return (ObjectNode) tree;
    }

    private XmlElement readXml(String body) {
        if (!StringUtils.hasText(body)) {
            return null;
        }
        try {
            XMLStreamReader reader = xmlInputFactory.createXMLStreamReader(new StringReader(body));
            Deque<XmlElement> open = new ArrayDeque<>();
            XmlElement root = null;
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    XmlElement element = new XmlElement(reader.getLocalName());
                    for (int i = 0; i < reader.getAttributeCount(); i++) {
                        element.attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
                    }
                    if (open.isEmpty()) {
                        root = element;
                    } else {
                        open.peek().children.add(element);
                    }
                    open.push(element);
                } else if (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA) {
                    if (!open.isEmpty()) {
                        open.peek().text.append(reader.getText());
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT) {
                    open.pop();
                }
            }
            reader.close();
            return root;
        } catch (XMLStreamException ex) {
            throw malformedBody();
        }
    }

    private ObjectNode extractServer(XmlElement node) {
        ObjectNode server = nodes.objectNode();
        for (String attribute : SERVER_ATTRIBUTES) {
            String value = node.attribute(attribute);
            if (StringUtils.hasLength(value)) {
                server.put(attribute, value);
            }
        }
        putMetadata(node, server);
        putPersonality(node, server);

        XmlElement networksNode = node.firstChild("networks");
        if (networksNode != null) {
            ArrayNode networks = server.putArray("networks");
            for (XmlElement networkNode : networksNode.children("network")) {
                ObjectNode network = networks.addObject();
                if (networkNode.hasAttribute("uuid")) {
                    network.put("uuid", networkNode.attribute("uuid"));
                }
                if (networkNode.hasAttribute("fixed_ip")) {
                    network.put("fixed_ip", networkNode.attribute("fixed_ip"));
                }
            }
        }

        XmlElement groupsNode = node.firstChild("security_groups");
        if (groupsNode != null) {
            ArrayNode groups = server.putArray("security_groups");
            for (XmlElement groupNode : groupsNode.children("security_group")) {
                XmlElement nameNode = groupNode.firstChild("name");
                if (nameNode != null) {
                    groups.addObject().put("name", nameNode.text());
                }
            }
        }

        putAutoDiskConfig(node, server);
        return server;
    }

    private JsonNode extractAction(ServerActionType type, XmlElement node) {
        return switch (type) {
            case CREATE_IMAGE -> extractImageAction(node, List.of("name"));
            case CREATE_BACKUP -> extractImageAction(node, List.of("name", "backup_type", "rotation"));
            case CHANGE_PASSWORD -> copyAttributes(node, List.of("adminPass"));
            case REBOOT -> copyAttributes(node, List.of("type"));
            case RESIZE -> copyAttributes(node, List.of("flavorRef"));
            case CONFIRM_RESIZE, REVERT_RESIZE -> nodes.nullNode();
            case REBUILD -> {
                ObjectNode rebuild = copyAttributes(node, List.of("name", "imageRef", "adminPass"));
                putMetadata(node, rebuild);
                putPersonality(node, rebuild);
                yield rebuild;
            }
        };
    }

    private ObjectNode extractImageAction(XmlElement node, List<String> attributes) {
        ObjectNode data = nodes.objectNode();
        for (String attribute : attributes) {
            String value = node.attribute(attribute);
            if (StringUtils.hasLength(value)) {
                data.put(attribute, value);
            }
        }
        putMetadata(node, data);
        return data;
    }

    private ObjectNode copyAttributes(XmlElement node, List<String> attributes) {
        ObjectNode data = nodes.objectNode();
        for (String attribute : attributes) {
            if (node.hasAttribute(attribute)) {
                data.put(attribute, node.attribute(attribute));
            }
        }
        return data;
    }

    private void putMetadata(XmlElement node, ObjectNode target) {
        XmlElement metadataNode = node.firstChild("metadata");
        if (metadataNode == null) {
            return;
        }
        ObjectNode metadata = target.putObject("metadata");
        for (XmlElement meta : metadataNode.children("meta")) {
            String key = meta.attribute("key");
            if (key != null) {
                metadata.put(key, meta.text());
            }
        }
    }

    private void putPersonality(XmlElement node, ObjectNode target) {
        XmlElement personalityNode = node.firstChild("personality");
        if (personalityNode == null) {
            return;
        }
        ArrayNode personality = target.putArray("personality");
        for (XmlElement fileNode : personalityNode.children("file")) {
            ObjectNode item = personality.addObject();
            if (fileNode.hasAttribute("path")) {
                item.put("path", fileNode.attribute("path"));
            }
            item.put("contents", fileNode.text());
        }
    }

    private void putAutoDiskConfig(XmlElement node, ObjectNode target) {
        String value = node.attribute("auto_disk_config");
        if (StringUtils.hasLength(value)) {
            target.put("auto_disk_config", ServerRequestValidator.boolFromString(value));
        }
    }

    private JsonNode toGenericNode(XmlElement element) {
        if (element.attributes.isEmpty() && element.children.isEmpty()) {
            return nodes.textNode(element.text());
        }
        ObjectNode object = nodes.objectNode();
        element.attributes.forEach(object::put);
        for (XmlElement child : element.children) {
            JsonNode value = toGenericNode(child);
            JsonNode existing = object.get(child.name);
            if (existing == null) {
                object.set(child.name, value);
            } else if (existing.isArray()) {
                ((ArrayNode) existing).add(value);
            } else {
                ArrayNode many = nodes.arrayNode();
                many.add(existing);
                many.add(value);
                object.set(child.name, many);
            }
        }
        return object;
    }

    private ResponseStatusException malformedBody() {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    private static final class XmlElement {
        private final String name;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<XmlElement> children = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private XmlElement(String name) {
            this.name = name;
        }

        private boolean hasAttribute(String attribute) {
            return attributes.containsKey(attribute);
        }

        private String attribute(String attribute) {
            return attributes.get(attribute);
        }

        private String text() {
            return text.toString();
        }

        private XmlElement firstChild(String childName) {
            for (XmlElement child : children) {
                if (child.name.equals(childName)) {
                    return child;
                }
            }
            return null;
        }

        private List<XmlElement> children(String childName) {
            return children.stream()
                    .filter(child -> child.name.equals(childName))
                    .toList();
        }
    }
}
