package org.stackfall.replay.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.stackfall.replay.ReplayData;
import org.stackfall.replay.ReplayEvent;
import org.stackfall.replay.ReplayMetadata;
import org.stackfall.runtime.Input;
import org.stackfall.runtime.model.Shape;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a replay:
 * <pre>
 * {
 *   "metadata": { "version": "1.0", "startTimestamp": ..., "boardWidth": 10, ... },
 *   "events": [
 *     { "kind": "PieceSpawn", "shape": "T", "frame": 3 },
 *     { "kind": "PlayerInput", "input": "HARD_DROP", "frame": 3 }
 *   ]
 * }
 * </pre>
 * Shapes and inputs are written by enum name.
 */
public class JsonReplayCodec implements IReplayCodec {

    static final String KIND_PLAYER_INPUT = "PlayerInput";
    static final String KIND_PIECE_SPAWN = "PieceSpawn";

    private final ObjectMapper objectMapper;

    public JsonReplayCodec() {
        this(new ObjectMapper());
    }

    public JsonReplayCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] encode(ReplayData data) throws ReplayCodecException {
        ObjectNode root = objectMapper.createObjectNode();
        ReplayMetadata metadata = data.metadata();
        ObjectNode meta = root.putObject("metadata");
        meta.put("version", metadata.version());
        meta.put("startTimestamp", metadata.startTimestamp());
        meta.put("boardWidth", metadata.boardWidth());
        meta.put("boardHeight", metadata.boardHeight());
        meta.put("firstShape", metadata.firstShape().name());
        meta.put("secondShape", metadata.secondShape().name());
        meta.put("finalScore", metadata.finalScore());
        meta.put("finalLevel", metadata.finalLevel());
        meta.put("finalLines", metadata.finalLines());
        meta.put("durationMs", metadata.durationMs());

        ArrayNode events = root.putArray("events");
        for (ReplayEvent event : data.events()) {
            ObjectNode node = events.addObject();
            if (event instanceof ReplayEvent.PlayerInput playerInput) {
                node.put("kind", KIND_PLAYER_INPUT);
                node.put("input", playerInput.input().name());
            } else if (event instanceof ReplayEvent.PieceSpawn spawn) {
                node.put("kind", KIND_PIECE_SPAWN);
                node.put("shape", spawn.shape().name());
            }
            node.put("frame", event.frameNumber());
        }

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new ReplayCodecException("Failed to encode replay", e);
        }
    }

    @Override
    public ReplayData decode(byte[] bytes) throws ReplayCodecException {
        JsonNode root;
        try {
            root = objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new ReplayCodecException("Malformed replay JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ReplayCodecException("Replay document must be a JSON object");
        }

        JsonNode meta = requireField(root, "metadata", "replay");
        ReplayMetadata metadata = new ReplayMetadata(
                requireText(meta, "version", "metadata"),
                requireLong(meta, "startTimestamp", "metadata"),
                requireInt(meta, "boardWidth", "metadata"),
                requireInt(meta, "boardHeight", "metadata"),
                parseShape(requireText(meta, "firstShape", "metadata")),
                parseShape(requireText(meta, "secondShape", "metadata")),
                requireInt(meta, "finalScore", "metadata"),
                requireInt(meta, "finalLevel", "metadata"),
                requireInt(meta, "finalLines", "metadata"),
                requireLong(meta, "durationMs", "metadata"));
        if (metadata.boardWidth() <= 0 || metadata.boardHeight() <= 0) {
            throw new ReplayCodecException("Board dimensions must be positive, got "
                    + metadata.boardWidth() + "x" + metadata.boardHeight());
        }

        JsonNode eventsNode = requireField(root, "events", "replay");
        if (!eventsNode.isArray()) {
            throw new ReplayCodecException("'events' must be an array");
        }
        List<ReplayEvent> events = new ArrayList<>(eventsNode.size());
        for (int i = 0; i < eventsNode.size(); i++) {
            events.add(decodeEvent(eventsNode.get(i), i));
        }

        try {
            return new ReplayData(metadata, events);
        } catch (IllegalArgumentException e) {
            throw new ReplayCodecException(e.getMessage(), e);
        }
    }

    private ReplayEvent decodeEvent(JsonNode node, int index) throws ReplayCodecException {
        String context = "events[" + index + "]";
        String kind = requireText(node, "kind", context);
        long frame = requireLong(node, "frame", context);
        if (frame < 0) {
            throw new ReplayCodecException(context + ": frame must not be negative, got " + frame);
        }
        return switch (kind) {
            case KIND_PLAYER_INPUT -> new ReplayEvent.PlayerInput(parseInput(requireText(node, "input", context)), frame);
            case KIND_PIECE_SPAWN -> new ReplayEvent.PieceSpawn(parseShape(requireText(node, "shape", context)), frame);
            default -> throw new ReplayCodecException(context + ": unknown event kind '" + kind + "'");
        };
    }

    private static JsonNode requireField(JsonNode node, String field, String context) throws ReplayCodecException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ReplayCodecException(context + ": missing field '" + field + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field, String context) throws ReplayCodecException {
        JsonNode value = requireField(node, field, context);
        if (!value.isTextual()) {
            throw new ReplayCodecException(context + ": field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static long requireLong(JsonNode node, String field, String context) throws ReplayCodecException {
        JsonNode value = requireField(node, field, context);
        if (!value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new ReplayCodecException(context + ": field '" + field + "' must be an integer");
        }
        return value.asLong();
    }

    private static int requireInt(JsonNode node, String field, String context) throws ReplayCodecException {
        JsonNode value = requireField(node, field, context);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ReplayCodecException(context + ": field '" + field + "' must be a 32-bit integer");
        }
        return value.asInt();
    }

    private static Shape parseShape(String name) throws ReplayCodecException {
        try {
            return Shape.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new ReplayCodecException("Unknown shape '" + name + "'", e);
        }
    }

    private static Input parseInput(String name) throws ReplayCodecException {
        try {
            return Input.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new ReplayCodecException("Unknown input '" + name + "'", e);
        }
    }
}
